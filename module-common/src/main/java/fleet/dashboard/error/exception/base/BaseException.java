package fleet.dashboard.error.exception.base;

import fleet.dashboard.error.ErrorCode;
import lombok.Getter;

/**
 * 프로젝트 예외 계층의 최상위 타입
 *
 * <p>{@link ErrorCode}의 메시지 포맷에 동적 인자를 채워 최종 메시지를 만듭니다. 전역 핸들러는 이 타입만 보고 상태 코드와 응답 본문을 결정합니다.
 */
@Getter
public abstract class BaseException extends RuntimeException {
  private final transient ErrorCode errorCode;

  // 기본 생성자
  protected BaseException(ErrorCode errorCode) {
    super(errorCode.getMessage());
    this.errorCode = errorCode;
  }

  // 동적 인자를 받는 생성자 (String.format 활용)
  protected BaseException(ErrorCode errorCode, Object... args) {
    super(String.format(errorCode.getMessage(), args));
    this.errorCode = errorCode;
  }

  protected BaseException(ErrorCode errorCode, Throwable cause) {
    super(errorCode.getMessage(), cause);
    this.errorCode = errorCode;
  }

  protected BaseException(ErrorCode errorCode, Throwable cause, Object... args) {
    super(String.format(errorCode.getMessage(), args), cause);
    this.errorCode = errorCode;
  }
}
