package fleet.dashboard.error.exception.base;

import fleet.dashboard.error.ErrorCode;

/**
 * ServerBaseException: 업스트림 장애나 시스템 내부 오류로 발생하는 5xx 계열 예외. 장애 회고를 위한 상세 로그를 남기는 것이 주 목적입니다.
 */
public abstract class ServerBaseException extends BaseException {

  protected ServerBaseException(ErrorCode errorCode) {
    super(errorCode);
  }

  protected ServerBaseException(ErrorCode errorCode, Object... args) {
    super(errorCode, args);
  }

  // 실제 에러(cause)를 포함하여 디버깅 정보 확보
  protected ServerBaseException(ErrorCode errorCode, Throwable cause) {
    super(errorCode, cause);
  }

  protected ServerBaseException(ErrorCode errorCode, Throwable cause, Object... args) {
    super(errorCode, cause, args);
  }
}
