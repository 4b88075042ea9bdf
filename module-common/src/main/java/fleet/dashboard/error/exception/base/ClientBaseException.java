package fleet.dashboard.error.exception.base;

import fleet.dashboard.error.ErrorCode;

/**
 * ClientBaseException: 호출자의 요청 자체가 문제인 4xx 계열 예외. 재시도해도 결과가 바뀌지 않으므로 구체적인 실패 원인을 그대로 전달하는 것이
 * 목적입니다.
 */
public abstract class ClientBaseException extends BaseException {

  protected ClientBaseException(ErrorCode errorCode) {
    super(errorCode);
  }

  // "업스트림 인증 실패 (status: %s, path: %s)"와 같은 메시지 완성용
  protected ClientBaseException(ErrorCode errorCode, Object... args) {
    super(errorCode, args);
  }

  protected ClientBaseException(ErrorCode errorCode, Throwable cause, Object... args) {
    super(errorCode, cause, args);
  }
}
