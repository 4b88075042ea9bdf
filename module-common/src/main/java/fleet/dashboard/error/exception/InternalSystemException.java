package fleet.dashboard.error.exception;

import fleet.dashboard.error.CommonErrorCode;
import fleet.dashboard.error.exception.base.ServerBaseException;

/**
 * LogicExecutor 전용 시스템 예외
 *
 * <p>LogicExecutor에서 처리하지 못한 관리되지 않은 예외를 프로젝트 규격에 맞게 래핑합니다. taskName으로 에러 발생 지점을 추적할 수 있습니다.
 */
public class InternalSystemException extends ServerBaseException {

  /**
   * @param taskName 작업 이름 (예: "SharedCache:get:containers:3")
   * @param cause 원본 예외
   */
  public InternalSystemException(String taskName, Throwable cause) {
    super(CommonErrorCode.INTERNAL_SERVER_ERROR, cause, taskName);
  }

  public InternalSystemException(String taskName) {
    super(CommonErrorCode.INTERNAL_SERVER_ERROR, taskName);
  }
}
