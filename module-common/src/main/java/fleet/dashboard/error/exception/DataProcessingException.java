package fleet.dashboard.error.exception;

import fleet.dashboard.error.CommonErrorCode;
import fleet.dashboard.error.exception.base.ServerBaseException;

/** 업스트림 응답 본문 역직렬화/가공 실패 */
public class DataProcessingException extends ServerBaseException {

  public DataProcessingException(String target, Throwable cause) {
    super(CommonErrorCode.DATA_PROCESSING_ERROR, cause, target);
  }
}
