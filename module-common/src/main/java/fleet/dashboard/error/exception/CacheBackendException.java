package fleet.dashboard.error.exception;

import fleet.dashboard.error.CommonErrorCode;
import fleet.dashboard.error.exception.base.ServerBaseException;

/** 공유 캐시 백엔드(Redis) 연결/명령 실패. 캐시 어댑터 내부에서만 발생하고 항상 흡수됩니다. */
public class CacheBackendException extends ServerBaseException {

  public CacheBackendException(String operation, Throwable cause) {
    super(CommonErrorCode.CACHE_BACKEND_ERROR, cause, operation);
  }

  public CacheBackendException(String operation) {
    super(CommonErrorCode.CACHE_BACKEND_ERROR, operation);
  }
}
