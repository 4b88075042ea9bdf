package fleet.dashboard.error.exception;

import fleet.dashboard.error.CommonErrorCode;
import fleet.dashboard.error.exception.base.ServerBaseException;

/** 캐시 로더(fetcher)가 Checked Exception을 던진 경우의 래퍼. 원본은 cause로 보존합니다. */
public class CacheLoadException extends ServerBaseException {

  public CacheLoadException(String key, Throwable cause) {
    super(CommonErrorCode.CACHE_LOAD_FAILED, cause, key);
  }
}
