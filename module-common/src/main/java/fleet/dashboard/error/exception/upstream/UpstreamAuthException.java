package fleet.dashboard.error.exception.upstream;

import fleet.dashboard.error.CommonErrorCode;
import fleet.dashboard.error.exception.marker.CircuitBreakerIgnoreMarker;

/** API 키가 잘못되었거나 권한이 없는 경우. 재시도하지 않습니다. */
public class UpstreamAuthException extends UpstreamApiException
    implements CircuitBreakerIgnoreMarker {

  public UpstreamAuthException(int status, String path) {
    super(CommonErrorCode.UPSTREAM_AUTH_FAILED, UpstreamErrorKind.AUTH, status, path);
  }
}
