package fleet.dashboard.error.exception.upstream;

import fleet.dashboard.error.CommonErrorCode;
import fleet.dashboard.error.exception.marker.CircuitBreakerIgnoreMarker;

public class UpstreamRateLimitException extends UpstreamApiException
    implements CircuitBreakerIgnoreMarker {

  public UpstreamRateLimitException(int status, String path) {
    super(CommonErrorCode.UPSTREAM_RATE_LIMITED, UpstreamErrorKind.RATE_LIMIT, status, path);
  }
}
