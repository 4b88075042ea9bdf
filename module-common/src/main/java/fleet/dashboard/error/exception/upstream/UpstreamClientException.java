package fleet.dashboard.error.exception.upstream;

import fleet.dashboard.error.CommonErrorCode;
import fleet.dashboard.error.exception.marker.CircuitBreakerIgnoreMarker;

/** 인증/한도 이외의 4xx 응답 (예: 404 존재하지 않는 컨테이너) */
public class UpstreamClientException extends UpstreamApiException
    implements CircuitBreakerIgnoreMarker {

  public UpstreamClientException(int status, String path) {
    super(CommonErrorCode.UPSTREAM_REQUEST_REJECTED, UpstreamErrorKind.UNKNOWN, status, path);
  }
}
