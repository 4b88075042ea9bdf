package fleet.dashboard.error.exception.upstream;

import fleet.dashboard.error.CommonErrorCode;
import fleet.dashboard.error.exception.marker.CircuitBreakerRecordMarker;

public class UpstreamServerException extends UpstreamApiException
    implements CircuitBreakerRecordMarker {

  public UpstreamServerException(int status, String path) {
    super(CommonErrorCode.UPSTREAM_SERVER_ERROR, UpstreamErrorKind.SERVER, status, path);
  }
}
