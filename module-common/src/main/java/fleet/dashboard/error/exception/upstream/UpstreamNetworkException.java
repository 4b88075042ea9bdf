package fleet.dashboard.error.exception.upstream;

import fleet.dashboard.error.CommonErrorCode;
import fleet.dashboard.error.exception.marker.CircuitBreakerRecordMarker;

/** 연결 실패, 연결 리셋, 시도 타임아웃 */
public class UpstreamNetworkException extends UpstreamApiException
    implements CircuitBreakerRecordMarker {

  public UpstreamNetworkException(String path, Throwable cause) {
    super(CommonErrorCode.UPSTREAM_NETWORK_ERROR, UpstreamErrorKind.NETWORK, 0, path, cause);
  }

  public UpstreamNetworkException(String path) {
    super(CommonErrorCode.UPSTREAM_NETWORK_ERROR, UpstreamErrorKind.NETWORK, 0, path);
  }
}
