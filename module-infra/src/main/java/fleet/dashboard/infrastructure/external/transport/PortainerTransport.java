package fleet.dashboard.infrastructure.external.transport;

import fleet.dashboard.error.exception.upstream.UpstreamApiException;
import fleet.dashboard.infrastructure.external.UpstreamRequest;

/**
 * 단일 HTTP 시도 (재시도/브레이커/동시성 제한 없음)
 *
 * <p>모든 실패는 분류된 {@link UpstreamApiException}으로 던집니다. 비정상 상태 코드는 {@link
 * UpstreamApiException#fromStatus}, 연결 오류와 시도별 타임아웃은 NETWORK 입니다.
 */
public interface PortainerTransport {

  /**
   * @return 응답 본문 (본문이 없으면 빈 배열)
   */
  byte[] exchange(UpstreamRequest request);
}
