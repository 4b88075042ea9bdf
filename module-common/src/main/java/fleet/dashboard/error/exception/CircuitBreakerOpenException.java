package fleet.dashboard.error.exception;

import fleet.dashboard.error.CommonErrorCode;
import fleet.dashboard.error.exception.base.ServerBaseException;
import lombok.Getter;

/**
 * 브레이커가 OPEN 상태라 업스트림을 호출하지 않고 즉시 거절했음을 나타냅니다.
 *
 * <p>{@link #getRetryAfterMs()}는 브레이커의 reset timeout이며, UI는 이를 "일시적 성능 저하" 안내와 재시도 힌트로 사용합니다.
 */
@Getter
public class CircuitBreakerOpenException extends ServerBaseException {

  private final String breakerName;
  private final long retryAfterMs;

  public CircuitBreakerOpenException(String breakerName, long retryAfterMs) {
    super(CommonErrorCode.BREAKER_OPEN, breakerName, retryAfterMs);
    this.breakerName = breakerName;
    this.retryAfterMs = retryAfterMs;
  }
}
