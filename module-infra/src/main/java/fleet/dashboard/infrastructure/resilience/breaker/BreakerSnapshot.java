package fleet.dashboard.infrastructure.resilience.breaker;

import java.time.Instant;

/** 관리 화면/통계용 브레이커 스냅샷 */
public record BreakerSnapshot(
    String name,
    CircuitState state,
    int failures,
    int successes,
    Instant lastFailureAt,
    Instant openedAt,
    int consecutiveProbeFailures) {

  static BreakerSnapshot of(String name, BreakerState s) {
    return new BreakerSnapshot(
        name,
        s.state(),
        s.failures(),
        s.successes(),
        s.lastFailureAt(),
        s.openedAt(),
        s.consecutiveProbeFailures());
  }
}
