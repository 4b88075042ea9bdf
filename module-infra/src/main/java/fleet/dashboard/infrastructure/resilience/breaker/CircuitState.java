package fleet.dashboard.infrastructure.resilience.breaker;

/** 브레이커 상태. severity가 클수록 나쁜 상태 (집계 시 최악 상태 선택용) */
public enum CircuitState {
  CLOSED(0),
  HALF_OPEN(1),
  OPEN(2);

  private final int severity;

  CircuitState(int severity) {
    this.severity = severity;
  }

  public static CircuitState worst(CircuitState a, CircuitState b) {
    return a.severity >= b.severity ? a : b;
  }
}
