package fleet.dashboard.infrastructure.resilience.breaker;

import java.time.Duration;
import java.time.Instant;

/**
 * 브레이커 상태 값 (불변)
 *
 * <p>모든 전이는 새 인스턴스와 전이 여부를 담은 {@link Observation}으로 반환됩니다. 부수효과(로그, 메트릭)는 호출부에서 전이 여부를 보고
 * 명시적으로 처리합니다.
 *
 * <pre>
 * CLOSED    --(연속 실패 >= threshold)--> OPEN
 * OPEN      --(now - openedAt >= resetTimeout, 조회 시점 판정)--> HALF_OPEN
 * HALF_OPEN --(probe 성공)--> CLOSED (failures, consecutiveProbeFailures = 0)
 * HALF_OPEN --(probe 실패)--> OPEN   (openedAt 갱신, consecutiveProbeFailures + 1)
 * </pre>
 *
 * <p>OPEN/HALF_OPEN에서 probe가 아닌 호출(CLOSED일 때 통과해 늦게 끝난 호출)의 결과는 {@link #countSuccess()}, {@link
 * #countFailure(Instant)}로 카운트만 반영하며 상태를 바꾸지 않습니다.
 */
public record BreakerState(
    CircuitState state,
    int failures,
    int successes,
    Instant lastFailureAt,
    Instant openedAt,
    int consecutiveProbeFailures) {

  public static BreakerState initial() {
    return new BreakerState(CircuitState.CLOSED, 0, 0, null, null, 0);
  }

  /**
   * 시간 경과에 따른 OPEN → HALF_OPEN 전이를 평가합니다.
   *
   * @param now 현재 시각
   * @param resetTimeout OPEN 유지 시간
   */
  public Observation observe(Instant now, Duration resetTimeout) {
    if (state == CircuitState.OPEN
        && openedAt != null
        && !now.isBefore(openedAt.plus(resetTimeout))) {
      return new Observation(
          new BreakerState(
              CircuitState.HALF_OPEN,
              failures,
              successes,
              lastFailureAt,
              openedAt,
              consecutiveProbeFailures),
          true);
    }
    return new Observation(this, false);
  }

  /** 성공 기록. CLOSED에서는 연속 실패 카운트를 초기화하고, HALF_OPEN에서는 CLOSED로 전이합니다. */
  public Observation onSuccess() {
    if (state == CircuitState.HALF_OPEN) {
      return new Observation(
          new BreakerState(CircuitState.CLOSED, 0, successes + 1, lastFailureAt, null, 0), true);
    }
    return new Observation(
        new BreakerState(state, 0, successes + 1, lastFailureAt, openedAt, consecutiveProbeFailures),
        false);
  }

  /** 상태 전이 없이 성공 카운트만 증가 */
  public BreakerState countSuccess() {
    return new BreakerState(
        state, failures, successes + 1, lastFailureAt, openedAt, consecutiveProbeFailures);
  }

  /** 상태 전이 없이 실패 카운트와 마지막 실패 시각만 갱신 */
  public BreakerState countFailure(Instant now) {
    return new BreakerState(
        state, failures + 1, successes, now, openedAt, consecutiveProbeFailures);
  }

  /**
   * 실패 기록
   *
   * @param now 실패 시각
   * @param failureThreshold CLOSED → OPEN 임계값
   */
  public Observation onFailure(Instant now, int failureThreshold) {
    int nextFailures = failures + 1;
    if (state == CircuitState.HALF_OPEN) {
      return new Observation(
          new BreakerState(
              CircuitState.OPEN, nextFailures, successes, now, now, consecutiveProbeFailures + 1),
          true);
    }
    if (state == CircuitState.CLOSED && nextFailures >= failureThreshold) {
      return new Observation(
          new BreakerState(CircuitState.OPEN, nextFailures, successes, now, now, 0), true);
    }
    return new Observation(
        new BreakerState(state, nextFailures, successes, now, openedAt, consecutiveProbeFailures),
        false);
  }

  /**
   * @param state 평가 이후 상태
   * @param transitioned 상태(CircuitState)가 바뀌었으면 true
   */
  public record Observation(BreakerState state, boolean transitioned) {}
}
