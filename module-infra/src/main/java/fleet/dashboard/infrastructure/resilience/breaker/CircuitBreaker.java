package fleet.dashboard.infrastructure.resilience.breaker;

import fleet.dashboard.error.exception.CircuitBreakerOpenException;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;
import java.util.function.Supplier;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * 3상태 서킷 브레이커 (파티션 1개당 인스턴스 1개)
 *
 * <h4>동작</h4>
 *
 * <ul>
 *   <li>OPEN + cool-down 미경과: 래핑된 호출 없이 {@link CircuitBreakerOpenException} (retryAfterMs = resetTimeout)
 *   <li>OPEN → HALF_OPEN: 다음 호출 또는 상태 조회 시점에 판정 (타이머 스레드 없음)
 *   <li>HALF_OPEN: probe는 한 번에 하나만 통과. probe 진행 중 도착한 호출은 OPEN과 동일하게 거절
 *   <li>HALF_OPEN → CLOSED/OPEN 전이는 probe로 통과한 호출의 결과만 결정. CLOSED에서 통과해 늦게 끝난 호출은 카운트만 반영
 *   <li>{@code isFailure}가 false인 예외는 성공/실패 어느 쪽에도 기록하지 않음 (미지정 시 모든 예외가 실패)
 * </ul>
 *
 * <h4>동시성</h4>
 *
 * <p>상태 확인과 전이는 {@link ReentrantLock} 안에서만 일어나며, 래핑된 호출 자체는 락 밖에서 실행됩니다.
 *
 * <h4>로그 억제</h4>
 *
 * <p>연속 probe 실패가 {@value #PROBE_FAILURE_LOG_THRESHOLD}회를 넘으면 전이 로그를 debug로 낮춥니다.
 */
@Slf4j
public class CircuitBreaker {

  static final int PROBE_FAILURE_LOG_THRESHOLD = 3;

  @Getter private final String name;
  private final int failureThreshold;
  private final Duration resetTimeout;
  private final Predicate<Throwable> isFailure;
  private final Clock clock;

  private final ReentrantLock lock = new ReentrantLock();
  private BreakerState current = BreakerState.initial();
  private boolean probeInFlight;

  public CircuitBreaker(
      String name,
      int failureThreshold,
      Duration resetTimeout,
      Predicate<Throwable> isFailure,
      Clock clock) {
    this.name = name;
    this.failureThreshold = failureThreshold;
    this.resetTimeout = resetTimeout;
    this.isFailure = isFailure != null ? isFailure : e -> true;
    this.clock = clock;
  }

  public <T> T execute(Supplier<T> call) {
    boolean probe = acquirePermission();
    T result;
    try {
      result = call.get();
    } catch (RuntimeException | Error e) {
      onError(e, probe);
      throw e;
    }
    onSuccess(probe);
    return result;
  }

  /** 현재 상태. 조회 시점에 OPEN → HALF_OPEN 전이를 명시적으로 평가합니다. */
  public CircuitState getState() {
    lock.lock();
    try {
      return observe().state();
    } finally {
      lock.unlock();
    }
  }

  public BreakerSnapshot getStats() {
    lock.lock();
    try {
      return BreakerSnapshot.of(name, observe());
    } finally {
      lock.unlock();
    }
  }

  public long getResetTimeoutMs() {
    return resetTimeout.toMillis();
  }

  public void reset() {
    lock.lock();
    try {
      current = BreakerState.initial();
      probeInFlight = false;
    } finally {
      lock.unlock();
    }
    log.info("[CircuitBreaker] {} reset to CLOSED", name);
  }

  /** @return HALF_OPEN probe로 통과했으면 true */
  private boolean acquirePermission() {
    lock.lock();
    try {
      BreakerState state = observe();
      if (state.state() == CircuitState.CLOSED) {
        return false;
      }
      if (state.state() == CircuitState.HALF_OPEN && !probeInFlight) {
        probeInFlight = true;
        return true;
      }
    } finally {
      lock.unlock();
    }
    throw new CircuitBreakerOpenException(name, resetTimeout.toMillis());
  }

  private void onSuccess(boolean probe) {
    lock.lock();
    try {
      if (probe) {
        probeInFlight = false;
      } else if (current.state() != CircuitState.CLOSED) {
        current = current.countSuccess();
        return;
      }
      BreakerState.Observation next = current.onSuccess();
      if (next.transitioned()) {
        log.info(
            "[CircuitBreaker] {} probe 성공, CLOSED로 전환 (직전 연속 probe 실패: {})",
            name,
            current.consecutiveProbeFailures());
      }
      current = next.state();
    } finally {
      lock.unlock();
    }
  }

  private void onError(Throwable e, boolean probe) {
    lock.lock();
    try {
      if (probe) {
        probeInFlight = false;
      }
      if (!isFailure.test(e)) {
        return;
      }
      if (!probe && current.state() != CircuitState.CLOSED) {
        current = current.countFailure(clock.instant());
        return;
      }
      BreakerState.Observation next = current.onFailure(clock.instant(), failureThreshold);
      current = next.state();
      if (next.transitioned()) {
        logOpened(next.state());
      }
    } finally {
      lock.unlock();
    }
  }

  /** 락 안에서만 호출. 시간 경과 전이를 반영하고 필요하면 로그를 남깁니다. */
  private BreakerState observe() {
    BreakerState.Observation observation = current.observe(clock.instant(), resetTimeout);
    current = observation.state();
    if (observation.transitioned()) {
      if (current.consecutiveProbeFailures() < PROBE_FAILURE_LOG_THRESHOLD) {
        log.info("[CircuitBreaker] {} HALF_OPEN 전환, probe 허용", name);
      } else {
        log.debug(
            "[CircuitBreaker] {} HALF_OPEN 전환 (연속 probe 실패: {})",
            name,
            current.consecutiveProbeFailures());
      }
    }
    return current;
  }

  private void logOpened(BreakerState opened) {
    int probeFailures = opened.consecutiveProbeFailures();
    if (probeFailures == 0) {
      log.warn(
          "[CircuitBreaker] {} OPEN 전환: 연속 실패 {}회 (threshold: {})",
          name,
          opened.failures(),
          failureThreshold);
    } else if (probeFailures <= PROBE_FAILURE_LOG_THRESHOLD) {
      log.warn("[CircuitBreaker] {} probe 실패, 다시 OPEN", name);
    } else if (probeFailures == PROBE_FAILURE_LOG_THRESHOLD + 1) {
      log.warn(
          "[CircuitBreaker] {} probe 실패가 계속됨 ({}회), 이후 로그는 debug로 낮춥니다", name, probeFailures);
    } else {
      log.debug("[CircuitBreaker] {} probe 실패, 다시 OPEN (연속 {}회)", name, probeFailures);
    }
  }
}
