package fleet.dashboard.infrastructure.resilience.breaker;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;

/**
 * 업스트림 파티션별 브레이커 레지스트리
 *
 * <ul>
 *   <li>파티션 키: 경로의 {@code /api/endpoints/<id>} → {@code endpoint-<id>}, 그 외 {@code global}
 *   <li>브레이커 이름: {@code <namePrefix>:<partition>}
 *   <li>첫 요청 시 Lazy 생성, 프로세스 수명 동안 유지. 명시적 reset 외에는 제거하지 않음
 * </ul>
 */
@Slf4j
public class PartitionedCircuitBreakerRegistry {

  public static final String GLOBAL_PARTITION = "global";
  private static final Pattern ENDPOINT_PATH = Pattern.compile("/api/endpoints/(\\d+)(?:[/?]|$)");

  private final Map<String, CircuitBreaker> breakers = new ConcurrentHashMap<>();
  private final String namePrefix;
  private final int failureThreshold;
  private final Duration resetTimeout;
  private final Predicate<Throwable> isFailure;
  private final Clock clock;

  public PartitionedCircuitBreakerRegistry(
      String namePrefix,
      int failureThreshold,
      Duration resetTimeout,
      Predicate<Throwable> isFailure,
      Clock clock) {
    this.namePrefix = namePrefix;
    this.failureThreshold = failureThreshold;
    this.resetTimeout = resetTimeout;
    this.isFailure = isFailure;
    this.clock = clock;
  }

  public static String partitionOf(String path) {
    if (path == null) {
      return GLOBAL_PARTITION;
    }
    Matcher matcher = ENDPOINT_PATH.matcher(path);
    return matcher.find() ? "endpoint-" + matcher.group(1) : GLOBAL_PARTITION;
  }

  public CircuitBreaker forPath(String path) {
    return forPartition(partitionOf(path));
  }

  public CircuitBreaker forPartition(String partition) {
    return breakers.computeIfAbsent(partition, this::create);
  }

  /** 전체 파티션 통계. 최상위 state는 가장 나쁜 상태 (OPEN > HALF_OPEN > CLOSED) */
  public BreakerRegistryStats getStats() {
    Map<String, BreakerSnapshot> byPartition = new TreeMap<>();
    breakers.forEach((partition, breaker) -> byPartition.put(partition, breaker.getStats()));

    CircuitState worst = CircuitState.CLOSED;
    int failures = 0;
    int successes = 0;
    Instant lastFailureAt = null;
    for (BreakerSnapshot snapshot : byPartition.values()) {
      worst = CircuitState.worst(worst, snapshot.state());
      failures += snapshot.failures();
      successes += snapshot.successes();
      if (snapshot.lastFailureAt() != null
          && (lastFailureAt == null || snapshot.lastFailureAt().isAfter(lastFailureAt))) {
        lastFailureAt = snapshot.lastFailureAt();
      }
    }
    return new BreakerRegistryStats(worst, failures, successes, lastFailureAt, byPartition);
  }

  /** @return 해당 파티션 브레이커가 존재해 초기화했으면 true */
  public boolean reset(String partition) {
    CircuitBreaker breaker = breakers.get(partition);
    if (breaker == null) {
      return false;
    }
    breaker.reset();
    return true;
  }

  /** 모든 브레이커 상태 초기화 (관리자 요청/테스트 정리용) */
  public void resetAll() {
    breakers.values().forEach(CircuitBreaker::reset);
  }

  private CircuitBreaker create(String partition) {
    log.debug("[CircuitBreaker] 새 파티션 브레이커 생성: {}:{}", namePrefix, partition);
    return new CircuitBreaker(
        namePrefix + ":" + partition, failureThreshold, resetTimeout, isFailure, clock);
  }

  /**
   * @param state 전체 파티션 중 최악 상태
   * @param byPartition 파티션별 스냅샷 (키 정렬)
   */
  public record BreakerRegistryStats(
      CircuitState state,
      int failures,
      int successes,
      Instant lastFailureAt,
      Map<String, BreakerSnapshot> byPartition) {}
}
