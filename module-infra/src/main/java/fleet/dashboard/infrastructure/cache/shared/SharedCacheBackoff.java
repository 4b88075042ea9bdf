package fleet.dashboard.infrastructure.cache.shared;

import java.time.Clock;
import java.time.Instant;

/**
 * 공유 캐시 실패 백오프
 *
 * <p>N번째 연속 실패 시 {@code disabledUntil = now + min(base * 2^(N-1), max)}. disabledUntil 이전의 모든 원격 연산은
 * 네트워크 호출 없이 건너뜁니다. 실패 이후 첫 성공에서 초기화됩니다.
 *
 * <p>프로세스 전역 상태이므로 모든 메서드는 동기화됩니다.
 */
public class SharedCacheBackoff {

  /** 2^30 이상은 어떤 base에서도 상한을 넘으므로 지수를 여기서 자릅니다. */
  private static final int MAX_EXPONENT = 30;

  private final Clock clock;
  private final long baseDelayMs;
  private final long maxDelayMs;

  private int failureCount;
  private Instant disabledUntil = Instant.EPOCH;

  public SharedCacheBackoff(Clock clock, long baseDelayMs, long maxDelayMs) {
    this.clock = clock;
    this.baseDelayMs = baseDelayMs;
    this.maxDelayMs = maxDelayMs;
  }

  public synchronized boolean isBackedOff() {
    return clock.instant().isBefore(disabledUntil);
  }

  /**
   * 실패 기록
   *
   * @return 갱신된 disabledUntil
   */
  public synchronized Instant recordFailure() {
    failureCount++;
    disabledUntil = clock.instant().plusMillis(delayFor(failureCount));
    return disabledUntil;
  }

  public synchronized void recordSuccess() {
    if (failureCount > 0) {
      failureCount = 0;
      disabledUntil = Instant.EPOCH;
    }
  }

  public synchronized State snapshot() {
    return new State(failureCount, disabledUntil);
  }

  /** N번째 실패의 대기 시간 (ms) */
  long delayFor(int failures) {
    int exponent = Math.min(Math.max(failures - 1, 0), MAX_EXPONENT);
    return Math.min(baseDelayMs * (1L << exponent), maxDelayMs);
  }

  /**
   * @param failureCount 연속 실패 횟수
   * @param disabledUntil 이 시각까지 원격 연산 생략
   */
  public record State(int failureCount, Instant disabledUntil) {}
}
