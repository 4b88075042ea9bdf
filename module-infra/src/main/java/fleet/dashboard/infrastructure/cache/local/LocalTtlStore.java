package fleet.dashboard.infrastructure.cache.local;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import fleet.dashboard.infrastructure.cache.CacheEntry;
import fleet.dashboard.infrastructure.cache.StaleAwareValue;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;

/**
 * L1 인프로세스 TTL 저장소 (Caffeine)
 *
 * <h4>만료 정책</h4>
 *
 * <ul>
 *   <li>엔트리별 가변 만료: {@link Expiry}가 각 엔트리의 expiresAt을 그대로 사용
 *   <li>Lazy 만료: 별도 스케줄러 없이 조회/유지보수 시점에만 판단 ({@code executor(Runnable::run)})
 *   <li>크기 제한 없음: maximumSize를 지정하지 않으므로 TTL 만료만으로 메모리가 회수됨
 *   <li>시간 소스: 주입된 {@link Clock}을 Caffeine Ticker로 사용 (테스트에서 시간 이동 가능)
 * </ul>
 */
@Slf4j
public class LocalTtlStore {

  private final Cache<String, CacheEntry> cache;
  private final Clock clock;
  private final double staleFraction;

  public LocalTtlStore(Clock clock, double staleFraction) {
    this.clock = clock;
    this.staleFraction = staleFraction;
    this.cache =
        Caffeine.newBuilder()
            .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
            .executor(Runnable::run)
            .expireAfter(new EntryExpiry(clock))
            .build();
  }

  public Optional<Object> get(String key) {
    return live(key).map(CacheEntry::data);
  }

  /** stale 여부와 함께 조회. 만료된 엔트리는 부재로 취급 */
  public Optional<StaleAwareValue<Object>> getWithStaleInfo(String key) {
    Instant now = clock.instant();
    return live(key).map(entry -> new StaleAwareValue<>(entry.data(), entry.isStale(now)));
  }

  public void set(String key, Object value, long ttlSeconds) {
    set(key, value, ttlSeconds, Set.of());
  }

  public void set(String key, Object value, long ttlSeconds, Set<String> tags) {
    cache.put(key, CacheEntry.create(key, value, ttlSeconds, staleFraction, tags, clock.instant()));
  }

  public void invalidate(String key) {
    cache.invalidate(key);
  }

  /**
   * 태그 패턴으로 무효화
   *
   * <p>로컬 계층에는 태그 인덱스가 없으므로 키 문자열에 패턴이 포함되거나 엔트리 태그가 일치하는 항목을 모두 제거합니다.
   *
   * @return 제거된 엔트리 수
   */
  public int invalidateTag(String tagPattern) {
    List<String> matched =
        cache.asMap().values().stream()
            .filter(e -> e.key().contains(tagPattern) || e.tags().contains(tagPattern))
            .map(CacheEntry::key)
            .toList();
    cache.invalidateAll(matched);
    log.debug("[LocalTtlStore] invalidateTag {} removed {} entries", tagPattern, matched.size());
    return matched.size();
  }

  /** 만료되지 않은 엔트리 목록 (키 순 정렬) */
  public List<CacheEntry> entries() {
    Instant now = clock.instant();
    return cache.asMap().values().stream()
        .filter(e -> !e.isExpired(now))
        .sorted(Comparator.comparing(CacheEntry::key))
        .toList();
  }

  public void clear() {
    cache.invalidateAll();
  }

  public long size() {
    cache.cleanUp();
    return cache.estimatedSize();
  }

  private Optional<CacheEntry> live(String key) {
    CacheEntry entry = cache.getIfPresent(key);
    if (entry == null) {
      return Optional.empty();
    }
    if (entry.isExpired(clock.instant())) {
      cache.asMap().remove(key, entry);
      return Optional.empty();
    }
    return Optional.of(entry);
  }

  /**
   * 엔트리의 expiresAt까지 남은 시간을 Caffeine 만료 시간으로 사용
   *
   * <p>Caffeine은 {@code now >= 만료시각}을 만료로 보므로 1ms를 더해 {@code now > expiresAt} 규칙과 맞춥니다.
   */
  private record EntryExpiry(Clock clock) implements Expiry<String, CacheEntry> {

    @Override
    public long expireAfterCreate(String key, CacheEntry entry, long currentTime) {
      return remainingNanos(entry);
    }

    @Override
    public long expireAfterUpdate(
        String key, CacheEntry entry, long currentTime, long currentDuration) {
      return remainingNanos(entry);
    }

    @Override
    public long expireAfterRead(
        String key, CacheEntry entry, long currentTime, long currentDuration) {
      return currentDuration;
    }

    private long remainingNanos(CacheEntry entry) {
      long remainingMillis = Duration.between(clock.instant(), entry.expiresAt()).toMillis() + 1;
      return TimeUnit.MILLISECONDS.toNanos(Math.max(0L, remainingMillis));
    }
  }
}
