package fleet.dashboard.infrastructure.cache.orchestrator;

import com.fasterxml.jackson.databind.JavaType;
import fleet.dashboard.infrastructure.cache.CacheEntry;
import fleet.dashboard.infrastructure.cache.CacheWrite;
import fleet.dashboard.infrastructure.cache.StaleAwareValue;
import fleet.dashboard.infrastructure.cache.local.LocalTtlStore;
import fleet.dashboard.infrastructure.cache.orchestrator.strategy.CacheLayerStrategy;
import fleet.dashboard.infrastructure.cache.orchestrator.strategy.LocalOnlyLayerStrategy;
import fleet.dashboard.infrastructure.cache.orchestrator.strategy.MultiLayerStrategy;
import fleet.dashboard.infrastructure.cache.shared.SharedCacheAdapter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import lombok.extern.slf4j.Slf4j;

/**
 * 2계층 캐시 오케스트레이터 (L1: {@link LocalTtlStore}, L2: {@link SharedCacheAdapter})
 *
 * <h4>cachedFetch</h4>
 *
 * <ol>
 *   <li>L1 hit → 즉시 반환
 *   <li>{@link InFlightRegistry}에 합류하거나 leader로 등록
 *   <li>leader: L1/L2 재확인(Double-check) → miss면 fetcher 1회 호출 → L2, L1 저장
 *   <li>정산 시 레지스트리에서 제거, 합류한 모든 호출자에게 같은 결과 전달
 * </ol>
 *
 * <h4>cachedFetchSWR</h4>
 *
 * <ul>
 *   <li>fresh: 즉시 반환
 *   <li>stale (만료 전): 즉시 반환 + 백그라운드 재검증 (키당 1개, 같은 레지스트리 사용). 재검증 실패는 로그만 남김
 *   <li>cold: cachedFetch와 동일하게 대기
 * </ul>
 *
 * <h4>계층 전략</h4>
 *
 * <p>공유 캐시가 구성되어 있고 백오프 구간이 아니면 {@link MultiLayerStrategy}, 아니면 {@link LocalOnlyLayerStrategy}를 연산마다
 * 선택합니다.
 *
 * <h4>메트릭 (Counter pre-registration)</h4>
 *
 * <ul>
 *   <li>cache.hit{layer=L1|L2}, cache.miss, cache.swr.revalidate{result=success|failure}
 * </ul>
 */
@Slf4j
public class TieredCacheOrchestrator implements CacheOrchestrator {

  private static final String CACHE_TAG = "orchestrator";

  private final LocalTtlStore local;
  private final SharedCacheAdapter shared;
  private final InFlightRegistry inFlight;
  private final Executor fetchExecutor;
  private final Executor revalidateExecutor;
  private final long backfillTtlSeconds;
  private final Clock clock;

  private final CacheLayerStrategy localOnly;
  private final CacheLayerStrategy multiLayer;

  private final Counter l1HitCounter;
  private final Counter l2HitCounter;
  private final Counter missCounter;
  private final Counter revalidateSuccessCounter;
  private final Counter revalidateFailureCounter;

  /**
   * @param shared 공유 캐시 어댑터, 미구성 시 null
   * @param backfillTtlSeconds TTL을 알 수 없는 조회(get/getMany)의 L2 → L1 backfill TTL
   */
  public TieredCacheOrchestrator(
      LocalTtlStore local,
      SharedCacheAdapter shared,
      InFlightRegistry inFlight,
      Executor fetchExecutor,
      Executor revalidateExecutor,
      MeterRegistry meterRegistry,
      long backfillTtlSeconds,
      Clock clock) {
    this.local = local;
    this.shared = shared;
    this.inFlight = inFlight;
    this.fetchExecutor = fetchExecutor;
    this.revalidateExecutor = revalidateExecutor;
    this.backfillTtlSeconds = backfillTtlSeconds;
    this.clock = clock;
    this.localOnly = new LocalOnlyLayerStrategy(local);
    this.multiLayer = shared != null ? new MultiLayerStrategy(local, shared) : localOnly;

    this.l1HitCounter =
        Counter.builder("cache.hit").tag("layer", "L1").tag("cache", CACHE_TAG).register(meterRegistry);
    this.l2HitCounter =
        Counter.builder("cache.hit").tag("layer", "L2").tag("cache", CACHE_TAG).register(meterRegistry);
    this.missCounter = Counter.builder("cache.miss").tag("cache", CACHE_TAG).register(meterRegistry);
    this.revalidateSuccessCounter =
        Counter.builder("cache.swr.revalidate").tag("result", "success").register(meterRegistry);
    this.revalidateFailureCounter =
        Counter.builder("cache.swr.revalidate").tag("result", "failure").register(meterRegistry);
  }

  @Override
  public <T> T cachedFetch(CacheFetchRequest<T> request) {
    Optional<T> l1 = readLocal(request.key(), request.type());
    if (l1.isPresent()) {
      l1HitCounter.increment();
      return l1.get();
    }
    return Fetchers.await(joinOrLoad(request));
  }

  @Override
  public <T> CompletableFuture<T> cachedFetchAsync(CacheFetchRequest<T> request) {
    Optional<T> l1 = readLocal(request.key(), request.type());
    if (l1.isPresent()) {
      l1HitCounter.increment();
      return CompletableFuture.completedFuture(l1.get());
    }
    return joinOrLoad(request);
  }

  @Override
  @SuppressWarnings("unchecked")
  public <T> T cachedFetchSWR(CacheFetchRequest<T> request) {
    Optional<StaleAwareValue<Object>> cached =
        local
            .getWithStaleInfo(request.key())
            .filter(v -> request.type().getRawClass().isInstance(v.data()));
    if (cached.isEmpty()) {
      return cachedFetch(request);
    }

    l1HitCounter.increment();
    if (cached.get().stale()) {
      revalidateInBackground(request);
    }
    return (T) cached.get().data();
  }

  @Override
  public <T> List<T> cachedFetchMany(List<CacheFetchRequest<T>> requests) {
    List<CompletableFuture<T>> futures = requests.stream().map(this::cachedFetchAsync).toList();
    return Fetchers.awaitAll(futures);
  }

  @Override
  public <T> Optional<T> get(String key, JavaType type) {
    Optional<T> value = strategy().read(key, type, backfillTtlSeconds);
    (value.isPresent() ? l2HitCounter : missCounter).increment();
    return value;
  }

  @Override
  public <T> List<Optional<T>> getMany(List<String> keys, JavaType type) {
    List<Optional<T>> values = strategy().readMany(keys, type, backfillTtlSeconds);
    values.forEach(v -> (v.isPresent() ? l2HitCounter : missCounter).increment());
    return values;
  }

  @Override
  public void set(String key, Object value, long ttlSeconds) {
    strategy().write(key, value, ttlSeconds, Set.of());
  }

  @Override
  public void setWithTags(String key, Object value, long ttlSeconds, Set<String> tags) {
    strategy().write(key, value, ttlSeconds, tags);
  }

  @Override
  public void setMany(Collection<CacheWrite> writes) {
    if (!writes.isEmpty()) {
      strategy().writeMany(writes);
    }
  }

  @Override
  public void invalidate(String key) {
    strategy().invalidate(key);
  }

  @Override
  public void invalidateTag(String tag) {
    strategy().invalidateTag(tag);
    log.info("[Cache] 태그 무효화: {}", tag);
  }

  @Override
  public void clear() {
    strategy().clear();
    log.info("[Cache] 전체 캐시 초기화");
  }

  @Override
  public CacheStats getStats() {
    CacheLayerStrategy strategy = strategy();
    long hits = (long) (l1HitCounter.count() + l2HitCounter.count());
    long misses = (long) missCounter.count();
    return new CacheStats(
        strategy.backend(),
        local.size(),
        strategy.remoteSize(),
        hits,
        misses,
        CacheStats.hitRate(hits, misses),
        inFlight.size(),
        shared != null ? shared.getStats() : null);
  }

  @Override
  public List<CacheEntryView> getEntries() {
    Instant now = clock.instant();
    return local.entries().stream().map(e -> toView(e, now)).toList();
  }

  @Override
  public int getInFlightCount() {
    return inFlight.size();
  }

  private CacheLayerStrategy strategy() {
    return shared != null && shared.isAvailable() ? multiLayer : localOnly;
  }

  private <T> Optional<T> readLocal(String key, JavaType type) {
    return localOnly.read(key, type, backfillTtlSeconds);
  }

  private <T> CompletableFuture<T> joinOrLoad(CacheFetchRequest<T> request) {
    return inFlight.runOnce(
        request.key(),
        () -> CompletableFuture.supplyAsync(() -> readThrough(request), fetchExecutor));
  }

  /** leader 전용: Double-check 후 miss면 fetch + 저장 */
  private <T> T readThrough(CacheFetchRequest<T> request) {
    Optional<T> l1 = readLocal(request.key(), request.type());
    if (l1.isPresent()) {
      l1HitCounter.increment();
      return l1.get();
    }
    Optional<T> l2 = strategy().read(request.key(), request.type(), request.ttlSeconds());
    if (l2.isPresent()) {
      l2HitCounter.increment();
      return l2.get();
    }
    missCounter.increment();
    log.debug("[Cache] miss, fetch 실행: {}", request.key());
    return fetchAndStore(request);
  }

  private <T> T fetchAndStore(CacheFetchRequest<T> request) {
    T value = Fetchers.invoke(request);
    if (value != null) {
      strategy().write(request.key(), value, request.ttlSeconds(), request.tags());
    }
    return value;
  }

  /** Fire-and-forget. 같은 키의 진행 중 작업이 있으면 새로 시작하지 않습니다. */
  private <T> void revalidateInBackground(CacheFetchRequest<T> request) {
    if (inFlight.isInFlight(request.key())) {
      return;
    }
    inFlight
        .runOnce(
            request.key(),
            () -> CompletableFuture.supplyAsync(() -> fetchAndStore(request), revalidateExecutor))
        .whenComplete(
            (value, error) -> {
              if (error == null) {
                revalidateSuccessCounter.increment();
                log.debug("[Cache] SWR 재검증 완료: {}", request.key());
                return;
              }
              revalidateFailureCounter.increment();
              log.warn(
                  "[Cache] SWR 재검증 실패, stale 값 유지: {} ({})",
                  request.key(),
                  error.getMessage());
            });
  }

  private CacheEntryView toView(CacheEntry entry, Instant now) {
    long expiresIn = Math.max(0L, Duration.between(now, entry.expiresAt()).toSeconds());
    return new CacheEntryView(
        entry.key(), entry.staleAt(), entry.expiresAt(), expiresIn, entry.isStale(now), entry.tags());
  }
}
