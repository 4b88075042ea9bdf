package fleet.dashboard.infrastructure.cache.orchestrator;

import com.fasterxml.jackson.databind.JavaType;
import fleet.dashboard.infrastructure.cache.CacheWrite;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import lombok.RequiredArgsConstructor;

/**
 * 캐시 비활성화(CACHE_ENABLED=false) 구현
 *
 * <p>모든 cachedFetch 계열은 저장소를 거치지 않고 fetcher를 직접 호출합니다. 조회는 항상 miss, 쓰기/무효화는 no-op 입니다.
 */
@RequiredArgsConstructor
public class PassThroughCacheOrchestrator implements CacheOrchestrator {

  public static final String BACKEND = "disabled";

  private final Executor fetchExecutor;

  @Override
  public <T> T cachedFetch(CacheFetchRequest<T> request) {
    return Fetchers.invoke(request);
  }

  @Override
  public <T> CompletableFuture<T> cachedFetchAsync(CacheFetchRequest<T> request) {
    return CompletableFuture.supplyAsync(() -> Fetchers.invoke(request), fetchExecutor);
  }

  @Override
  public <T> T cachedFetchSWR(CacheFetchRequest<T> request) {
    return Fetchers.invoke(request);
  }

  @Override
  public <T> List<T> cachedFetchMany(List<CacheFetchRequest<T>> requests) {
    return Fetchers.awaitAll(requests.stream().map(this::cachedFetchAsync).toList());
  }

  @Override
  public <T> Optional<T> get(String key, JavaType type) {
    return Optional.empty();
  }

  @Override
  public <T> List<Optional<T>> getMany(List<String> keys, JavaType type) {
    return Collections.nCopies(keys.size(), Optional.empty());
  }

  @Override
  public void set(String key, Object value, long ttlSeconds) {}

  @Override
  public void setWithTags(String key, Object value, long ttlSeconds, Set<String> tags) {}

  @Override
  public void setMany(Collection<CacheWrite> writes) {}

  @Override
  public void invalidate(String key) {}

  @Override
  public void invalidateTag(String tag) {}

  @Override
  public void clear() {}

  @Override
  public CacheStats getStats() {
    return new CacheStats(BACKEND, 0, 0, 0, 0, 0.0, 0, null);
  }

  @Override
  public List<CacheEntryView> getEntries() {
    return List.of();
  }

  @Override
  public int getInFlightCount() {
    return 0;
  }
}
