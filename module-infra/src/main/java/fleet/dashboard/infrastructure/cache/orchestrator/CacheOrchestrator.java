package fleet.dashboard.infrastructure.cache.orchestrator;

import com.fasterxml.jackson.databind.JavaType;
import fleet.dashboard.infrastructure.cache.CacheWrite;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;

/**
 * 애플리케이션 코드가 사용하는 캐시 진입점
 *
 * <p>캐시 비활성화 시에도 같은 시그니처의 pass-through 구현이 주입되므로 호출부는 분기하지 않습니다.
 *
 * <p>fetcher가 던진 예외는 재해석 없이 그대로 전파됩니다 (Checked Exception은 {@code CacheLoadException}으로 감쌈).
 */
public interface CacheOrchestrator {

  /** Read-through 조회. 같은 키의 동시 miss는 fetcher 1회 호출로 합쳐집니다. */
  <T> T cachedFetch(CacheFetchRequest<T> request);

  /** {@link #cachedFetch}의 비동기 버전. 반환된 future를 취소해도 공유 fetch는 취소되지 않습니다. */
  <T> CompletableFuture<T> cachedFetchAsync(CacheFetchRequest<T> request);

  /** Stale-while-revalidate 조회 */
  <T> T cachedFetchSWR(CacheFetchRequest<T> request);

  /** 요청별 cachedFetch를 동시에 실행하고 입력 순서대로 결과를 반환합니다. */
  <T> List<T> cachedFetchMany(List<CacheFetchRequest<T>> requests);

  <T> Optional<T> get(String key, JavaType type);

  <T> List<Optional<T>> getMany(List<String> keys, JavaType type);

  void set(String key, Object value, long ttlSeconds);

  void setWithTags(String key, Object value, long ttlSeconds, Set<String> tags);

  void setMany(Collection<CacheWrite> writes);

  void invalidate(String key);

  void invalidateTag(String tag);

  void clear();

  CacheStats getStats();

  List<CacheEntryView> getEntries();

  int getInFlightCount();

  default <T> T cachedFetch(String key, long ttlSeconds, Class<T> type, Callable<T> fetcher) {
    return cachedFetch(CacheFetchRequest.of(key, ttlSeconds, type, fetcher));
  }

  default <T> T cachedFetchSWR(String key, long ttlSeconds, Class<T> type, Callable<T> fetcher) {
    return cachedFetchSWR(CacheFetchRequest.of(key, ttlSeconds, type, fetcher));
  }
}
