package fleet.dashboard.infrastructure.cache.orchestrator;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.type.TypeFactory;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.Callable;

/**
 * 캐시 조회 요청
 *
 * @param key 논리 캐시 키
 * @param ttlSeconds 저장 TTL (초)
 * @param type 공유 캐시 역직렬화 타입
 * @param fetcher 캐시 miss 시 호출되는 원본 조회 함수
 * @param tags 저장 시 부여할 태그 (없으면 빈 집합)
 */
public record CacheFetchRequest<T>(
    String key, long ttlSeconds, JavaType type, Callable<T> fetcher, Set<String> tags) {

  public CacheFetchRequest {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(fetcher, "fetcher");
    tags = tags == null ? Set.of() : Set.copyOf(tags);
  }

  public static <T> CacheFetchRequest<T> of(
      String key, long ttlSeconds, Class<T> type, Callable<T> fetcher) {
    return new CacheFetchRequest<>(
        key, ttlSeconds, TypeFactory.defaultInstance().constructType(type), fetcher, Set.of());
  }

  public static <T> CacheFetchRequest<T> of(
      String key, long ttlSeconds, TypeReference<T> type, Callable<T> fetcher) {
    return new CacheFetchRequest<>(
        key, ttlSeconds, TypeFactory.defaultInstance().constructType(type), fetcher, Set.of());
  }

  public CacheFetchRequest<T> withTags(String... tags) {
    return new CacheFetchRequest<>(key, ttlSeconds, type, fetcher, Set.of(tags));
  }
}
