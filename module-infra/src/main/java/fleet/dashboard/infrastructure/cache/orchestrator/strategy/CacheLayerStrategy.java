package fleet.dashboard.infrastructure.cache.orchestrator.strategy;

import com.fasterxml.jackson.databind.JavaType;
import fleet.dashboard.infrastructure.cache.CacheWrite;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * 캐시 계층 구성 전략
 *
 * <ul>
 *   <li>{@link LocalOnlyLayerStrategy}: 공유 캐시 미구성 또는 백오프 구간 (memory-only)
 *   <li>{@link MultiLayerStrategy}: L1 + L2 (multi-layer)
 * </ul>
 *
 * <p>오케스트레이터는 연산마다 현재 전략을 선택하므로, 공유 캐시 백오프가 풀리면 자동으로 multi-layer로 복귀합니다.
 */
public interface CacheLayerStrategy {

  String backend();

  /**
   * 계층 순서대로 조회. 하위 계층 hit은 상위 계층으로 backfill 합니다.
   *
   * @param backfillTtlSeconds backfill 시 L1 TTL
   */
  <T> Optional<T> read(String key, JavaType type, long backfillTtlSeconds);

  <T> List<Optional<T>> readMany(List<String> keys, JavaType type, long backfillTtlSeconds);

  void write(String key, Object value, long ttlSeconds, Set<String> tags);

  void writeMany(Collection<CacheWrite> writes);

  void invalidate(String key);

  void invalidateTag(String tag);

  void clear();

  long remoteSize();
}
