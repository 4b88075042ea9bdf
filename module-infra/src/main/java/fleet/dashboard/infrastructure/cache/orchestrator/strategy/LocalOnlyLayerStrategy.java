package fleet.dashboard.infrastructure.cache.orchestrator.strategy;

import com.fasterxml.jackson.databind.JavaType;
import fleet.dashboard.infrastructure.cache.CacheWrite;
import fleet.dashboard.infrastructure.cache.local.LocalTtlStore;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import lombok.RequiredArgsConstructor;

/** memory-only: L1만 사용 */
@RequiredArgsConstructor
public class LocalOnlyLayerStrategy implements CacheLayerStrategy {

  public static final String BACKEND = "memory-only";

  private final LocalTtlStore local;

  @Override
  public String backend() {
    return BACKEND;
  }

  @Override
  public <T> Optional<T> read(String key, JavaType type, long backfillTtlSeconds) {
    return readLocal(local, key, type);
  }

  @Override
  public <T> List<Optional<T>> readMany(List<String> keys, JavaType type, long backfillTtlSeconds) {
    return keys.stream().map(key -> LocalOnlyLayerStrategy.<T>readLocal(local, key, type)).toList();
  }

  @Override
  public void write(String key, Object value, long ttlSeconds, Set<String> tags) {
    local.set(key, value, ttlSeconds, tags);
  }

  @Override
  public void writeMany(Collection<CacheWrite> writes) {
    writes.forEach(w -> local.set(w.key(), w.value(), w.ttlSeconds()));
  }

  @Override
  public void invalidate(String key) {
    local.invalidate(key);
  }

  @Override
  public void invalidateTag(String tag) {
    local.invalidateTag(tag);
  }

  @Override
  public void clear() {
    local.clear();
  }

  @Override
  public long remoteSize() {
    return 0L;
  }

  /** 요청 타입과 호환되지 않는 값은 miss로 취급 */
  @SuppressWarnings("unchecked")
  static <T> Optional<T> readLocal(LocalTtlStore local, String key, JavaType type) {
    return local
        .get(key)
        .filter(value -> type.getRawClass().isInstance(value))
        .map(value -> (T) value);
  }
}
