package fleet.dashboard.infrastructure.cache.orchestrator.strategy;

import com.fasterxml.jackson.databind.JavaType;
import fleet.dashboard.infrastructure.cache.CacheWrite;
import fleet.dashboard.infrastructure.cache.local.LocalTtlStore;
import fleet.dashboard.infrastructure.cache.shared.SharedCacheAdapter;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import lombok.RequiredArgsConstructor;

/**
 * multi-layer: L1(Local) → L2(Shared)
 *
 * <ul>
 *   <li>조회: L1 hit이면 종료, 아니면 L2 조회 후 L1 backfill
 *   <li>저장/무효화: L2 → L1 순서
 *   <li>태그 무효화: L2 태그 집합 삭제 + L1 키 부분 문자열 매칭 삭제
 * </ul>
 */
@RequiredArgsConstructor
public class MultiLayerStrategy implements CacheLayerStrategy {

  public static final String BACKEND = "multi-layer";

  private final LocalTtlStore local;
  private final SharedCacheAdapter shared;

  @Override
  public String backend() {
    return BACKEND;
  }

  @Override
  public <T> Optional<T> read(String key, JavaType type, long backfillTtlSeconds) {
    Optional<T> l1 = LocalOnlyLayerStrategy.readLocal(local, key, type);
    if (l1.isPresent()) {
      return l1;
    }
    Optional<T> l2 = shared.get(key, type);
    l2.ifPresent(value -> local.set(key, value, backfillTtlSeconds));
    return l2;
  }

  @Override
  public <T> List<Optional<T>> readMany(List<String> keys, JavaType type, long backfillTtlSeconds) {
    List<Optional<T>> results = new ArrayList<>(keys.size());
    List<Integer> missingIndexes = new ArrayList<>();
    List<String> missingKeys = new ArrayList<>();
    for (int i = 0; i < keys.size(); i++) {
      Optional<T> l1 = LocalOnlyLayerStrategy.readLocal(local, keys.get(i), type);
      results.add(l1);
      if (l1.isEmpty()) {
        missingIndexes.add(i);
        missingKeys.add(keys.get(i));
      }
    }
    if (missingKeys.isEmpty()) {
      return results;
    }

    List<Optional<T>> fromShared = shared.getMany(missingKeys, type);
    for (int i = 0; i < missingKeys.size(); i++) {
      Optional<T> value = fromShared.get(i);
      String key = missingKeys.get(i);
      value.ifPresent(v -> local.set(key, v, backfillTtlSeconds));
      results.set(missingIndexes.get(i), value);
    }
    return results;
  }

  @Override
  public void write(String key, Object value, long ttlSeconds, Set<String> tags) {
    if (tags.isEmpty()) {
      shared.set(key, value, ttlSeconds);
    } else {
      shared.setWithTags(key, value, ttlSeconds, tags);
    }
    local.set(key, value, ttlSeconds, tags);
  }

  @Override
  public void writeMany(Collection<CacheWrite> writes) {
    shared.setMany(writes);
    writes.forEach(w -> local.set(w.key(), w.value(), w.ttlSeconds()));
  }

  @Override
  public void invalidate(String key) {
    shared.invalidate(key);
    local.invalidate(key);
  }

  @Override
  public void invalidateTag(String tag) {
    shared.invalidateTag(tag);
    local.invalidateTag(tag);
  }

  @Override
  public void clear() {
    shared.clear();
    local.clear();
  }

  @Override
  public long remoteSize() {
    return shared.size();
  }
}
