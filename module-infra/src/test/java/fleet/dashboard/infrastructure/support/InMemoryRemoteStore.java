package fleet.dashboard.infrastructure.support;

import fleet.dashboard.infrastructure.cache.shared.RemoteKeyValueStore;
import fleet.dashboard.infrastructure.cache.shared.RemoteWrite;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 테스트용 원격 저장소
 *
 * <p>{@link #goDown()} 이후 모든 연산은 {@link IllegalStateException}을 던집니다. {@link #calls()}는 실제로 도달한 연산
 * 수입니다.
 */
public class InMemoryRemoteStore implements RemoteKeyValueStore {

  private record Value(String data, Instant expiresAt) {}

  private final Clock clock;
  private final Map<String, Value> values = new ConcurrentHashMap<>();
  private final Map<String, Set<String>> sets = new ConcurrentHashMap<>();
  private final Map<String, Instant> setExpiry = new ConcurrentHashMap<>();
  private final AtomicBoolean down = new AtomicBoolean();
  private final AtomicInteger calls = new AtomicInteger();
  private final AtomicInteger getAllCalls = new AtomicInteger();
  private final Map<String, String> info = new HashMap<>();

  public InMemoryRemoteStore(Clock clock) {
    this.clock = clock;
  }

  public void goDown() {
    down.set(true);
  }

  public void comeBack() {
    down.set(false);
  }

  public int calls() {
    return calls.get();
  }

  public int getAllCalls() {
    return getAllCalls.get();
  }

  public void putInfo(String field, String value) {
    info.put(field, value);
  }

  /** 테스트 검증용 직접 조회 (호출 수에 포함되지 않음) */
  public String raw(String key) {
    Value value = values.get(key);
    return value != null && !expired(value) ? value.data() : null;
  }

  public Set<String> rawSet(String key) {
    expireSet(key);
    return sets.getOrDefault(key, Set.of());
  }

  public Instant setExpiresAt(String key) {
    return setExpiry.get(key);
  }

  public boolean containsKey(String key) {
    expireSet(key);
    return raw(key) != null || sets.containsKey(key);
  }

  @Override
  public Optional<String> get(String key) {
    touch();
    return Optional.ofNullable(raw(key));
  }

  @Override
  public Map<String, String> getAll(Collection<String> keys) {
    touch();
    getAllCalls.incrementAndGet();
    Map<String, String> found = new HashMap<>();
    for (String key : keys) {
      String value = raw(key);
      if (value != null) {
        found.put(key, value);
      }
    }
    return found;
  }

  @Override
  public void writeAll(List<RemoteWrite> writes) {
    touch();
    for (RemoteWrite write : writes) {
      values.put(write.key(), new Value(write.value(), clock.instant().plus(write.ttl())));
      if (write.obsoleteKey() != null) {
        values.remove(write.obsoleteKey());
      }
    }
  }

  @Override
  public long delete(Collection<String> keys) {
    touch();
    long removed = 0;
    for (String key : keys) {
      boolean removedValue = values.remove(key) != null;
      setExpiry.remove(key);
      boolean removedSet = sets.remove(key) != null;
      if (removedValue || removedSet) {
        removed++;
      }
    }
    return removed;
  }

  @Override
  public void addToSet(String setKey, Collection<String> members, Duration ttl) {
    touch();
    expireSet(setKey);
    sets.computeIfAbsent(setKey, k -> ConcurrentHashMap.newKeySet()).addAll(members);
    Instant requested = clock.instant().plus(ttl);
    setExpiry.merge(setKey, requested, (current, next) -> next.isAfter(current) ? next : current);
  }

  @Override
  public Set<String> members(String setKey) {
    touch();
    expireSet(setKey);
    return new HashSet<>(sets.getOrDefault(setKey, Set.of()));
  }

  @Override
  public long countByPrefix(String prefix) {
    touch();
    sets.keySet().forEach(this::expireSet);
    long liveValues =
        values.entrySet().stream()
            .filter(e -> e.getKey().startsWith(prefix) && !expired(e.getValue()))
            .count();
    return liveValues + sets.keySet().stream().filter(k -> k.startsWith(prefix)).count();
  }

  @Override
  public long deleteByPrefix(String prefix) {
    touch();
    long before = values.size() + sets.size();
    values.keySet().removeIf(k -> k.startsWith(prefix));
    sets.keySet().removeIf(k -> k.startsWith(prefix));
    setExpiry.keySet().removeIf(k -> k.startsWith(prefix));
    return before - values.size() - sets.size();
  }

  @Override
  public boolean ping() {
    touch();
    return true;
  }

  @Override
  public Map<String, String> info() {
    touch();
    return Map.copyOf(info);
  }

  @Override
  public void close() {}

  private void touch() {
    calls.incrementAndGet();
    if (down.get()) {
      throw new IllegalStateException("connection refused");
    }
  }

  private void expireSet(String key) {
    Instant expiresAt = setExpiry.get(key);
    if (expiresAt != null && clock.instant().isAfter(expiresAt)) {
      sets.remove(key);
      setExpiry.remove(key);
    }
  }

  private boolean expired(Value value) {
    return clock.instant().isAfter(value.expiresAt());
  }
}
