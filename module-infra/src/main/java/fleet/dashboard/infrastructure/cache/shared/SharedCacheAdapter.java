package fleet.dashboard.infrastructure.cache.shared;

import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import fleet.dashboard.infrastructure.cache.CacheWrite;
import fleet.dashboard.infrastructure.cache.shared.SharedCacheStats.CompressionStats;
import fleet.dashboard.infrastructure.cache.shared.SharedCacheStats.RedisTelemetry;
import fleet.dashboard.infrastructure.executor.LogicExecutor;
import fleet.dashboard.infrastructure.executor.TaskContext;
import fleet.dashboard.infrastructure.executor.strategy.ExceptionTranslator;
import fleet.dashboard.util.GzipUtils;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;
import lombok.extern.slf4j.Slf4j;

/**
 * L2 공유 캐시 어댑터 (Redis)
 *
 * <h4>키 레이아웃</h4>
 *
 * <ul>
 *   <li>일반 값: {@code <prefix><key>}
 *   <li>압축 값: {@code <prefix><key>:gz} (GZIP + Base64). 직렬화 크기가 임계값을 넘을 때만 사용하며 반대편 변형 키는 같은
 *       파이프라인에서 삭제
 *   <li>태그 집합: {@code <prefix>_tag:<tag>} (멤버는 네임스페이스가 적용된 일반 키)
 * </ul>
 *
 * <h4>장애 격리</h4>
 *
 * <ul>
 *   <li>연결은 첫 연산 시점에 Lazy 수립
 *   <li>연결/명령 실패는 로그 + 백오프 카운트 후 읽기는 miss, 쓰기는 no-op으로 변환. 호출자에게 예외가 전파되지 않음
 *   <li>백오프 구간에서는 네트워크 호출 없이 즉시 fallback
 * </ul>
 */
@Slf4j
public class SharedCacheAdapter implements AutoCloseable {

  static final String COMPRESSED_SUFFIX = ":gz";
  static final String TAG_SEGMENT = "_tag:";
  private static final String COMPONENT = "SharedCache";

  private final RemoteStoreConnector connector;
  private final ObjectMapper objectMapper;
  private final LogicExecutor executor;
  private final SharedCacheBackoff backoff;
  private final String prefix;
  private final int compressionThreshold;

  private final Object connectLock = new Object();
  private volatile RemoteKeyValueStore store;

  private final AtomicLong compressedCount = new AtomicLong();
  private final AtomicLong bytesSaved = new AtomicLong();
  private final Counter failureCounter;
  private final Counter skippedCounter;

  public SharedCacheAdapter(
      RemoteStoreConnector connector,
      ObjectMapper objectMapper,
      LogicExecutor executor,
      SharedCacheBackoff backoff,
      MeterRegistry meterRegistry,
      String prefix,
      int compressionThreshold) {
    this.connector = connector;
    this.objectMapper = objectMapper;
    this.executor = executor;
    this.backoff = backoff;
    this.prefix = prefix;
    this.compressionThreshold = compressionThreshold;
    this.failureCounter =
        Counter.builder("cache.l2.failure").tag("cache", "shared").register(meterRegistry);
    this.skippedCounter =
        Counter.builder("cache.l2.skipped").tag("cache", "shared").register(meterRegistry);
  }

  /** 백오프 구간이 아니면 true. 아직 연결 전이어도 true (첫 연산이 연결을 시도) */
  public boolean isAvailable() {
    return !backoff.isBackedOff();
  }

  public <T> Optional<T> get(String key, JavaType type) {
    Map<String, String> raw =
        call("get", key, s -> s.getAll(List.of(gzKey(key), plainKey(key))), Map.of());
    return decode(key, raw.get(gzKey(key)), raw.get(plainKey(key)), type);
  }

  public void set(String key, Object value, long ttlSeconds) {
    encode(key, value, ttlSeconds)
        .ifPresent(
            write ->
                call(
                    "set",
                    key,
                    s -> {
                      s.writeAll(List.of(write));
                      return null;
                    },
                    null));
  }

  /**
   * 값을 저장하고 각 태그 집합에 네임스페이스 키를 추가합니다.
   *
   * <p>태그 집합의 TTL은 멤버 중 가장 긴 TTL 이상으로만 연장됩니다. 짧은 TTL 멤버가 나중에 추가되어도 긴 TTL 멤버가 태그 색인에서 빠지지
   * 않습니다.
   */
  public void setWithTags(String key, Object value, long ttlSeconds, Set<String> tags) {
    Optional<RemoteWrite> encoded = encode(key, value, ttlSeconds);
    if (encoded.isEmpty()) {
      return;
    }
    call(
        "setWithTags",
        key,
        s -> {
          s.writeAll(List.of(encoded.get()));
          for (String tag : tags) {
            s.addToSet(tagKey(tag), List.of(plainKey(key)), encoded.get().ttl());
          }
          return null;
        },
        null);
  }

  public void invalidate(String key) {
    call("invalidate", key, s -> s.delete(List.of(plainKey(key), gzKey(key))), 0L);
  }

  /**
   * 태그 집합의 모든 멤버 키(일반/압축 변형)와 태그 집합 자체를 삭제합니다.
   *
   * @return 태그에 속해 있던 키 수
   */
  public int invalidateTag(String tag) {
    return call(
        "invalidateTag",
        tag,
        s -> {
          Set<String> members = s.members(tagKey(tag));
          List<String> doomed = new ArrayList<>(members.size() * 2 + 1);
          for (String member : members) {
            doomed.add(member);
            doomed.add(member + COMPRESSED_SUFFIX);
          }
          doomed.add(tagKey(tag));
          s.delete(doomed);
          return members.size();
        },
        0);
  }

  /**
   * 단일 multi-get으로 여러 키를 조회합니다.
   *
   * @return 입력 순서를 보존한 결과, 없는 키는 {@link Optional#empty()}
   */
  public <T> List<Optional<T>> getMany(List<String> keys, JavaType type) {
    if (keys.isEmpty()) {
      return List.of();
    }
    List<String> physical = new ArrayList<>(keys.size() * 2);
    for (String key : keys) {
      physical.add(gzKey(key));
      physical.add(plainKey(key));
    }
    Map<String, String> raw = call("getMany", keys.size() + " keys", s -> s.getAll(physical), Map.of());

    List<Optional<T>> results = new ArrayList<>(keys.size());
    for (String key : keys) {
      results.add(decode(key, raw.get(gzKey(key)), raw.get(plainKey(key)), type));
    }
    return results;
  }

  /** 단일 파이프라인으로 여러 키를 저장합니다. 직렬화에 실패한 항목만 건너뜁니다. */
  public void setMany(Collection<CacheWrite> writes) {
    List<RemoteWrite> encoded = new ArrayList<>(writes.size());
    for (CacheWrite write : writes) {
      encode(write.key(), write.value(), write.ttlSeconds()).ifPresent(encoded::add);
    }
    if (encoded.isEmpty()) {
      return;
    }
    call(
        "setMany",
        encoded.size() + " keys",
        s -> {
          s.writeAll(encoded);
          return null;
        },
        null);
  }

  /** 네임스페이스 아래의 모든 키(태그 집합 포함) 삭제 */
  public long clear() {
    return call("clear", prefix, s -> s.deleteByPrefix(prefix), 0L);
  }

  /** 네임스페이스 아래의 키 수 (태그 집합 제외) */
  public long size() {
    return call(
        "size",
        prefix,
        s -> s.countByPrefix(prefix) - s.countByPrefix(prefix + TAG_SEGMENT),
        0L);
  }

  public boolean ping() {
    return call("ping", "", RemoteKeyValueStore::ping, false);
  }

  public SharedCacheStats getStats() {
    RedisTelemetry telemetry = call("info", "", s -> toTelemetry(s.info()), null);
    SharedCacheBackoff.State state = backoff.snapshot();
    return new SharedCacheStats(
        connectionState(),
        telemetry,
        new CompressionStats(compressedCount.get(), bytesSaved.get(), compressionThreshold),
        state.failureCount(),
        state.disabledUntil());
  }

  /** 연결 종료. 다음 연산이 새 연결을 시도합니다. */
  @Override
  public void close() {
    synchronized (connectLock) {
      if (store != null) {
        store.close();
        store = null;
      }
    }
  }

  String plainKey(String key) {
    return prefix + key;
  }

  String gzKey(String key) {
    return prefix + key + COMPRESSED_SUFFIX;
  }

  String tagKey(String tag) {
    return prefix + TAG_SEGMENT + tag;
  }

  private String connectionState() {
    if (backoff.isBackedOff()) {
      return "backed-off";
    }
    return store != null ? "connected" : "idle";
  }

  /**
   * 원격 연산 템플릿: 백오프 확인 → Lazy 연결 → 실행 → 성공 시 백오프 초기화
   *
   * <p>실패는 백오프에 반영하고 fallback을 반환합니다.
   */
  private <T> T call(String operation, String key, StoreCall<T> action, T fallback) {
    if (backoff.isBackedOff()) {
      skippedCounter.increment();
      return fallback;
    }
    return executor.executeOrCatch(
        () -> {
          T result = action.apply(connectedStore());
          backoff.recordSuccess();
          return result;
        },
        e -> onFailure(operation, e, fallback),
        TaskContext.of(COMPONENT, operation, key));
  }

  private <T> T onFailure(String operation, Throwable e, T fallback) {
    Instant disabledUntil = backoff.recordFailure();
    failureCounter.increment();
    log.warn(
        "[SharedCache] {} 실패, {}까지 원격 연산을 건너뜁니다 (memory-only): {}",
        operation,
        disabledUntil,
        rootMessage(e));
    return fallback;
  }

  /** 연결 실패는 {@code CacheBackendException}으로 번역되어 {@link #call}의 복구 경로로 전달됩니다. */
  private RemoteKeyValueStore connectedStore() {
    RemoteKeyValueStore current = store;
    if (current != null) {
      return current;
    }
    synchronized (connectLock) {
      if (store == null) {
        store =
            executor.executeWithTranslation(
                connector::connect,
                ExceptionTranslator.forCache(),
                TaskContext.of(COMPONENT, "connect", prefix));
        log.info("[SharedCache] 원격 저장소 연결 완료 (prefix: {})", prefix);
      }
      return store;
    }
  }

  private Optional<RemoteWrite> encode(String key, Object value, long ttlSeconds) {
    Duration ttl = Duration.ofSeconds(Math.max(1L, ttlSeconds));
    return executor.executeOrCatch(
        () -> {
          byte[] json = objectMapper.writeValueAsBytes(value);
          if (json.length > compressionThreshold) {
            String compressed = GzipUtils.compressToBase64(json);
            compressedCount.incrementAndGet();
            bytesSaved.addAndGet(Math.max(0L, json.length - (long) compressed.length()));
            return Optional.of(new RemoteWrite(gzKey(key), compressed, ttl, plainKey(key)));
          }
          String plain = new String(json, StandardCharsets.UTF_8);
          return Optional.of(new RemoteWrite(plainKey(key), plain, ttl, gzKey(key)));
        },
        e -> {
          log.warn("[SharedCache] 직렬화 실패로 저장 생략 (key: {}): {}", key, rootMessage(e));
          return Optional.empty();
        },
        TaskContext.of(COMPONENT, "encode", key));
  }

  private <T> Optional<T> decode(String key, String compressed, String plain, JavaType type) {
    if (compressed == null && plain == null) {
      return Optional.empty();
    }
    return executor.executeOrCatch(
        () -> {
          if (compressed != null) {
            T value = objectMapper.readValue(GzipUtils.decompressFromBase64(compressed), type);
            return Optional.ofNullable(value);
          }
          T value = objectMapper.readValue(plain, type);
          return Optional.ofNullable(value);
        },
        e -> {
          log.warn("[SharedCache] 역직렬화 실패, miss 처리 (key: {}): {}", key, rootMessage(e));
          return Optional.empty();
        },
        TaskContext.of(COMPONENT, "decode", key));
  }

  private RedisTelemetry toTelemetry(Map<String, String> info) {
    return new RedisTelemetry(
        parseLong(info, "used_memory"),
        parseLong(info, "maxmemory"),
        parseLong(info, "evicted_keys"),
        parseLong(info, "connected_clients"),
        parseLong(info, "uptime_in_seconds"));
  }

  private long parseLong(Map<String, String> info, String field) {
    String value = info.get(field);
    if (value == null || value.isBlank()) {
      return 0L;
    }
    return executor.executeOrDefault(
        () -> Long.parseLong(value.trim()), 0L, TaskContext.of(COMPONENT, "parseInfo", field));
  }

  private static String rootMessage(Throwable e) {
    Throwable root = e;
    while (root.getCause() != null && root.getCause() != root) {
      root = root.getCause();
    }
    return root.getClass().getSimpleName() + ": " + root.getMessage();
  }

  @FunctionalInterface
  private interface StoreCall<T> {
    T apply(RemoteKeyValueStore store) throws Exception;
  }
}
