package fleet.dashboard.infrastructure.cache;

import java.util.Objects;

/** 배치 저장 단위 */
public record CacheWrite(String key, Object value, long ttlSeconds) {
  public CacheWrite {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(value, "value");
  }
}
