package fleet.dashboard.infrastructure.cache;

import java.time.Instant;
import java.util.Objects;
import java.util.Set;

/**
 * 로컬 캐시 엔트리
 *
 * <p>{@code staleAt = createdAt + ttl * staleFraction}, {@code expiresAt = createdAt + ttl}. 항상 {@code
 * staleAt <= expiresAt} 입니다.
 *
 * @param key 논리 키
 * @param data 저장된 값
 * @param createdAt 저장 시각
 * @param staleAt 이 시각 이후는 stale (재검증 대상)
 * @param expiresAt 이 시각 이후는 부재로 취급
 * @param tags 엔트리에 부여된 태그
 */
public record CacheEntry(
    String key,
    Object data,
    Instant createdAt,
    Instant staleAt,
    Instant expiresAt,
    Set<String> tags) {

  public CacheEntry {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(createdAt, "createdAt");
    Objects.requireNonNull(expiresAt, "expiresAt");
    if (staleAt == null || staleAt.isAfter(expiresAt)) {
      staleAt = expiresAt;
    }
    tags = tags == null ? Set.of() : Set.copyOf(tags);
  }

  /**
   * TTL과 stale 비율로 엔트리 생성
   *
   * @param staleFraction 0.0 ~ 1.0 범위로 보정됩니다
   */
  public static CacheEntry create(
      String key,
      Object data,
      long ttlSeconds,
      double staleFraction,
      Set<String> tags,
      Instant now) {
    long ttlMillis = Math.max(0L, ttlSeconds) * 1000L;
    double fraction = Math.min(1.0, Math.max(0.0, staleFraction));
    Instant staleAt = now.plusMillis((long) (ttlMillis * fraction));
    Instant expiresAt = now.plusMillis(ttlMillis);
    return new CacheEntry(key, data, now, staleAt, expiresAt, tags);
  }

  public boolean isExpired(Instant now) {
    return now.isAfter(expiresAt);
  }

  public boolean isStale(Instant now) {
    return now.isAfter(staleAt);
  }
}
