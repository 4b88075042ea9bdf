package fleet.dashboard.infrastructure.cache;

import java.util.StringJoiner;

/**
 * 논리 캐시 키 생성기
 *
 * <pre>
 * CacheKeys.of("containers", 3)        → "containers:3"
 * CacheKeys.of("stats", 3, "abc123")  → "stats:3:abc123"
 * </pre>
 */
public final class CacheKeys {

  private CacheKeys() {}

  public static String of(String resource, Object... parts) {
    StringJoiner joiner = new StringJoiner(":");
    joiner.add(resource);
    for (Object part : parts) {
      joiner.add(String.valueOf(part));
    }
    return joiner.toString();
  }

  /** 엔드포인트 단위 태그 (예: "endpoint-3") */
  public static String endpointTag(int endpointId) {
    return "endpoint-" + endpointId;
  }
}
