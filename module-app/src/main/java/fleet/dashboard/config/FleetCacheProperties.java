package fleet.dashboard.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * 캐시 계층 설정 프로퍼티
 *
 * <p>application.yml에서 다음과 같이 설정:
 *
 * <pre>
 * fleet:
 *   cache:
 *     enabled: ${CACHE_ENABLED:true}
 *     stale-fraction: 0.8
 *     compression-threshold-bytes: 10000
 *     backfill-ttl-seconds: 60
 *     redis:
 *       url: ${REDIS_URL:}
 *       password: ${REDIS_PASSWORD:}
 *       key-prefix: ${REDIS_KEY_PREFIX:aidash:cache:}
 *     backoff:
 *       base-delay-ms: 2000
 *       max-delay-ms: 300000
 * </pre>
 *
 * <h4>백엔드 결정</h4>
 *
 * <ul>
 *   <li>{@code enabled=false}: 캐시 없이 매번 원본 조회 (disabled)
 *   <li>{@code redis.url} 미설정: 로컬 메모리만 사용 (memory-only)
 *   <li>{@code redis.url} 설정: 로컬 + Redis (multi-layer)
 * </ul>
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "fleet.cache")
public class FleetCacheProperties {

  private boolean enabled = true;

  /** TTL 중 이 비율이 지나면 stale (SWR 재검증 대상) */
  @DecimalMin("0.0")
  @DecimalMax("1.0")
  private double staleFraction = 0.8;

  /** 직렬화 결과가 이 크기(바이트)를 넘으면 gzip 압축 후 저장 */
  @Min(1)
  private int compressionThresholdBytes = 10_000;

  /** TTL을 모르는 단건 조회(get/getMany)에서 L2 hit를 L1에 채울 때 사용하는 TTL */
  @Min(1)
  private long backfillTtlSeconds = 60;

  @Valid private Redis redis = new Redis();

  @Valid private Backoff backoff = new Backoff();

  @Getter
  @Setter
  public static class Redis {

    private String url;

    private String password;

    @NotBlank private String keyPrefix = "aidash:cache:";

    @Min(100)
    private int connectTimeoutMs = 5_000;

    @Min(100)
    private int timeoutMs = 3_000;
  }

  @Getter
  @Setter
  public static class Backoff {

    @Min(1)
    private long baseDelayMs = 2_000;

    @Min(1)
    private long maxDelayMs = 300_000;
  }
}
