package fleet.dashboard.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Portainer API 클라이언트 설정 프로퍼티
 *
 * <pre>
 * fleet:
 *   portainer:
 *     url: ${PORTAINER_API_URL:http://localhost:9000}
 *     api-key: ${PORTAINER_API_KEY:}
 *     concurrency: 10
 *     max-connections: 20
 *     timeout-ms: 15000
 *     stats-timeout-ms: 10000
 *     retries: 3
 *     retry-base-delay-ms: 1000
 *     circuit-breaker:
 *       failure-threshold: 5
 *       reset-timeout-ms: 30000
 * </pre>
 *
 * <h4>호출 한도</h4>
 *
 * <p>동시 요청 수(concurrency)는 Bulkhead로, 커넥션 풀 크기(max-connections)는 Reactor Netty
 * ConnectionProvider로 제한합니다. Bulkhead 대기 한도는 요청 타임아웃과 같습니다.
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "fleet.portainer")
public class PortainerApiProperties {

  @NotBlank private String url = "http://localhost:9000";

  private String apiKey;

  @Min(1)
  private int concurrency = 10;

  @Min(1)
  private int maxConnections = 20;

  @Min(1)
  private long timeoutMs = 15_000;

  @Min(1)
  private long statsTimeoutMs = 10_000;

  @Min(0)
  private int retries = 3;

  @Min(1)
  private long retryBaseDelayMs = 1_000;

  @Valid private CircuitBreaker circuitBreaker = new CircuitBreaker();

  public Duration timeout() {
    return Duration.ofMillis(timeoutMs);
  }

  public Duration statsTimeout() {
    return Duration.ofMillis(statsTimeoutMs);
  }

  @Getter
  @Setter
  public static class CircuitBreaker {

    @Min(1)
    private int failureThreshold = 5;

    @Min(1)
    private long resetTimeoutMs = 30_000;
  }
}
