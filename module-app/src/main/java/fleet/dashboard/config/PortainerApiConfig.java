package fleet.dashboard.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import fleet.dashboard.infrastructure.executor.LogicExecutor;
import fleet.dashboard.infrastructure.external.PortainerApiClient;
import fleet.dashboard.infrastructure.external.ResilientPortainerClient;
import fleet.dashboard.infrastructure.external.transport.PortainerTransport;
import fleet.dashboard.infrastructure.external.transport.WebClientPortainerTransport;
import fleet.dashboard.infrastructure.resilience.breaker.PartitionedCircuitBreakerRegistry;
import io.github.resilience4j.bulkhead.Bulkhead;
import io.github.resilience4j.bulkhead.BulkheadConfig;
import io.github.resilience4j.retry.Retry;
import io.netty.channel.ChannelOption;
import java.time.Clock;
import java.time.Duration;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;
import reactor.netty.resources.ConnectionProvider;

/**
 * Portainer API 클라이언트 구성
 *
 * <p>타임아웃/한도 계층:
 *
 * <ul>
 *   <li>ConnectionProvider: 커넥션 풀 크기 (max-connections)
 *   <li>Bulkhead: 동시 요청 수 (concurrency), 대기 한도 = 요청 타임아웃
 *   <li>요청 타임아웃: 기본 timeout-ms, stats 조회는 stats-timeout-ms
 * </ul>
 *
 * @see PortainerApiProperties
 */
@Configuration
@RequiredArgsConstructor
public class PortainerApiConfig {

  static final String CLIENT_NAME = "portainer-api";
  private static final int CONNECT_TIMEOUT_MS = 5_000;
  private static final int MAX_IN_MEMORY_BYTES = 32 * 1024 * 1024;

  private final PortainerApiProperties properties;

  @Bean("portainerWebClient")
  public WebClient portainerWebClient(WebClient.Builder builder) {
    ConnectionProvider provider =
        ConnectionProvider.builder(CLIENT_NAME)
            .maxConnections(properties.getMaxConnections())
            .pendingAcquireTimeout(properties.timeout())
            .maxIdleTime(Duration.ofSeconds(30))
            .build();

    HttpClient httpClient =
        HttpClient.create(provider)
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, CONNECT_TIMEOUT_MS)
            .responseTimeout(properties.timeout())
            .compress(true);

    // 로그/아카이브 응답은 기본 버퍼 한도(256KB)를 넘을 수 있음
    return builder
        .clone()
        .clientConnector(new ReactorClientHttpConnector(httpClient))
        .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(MAX_IN_MEMORY_BYTES))
        .build();
  }

  @Bean
  public PortainerTransport portainerTransport(WebClient portainerWebClient) {
    return new WebClientPortainerTransport(
        portainerWebClient, properties.getUrl(), properties.getApiKey(), properties.timeout());
  }

  @Bean
  public Bulkhead portainerBulkhead() {
    return Bulkhead.of(
        CLIENT_NAME,
        BulkheadConfig.custom()
            .maxConcurrentCalls(properties.getConcurrency())
            .maxWaitDuration(properties.timeout())
            .build());
  }

  @Bean
  public Retry portainerRetry() {
    return Retry.of(
        CLIENT_NAME,
        ResilientPortainerClient.retryConfig(
            properties.getRetries(), Duration.ofMillis(properties.getRetryBaseDelayMs())));
  }

  @Bean
  public PartitionedCircuitBreakerRegistry portainerCircuitBreakers(Clock clock) {
    PortainerApiProperties.CircuitBreaker breaker = properties.getCircuitBreaker();
    return new PartitionedCircuitBreakerRegistry(
        CLIENT_NAME,
        breaker.getFailureThreshold(),
        Duration.ofMillis(breaker.getResetTimeoutMs()),
        ResilientPortainerClient::isBreakerFailure,
        clock);
  }

  @Bean
  public ResilientPortainerClient resilientPortainerClient(
      PortainerTransport portainerTransport,
      Bulkhead portainerBulkhead,
      PartitionedCircuitBreakerRegistry portainerCircuitBreakers,
      Retry portainerRetry,
      ObjectMapper objectMapper,
      LogicExecutor logicExecutor) {
    return new ResilientPortainerClient(
        portainerTransport,
        portainerBulkhead,
        portainerCircuitBreakers,
        portainerRetry,
        objectMapper,
        logicExecutor);
  }

  @Bean
  public PortainerApiClient portainerApiClient(ResilientPortainerClient resilientPortainerClient) {
    return new PortainerApiClient(resilientPortainerClient, properties.statsTimeout());
  }
}
