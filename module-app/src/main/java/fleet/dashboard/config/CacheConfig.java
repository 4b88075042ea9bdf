package fleet.dashboard.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import fleet.dashboard.infrastructure.cache.local.LocalTtlStore;
import fleet.dashboard.infrastructure.cache.orchestrator.CacheOrchestrator;
import fleet.dashboard.infrastructure.cache.orchestrator.InFlightRegistry;
import fleet.dashboard.infrastructure.cache.orchestrator.PassThroughCacheOrchestrator;
import fleet.dashboard.infrastructure.cache.orchestrator.TieredCacheOrchestrator;
import fleet.dashboard.infrastructure.cache.shared.RedissonStoreConnector;
import fleet.dashboard.infrastructure.cache.shared.SharedCacheAdapter;
import fleet.dashboard.infrastructure.cache.shared.SharedCacheBackoff;
import fleet.dashboard.infrastructure.executor.LogicExecutor;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.util.concurrent.Executor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 캐시 계층 빈 구성
 *
 * <ul>
 *   <li>{@code fleet.cache.enabled=false}: {@link PassThroughCacheOrchestrator}
 *   <li>그 외: {@link TieredCacheOrchestrator} (REDIS_URL이 있으면 {@link SharedCacheAdapter} 포함)
 * </ul>
 *
 * <p>Redis 연결은 첫 캐시 연산 시점에 수립되므로, Redis가 내려가 있어도 애플리케이션 기동은 실패하지 않습니다.
 */
@Slf4j
@Configuration
public class CacheConfig {

  @Bean
  public LocalTtlStore localTtlStore(FleetCacheProperties properties, Clock clock) {
    return new LocalTtlStore(clock, properties.getStaleFraction());
  }

  @Bean
  public InFlightRegistry inFlightRegistry() {
    return new InFlightRegistry();
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnExpression(
      "${fleet.cache.enabled:true} && '${fleet.cache.redis.url:}'.trim().length() > 0")
  public SharedCacheAdapter sharedCacheAdapter(
      FleetCacheProperties properties,
      ObjectMapper objectMapper,
      LogicExecutor logicExecutor,
      MeterRegistry meterRegistry,
      Clock clock) {
    FleetCacheProperties.Redis redis = properties.getRedis();
    FleetCacheProperties.Backoff backoff = properties.getBackoff();
    return new SharedCacheAdapter(
        new RedissonStoreConnector(
            redis.getUrl(), redis.getPassword(), redis.getConnectTimeoutMs(), redis.getTimeoutMs()),
        objectMapper,
        logicExecutor,
        new SharedCacheBackoff(clock, backoff.getBaseDelayMs(), backoff.getMaxDelayMs()),
        meterRegistry,
        redis.getKeyPrefix(),
        properties.getCompressionThresholdBytes());
  }

  @Bean
  @ConditionalOnProperty(
      prefix = "fleet.cache",
      name = "enabled",
      havingValue = "true",
      matchIfMissing = true)
  public CacheOrchestrator tieredCacheOrchestrator(
      FleetCacheProperties properties,
      LocalTtlStore localTtlStore,
      ObjectProvider<SharedCacheAdapter> sharedCacheAdapter,
      InFlightRegistry inFlightRegistry,
      @Qualifier("cacheFetchExecutor") Executor fetchExecutor,
      @Qualifier("cacheRevalidateExecutor") Executor revalidateExecutor,
      MeterRegistry meterRegistry,
      Clock clock) {
    SharedCacheAdapter shared = sharedCacheAdapter.getIfAvailable();
    log.info("[Cache] 캐시 백엔드: {}", shared == null ? "memory-only" : "multi-layer");
    return new TieredCacheOrchestrator(
        localTtlStore,
        shared,
        inFlightRegistry,
        fetchExecutor,
        revalidateExecutor,
        meterRegistry,
        properties.getBackfillTtlSeconds(),
        clock);
  }

  @Bean
  @ConditionalOnProperty(prefix = "fleet.cache", name = "enabled", havingValue = "false")
  public CacheOrchestrator passThroughCacheOrchestrator(
      @Qualifier("cacheFetchExecutor") Executor fetchExecutor) {
    log.info("[Cache] 캐시 비활성화: 모든 조회가 원본으로 전달됩니다");
    return new PassThroughCacheOrchestrator(fetchExecutor);
  }
}
