package fleet.dashboard.config;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import fleet.dashboard.infrastructure.cache.orchestrator.CacheOrchestrator;
import fleet.dashboard.infrastructure.cache.orchestrator.PassThroughCacheOrchestrator;
import fleet.dashboard.infrastructure.cache.orchestrator.TieredCacheOrchestrator;
import fleet.dashboard.infrastructure.cache.shared.SharedCacheAdapter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

/** 설정값에 따른 캐시 백엔드 선택 검증 */
@Tag("unit")
@DisplayName("CacheConfig 백엔드 선택")
class CacheConfigTest {

  @Configuration
  @EnableConfigurationProperties(FleetCacheProperties.class)
  static class PropertiesConfig {}

  private final ApplicationContextRunner runner =
      new ApplicationContextRunner()
          .withUserConfiguration(PropertiesConfig.class, ExecutorConfig.class, CacheConfig.class)
          .withBean(MeterRegistry.class, SimpleMeterRegistry::new)
          .withBean(ObjectMapper.class, ObjectMapper::new);

  @Test
  @DisplayName("REDIS_URL 없음 → memory-only")
  void memoryOnly() {
    runner.run(
        context -> {
          assertThat(context).hasSingleBean(CacheOrchestrator.class);
          assertThat(context).doesNotHaveBean(SharedCacheAdapter.class);
          assertThat(context.getBean(CacheOrchestrator.class))
              .isInstanceOf(TieredCacheOrchestrator.class);
          assertThat(context.getBean(CacheOrchestrator.class).getStats().backend())
              .isEqualTo("memory-only");
        });
  }

  @Test
  @DisplayName("REDIS_URL 있음 → 공유 캐시 어댑터 생성, 연결은 첫 연산까지 지연")
  void multiLayer() {
    runner
        .withPropertyValues(
            "fleet.cache.redis.url=redis://127.0.0.1:1", "fleet.cache.redis.key-prefix=test:")
        .run(
            context -> {
              assertThat(context).hasSingleBean(SharedCacheAdapter.class);
              assertThat(context.getBean(CacheOrchestrator.class))
                  .isInstanceOf(TieredCacheOrchestrator.class);
              assertThat(context.getBean(SharedCacheAdapter.class).isAvailable()).isTrue();
            });
  }

  @Test
  @DisplayName("CACHE_ENABLED=false → pass-through, REDIS_URL은 무시")
  void disabled() {
    runner
        .withPropertyValues("fleet.cache.enabled=false", "fleet.cache.redis.url=redis://cache:6379")
        .run(
            context -> {
              assertThat(context).doesNotHaveBean(SharedCacheAdapter.class);
              assertThat(context.getBean(CacheOrchestrator.class))
                  .isInstanceOf(PassThroughCacheOrchestrator.class);
              assertThat(context.getBean(CacheOrchestrator.class).getStats().backend())
                  .isEqualTo("disabled");
            });
  }

  @Test
  @DisplayName("잘못된 stale-fraction은 기동 실패")
  void invalidProperties() {
    runner
        .withPropertyValues("fleet.cache.stale-fraction=1.5")
        .run(context -> assertThat(context).hasFailed());
  }
}
