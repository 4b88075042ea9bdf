package fleet.dashboard.config;

import fleet.dashboard.infrastructure.executor.DefaultLogicExecutor;
import fleet.dashboard.infrastructure.executor.LogicExecutor;
import fleet.dashboard.infrastructure.executor.strategy.ExceptionTranslator;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.binder.jvm.ExecutorServiceMetrics;
import java.time.Clock;
import java.util.concurrent.ThreadPoolExecutor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * 실행 인프라 설정
 *
 * <h4>책임</h4>
 *
 * <ul>
 *   <li><b>LogicExecutor</b>: 예외 번역 + {@code logic.executor} 메트릭
 *   <li><b>cacheFetchExecutor</b>: read-through miss 시 fetcher 실행
 *   <li><b>cacheRevalidateExecutor</b>: SWR 백그라운드 재검증 (best-effort)
 *   <li><b>Clock</b>: 로컬 저장소, 백오프, 브레이커가 공유하는 단일 시간원
 * </ul>
 */
@Slf4j
@Configuration
public class ExecutorConfig {

  @Bean
  @ConditionalOnMissingBean(Clock.class)
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  @ConditionalOnMissingBean(LogicExecutor.class)
  public LogicExecutor logicExecutor(MeterRegistry meterRegistry) {
    return new DefaultLogicExecutor(meterRegistry, ExceptionTranslator.defaultTranslator());
  }

  /**
   * Read-through fetch 전용 Executor
   *
   * <p>호출자가 결과를 기다리므로 포화 시 CallerRunsPolicy로 호출 스레드에서 실행합니다. 큐가 넘쳐도 요청이 실패하지 않습니다.
   */
  @Bean(name = "cacheFetchExecutor")
  public ThreadPoolTaskExecutor cacheFetchExecutor(MeterRegistry meterRegistry) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(8);
    executor.setMaxPoolSize(32);
    executor.setQueueCapacity(500);
    executor.setThreadNamePrefix("cache-fetch-");
    executor.setAllowCoreThreadTimeOut(true);
    executor.setKeepAliveSeconds(30);
    executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationSeconds(20);
    executor.initialize();

    registerMetrics(executor, "cache.fetch", meterRegistry);
    return executor;
  }

  /**
   * SWR 재검증 전용 Executor
   *
   * <p>재검증은 부가 작업이므로 포화 시 AbortPolicy로 버립니다. 거절은 재검증 실패로 집계되고 stale 값은 그대로 유지됩니다.
   */
  @Bean(name = "cacheRevalidateExecutor")
  public ThreadPoolTaskExecutor cacheRevalidateExecutor(MeterRegistry meterRegistry) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(2);
    executor.setMaxPoolSize(4);
    executor.setQueueCapacity(100);
    executor.setThreadNamePrefix("cache-revalidate-");
    executor.setAllowCoreThreadTimeOut(true);
    executor.setKeepAliveSeconds(30);
    executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
    executor.setWaitForTasksToCompleteOnShutdown(false);
    executor.initialize();

    registerMetrics(executor, "cache.revalidate", meterRegistry);
    return executor;
  }

  private static void registerMetrics(
      ThreadPoolTaskExecutor executor, String name, MeterRegistry meterRegistry) {
    new ExecutorServiceMetrics(executor.getThreadPoolExecutor(), name, Tags.empty())
        .bindTo(meterRegistry);
    log.info(
        "[Executor] {} 초기화: core={}, max={}, queue={}",
        name,
        executor.getCorePoolSize(),
        executor.getMaxPoolSize(),
        executor.getQueueCapacity());
  }
}
