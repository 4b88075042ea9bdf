package fleet.dashboard.infrastructure.executor;

import fleet.dashboard.infrastructure.executor.strategy.ExceptionTranslator;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.function.Function;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * LogicExecutor 기본 구현체
 *
 * <ul>
 *   <li>Checked Exception → 번역기가 고른 Runtime Exception
 *   <li>{@code logic.executor} 타이머: component/operation/result(+exception) 태그만 사용. 캐시 키나 요청 경로는 로그에만 남김
 *   <li>Error(OOM 등)는 캐치하지 않고 상위로 전파
 * </ul>
 */
@Slf4j
@RequiredArgsConstructor
public class DefaultLogicExecutor implements LogicExecutor {

  private static final String METRIC_NAME = "logic.executor";

  private final MeterRegistry meterRegistry;
  private final ExceptionTranslator defaultTranslator;

  public DefaultLogicExecutor(MeterRegistry meterRegistry) {
    this(meterRegistry, ExceptionTranslator.defaultTranslator());
  }

  @Override
  public <T> T executeOrDefault(Callable<T> task, T defaultValue, TaskContext context) {
    return executeOrCatch(task, e -> defaultValue, context);
  }

  @Override
  public <T> T executeOrCatch(
      Callable<T> task, Function<Throwable, T> recovery, TaskContext context) {
    Objects.requireNonNull(recovery, "recovery");
    try {
      return executeWithMetrics(task, context, defaultTranslator);
    } catch (RuntimeException e) {
      log.debug("[{}] 예외 발생, 복구 로직 실행: {}", context.toTaskName(), e.getMessage());
      return recovery.apply(e);
    }
  }

  @Override
  public <T> T executeWithTranslation(
      Callable<T> task, ExceptionTranslator translator, TaskContext context) {
    Objects.requireNonNull(translator, "translator");
    return executeWithMetrics(task, context, translator);
  }

  private <T> T executeWithMetrics(
      Callable<T> task, TaskContext context, ExceptionTranslator translator) {
    Objects.requireNonNull(task, "task");
    Objects.requireNonNull(context, "context");
    Timer.Sample sample = Timer.start(meterRegistry);

    try {
      T result = task.call();
      sample.stop(
          Timer.builder(METRIC_NAME).tags(context.metricTags("success")).register(meterRegistry));
      return result;
    } catch (Exception e) {
      sample.stop(
          Timer.builder(METRIC_NAME)
              .tags(context.metricTags("failure"))
              .tag("exception", e.getClass().getSimpleName())
              .register(meterRegistry));
      throw translator.translate(e, context);
    }
  }
}
