package fleet.dashboard.infrastructure.executor;

import io.micrometer.core.instrument.Tags;
import java.util.Objects;

/**
 * 실행 단위 식별자
 *
 * <p>{@code component}/{@code operation}은 메트릭 태그, {@code key}(캐시 키, 요청 경로)는 로그와 예외 메시지에만 사용합니다.
 * 예: {@code TaskContext.of("SharedCache", "get", "containers:3")} → {@code SharedCache:get:containers:3}
 */
public record TaskContext(String component, String operation, String key) {

  public TaskContext {
    Objects.requireNonNull(component, "component");
    Objects.requireNonNull(operation, "operation");
    key = key == null ? "" : key;
  }

  public static TaskContext of(String component, String operation, String key) {
    return new TaskContext(component, operation, key);
  }

  public static TaskContext of(String component, String operation) {
    return new TaskContext(component, operation, "");
  }

  /** 카디널리티가 고정된 타이머 태그 */
  Tags metricTags(String result) {
    return Tags.of("component", component, "operation", operation, "result", result);
  }

  public String toTaskName() {
    return key.isEmpty() ? component + ":" + operation : component + ":" + operation + ":" + key;
  }
}
