package fleet.dashboard.infrastructure.executor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import fleet.dashboard.error.exception.CacheBackendException;
import fleet.dashboard.error.exception.DataProcessingException;
import fleet.dashboard.error.exception.InternalSystemException;
import fleet.dashboard.error.exception.InvalidInputException;
import fleet.dashboard.infrastructure.executor.strategy.ExceptionTranslator;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.IOException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
@DisplayName("DefaultLogicExecutor 단위 테스트")
class DefaultLogicExecutorTest {

  private SimpleMeterRegistry meterRegistry;
  private LogicExecutor executor;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    executor = new DefaultLogicExecutor(meterRegistry);
  }

  private static final ExceptionTranslator DEFAULT = ExceptionTranslator.defaultTranslator();

  @Nested
  @DisplayName("executeWithTranslation")
  class Translation {

    @Test
    @DisplayName("성공 시 결과 반환 및 success 타이머 기록")
    void success() {
      // Given
      TaskContext context = TaskContext.of("SharedCache", "get", "containers:3");

      // When
      String result = executor.executeWithTranslation(() -> "ok", DEFAULT, context);

      // Then
      assertThat(result).isEqualTo("ok");
      assertThat(
              meterRegistry
                  .find("logic.executor")
                  .tags("component", "SharedCache", "operation", "get", "result", "success")
                  .timer())
          .isNotNull()
          .satisfies(t -> assertThat(t.count()).isEqualTo(1));
    }

    @Test
    @DisplayName("BaseException은 그대로 전파")
    void baseExceptionPassesThrough() {
      InvalidInputException original = new InvalidInputException("containerId=..");

      assertThatThrownBy(
              () ->
                  executor.executeWithTranslation(
                      () -> {
                        throw original;
                      },
                      DEFAULT,
                      TaskContext.of("Portainer", "request")))
          .isSameAs(original);
    }

    @Test
    @DisplayName("Checked 예외는 InternalSystemException으로 래핑, 동적 값은 메트릭 태그에서 제외")
    void checkedIsWrapped() {
      IOException cause = new IOException("boom");

      assertThatThrownBy(
              () ->
                  executor.executeWithTranslation(
                      () -> {
                        throw cause;
                      },
                      DEFAULT,
                      TaskContext.of("SharedCache", "get", "containers:3")))
          .isInstanceOf(InternalSystemException.class)
          .hasCause(cause);

      assertThat(
              meterRegistry
                  .find("logic.executor")
                  .tags("result", "failure", "exception", "IOException")
                  .timer())
          .isNotNull()
          .satisfies(t -> assertThat(t.getId().getTag("key")).isNull());
    }

    @Test
    @DisplayName("CompletionException은 언래핑 후 번역")
    void completionExceptionIsUnwrapped() {
      InvalidInputException root = new InvalidInputException("x");

      assertThatThrownBy(
              () ->
                  executor.executeWithTranslation(
                      () -> {
                        throw new CompletionException(root);
                      },
                      DEFAULT,
                      TaskContext.of("Orchestrator", "fetch")))
          .isSameAs(root);
    }

    @Test
    @DisplayName("Error는 번역하지 않고 그대로 전파")
    void errorIsNotTranslated() {
      assertThatThrownBy(
              () ->
                  executor.executeWithTranslation(
                      () -> {
                        throw new StackOverflowError();
                      },
                      DEFAULT,
                      TaskContext.of("Orchestrator", "fetch")))
          .isInstanceOf(StackOverflowError.class);
    }
  }

  @Nested
  @DisplayName("복구/기본값")
  class Recovery {

    @Test
    @DisplayName("executeOrDefault: 실패 시 기본값")
    void orDefault() {
      Integer result =
          executor.executeOrDefault(
              () -> {
                throw new IOException("down");
              },
              -1,
              TaskContext.of("SharedCache", "size"));

      assertThat(result).isEqualTo(-1);
    }

    @Test
    @DisplayName("executeOrCatch: 번역된 예외가 복구 함수로 전달")
    void orCatchReceivesTranslated() {
      AtomicReference<Throwable> received = new AtomicReference<>();

      String result =
          executor.executeOrCatch(
              () -> {
                throw new IOException("down");
              },
              e -> {
                received.set(e);
                return "fallback";
              },
              TaskContext.of("SharedCache", "get"));

      assertThat(result).isEqualTo("fallback");
      assertThat(received.get()).isInstanceOf(InternalSystemException.class);
    }

    @Test
    @DisplayName("executeOrCatch: Error는 복구 대상이 아님")
    void orCatchDoesNotRecoverError() {
      assertThatThrownBy(
              () ->
                  executor.executeOrCatch(
                      () -> {
                        throw new OutOfMemoryError("oom");
                      },
                      e -> "fallback",
                      TaskContext.of("SharedCache", "get")))
          .isInstanceOf(OutOfMemoryError.class);
    }
  }

  @Nested
  @DisplayName("도메인 번역기")
  class Translators {

    @Test
    @DisplayName("forJson: I/O 예외 → DataProcessingException")
    void jsonTranslator() {
      assertThatThrownBy(
              () ->
                  executor.executeWithTranslation(
                      () -> {
                        throw new IOException("bad json");
                      },
                      ExceptionTranslator.forJson(),
                      TaskContext.of("Portainer", "decode", "/api/endpoints")))
          .isInstanceOf(DataProcessingException.class);
    }

    @Test
    @DisplayName("forCache: 모든 예외 → CacheBackendException")
    void cacheTranslator() {
      assertThatThrownBy(
              () ->
                  executor.executeWithTranslation(
                      () -> {
                        throw new IllegalStateException("connection reset");
                      },
                      ExceptionTranslator.forCache(),
                      TaskContext.of("SharedCache", "set")))
          .isInstanceOf(CacheBackendException.class)
          .hasCauseInstanceOf(IllegalStateException.class);
    }
  }
}
