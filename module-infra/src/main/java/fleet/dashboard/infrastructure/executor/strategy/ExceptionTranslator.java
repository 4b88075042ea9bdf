package fleet.dashboard.infrastructure.executor.strategy;

import com.fasterxml.jackson.core.JsonProcessingException;
import fleet.dashboard.error.exception.CacheBackendException;
import fleet.dashboard.error.exception.DataProcessingException;
import fleet.dashboard.error.exception.InternalSystemException;
import fleet.dashboard.error.exception.base.BaseException;
import fleet.dashboard.infrastructure.executor.TaskContext;
import fleet.dashboard.infrastructure.util.ExceptionUtils;
import java.io.IOException;

/**
 * 특정 예외를 도메인 예외로 변환하는 전략
 *
 * <h3>P0 정책: Error 격리</h3>
 *
 * <ul>
 *   <li>{@link Error}(OOM, StackOverflow 등)는 절대 변환하지 않고 그대로 throw
 *   <li>{@link BaseException}은 그대로 pass-through
 *   <li>원본 예외를 cause로 보존하여 스택 트레이스 유지
 * </ul>
 *
 * <h4>사용 예시</h4>
 *
 * <pre>{@code
 * return executor.executeWithTranslation(
 *     () -> objectMapper.readValue(body, type),
 *     ExceptionTranslator.forJson(),
 *     TaskContext.of("Portainer", "decode", path));
 * }</pre>
 */
@FunctionalInterface
public interface ExceptionTranslator {

  /**
   * 예외를 변환하여 반환
   *
   * @param e 원본 예외
   * @param context 작업 컨텍스트 (메시지 구성용)
   * @return 변환된 RuntimeException
   * @throws Error Error 타입은 변환하지 않고 그대로 throw
   */
  RuntimeException translate(Throwable e, TaskContext context);

  /** JSON/I/O 예외 → {@link DataProcessingException} */
  static ExceptionTranslator forJson() {
    return withErrorGuardAndUnwrap(
        (e, context) -> {
          if (e instanceof JsonProcessingException || e instanceof IOException) {
            return new DataProcessingException(context.toTaskName(), e);
          }
          return passThroughOrWrap(e, context);
        });
  }

  /** 공유 캐시 백엔드 예외 → {@link CacheBackendException} */
  static ExceptionTranslator forCache() {
    return withErrorGuardAndUnwrap(
        (e, context) -> {
          if (e instanceof CacheBackendException cbe) {
            return cbe;
          }
          return new CacheBackendException(context.toTaskName(), e);
        });
  }

  /** BaseException은 그대로, 그 외는 {@link InternalSystemException} */
  static ExceptionTranslator defaultTranslator() {
    return withErrorGuardAndUnwrap(ExceptionTranslator::passThroughOrWrap);
  }

  private static RuntimeException passThroughOrWrap(Throwable e, TaskContext context) {
    if (e instanceof BaseException be) {
      return be;
    }
    return new InternalSystemException(context.toTaskName(), e);
  }

  /** Error 격리 + CompletionException/ExecutionException 언래핑을 공통 적용 */
  private static ExceptionTranslator withErrorGuardAndUnwrap(ExceptionTranslator delegate) {
    return (e, context) -> {
      Throwable cause = ExceptionUtils.unwrapAsyncException(e);
      if (cause instanceof Error error) {
        throw error;
      }
      if (cause instanceof InterruptedException) {
        Thread.currentThread().interrupt();
      }
      return delegate.translate(cause, context);
    };
  }
}
