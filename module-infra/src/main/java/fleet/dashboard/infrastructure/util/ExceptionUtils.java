package fleet.dashboard.infrastructure.util;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Exception unwrapping utilities.
 *
 * <p>Extracts root causes from wrapped exceptions like CompletionException and ExecutionException.
 */
public final class ExceptionUtils {

  /**
   * Unwrap async exception wrappers to find the root cause.
   *
   * @param throwable The exception to unwrap
   * @return The root cause, or the original if not wrapped
   */
  public static Throwable unwrapAsyncException(Throwable throwable) {
    Throwable cause = throwable;
    while (cause instanceof CompletionException || cause instanceof ExecutionException) {
      cause = cause.getCause();
      if (cause == null) {
        return throwable;
      }
    }
    return cause;
  }

  /**
   * Rethrow a throwable without checked-exception wrapping when possible.
   *
   * <p>RuntimeException and Error are rethrown as is; checked exceptions are wrapped in a
   * CompletionException so callers can unwrap with {@link #unwrapAsyncException}.
   */
  public static RuntimeException propagate(Throwable throwable) {
    if (throwable instanceof RuntimeException re) {
      return re;
    }
    if (throwable instanceof Error error) {
      throw error;
    }
    return new CompletionException(throwable);
  }

  private ExceptionUtils() {
    // Utility class
  }
}
