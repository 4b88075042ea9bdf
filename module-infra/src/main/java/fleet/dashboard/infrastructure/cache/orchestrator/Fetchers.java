package fleet.dashboard.infrastructure.cache.orchestrator;

import fleet.dashboard.error.exception.CacheLoadException;
import fleet.dashboard.infrastructure.util.ExceptionUtils;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/** fetcher 호출과 future 대기 시 예외 규격화 */
final class Fetchers {

  private Fetchers() {}

  /** Unchecked 예외는 그대로, Checked 예외는 {@link CacheLoadException}으로 감싸 전파 */
  static <T> T invoke(CacheFetchRequest<T> request) {
    try {
      return request.fetcher().call();
    } catch (RuntimeException e) {
      throw e;
    } catch (Exception e) {
      if (e instanceof InterruptedException) {
        Thread.currentThread().interrupt();
      }
      throw new CacheLoadException(request.key(), e);
    }
  }

  /** future 완료를 기다리고, 실패 시 fetcher가 던진 원래 예외를 다시 던집니다. */
  static <T> T await(CompletableFuture<T> future) {
    try {
      return future.join();
    } catch (CompletionException | CancellationException e) {
      throw ExceptionUtils.propagate(ExceptionUtils.unwrapAsyncException(e));
    }
  }

  /** 입력 순서대로 대기 */
  static <T> List<T> awaitAll(List<CompletableFuture<T>> futures) {
    return futures.stream().map(Fetchers::await).toList();
  }
}
