package fleet.dashboard.infrastructure.cache.orchestrator;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;

/**
 * 키별 단일 진행 중 작업 레지스트리 (Cache Stampede 방지)
 *
 * <h4>불변식</h4>
 *
 * <ul>
 *   <li>키당 진행 중 엔트리는 최대 1개: {@code putIfAbsent}로 leader를 결정
 *   <li>엔트리는 정산(성공/실패) 시 정확히 1회 제거: {@code remove(key, future)}로 자기 자신만 제거
 *   <li>정산 전에 합류한 모든 호출자는 같은 결과(또는 같은 예외)를 관찰
 * </ul>
 *
 * <p>호출자에게는 공유 future의 {@link CompletableFuture#copy() copy}를 돌려주므로, 호출자가 자신의 future를 취소해도 공유 작업은
 * 계속 진행됩니다.
 */
@Slf4j
public class InFlightRegistry {

  private final Map<String, CompletableFuture<Object>> inFlight = new ConcurrentHashMap<>();

  /**
   * 진행 중 작업이 있으면 합류하고, 없으면 {@code operation}을 시작합니다.
   *
   * @param key 캐시 키
   * @param operation leader만 호출하는 작업 시작 함수
   * @return 공유 결과의 호출자 전용 사본
   */
  @SuppressWarnings("unchecked")
  public <T> CompletableFuture<T> runOnce(String key, Supplier<CompletableFuture<T>> operation) {
    CompletableFuture<Object> shared = new CompletableFuture<>();
    CompletableFuture<Object> existing = inFlight.putIfAbsent(key, shared);
    if (existing != null) {
      log.debug("[InFlight] 진행 중 작업에 합류: {}", key);
      return (CompletableFuture<T>) existing.copy();
    }

    try {
      operation
          .get()
          .whenComplete(
              (value, error) -> {
                inFlight.remove(key, shared);
                if (error != null) {
                  shared.completeExceptionally(error);
                } else {
                  shared.complete(value);
                }
              });
    } catch (RuntimeException | Error e) {
      inFlight.remove(key, shared);
      shared.completeExceptionally(e);
    }
    return (CompletableFuture<T>) shared.copy();
  }

  public boolean isInFlight(String key) {
    return inFlight.containsKey(key);
  }

  public int size() {
    return inFlight.size();
  }
}
