package fleet.dashboard.infrastructure.external;

import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import fleet.dashboard.error.exception.marker.CircuitBreakerRecordMarker;
import fleet.dashboard.error.exception.upstream.UpstreamApiException;
import fleet.dashboard.error.exception.upstream.UpstreamNetworkException;
import fleet.dashboard.infrastructure.executor.LogicExecutor;
import fleet.dashboard.infrastructure.executor.TaskContext;
import fleet.dashboard.infrastructure.executor.strategy.ExceptionTranslator;
import fleet.dashboard.infrastructure.external.transport.PortainerTransport;
import fleet.dashboard.infrastructure.resilience.breaker.CircuitBreaker;
import fleet.dashboard.infrastructure.resilience.breaker.PartitionedCircuitBreakerRegistry;
import io.github.resilience4j.bulkhead.Bulkhead;
import io.github.resilience4j.bulkhead.BulkheadFullException;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import java.time.Duration;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;

/**
 * Resilient Portainer Client - 업스트림 호출에 회복 탄력성 패턴을 적용하는 퍼사드
 *
 * <h4>실행 순서</h4>
 *
 * <ol>
 *   <li>Bulkhead: 전역 동시 요청 수 제한 (모든 파티션 공통 대기열)
 *   <li>CircuitBreaker: 경로의 파티션 브레이커 ({@code endpoint-<id>} / {@code global})
 *   <li>Retry: 재시도 가능한 분류만 지수 백오프로 재시도 ({@code base * 2^attempt})
 * </ol>
 *
 * <h4>분류별 정책</h4>
 *
 * <ul>
 *   <li>AUTH (401/403): 즉시 실패, 브레이커 무관
 *   <li>RATE_LIMIT (429): 재시도, 브레이커 무관
 *   <li>SERVER (5xx) / NETWORK: 재시도, 브레이커 실패로 기록
 *   <li>그 외 4xx: 즉시 실패, 브레이커 무관
 * </ul>
 *
 * <p>재시도 소진 후에는 마지막 분류 예외가 그대로 전파됩니다. 응답 역직렬화 실패는 {@code DataProcessingException}입니다.
 */
@Slf4j
public class ResilientPortainerClient {

  private final PortainerTransport transport;
  private final Bulkhead bulkhead;
  private final PartitionedCircuitBreakerRegistry breakers;
  private final Retry retry;
  private final ObjectMapper objectMapper;
  private final LogicExecutor executor;

  public ResilientPortainerClient(
      PortainerTransport transport,
      Bulkhead bulkhead,
      PartitionedCircuitBreakerRegistry breakers,
      Retry retry,
      ObjectMapper objectMapper,
      LogicExecutor executor) {
    this.transport = transport;
    this.bulkhead = bulkhead;
    this.breakers = breakers;
    this.retry = retry;
    this.objectMapper = objectMapper;
    this.executor = executor;
    this.retry
        .getEventPublisher()
        .onRetry(
            event ->
                log.warn(
                    "[Portainer] 재시도 {}회차, {}ms 후 재요청: {}",
                    event.getNumberOfRetryAttempts(),
                    event.getWaitInterval().toMillis(),
                    event.getLastThrowable().getMessage()));
  }

  /**
   * 업스트림 재시도 설정
   *
   * @param retries 최초 시도 외 추가 재시도 횟수
   * @param baseDelay 첫 재시도 대기 시간
   */
  public static RetryConfig retryConfig(int retries, Duration baseDelay) {
    return RetryConfig.custom()
        .maxAttempts(retries + 1)
        .intervalFunction(IntervalFunction.ofExponentialBackoff(baseDelay, 2.0))
        .retryOnException(ResilientPortainerClient::isRetryable)
        .build();
  }

  /**
   * 브레이커 실패 판정: {@link CircuitBreakerRecordMarker}(SERVER/NETWORK)만 실패로 기록
   *
   * <p>전송 계층은 분류되지 않은 I/O 실패를 NETWORK로 바꿔 던지므로, 그 밖의 예외는 업스트림 건강 상태와 무관합니다.
   */
  public static boolean isBreakerFailure(Throwable error) {
    return error instanceof CircuitBreakerRecordMarker;
  }

  static boolean isRetryable(Throwable error) {
    return error instanceof UpstreamApiException upstream && upstream.isRetryable();
  }

  /** JSON 응답을 지정 타입으로 역직렬화. 본문이 비어 있으면 null */
  public <T> T request(UpstreamRequest request, JavaType responseType) {
    byte[] body = execute(request);
    if (body.length == 0) {
      return null;
    }
    return executor.executeWithTranslation(
        () -> objectMapper.readValue(body, responseType),
        ExceptionTranslator.forJson(),
        TaskContext.of("Portainer", "decode", request.describe()));
  }

  public <T> T request(UpstreamRequest request, Class<T> responseType) {
    return request(request, objectMapper.constructType(responseType));
  }

  /** 원본 바이트 응답 (로그 스트림, tar 아카이브 등) */
  public byte[] requestBytes(UpstreamRequest request) {
    return execute(request);
  }

  /** 응답 본문이 필요 없는 명령 (start/stop/restart) */
  public void send(UpstreamRequest request) {
    execute(request);
  }

  private byte[] execute(UpstreamRequest request) {
    CircuitBreaker breaker = breakers.forPath(request.path());
    Supplier<byte[]> attempts = Retry.decorateSupplier(retry, () -> transport.exchange(request));
    Supplier<byte[]> guarded = Bulkhead.decorateSupplier(bulkhead, () -> breaker.execute(attempts));
    try {
      return guarded.get();
    } catch (BulkheadFullException e) {
      log.warn("[Portainer] 동시 요청 대기 시간 초과: {}", request.describe());
      throw new UpstreamNetworkException(request.path(), e);
    }
  }
}
