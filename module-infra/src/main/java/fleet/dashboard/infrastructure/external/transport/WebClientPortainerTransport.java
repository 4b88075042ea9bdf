package fleet.dashboard.infrastructure.external.transport;

import fleet.dashboard.error.exception.upstream.UpstreamApiException;
import fleet.dashboard.error.exception.upstream.UpstreamNetworkException;
import fleet.dashboard.infrastructure.external.UpstreamRequest;
import java.net.URI;
import java.time.Duration;
import java.util.concurrent.TimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;

/**
 * WebClient(Reactor Netty) 기반 전송 계층
 *
 * <ul>
 *   <li>인증: API 키가 있으면 {@code X-API-Key} 헤더
 *   <li>base URL의 후행 슬래시 제거 후 경로를 그대로 이어 붙임
 *   <li>시도별 타임아웃: {@link Mono#timeout} 만료 시 구독 취소 → NETWORK 실패
 *   <li>상태 코드로 분류되지 않은 실패(연결 거부, 본문 읽기 중 I/O 오류 등)는 모두 NETWORK
 * </ul>
 */
@Slf4j
public class WebClientPortainerTransport implements PortainerTransport {

  static final String API_KEY_HEADER = "X-API-Key";
  private static final byte[] EMPTY = new byte[0];

  private final WebClient webClient;
  private final String baseUrl;
  private final String apiKey;
  private final Duration defaultTimeout;

  public WebClientPortainerTransport(
      WebClient webClient, String baseUrl, String apiKey, Duration defaultTimeout) {
    this.webClient = webClient;
    this.baseUrl = normalizeBaseUrl(baseUrl);
    this.apiKey = apiKey;
    this.defaultTimeout = defaultTimeout;
  }

  public static String normalizeBaseUrl(String url) {
    if (url == null) {
      return "";
    }
    return url.replaceAll("/+$", "");
  }

  @Override
  public byte[] exchange(UpstreamRequest request) {
    Duration timeout = request.timeout() != null ? request.timeout() : defaultTimeout;
    String path = request.path();

    WebClient.RequestBodySpec spec =
        webClient
            .method(request.method())
            .uri(URI.create(baseUrl + path))
            .accept(MediaType.APPLICATION_JSON, MediaType.APPLICATION_OCTET_STREAM, MediaType.ALL);
    if (StringUtils.hasText(apiKey)) {
      spec.header(API_KEY_HEADER, apiKey);
    }
    WebClient.RequestHeadersSpec<?> headersSpec =
        request.body() != null
            ? spec.contentType(MediaType.APPLICATION_JSON).bodyValue(request.body())
            : spec;

    return headersSpec
        .exchangeToMono(response -> toBody(response, path))
        .timeout(timeout)
        .onErrorMap(e -> !(e instanceof UpstreamApiException), e -> toNetworkFailure(path, e))
        .defaultIfEmpty(EMPTY)
        .block();
  }

  private static UpstreamNetworkException toNetworkFailure(String path, Throwable e) {
    if (!(e instanceof TimeoutException) && !(e instanceof WebClientRequestException)) {
      log.debug("[Portainer] 분류되지 않은 전송 실패를 NETWORK로 처리 {}: {}", path, e.toString());
    }
    return new UpstreamNetworkException(path, e);
  }

  private Mono<byte[]> toBody(ClientResponse response, String path) {
    int status = response.statusCode().value();
    if (response.statusCode().isError()) {
      log.debug("[Portainer] 비정상 응답 {} {}", status, path);
      return response.releaseBody().then(Mono.error(UpstreamApiException.fromStatus(status, path)));
    }
    return response.bodyToMono(byte[].class);
  }
}
