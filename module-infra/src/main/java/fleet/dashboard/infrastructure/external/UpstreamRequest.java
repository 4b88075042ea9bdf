package fleet.dashboard.infrastructure.external;

import java.time.Duration;
import java.util.Objects;
import org.springframework.http.HttpMethod;

/**
 * 업스트림 API 요청
 *
 * @param method HTTP 메서드
 * @param path base URL 이후 경로 (쿼리 문자열 포함, 인코딩 완료 상태)
 * @param body JSON으로 직렬화할 본문, 없으면 null
 * @param timeout 시도별 타임아웃, null이면 클라이언트 기본값
 */
public record UpstreamRequest(HttpMethod method, String path, Object body, Duration timeout) {

  public UpstreamRequest {
    Objects.requireNonNull(method, "method");
    Objects.requireNonNull(path, "path");
  }

  public static UpstreamRequest get(String path) {
    return new UpstreamRequest(HttpMethod.GET, path, null, null);
  }

  public static UpstreamRequest post(String path) {
    return new UpstreamRequest(HttpMethod.POST, path, null, null);
  }

  public static UpstreamRequest post(String path, Object body) {
    return new UpstreamRequest(HttpMethod.POST, path, body, null);
  }

  public UpstreamRequest withTimeout(Duration timeout) {
    return new UpstreamRequest(method, path, body, timeout);
  }

  /** 로그/트레이스 표기용 */
  public String describe() {
    return method.name() + " " + path;
  }
}
