package fleet.dashboard.error;

import lombok.AllArgsConstructor;
import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
@AllArgsConstructor
public enum CommonErrorCode implements ErrorCode {
  // === Client Errors (4xx) ===
  INVALID_INPUT_VALUE("C001", "잘못된 입력값입니다: %s", HttpStatus.BAD_REQUEST),
  UPSTREAM_AUTH_FAILED(
      "C002", "업스트림 인증 실패 (status: %s, path: %s)", HttpStatus.UNAUTHORIZED),
  UPSTREAM_RATE_LIMITED(
      "C003", "업스트림 요청 한도 초과 (status: %s, path: %s)", HttpStatus.TOO_MANY_REQUESTS),
  UPSTREAM_REQUEST_REJECTED(
      "C004", "업스트림이 요청을 거부했습니다 (status: %s, path: %s)", HttpStatus.BAD_REQUEST),

  // === Server Errors (5xx) ===
  INTERNAL_SERVER_ERROR("S001", "서버 내부 오류가 발생했습니다.", HttpStatus.INTERNAL_SERVER_ERROR),
  DATA_PROCESSING_ERROR("S002", "데이터 처리 중 오류 발생 (%s)", HttpStatus.INTERNAL_SERVER_ERROR),
  CACHE_BACKEND_ERROR("S003", "공유 캐시 백엔드 오류 (%s)", HttpStatus.SERVICE_UNAVAILABLE),
  CACHE_LOAD_FAILED("S004", "캐시 로더 실행 실패 (key: %s)", HttpStatus.INTERNAL_SERVER_ERROR),
  UPSTREAM_NETWORK_ERROR("S005", "업스트림 연결 실패 (path: %2$s)", HttpStatus.BAD_GATEWAY),
  UPSTREAM_SERVER_ERROR(
      "S006", "업스트림 서버 오류 (status: %s, path: %s)", HttpStatus.BAD_GATEWAY),
  BREAKER_OPEN(
      "S007",
      "서킷 브레이커가 열려 있습니다 (breaker: %s, retryAfterMs: %s)",
      HttpStatus.SERVICE_UNAVAILABLE);

  private final String code;
  private final String message;
  private final HttpStatus status;
}
