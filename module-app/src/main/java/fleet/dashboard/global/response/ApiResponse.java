package fleet.dashboard.global.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import fleet.dashboard.error.ErrorCode;
import fleet.dashboard.error.exception.CircuitBreakerOpenException;
import fleet.dashboard.error.exception.base.BaseException;
import fleet.dashboard.error.exception.upstream.UpstreamApiException;
import fleet.dashboard.error.exception.upstream.UpstreamErrorKind;

/**
 * 대시보드 API 공통 응답 포맷
 *
 * <h4>실패 응답</h4>
 *
 * <ul>
 *   <li>업스트림 분류 실패: {@code error.upstreamKind} (NETWORK, AUTH, RATE_LIMIT, SERVER, UNKNOWN)
 *   <li>브레이커 거절: {@code error.breaker}, {@code error.retryAfterSeconds}. UI는 일반 실패 대신 "일시적 성능 저하"로 표시
 * </ul>
 *
 * @param success 성공 여부
 * @param data 응답 데이터 (성공 시)
 * @param error 에러 정보 (실패 시)
 * @param <T> 응답 데이터 타입
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiResponse<T>(boolean success, T data, ErrorInfo error) {

  public static <T> ApiResponse<T> success(T data) {
    return new ApiResponse<>(true, data, null);
  }

  /** 예외 메시지(가공된 상세)와 분류 정보를 담은 실패 응답 */
  public static ApiResponse<Void> failure(BaseException e) {
    return new ApiResponse<>(false, null, ErrorInfo.from(e));
  }

  /** ErrorCode의 기본 메시지만 담은 실패 응답 (상세 내용은 숨김) */
  public static ApiResponse<Void> failure(ErrorCode errorCode) {
    return new ApiResponse<>(
        false,
        null,
        new ErrorInfo(
            errorCode.getStatusCode(), errorCode.getCode(), errorCode.getMessage(), null, null, null));
  }

  /** Retry-After 헤더와 같은 값: 밀리초를 초로 올림, 최소 1초 */
  public static long toRetryAfterSeconds(long retryAfterMs) {
    return Math.max(1, (retryAfterMs + 999) / 1000);
  }

  @JsonInclude(JsonInclude.Include.NON_NULL)
  public record ErrorInfo(
      int status,
      String code,
      String message,
      UpstreamErrorKind upstreamKind,
      String breaker,
      Long retryAfterSeconds) {

    static ErrorInfo from(BaseException e) {
      ErrorCode errorCode = e.getErrorCode();
      UpstreamErrorKind kind = null;
      String breaker = null;
      Long retryAfterSeconds = null;
      if (e instanceof UpstreamApiException upstream) {
        kind = upstream.getKind();
      } else if (e instanceof CircuitBreakerOpenException open) {
        breaker = open.getBreakerName();
        retryAfterSeconds = toRetryAfterSeconds(open.getRetryAfterMs());
      }
      return new ErrorInfo(
          errorCode.getStatusCode(),
          errorCode.getCode(),
          e.getMessage(),
          kind,
          breaker,
          retryAfterSeconds);
    }
  }
}
