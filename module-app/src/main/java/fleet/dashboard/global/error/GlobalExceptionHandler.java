package fleet.dashboard.global.error;

import fleet.dashboard.error.CommonErrorCode;
import fleet.dashboard.error.exception.CircuitBreakerOpenException;
import fleet.dashboard.error.exception.base.BaseException;
import fleet.dashboard.error.exception.base.ClientBaseException;
import fleet.dashboard.global.response.ApiResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

  /**
   * 브레이커 OPEN: 업스트림을 호출하지 않고 거절된 요청
   *
   * <p>UI가 "일시적 성능 저하" 상태를 표시할 수 있도록 Retry-After(초, 올림)를 헤더와 본문에 함께 내려줍니다.
   */
  @ExceptionHandler(CircuitBreakerOpenException.class)
  protected ResponseEntity<ApiResponse<Void>> handleBreakerOpen(CircuitBreakerOpenException e) {
    log.warn("Breaker Open: {} | retryAfterMs={}", e.getBreakerName(), e.getRetryAfterMs());
    return ResponseEntity.status(e.getErrorCode().getStatus())
        .header(
            HttpHeaders.RETRY_AFTER,
            String.valueOf(ApiResponse.toRetryAfterSeconds(e.getRetryAfterMs())))
        .body(ApiResponse.failure(e));
  }

  /** 비즈니스/업스트림 예외: ErrorCode의 상태 코드와 가공된 메시지 */
  @ExceptionHandler(BaseException.class)
  protected ResponseEntity<ApiResponse<Void>> handleBaseException(BaseException e) {
    if (e instanceof ClientBaseException) {
      log.info("Client Exception: {} | Message: {}", e.getErrorCode().getCode(), e.getMessage());
    } else {
      log.warn("Server Exception: {} | Message: {}", e.getErrorCode().getCode(), e.getMessage());
    }
    return ResponseEntity.status(e.getErrorCode().getStatus()).body(ApiResponse.failure(e));
  }

  /** 예측하지 못한 시스템 예외: 상세 메시지는 숨기고 공통 코드로 응답 */
  @ExceptionHandler(Exception.class)
  protected ResponseEntity<ApiResponse<Void>> handleException(Exception e) {
    log.error("Unexpected System Failure: ", e);
    return ResponseEntity.status(CommonErrorCode.INTERNAL_SERVER_ERROR.getStatus())
        .body(ApiResponse.failure(CommonErrorCode.INTERNAL_SERVER_ERROR));
  }
}
