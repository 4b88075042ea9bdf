package fleet.dashboard.error.exception.upstream;

import fleet.dashboard.error.ErrorCode;
import fleet.dashboard.error.exception.base.BaseException;
import lombok.Getter;

/**
 * 분류가 끝난 업스트림 호출 실패
 *
 * <p>재시도 정책과 브레이커 판정은 모두 {@link #getKind()}를 기준으로 합니다. 전송 계층 오류의 {@link #getStatus()}는 0입니다.
 */
@Getter
public abstract class UpstreamApiException extends BaseException {

  private final UpstreamErrorKind kind;
  private final int status;
  private final String path;

  protected UpstreamApiException(
      ErrorCode errorCode, UpstreamErrorKind kind, int status, String path, Throwable cause) {
    super(errorCode, cause, status, path);
    this.kind = kind;
    this.status = status;
    this.path = path;
  }

  protected UpstreamApiException(
      ErrorCode errorCode, UpstreamErrorKind kind, int status, String path) {
    super(errorCode, status, path);
    this.kind = kind;
    this.status = status;
    this.path = path;
  }

  public boolean isRetryable() {
    return kind.isRetryable();
  }

  /**
   * 비정상 HTTP 응답을 분류하여 예외로 만듭니다.
   *
   * @param status HTTP 상태 코드
   * @param path 요청 경로
   */
  public static UpstreamApiException fromStatus(int status, String path) {
    return switch (UpstreamErrorKind.classify(status)) {
      case AUTH -> new UpstreamAuthException(status, path);
      case RATE_LIMIT -> new UpstreamRateLimitException(status, path);
      case SERVER -> new UpstreamServerException(status, path);
      default -> new UpstreamClientException(status, path);
    };
  }
}
