package fleet.dashboard.error.exception.upstream;

/**
 * 업스트림 호출 실패 분류
 *
 * <ul>
 *   <li>{@link #NETWORK}: 연결 거부/리셋, 타임아웃 등 전송 계층 오류. 재시도 대상, 브레이커 반영
 *   <li>{@link #AUTH}: 401/403. 즉시 실패
 *   <li>{@link #RATE_LIMIT}: 429. 재시도 대상, 브레이커 미반영
 *   <li>{@link #SERVER}: 5xx. 재시도 대상, 브레이커 반영
 *   <li>{@link #UNKNOWN}: 그 외 4xx. 즉시 실패
 * </ul>
 */
public enum UpstreamErrorKind {
  NETWORK(true, true),
  AUTH(false, false),
  RATE_LIMIT(true, false),
  SERVER(true, true),
  UNKNOWN(false, false);

  private final boolean retryable;
  private final boolean breakerRelevant;

  UpstreamErrorKind(boolean retryable, boolean breakerRelevant) {
    this.retryable = retryable;
    this.breakerRelevant = breakerRelevant;
  }

  public boolean isRetryable() {
    return retryable;
  }

  public boolean isBreakerRelevant() {
    return breakerRelevant;
  }

  /** HTTP 상태 코드로 분류합니다. 2xx/3xx는 호출하지 않는다는 전제입니다. */
  public static UpstreamErrorKind classify(int status) {
    if (status == 401 || status == 403) {
      return AUTH;
    }
    if (status == 429) {
      return RATE_LIMIT;
    }
    if (status >= 500) {
      return SERVER;
    }
    return UNKNOWN;
  }
}
