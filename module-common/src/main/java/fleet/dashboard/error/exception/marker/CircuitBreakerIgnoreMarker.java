package fleet.dashboard.error.exception.marker;

/**
 * 서킷 브레이커가 무시해야 하는 예외임을 표시합니다.
 *
 * <p>인증 실패, 요청 한도 초과처럼 호출자 측 조건으로 발생한 예외는 업스트림 건강 상태와 무관하므로 브레이커를 열지 않습니다.
 */
public interface CircuitBreakerIgnoreMarker {}
