package fleet.dashboard.error.exception.marker;

/**
 * 서킷 브레이커의 실패 카운트에 반영되어야 하는 예외임을 표시합니다.
 *
 * <p>업스트림 자체의 장애(네트워크, 5xx)가 여기에 해당합니다.
 */
public interface CircuitBreakerRecordMarker {}
