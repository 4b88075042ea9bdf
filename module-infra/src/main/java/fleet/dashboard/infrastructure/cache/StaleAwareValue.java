package fleet.dashboard.infrastructure.cache;

/**
 * stale 여부를 함께 돌려주는 조회 결과
 *
 * @param data 캐시 값
 * @param stale staleAt이 지났지만 아직 만료되지 않은 경우 true
 */
public record StaleAwareValue<T>(T data, boolean stale) {}
