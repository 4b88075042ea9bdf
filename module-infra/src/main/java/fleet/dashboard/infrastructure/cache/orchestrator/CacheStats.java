package fleet.dashboard.infrastructure.cache.orchestrator;

import fleet.dashboard.infrastructure.cache.shared.SharedCacheStats;

/**
 * 캐시 전체 통계
 *
 * @param backend memory-only / multi-layer / disabled
 * @param l1Size 로컬 엔트리 수
 * @param l2Size 공유 캐시 키 수 (multi-layer가 아니면 0)
 * @param hits 누적 hit
 * @param misses 누적 miss
 * @param hitRate 0.0 ~ 1.0 (조회 이력이 없으면 0.0)
 * @param inFlight 진행 중 fetch 수
 * @param shared 공유 캐시 상태, 미구성 시 null
 */
public record CacheStats(
    String backend,
    long l1Size,
    long l2Size,
    long hits,
    long misses,
    double hitRate,
    int inFlight,
    SharedCacheStats shared) {

  public static double hitRate(long hits, long misses) {
    long total = hits + misses;
    return total == 0 ? 0.0 : (double) hits / total;
  }
}
