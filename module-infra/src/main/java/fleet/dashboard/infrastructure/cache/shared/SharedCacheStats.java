package fleet.dashboard.infrastructure.cache.shared;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;

/**
 * 공유 캐시 어댑터 상태 스냅샷
 *
 * @param state connected / backed-off / idle (아직 연결 시도 전)
 * @param redis 원격 저장소 텔레메트리, 조회 불가 시 null
 * @param compression 압축 누적 통계
 * @param failureCount 백오프 연속 실패 횟수
 * @param disabledUntil 원격 연산 재개 시각
 */
@JsonInclude(JsonInclude.Include.ALWAYS)
public record SharedCacheStats(
    String state,
    RedisTelemetry redis,
    CompressionStats compression,
    int failureCount,
    Instant disabledUntil) {

  /**
   * INFO 명령에서 추출한 메모리/클라이언트 지표
   *
   * @param memoryMaxBytes maxmemory 설정값 (0이면 무제한)
   */
  public record RedisTelemetry(
      long memoryUsedBytes,
      long memoryMaxBytes,
      long evictedKeys,
      long connectedClients,
      long uptimeSeconds) {}

  /**
   * @param compressedCount 압축 저장 횟수
   * @param bytesSaved 압축으로 절약한 누적 바이트
   * @param threshold 압축 임계값 (직렬화 바이트)
   */
  public record CompressionStats(long compressedCount, long bytesSaved, int threshold) {}
}
