package fleet.dashboard.controller;

import fleet.dashboard.error.exception.InvalidInputException;
import fleet.dashboard.global.response.ApiResponse;
import fleet.dashboard.infrastructure.resilience.breaker.PartitionedCircuitBreakerRegistry;
import fleet.dashboard.infrastructure.resilience.breaker.PartitionedCircuitBreakerRegistry.BreakerRegistryStats;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** 업스트림 브레이커 조회/초기화 API */
@Slf4j
@RestController
@RequestMapping("/api/admin/breakers")
@RequiredArgsConstructor
public class BreakerAdminController {

  private final PartitionedCircuitBreakerRegistry portainerCircuitBreakers;

  @GetMapping
  public ResponseEntity<ApiResponse<BreakerRegistryStats>> stats() {
    return ResponseEntity.ok(ApiResponse.success(portainerCircuitBreakers.getStats()));
  }

  /** partition이 없으면 전체 초기화 */
  @PostMapping("/reset")
  public ResponseEntity<ApiResponse<BreakerRegistryStats>> reset(
      @RequestParam(required = false) String partition) {
    if (partition == null || partition.isBlank()) {
      portainerCircuitBreakers.resetAll();
      log.info("[BreakerAdmin] 전체 브레이커 초기화");
    } else if (!portainerCircuitBreakers.reset(partition)) {
      throw new InvalidInputException("알 수 없는 파티션: " + partition);
    } else {
      log.info("[BreakerAdmin] 브레이커 초기화: {}", partition);
    }
    return ResponseEntity.ok(ApiResponse.success(portainerCircuitBreakers.getStats()));
  }
}
