package fleet.dashboard.controller;

import fleet.dashboard.error.exception.InvalidInputException;
import fleet.dashboard.global.response.ApiResponse;
import fleet.dashboard.infrastructure.cache.orchestrator.CacheEntryView;
import fleet.dashboard.infrastructure.cache.orchestrator.CacheOrchestrator;
import fleet.dashboard.infrastructure.cache.orchestrator.CacheStats;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * 캐시 관리 API
 *
 * <p>엔드포인트:
 *
 * <ul>
 *   <li>GET /api/admin/cache/stats - 백엔드 모드, hit/miss, 압축, Redis 텔레메트리
 *   <li>GET /api/admin/cache/entries - 로컬 엔트리 목록 (값 제외)
 *   <li>POST /api/admin/cache/clear - 전체 삭제
 *   <li>POST /api/admin/cache/invalidate?tag=|key= - 태그 또는 키 무효화
 * </ul>
 */
@Slf4j
@RestController
@RequestMapping("/api/admin/cache")
@RequiredArgsConstructor
public class CacheAdminController {

  private final CacheOrchestrator cacheOrchestrator;

  @GetMapping("/stats")
  public ResponseEntity<ApiResponse<CacheStats>> stats() {
    return ResponseEntity.ok(ApiResponse.success(cacheOrchestrator.getStats()));
  }

  @GetMapping("/entries")
  public ResponseEntity<ApiResponse<List<CacheEntryView>>> entries() {
    return ResponseEntity.ok(ApiResponse.success(cacheOrchestrator.getEntries()));
  }

  @PostMapping("/clear")
  public ResponseEntity<ApiResponse<String>> clear() {
    cacheOrchestrator.clear();
    return ResponseEntity.ok(ApiResponse.success("cleared"));
  }

  /** tag가 있으면 태그 무효화, 없으면 key 무효화. 둘 다 없으면 400 */
  @PostMapping("/invalidate")
  public ResponseEntity<ApiResponse<Map<String, String>>> invalidate(
      @RequestParam(required = false) String tag, @RequestParam(required = false) String key) {
    if (hasText(tag)) {
      cacheOrchestrator.invalidateTag(tag);
      return ResponseEntity.ok(ApiResponse.success(Map.of("tag", tag)));
    }
    if (hasText(key)) {
      cacheOrchestrator.invalidate(key);
      log.info("[CacheAdmin] 키 무효화: {}", key);
      return ResponseEntity.ok(ApiResponse.success(Map.of("key", key)));
    }
    throw new InvalidInputException("tag 또는 key가 필요합니다");
  }

  private static boolean hasText(String value) {
    return value != null && !value.isBlank();
  }
}
