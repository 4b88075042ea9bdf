package fleet.dashboard.controller;

import fleet.dashboard.global.response.ApiResponse;
import fleet.dashboard.infrastructure.external.PortainerApiClient.LogOptions;
import fleet.dashboard.infrastructure.external.dto.ContainerInspectResponse;
import fleet.dashboard.infrastructure.external.dto.ContainerStatsResponse;
import fleet.dashboard.infrastructure.external.dto.ContainerSummary;
import fleet.dashboard.infrastructure.external.dto.EndpointResponse;
import fleet.dashboard.infrastructure.external.dto.ImageResponse;
import fleet.dashboard.infrastructure.external.dto.NetworkResponse;
import fleet.dashboard.infrastructure.external.dto.StackResponse;
import fleet.dashboard.service.FleetQueryService;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * 플릿 조회/컨테이너 액션 API
 *
 * <p>모든 조회는 {@link FleetQueryService}의 캐시를 거칩니다. 업스트림 오류와 브레이커 OPEN은 전역 핸들러가 상태 코드로 변환합니다.
 */
@RestController
@RequestMapping("/api/fleet")
@RequiredArgsConstructor
public class FleetController {

  private static final MediaType TAR = MediaType.parseMediaType("application/x-tar");

  private final FleetQueryService fleetQueryService;

  @GetMapping("/endpoints")
  public ResponseEntity<ApiResponse<List<EndpointResponse>>> endpoints() {
    return ResponseEntity.ok(ApiResponse.success(fleetQueryService.getEndpoints()));
  }

  @GetMapping("/endpoints/{endpointId}")
  public ResponseEntity<ApiResponse<EndpointResponse>> endpoint(@PathVariable int endpointId) {
    return ResponseEntity.ok(ApiResponse.success(fleetQueryService.getEndpoint(endpointId)));
  }

  @GetMapping("/containers")
  public ResponseEntity<ApiResponse<Map<Integer, List<ContainerSummary>>>> fleetContainers() {
    return ResponseEntity.ok(ApiResponse.success(fleetQueryService.getFleetContainers()));
  }

  @GetMapping("/endpoints/{endpointId}/containers")
  public ResponseEntity<ApiResponse<List<ContainerSummary>>> containers(
      @PathVariable int endpointId) {
    return ResponseEntity.ok(ApiResponse.success(fleetQueryService.getContainers(endpointId)));
  }

  @GetMapping("/stacks")
  public ResponseEntity<ApiResponse<List<StackResponse>>> stacks() {
    return ResponseEntity.ok(ApiResponse.success(fleetQueryService.getStacks()));
  }

  @GetMapping("/endpoints/{endpointId}/stacks")
  public ResponseEntity<ApiResponse<List<StackResponse>>> endpointStacks(
      @PathVariable int endpointId) {
    return ResponseEntity.ok(ApiResponse.success(fleetQueryService.getStacks(endpointId)));
  }

  @GetMapping("/endpoints/{endpointId}/images")
  public ResponseEntity<ApiResponse<List<ImageResponse>>> images(@PathVariable int endpointId) {
    return ResponseEntity.ok(ApiResponse.success(fleetQueryService.getImages(endpointId)));
  }

  @GetMapping("/endpoints/{endpointId}/networks")
  public ResponseEntity<ApiResponse<List<NetworkResponse>>> networks(
      @PathVariable int endpointId) {
    return ResponseEntity.ok(ApiResponse.success(fleetQueryService.getNetworks(endpointId)));
  }

  @GetMapping("/endpoints/{endpointId}/containers/{containerId}")
  public ResponseEntity<ApiResponse<ContainerInspectResponse>> inspect(
      @PathVariable int endpointId, @PathVariable String containerId) {
    return ResponseEntity.ok(
        ApiResponse.success(fleetQueryService.inspectContainer(endpointId, containerId)));
  }

  /** 컨테이너 내부 경로의 tar 아카이브 (본문 그대로 전달) */
  @GetMapping("/endpoints/{endpointId}/containers/{containerId}/archive")
  public ResponseEntity<byte[]> archive(
      @PathVariable int endpointId, @PathVariable String containerId, @RequestParam String path) {
    byte[] archive = fleetQueryService.getContainerArchive(endpointId, containerId, path);
    return ResponseEntity.ok()
        .contentType(TAR)
        .header(
            HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"" + containerId + ".tar\"")
        .body(archive);
  }

  @GetMapping("/endpoints/{endpointId}/containers/{containerId}/stats")
  public ResponseEntity<ApiResponse<ContainerStatsResponse>> stats(
      @PathVariable int endpointId, @PathVariable String containerId) {
    return ResponseEntity.ok(
        ApiResponse.success(fleetQueryService.getContainerStats(endpointId, containerId)));
  }

  @GetMapping("/endpoints/{endpointId}/containers/{containerId}/logs")
  public ResponseEntity<ApiResponse<String>> logs(
      @PathVariable int endpointId,
      @PathVariable String containerId,
      @RequestParam(defaultValue = "100") int tail,
      @RequestParam(required = false) Long since,
      @RequestParam(required = false) Long until,
      @RequestParam(defaultValue = "true") boolean timestamps) {
    LogOptions options = new LogOptions(tail, since, until, timestamps);
    return ResponseEntity.ok(
        ApiResponse.success(fleetQueryService.getContainerLogs(endpointId, containerId, options)));
  }

  @PostMapping("/endpoints/{endpointId}/containers/{containerId}/start")
  public ResponseEntity<ApiResponse<String>> start(
      @PathVariable int endpointId, @PathVariable String containerId) {
    fleetQueryService.startContainer(endpointId, containerId);
    return ResponseEntity.ok(ApiResponse.success("started"));
  }

  @PostMapping("/endpoints/{endpointId}/containers/{containerId}/stop")
  public ResponseEntity<ApiResponse<String>> stop(
      @PathVariable int endpointId, @PathVariable String containerId) {
    fleetQueryService.stopContainer(endpointId, containerId);
    return ResponseEntity.ok(ApiResponse.success("stopped"));
  }

  @PostMapping("/endpoints/{endpointId}/containers/{containerId}/restart")
  public ResponseEntity<ApiResponse<String>> restart(
      @PathVariable int endpointId, @PathVariable String containerId) {
    fleetQueryService.restartContainer(endpointId, containerId);
    return ResponseEntity.ok(ApiResponse.success("restarted"));
  }
}
