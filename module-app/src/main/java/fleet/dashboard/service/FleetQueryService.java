package fleet.dashboard.service;

import com.fasterxml.jackson.core.type.TypeReference;
import fleet.dashboard.infrastructure.cache.CacheKeys;
import fleet.dashboard.infrastructure.cache.orchestrator.CacheFetchRequest;
import fleet.dashboard.infrastructure.cache.orchestrator.CacheOrchestrator;
import fleet.dashboard.infrastructure.external.PortainerApiClient;
import fleet.dashboard.infrastructure.external.dto.ContainerInspectResponse;
import fleet.dashboard.infrastructure.external.dto.ContainerStatsResponse;
import fleet.dashboard.infrastructure.external.dto.ContainerSummary;
import fleet.dashboard.infrastructure.external.dto.EndpointResponse;
import fleet.dashboard.infrastructure.external.dto.ImageResponse;
import fleet.dashboard.infrastructure.external.dto.NetworkResponse;
import fleet.dashboard.infrastructure.external.dto.StackResponse;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * 대시보드 조회 서비스
 *
 * <h4>캐시 정책</h4>
 *
 * <ul>
 *   <li>목록 조회: SWR. stale 구간에서는 즉시 응답하고 백그라운드에서 갱신
 *   <li>stats: 1분 TTL read-through (stale 값을 보여주지 않음)
 *   <li>로그/상세/아카이브: 캐시하지 않음
 *   <li>태그: 리소스 이름 + {@code endpoint-<id>}. 컨테이너 액션 성공 후 {@code containers}, {@code endpoint-<id>} 무효화
 * </ul>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FleetQueryService {

  static final String ENDPOINTS = "endpoints";
  static final String CONTAINERS = "containers";
  static final String STACKS = "stacks";
  static final String IMAGES = "images";
  static final String NETWORKS = "networks";
  static final String STATS = "stats";

  /** Portainer 엔드포인트 status 값: 1 = up */
  private static final int ENDPOINT_UP = 1;

  private final CacheOrchestrator cache;
  private final PortainerApiClient portainer;

  public List<EndpointResponse> getEndpoints() {
    return cache.cachedFetchSWR(
        CacheFetchRequest.of(
                CacheKeys.of(ENDPOINTS),
                TtlPresets.ENDPOINTS,
                new TypeReference<List<EndpointResponse>>() {},
                portainer::getEndpoints)
            .withTags(ENDPOINTS));
  }

  public EndpointResponse getEndpoint(int endpointId) {
    return cache.cachedFetchSWR(
        CacheFetchRequest.of(
                CacheKeys.of(ENDPOINTS, endpointId),
                TtlPresets.ENDPOINTS,
                EndpointResponse.class,
                () -> portainer.getEndpoint(endpointId))
            .withTags(ENDPOINTS, CacheKeys.endpointTag(endpointId)));
  }

  public List<ContainerSummary> getContainers(int endpointId) {
    return cache.cachedFetchSWR(containersRequest(endpointId));
  }

  /**
   * 가동 중인 모든 엔드포인트의 컨테이너 목록
   *
   * <p>엔드포인트별 조회는 동시에 실행되며, 결과는 엔드포인트 목록 순서를 따릅니다.
   */
  public Map<Integer, List<ContainerSummary>> getFleetContainers() {
    List<Integer> endpointIds =
        getEndpoints().stream()
            .filter(e -> e.getStatus() == ENDPOINT_UP)
            .map(EndpointResponse::getId)
            .toList();
    List<CacheFetchRequest<List<ContainerSummary>>> requests =
        endpointIds.stream().map(this::containersRequest).toList();
    List<List<ContainerSummary>> results = cache.cachedFetchMany(requests);

    Map<Integer, List<ContainerSummary>> byEndpoint = new LinkedHashMap<>();
    for (int i = 0; i < endpointIds.size(); i++) {
      byEndpoint.put(endpointIds.get(i), results.get(i));
    }
    return byEndpoint;
  }

  public List<StackResponse> getStacks() {
    return cache.cachedFetchSWR(
        CacheFetchRequest.of(
                CacheKeys.of(STACKS),
                TtlPresets.STACKS,
                new TypeReference<List<StackResponse>>() {},
                portainer::getStacks)
            .withTags(STACKS));
  }

  public List<StackResponse> getStacks(int endpointId) {
    return cache.cachedFetchSWR(
        CacheFetchRequest.of(
                CacheKeys.of(STACKS, endpointId),
                TtlPresets.STACKS,
                new TypeReference<List<StackResponse>>() {},
                () -> portainer.getStacksByEndpoint(endpointId))
            .withTags(STACKS, CacheKeys.endpointTag(endpointId)));
  }

  public List<ImageResponse> getImages(int endpointId) {
    return cache.cachedFetchSWR(
        CacheFetchRequest.of(
                CacheKeys.of(IMAGES, endpointId),
                TtlPresets.IMAGES,
                new TypeReference<List<ImageResponse>>() {},
                () -> portainer.getImages(endpointId))
            .withTags(IMAGES, CacheKeys.endpointTag(endpointId)));
  }

  public List<NetworkResponse> getNetworks(int endpointId) {
    return cache.cachedFetchSWR(
        CacheFetchRequest.of(
                CacheKeys.of(NETWORKS, endpointId),
                TtlPresets.NETWORKS,
                new TypeReference<List<NetworkResponse>>() {},
                () -> portainer.getNetworks(endpointId))
            .withTags(NETWORKS, CacheKeys.endpointTag(endpointId)));
  }

  public ContainerStatsResponse getContainerStats(int endpointId, String containerId) {
    return cache.cachedFetch(
        CacheFetchRequest.of(
                CacheKeys.of(STATS, endpointId, containerId),
                TtlPresets.STATS,
                ContainerStatsResponse.class,
                () -> portainer.getContainerStats(endpointId, containerId))
            .withTags(STATS, CacheKeys.endpointTag(endpointId)));
  }

  /** 상세 조회는 액션 직후 상태를 보여줘야 하므로 캐시하지 않음 */
  public ContainerInspectResponse inspectContainer(int endpointId, String containerId) {
    return portainer.inspectContainer(endpointId, containerId);
  }

  public byte[] getContainerArchive(int endpointId, String containerId, String path) {
    return portainer.getContainerArchive(endpointId, containerId, path);
  }

  public String getContainerLogs(
      int endpointId, String containerId, PortainerApiClient.LogOptions options) {
    return portainer.getContainerLogs(endpointId, containerId, options);
  }

  public void startContainer(int endpointId, String containerId) {
    portainer.startContainer(endpointId, containerId);
    invalidateContainers(endpointId);
  }

  public void stopContainer(int endpointId, String containerId) {
    portainer.stopContainer(endpointId, containerId);
    invalidateContainers(endpointId);
  }

  public void restartContainer(int endpointId, String containerId) {
    portainer.restartContainer(endpointId, containerId);
    invalidateContainers(endpointId);
  }

  private CacheFetchRequest<List<ContainerSummary>> containersRequest(int endpointId) {
    return CacheFetchRequest.of(
            CacheKeys.of(CONTAINERS, endpointId),
            TtlPresets.CONTAINERS,
            new TypeReference<List<ContainerSummary>>() {},
            () -> portainer.getContainers(endpointId, true))
        .withTags(CONTAINERS, CacheKeys.endpointTag(endpointId));
  }

  private void invalidateContainers(int endpointId) {
    cache.invalidateTag(CONTAINERS);
    cache.invalidateTag(CacheKeys.endpointTag(endpointId));
    log.debug("[Fleet] 컨테이너 캐시 무효화: endpoint={}", endpointId);
  }
}
