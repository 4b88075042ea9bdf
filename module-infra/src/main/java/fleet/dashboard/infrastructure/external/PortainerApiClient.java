package fleet.dashboard.infrastructure.external;

import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.type.TypeFactory;
import fleet.dashboard.error.exception.InvalidInputException;
import fleet.dashboard.error.exception.upstream.UpstreamClientException;
import fleet.dashboard.error.exception.upstream.UpstreamServerException;
import fleet.dashboard.infrastructure.external.dto.ContainerInspectResponse;
import fleet.dashboard.infrastructure.external.dto.ContainerStatsResponse;
import fleet.dashboard.infrastructure.external.dto.ContainerSummary;
import fleet.dashboard.infrastructure.external.dto.EndpointResponse;
import fleet.dashboard.infrastructure.external.dto.ImageResponse;
import fleet.dashboard.infrastructure.external.dto.NetworkResponse;
import fleet.dashboard.infrastructure.external.dto.StackResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.util.UriUtils;

/**
 * Portainer REST API 타입 지정 클라이언트
 *
 * <p>모든 호출은 {@link ResilientPortainerClient}를 거칩니다. 엔드포인트 하위 경로({@code /api/endpoints/<id>/...})는
 * 엔드포인트별 브레이커로 격리됩니다.
 */
@Slf4j
public class PortainerApiClient {

  private static final Pattern CONTAINER_ID = Pattern.compile("^[A-Za-z0-9][A-Za-z0-9_.-]*$");
  private static final TypeFactory TYPES = TypeFactory.defaultInstance();

  private final ResilientPortainerClient client;
  private final Duration statsTimeout;

  public PortainerApiClient(ResilientPortainerClient client, Duration statsTimeout) {
    this.client = client;
    this.statsTimeout = statsTimeout;
  }

  /**
   * 로그 조회 옵션
   *
   * @param tail 마지막 N줄 (0 이하이면 100)
   * @param since 시작 시각 (epoch seconds), null이면 생략
   * @param until 종료 시각 (epoch seconds), null이면 생략
   * @param timestamps 각 줄에 타임스탬프 포함 여부
   */
  public record LogOptions(int tail, Long since, Long until, boolean timestamps) {

    public static LogOptions defaults() {
      return new LogOptions(100, null, null, true);
    }
  }

  // Endpoints

  public List<EndpointResponse> getEndpoints() {
    return client.request(UpstreamRequest.get("/api/endpoints"), listOf(EndpointResponse.class));
  }

  public EndpointResponse getEndpoint(int endpointId) {
    return client.request(
        UpstreamRequest.get("/api/endpoints/" + endpointId), EndpointResponse.class);
  }

  // Containers

  public List<ContainerSummary> getContainers(int endpointId, boolean all) {
    List<ContainerSummary> containers =
        client.request(
            UpstreamRequest.get(dockerPath(endpointId, "/containers/json?all=" + all)),
            listOf(ContainerSummary.class));
    if (containers == null) {
      return List.of();
    }
    containers.forEach(c -> c.setLabels(ContainerLabelSanitizer.sanitize(c.getLabels())));
    return containers;
  }

  public ContainerInspectResponse inspectContainer(int endpointId, String containerId) {
    ContainerInspectResponse inspect =
        client.request(
            UpstreamRequest.get(containerPath(endpointId, containerId, "/json")),
            ContainerInspectResponse.class);
    if (inspect != null && inspect.getConfig() != null) {
      inspect.getConfig().setLabels(ContainerLabelSanitizer.sanitize(inspect.getConfig().getLabels()));
    }
    return inspect;
  }

  public void startContainer(int endpointId, String containerId) {
    client.send(UpstreamRequest.post(containerPath(endpointId, containerId, "/start")));
    log.info("[Portainer] 컨테이너 시작: endpoint={}, container={}", endpointId, containerId);
  }

  public void stopContainer(int endpointId, String containerId) {
    client.send(UpstreamRequest.post(containerPath(endpointId, containerId, "/stop")));
    log.info("[Portainer] 컨테이너 중지: endpoint={}, container={}", endpointId, containerId);
  }

  public void restartContainer(int endpointId, String containerId) {
    client.send(UpstreamRequest.post(containerPath(endpointId, containerId, "/restart")));
    log.info("[Portainer] 컨테이너 재시작: endpoint={}, container={}", endpointId, containerId);
  }

  /**
   * 컨테이너 로그 (stdout + stderr, 다중화 해제)
   *
   * <p>로그 경로의 404는 해당 엔드포인트의 Docker 데몬에 닿지 못했다는 의미이므로 SERVER(502)로 보고합니다.
   */
  public String getContainerLogs(int endpointId, String containerId, LogOptions options) {
    StringBuilder query =
        new StringBuilder("/logs?stdout=true&stderr=true")
            .append("&tail=")
            .append(options.tail() > 0 ? options.tail() : 100)
            .append("&timestamps=")
            .append(options.timestamps());
    if (options.since() != null) {
      query.append("&since=").append(options.since());
    }
    if (options.until() != null) {
      query.append("&until=").append(options.until());
    }

    String path = containerPath(endpointId, containerId, query.toString());
    try {
      return DockerLogDecoder.decode(client.requestBytes(UpstreamRequest.get(path)));
    } catch (UpstreamClientException e) {
      if (e.getStatus() == 404) {
        throw new UpstreamServerException(502, path);
      }
      throw e;
    }
  }

  public ContainerStatsResponse getContainerStats(int endpointId, String containerId) {
    return client.request(
        UpstreamRequest.get(containerPath(endpointId, containerId, "/stats?stream=false"))
            .withTimeout(statsTimeout),
        ContainerStatsResponse.class);
  }

  /** 컨테이너 내부 경로의 tar 아카이브 */
  public byte[] getContainerArchive(int endpointId, String containerId, String containerPath) {
    String query = "/archive?path=" + UriUtils.encodeQueryParam(containerPath, StandardCharsets.UTF_8);
    return client.requestBytes(UpstreamRequest.get(containerPath(endpointId, containerId, query)));
  }

  // Stacks

  public List<StackResponse> getStacks() {
    return client.request(UpstreamRequest.get("/api/stacks"), listOf(StackResponse.class));
  }

  public List<StackResponse> getStacksByEndpoint(int endpointId) {
    String filter = "{\"EndpointID\":" + endpointId + "}";
    return client.request(
        UpstreamRequest.get(
            "/api/stacks?filters=" + UriUtils.encodeQueryParam(filter, StandardCharsets.UTF_8)),
        listOf(StackResponse.class));
  }

  public StackResponse getStack(int stackId) {
    return client.request(UpstreamRequest.get("/api/stacks/" + stackId), StackResponse.class);
  }

  // Networks / Images

  public List<NetworkResponse> getNetworks(int endpointId) {
    return client.request(
        UpstreamRequest.get(dockerPath(endpointId, "/networks")), listOf(NetworkResponse.class));
  }

  public List<ImageResponse> getImages(int endpointId) {
    return client.request(
        UpstreamRequest.get(dockerPath(endpointId, "/images/json")), listOf(ImageResponse.class));
  }

  private static String dockerPath(int endpointId, String suffix) {
    return "/api/endpoints/" + endpointId + "/docker" + suffix;
  }

  private static String containerPath(int endpointId, String containerId, String suffix) {
    if (containerId == null || !CONTAINER_ID.matcher(containerId).matches()) {
      throw new InvalidInputException("containerId=" + containerId);
    }
    return dockerPath(endpointId, "/containers/" + containerId + suffix);
  }

  private static JavaType listOf(Class<?> elementType) {
    return TYPES.constructCollectionType(List.class, elementType);
  }
}
