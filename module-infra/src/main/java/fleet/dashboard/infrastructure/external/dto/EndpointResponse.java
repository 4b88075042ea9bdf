package fleet.dashboard.infrastructure.external.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * Portainer 엔드포인트(Docker 환경) 응답 DTO
 *
 * <p>Endpoint: GET /api/endpoints, GET /api/endpoints/{id}
 */
@Getter
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class EndpointResponse {

  @JsonProperty("Id")
  private int id;

  @JsonProperty("Name")
  private String name;

  @JsonProperty("Type")
  private int type;

  @JsonProperty("URL")
  private String url;

  /** 1: up, 2: down */
  @JsonProperty("Status")
  private int status;

  @JsonProperty("Snapshots")
  private List<Snapshot> snapshots = List.of();

  @JsonProperty("TagIds")
  private List<Integer> tagIds = List.of();

  @JsonProperty("EdgeID")
  private String edgeId;

  @JsonProperty("LastCheckInDate")
  private Long lastCheckInDate;

  @Getter
  @NoArgsConstructor
  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class Snapshot {

    @JsonProperty("TotalCPU")
    private Integer totalCpu;

    @JsonProperty("TotalMemory")
    private Long totalMemory;

    @JsonProperty("RunningContainerCount")
    private Integer runningContainerCount;

    @JsonProperty("StoppedContainerCount")
    private Integer stoppedContainerCount;

    @JsonProperty("HealthyContainerCount")
    private Integer healthyContainerCount;

    @JsonProperty("UnhealthyContainerCount")
    private Integer unhealthyContainerCount;

    @JsonProperty("StackCount")
    private Integer stackCount;

    @JsonProperty("Time")
    private Long time;
  }
}
