package fleet.dashboard.infrastructure.external.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Map;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * 컨테이너 상세 DTO
 *
 * <p>Endpoint: GET /api/endpoints/{id}/docker/containers/{containerId}/json
 */
@Getter
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ContainerInspectResponse {

  @JsonProperty("Id")
  private String id;

  @JsonProperty("Name")
  private String name;

  @JsonProperty("Image")
  private String image;

  @JsonProperty("RestartCount")
  private int restartCount;

  @JsonProperty("State")
  private State state;

  @JsonProperty("Config")
  private Config config;

  @JsonProperty("HostConfig")
  private HostConfig hostConfig;

  @Getter
  @NoArgsConstructor
  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class State {

    @JsonProperty("Status")
    private String status;

    @JsonProperty("Running")
    private boolean running;

    @JsonProperty("ExitCode")
    private int exitCode;

    @JsonProperty("StartedAt")
    private String startedAt;
  }

  @Getter
  @NoArgsConstructor
  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class Config {

    @JsonProperty("Image")
    private String image;

    @Setter
    @JsonProperty("Labels")
    private Map<String, String> labels = Map.of();
  }

  @Getter
  @NoArgsConstructor
  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class HostConfig {

    @JsonProperty("NetworkMode")
    private String networkMode;

    @JsonProperty("Privileged")
    private Boolean privileged;

    @JsonProperty("CapAdd")
    private List<String> capAdd;

    @JsonProperty("CapDrop")
    private List<String> capDrop;

    @JsonProperty("PidMode")
    private String pidMode;
  }
}
