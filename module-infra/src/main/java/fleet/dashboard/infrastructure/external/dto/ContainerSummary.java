package fleet.dashboard.infrastructure.external.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Map;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * 컨테이너 목록 항목 DTO
 *
 * <p>Endpoint: GET /api/endpoints/{id}/docker/containers/json
 *
 * <p>labels는 호스트 경로 노출 방지를 위해 반환 전에 마스킹됩니다.
 */
@Getter
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ContainerSummary {

  @JsonProperty("Id")
  private String id;

  @JsonProperty("Names")
  private List<String> names = List.of();

  @JsonProperty("Image")
  private String image;

  @JsonProperty("ImageID")
  private String imageId;

  @JsonProperty("Command")
  private String command;

  @JsonProperty("Created")
  private long created;

  @JsonProperty("State")
  private String state;

  @JsonProperty("Status")
  private String status;

  @JsonProperty("Ports")
  private List<Port> ports = List.of();

  @Setter
  @JsonProperty("Labels")
  private Map<String, String> labels = Map.of();

  @JsonProperty("Mounts")
  private List<Mount> mounts = List.of();

  @Getter
  @NoArgsConstructor
  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class Port {

    @JsonProperty("IP")
    private String ip;

    @JsonProperty("PrivatePort")
    private Integer privatePort;

    @JsonProperty("PublicPort")
    private Integer publicPort;

    @JsonProperty("Type")
    private String type;
  }

  @Getter
  @NoArgsConstructor
  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class Mount {

    @JsonProperty("Type")
    private String type;

    @JsonProperty("Name")
    private String name;

    @JsonProperty("Source")
    private String source;

    @JsonProperty("Destination")
    private String destination;

    @JsonProperty("RW")
    private Boolean readWrite;
  }
}
