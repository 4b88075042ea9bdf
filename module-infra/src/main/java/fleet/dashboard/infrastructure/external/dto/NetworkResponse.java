package fleet.dashboard.infrastructure.external.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Map;
import lombok.Getter;
import lombok.NoArgsConstructor;

/** Endpoint: GET /api/endpoints/{id}/docker/networks */
@Getter
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class NetworkResponse {

  @JsonProperty("Id")
  private String id;

  @JsonProperty("Name")
  private String name;

  @JsonProperty("Driver")
  private String driver;

  @JsonProperty("Scope")
  private String scope;

  @JsonProperty("IPAM")
  private Ipam ipam;

  @JsonProperty("Containers")
  private Map<String, Attachment> containers = Map.of();

  @Getter
  @NoArgsConstructor
  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class Ipam {

    @JsonProperty("Config")
    private List<IpamConfig> config = List.of();
  }

  @Getter
  @NoArgsConstructor
  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class IpamConfig {

    @JsonProperty("Subnet")
    private String subnet;

    @JsonProperty("Gateway")
    private String gateway;
  }

  @Getter
  @NoArgsConstructor
  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class Attachment {

    @JsonProperty("Name")
    private String name;

    @JsonProperty("IPv4Address")
    private String ipv4Address;

    @JsonProperty("MacAddress")
    private String macAddress;
  }
}
