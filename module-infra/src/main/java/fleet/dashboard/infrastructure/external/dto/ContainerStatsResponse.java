package fleet.dashboard.infrastructure.external.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Map;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 컨테이너 리소스 스냅샷 DTO
 *
 * <p>Endpoint: GET /api/endpoints/{id}/docker/containers/{containerId}/stats?stream=false
 */
@Getter
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ContainerStatsResponse {

  @JsonProperty("cpu_stats")
  private CpuStats cpuStats;

  @JsonProperty("precpu_stats")
  private CpuStats preCpuStats;

  @JsonProperty("memory_stats")
  private MemoryStats memoryStats;

  @JsonProperty("networks")
  private Map<String, NetworkIo> networks = Map.of();

  @Getter
  @NoArgsConstructor
  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class CpuStats {

    @JsonProperty("cpu_usage")
    private CpuUsage cpuUsage;

    @JsonProperty("system_cpu_usage")
    private Long systemCpuUsage;

    @JsonProperty("online_cpus")
    private Integer onlineCpus;
  }

  @Getter
  @NoArgsConstructor
  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class CpuUsage {

    @JsonProperty("total_usage")
    private long totalUsage;
  }

  @Getter
  @NoArgsConstructor
  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class MemoryStats {

    @JsonProperty("usage")
    private Long usage;

    @JsonProperty("limit")
    private Long limit;
  }

  @Getter
  @NoArgsConstructor
  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class NetworkIo {

    @JsonProperty("rx_bytes")
    private long rxBytes;

    @JsonProperty("tx_bytes")
    private long txBytes;
  }
}
