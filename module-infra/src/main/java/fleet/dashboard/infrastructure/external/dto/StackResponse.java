package fleet.dashboard.infrastructure.external.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * Portainer 스택 DTO
 *
 * <p>Endpoint: GET /api/stacks, GET /api/stacks/{id}
 *
 * <p>스택 환경 변수(Env)는 비밀 값이 섞일 수 있어 매핑하지 않습니다.
 */
@Getter
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class StackResponse {

  @JsonProperty("Id")
  private int id;

  @JsonProperty("Name")
  private String name;

  /** 1: swarm, 2: compose, 3: kubernetes */
  @JsonProperty("Type")
  private int type;

  @JsonProperty("EndpointId")
  private int endpointId;

  /** 1: active, 2: inactive */
  @JsonProperty("Status")
  private int status;

  @JsonProperty("CreationDate")
  private Long creationDate;

  @JsonProperty("UpdateDate")
  private Long updateDate;
}
