package fleet.dashboard.infrastructure.external.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import lombok.Getter;
import lombok.NoArgsConstructor;

/** Endpoint: GET /api/endpoints/{id}/docker/images/json */
@Getter
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ImageResponse {

  @JsonProperty("Id")
  private String id;

  @JsonProperty("RepoTags")
  private List<String> repoTags = List.of();

  @JsonProperty("Size")
  private Long size;

  @JsonProperty("Created")
  private Long created;
}
