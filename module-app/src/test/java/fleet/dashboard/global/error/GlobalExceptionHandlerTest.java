package fleet.dashboard.global.error;

import static org.mockito.BDDMockito.given;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import fleet.dashboard.controller.FleetController;
import fleet.dashboard.error.exception.CircuitBreakerOpenException;
import fleet.dashboard.error.exception.upstream.UpstreamApiException;
import fleet.dashboard.error.exception.upstream.UpstreamNetworkException;
import fleet.dashboard.service.FleetQueryService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpHeaders;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

/** 업스트림 분류 예외가 HTTP 응답으로 변환되는 규칙 검증 */
@Tag("unit")
@ExtendWith(MockitoExtension.class)
@DisplayName("GlobalExceptionHandler 단위 테스트")
class GlobalExceptionHandlerTest {

  @Mock private FleetQueryService fleetQueryService;

  private MockMvc mockMvc;

  @BeforeEach
  void setUp() {
    mockMvc =
        MockMvcBuilders.standaloneSetup(new FleetController(fleetQueryService))
            .setControllerAdvice(new GlobalExceptionHandler())
            .build();
  }

  @Test
  @DisplayName("브레이커 OPEN → 503 + Retry-After(초, 올림)")
  void breakerOpen() throws Exception {
    // Given
    given(fleetQueryService.getContainers(3))
        .willThrow(new CircuitBreakerOpenException("portainer-api:endpoint-3", 29_500));

    // When & Then
    mockMvc
        .perform(get("/api/fleet/endpoints/3/containers"))
        .andExpect(status().isServiceUnavailable())
        .andExpect(header().string(HttpHeaders.RETRY_AFTER, "30"))
        .andExpect(jsonPath("$.success").value(false))
        .andExpect(jsonPath("$.error.code").value("S007"))
        .andExpect(jsonPath("$.error.breaker").value("portainer-api:endpoint-3"))
        .andExpect(jsonPath("$.error.retryAfterSeconds").value(30))
        .andExpect(jsonPath("$.error.upstreamKind").doesNotExist());
  }

  @ParameterizedTest(name = "upstream {0} → {1} ({2})")
  @CsvSource({
    "401, 401, AUTH",
    "403, 401, AUTH",
    "429, 429, RATE_LIMIT",
    "404, 400, UNKNOWN",
    "500, 502, SERVER",
    "503, 502, SERVER"
  })
  @DisplayName("업스트림 HTTP 분류별 응답 상태와 분류")
  void upstreamStatus(int upstreamStatus, int expectedStatus, String kind) throws Exception {
    given(fleetQueryService.getStacks())
        .willThrow(UpstreamApiException.fromStatus(upstreamStatus, "/api/stacks"));

    mockMvc
        .perform(get("/api/fleet/stacks"))
        .andExpect(status().is(expectedStatus))
        .andExpect(jsonPath("$.error.status").value(expectedStatus))
        .andExpect(jsonPath("$.error.upstreamKind").value(kind))
        .andExpect(jsonPath("$.error.retryAfterSeconds").doesNotExist());
  }

  @Test
  @DisplayName("전송 계층 실패 → 502")
  void network() throws Exception {
    given(fleetQueryService.getEndpoints())
        .willThrow(new UpstreamNetworkException("/api/endpoints"));

    mockMvc
        .perform(get("/api/fleet/endpoints"))
        .andExpect(status().isBadGateway())
        .andExpect(jsonPath("$.error.code").value("S005"))
        .andExpect(jsonPath("$.error.upstreamKind").value("NETWORK"));
  }

  @Test
  @DisplayName("예측하지 못한 예외 → 500, 상세 메시지 숨김")
  void unexpected() throws Exception {
    given(fleetQueryService.getEndpoints()).willThrow(new IllegalStateException("secret detail"));

    mockMvc
        .perform(get("/api/fleet/endpoints"))
        .andExpect(status().isInternalServerError())
        .andExpect(jsonPath("$.success").value(false))
        .andExpect(jsonPath("$.error.code").value("S001"))
        .andExpect(jsonPath("$.error.message").value("서버 내부 오류가 발생했습니다."));
  }
}
