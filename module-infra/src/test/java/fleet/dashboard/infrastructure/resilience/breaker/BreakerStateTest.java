package fleet.dashboard.infrastructure.resilience.breaker;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
@DisplayName("BreakerState 전이 테스트")
class BreakerStateTest {

  private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");
  private static final Duration RESET = Duration.ofSeconds(30);

  @Test
  @DisplayName("CLOSED: 연속 실패가 threshold에 도달하면 OPEN")
  void closed_opensAtThreshold() {
    BreakerState state = BreakerState.initial();
    for (int i = 0; i < 4; i++) {
      BreakerState.Observation o = state.onFailure(T0, 5);
      assertThat(o.transitioned()).isFalse();
      state = o.state();
    }

    BreakerState.Observation fifth = state.onFailure(T0, 5);

    assertThat(fifth.transitioned()).isTrue();
    assertThat(fifth.state().state()).isEqualTo(CircuitState.OPEN);
    assertThat(fifth.state().openedAt()).isEqualTo(T0);
  }

  @Test
  @DisplayName("CLOSED: 성공은 연속 실패 카운트를 0으로")
  void closed_successResetsFailures() {
    BreakerState state = BreakerState.initial().onFailure(T0, 5).state().onFailure(T0, 5).state();

    BreakerState next = state.onSuccess().state();

    assertThat(next.failures()).isZero();
    assertThat(next.successes()).isEqualTo(1);
    assertThat(next.state()).isEqualTo(CircuitState.CLOSED);
  }

  @Test
  @DisplayName("OPEN: resetTimeout 경과 시점부터 HALF_OPEN")
  void open_halfOpensAfterTimeout() {
    BreakerState open = BreakerState.initial().onFailure(T0, 1).state();

    assertThat(open.observe(T0.plus(RESET).minusMillis(1), RESET).state().state())
        .isEqualTo(CircuitState.OPEN);
    assertThat(open.observe(T0.plus(RESET), RESET).state().state())
        .isEqualTo(CircuitState.HALF_OPEN);
  }

  @Test
  @DisplayName("HALF_OPEN: 실패 시 OPEN + openedAt 갱신 + 연속 probe 실패 증가, 성공 시 CLOSED")
  void halfOpen_transitions() {
    BreakerState halfOpen =
        BreakerState.initial().onFailure(T0, 1).state().observe(T0.plus(RESET), RESET).state();
    Instant later = T0.plus(RESET).plusSeconds(1);

    BreakerState reopened = halfOpen.onFailure(later, 5).state();
    assertThat(reopened.state()).isEqualTo(CircuitState.OPEN);
    assertThat(reopened.openedAt()).isEqualTo(later);
    assertThat(reopened.consecutiveProbeFailures()).isEqualTo(1);

    BreakerState closed = halfOpen.onSuccess().state();
    assertThat(closed.state()).isEqualTo(CircuitState.CLOSED);
    assertThat(closed.failures()).isZero();
    assertThat(closed.consecutiveProbeFailures()).isZero();
  }

  @Test
  @DisplayName("count*는 상태를 바꾸지 않고 카운트만 반영")
  void count_keepsState() {
    BreakerState halfOpen =
        BreakerState.initial().onFailure(T0, 1).state().observe(T0.plus(RESET), RESET).state();
    Instant later = T0.plus(RESET).plusSeconds(1);

    BreakerState afterSuccess = halfOpen.countSuccess();
    BreakerState afterFailure = halfOpen.countFailure(later);

    assertThat(afterSuccess.state()).isEqualTo(CircuitState.HALF_OPEN);
    assertThat(afterSuccess.successes()).isEqualTo(halfOpen.successes() + 1);
    assertThat(afterFailure.state()).isEqualTo(CircuitState.HALF_OPEN);
    assertThat(afterFailure.failures()).isEqualTo(halfOpen.failures() + 1);
    assertThat(afterFailure.lastFailureAt()).isEqualTo(later);
    assertThat(afterFailure.openedAt()).isEqualTo(T0);
  }
}
