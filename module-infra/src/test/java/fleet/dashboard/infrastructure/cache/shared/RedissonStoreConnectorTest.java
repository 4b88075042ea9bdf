package fleet.dashboard.infrastructure.cache.shared;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

@Tag("unit")
@DisplayName("RedissonStoreConnector 단위 테스트")
class RedissonStoreConnectorTest {

  @ParameterizedTest(name = "{0} + {1} → {2}")
  @CsvSource(
      nullValues = "null",
      value = {
        "redis://cache:6379, s3cret, redis://:s3cret@cache:6379",
        "redis://cache:6379, null, redis://cache:6379",
        "redis://cache:6379, '  ', redis://cache:6379",
        "redis://:keep@cache:6379, other, redis://:keep@cache:6379",
        "rediss://cache:6380/2, p@ss, rediss://:p%40ss@cache:6380/2"
      })
  @DisplayName("REDIS_PASSWORD는 userinfo가 없을 때만 주입")
  void withPassword(String url, String password, String expected) {
    assertThat(RedissonStoreConnector.withPassword(url, password)).isEqualTo(expected);
  }
}
