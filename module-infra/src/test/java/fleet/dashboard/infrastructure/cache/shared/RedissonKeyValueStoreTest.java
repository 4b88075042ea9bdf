package fleet.dashboard.infrastructure.cache.shared;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.containers.wait.strategy.Wait;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

/**
 * 실제 Redis 대상 {@link RedissonKeyValueStore} 통합 테스트
 *
 * <p>Docker가 없는 환경에서는 건너뜁니다.
 */
@Tag("integration")
@Testcontainers(disabledWithoutDocker = true)
@DisplayName("RedissonKeyValueStore 통합 테스트")
class RedissonKeyValueStoreTest {

  @Container
  static final GenericContainer<?> REDIS =
      new GenericContainer<>(DockerImageName.parse("redis:7-alpine"))
          .withExposedPorts(6379)
          .waitingFor(Wait.forListeningPort());

  private static RemoteKeyValueStore store;

  @BeforeAll
  static void connect() {
    String url = "redis://" + REDIS.getHost() + ":" + REDIS.getMappedPort(6379);
    store = new RedissonStoreConnector(url, null, 2000, 2000).connect();
  }

  @AfterAll
  static void close() {
    if (store != null) {
      store.close();
    }
  }

  @BeforeEach
  void flush() {
    store.deleteByPrefix("");
  }

  @Test
  @DisplayName("파이프라인 쓰기 + multi-get, 반대편 변형 키는 함께 삭제")
  void writeAllAndGetAll() {
    // Given
    store.writeAll(List.of(new RemoteWrite("k:a:gz", "old", Duration.ofMinutes(1), null)));

    // When
    store.writeAll(
        List.of(
            new RemoteWrite("k:a", "{\"v\":1}", Duration.ofMinutes(1), "k:a:gz"),
            new RemoteWrite("k:b", "{\"v\":2}", Duration.ofMinutes(1), null)));

    // Then
    assertThat(store.getAll(List.of("k:a", "k:a:gz", "k:b", "k:missing")))
        .containsOnlyKeys("k:a", "k:b")
        .containsEntry("k:b", "{\"v\":2}");
    assertThat(store.get("k:a")).contains("{\"v\":1}");
  }

  @Test
  @DisplayName("TTL 만료 후 조회되지 않음")
  void ttlExpires() throws InterruptedException {
    store.writeAll(List.of(new RemoteWrite("k:short", "x", Duration.ofMillis(200), null)));

    Thread.sleep(400);

    assertThat(store.get("k:short")).isEmpty();
  }

  @Test
  @DisplayName("태그 집합, prefix 카운트/삭제")
  void setsAndPrefixes() {
    store.addToSet("tag:containers", Set.of("k:a", "k:b"), Duration.ofMinutes(1));
    store.writeAll(
        List.of(
            new RemoteWrite("p:1", "1", Duration.ofMinutes(1), null),
            new RemoteWrite("p:2", "2", Duration.ofMinutes(1), null)));

    assertThat(store.members("tag:containers")).containsExactlyInAnyOrder("k:a", "k:b");
    assertThat(store.countByPrefix("p:")).isEqualTo(2);
    assertThat(store.deleteByPrefix("p:")).isEqualTo(2);
    assertThat(store.delete(List.of("tag:containers"))).isEqualTo(1);
  }

  @Test
  @DisplayName("태그 집합 TTL은 짧은 TTL로 덮어쓰이지 않음")
  void setTtl_onlyExtends() throws InterruptedException {
    // Given
    store.addToSet("t:ep", List.of("k:images"), Duration.ofSeconds(5));
    store.addToSet("t:ep", List.of("k:stats"), Duration.ofMillis(500));

    // When
    Thread.sleep(1_000);

    // Then
    assertThat(store.members("t:ep")).containsExactlyInAnyOrder("k:images", "k:stats");
  }

  @Test
  @DisplayName("ping과 INFO")
  void pingAndInfo() {
    assertThat(store.ping()).isTrue();
    assertThat(store.info()).containsKey("used_memory_human");
  }
}
