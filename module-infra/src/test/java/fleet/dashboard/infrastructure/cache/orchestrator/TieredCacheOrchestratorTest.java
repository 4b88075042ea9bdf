package fleet.dashboard.infrastructure.cache.orchestrator;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

import com.fasterxml.jackson.databind.ObjectMapper;
import fleet.dashboard.error.exception.CacheLoadException;
import fleet.dashboard.error.exception.upstream.UpstreamServerException;
import fleet.dashboard.infrastructure.cache.local.LocalTtlStore;
import fleet.dashboard.infrastructure.cache.orchestrator.strategy.LocalOnlyLayerStrategy;
import fleet.dashboard.infrastructure.cache.orchestrator.strategy.MultiLayerStrategy;
import fleet.dashboard.infrastructure.cache.shared.SharedCacheAdapter;
import fleet.dashboard.infrastructure.cache.shared.SharedCacheBackoff;
import fleet.dashboard.infrastructure.support.InMemoryRemoteStore;
import fleet.dashboard.infrastructure.support.MutableClock;
import fleet.dashboard.infrastructure.support.TestLogicExecutors;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.IntStream;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
@DisplayName("TieredCacheOrchestrator 단위 테스트")
class TieredCacheOrchestratorTest {

  private MutableClock clock;
  private LocalTtlStore local;
  private InMemoryRemoteStore remote;
  private SharedCacheAdapter shared;
  private ExecutorService fetchPool;
  private List<Runnable> revalidations;
  private TieredCacheOrchestrator orchestrator;

  @BeforeEach
  void setUp() {
    clock = MutableClock.startingAt("2026-01-01T00:00:00Z");
    local = new LocalTtlStore(clock, 0.8);
    remote = new InMemoryRemoteStore(clock);
    shared =
        new SharedCacheAdapter(
            () -> remote,
            new ObjectMapper(),
            TestLogicExecutors.create(),
            new SharedCacheBackoff(clock, 2_000, 300_000),
            new SimpleMeterRegistry(),
            "aidash:cache:",
            10_000);
    fetchPool = Executors.newFixedThreadPool(8);
    revalidations = new ArrayList<>();
    orchestrator = create(shared, revalidations::add);
  }

  @AfterEach
  void tearDown() {
    fetchPool.shutdownNow();
  }

  private TieredCacheOrchestrator create(SharedCacheAdapter adapter, Executor revalidateExecutor) {
    return new TieredCacheOrchestrator(
        local,
        adapter,
        new InFlightRegistry(),
        fetchPool,
        revalidateExecutor,
        new SimpleMeterRegistry(),
        300,
        clock);
  }

  private void runQueuedRevalidations() {
    List<Runnable> queued = new ArrayList<>(revalidations);
    revalidations.clear();
    queued.forEach(Runnable::run);
  }

  @Nested
  @DisplayName("cachedFetch")
  class CachedFetch {

    @Test
    @DisplayName("동시 miss 3건은 fetcher 1회 호출로 합쳐지고 모두 같은 값을 받음")
    void concurrentMisses_singleFetch() {
      // Given
      AtomicInteger invocations = new AtomicInteger();
      CountDownLatch release = new CountDownLatch(1);
      CacheFetchRequest<String> request =
          CacheFetchRequest.of(
              "containers:1",
              300,
              String.class,
              () -> {
                invocations.incrementAndGet();
                release.await(5, TimeUnit.SECONDS);
                return "fleet";
              });

      // When
      List<CompletableFuture<String>> callers =
          List.of(
              orchestrator.cachedFetchAsync(request),
              orchestrator.cachedFetchAsync(request),
              orchestrator.cachedFetchAsync(request));
      await().atMost(Duration.ofSeconds(5)).until(() -> invocations.get() == 1);
      assertThat(orchestrator.getInFlightCount()).isEqualTo(1);
      release.countDown();

      // Then
      assertThat(callers).allSatisfy(f -> assertThat(f.join()).isEqualTo("fleet"));
      assertThat(invocations.get()).isEqualTo(1);
      assertThat(orchestrator.getInFlightCount()).isZero();
      assertThat(local.get("containers:1")).contains("fleet");
      assertThat(remote.raw("aidash:cache:containers:1")).isEqualTo("\"fleet\"");
    }

    @Test
    @DisplayName("여러 스레드가 동시에 blocking 호출해도 fetcher는 1회")
    void concurrentBlockingCallers_singleFetch() {
      AtomicInteger invocations = new AtomicInteger();
      ExecutorService callers = Executors.newFixedThreadPool(10);
      try {
        List<CompletableFuture<String>> results =
            IntStream.range(0, 10)
                .mapToObj(
                    i ->
                        CompletableFuture.supplyAsync(
                            () ->
                                orchestrator.cachedFetch(
                                    "endpoints",
                                    900,
                                    String.class,
                                    () -> {
                                      invocations.incrementAndGet();
                                      Thread.sleep(100);
                                      return "all";
                                    }),
                            callers))
                .toList();

        assertThat(results).allSatisfy(f -> assertThat(f.join()).isEqualTo("all"));
        assertThat(invocations.get()).isEqualTo(1);
      } finally {
        callers.shutdownNow();
      }
    }

    @Test
    @DisplayName("fetcher 예외는 재해석 없이 전파되고, 다음 호출은 다시 fetch")
    void fetcherError_propagatesUnchanged() {
      AtomicInteger invocations = new AtomicInteger();
      UpstreamServerException failure = new UpstreamServerException(503, "/api/endpoints");

      assertThatThrownBy(
              () ->
                  orchestrator.cachedFetch(
                      "endpoints",
                      900,
                      String.class,
                      () -> {
                        invocations.incrementAndGet();
                        throw failure;
                      }))
          .isSameAs(failure);
      assertThat(orchestrator.getInFlightCount()).isZero();

      String value = orchestrator.cachedFetch("endpoints", 900, String.class, () -> "recovered");

      assertThat(value).isEqualTo("recovered");
      assertThat(invocations.get()).isEqualTo(1);
    }

    @Test
    @DisplayName("Checked 예외는 CacheLoadException으로 감싸 전파")
    void checkedException_wrapped() {
      IOException io = new IOException("disk");

      assertThatThrownBy(
              () ->
                  orchestrator.cachedFetch(
                      "k",
                      60,
                      String.class,
                      () -> {
                        throw io;
                      }))
          .isInstanceOf(CacheLoadException.class)
          .hasCause(io);
    }

    @Test
    @DisplayName("L2 hit이면 fetcher 없이 반환하고 L1에 backfill")
    void sharedHit_backfillsLocal() {
      shared.set("stacks", "from-redis", 600);

      String value =
          orchestrator.cachedFetch(
              "stacks",
              600,
              String.class,
              () -> {
                throw new AssertionError("fetcher must not run");
              });

      assertThat(value).isEqualTo("from-redis");
      assertThat(local.get("stacks")).contains("from-redis");
    }

    @Test
    @DisplayName("null 결과는 캐시하지 않음")
    void nullResult_notCached() {
      AtomicInteger invocations = new AtomicInteger();

      orchestrator.cachedFetch(
          "k",
          60,
          String.class,
          () -> {
            invocations.incrementAndGet();
            return null;
          });
      orchestrator.cachedFetch(
          "k",
          60,
          String.class,
          () -> {
            invocations.incrementAndGet();
            return null;
          });

      assertThat(invocations.get()).isEqualTo(2);
      assertThat(local.size()).isZero();
    }

    @Test
    @DisplayName("공유 캐시 장애 시 memory-only로 계속 동작")
    void sharedOutage_degradesToMemoryOnly() {
      remote.goDown();

      String first = orchestrator.cachedFetch("images:1", 600, String.class, () -> "img");
      String second =
          orchestrator.cachedFetch(
              "images:1",
              600,
              String.class,
              () -> {
                throw new AssertionError("L1 should serve");
              });

      assertThat(first).isEqualTo("img");
      assertThat(second).isEqualTo("img");
      assertThat(orchestrator.getStats().backend()).isEqualTo(LocalOnlyLayerStrategy.BACKEND);
    }
  }

  @Nested
  @DisplayName("cachedFetchSWR")
  class StaleWhileRevalidate {

    @Test
    @DisplayName("fresh hit은 재검증 없이 반환")
    void fresh_noRevalidation() {
      orchestrator.set("stats:1:c1", "v1", 100);

      String value = orchestrator.cachedFetchSWR("stats:1:c1", 100, String.class, () -> "v2");

      assertThat(value).isEqualTo("v1");
      assertThat(revalidations).isEmpty();
    }

    @Test
    @DisplayName("stale hit은 이전 값을 즉시 반환하고 백그라운드에서 갱신")
    void stale_returnsOldAndRefreshes() {
      orchestrator.set("stats:1:c1", "v1", 100);
      clock.advance(Duration.ofSeconds(81));

      String value = orchestrator.cachedFetchSWR("stats:1:c1", 100, String.class, () -> "v2");

      assertThat(value).isEqualTo("v1");
      assertThat(revalidations).hasSize(1);
      runQueuedRevalidations();
      assertThat(local.get("stats:1:c1")).contains("v2");
    }

    @Test
    @DisplayName("같은 키의 재검증은 동시에 하나만")
    void duplicateRevalidation_suppressed() {
      orchestrator.set("k", "v1", 100);
      clock.advance(Duration.ofSeconds(90));

      orchestrator.cachedFetchSWR("k", 100, String.class, () -> "v2");
      orchestrator.cachedFetchSWR("k", 100, String.class, () -> "v3");

      assertThat(revalidations).hasSize(1);
      assertThat(orchestrator.getInFlightCount()).isEqualTo(1);
      runQueuedRevalidations();
      assertThat(orchestrator.getInFlightCount()).isZero();
      assertThat(local.get("k")).contains("v2");
    }

    @Test
    @DisplayName("재검증 실패는 호출자에게 보이지 않고 stale 값 유지")
    void revalidationFailure_keepsStale() {
      orchestrator.set("k", "v1", 100);
      clock.advance(Duration.ofSeconds(90));

      String value =
          orchestrator.cachedFetchSWR(
              "k",
              100,
              String.class,
              () -> {
                throw new UpstreamServerException(500, "/api/stacks");
              });
      runQueuedRevalidations();

      assertThat(value).isEqualTo("v1");
      assertThat(local.get("k")).contains("v1");
      assertThat(orchestrator.getInFlightCount()).isZero();
    }

    @Test
    @DisplayName("cold cache는 cachedFetch처럼 대기 후 반환")
    void cold_blocks() {
      String value = orchestrator.cachedFetchSWR("k", 100, String.class, () -> "fresh");

      assertThat(value).isEqualTo("fresh");
      assertThat(revalidations).isEmpty();
    }
  }

  @Nested
  @DisplayName("부가 연산")
  class Operations {

    @Test
    @DisplayName("cachedFetchMany는 입력 순서를 보존")
    void fetchMany_preservesOrder() {
      List<CacheFetchRequest<String>> requests =
          List.of(
              CacheFetchRequest.of(
                  "a",
                  60,
                  String.class,
                  () -> {
                    Thread.sleep(50);
                    return "A";
                  }),
              CacheFetchRequest.of("b", 60, String.class, () -> "B"),
              CacheFetchRequest.of("c", 60, String.class, () -> "C"));

      assertThat(orchestrator.cachedFetchMany(requests)).containsExactly("A", "B", "C");
    }

    @Test
    @DisplayName("invalidateTag는 양쪽 계층에서 태그 항목을 제거")
    void invalidateTag_bothLayers() {
      orchestrator.cachedFetch(
          CacheFetchRequest.of("containers:1", 300, String.class, () -> "c1")
              .withTags("containers", "endpoint-1"));
      orchestrator.cachedFetch(
          CacheFetchRequest.of("stacks", 600, String.class, () -> "s").withTags("stacks"));

      orchestrator.invalidateTag("endpoint-1");

      assertThat(local.get("containers:1")).isEmpty();
      assertThat(remote.raw("aidash:cache:containers:1")).isNull();
      assertThat(local.get("stacks")).contains("s");
    }

    @Test
    @DisplayName("통계: backend, 계층 크기, hit/miss")
    void stats() {
      orchestrator.cachedFetch("a", 60, String.class, () -> "A");
      orchestrator.cachedFetch("a", 60, String.class, () -> "A");

      CacheStats stats = orchestrator.getStats();

      assertThat(stats.backend()).isEqualTo(MultiLayerStrategy.BACKEND);
      assertThat(stats.l1Size()).isEqualTo(1);
      assertThat(stats.l2Size()).isEqualTo(1);
      assertThat(stats.hits()).isEqualTo(1);
      assertThat(stats.misses()).isEqualTo(1);
      assertThat(stats.hitRate()).isEqualTo(0.5);
      assertThat(stats.shared()).isNotNull();
    }

    @Test
    @DisplayName("공유 캐시 미구성 시 memory-only, shared 통계는 null")
    void withoutShared_memoryOnly() {
      TieredCacheOrchestrator memoryOnly = create(null, Runnable::run);

      memoryOnly.cachedFetch("a", 60, String.class, () -> "A");

      assertThat(memoryOnly.getStats().backend()).isEqualTo(LocalOnlyLayerStrategy.BACKEND);
      assertThat(memoryOnly.getStats().shared()).isNull();
      assertThat(memoryOnly.getEntries())
          .singleElement()
          .satisfies(
              entry -> {
                assertThat(entry.key()).isEqualTo("a");
                assertThat(entry.expiresInSeconds()).isEqualTo(60);
                assertThat(entry.stale()).isFalse();
              });
    }
  }
}
