package alert.grouping.infrastructure.storage;

import static alert.grouping.infrastructure.support.GroupFixtures.group;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import alert.grouping.domain.model.group.AlertGroup;
import alert.grouping.domain.model.group.GroupKey;
import alert.grouping.error.exception.GroupNotFoundException;
import alert.grouping.error.exception.StorageUnavailableException;
import alert.grouping.error.exception.VersionMismatchException;
import alert.grouping.infrastructure.executor.DefaultLogicExecutor;
import alert.grouping.infrastructure.metrics.GroupingMetrics;
import alert.grouping.infrastructure.storage.memory.InMemoryGroupStorage;
import alert.grouping.infrastructure.support.FlakyGroupStorage;
import alert.grouping.infrastructure.support.GroupFixtures;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
@DisplayName("StorageCoordinator failover/recovery 테스트")
class StorageCoordinatorTest {

  private FlakyGroupStorage primary;
  private InMemoryGroupStorage fallback;
  private SimpleMeterRegistry registry;
  private StorageCoordinator coordinator;

  @BeforeEach
  void setUp() {
    primary = new FlakyGroupStorage();
    fallback = new InMemoryGroupStorage();
    registry = new SimpleMeterRegistry();
    coordinator =
        new StorageCoordinator(
            primary,
            fallback,
            new DefaultLogicExecutor(),
            new GroupingMetrics(registry),
            true,
            true);
  }

  @Nested
  @DisplayName("헬스체크")
  class HealthCheck {

    @Test
    @DisplayName("한 번의 헬스체크 실패로 fallback 으로 전환되고, 이후 Store 는 fallback 에서 성공한다")
    void failoverAfterOneFailedPoll() {
      primary.goDown();

      assertThat(coordinator.checkHealth()).isFalse();

      assertThat(coordinator.currentBackend()).isEqualTo(StorageBackend.FALLBACK);
      assertThat(coordinator.store(group("HighCPU", "f1"))).isEqualTo(1);
      assertThat(fallback.size()).isEqualTo(1);
      assertThat(
              registry.get("grouping.storage.fallback").tag("reason", "health_check_failed").counter().count())
          .isEqualTo(1.0);
      assertThat(registry.get("grouping.storage.health").tag("backend", "redis").gauge().value())
          .isZero();
    }

    @Test
    @DisplayName("primary 가 회복되면 다음 헬스체크에서 primary 로 복귀한다")
    void recoveryOnNextPoll() {
      primary.goDown();
      coordinator.checkHealth();

      primary.recover();
      coordinator.checkHealth();

      assertThat(coordinator.currentBackend()).isEqualTo(StorageBackend.PRIMARY);
      assertThat(registry.get("grouping.storage.recovery").counter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("복구 시 fallback 에만 있던 그룹은 primary 로 옮겨지고 fallback 은 비워진다")
    void reconcileOnRecovery() {
      primary.store(group("Existing", "e1"));
      primary.goDown();
      coordinator.checkHealth();
      coordinator.store(group("OutageOnly", "o1"));
      coordinator.store(group("Existing", "e2"));

      primary.recover();
      coordinator.checkHealth();

      assertThat(primary.listKeys())
          .containsExactlyInAnyOrder(
              GroupKey.of("alertname=Existing"), GroupKey.of("alertname=OutageOnly"));
      assertThat(primary.load(GroupKey.of("alertname=Existing")).contains("e1")).isTrue();
      assertThat(fallback.size()).isZero();
    }

    @Test
    @DisplayName("전환 리스너에 이전/새 백엔드와 사유가 전달된다")
    void listenerNotified() {
      List<String> events = new ArrayList<>();
      coordinator.addListener((from, to, reason) -> events.add(from + "->" + to + ":" + reason));

      primary.goDown();
      coordinator.checkHealth();
      primary.recover();
      coordinator.checkHealth();

      assertThat(events)
          .containsExactly(
              "PRIMARY->FALLBACK:health_check_failed", "FALLBACK->PRIMARY:health_check_recovered");
    }
  }

  @Nested
  @DisplayName("쓰기 경로")
  class WritePath {

    @Test
    @DisplayName("primary 쓰기 실패 시 강등 후 fallback 에 1회 재시도한다")
    void writeDemotesAndRetries() {
      primary.goDown();

      long version = coordinator.store(group("HighCPU", "f1"));

      assertThat(version).isEqualTo(1);
      assertThat(coordinator.currentBackend()).isEqualTo(StorageBackend.FALLBACK);
      assertThat(
              registry.get("grouping.storage.fallback").tag("reason", "store_error").counter().count())
          .isEqualTo(1.0);
    }

    @Test
    @DisplayName("primary 에서 읽은 기존 그룹도 강등 후 fallback 재시도에서 저장된다")
    void existingGroupSurvivesDemotion() {
      coordinator.store(group("HighCPU", "f1", "f2"));
      AlertGroup loaded = coordinator.load(GroupKey.of("alertname=HighCPU"));
      loaded.remove("f1", GroupFixtures.T0.plusSeconds(5));
      primary.goDown();

      long version = coordinator.store(loaded);

      assertThat(version).isEqualTo(2);
      assertThat(coordinator.currentBackend()).isEqualTo(StorageBackend.FALLBACK);
      AlertGroup stored = fallback.load(loaded.key());
      assertThat(stored.version()).isEqualTo(2);
      assertThat(stored.contains("f1")).isFalse();
      assertThat(stored.contains("f2")).isTrue();
    }

    @Test
    @DisplayName("버전 충돌은 강등 사유가 아니다")
    void versionMismatchDoesNotDemote() {
      AlertGroup g = group("HighCPU", "f1");
      coordinator.store(g);

      assertThatThrownBy(() -> coordinator.store(g)).isInstanceOf(VersionMismatchException.class);
      assertThat(coordinator.currentBackend()).isEqualTo(StorageBackend.PRIMARY);
      assertThat(
              registry
                  .get("grouping.storage.operations")
                  .tag("result", "conflict")
                  .counter()
                  .count())
          .isEqualTo(1.0);
    }

    @Test
    @DisplayName("fallback 이 비활성화되어 있으면 저장소 장애가 그대로 전파된다")
    void fallbackDisabledPropagates() {
      StorageCoordinator strict =
          new StorageCoordinator(
              primary,
              fallback,
              new DefaultLogicExecutor(),
              new GroupingMetrics(new SimpleMeterRegistry()),
              false,
              false);
      primary.goDown();

      assertThatThrownBy(() -> strict.store(group("HighCPU", "f1")))
          .isInstanceOf(StorageUnavailableException.class);
      assertThat(strict.currentBackend()).isEqualTo(StorageBackend.PRIMARY);
    }
  }

  @Test
  @DisplayName("읽기는 백엔드를 넘나들며 재시도하지 않는다")
  void readsDoNotRetryAcrossBackends() {
    fallback.store(group("OnlyInFallback", "f1"));
    primary.goDown();

    assertThatThrownBy(() -> coordinator.load(GroupKey.of("alertname=OnlyInFallback")))
        .isInstanceOf(StorageUnavailableException.class);
    assertThat(coordinator.currentBackend()).isEqualTo(StorageBackend.PRIMARY);
  }

  @Test
  @DisplayName("NotFound 는 not_found 결과로 집계된다")
  void notFoundCounted() {
    assertThatThrownBy(() -> coordinator.load(GroupKey.of("missing")))
        .isInstanceOf(GroupNotFoundException.class);

    assertThat(
            registry.get("grouping.storage.operations").tag("result", "not_found").counter().count())
        .isEqualTo(1.0);
  }
}
