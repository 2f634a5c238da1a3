package alert.grouping.infrastructure.lock;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import alert.grouping.common.function.ThrowingSupplier;
import alert.grouping.error.exception.StorageUnavailableException;
import alert.grouping.infrastructure.executor.DefaultLogicExecutor;
import alert.grouping.infrastructure.metrics.GroupingMetrics;
import alert.grouping.infrastructure.storage.StorageCoordinator;
import alert.grouping.infrastructure.storage.memory.InMemoryGroupStorage;
import alert.grouping.infrastructure.support.FlakyGroupStorage;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
@DisplayName("ResilientGroupLockStrategy 테스트")
class ResilientGroupLockStrategyTest {

  private static final Duration LEASE = Duration.ofSeconds(30);

  private FlakyGroupStorage groupPrimary;
  private StorageCoordinator coordinator;
  private GroupLockStrategy distributed;
  private LocalGroupLockStrategy local;
  private ResilientGroupLockStrategy strategy;

  @BeforeEach
  void setUp() {
    groupPrimary = new FlakyGroupStorage();
    coordinator =
        new StorageCoordinator(
            groupPrimary,
            new InMemoryGroupStorage(),
            new DefaultLogicExecutor(),
            new GroupingMetrics(new SimpleMeterRegistry()),
            true,
            true);
    distributed = mock(GroupLockStrategy.class);
    local = new LocalGroupLockStrategy(new DefaultLogicExecutor());
    strategy = new ResilientGroupLockStrategy(distributed, local, coordinator);
  }

  @Test
  @DisplayName("fallback 사용 중에는 분산 락을 건드리지 않는다")
  void usesLocalWhileOnFallback() {
    groupPrimary.goDown();
    coordinator.checkHealth();

    assertThat(strategy.tryExecute("lock:timer:a", LEASE, () -> "local")).contains("local");
    verify(distributed, never()).tryExecute(anyString(), any(), any());
  }

  @Test
  @DisplayName("Redis 락 획득 전 인프라 장애면 로컬 락으로 실행한다")
  void fallsBackBeforeAcquisition() {
    given(distributed.tryExecute(anyString(), any(), any()))
        .willThrow(new StorageUnavailableException("redis", "tryLock"));

    assertThat(strategy.tryExecute("lock:timer:a", LEASE, () -> "local")).contains("local");
  }

  @Test
  @DisplayName("락 획득 후 작업에서 난 예외는 로컬 재실행 없이 전파된다")
  @SuppressWarnings("unchecked")
  void propagatesTaskFailureAfterAcquisition() {
    given(distributed.tryExecute(anyString(), any(), any()))
        .willAnswer(
            invocation -> {
              ThrowingSupplier<Object> task = invocation.getArgument(2);
              return java.util.Optional.ofNullable(task.get());
            });
    int[] runs = {0};

    assertThatThrownBy(
            () ->
                strategy.tryExecute(
                    "lock:timer:a",
                    LEASE,
                    () -> {
                      runs[0]++;
                      throw new StorageUnavailableException("redis", "store");
                    }))
        .isInstanceOf(StorageUnavailableException.class);
    assertThat(runs[0]).isEqualTo(1);
  }
}
