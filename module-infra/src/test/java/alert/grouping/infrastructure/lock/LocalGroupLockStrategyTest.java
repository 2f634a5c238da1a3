package alert.grouping.infrastructure.lock;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import alert.grouping.error.exception.InvalidAlertException;
import alert.grouping.infrastructure.executor.DefaultLogicExecutor;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
@DisplayName("LocalGroupLockStrategy 테스트")
class LocalGroupLockStrategyTest {

  private static final Duration LEASE = Duration.ofSeconds(30);

  private final LocalGroupLockStrategy strategy =
      new LocalGroupLockStrategy(new DefaultLogicExecutor());

  @Test
  @DisplayName("락을 얻으면 작업 결과를 반환한다")
  void returnsResult() {
    assertThat(strategy.tryExecute("lock:timer:a", LEASE, () -> "done")).contains("done");
  }

  @Test
  @DisplayName("다른 스레드가 보유 중이면 대기 없이 empty")
  void contendedReturnsEmpty() throws Exception {
    Optional<Optional<String>> nested =
        strategy.tryExecute(
            "lock:timer:a",
            LEASE,
            () ->
                CompletableFuture.supplyAsync(
                        () -> strategy.tryExecute("lock:timer:a", LEASE, () -> "inner"))
                    .get(5, TimeUnit.SECONDS));

    assertThat(nested).contains(Optional.empty());
  }

  @Test
  @DisplayName("작업 예외는 전파되고 락은 해제된다")
  void releasesOnFailure() {
    assertThatThrownBy(
            () ->
                strategy.tryExecute(
                    "lock:timer:a",
                    LEASE,
                    () -> {
                      throw new InvalidAlertException("boom");
                    }))
        .isInstanceOf(InvalidAlertException.class);

    assertThat(strategy.tryExecute("lock:timer:a", LEASE, () -> 1)).contains(1);
  }
}
