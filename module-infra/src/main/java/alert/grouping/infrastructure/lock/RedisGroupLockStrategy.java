package alert.grouping.infrastructure.lock;

import alert.grouping.common.function.ThrowingSupplier;
import alert.grouping.infrastructure.executor.LogicExecutor;
import alert.grouping.infrastructure.executor.TaskContext;
import alert.grouping.infrastructure.executor.strategy.ExceptionTranslator;
import alert.grouping.infrastructure.redis.RedissonClientProvider;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RLock;

/** Redisson RLock 기반 분산 락 (waitTime 0, leaseTime 지정) */
@Slf4j
@RequiredArgsConstructor
public class RedisGroupLockStrategy implements GroupLockStrategy {

  private static final String COMPONENT = "RedisGroupLock";

  private final RedissonClientProvider clientProvider;
  private final LogicExecutor executor;

  @Override
  public <T> Optional<T> tryExecute(String lockKey, Duration lease, ThrowingSupplier<T> task) {
    RLock lock =
        executor.executeWithTranslation(
            () -> clientProvider.get().getLock(lockKey),
            ExceptionTranslator.forLock(),
            TaskContext.of(COMPONENT, "getLock", lockKey));
    boolean acquired =
        executor.executeWithTranslation(
            () -> lock.tryLock(0, lease.toMillis(), TimeUnit.MILLISECONDS),
            ExceptionTranslator.forLock(),
            TaskContext.of(COMPONENT, "tryLock", lockKey));
    if (!acquired) {
      log.debug("[RedisGroupLock] 다른 인스턴스가 보유 중 - key={}", lockKey);
      return Optional.empty();
    }
    return Optional.ofNullable(
        executor.executeWithFinally(
            task,
            () -> unlockSafely(lock, lockKey),
            TaskContext.of(COMPONENT, "execute", lockKey)));
  }

  private void unlockSafely(RLock lock, String lockKey) {
    executor.executeOrDefault(
        () -> {
          if (lock.isHeldByCurrentThread()) {
            lock.unlock();
          }
          return null;
        },
        null,
        TaskContext.of(COMPONENT, "unlock", lockKey));
  }
}
