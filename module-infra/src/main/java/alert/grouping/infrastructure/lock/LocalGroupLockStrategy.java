package alert.grouping.infrastructure.lock;

import alert.grouping.common.function.ThrowingSupplier;
import alert.grouping.infrastructure.executor.LogicExecutor;
import alert.grouping.infrastructure.executor.TaskContext;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import lombok.RequiredArgsConstructor;

/** 프로세스 내 락 (Redis 장애 시 fallback). lease 는 무시됩니다. */
@RequiredArgsConstructor
public class LocalGroupLockStrategy implements GroupLockStrategy {

  private final LogicExecutor executor;
  private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();

  @Override
  public <T> Optional<T> tryExecute(String lockKey, Duration lease, ThrowingSupplier<T> task) {
    ReentrantLock lock = locks.computeIfAbsent(lockKey, k -> new ReentrantLock());
    if (!lock.tryLock()) {
      return Optional.empty();
    }
    return Optional.ofNullable(
        executor.executeWithFinally(
            task,
            () -> {
              lock.unlock();
              if (!lock.hasQueuedThreads()) {
                locks.remove(lockKey, lock);
              }
            },
            TaskContext.of("LocalGroupLock", "execute", lockKey)));
  }
}
