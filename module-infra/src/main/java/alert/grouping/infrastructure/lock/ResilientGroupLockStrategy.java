package alert.grouping.infrastructure.lock;

import alert.grouping.common.function.ThrowingSupplier;
import alert.grouping.error.exception.StorageUnavailableException;
import alert.grouping.infrastructure.storage.StorageCoordinator;
import java.time.Duration;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

/**
 * Redis 분산 락 우선, 장애 시 프로세스 내 락으로 fallback
 *
 * <ul>
 *   <li>coordinator 가 fallback 사용 중: 레플리카별 상태가 독립이므로 로컬 락
 *   <li>Redis 락 획득 중 인프라 예외: 로컬 락으로 재시도
 *   <li>작업 자체의 예외: 그대로 전파
 * </ul>
 */
@Slf4j
public class ResilientGroupLockStrategy implements GroupLockStrategy {

  private final GroupLockStrategy distributed;
  private final GroupLockStrategy local;
  private final StorageCoordinator coordinator;

  public ResilientGroupLockStrategy(
      GroupLockStrategy distributed, GroupLockStrategy local, StorageCoordinator coordinator) {
    this.distributed = distributed;
    this.local = local;
    this.coordinator = coordinator;
  }

  @Override
  public <T> Optional<T> tryExecute(String lockKey, Duration lease, ThrowingSupplier<T> task) {
    if (!coordinator.isPrimaryActive()) {
      return local.tryExecute(lockKey, lease, task);
    }
    LockAttempt attempt = new LockAttempt();
    try {
      return distributed.tryExecute(
          lockKey,
          lease,
          () -> {
            attempt.acquired = true;
            return task.get();
          });
    } catch (StorageUnavailableException e) {
      if (attempt.acquired) {
        throw e;
      }
      log.warn(
          "[ResilientGroupLock] Redis 락 실패, 로컬 락으로 전환 - key={}, cause={}",
          lockKey,
          e.getMessage());
      return local.tryExecute(lockKey, lease, task);
    }
  }

  /** 락 획득 이후의 예외(작업 예외)와 획득 실패를 구분 */
  private static final class LockAttempt {
    private boolean acquired;
  }
}
