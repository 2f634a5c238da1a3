package alert.grouping.infrastructure.lock;

import alert.grouping.common.function.ThrowingSupplier;
import java.time.Duration;
import java.util.Optional;

/**
 * 그룹 단위 배타 실행 전략
 *
 * <p>대기 없이 락을 시도하고, 다른 인스턴스/스레드가 보유 중이면 작업을 건너뜁니다.
 */
public interface GroupLockStrategy {

  /**
   * @param lockKey 락 키
   * @param lease 최대 보유 시간 (보유자가 죽으면 자동 해제)
   * @param task 락 보유 중 실행할 작업
   * @return 락 획득 시 작업 결과, 획득 실패 시 empty
   */
  <T> Optional<T> tryExecute(String lockKey, Duration lease, ThrowingSupplier<T> task);
}
