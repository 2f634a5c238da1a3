package alert.grouping.core.port.out;

import alert.grouping.domain.model.group.AlertGroup;
import alert.grouping.domain.model.timer.TimerType;
import java.time.Instant;

/**
 * 그룹 flush 알림 포트
 *
 * <p>WAIT / INTERVAL 타이머가 만료되면 현재 그룹 스냅샷과 함께 호출됩니다. 포맷팅과 전송은 구현체 책임입니다.
 */
@FunctionalInterface
public interface GroupNotificationPort {

  void onGroupFlush(GroupNotification notification);

  /**
   * @param group 그룹 스냅샷 (복사본)
   * @param trigger 만료된 타이머 종류
   * @param firedAt 만료 처리 시각
   */
  record GroupNotification(AlertGroup group, TimerType trigger, Instant firedAt) {}
}
