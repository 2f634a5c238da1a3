package alert.grouping.service.notification;

import alert.grouping.core.port.out.GroupNotificationPort;
import alert.grouping.domain.model.alert.Alert;
import alert.grouping.domain.model.group.AlertGroup;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/** flush 이벤트를 로그로 남기는 기본 알림 리스너 (외부 발행기 연결 전까지 사용) */
@Slf4j
@Component
@ConditionalOnProperty(
    name = "grouping.notification.log.enabled",
    havingValue = "true",
    matchIfMissing = true)
public class LoggingGroupNotifier implements GroupNotificationPort {

  @Override
  public void onGroupFlush(GroupNotification notification) {
    AlertGroup group = notification.group();
    log.info(
        "[GroupNotifier] {} flush - key={}, state={}, firing={}, resolved={}, alerts={}",
        notification.trigger().getTag(),
        group.key(),
        group.state(),
        group.metadata().firingCount(),
        group.metadata().resolvedCount(),
        group.alerts().stream().map(Alert::alertName).distinct().toList());
  }
}
