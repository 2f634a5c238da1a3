package alert.grouping.scheduler;

import alert.grouping.config.GroupingProperties;
import alert.grouping.infrastructure.executor.LogicExecutor;
import alert.grouping.infrastructure.executor.TaskContext;
import alert.grouping.service.grouping.AlertGroupManager;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/** 만료 그룹 정리 (기본 5분). 저장소 TTL 은 이 작업이 멈췄을 때의 backstop 입니다. */
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(
    name = "scheduler.grouping.enabled",
    havingValue = "true",
    matchIfMissing = true)
public class GroupCleanupScheduler {

  private final AlertGroupManager groupManager;
  private final GroupingProperties properties;
  private final LogicExecutor executor;

  @Scheduled(
      fixedDelayString = "${grouping.cleanup-interval:5m}",
      initialDelayString = "${grouping.cleanup-interval:5m}")
  public void cleanup() {
    executor.executeVoid(
        () -> groupManager.cleanupExpiredGroups(properties.maxGroupAge()),
        TaskContext.of("Scheduler", "Group.Cleanup"));
  }
}
