package alert.grouping.service.grouping;

import alert.grouping.infrastructure.executor.LogicExecutor;
import alert.grouping.infrastructure.executor.TaskContext;
import alert.grouping.service.timer.GroupTimerService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * 기동 완료 시 그룹 인덱스와 타이머 복원
 *
 * <p>복원 실패는 기동을 막지 않습니다. 인덱스는 캐시이고, 놓친 타이머는 스윕이 이어받습니다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GroupStateRestorer {

  private final AlertGroupManager groupManager;
  private final GroupTimerService timerService;
  private final LogicExecutor executor;

  @EventListener(ApplicationReadyEvent.class)
  public void restore() {
    executor.executeOrCatch(
        groupManager::restoreFromStorage,
        e -> {
          log.error("[GroupStateRestorer] 그룹 복원 실패", e);
          return 0;
        },
        TaskContext.of("Startup", "RestoreGroups"));
    executor.executeOrCatch(
        timerService::restoreTimers,
        e -> {
          log.error("[GroupStateRestorer] 타이머 복원 실패", e);
          return 0;
        },
        TaskContext.of("Startup", "RestoreTimers"));
  }
}
