package alert.grouping.scheduler;

import alert.grouping.infrastructure.executor.LogicExecutor;
import alert.grouping.infrastructure.executor.TaskContext;
import alert.grouping.service.timer.GroupTimerService;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/** 유예 기간을 넘긴 주인 없는 타이머 처리 (grace-period 주기) */
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(
    name = "scheduler.grouping.enabled",
    havingValue = "true",
    matchIfMissing = true)
public class TimerSweepScheduler {

  private final GroupTimerService timerService;
  private final LogicExecutor executor;

  @Scheduled(
      fixedDelayString = "${grouping.storage.grace-period:60s}",
      initialDelayString = "${grouping.storage.grace-period:60s}")
  public void sweep() {
    executor.executeVoid(
        timerService::sweepOverdueTimers, TaskContext.of("Scheduler", "Timer.Sweep"));
  }
}
