package alert.grouping.service.timer;

import alert.grouping.config.GroupingProperties;
import alert.grouping.core.port.out.GroupNotificationPort;
import alert.grouping.core.port.out.GroupNotificationPort.GroupNotification;
import alert.grouping.core.port.out.GroupStorage;
import alert.grouping.core.port.out.TimerStorage;
import alert.grouping.domain.model.group.AlertGroup;
import alert.grouping.domain.model.group.GroupKey;
import alert.grouping.domain.model.group.GroupState;
import alert.grouping.domain.model.timer.GroupTimer;
import alert.grouping.domain.model.timer.TimerType;
import alert.grouping.error.exception.GroupNotFoundException;
import alert.grouping.infrastructure.config.GroupStorageProperties;
import alert.grouping.infrastructure.executor.LogicExecutor;
import alert.grouping.infrastructure.executor.TaskContext;
import alert.grouping.infrastructure.lock.GroupLockStrategy;
import alert.grouping.infrastructure.metrics.GroupingMetrics;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

/**
 * 그룹 WAIT / INTERVAL 타이머 관리
 *
 * <h3>영속화</h3>
 *
 * <p>타이머는 절대 만료 시각으로 {@link TimerStorage} 에 기록되어 재시작 후에도 복원됩니다. 그룹 키당 하나만 존재하며 로컬에는
 * {@link TaskScheduler} 핸들만 보관합니다.
 *
 * <h3>만료 처리 (멱등)</h3>
 *
 * <ol>
 *   <li>{@code lock:timer:<key>} 분산 락 획득 (실패 시 다른 인스턴스가 처리 중이므로 건너뜀)
 *   <li>저장된 타이머 재조회. 없거나 스케줄이 바뀌었으면 취소/교체된 것으로 보고 종료
 *   <li>그룹 재조회. 없거나 재생성된 그룹이면 타이머 폐기
 *   <li>{@code fired=true} 기록 후 알림 리스너 호출
 *   <li>그룹이 FIRING 이면 INTERVAL 재설정, 아니면 타이머 삭제
 * </ol>
 *
 * <p>{@code fired=true} 로 남은 타이머(알림 후 재설정 전 크래시)는 알림 없이 다음 단계만 진행합니다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GroupTimerService {

  public static final String LOCK_PREFIX = "lock:timer:";

  private static final String COMPONENT = "GroupTimerService";

  private final TimerStorage timerStorage;
  private final GroupStorage groupStorage;
  private final GroupLockStrategy lockStrategy;
  private final TaskScheduler taskScheduler;
  private final List<GroupNotificationPort> notificationPorts;
  private final GroupingProperties groupingProperties;
  private final GroupStorageProperties storageProperties;
  private final GroupingMetrics metrics;
  private final LogicExecutor executor;
  private final Clock clock;

  private final Map<GroupKey, ScheduledFuture<?>> handles = new ConcurrentHashMap<>();
  private final String instanceId = resolveInstanceId();

  /** 새 그룹(또는 재사용된 그룹 레코드)의 첫 flush 타이머. 기존 타이머는 교체됩니다. */
  public GroupTimer startWaitTimer(AlertGroup group) {
    return start(group, TimerType.WAIT, groupingProperties.groupWait());
  }

  /** 그룹 삭제 시 호출. 이미 실행 대기 중인 핸들이 발화해도 저장된 타이머가 없으므로 무시됩니다. */
  public void cancel(GroupKey key) {
    ScheduledFuture<?> handle = handles.remove(key);
    if (handle != null) {
      handle.cancel(false);
    }
    timerStorage.delete(key);
    metrics.recordTimerEvent("any", "cancelled");
    log.debug("[GroupTimerService] 타이머 취소 - key={}", key);
  }

  /**
   * 기동 시 저장된 타이머 전체를 다시 스케줄. 이미 만료된 타이머는 즉시 실행됩니다.
   *
   * @return 복원된 타이머 수
   */
  public int restoreTimers() {
    List<GroupTimer> timers = timerStorage.listAll();
    Instant now = clock.instant();
    int overdue = 0;
    for (GroupTimer timer : timers) {
      if (timer.isExpired(now)) {
        overdue++;
      }
      schedule(timer);
    }
    log.info("[GroupTimerService] 타이머 복원 완료 - total={}, overdue={}", timers.size(), overdue);
    return timers.size();
  }

  /**
   * 유예 기간을 넘겨 만료되었는데 로컬 핸들이 없는 타이머 처리
   *
   * <p>INTERVAL 을 재설정한 인스턴스가 죽은 경우를 다른 인스턴스가 이어받습니다.
   *
   * @return 처리 시도한 타이머 수
   */
  public int sweepOverdueTimers() {
    Instant horizon = clock.instant().minus(storageProperties.gracePeriod());
    int swept = 0;
    for (GroupTimer timer : timerStorage.listAll()) {
      if (!timer.expiresAt().isBefore(horizon) || hasLiveHandle(timer.groupKey())) {
        continue;
      }
      log.warn(
          "[GroupTimerService] 놓친 타이머 처리 - key={}, type={}, expiresAt={}",
          timer.groupKey(),
          timer.type().getTag(),
          timer.expiresAt());
      metrics.recordTimerEvent(timer.type().getTag(), "missed");
      fire(timer);
      swept++;
    }
    return swept;
  }

  private GroupTimer start(AlertGroup group, TimerType type, Duration duration) {
    GroupTimer timer =
        GroupTimer.start(
            group.key(), type, duration, clock.instant(), group.metadata().createdAt(), instanceId);
    timerStorage.save(timer);
    schedule(timer);
    metrics.recordTimerEvent(type.getTag(), "started");
    log.debug(
        "[GroupTimerService] 타이머 시작 - key={}, type={}, expiresAt={}",
        group.key(),
        type.getTag(),
        timer.expiresAt());
    return timer;
  }

  private void schedule(GroupTimer timer) {
    ScheduledFuture<?> handle = taskScheduler.schedule(() -> fire(timer), timer.expiresAt());
    ScheduledFuture<?> previous = handles.put(timer.groupKey(), handle);
    if (previous != null && previous != handle) {
      previous.cancel(false);
    }
  }

  private boolean hasLiveHandle(GroupKey key) {
    ScheduledFuture<?> handle = handles.get(key);
    return handle != null && !handle.isDone();
  }

  /** 실패한 타이머는 저장된 채로 남아 다음 스윕에서 다시 처리됩니다. */
  void fire(GroupTimer scheduled) {
    GroupKey key = scheduled.groupKey();
    executor.executeOrCatch(
        () -> {
          Optional<Boolean> flushed =
              lockStrategy.tryExecute(
                  LOCK_PREFIX + key.value(),
                  storageProperties.fireLockLease(),
                  () -> flush(scheduled));
          if (flushed.isEmpty()) {
            log.debug("[GroupTimerService] 다른 인스턴스가 처리 중 - key={}", key);
            metrics.recordTimerEvent(scheduled.type().getTag(), "lock_skipped");
          }
          return flushed.orElse(false);
        },
        e -> {
          log.error("[GroupTimerService] 타이머 처리 실패 - key={}", key, e);
          metrics.recordTimerEvent(scheduled.type().getTag(), "error");
          return false;
        },
        TaskContext.of(COMPONENT, "fire", key.value()));
  }

  private boolean flush(GroupTimer scheduled) {
    GroupKey key = scheduled.groupKey();
    String tag = scheduled.type().getTag();

    Optional<GroupTimer> stored = timerStorage.load(key);
    if (stored.isEmpty() || !stored.get().sameScheduleAs(scheduled)) {
      log.debug("[GroupTimerService] 취소/교체된 타이머 - key={}, type={}", key, tag);
      metrics.recordTimerEvent(tag, "stale");
      return false;
    }
    GroupTimer timer = stored.get();

    Optional<AlertGroup> group = loadGroup(key);
    if (group.isEmpty()
        || !Objects.equals(group.get().metadata().createdAt(), timer.groupCreatedAt())) {
      log.info("[GroupTimerService] 그룹이 없거나 재생성되어 타이머 폐기 - key={}, type={}", key, tag);
      discard(key);
      metrics.recordTimerEvent(tag, "stale");
      return false;
    }
    AlertGroup snapshot = group.get();

    if (timer.fired()) {
      log.info("[GroupTimerService] 이미 flush 된 타이머, 알림 생략 - key={}, type={}", key, tag);
    } else {
      timerStorage.save(timer.markFired());
      notifyListeners(new GroupNotification(snapshot, timer.type(), clock.instant()));
      metrics.recordTimerEvent(tag, "fired");
      log.info(
          "[GroupTimerService] 그룹 flush - key={}, type={}, alerts={}, state={}",
          key,
          tag,
          snapshot.size(),
          snapshot.state());
    }

    if (snapshot.state() == GroupState.FIRING && !snapshot.isEmpty()) {
      start(snapshot, TimerType.INTERVAL, groupingProperties.groupInterval());
    } else {
      discard(key);
    }
    return true;
  }

  private void discard(GroupKey key) {
    timerStorage.delete(key);
    handles.remove(key);
  }

  private Optional<AlertGroup> loadGroup(GroupKey key) {
    try {
      return Optional.of(groupStorage.load(key));
    } catch (GroupNotFoundException e) {
      return Optional.empty();
    }
  }

  /** 리스너 하나의 실패가 나머지 리스너 호출을 막지 않습니다. */
  private void notifyListeners(GroupNotification notification) {
    for (GroupNotificationPort port : notificationPorts) {
      executor.executeOrCatch(
          () -> {
            port.onGroupFlush(
                new GroupNotification(
                    notification.group().copy(), notification.trigger(), notification.firedAt()));
            metrics.recordNotification(GroupingMetrics.RESULT_SUCCESS);
            return null;
          },
          e -> {
            log.error(
                "[GroupTimerService] 알림 리스너 실패 - key={}, listener={}",
                notification.group().key(),
                port.getClass().getSimpleName(),
                e);
            metrics.recordNotification(GroupingMetrics.RESULT_ERROR);
            return null;
          },
          TaskContext.of(COMPONENT, "notify", notification.group().key().value()));
    }
  }

  private static String resolveInstanceId() {
    String host;
    try {
      host = InetAddress.getLocalHost().getHostName();
    } catch (UnknownHostException e) {
      log.debug("[GroupTimerService] 호스트명 조회 실패 - {}", e.getMessage());
      host = "unknown";
    }
    return host + ":" + ProcessHandle.current().pid();
  }
}
