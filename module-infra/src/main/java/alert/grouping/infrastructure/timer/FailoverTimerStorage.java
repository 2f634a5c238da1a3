package alert.grouping.infrastructure.timer;

import alert.grouping.core.port.out.TimerStorage;
import alert.grouping.domain.model.group.AlertGroup;
import alert.grouping.domain.model.group.GroupKey;
import alert.grouping.domain.model.timer.GroupTimer;
import alert.grouping.error.exception.GroupNotFoundException;
import alert.grouping.error.exception.StorageUnavailableException;
import alert.grouping.infrastructure.executor.LogicExecutor;
import alert.grouping.infrastructure.executor.TaskContext;
import alert.grouping.infrastructure.storage.StorageBackend;
import alert.grouping.infrastructure.storage.StorageCoordinator;
import alert.grouping.infrastructure.storage.StorageSwitchListener;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import lombok.extern.slf4j.Slf4j;

/**
 * 그룹 저장소와 같은 활성 백엔드를 따르는 타이머 저장소
 *
 * <p>활성 백엔드 판단은 {@link StorageCoordinator} 에 위임합니다. primary 쓰기가 실패하면 coordinator 를 강등시키고 fallback 에
 * 다시 씁니다. primary 로 복구되면 fallback 기간에 저장된 타이머 중 그룹이 함께 이관된 것만 primary 로 옮깁니다.
 *
 * <p>그룹 재동기화는 양쪽에 같은 키가 있으면 primary 의 그룹을 남깁니다. 이때 fallback 타이머의 {@code groupCreatedAt} 은 버려진
 * 그룹의 것이므로, primary 그룹의 생성 시각과 다르면 이관하지 않고 primary 의 기존 타이머를 유지합니다.
 */
@Slf4j
public class FailoverTimerStorage implements TimerStorage, StorageSwitchListener {

  private static final String COMPONENT = "FailoverTimerStorage";

  private final TimerStorage primary;
  private final TimerStorage fallback;
  private final StorageCoordinator coordinator;
  private final LogicExecutor executor;

  public FailoverTimerStorage(
      TimerStorage primary,
      TimerStorage fallback,
      StorageCoordinator coordinator,
      LogicExecutor executor) {
    this.primary = primary;
    this.fallback = fallback;
    this.coordinator = coordinator;
    this.executor = executor;
    coordinator.addListener(this);
  }

  @Override
  public void save(GroupTimer timer) {
    write(
        "timer_save",
        storage -> {
          storage.save(timer);
          return null;
        });
  }

  @Override
  public void delete(GroupKey key) {
    write(
        "timer_delete",
        storage -> {
          storage.delete(key);
          return null;
        });
  }

  @Override
  public Optional<GroupTimer> load(GroupKey key) {
    return current().load(key);
  }

  @Override
  public List<GroupTimer> listAll() {
    return current().listAll();
  }

  @Override
  public void onSwitch(StorageBackend from, StorageBackend to, String reason) {
    if (to != StorageBackend.PRIMARY) {
      return;
    }
    int migrated =
        executor.executeOrCatch(
            () -> {
              int moved = 0;
              for (GroupTimer timer : fallback.listAll()) {
                if (belongsToPrimaryGroup(timer)) {
                  primary.save(timer);
                  moved++;
                } else {
                  log.info(
                      "[FailoverTimerStorage] 세대가 다른 fallback 타이머 폐기 - key={}, type={}",
                      timer.groupKey(),
                      timer.type().getTag());
                }
                fallback.delete(timer.groupKey());
              }
              return moved;
            },
            e -> {
              log.warn("[FailoverTimerStorage] fallback 타이머 이관 실패 - {}", e.getMessage());
              return 0;
            },
            TaskContext.of(COMPONENT, "migrate", reason));
    if (migrated > 0) {
      log.info("[FailoverTimerStorage] fallback 타이머 {}건 primary 로 이관", migrated);
    }
  }

  private boolean belongsToPrimaryGroup(GroupTimer timer) {
    try {
      AlertGroup group = coordinator.load(timer.groupKey());
      return Objects.equals(group.metadata().createdAt(), timer.groupCreatedAt());
    } catch (GroupNotFoundException e) {
      return false;
    }
  }

  private TimerStorage current() {
    return coordinator.isPrimaryActive() ? primary : fallback;
  }

  private <T> T write(String operation, Function<TimerStorage, T> call) {
    TimerStorage target = current();
    try {
      return call.apply(target);
    } catch (StorageUnavailableException e) {
      if (target != primary) {
        throw e;
      }
      log.warn(
          "[FailoverTimerStorage] primary 타이머 쓰기 실패 - operation={}, cause={}",
          operation,
          e.getMessage());
      if (!coordinator.demote(operation + "_error") && coordinator.isPrimaryActive()) {
        throw e;
      }
      return call.apply(fallback);
    }
  }
}
