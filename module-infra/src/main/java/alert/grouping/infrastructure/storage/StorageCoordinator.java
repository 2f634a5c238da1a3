package alert.grouping.infrastructure.storage;

import alert.grouping.core.port.out.GroupStorage;
import alert.grouping.domain.model.group.AlertGroup;
import alert.grouping.domain.model.group.GroupKey;
import alert.grouping.error.exception.GroupNotFoundException;
import alert.grouping.error.exception.StorageUnavailableException;
import alert.grouping.error.exception.VersionMismatchException;
import alert.grouping.infrastructure.executor.LogicExecutor;
import alert.grouping.infrastructure.executor.TaskContext;
import alert.grouping.infrastructure.metrics.GroupingMetrics;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;
import lombok.extern.slf4j.Slf4j;

/**
 * primary(분산) + fallback(프로세스 내) 저장소를 합성한 자동 failover 저장소
 *
 * <h3>동작</h3>
 *
 * <ul>
 *   <li>헬스체크: 요청 경로와 무관한 주기 작업이 {@link #checkHealth()} 호출. 실패 시 fallback 전환, 회복 시 primary 복귀
 *   <li>쓰기(store/delete/storeAll): primary 에서 {@link StorageUnavailableException} 이 나면 fallback 으로 강등 후 같은
 *       쓰기를 1회 재시도
 *   <li>읽기: 교차 재시도 없음. 호출 시점의 활성 백엔드만 사용
 * </ul>
 *
 * <h3>예외 분류</h3>
 *
 * <ul>
 *   <li>비즈니스 예외 (NotFound, VersionMismatch): 즉시 전파, 강등 없음
 *   <li>인프라 예외 (StorageUnavailable): fallback 강등
 *   <li>그 외 (직렬화 오류 등): 즉시 전파
 * </ul>
 *
 * <p>활성 백엔드는 단일 AtomicReference 이므로 진행 중인 작업은 이전 또는 새 백엔드 한쪽에서만 완료됩니다. 합의 프로토콜이 아니며 fallback 기간
 * 동안 레플리카별 상태가 갈라지는 것은 허용된 저하입니다.
 */
@Slf4j
public class StorageCoordinator implements GroupStorage {

  public static final String BACKEND = "coordinator";

  private static final String COMPONENT = "StorageCoordinator";

  private final GroupStorage primary;
  private final GroupStorage fallback;
  private final LogicExecutor executor;
  private final GroupingMetrics metrics;
  private final boolean fallbackEnabled;
  private final boolean reconcileOnRecovery;

  private final AtomicReference<StorageBackend> active =
      new AtomicReference<>(StorageBackend.PRIMARY);
  private final AtomicBoolean primaryHealthy = new AtomicBoolean(true);
  private final List<StorageSwitchListener> listeners = new CopyOnWriteArrayList<>();

  public StorageCoordinator(
      GroupStorage primary,
      GroupStorage fallback,
      LogicExecutor executor,
      GroupingMetrics metrics,
      boolean fallbackEnabled,
      boolean reconcileOnRecovery) {
    this.primary = primary;
    this.fallback = fallback;
    this.executor = executor;
    this.metrics = metrics;
    this.fallbackEnabled = fallbackEnabled;
    this.reconcileOnRecovery = reconcileOnRecovery;
    metrics.registerHealthGauge(primary.backendName(), primaryHealthy::get);
    metrics.registerHealthGauge(fallback.backendName(), () -> true);
  }

  public void addListener(StorageSwitchListener listener) {
    listeners.add(listener);
  }

  public StorageBackend currentBackend() {
    return active.get();
  }

  public boolean isPrimaryActive() {
    return active.get() == StorageBackend.PRIMARY;
  }

  /**
   * primary 헬스체크 1회
   *
   * <p>실패하면 fallback 으로, fallback 사용 중 회복되면 primary 로 전환합니다.
   *
   * @return primary 정상 여부
   */
  public boolean checkHealth() {
    boolean healthy =
        executor.executeOrDefault(
            () -> {
              primary.ping();
              return true;
            },
            false,
            TaskContext.of(COMPONENT, "healthCheck", primary.backendName()));
    primaryHealthy.set(healthy);

    if (!healthy && isPrimaryActive()) {
      switchTo(StorageBackend.FALLBACK, "health_check_failed");
    } else if (healthy && !isPrimaryActive()) {
      switchTo(StorageBackend.PRIMARY, "health_check_recovered");
    }
    return healthy;
  }

  /**
   * fallback 으로 강등
   *
   * @return 실제로 전환이 일어났으면 true
   */
  public boolean demote(String reason) {
    primaryHealthy.set(false);
    return switchTo(StorageBackend.FALLBACK, reason);
  }

  private boolean switchTo(StorageBackend target, String reason) {
    if (target == StorageBackend.FALLBACK && !fallbackEnabled) {
      log.error("[StorageCoordinator] primary 장애지만 fallback 이 비활성화됨 - reason={}", reason);
      return false;
    }
    StorageBackend previous =
        target == StorageBackend.PRIMARY ? StorageBackend.FALLBACK : StorageBackend.PRIMARY;
    if (!active.compareAndSet(previous, target)) {
      return false;
    }

    if (target == StorageBackend.FALLBACK) {
      log.warn(
          "[StorageCoordinator] ⚠️ Failover: {} → {} (reason={})",
          primary.backendName(),
          fallback.backendName(),
          reason);
      metrics.recordFallback(reason);
    } else {
      log.info(
          "[StorageCoordinator] ✅ Recovery: {} → {} (reason={})",
          fallback.backendName(),
          primary.backendName(),
          reason);
      metrics.recordRecovery(reason);
      if (reconcileOnRecovery) {
        reconcileFallbackIntoPrimary();
      }
    }
    listeners.forEach(
        listener ->
            executor.executeOrDefault(
                () -> {
                  listener.onSwitch(previous, target, reason);
                  return null;
                },
                null,
                TaskContext.of(COMPONENT, "notifyListener", reason)));
    return true;
  }

  /**
   * fallback 기간에 생긴 그룹을 primary 로 옮긴 뒤 fallback 을 비웁니다.
   *
   * <p>primary 에 이미 있는 키는 primary 를 우선합니다. 실패해도 전환 자체는 유지됩니다.
   */
  private void reconcileFallbackIntoPrimary() {
    executor.executeOrCatch(
        () -> {
          List<AlertGroup> pending = fallback.loadAll();
          if (pending.isEmpty()) {
            return 0;
          }
          Set<GroupKey> existing = new HashSet<>(primary.listKeys());
          List<AlertGroup> missing =
              pending.stream().filter(group -> !existing.contains(group.key())).toList();
          primary.storeAll(missing);
          pending.forEach(group -> fallback.delete(group.key()));
          log.info(
              "[StorageCoordinator] fallback 재동기화 완료 - migrated={}, discarded={}",
              missing.size(),
              pending.size() - missing.size());
          return missing.size();
        },
        e -> {
          log.warn("[StorageCoordinator] fallback 재동기화 실패 - {}", e.getMessage());
          return 0;
        },
        TaskContext.of(COMPONENT, "reconcile"));
  }

  // ==================== GroupStorage ====================

  @Override
  public long store(AlertGroup group) {
    return write("store", group.key().value(), storage -> storage.store(group));
  }

  @Override
  public void delete(GroupKey key) {
    write(
        "delete",
        key.value(),
        storage -> {
          storage.delete(key);
          return null;
        });
  }

  @Override
  public void storeAll(Collection<AlertGroup> groups) {
    write(
        "store_all",
        groups.size() + " groups",
        storage -> {
          storage.storeAll(groups);
          return null;
        });
  }

  @Override
  public AlertGroup load(GroupKey key) {
    return read("load", storage -> storage.load(key));
  }

  @Override
  public List<GroupKey> listKeys() {
    return read("list_keys", GroupStorage::listKeys);
  }

  @Override
  public int size() {
    return read("size", GroupStorage::size);
  }

  @Override
  public List<AlertGroup> loadAll() {
    return read("load_all", GroupStorage::loadAll);
  }

  @Override
  public List<GroupKey> listKeysUpdatedBefore(Instant cutoff) {
    return read("list_expired", storage -> storage.listKeysUpdatedBefore(cutoff));
  }

  /** 활성 백엔드 생존 확인 */
  @Override
  public void ping() {
    current().ping();
  }

  @Override
  public String backendName() {
    return BACKEND;
  }

  private GroupStorage current() {
    return active.get() == StorageBackend.PRIMARY ? primary : fallback;
  }

  private <T> T read(String operation, Function<GroupStorage, T> call) {
    return timed(current(), operation, call);
  }

  private <T> T write(String operation, String key, Function<GroupStorage, T> call) {
    GroupStorage target = current();
    try {
      return timed(target, operation, call);
    } catch (StorageUnavailableException e) {
      if (target != primary || !fallbackEnabled) {
        throw e;
      }
      log.warn(
          "[StorageCoordinator] primary 쓰기 실패, fallback 으로 재시도 - operation={}, key={}, cause={}",
          operation,
          key,
          e.getMessage());
      demote(operation + "_error");
      return timed(fallback, operation, call);
    }
  }

  private <T> T timed(GroupStorage storage, String operation, Function<GroupStorage, T> call) {
    long start = System.nanoTime();
    String result = GroupingMetrics.RESULT_ERROR;
    try {
      T value = call.apply(storage);
      result = GroupingMetrics.RESULT_SUCCESS;
      return value;
    } catch (GroupNotFoundException e) {
      result = GroupingMetrics.RESULT_NOT_FOUND;
      throw e;
    } catch (VersionMismatchException e) {
      result = GroupingMetrics.RESULT_CONFLICT;
      throw e;
    } finally {
      metrics.recordStorageOperation(
          storage.backendName(), operation, result, Duration.ofNanos(System.nanoTime() - start));
    }
  }
}
