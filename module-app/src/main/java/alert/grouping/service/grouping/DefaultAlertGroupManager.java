package alert.grouping.service.grouping;

import alert.grouping.config.GroupingProperties;
import alert.grouping.core.port.out.GroupStorage;
import alert.grouping.domain.model.alert.Alert;
import alert.grouping.domain.model.group.AlertGroup;
import alert.grouping.domain.model.group.GroupFilter;
import alert.grouping.domain.model.group.GroupKey;
import alert.grouping.domain.model.group.GroupPage;
import alert.grouping.domain.model.group.GroupState;
import alert.grouping.domain.model.group.GroupStats;
import alert.grouping.domain.model.group.Pagination;
import alert.grouping.domain.service.GroupKeyGenerator;
import alert.grouping.error.exception.GroupNotFoundException;
import alert.grouping.error.exception.InvalidAlertException;
import alert.grouping.infrastructure.executor.LogicExecutor;
import alert.grouping.infrastructure.executor.TaskContext;
import alert.grouping.infrastructure.metrics.GroupingMetrics;
import alert.grouping.service.timer.GroupTimerService;
import io.github.resilience4j.retry.Retry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * 저장소 기반 알림 그룹 매니저
 *
 * <h3>동시성</h3>
 *
 * <p>레플리카 간 락 없이 저장소의 키 단위 낙관적 락({@code store} 버전 검사)에 의존합니다. 충돌 시 resilience4j Retry
 * ({@code groupVersionConflict}) 가 Load 부터 변경을 다시 적용합니다.
 *
 * <h3>RESOLVED 그룹</h3>
 *
 * <p>RESOLVED 는 종료 상태입니다. 같은 키로 firing 알림이 들어오면 기존 레코드를 새 그룹으로 교체(recycle)하고 WAIT 타이머를 새로
 * 시작합니다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DefaultAlertGroupManager implements AlertGroupManager {

  private static final String COMPONENT = "AlertGroupManager";

  private final GroupStorage storage;
  private final GroupKeyGenerator keyGenerator;
  private final GroupTimerService timerService;
  private final FingerprintIndex fingerprintIndex;
  private final Retry groupVersionConflictRetry;
  private final GroupingProperties properties;
  private final GroupingMetrics metrics;
  private final LogicExecutor executor;
  private final Clock clock;

  private final AtomicLong totalAdds = new AtomicLong();
  private final AtomicLong totalRemoves = new AtomicLong();
  private final AtomicLong totalCleanups = new AtomicLong();
  private final AtomicReference<Instant> lastCleanupAt = new AtomicReference<>();

  @Override
  public AlertGroup addAlertToGroup(Alert alert) {
    if (alert == null) {
      throw new InvalidAlertException("alert is null");
    }
    alert.validate();
    GroupKey key = keyGenerator.generate(alert.labels(), properties.groupBy());

    AddResult result =
        Retry.decorateSupplier(groupVersionConflictRetry, () -> applyAdd(key, alert)).get();
    AlertGroup group = result.group();

    fingerprintIndex.put(alert.fingerprint(), key);
    totalAdds.incrementAndGet();

    if (result.previous() == null || result.recycled()) {
      String event = result.recycled() ? "recycled" : "created";
      metrics.recordGroupEvent(event);
      log.info(
          "[AlertGroupManager] 그룹 {} - key={}, fingerprint={}",
          result.recycled() ? "재생성" : "생성",
          key,
          alert.fingerprint());
      startWaitTimer(group);
    } else if (result.previous() != group.state()) {
      logTransition(key, result.previous(), group.state());
    }
    if (result.previous() == null && group.isResolved()) {
      logTransition(key, GroupState.FIRING, GroupState.RESOLVED);
    }
    return group.copy();
  }

  private AddResult applyAdd(GroupKey key, Alert alert) {
    Instant now = clock.instant();
    Optional<AlertGroup> existing = find(key);

    AlertGroup group;
    boolean recycled = false;
    if (existing.isEmpty()) {
      group = AlertGroup.create(key, properties.groupBy(), now);
    } else if (existing.get().isResolved() && alert.isFiring()) {
      group = existing.get().recycle(now);
      recycled = true;
    } else {
      group = existing.get();
    }
    group.upsert(alert, now);

    long version = storage.store(group);
    group.markStored(version);
    return new AddResult(group, existing.map(AlertGroup::state).orElse(null), recycled);
  }

  private void startWaitTimer(AlertGroup group) {
    executor.executeOrCatch(
        () -> timerService.startWaitTimer(group),
        e -> {
          log.error("[AlertGroupManager] 그룹은 저장되었으나 WAIT 타이머 시작 실패 - key={}", group.key(), e);
          return null;
        },
        TaskContext.of(COMPONENT, "startWaitTimer", group.key().value()));
  }

  @Override
  public void removeAlertFromGroup(String fingerprint, GroupKey key) {
    RemoveResult result =
        Retry.decorateSupplier(groupVersionConflictRetry, () -> applyRemove(fingerprint, key))
            .get();

    switch (result.outcome()) {
      case ABSENT -> log.debug(
          "[AlertGroupManager] 제거할 알림 없음 - key={}, fingerprint={}", key, fingerprint);
      case REMOVED -> {
        totalRemoves.incrementAndGet();
        fingerprintIndex.remove(fingerprint, key);
        if (result.previous() != result.current()) {
          logTransition(key, result.previous(), result.current());
        }
      }
      case DELETED -> {
        totalRemoves.incrementAndGet();
        fingerprintIndex.remove(fingerprint, key);
        timerService.cancel(key);
        metrics.recordGroupEvent("deleted");
        log.info("[AlertGroupManager] 빈 그룹 삭제 - key={}", key);
      }
    }
  }

  private RemoveResult applyRemove(String fingerprint, GroupKey key) {
    AlertGroup group = storage.load(key);
    GroupState previous = group.state();
    if (group.remove(fingerprint, clock.instant()).isEmpty()) {
      return new RemoveResult(RemoveOutcome.ABSENT, previous, previous);
    }
    if (group.isEmpty()) {
      storage.delete(key);
      return new RemoveResult(RemoveOutcome.DELETED, previous, null);
    }
    group.markStored(storage.store(group));
    return new RemoveResult(RemoveOutcome.REMOVED, previous, group.state());
  }

  @Override
  public AlertGroup getGroup(GroupKey key) {
    return storage.load(key);
  }

  /** 인덱스는 캐시이므로 로드한 그룹에 fingerprint 가 없으면 인덱스 항목을 지우고 NotFound */
  @Override
  public AlertGroup getGroupByFingerprint(String fingerprint) {
    GroupKey key =
        fingerprintIndex
            .lookup(fingerprint)
            .orElseThrow(() -> new GroupNotFoundException("fingerprint:" + fingerprint));
    AlertGroup group;
    try {
      group = storage.load(key);
    } catch (GroupNotFoundException e) {
      fingerprintIndex.remove(fingerprint, key);
      throw e;
    }
    if (!group.contains(fingerprint)) {
      fingerprintIndex.remove(fingerprint, key);
      throw new GroupNotFoundException("fingerprint:" + fingerprint);
    }
    return group;
  }

  @Override
  public GroupPage listGroups(GroupFilter filter, Pagination pagination) {
    Instant now = clock.instant();
    GroupFilter effective = filter == null ? GroupFilter.all() : filter;
    Pagination page = pagination == null ? Pagination.unpaged() : pagination;

    List<AlertGroup> matched =
        storage.loadAll().stream()
            .filter(group -> effective.matches(group, now))
            .sorted(Comparator.comparing(AlertGroup::key))
            .toList();
    if (page.isUnpaged()) {
      return new GroupPage(matched, matched.size(), page);
    }
    int from = Math.min(page.offset(), matched.size());
    int to = Math.min(from + page.limit(), matched.size());
    return new GroupPage(matched.subList(from, to), matched.size(), page);
  }

  /**
   * 인덱스에서 {@code updatedAt < now - maxAge} 후보를 찾고, 로드해서 만료를 재확인한 뒤 삭제합니다.
   *
   * <p>키 하나의 실패는 로그 후 다음 키로 진행합니다.
   */
  @Override
  public int cleanupExpiredGroups(Duration maxAge) {
    Instant now = clock.instant();
    List<GroupKey> candidates = storage.listKeysUpdatedBefore(now.minus(maxAge));

    int removed = 0;
    for (GroupKey key : candidates) {
      boolean deleted =
          executor.executeOrCatch(
              () -> deleteIfExpired(key, maxAge, now),
              e -> {
                log.warn("[AlertGroupManager] 만료 그룹 정리 실패 - key={}, cause={}", key, e.getMessage());
                return false;
              },
              TaskContext.of(COMPONENT, "cleanup", key.value()));
      if (deleted) {
        removed++;
      }
    }

    totalCleanups.addAndGet(removed);
    lastCleanupAt.set(now);
    if (removed > 0) {
      log.info("[AlertGroupManager] 만료 그룹 정리 완료 - removed={}, candidates={}", removed, candidates.size());
    }
    return removed;
  }

  private boolean deleteIfExpired(GroupKey key, Duration maxAge, Instant now) {
    AlertGroup group;
    try {
      group = storage.load(key);
    } catch (GroupNotFoundException e) {
      return false;
    }
    if (!group.isExpired(maxAge, now)) {
      return false;
    }
    storage.delete(key);
    timerService.cancel(key);
    fingerprintIndex.removeGroup(group);
    metrics.recordGroupEvent("expired");
    log.info(
        "[AlertGroupManager] 그룹 만료 - key={}, state={}, updatedAt={}",
        key,
        group.state(),
        group.metadata().updatedAt());
    return true;
  }

  @Override
  public int restoreFromStorage() {
    List<AlertGroup> groups = storage.loadAll();
    int fingerprints = fingerprintIndex.rebuild(groups);
    metrics.recordGroupsRestored(groups.size());
    log.info("[AlertGroupManager] 저장소에서 복원 완료 - groups={}, fingerprints={}", groups.size(), fingerprints);
    return groups.size();
  }

  @Override
  public GroupStats getStats() {
    List<AlertGroup> groups = storage.loadAll();
    Map<String, Long> distribution = GroupStats.emptyDistribution();
    int firing = 0;
    int resolved = 0;
    for (AlertGroup group : groups) {
      firing += group.metadata().firingCount();
      resolved += group.metadata().resolvedCount();
      distribution.merge(GroupStats.bucketOf(group.size()), 1L, Long::sum);
    }
    return new GroupStats(
        totalAdds.get(),
        totalRemoves.get(),
        totalCleanups.get(),
        groups.size(),
        firing + resolved,
        firing,
        resolved,
        lastCleanupAt.get(),
        distribution);
  }

  private Optional<AlertGroup> find(GroupKey key) {
    try {
      return Optional.of(storage.load(key));
    } catch (GroupNotFoundException e) {
      return Optional.empty();
    }
  }

  private void logTransition(GroupKey key, GroupState from, GroupState to) {
    if (to == GroupState.RESOLVED) {
      metrics.recordGroupEvent("resolved");
    }
    log.info("[AlertGroupManager] 상태 전이 - key={}, {} → {}", key, from, to);
  }

  private record AddResult(AlertGroup group, GroupState previous, boolean recycled) {}

  private enum RemoveOutcome {
    ABSENT,
    REMOVED,
    DELETED
  }

  private record RemoveResult(RemoveOutcome outcome, GroupState previous, GroupState current) {}
}
