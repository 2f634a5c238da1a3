package alert.grouping.domain.model.group;

import alert.grouping.domain.model.alert.Alert;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * 알림 그룹 애그리거트
 *
 * <p>스레드 안전하지 않습니다. 저장소는 copy-in/copy-out 으로만 다루므로 호출자가 받은 인스턴스는 저장된 상태의 별칭이 아닌 방어적
 * 복사본입니다. 변경 후에는 반드시 {@code GroupStorage.store}를 거쳐야 반영됩니다.
 */
public final class AlertGroup {

  private final GroupKey key;
  private final Map<String, Alert> alerts;
  private GroupMetadata metadata;

  private AlertGroup(GroupKey key, Map<String, Alert> alerts, GroupMetadata metadata) {
    this.key = Objects.requireNonNull(key, "key");
    this.alerts = alerts;
    this.metadata = Objects.requireNonNull(metadata, "metadata");
  }

  /** 새 키에 대한 빈 그룹 (version 0) */
  public static AlertGroup create(GroupKey key, List<String> groupBy, Instant now) {
    return new AlertGroup(key, new LinkedHashMap<>(), GroupMetadata.initial(groupBy, now));
  }

  /** 저장소 복원용 정적 팩토리. 메타데이터는 검증 없이 그대로 신뢰합니다. */
  public static AlertGroup restore(GroupKey key, Collection<Alert> alerts, GroupMetadata metadata) {
    Map<String, Alert> byFingerprint = new LinkedHashMap<>();
    for (Alert alert : alerts) {
      byFingerprint.put(alert.fingerprint(), alert);
    }
    return new AlertGroup(key, byFingerprint, metadata);
  }

  /**
   * RESOLVED 그룹을 대체할 새 그룹 레코드
   *
   * <p>같은 키의 저장 레코드를 덮어써야 하므로 현재 version을 이어받습니다.
   */
  public AlertGroup recycle(Instant now) {
    GroupMetadata fresh = GroupMetadata.initial(metadata.groupBy(), now).withVersion(version());
    return new AlertGroup(key, new LinkedHashMap<>(), fresh);
  }

  /**
   * fingerprint 기준 삽입/덮어쓰기
   *
   * @return 새 fingerprint 였으면 true
   */
  public boolean upsert(Alert alert, Instant now) {
    boolean added = alerts.put(alert.fingerprint(), alert) == null;
    recompute(now);
    return added;
  }

  public Optional<Alert> remove(String fingerprint, Instant now) {
    Alert removed = alerts.remove(fingerprint);
    if (removed != null) {
      recompute(now);
    }
    return Optional.ofNullable(removed);
  }

  private void recompute(Instant now) {
    int firing = 0;
    int resolved = 0;
    for (Alert alert : alerts.values()) {
      if (alert.isResolved()) {
        resolved++;
      } else {
        firing++;
      }
    }
    metadata = metadata.recomputed(firing, resolved, now);
  }

  /** 저장 성공 후 새 버전 반영 */
  public void markStored(long newVersion) {
    metadata = metadata.withVersion(newVersion);
  }

  /**
   * 정리 대상 여부
   *
   * <p>RESOLVED 후 maxAge 가 지났거나, maxAge 동안 아무 변경이 없었으면 만료입니다.
   */
  public boolean isExpired(Duration maxAge, Instant now) {
    Instant cutoff = now.minus(maxAge);
    if (metadata.state() == GroupState.RESOLVED
        && metadata.resolvedAt() != null
        && metadata.resolvedAt().isBefore(cutoff)) {
      return true;
    }
    return metadata.updatedAt().isBefore(cutoff);
  }

  public AlertGroup copy() {
    return new AlertGroup(key, new LinkedHashMap<>(alerts), metadata);
  }

  public GroupKey key() {
    return key;
  }

  public GroupMetadata metadata() {
    return metadata;
  }

  public GroupState state() {
    return metadata.state();
  }

  public long version() {
    return metadata.version();
  }

  public boolean isResolved() {
    return metadata.state() == GroupState.RESOLVED;
  }

  public List<Alert> alerts() {
    return List.copyOf(alerts.values());
  }

  public boolean contains(String fingerprint) {
    return alerts.containsKey(fingerprint);
  }

  public int size() {
    return alerts.size();
  }

  public boolean isEmpty() {
    return alerts.isEmpty();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof AlertGroup other)) {
      return false;
    }
    return key.equals(other.key)
        && alerts.equals(other.alerts)
        && metadata.equals(other.metadata);
  }

  @Override
  public int hashCode() {
    return Objects.hash(key, alerts, metadata);
  }

  @Override
  public String toString() {
    return "AlertGroup{key="
        + key
        + ", size="
        + alerts.size()
        + ", state="
        + metadata.state()
        + ", version="
        + metadata.version()
        + "}";
  }
}
