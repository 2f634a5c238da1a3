package alert.grouping.infrastructure.storage.document;

import alert.grouping.domain.model.group.GroupKey;
import alert.grouping.domain.model.timer.GroupTimer;
import alert.grouping.domain.model.timer.TimerType;
import java.time.Duration;
import java.time.Instant;

/** 저장소에 기록되는 타이머 문서 */
public record GroupTimerDocument(
    String kind,
    String groupKey,
    TimerType type,
    Duration duration,
    Instant startedAt,
    Instant expiresAt,
    boolean fired,
    Instant groupCreatedAt,
    String createdBy) {

  public static final String KIND = "group-timer";

  public static GroupTimerDocument from(GroupTimer timer) {
    return new GroupTimerDocument(
        KIND,
        timer.groupKey().value(),
        timer.type(),
        timer.duration(),
        timer.startedAt(),
        timer.expiresAt(),
        timer.fired(),
        timer.groupCreatedAt(),
        timer.createdBy());
  }

  public GroupTimer toDomain() {
    if (!KIND.equals(kind)) {
      throw new IllegalArgumentException("unexpected document kind: " + kind);
    }
    return new GroupTimer(
        GroupKey.of(groupKey),
        type,
        duration,
        startedAt,
        expiresAt,
        fired,
        groupCreatedAt,
        createdBy);
  }
}
