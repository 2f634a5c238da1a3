package alert.grouping.domain.model.timer;

import alert.grouping.domain.model.group.GroupKey;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * 그룹 단위 알림 타이머
 *
 * <p>재시작 후 복원을 위해 상대 시간이 아닌 절대 만료 시각({@code expiresAt})으로 저장됩니다. 그룹 키당 하나만 존재하며 WAIT 가 flush 된
 * 뒤 INTERVAL 로 교체됩니다.
 *
 * @param groupKey 소유 그룹
 * @param type WAIT / INTERVAL
 * @param duration 최초 지정 길이
 * @param startedAt 시작 시각
 * @param expiresAt 절대 만료 시각
 * @param fired flush 진행 표시. true 로 저장된 타이머는 재전달되어도 다시 flush 하지 않음
 * @param groupCreatedAt 타이머가 속한 그룹 레코드의 생성 시각. 그룹이 재생성되면 stale 로 판정
 * @param createdBy 생성한 인스턴스 (host:pid)
 */
public record GroupTimer(
    GroupKey groupKey,
    TimerType type,
    Duration duration,
    Instant startedAt,
    Instant expiresAt,
    boolean fired,
    Instant groupCreatedAt,
    String createdBy) {

  public GroupTimer {
    Objects.requireNonNull(groupKey, "groupKey");
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(expiresAt, "expiresAt");
    if (duration != null && duration.isNegative()) {
      throw new IllegalArgumentException("timer duration cannot be negative: " + duration);
    }
  }

  public static GroupTimer start(
      GroupKey groupKey,
      TimerType type,
      Duration duration,
      Instant now,
      Instant groupCreatedAt,
      String createdBy) {
    return new GroupTimer(
        groupKey, type, duration, now, now.plus(duration), false, groupCreatedAt, createdBy);
  }

  public GroupTimer markFired() {
    return new GroupTimer(
        groupKey, type, duration, startedAt, expiresAt, true, groupCreatedAt, createdBy);
  }

  public boolean isExpired(Instant now) {
    return !expiresAt.isAfter(now);
  }

  /** 남은 시간 (음수 없음) */
  public Duration remaining(Instant now) {
    Duration remaining = Duration.between(now, expiresAt);
    return remaining.isNegative() ? Duration.ZERO : remaining;
  }

  /** 같은 스케줄(같은 만료 시각/종류)의 타이머인지 */
  public boolean sameScheduleAs(GroupTimer other) {
    return other != null && type == other.type && expiresAt.equals(other.expiresAt);
  }
}
