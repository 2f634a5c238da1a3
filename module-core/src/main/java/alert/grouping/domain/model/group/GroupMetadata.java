package alert.grouping.domain.model.group;

import java.time.Instant;
import java.util.List;

/**
 * 그룹 메타데이터 (불변)
 *
 * @param state 그룹 상태
 * @param version 낙관적 락 버전 (저장소에 기록된 값, 신규 그룹은 0)
 * @param createdAt 생성 시각
 * @param updatedAt 마지막 변경 시각
 * @param firstFiringAt 첫 firing 알림 시각
 * @param resolvedAt RESOLVED 전이 시각 (nullable)
 * @param firingCount firing 알림 수
 * @param resolvedCount resolved 알림 수
 * @param groupBy 키 생성에 사용된 그룹핑 라벨
 */
public record GroupMetadata(
    GroupState state,
    long version,
    Instant createdAt,
    Instant updatedAt,
    Instant firstFiringAt,
    Instant resolvedAt,
    int firingCount,
    int resolvedCount,
    List<String> groupBy) {

  public GroupMetadata {
    if (state == null) {
      state = GroupState.FIRING;
    }
    groupBy = groupBy == null ? List.of() : List.copyOf(groupBy);
    if (version < 0) {
      throw new IllegalArgumentException("version cannot be negative: " + version);
    }
  }

  public static GroupMetadata initial(List<String> groupBy, Instant now) {
    return new GroupMetadata(GroupState.FIRING, 0L, now, now, null, null, 0, 0, groupBy);
  }

  public GroupMetadata withVersion(long newVersion) {
    return new GroupMetadata(
        state,
        newVersion,
        createdAt,
        updatedAt,
        firstFiringAt,
        resolvedAt,
        firingCount,
        resolvedCount,
        groupBy);
  }

  GroupMetadata recomputed(int firing, int resolved, Instant now) {
    GroupState nextState = state.next(firing, resolved);
    Instant nextResolvedAt =
        nextState == GroupState.RESOLVED && resolvedAt == null ? now : resolvedAt;
    Instant nextFirstFiring = firstFiringAt == null && firing > 0 ? now : firstFiringAt;
    return new GroupMetadata(
        nextState,
        version,
        createdAt,
        now,
        nextFirstFiring,
        nextResolvedAt,
        firing,
        resolved,
        groupBy);
  }
}
