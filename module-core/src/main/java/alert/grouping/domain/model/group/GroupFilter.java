package alert.grouping.domain.model.group;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * 그룹 목록 조회 필터. null 필드는 조건 없음.
 *
 * @param state 상태 일치
 * @param minSize 최소 알림 수
 * @param maxAge 생성 후 경과 시간 상한
 * @param labelMatchers 모든 알림이 아닌 "하나 이상의 알림"이 가져야 하는 라벨 값
 */
public record GroupFilter(
    GroupState state, Integer minSize, Duration maxAge, Map<String, String> labelMatchers) {

  public GroupFilter {
    labelMatchers = labelMatchers == null ? Map.of() : Map.copyOf(labelMatchers);
  }

  public static GroupFilter all() {
    return new GroupFilter(null, null, null, Map.of());
  }

  public static GroupFilter byState(GroupState state) {
    return new GroupFilter(state, null, null, Map.of());
  }

  public boolean matches(AlertGroup group, Instant now) {
    if (state != null && group.state() != state) {
      return false;
    }
    if (minSize != null && group.size() < minSize) {
      return false;
    }
    if (maxAge != null && group.metadata().createdAt().isBefore(now.minus(maxAge))) {
      return false;
    }
    if (labelMatchers.isEmpty()) {
      return true;
    }
    return group.alerts().stream()
        .anyMatch(
            alert ->
                labelMatchers.entrySet().stream()
                    .allMatch(m -> m.getValue().equals(alert.label(m.getKey()))));
  }
}
