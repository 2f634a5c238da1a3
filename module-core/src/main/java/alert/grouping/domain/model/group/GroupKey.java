package alert.grouping.domain.model.group;

import java.util.Objects;

/**
 * 그룹 키 (Value Object)
 *
 * <p>그룹핑 라벨로부터 결정론적으로 파생된 불투명 문자열. 프로세스 재시작과 레플리카 간에 동일한 입력이면 동일한 값입니다.
 */
public record GroupKey(String value) implements Comparable<GroupKey> {

  /** 그룹핑 라벨이 비어있을 때의 단일 전역 그룹 */
  public static final GroupKey GLOBAL = new GroupKey("{global}");

  public GroupKey {
    Objects.requireNonNull(value, "GroupKey value cannot be null");
    if (value.isEmpty()) {
      throw new IllegalArgumentException("GroupKey value cannot be empty");
    }
  }

  public static GroupKey of(String value) {
    return new GroupKey(value);
  }

  @Override
  public int compareTo(GroupKey other) {
    return value.compareTo(other.value);
  }

  @Override
  public String toString() {
    return value;
  }
}
