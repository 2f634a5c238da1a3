package alert.grouping.domain.model.timer;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum TimerType {
  /** 새 그룹의 첫 flush 전 1회성 대기 */
  WAIT("group_wait"),
  /** flush 후 재알림 주기 */
  INTERVAL("group_interval");

  /** 메트릭/로그 태그 값 */
  private final String tag;
}
