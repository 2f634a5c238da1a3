package alert.grouping.infrastructure.support;

import alert.grouping.domain.model.alert.Alert;
import alert.grouping.domain.model.alert.AlertStatus;
import alert.grouping.domain.model.group.AlertGroup;
import alert.grouping.domain.model.group.GroupKey;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/** 테스트용 그룹/알림 생성 헬퍼 */
public final class GroupFixtures {

  public static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

  private GroupFixtures() {}

  public static Alert firing(String fingerprint, String alertName) {
    return new Alert(
        fingerprint,
        Map.of("alertname", alertName, "instance", fingerprint),
        Map.of("summary", alertName + " on " + fingerprint),
        AlertStatus.FIRING,
        T0,
        null);
  }

  public static AlertGroup group(String alertName, String... fingerprints) {
    return groupAt(T0, alertName, fingerprints);
  }

  /** 생성/갱신 시각을 지정한 그룹 (Redis 인덱스 보존 기간 안의 시각이 필요한 경우) */
  public static AlertGroup groupAt(Instant at, String alertName, String... fingerprints) {
    AlertGroup group =
        AlertGroup.create(GroupKey.of("alertname=" + alertName), List.of("alertname"), at);
    for (String fingerprint : fingerprints) {
      group.upsert(firing(fingerprint, alertName), at);
    }
    return group;
  }
}
