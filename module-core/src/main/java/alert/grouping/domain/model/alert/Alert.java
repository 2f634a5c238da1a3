package alert.grouping.domain.model.alert;

import alert.grouping.error.exception.InvalidAlertException;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 개별 알림 인스턴스 (Value Object)
 *
 * <p>라벨/어노테이션 맵은 생성 시 복사되어 불변입니다. 알림은 자신을 포함하는 {@code AlertGroup}의 일부로만 저장되며 독립적으로
 * 영속화되지 않습니다.
 *
 * @param fingerprint 전체 라벨의 안정적인 해시 (그룹 내 중복 제거 키)
 * @param labels 라벨
 * @param annotations 어노테이션
 * @param status firing / resolved
 * @param startsAt 발생 시각
 * @param endsAt 해소 시각 (firing 이면 null 가능)
 */
public record Alert(
    String fingerprint,
    Map<String, String> labels,
    Map<String, String> annotations,
    AlertStatus status,
    Instant startsAt,
    Instant endsAt) {

  public static final String ALERT_NAME_LABEL = "alertname";

  public Alert {
    labels = labels == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(labels));
    annotations =
        annotations == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(annotations));
    if (status == null) {
      status = AlertStatus.FIRING;
    }
  }

  /** fingerprint를 라벨로부터 계산하는 firing 알림 */
  public static Alert firing(Map<String, String> labels, Instant startsAt) {
    return new Alert(
        AlertFingerprint.of(labels), labels, Map.of(), AlertStatus.FIRING, startsAt, null);
  }

  /** 같은 fingerprint의 해소(resolved) 알림 */
  public Alert resolve(Instant endedAt) {
    return new Alert(fingerprint, labels, annotations, AlertStatus.RESOLVED, startsAt, endedAt);
  }

  /**
   * 그룹핑에 들어갈 수 있는 알림인지 검증
   *
   * @throws InvalidAlertException fingerprint가 비어있는 경우
   */
  public void validate() {
    if (fingerprint == null || fingerprint.isBlank()) {
      throw new InvalidAlertException("fingerprint is empty");
    }
  }

  public boolean isFiring() {
    return status == AlertStatus.FIRING;
  }

  public boolean isResolved() {
    return status == AlertStatus.RESOLVED;
  }

  /** 라벨 값 (없으면 빈 문자열) */
  public String label(String name) {
    return labels.getOrDefault(name, "");
  }

  public String alertName() {
    return label(ALERT_NAME_LABEL);
  }
}
