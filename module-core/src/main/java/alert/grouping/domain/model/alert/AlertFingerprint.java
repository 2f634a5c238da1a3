package alert.grouping.domain.model.alert;

import java.util.Map;
import java.util.TreeMap;

/**
 * 라벨 집합의 안정적인 fingerprint
 *
 * <p>fingerprint를 직접 제공하지 않는 수집기용. 라벨 이름 순으로 정렬한 뒤 해시하므로 맵 순회 순서와 무관합니다.
 */
public final class AlertFingerprint {

  private static final char SEPARATOR = '\u0000';

  private AlertFingerprint() {}

  public static String of(Map<String, String> labels) {
    if (labels == null || labels.isEmpty()) {
      return Fnv1a.hex64("");
    }
    StringBuilder sb = new StringBuilder();
    new TreeMap<>(labels)
        .forEach(
            (name, value) ->
                sb.append(name).append(SEPARATOR).append(value == null ? "" : value).append(SEPARATOR));
    return Fnv1a.hex64(sb.toString());
  }
}
