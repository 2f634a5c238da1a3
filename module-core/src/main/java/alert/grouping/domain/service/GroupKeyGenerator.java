package alert.grouping.domain.service;

import alert.grouping.domain.model.alert.Fnv1a;
import alert.grouping.domain.model.group.GroupKey;
import alert.grouping.error.exception.InvalidGroupingLabelException;
import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * 라벨 → 그룹 키 순수 함수
 *
 * <h3>규칙</h3>
 *
 * <ul>
 *   <li>그룹핑 라벨 이름을 정렬(중복 제거)한 뒤 {@code name=value} 를 {@code ,} 로 연결
 *   <li>알림에 없는 그룹핑 라벨은 빈 문자열로 취급 (알림을 제외하지 않음)
 *   <li>그룹핑 라벨이 비어있으면 {@link GroupKey#GLOBAL}
 *   <li>{@code ...} 는 알림의 모든 라벨로 그룹핑
 *   <li>예약 문자가 포함된 값은 퍼센트 인코딩하여 서로 다른 라벨 집합이 같은 문자열이 되지 않게 함
 *   <li>{@code maxKeyLength} 를 넘는 키는 {@code {hash:<FNV-1a 64>}} 로 축약 (충돌 시 같은 그룹으로 병합)
 * </ul>
 *
 * <p>입력 맵의 순회 순서나 그룹핑에 포함되지 않은 라벨에 영향받지 않습니다.
 */
public class GroupKeyGenerator {

  public static final String ALL_LABELS = "...";
  public static final int DEFAULT_MAX_KEY_LENGTH = 256;
  public static final int MIN_KEY_LENGTH = 64;
  public static final int MAX_KEY_LENGTH = 2048;

  private static final Pattern LABEL_NAME = Pattern.compile("[a-zA-Z_][a-zA-Z0-9_]*");
  private static final String RESERVED = ",={}[]<>%";
  private static final char[] HEX = "0123456789ABCDEF".toCharArray();

  private final int maxKeyLength;
  private final boolean hashLongKeys;
  private final boolean validateLabelNames;

  public GroupKeyGenerator() {
    this(DEFAULT_MAX_KEY_LENGTH, true, false);
  }

  public GroupKeyGenerator(int maxKeyLength, boolean hashLongKeys, boolean validateLabelNames) {
    this.maxKeyLength = Math.max(MIN_KEY_LENGTH, Math.min(MAX_KEY_LENGTH, maxKeyLength));
    this.hashLongKeys = hashLongKeys;
    this.validateLabelNames = validateLabelNames;
  }

  /**
   * @param labels 알림 라벨 (null 허용)
   * @param groupingLabelNames 그룹핑 라벨 이름 (null/빈 목록이면 전역 그룹)
   */
  public GroupKey generate(Map<String, String> labels, List<String> groupingLabelNames) {
    if (groupingLabelNames == null || groupingLabelNames.isEmpty()) {
      return GroupKey.GLOBAL;
    }
    Map<String, String> safeLabels = labels == null ? Map.of() : labels;
    SortedSet<String> names = resolveNames(safeLabels, groupingLabelNames);
    if (names.isEmpty()) {
      return GroupKey.GLOBAL;
    }

    StringBuilder sb = new StringBuilder();
    for (String name : names) {
      if (sb.length() > 0) {
        sb.append(',');
      }
      String value = safeLabels.get(name);
      sb.append(name).append('=').append(encode(value == null ? "" : value));
    }

    String raw = sb.toString();
    if (hashLongKeys && raw.length() > maxKeyLength) {
      return GroupKey.of("{hash:" + Fnv1a.hex64(raw) + "}");
    }
    return GroupKey.of(raw);
  }

  private SortedSet<String> resolveNames(Map<String, String> labels, Collection<String> requested) {
    SortedSet<String> names = new TreeSet<>();
    for (String name : requested) {
      if (ALL_LABELS.equals(name)) {
        names.addAll(labels.keySet());
      } else if (name != null && !name.isEmpty()) {
        names.add(name);
      }
    }
    if (validateLabelNames) {
      for (String name : names) {
        if (!LABEL_NAME.matcher(name).matches()) {
          throw new InvalidGroupingLabelException(name);
        }
      }
    }
    return names;
  }

  static String encode(String value) {
    if (!needsEncoding(value)) {
      return value;
    }
    StringBuilder sb = new StringBuilder(value.length() + 16);
    value
        .codePoints()
        .forEach(
            cp -> {
              if (cp < 0x80 && !isReserved((char) cp)) {
                sb.append((char) cp);
                return;
              }
              for (byte b : new String(Character.toChars(cp)).getBytes(StandardCharsets.UTF_8)) {
                sb.append('%').append(HEX[(b >> 4) & 0x0f]).append(HEX[b & 0x0f]);
              }
            });
    return sb.toString();
  }

  private static boolean needsEncoding(String value) {
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      if (c >= 0x80 || isReserved(c)) {
        return true;
      }
    }
    return false;
  }

  private static boolean isReserved(char c) {
    return RESERVED.indexOf(c) >= 0 || Character.isWhitespace(c) || Character.isISOControl(c);
  }

  public int maxKeyLength() {
    return maxKeyLength;
  }
}
