package alert.grouping.config;

import alert.grouping.domain.service.GroupKeyGenerator;
import java.time.Duration;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * 그룹핑 동작 설정
 *
 * <h3>application.yml 설정 예시</h3>
 *
 * <pre>
 * grouping:
 *   group-by: [alertname, cluster]   # "..." 이면 전체 라벨
 *   group-wait: 30s
 *   group-interval: 5m
 *   max-group-age: 24h
 *   cleanup-interval: 5m
 *   key:
 *     max-length: 256
 *     hash-long-keys: true
 *     validate-label-names: false
 * </pre>
 *
 * @param groupBy 그룹핑 라벨 이름 목록
 * @param groupWait 새 그룹의 첫 flush 까지 대기 시간
 * @param groupInterval flush 이후 재알림 주기
 * @param maxGroupAge 변경 없는 그룹의 정리 기준
 * @param cleanupInterval 만료 정리 주기
 * @param key 그룹 키 생성 옵션
 */
@ConfigurationProperties(prefix = "grouping")
public record GroupingProperties(
    @DefaultValue("alertname") List<String> groupBy,
    @DefaultValue("30s") Duration groupWait,
    @DefaultValue("5m") Duration groupInterval,
    @DefaultValue("24h") Duration maxGroupAge,
    @DefaultValue("5m") Duration cleanupInterval,
    @DefaultValue Key key) {

  public GroupingProperties {
    groupBy = groupBy == null ? List.of() : List.copyOf(groupBy);
    requirePositive(groupWait, "group-wait");
    requirePositive(groupInterval, "group-interval");
    requirePositive(maxGroupAge, "max-group-age");
    requirePositive(cleanupInterval, "cleanup-interval");
    if (key == null) {
      key = Key.defaults();
    }
  }

  public static GroupingProperties defaults() {
    return new GroupingProperties(
        List.of("alertname"),
        Duration.ofSeconds(30),
        Duration.ofMinutes(5),
        Duration.ofHours(24),
        Duration.ofMinutes(5),
        Key.defaults());
  }

  private static void requirePositive(Duration value, String name) {
    if (value == null || value.isZero() || value.isNegative()) {
      throw new IllegalArgumentException("grouping." + name + " must be positive");
    }
  }

  /**
   * @param maxLength 키 최대 길이 (64..2048 로 보정)
   * @param hashLongKeys 최대 길이 초과 시 해시 키 사용
   * @param validateLabelNames 라벨 이름 형식 검증
   */
  public record Key(
      @DefaultValue("256") int maxLength,
      @DefaultValue("true") boolean hashLongKeys,
      @DefaultValue("false") boolean validateLabelNames) {

    public Key {
      maxLength =
          Math.max(
              GroupKeyGenerator.MIN_KEY_LENGTH, Math.min(GroupKeyGenerator.MAX_KEY_LENGTH, maxLength));
    }

    public static Key defaults() {
      return new Key(GroupKeyGenerator.DEFAULT_MAX_KEY_LENGTH, true, false);
    }
  }
}
