package alert.grouping.domain.model.group;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 그룹 매니저 통계 스냅샷
 *
 * @param totalAdds 누적 알림 추가 수
 * @param totalRemoves 누적 알림 제거 수
 * @param totalCleanups 누적 만료 정리 그룹 수
 * @param activeGroups 현재 그룹 수
 * @param totalAlerts 현재 알림 수
 * @param firingAlerts firing 알림 수
 * @param resolvedAlerts resolved 알림 수
 * @param lastCleanupAt 마지막 정리 시각 (nullable)
 * @param sizeDistribution 그룹 크기 분포 (버킷 라벨 → 그룹 수)
 */
public record GroupStats(
    long totalAdds,
    long totalRemoves,
    long totalCleanups,
    int activeGroups,
    int totalAlerts,
    int firingAlerts,
    int resolvedAlerts,
    Instant lastCleanupAt,
    Map<String, Long> sizeDistribution) {

  /** 크기 분포 버킷 (상한 포함) */
  public static final List<String> SIZE_BUCKETS =
      List.of("1-10", "11-50", "51-100", "101-500", "501-1000", "1000+");

  private static final int[] UPPER_BOUNDS = {10, 50, 100, 500, 1000};

  public GroupStats {
    sizeDistribution = Map.copyOf(sizeDistribution);
  }

  public static String bucketOf(int size) {
    for (int i = 0; i < UPPER_BOUNDS.length; i++) {
      if (size <= UPPER_BOUNDS[i]) {
        return SIZE_BUCKETS.get(i);
      }
    }
    return SIZE_BUCKETS.get(SIZE_BUCKETS.size() - 1);
  }

  public static Map<String, Long> emptyDistribution() {
    Map<String, Long> distribution = new LinkedHashMap<>();
    SIZE_BUCKETS.forEach(bucket -> distribution.put(bucket, 0L));
    return distribution;
  }
}
