package alert.grouping.infrastructure.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * 그룹/타이머 저장소 설정
 *
 * <pre>{@code
 * grouping:
 *   storage:
 *     key-prefix: "group:"
 *     ttl: 24h            # FIRING 그룹 TTL (grace 별도)
 *     resolved-ttl: 1h    # RESOLVED 그룹은 빠르게 정리
 *     grace-period: 60s
 *     health-check-interval: 30s
 *     fallback-enabled: true
 * }</pre>
 */
@ConfigurationProperties(prefix = "grouping.storage")
public record GroupStorageProperties(
    @DefaultValue("group:") String keyPrefix,
    @DefaultValue("group:index") String indexKey,
    @DefaultValue("timer:") String timerPrefix,
    @DefaultValue("timers:index") String timerIndexKey,
    @DefaultValue("grouping:health") String healthKey,
    @DefaultValue("24h") Duration ttl,
    @DefaultValue("1h") Duration resolvedTtl,
    @DefaultValue("60s") Duration gracePeriod,
    @DefaultValue("30s") Duration healthCheckInterval,
    @DefaultValue("5s") Duration healthCheckTimeout,
    @DefaultValue("16") int loadAllConcurrency,
    @DefaultValue("30s") Duration loadAllTimeout,
    @DefaultValue("true") boolean fallbackEnabled,
    @DefaultValue("true") boolean reconcileOnRecovery,
    @DefaultValue("30s") Duration fireLockLease) {

  public GroupStorageProperties {
    requirePositive(ttl, "ttl");
    requirePositive(resolvedTtl, "resolved-ttl");
    requirePositive(healthCheckInterval, "health-check-interval");
    requirePositive(healthCheckTimeout, "health-check-timeout");
    requirePositive(loadAllTimeout, "load-all-timeout");
    requirePositive(fireLockLease, "fire-lock-lease");
    if (gracePeriod == null || gracePeriod.isNegative()) {
      throw new IllegalArgumentException("grouping.storage.grace-period must not be negative");
    }
    if (loadAllConcurrency <= 0) {
      throw new IllegalArgumentException(
          "grouping.storage.load-all-concurrency must be positive, got: " + loadAllConcurrency);
    }
    if (resolvedTtl.compareTo(ttl) > 0) {
      throw new IllegalArgumentException("grouping.storage.resolved-ttl must not exceed ttl");
    }
  }

  /** 기본값 (테스트/수동 구성용) */
  public static GroupStorageProperties defaults() {
    return new GroupStorageProperties(
        "group:",
        "group:index",
        "timer:",
        "timers:index",
        "grouping:health",
        Duration.ofHours(24),
        Duration.ofHours(1),
        Duration.ofSeconds(60),
        Duration.ofSeconds(30),
        Duration.ofSeconds(5),
        16,
        Duration.ofSeconds(30),
        true,
        true,
        Duration.ofSeconds(30));
  }

  private static void requirePositive(Duration value, String name) {
    if (value == null || value.isZero() || value.isNegative()) {
      throw new IllegalArgumentException("grouping.storage." + name + " must be positive");
    }
  }
}
