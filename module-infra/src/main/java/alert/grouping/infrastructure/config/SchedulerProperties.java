package alert.grouping.infrastructure.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * 타이머/주기 작업 스케줄러 스레드 풀 설정
 *
 * <pre>{@code
 * scheduler:
 *   task-scheduler:
 *     pool-size: 4
 * }</pre>
 *
 * @see SchedulerConfig
 */
@ConfigurationProperties(prefix = "scheduler.task-scheduler")
public record SchedulerProperties(
    @DefaultValue("4") int poolSize, @DefaultValue("30") int awaitTerminationSeconds) {

  public SchedulerProperties {
    if (poolSize <= 0) {
      throw new IllegalArgumentException(
          "scheduler.task-scheduler.pool-size must be positive, got: " + poolSize);
    }
    if (awaitTerminationSeconds <= 0) {
      throw new IllegalArgumentException("await-termination-seconds must be positive");
    }
  }
}
