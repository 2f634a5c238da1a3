package alert.grouping.config;

import alert.grouping.domain.service.GroupKeyGenerator;
import alert.grouping.infrastructure.metrics.GroupingMetrics;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import java.time.Clock;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 그룹핑 도메인 Bean 등록
 *
 * <p>버전 충돌 재시도 정책은 application.yml 의 {@code resilience4j.retry.instances.groupVersionConflict} 에서
 * 관리되며, Spring 관리 RetryRegistry 에서 조회하므로 actuator 의 retry 이벤트/메트릭에 함께 집계됩니다.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(GroupingProperties.class)
public class GroupingConfig {

  public static final String VERSION_CONFLICT_RETRY = "groupVersionConflict";

  @Bean
  public GroupKeyGenerator groupKeyGenerator(GroupingProperties properties) {
    GroupingProperties.Key key = properties.key();
    return new GroupKeyGenerator(key.maxLength(), key.hashLongKeys(), key.validateLabelNames());
  }

  @Bean
  @ConditionalOnMissingBean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  public Retry groupVersionConflictRetry(RetryRegistry retryRegistry, GroupingMetrics metrics) {
    Retry retry = retryRegistry.retry(VERSION_CONFLICT_RETRY);
    retry
        .getEventPublisher()
        .onRetry(
            event -> {
              metrics.recordVersionConflict();
              log.warn(
                  "[AlertGroupManager] 버전 충돌 재시도 - attempt={}, cause={}",
                  event.getNumberOfRetryAttempts(),
                  event.getLastThrowable() == null ? "" : event.getLastThrowable().getMessage());
            });
    return retry;
  }
}
