package alert.grouping.infrastructure.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.jvm.ExecutorServiceMetrics;
import java.util.Collections;
import java.util.concurrent.RejectedExecutionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * 그룹 타이머 + 주기 작업(헬스체크, 정리, 타이머 스윕) 공용 스케줄러
 *
 * <p>요청 처리 스레드와 분리되어 있으며, 거부된 작업은 {@code scheduler.rejected} 로 집계됩니다.
 */
@Slf4j
@Configuration
@EnableScheduling
@EnableConfigurationProperties(SchedulerProperties.class)
public class SchedulerConfig {

  @Bean
  @ConditionalOnMissingBean(name = "taskScheduler")
  public ThreadPoolTaskScheduler taskScheduler(
      SchedulerProperties properties, MeterRegistry meterRegistry) {

    Counter rejectedCounter =
        Counter.builder("scheduler.rejected")
            .description("Number of scheduled tasks rejected")
            .register(meterRegistry);

    ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
    scheduler.setPoolSize(properties.poolSize());
    scheduler.setThreadNamePrefix("grouping-scheduler-");
    scheduler.setRemoveOnCancelPolicy(true);
    scheduler.setWaitForTasksToCompleteOnShutdown(true);
    scheduler.setAwaitTerminationSeconds(properties.awaitTerminationSeconds());
    scheduler.setRejectedExecutionHandler(
        (r, executor) -> {
          rejectedCounter.increment();
          if (executor.isShutdown() || executor.isTerminating()) {
            throw new RejectedExecutionException("Scheduler rejected (shutdown in progress)");
          }
          log.warn(
              "[TaskScheduler] Task rejected. poolSize={}, activeCount={}, queueSize={}",
              executor.getPoolSize(),
              executor.getActiveCount(),
              executor.getQueue().size());
          throw new RejectedExecutionException("TaskScheduler rejected task");
        });
    scheduler.initialize();

    new ExecutorServiceMetrics(
            scheduler.getScheduledExecutor(), "task.scheduler", Collections.emptyList())
        .bindTo(meterRegistry);

    log.info("[TaskScheduler] Initialized with poolSize={}", properties.poolSize());
    return scheduler;
  }
}
