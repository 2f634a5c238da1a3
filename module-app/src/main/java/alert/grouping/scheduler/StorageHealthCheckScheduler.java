package alert.grouping.scheduler;

import alert.grouping.infrastructure.storage.StorageCoordinator;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * primary 저장소 헬스체크 (기본 30초)
 *
 * <p>요청 경로와 독립적으로 실행되며 전환 판단은 {@link StorageCoordinator#checkHealth()} 가 담당합니다.
 */
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(
    name = "scheduler.grouping.enabled",
    havingValue = "true",
    matchIfMissing = true)
public class StorageHealthCheckScheduler {

  private final StorageCoordinator coordinator;

  @Scheduled(
      fixedDelayString = "${grouping.storage.health-check-interval:30s}",
      initialDelayString = "${grouping.storage.health-check-interval:30s}")
  public void checkHealth() {
    coordinator.checkHealth();
  }
}
