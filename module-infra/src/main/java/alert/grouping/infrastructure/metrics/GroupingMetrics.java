package alert.grouping.infrastructure.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.function.BooleanSupplier;
import lombok.RequiredArgsConstructor;

/**
 * 그룹핑 코어 메트릭
 *
 * <h3>메트릭</h3>
 *
 * <ul>
 *   <li>{@code grouping.storage.operations{backend,operation,result}} - 저장소 작업 결과
 *   <li>{@code grouping.storage.latency{backend,operation}} - 저장소 작업 지연 (histogram)
 *   <li>{@code grouping.storage.fallback{reason}} - primary → fallback 전환
 *   <li>{@code grouping.storage.recovery{reason}} - fallback → primary 복구
 *   <li>{@code grouping.storage.health{backend}} - 백엔드 헬스 (1 = 정상)
 *   <li>{@code grouping.groups.restored} - 기동 시 복원된 그룹 수
 *   <li>{@code grouping.groups.events{event}} - created / resolved / deleted / expired / recycled
 *   <li>{@code grouping.version.conflicts} - 낙관적 락 충돌 재시도
 *   <li>{@code grouping.timers.events{type,event}} - started / fired / missed / cancelled / stale
 *   <li>{@code grouping.notifications{result}} - flush 콜백 결과
 * </ul>
 */
@RequiredArgsConstructor
public class GroupingMetrics {

  public static final String RESULT_SUCCESS = "success";
  public static final String RESULT_NOT_FOUND = "not_found";
  public static final String RESULT_CONFLICT = "conflict";
  public static final String RESULT_ERROR = "error";

  private final MeterRegistry meterRegistry;

  public void recordStorageOperation(
      String backend, String operation, String result, Duration elapsed) {
    Counter.builder("grouping.storage.operations")
        .tag("backend", backend)
        .tag("operation", operation)
        .tag("result", result)
        .register(meterRegistry)
        .increment();
    Timer.builder("grouping.storage.latency")
        .tag("backend", backend)
        .tag("operation", operation)
        .publishPercentileHistogram()
        .register(meterRegistry)
        .record(elapsed);
  }

  public void recordFallback(String reason) {
    Counter.builder("grouping.storage.fallback")
        .description("primary 저장소에서 fallback 으로 전환된 횟수")
        .tag("reason", reason)
        .register(meterRegistry)
        .increment();
  }

  public void recordRecovery(String reason) {
    Counter.builder("grouping.storage.recovery")
        .description("fallback 에서 primary 로 복구된 횟수")
        .tag("reason", reason)
        .register(meterRegistry)
        .increment();
  }

  public void registerHealthGauge(String backend, BooleanSupplier healthy) {
    Gauge.builder("grouping.storage.health", healthy, h -> h.getAsBoolean() ? 1.0 : 0.0)
        .description("저장소 백엔드 헬스 (1 = 정상)")
        .strongReference(true)
        .tag("backend", backend)
        .register(meterRegistry);
  }

  public void recordGroupsRestored(int count) {
    Counter.builder("grouping.groups.restored").register(meterRegistry).increment(count);
  }

  public void recordGroupEvent(String event) {
    Counter.builder("grouping.groups.events")
        .tag("event", event)
        .register(meterRegistry)
        .increment();
  }

  public void recordVersionConflict() {
    Counter.builder("grouping.version.conflicts").register(meterRegistry).increment();
  }

  public void recordTimerEvent(String type, String event) {
    Counter.builder("grouping.timers.events")
        .tag("type", type)
        .tag("event", event)
        .register(meterRegistry)
        .increment();
  }

  public void recordNotification(String result) {
    Counter.builder("grouping.notifications")
        .tag("result", result)
        .register(meterRegistry)
        .increment();
  }
}
