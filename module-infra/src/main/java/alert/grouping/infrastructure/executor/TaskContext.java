package alert.grouping.infrastructure.executor;

import java.util.Objects;

/**
 * 로그/메트릭 카디널리티 통제를 위한 작업 컨텍스트
 *
 * <pre>
 * "component:operation:dynamicValue"
 *
 * 예시:
 * - TaskContext.of("RedisGroupStorage", "store", "alertname=HighCPU")
 *   → "RedisGroupStorage:store:alertname=HighCPU"
 * - TaskContext.of("StorageCoordinator", "healthCheck")
 *   → "StorageCoordinator:healthCheck"
 * </pre>
 *
 * <ul>
 *   <li>component, operation: 고정 값 (메트릭 태그 가능)
 *   <li>dynamicValue: 그룹 키 등 동적 값, 로그에만 기록
 * </ul>
 *
 * @param component 컴포넌트 이름
 * @param operation 작업 유형
 * @param dynamicValue 동적 값
 */
public record TaskContext(String component, String operation, String dynamicValue) {

  public TaskContext {
    Objects.requireNonNull(component, "component");
    Objects.requireNonNull(operation, "operation");
    if (dynamicValue == null) {
      dynamicValue = "";
    }
  }

  public static TaskContext of(String component, String operation, String dynamicValue) {
    return new TaskContext(component, operation, dynamicValue);
  }

  public static TaskContext of(String component, String operation) {
    return new TaskContext(component, operation, "");
  }

  public String toTaskName() {
    if (dynamicValue.isEmpty()) {
      return component + ":" + operation;
    }
    return component + ":" + operation + ":" + dynamicValue;
  }
}
