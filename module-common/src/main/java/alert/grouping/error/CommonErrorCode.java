package alert.grouping.error;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public enum CommonErrorCode implements ErrorCode {
  // === Client Errors (C0xx) ===
  INVALID_INPUT_VALUE("C001", "잘못된 입력값입니다: %s", true),
  GROUP_NOT_FOUND("C002", "존재하지 않는 알림 그룹입니다 (key: %s)", true),
  VERSION_MISMATCH("C003", "그룹 버전 충돌 (key: %s, expected: %s, actual: %s)", true),
  INVALID_ALERT("C004", "유효하지 않은 알림입니다: %s", true),
  INVALID_GROUPING_LABEL("C005", "유효하지 않은 그룹핑 라벨 이름입니다 (label: %s)", true),

  // === Server Errors (S0xx) ===
  INTERNAL_SERVER_ERROR("S001", "서버 내부 오류가 발생했습니다 (%s)", false),
  STORAGE_UNAVAILABLE("S002", "저장소를 사용할 수 없습니다 (backend: %s, operation: %s)", false),
  GROUP_SERIALIZATION_ERROR("S003", "그룹 문서 직렬화/역직렬화 실패 (key: %s)", false),
  STORAGE_INITIALIZATION_FAILED("S004", "저장소 초기화 실패 (대상: %s)", false),
  TIMER_STORAGE_ERROR("S005", "타이머 저장소 오류 (operation: %s, key: %s)", false);

  private final String code;
  private final String message;
  private final boolean clientError;
}
