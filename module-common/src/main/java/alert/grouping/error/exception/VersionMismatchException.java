package alert.grouping.error.exception;

import alert.grouping.error.CommonErrorCode;
import alert.grouping.error.exception.base.ClientBaseException;
import lombok.Getter;

/**
 * 낙관적 락 충돌
 *
 * <p>호출자는 그룹을 다시 Load 하고 변경을 재적용한 뒤 재시도합니다.
 */
@Getter
public class VersionMismatchException extends ClientBaseException {

  private final String groupKey;
  private final long expectedVersion;
  private final long actualVersion;

  public VersionMismatchException(String groupKey, long expectedVersion, long actualVersion) {
    super(
        CommonErrorCode.VERSION_MISMATCH,
        groupKey,
        String.valueOf(expectedVersion),
        String.valueOf(actualVersion));
    this.groupKey = groupKey;
    this.expectedVersion = expectedVersion;
    this.actualVersion = actualVersion;
  }
}
