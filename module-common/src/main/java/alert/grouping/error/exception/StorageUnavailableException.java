package alert.grouping.error.exception;

import alert.grouping.error.CommonErrorCode;
import alert.grouping.error.exception.base.ServerBaseException;
import lombok.Getter;

/**
 * 저장소 전송/백엔드 장애
 *
 * <p>StorageCoordinator가 fallback 저장소로 흡수합니다. fallback 까지 실패한 경우에만 호출자에게 전파됩니다.
 */
@Getter
public class StorageUnavailableException extends ServerBaseException {

  private final String backend;
  private final String operation;

  public StorageUnavailableException(String backend, String operation, Throwable cause) {
    super(CommonErrorCode.STORAGE_UNAVAILABLE, cause, backend, operation);
    this.backend = backend;
    this.operation = operation;
  }

  public StorageUnavailableException(String backend, String operation) {
    super(CommonErrorCode.STORAGE_UNAVAILABLE, backend, operation);
    this.backend = backend;
    this.operation = operation;
  }
}
