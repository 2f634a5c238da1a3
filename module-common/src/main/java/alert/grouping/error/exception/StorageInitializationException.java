package alert.grouping.error.exception;

import alert.grouping.error.CommonErrorCode;
import alert.grouping.error.exception.base.ServerBaseException;

/** 사용 가능한 저장소를 하나도 구성하지 못함 (기동 중단) */
public class StorageInitializationException extends ServerBaseException {

  public StorageInitializationException(String target) {
    super(CommonErrorCode.STORAGE_INITIALIZATION_FAILED, target);
  }

  public StorageInitializationException(String target, Throwable cause) {
    super(CommonErrorCode.STORAGE_INITIALIZATION_FAILED, cause, target);
  }
}
