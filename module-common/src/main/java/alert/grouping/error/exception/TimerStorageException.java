package alert.grouping.error.exception;

import alert.grouping.error.CommonErrorCode;
import alert.grouping.error.exception.base.ServerBaseException;

public class TimerStorageException extends ServerBaseException {

  public TimerStorageException(String operation, String key, Throwable cause) {
    super(CommonErrorCode.TIMER_STORAGE_ERROR, cause, operation, key);
  }
}
