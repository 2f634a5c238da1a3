package alert.grouping.error.exception;

import alert.grouping.error.CommonErrorCode;
import alert.grouping.error.exception.base.ClientBaseException;

public class InvalidAlertException extends ClientBaseException {

  public InvalidAlertException(String reason) {
    super(CommonErrorCode.INVALID_ALERT, reason);
  }
}
