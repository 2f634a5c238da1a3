package alert.grouping.error.exception;

import alert.grouping.error.CommonErrorCode;
import alert.grouping.error.exception.base.ClientBaseException;

public class InvalidGroupingLabelException extends ClientBaseException {

  public InvalidGroupingLabelException(String labelName) {
    super(CommonErrorCode.INVALID_GROUPING_LABEL, labelName);
  }
}
