package alert.grouping.error.exception;

import alert.grouping.error.CommonErrorCode;
import alert.grouping.error.exception.base.ServerBaseException;

/** 분류되지 않은 기술적 예외를 감싸는 최후의 도메인 예외 */
public class InternalSystemException extends ServerBaseException {

  public InternalSystemException(String taskName, Throwable cause) {
    super(CommonErrorCode.INTERNAL_SERVER_ERROR, cause, taskName);
  }
}
