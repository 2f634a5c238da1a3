package alert.grouping.error.exception.base;

import alert.grouping.error.ErrorCode;

/**
 * ClientBaseException: 호출자가 처리할 수 있는 '기대된 예외' (NotFound, 버전 충돌, 잘못된 입력).
 *
 * <p>정상 제어 흐름의 일부이므로 ERROR 레벨로 로깅하지 않습니다.
 */
public abstract class ClientBaseException extends BaseException {

  public ClientBaseException(ErrorCode errorCode) {
    super(errorCode);
  }

  public ClientBaseException(ErrorCode errorCode, Object... args) {
    super(errorCode, args);
  }
}
