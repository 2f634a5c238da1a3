package alert.grouping.error.exception.base;

import alert.grouping.error.ErrorCode;

/**
 * ServerBaseException: 저장소 장애, 직렬화 오류 등 '시스템 예외'. 장애 회고를 위해 원인(cause)을 함께 보존합니다.
 */
public abstract class ServerBaseException extends BaseException {

  public ServerBaseException(ErrorCode errorCode) {
    super(errorCode);
  }

  public ServerBaseException(ErrorCode errorCode, Object... args) {
    super(errorCode, args);
  }

  public ServerBaseException(ErrorCode errorCode, Throwable cause) {
    super(errorCode, cause);
  }

  // 상세 메시지(args)와 실제 에러(cause)를 동시에 기록
  public ServerBaseException(ErrorCode errorCode, Throwable cause, Object... args) {
    super(errorCode, cause, args);
  }
}
