package alert.grouping.error.exception;

import alert.grouping.error.CommonErrorCode;
import alert.grouping.error.exception.base.ServerBaseException;

/** 손상되었거나 형식이 잘못된 저장 문서. 벌크 로드에서는 해당 항목만 건너뜁니다. */
public class GroupSerializationException extends ServerBaseException {

  public GroupSerializationException(String key, Throwable cause) {
    super(CommonErrorCode.GROUP_SERIALIZATION_ERROR, cause, key);
  }
}
