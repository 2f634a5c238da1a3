package alert.grouping.error.exception;

import alert.grouping.error.CommonErrorCode;
import alert.grouping.error.exception.base.ClientBaseException;

/** 해당 키의 그룹이 저장소에 없음 (기대된 제어 흐름 신호) */
public class GroupNotFoundException extends ClientBaseException {

  public GroupNotFoundException(String groupKey) {
    super(CommonErrorCode.GROUP_NOT_FOUND, groupKey);
  }
}
