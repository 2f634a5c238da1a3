package alert.grouping.service.grouping;

import alert.grouping.domain.model.alert.Alert;
import alert.grouping.domain.model.group.AlertGroup;
import alert.grouping.domain.model.group.GroupFilter;
import alert.grouping.domain.model.group.GroupKey;
import alert.grouping.domain.model.group.GroupPage;
import alert.grouping.domain.model.group.GroupStats;
import alert.grouping.domain.model.group.Pagination;
import java.time.Duration;

/**
 * 알림 그룹 수명주기 관리
 *
 * <p>반환되는 모든 그룹은 복사본입니다. 저장소 장애는 failover 로 흡수되며, failover 와 재시도 이후에도 남는 오류만 호출자에게 전파됩니다.
 */
public interface AlertGroupManager {

  /**
   * 알림을 그룹에 추가 (같은 fingerprint 는 덮어쓰기)
   *
   * @return 저장된 그룹의 복사본
   * @throws alert.grouping.error.exception.InvalidAlertException fingerprint 가 비어 있는 경우
   * @throws alert.grouping.error.exception.VersionMismatchException 재시도 소진
   */
  AlertGroup addAlertToGroup(Alert alert);

  /**
   * 그룹에서 알림 제거. 그룹이 비면 삭제하고 타이머를 취소합니다.
   *
   * @throws alert.grouping.error.exception.GroupNotFoundException 그룹이 없는 경우
   */
  void removeAlertFromGroup(String fingerprint, GroupKey key);

  AlertGroup getGroup(GroupKey key);

  AlertGroup getGroupByFingerprint(String fingerprint);

  /** 키 순 정렬 후 필터/페이지 적용 */
  GroupPage listGroups(GroupFilter filter, Pagination pagination);

  /**
   * maxAge 동안 변경이 없거나 RESOLVED 후 maxAge 가 지난 그룹 삭제
   *
   * @return 삭제된 그룹 수
   */
  int cleanupExpiredGroups(Duration maxAge);

  /**
   * 기동 시 저장소의 그룹을 그대로 신뢰하고 fingerprint 인덱스를 재구성
   *
   * @return 복원된 그룹 수
   */
  int restoreFromStorage();

  GroupStats getStats();
}
