package alert.grouping.core.port.out;

import alert.grouping.domain.model.group.AlertGroup;
import alert.grouping.domain.model.group.GroupKey;
import java.time.Instant;
import java.util.Collection;
import java.util.List;

/**
 * 알림 그룹 저장소 포트
 *
 * <h3>구현체</h3>
 *
 * <ul>
 *   <li>RedisGroupStorage - 분산 저장소 (Lua CAS + TTL + 정렬 인덱스)
 *   <li>InMemoryGroupStorage - 프로세스 내 fallback
 *   <li>StorageCoordinator - 위 둘을 합성한 자동 failover 저장소
 * </ul>
 *
 * <p>모든 조회 결과는 복사본이며, 전달된 그룹 인스턴스는 저장소가 보관하지 않습니다. 호출 마감 시간은 구현체의 명령 타임아웃과 벌크 작업 타임아웃으로
 * 표현됩니다.
 */
public interface GroupStorage {

  /**
   * 그룹 저장 (낙관적 락)
   *
   * <p>저장소에 기록된 버전이 {@code group.version()} 과 다르면 실패합니다. 레코드가 없을 때 분산 저장소는 version 0 만
   * 허용하고, in-process fallback 은 강등 직후 재시도를 받기 위해 호출자의 버전을 이어받습니다.
   *
   * @return 증가된 새 버전
   * @throws alert.grouping.error.exception.VersionMismatchException 버전 불일치
   */
  long store(AlertGroup group);

  /**
   * @throws alert.grouping.error.exception.GroupNotFoundException 그룹 없음
   */
  AlertGroup load(GroupKey key);

  /** 멱등 삭제 (없어도 성공) */
  void delete(GroupKey key);

  List<GroupKey> listKeys();

  int size();

  /** 벌크 로드. 개별 키 실패는 로그 후 건너뜁니다. */
  List<AlertGroup> loadAll();

  /** 버전 검사 없는 best-effort 배치 쓰기 (복원/재동기화용) */
  void storeAll(Collection<AlertGroup> groups);

  /** updatedAt 이 cutoff 이전인 키 (만료 후보) */
  List<GroupKey> listKeysUpdatedBefore(Instant cutoff);

  /** 생존 확인. 실패 시 예외 */
  void ping();

  /** 메트릭/로그용 백엔드 이름 */
  String backendName();
}
