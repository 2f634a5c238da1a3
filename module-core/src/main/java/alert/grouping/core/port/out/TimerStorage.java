package alert.grouping.core.port.out;

import alert.grouping.domain.model.group.GroupKey;
import alert.grouping.domain.model.timer.GroupTimer;
import java.util.List;
import java.util.Optional;

/** 그룹 타이머 영속화 포트 (그룹 키당 하나) */
public interface TimerStorage {

  void save(GroupTimer timer);

  Optional<GroupTimer> load(GroupKey key);

  /** 멱등 삭제 */
  void delete(GroupKey key);

  List<GroupTimer> listAll();
}
