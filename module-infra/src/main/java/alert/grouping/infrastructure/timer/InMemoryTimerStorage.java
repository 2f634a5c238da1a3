package alert.grouping.infrastructure.timer;

import alert.grouping.core.port.out.TimerStorage;
import alert.grouping.domain.model.group.GroupKey;
import alert.grouping.domain.model.timer.GroupTimer;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/** 프로세스 내 타이머 저장소 (fallback). GroupTimer 는 불변이므로 복사가 필요 없습니다. */
public class InMemoryTimerStorage implements TimerStorage {

  private final Map<GroupKey, GroupTimer> timers = new ConcurrentHashMap<>();

  @Override
  public void save(GroupTimer timer) {
    timers.put(timer.groupKey(), timer);
  }

  @Override
  public Optional<GroupTimer> load(GroupKey key) {
    return Optional.ofNullable(timers.get(key));
  }

  @Override
  public void delete(GroupKey key) {
    timers.remove(key);
  }

  /** 만료 시각 순 */
  @Override
  public List<GroupTimer> listAll() {
    return timers.values().stream().sorted(Comparator.comparing(GroupTimer::expiresAt)).toList();
  }
}
