package alert.grouping.service.grouping;

import alert.grouping.domain.model.alert.Alert;
import alert.grouping.domain.model.group.AlertGroup;
import alert.grouping.domain.model.group.GroupKey;
import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.springframework.stereotype.Component;

/**
 * fingerprint → 그룹 키 역조회 캐시 (프로세스 로컬)
 *
 * <p>권위 있는 상태가 아닙니다. 저장소 전체 스캔으로 언제든 재구성할 수 있으므로 동시 쓰기 직후의 일시적 불일치를 허용합니다. 조회 결과는
 * 반드시 저장소 Load 로 확인해야 합니다.
 */
@Component
public class FingerprintIndex {

  private final Map<String, GroupKey> index = new HashMap<>();
  private final ReadWriteLock lock = new ReentrantReadWriteLock();

  public Optional<GroupKey> lookup(String fingerprint) {
    lock.readLock().lock();
    try {
      return Optional.ofNullable(index.get(fingerprint));
    } finally {
      lock.readLock().unlock();
    }
  }

  public void put(String fingerprint, GroupKey key) {
    lock.writeLock().lock();
    try {
      index.put(fingerprint, key);
    } finally {
      lock.writeLock().unlock();
    }
  }

  /** 다른 그룹으로 옮겨간 항목은 지우지 않습니다. */
  public void remove(String fingerprint, GroupKey key) {
    lock.writeLock().lock();
    try {
      index.remove(fingerprint, key);
    } finally {
      lock.writeLock().unlock();
    }
  }

  public void removeGroup(AlertGroup group) {
    lock.writeLock().lock();
    try {
      for (Alert alert : group.alerts()) {
        index.remove(alert.fingerprint(), group.key());
      }
    } finally {
      lock.writeLock().unlock();
    }
  }

  /**
   * 그룹 목록으로 전체 재구성
   *
   * @return 재구성된 항목 수
   */
  public int rebuild(Collection<AlertGroup> groups) {
    Map<String, GroupKey> rebuilt = new HashMap<>();
    for (AlertGroup group : groups) {
      for (Alert alert : group.alerts()) {
        rebuilt.put(alert.fingerprint(), group.key());
      }
    }
    lock.writeLock().lock();
    try {
      index.clear();
      index.putAll(rebuilt);
      return index.size();
    } finally {
      lock.writeLock().unlock();
    }
  }

  public int size() {
    lock.readLock().lock();
    try {
      return index.size();
    } finally {
      lock.readLock().unlock();
    }
  }
}
