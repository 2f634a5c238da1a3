package alert.grouping.infrastructure.storage.memory;

import alert.grouping.core.port.out.GroupStorage;
import alert.grouping.domain.model.group.AlertGroup;
import alert.grouping.domain.model.group.GroupKey;
import alert.grouping.error.exception.GroupNotFoundException;
import alert.grouping.error.exception.VersionMismatchException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * 프로세스 내 그룹 저장소 (fallback)
 *
 * <p>ReadWriteLock 으로 보호되는 맵. store/load 는 copy-in/copy-out 으로 외부 별칭을 막습니다. TTL 이 없으므로 명시적 delete
 * 또는 재시작만이 정리 경로이며, 장기 상태의 유일한 근거로 사용되지 않습니다.
 *
 * <p>기록이 없는 키에 대한 저장은 호출자의 버전을 그대로 이어받습니다. primary 에서 읽은 그룹(version N)을 강등 직후 fallback 에
 * 다시 쓰는 경로가 버전 충돌로 막히지 않게 하기 위함입니다. 기록이 있는 키는 일반 CAS 규칙을 따릅니다.
 */
public class InMemoryGroupStorage implements GroupStorage {

  public static final String BACKEND = "memory";

  private final Map<GroupKey, AlertGroup> groups = new HashMap<>();
  private final ReadWriteLock lock = new ReentrantReadWriteLock();

  @Override
  public long store(AlertGroup group) {
    lock.writeLock().lock();
    try {
      AlertGroup existing = groups.get(group.key());
      if (existing != null && existing.version() != group.version()) {
        throw new VersionMismatchException(
            group.key().value(), group.version(), existing.version());
      }
      long next = group.version() + 1;
      AlertGroup stored = group.copy();
      stored.markStored(next);
      groups.put(group.key(), stored);
      return next;
    } finally {
      lock.writeLock().unlock();
    }
  }

  @Override
  public AlertGroup load(GroupKey key) {
    lock.readLock().lock();
    try {
      AlertGroup group = groups.get(key);
      if (group == null) {
        throw new GroupNotFoundException(key.value());
      }
      return group.copy();
    } finally {
      lock.readLock().unlock();
    }
  }

  @Override
  public void delete(GroupKey key) {
    lock.writeLock().lock();
    try {
      groups.remove(key);
    } finally {
      lock.writeLock().unlock();
    }
  }

  @Override
  public List<GroupKey> listKeys() {
    lock.readLock().lock();
    try {
      return List.copyOf(groups.keySet());
    } finally {
      lock.readLock().unlock();
    }
  }

  @Override
  public int size() {
    lock.readLock().lock();
    try {
      return groups.size();
    } finally {
      lock.readLock().unlock();
    }
  }

  @Override
  public List<AlertGroup> loadAll() {
    lock.readLock().lock();
    try {
      List<AlertGroup> copies = new ArrayList<>(groups.size());
      groups.values().forEach(group -> copies.add(group.copy()));
      return copies;
    } finally {
      lock.readLock().unlock();
    }
  }

  @Override
  public void storeAll(Collection<AlertGroup> toStore) {
    lock.writeLock().lock();
    try {
      toStore.forEach(group -> groups.put(group.key(), group.copy()));
    } finally {
      lock.writeLock().unlock();
    }
  }

  @Override
  public List<GroupKey> listKeysUpdatedBefore(Instant cutoff) {
    lock.readLock().lock();
    try {
      return groups.values().stream()
          .filter(group -> group.metadata().updatedAt().isBefore(cutoff))
          .map(AlertGroup::key)
          .toList();
    } finally {
      lock.readLock().unlock();
    }
  }

  /** 항상 정상 */
  @Override
  public void ping() {}

  @Override
  public String backendName() {
    return BACKEND;
  }
}
