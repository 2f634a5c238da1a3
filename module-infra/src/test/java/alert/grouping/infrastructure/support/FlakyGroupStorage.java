package alert.grouping.infrastructure.support;

import alert.grouping.core.port.out.GroupStorage;
import alert.grouping.domain.model.group.AlertGroup;
import alert.grouping.domain.model.group.GroupKey;
import alert.grouping.error.exception.StorageUnavailableException;
import alert.grouping.infrastructure.storage.memory.InMemoryGroupStorage;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/** 장애를 켜고 끌 수 있는 primary 대역 (내부는 InMemoryGroupStorage) */
public class FlakyGroupStorage implements GroupStorage {

  private final InMemoryGroupStorage delegate = new InMemoryGroupStorage();
  private final AtomicBoolean down = new AtomicBoolean(false);

  public void goDown() {
    down.set(true);
  }

  public void recover() {
    down.set(false);
  }

  private void check(String operation) {
    if (down.get()) {
      throw new StorageUnavailableException("redis", operation);
    }
  }

  @Override
  public long store(AlertGroup group) {
    check("store");
    return delegate.store(group);
  }

  @Override
  public AlertGroup load(GroupKey key) {
    check("load");
    return delegate.load(key);
  }

  @Override
  public void delete(GroupKey key) {
    check("delete");
    delegate.delete(key);
  }

  @Override
  public List<GroupKey> listKeys() {
    check("listKeys");
    return delegate.listKeys();
  }

  @Override
  public int size() {
    check("size");
    return delegate.size();
  }

  @Override
  public List<AlertGroup> loadAll() {
    check("loadAll");
    return delegate.loadAll();
  }

  @Override
  public void storeAll(Collection<AlertGroup> groups) {
    check("storeAll");
    delegate.storeAll(groups);
  }

  @Override
  public List<GroupKey> listKeysUpdatedBefore(Instant cutoff) {
    check("listKeysUpdatedBefore");
    return delegate.listKeysUpdatedBefore(cutoff);
  }

  @Override
  public void ping() {
    check("ping");
  }

  @Override
  public String backendName() {
    return "redis";
  }
}
