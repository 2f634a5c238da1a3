package alert.grouping.infrastructure.storage;

/** 활성 백엔드 전환 통지 (타이머 저장소 재동기화 등) */
@FunctionalInterface
public interface StorageSwitchListener {

  void onSwitch(StorageBackend from, StorageBackend to, String reason);
}
