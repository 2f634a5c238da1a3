package alert.grouping.infrastructure.storage;

/** StorageCoordinator 가 현재 사용 중인 백엔드 */
public enum StorageBackend {
  PRIMARY,
  FALLBACK
}
