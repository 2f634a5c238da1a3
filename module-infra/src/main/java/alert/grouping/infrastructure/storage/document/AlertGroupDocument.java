package alert.grouping.infrastructure.storage.document;

import alert.grouping.domain.model.alert.Alert;
import alert.grouping.domain.model.group.AlertGroup;
import alert.grouping.domain.model.group.GroupKey;
import alert.grouping.domain.model.group.GroupMetadata;
import java.util.List;

/**
 * 저장소에 기록되는 자기 기술(self-describing) 그룹 문서
 *
 * <p>Redis Lua CAS 스크립트가 {@code metadata.version} 을 직접 읽으므로 필드 이름을 바꾸면 스크립트도 함께 바꿔야 합니다.
 */
public record AlertGroupDocument(
    String kind, int schemaVersion, String key, List<Alert> alerts, GroupMetadata metadata) {

  public static final String KIND = "alert-group";
  public static final int SCHEMA_VERSION = 1;

  public static AlertGroupDocument from(AlertGroup group, long version) {
    return new AlertGroupDocument(
        KIND,
        SCHEMA_VERSION,
        group.key().value(),
        group.alerts(),
        group.metadata().withVersion(version));
  }

  public AlertGroup toDomain() {
    if (!KIND.equals(kind)) {
      throw new IllegalArgumentException("unexpected document kind: " + kind);
    }
    if (schemaVersion > SCHEMA_VERSION) {
      throw new IllegalArgumentException("unsupported schema version: " + schemaVersion);
    }
    if (metadata == null) {
      throw new IllegalArgumentException("metadata is missing");
    }
    return AlertGroup.restore(GroupKey.of(key), alerts == null ? List.of() : alerts, metadata);
  }
}
