package alert.grouping.infrastructure.storage.document;

import alert.grouping.domain.model.group.AlertGroup;
import alert.grouping.domain.model.timer.GroupTimer;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * 그룹/타이머 문서 JSON 코덱
 *
 * <p>주입받은 ObjectMapper 를 복사해 시간 타입을 ISO-8601 문자열로 고정합니다. 원본 매퍼 설정은 변경하지 않습니다.
 */
public class GroupDocumentCodec {

  private final ObjectMapper objectMapper;

  public GroupDocumentCodec(ObjectMapper objectMapper) {
    this.objectMapper =
        objectMapper
            .copy()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
  }

  /** version 필드를 지정한 값으로 기록 */
  public String encodeGroup(AlertGroup group, long version) throws JsonProcessingException {
    return objectMapper.writeValueAsString(AlertGroupDocument.from(group, version));
  }

  public AlertGroup decodeGroup(String json) throws JsonProcessingException {
    return objectMapper.readValue(json, AlertGroupDocument.class).toDomain();
  }

  public String encodeTimer(GroupTimer timer) throws JsonProcessingException {
    return objectMapper.writeValueAsString(GroupTimerDocument.from(timer));
  }

  public GroupTimer decodeTimer(String json) throws JsonProcessingException {
    return objectMapper.readValue(json, GroupTimerDocument.class).toDomain();
  }
}
