package alert.grouping.domain.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import alert.grouping.domain.model.group.GroupKey;
import alert.grouping.error.exception.InvalidGroupingLabelException;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
@DisplayName("GroupKeyGenerator 테스트")
class GroupKeyGeneratorTest {

  private final GroupKeyGenerator generator = new GroupKeyGenerator();

  @Nested
  @DisplayName("기본 키 형식")
  class Format {

    @Test
    @DisplayName("그룹핑 라벨만 정렬되어 name=value 로 연결된다")
    void sortedNameValuePairs() {
      Map<String, String> labels = Map.of("alertname", "HighCPU", "instance", "a", "env", "prod");

      GroupKey key = generator.generate(labels, List.of("instance", "alertname"));

      assertThat(key.value()).isEqualTo("alertname=HighCPU,instance=a");
    }

    @Test
    @DisplayName("그룹핑에 없는 라벨은 키에 영향을 주지 않는다")
    void nonGroupingLabelsIgnored() {
      GroupKey a = generator.generate(Map.of("alertname", "HighCPU", "instance", "a"), List.of("alertname"));
      GroupKey b = generator.generate(Map.of("alertname", "HighCPU", "instance", "b"), List.of("alertname"));

      assertThat(a).isEqualTo(b).isEqualTo(GroupKey.of("alertname=HighCPU"));
    }

    @Test
    @DisplayName("누락된 그룹핑 라벨은 빈 문자열로 취급된다")
    void missingLabelIsEmptyString() {
      GroupKey key = generator.generate(Map.of("alertname", "Disk"), List.of("alertname", "cluster"));

      assertThat(key.value()).isEqualTo("alertname=Disk,cluster=");
    }

    @Test
    @DisplayName("그룹핑 라벨 목록이 비어있으면 전역 그룹")
    void emptyGroupingIsGlobal() {
      assertThat(generator.generate(Map.of("a", "b"), List.of())).isEqualTo(GroupKey.GLOBAL);
      assertThat(generator.generate(Map.of("a", "b"), null)).isEqualTo(GroupKey.GLOBAL);
    }

    @Test
    @DisplayName("'...' 은 모든 라벨로 그룹핑한다")
    void allLabelsMarker() {
      GroupKey key = generator.generate(Map.of("b", "2", "a", "1"), List.of("..."));

      assertThat(key.value()).isEqualTo("a=1,b=2");
    }
  }

  @Nested
  @DisplayName("값 인코딩과 축약")
  class EncodingAndHashing {

    @Test
    @DisplayName("예약 문자가 포함된 값은 퍼센트 인코딩된다")
    void reservedCharactersAreEncoded() {
      GroupKey key = generator.generate(Map.of("job", "a,b=c"), List.of("job"));

      assertThat(key.value()).isEqualTo("job=a%2Cb%3Dc");
    }

    @Test
    @DisplayName("구분자를 값에 넣어도 다른 라벨 집합과 키가 겹치지 않는다")
    void delimiterInjectionDoesNotCollide() {
      GroupKey injected = generator.generate(Map.of("a", "1,b=2"), List.of("a", "b"));
      GroupKey genuine = generator.generate(Map.of("a", "1", "b", "2"), List.of("a", "b"));

      assertThat(injected).isNotEqualTo(genuine);
    }

    @Test
    @DisplayName("비 ASCII 값은 UTF-8 바이트 단위로 인코딩된다")
    void nonAsciiEncoded() {
      GroupKey key = generator.generate(Map.of("team", "알림"), List.of("team"));

      assertThat(key.value()).startsWith("team=%EC%95%8C");
    }

    @Test
    @DisplayName("최대 길이를 넘는 키는 FNV-1a 해시로 축약된다")
    void longKeysAreHashed() {
      String longValue = "x".repeat(300);

      GroupKey key = generator.generate(Map.of("job", longValue), List.of("job"));

      assertThat(key.value()).matches("\\{hash:[0-9a-f]{16}}");
      assertThat(generator.generate(Map.of("job", longValue), List.of("job"))).isEqualTo(key);
    }

    @Test
    @DisplayName("최대 길이는 64..2048 로 보정된다")
    void maxLengthClamped() {
      assertThat(new GroupKeyGenerator(1, true, false).maxKeyLength()).isEqualTo(64);
      assertThat(new GroupKeyGenerator(100_000, true, false).maxKeyLength()).isEqualTo(2048);
    }
  }

  @Test
  @DisplayName("라벨 이름 검증이 켜져 있으면 잘못된 이름은 거부된다")
  void invalidLabelNameRejected() {
    GroupKeyGenerator strict = new GroupKeyGenerator(256, true, true);

    assertThatThrownBy(() -> strict.generate(Map.of("1bad", "v"), List.of("1bad")))
        .isInstanceOf(InvalidGroupingLabelException.class);
  }
}
