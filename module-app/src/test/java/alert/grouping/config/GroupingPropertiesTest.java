package alert.grouping.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
class GroupingPropertiesTest {

  @Test
  @DisplayName("키 최대 길이는 64..2048 로 보정된다")
  void clampsKeyLength() {
    assertThat(new GroupingProperties.Key(10, true, false).maxLength()).isEqualTo(64);
    assertThat(new GroupingProperties.Key(100_000, true, false).maxLength()).isEqualTo(2048);
    assertThat(new GroupingProperties.Key(512, true, false).maxLength()).isEqualTo(512);
  }

  @Test
  @DisplayName("0 이하의 대기 시간은 거부된다")
  void rejectsNonPositiveDurations() {
    assertThatThrownBy(
            () ->
                new GroupingProperties(
                    List.of("alertname"),
                    Duration.ZERO,
                    Duration.ofMinutes(5),
                    Duration.ofHours(24),
                    Duration.ofMinutes(5),
                    null))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("group-wait");
  }

  @Test
  @DisplayName("빈 group-by 는 전역 그룹을 뜻하며 허용된다")
  void emptyGroupByAllowed() {
    GroupingProperties properties =
        new GroupingProperties(
            List.of(),
            Duration.ofSeconds(30),
            Duration.ofMinutes(5),
            Duration.ofHours(24),
            Duration.ofMinutes(5),
            null);

    assertThat(properties.groupBy()).isEmpty();
    assertThat(properties.key()).isEqualTo(GroupingProperties.Key.defaults());
  }
}
