package alert.grouping;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

import alert.grouping.domain.model.alert.Alert;
import alert.grouping.domain.model.group.GroupKey;
import alert.grouping.domain.model.timer.TimerType;
import alert.grouping.infrastructure.redis.RedissonClientProvider;
import alert.grouping.infrastructure.storage.StorageBackend;
import alert.grouping.infrastructure.storage.StorageCoordinator;
import alert.grouping.service.grouping.AlertGroupManager;
import alert.grouping.service.grouping.FingerprintIndex;
import alert.grouping.support.RecordingNotifier;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.redisson.client.codec.StringCodec;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

/** 실제 Redis 를 공유 저장소로 사용하는 전체 흐름 (Docker 없으면 건너뜀) */
@Tag("integration")
@Testcontainers(disabledWithoutDocker = true)
@SpringBootTest(
    properties = {
      "grouping.group-wait=300ms",
      "grouping.group-interval=1h",
      "scheduler.grouping.enabled=false"
    })
@Import(GroupingApplicationRedisIntegrationTest.NotifierConfig.class)
@DisplayName("Redis 공유 저장소 통합 테스트")
class GroupingApplicationRedisIntegrationTest {

  @Container
  static final GenericContainer<?> REDIS =
      new GenericContainer<>(DockerImageName.parse("redis:7-alpine")).withExposedPorts(6379);

  @DynamicPropertySource
  static void redisProperties(DynamicPropertyRegistry registry) {
    registry.add("spring.data.redis.host", REDIS::getHost);
    registry.add("spring.data.redis.port", () -> REDIS.getMappedPort(6379));
  }

  @Autowired private AlertGroupManager groupManager;
  @Autowired private StorageCoordinator coordinator;
  @Autowired private RedissonClientProvider clientProvider;
  @Autowired private RecordingNotifier notifier;

  @Test
  @DisplayName("그룹이 Redis 에 저장되고 다른 인스턴스의 복원 경로로 다시 읽힌다")
  void groupsAreSharedThroughRedis() {
    assertThat(coordinator.currentBackend()).isEqualTo(StorageBackend.PRIMARY);

    groupManager.addAlertToGroup(
        Alert.firing(Map.of("alertname", "DiskFull", "instance", "a"), Instant.now()));
    groupManager.addAlertToGroup(
        Alert.firing(Map.of("alertname", "DiskFull", "instance", "b"), Instant.now()));

    String json =
        clientProvider
            .get()
            .<String>getBucket("group:alertname=DiskFull", StringCodec.INSTANCE)
            .get();
    assertThat(json).contains("\"kind\":\"alert-group\"");

    FingerprintIndex index = new FingerprintIndex();
    index.rebuild(coordinator.loadAll());
    assertThat(index.size()).isEqualTo(2);

    await()
        .atMost(Duration.ofSeconds(5))
        .until(
            () ->
                notifier.received().stream()
                    .anyMatch(
                        n ->
                            n.trigger() == TimerType.WAIT
                                && n.group().key().equals(GroupKey.of("alertname=DiskFull"))));
  }

  @TestConfiguration
  static class NotifierConfig {

    @Bean
    RecordingNotifier recordingNotifier() {
      return new RecordingNotifier();
    }
  }
}
