package alert.grouping.infrastructure.storage.redis;

import static alert.grouping.infrastructure.support.GroupFixtures.firing;
import static alert.grouping.infrastructure.support.GroupFixtures.groupAt;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import alert.grouping.domain.model.group.AlertGroup;
import alert.grouping.domain.model.group.GroupKey;
import alert.grouping.domain.model.group.GroupState;
import alert.grouping.domain.model.timer.GroupTimer;
import alert.grouping.domain.model.timer.TimerType;
import alert.grouping.error.exception.GroupNotFoundException;
import alert.grouping.error.exception.VersionMismatchException;
import alert.grouping.infrastructure.config.GroupStorageProperties;
import alert.grouping.infrastructure.executor.DefaultLogicExecutor;
import alert.grouping.infrastructure.executor.LogicExecutor;
import alert.grouping.infrastructure.redis.RedissonClientProvider;
import alert.grouping.infrastructure.redis.script.GroupLuaScriptProvider;
import alert.grouping.infrastructure.storage.document.GroupDocumentCodec;
import alert.grouping.infrastructure.timer.RedisTimerStorage;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.redisson.Redisson;
import org.redisson.api.RedissonClient;
import org.redisson.client.codec.StringCodec;
import org.redisson.config.Config;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

/** 실제 Redis 컨테이너 대상 저장소 통합 테스트 (Docker 없으면 건너뜀) */
@Tag("integration")
@Testcontainers(disabledWithoutDocker = true)
@DisplayName("Redis 그룹/타이머 저장소 통합 테스트")
class RedisGroupStorageIntegrationTest {

  @Container
  static final GenericContainer<?> REDIS =
      new GenericContainer<>(DockerImageName.parse("redis:7-alpine")).withExposedPorts(6379);

  private static final Instant NOW = Instant.now();

  private static RedissonClient client;
  private static RedissonClientProvider provider;

  private final GroupStorageProperties properties = GroupStorageProperties.defaults();
  private final LogicExecutor executor = new DefaultLogicExecutor();
  private final GroupDocumentCodec codec = new GroupDocumentCodec(new ObjectMapper());
  private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
  private GroupLuaScriptProvider scripts;
  private RedisGroupStorage storage;

  @BeforeAll
  static void connect() {
    Config config = new Config();
    config
        .useSingleServer()
        .setAddress("redis://" + REDIS.getHost() + ":" + REDIS.getMappedPort(6379));
    client = Redisson.create(config);
    provider = RedissonClientProvider.of(client);
  }

  @AfterAll
  static void disconnect() {
    provider.destroy();
  }

  @BeforeEach
  void setUp() {
    client.getKeys().flushall();
    scripts = new GroupLuaScriptProvider(provider, executor);
    scripts.loadScripts();
    storage = new RedisGroupStorage(provider, scripts, codec, executor, properties, clock);
  }

  @Nested
  @DisplayName("CAS 저장")
  class CompareAndStore {

    @Test
    @DisplayName("신규 그룹은 버전 1 로 저장되고 인덱스에 등록된다")
    void createsWithVersionOne() {
      AlertGroup g = groupAt(NOW, "HighCPU", "f1");

      assertThat(storage.store(g)).isEqualTo(1);
      assertThat(storage.load(g.key()).version()).isEqualTo(1);
      assertThat(storage.listKeys()).containsExactly(g.key());
      assertThat(client.getScoredSortedSet(properties.indexKey(), StringCodec.INSTANCE).size())
          .isEqualTo(1);
    }

    @Test
    @DisplayName("오래된 버전은 거부되고 현재 버전이 보고된다")
    void staleVersionRejected() {
      AlertGroup g = groupAt(NOW, "HighCPU", "f1");
      storage.store(g);

      assertThatThrownBy(() -> storage.store(g))
          .isInstanceOfSatisfying(
              VersionMismatchException.class,
              e -> assertThat(e.getActualVersion()).isEqualTo(1));
    }

    @Test
    @DisplayName("Load-수정-Store 로 버전이 1씩 증가한다")
    void loadModifyStore() {
      AlertGroup g = groupAt(NOW, "HighCPU", "f1");
      storage.store(g);

      AlertGroup loaded = storage.load(g.key());
      loaded.upsert(firing("f2", "HighCPU"), NOW.plusSeconds(5));

      assertThat(storage.store(loaded)).isEqualTo(2);
      assertThat(storage.load(g.key()).size()).isEqualTo(2);
    }

    @Test
    @DisplayName("FIRING 그룹 TTL 은 ttl + grace 이내로 설정된다")
    void ttlApplied() {
      AlertGroup g = groupAt(NOW, "HighCPU", "f1");
      storage.store(g);

      long remainMs = client.getBucket(properties.keyPrefix() + g.key().value()).remainTimeToLive();
      assertThat(remainMs)
          .isPositive()
          .isLessThanOrEqualTo(properties.ttl().plus(properties.gracePeriod()).toMillis());
    }

    @Test
    @DisplayName("RESOLVED 그룹 TTL 은 더 짧은 resolved-ttl + grace 이내로 설정된다")
    void resolvedTtlApplied() {
      AlertGroup g = groupAt(NOW, "DiskFull", "d1");
      g.upsert(firing("d1", "DiskFull").resolve(NOW), NOW);
      assertThat(g.state()).isEqualTo(GroupState.RESOLVED);

      storage.store(g);

      long remainMs = client.getBucket(properties.keyPrefix() + g.key().value()).remainTimeToLive();
      assertThat(remainMs)
          .isPositive()
          .isLessThanOrEqualTo(properties.resolvedTtl().plus(properties.gracePeriod()).toMillis());
    }
  }

  @Test
  @DisplayName("인덱스 보존 기간은 주입된 Clock 기준이라 과거 도메인 시각의 그룹도 목록에 남는다")
  void indexRetentionFollowsInjectedClock() {
    Instant past = Instant.parse("2026-01-01T00:00:00Z");
    RedisGroupStorage pastStorage =
        new RedisGroupStorage(
            provider, scripts, codec, executor, properties, Clock.fixed(past, ZoneOffset.UTC));
    pastStorage.store(groupAt(past, "HighCPU", "f1"));

    assertThat(pastStorage.listKeys()).containsExactly(GroupKey.of("alertname=HighCPU"));
    assertThat(pastStorage.loadAll()).hasSize(1);
    pastStorage.destroy();
  }

  @Test
  @DisplayName("없는 그룹 Load 는 NotFound, Delete 는 멱등")
  void notFoundAndIdempotentDelete() {
    GroupKey key = GroupKey.of("alertname=Missing");

    assertThatThrownBy(() -> storage.load(key)).isInstanceOf(GroupNotFoundException.class);
    storage.delete(key);

    AlertGroup g = groupAt(NOW, "HighCPU", "f1");
    storage.store(g);
    storage.delete(g.key());
    assertThat(storage.size()).isZero();
  }

  @Test
  @DisplayName("loadAll 은 인덱스에만 남은 키를 건너뛰고 정리한다")
  void loadAllSkipsDanglingIndexEntries() {
    storage.storeAll(List.of(groupAt(NOW, "A", "a1"), groupAt(NOW, "B", "b1")));
    client.getBucket(properties.keyPrefix() + "alertname=A").delete();

    List<AlertGroup> loaded = storage.loadAll();

    assertThat(loaded).extracting(AlertGroup::key).containsExactly(GroupKey.of("alertname=B"));
    assertThat(storage.listKeys()).containsExactly(GroupKey.of("alertname=B"));
  }

  @Test
  @DisplayName("손상된 문서는 loadAll 에서 건너뛴다")
  void loadAllSkipsCorruptDocuments() {
    storage.store(groupAt(NOW, "A", "a1"));
    storage.store(groupAt(NOW, "B", "b1"));
    client
        .getBucket(properties.keyPrefix() + "alertname=A", StringCodec.INSTANCE)
        .set("{not json");

    assertThat(storage.loadAll()).extracting(AlertGroup::key).containsExactly(GroupKey.of("alertname=B"));
  }

  @Test
  @DisplayName("listKeysUpdatedBefore 는 인덱스 score 로 만료 후보를 찾는다")
  void expiryCandidates() {
    storage.store(groupAt(NOW.minus(Duration.ofHours(2)), "Old", "o1"));
    storage.store(groupAt(NOW, "Fresh", "n1"));

    assertThat(storage.listKeysUpdatedBefore(NOW.minus(Duration.ofHours(1))))
        .containsExactly(GroupKey.of("alertname=Old"));
  }

  @Test
  @DisplayName("ping 은 정상 Redis 에서 예외 없이 끝난다")
  void ping() {
    storage.ping();
  }

  @Nested
  @DisplayName("타이머 저장소")
  class Timers {

    @Test
    @DisplayName("저장/조회/삭제와 listAll 만료 순 정렬")
    void timerLifecycle() {
      RedisTimerStorage timers =
          new RedisTimerStorage(provider, codec, executor, properties, clock);
      Instant now = NOW;
      GroupTimer late =
          GroupTimer.start(
              GroupKey.of("late"), TimerType.INTERVAL, Duration.ofMinutes(5), now, now, "h:1");
      GroupTimer soon =
          GroupTimer.start(GroupKey.of("soon"), TimerType.WAIT, Duration.ofSeconds(30), now, now, "h:1");

      timers.save(late);
      timers.save(soon);

      assertThat(timers.load(GroupKey.of("soon"))).contains(soon);
      assertThat(timers.listAll()).containsExactly(soon, late);

      timers.delete(GroupKey.of("soon"));
      assertThat(timers.load(GroupKey.of("soon"))).isEmpty();
      assertThat(timers.listAll()).containsExactly(late);
    }
  }
}
