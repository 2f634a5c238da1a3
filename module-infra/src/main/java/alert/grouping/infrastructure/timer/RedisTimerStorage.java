package alert.grouping.infrastructure.timer;

import alert.grouping.core.port.out.TimerStorage;
import alert.grouping.domain.model.group.GroupKey;
import alert.grouping.domain.model.timer.GroupTimer;
import alert.grouping.infrastructure.config.GroupStorageProperties;
import alert.grouping.infrastructure.executor.LogicExecutor;
import alert.grouping.infrastructure.executor.TaskContext;
import alert.grouping.infrastructure.executor.strategy.ExceptionTranslator;
import alert.grouping.infrastructure.redis.RedissonClientProvider;
import alert.grouping.infrastructure.storage.document.GroupDocumentCodec;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.BatchOptions;
import org.redisson.api.RBatch;
import org.redisson.api.RScoredSortedSet;
import org.redisson.client.codec.StringCodec;

/**
 * Redis 기반 타이머 저장소
 *
 * <ul>
 *   <li>{@code timer:<key>} - 타이머 JSON (PX = 남은 시간 + grace)
 *   <li>{@code timers:index} - ZSET, score = expiresAt(epoch ms)
 * </ul>
 *
 * <p>save/delete 는 MULTI/EXEC 배치로 문서와 인덱스를 함께 갱신합니다. listAll 은 MGET 으로 한 번에 읽고, 문서가 사라진 인덱스 항목은
 * 제거합니다.
 */
@Slf4j
@RequiredArgsConstructor
public class RedisTimerStorage implements TimerStorage {

  public static final String BACKEND = "redis";

  private static final String COMPONENT = "RedisTimerStorage";

  private final RedissonClientProvider clientProvider;
  private final GroupDocumentCodec codec;
  private final LogicExecutor executor;
  private final GroupStorageProperties properties;
  private final Clock clock;
  private final ExceptionTranslator redisTranslator = ExceptionTranslator.forRedis(BACKEND);

  @Override
  public void save(GroupTimer timer) {
    String key = timer.groupKey().value();
    String json =
        executor.executeWithTranslation(
            () -> codec.encodeTimer(timer),
            ExceptionTranslator.forTimerJson(),
            TaskContext.of(COMPONENT, "encode", key));
    long ttlMillis = timer.remaining(clock.instant()).plus(properties.gracePeriod()).toMillis();

    executor.executeWithTranslation(
        () -> {
          RBatch batch =
              clientProvider
                  .get()
                  .createBatch(
                      BatchOptions.defaults()
                          .executionMode(BatchOptions.ExecutionMode.IN_MEMORY_ATOMIC));
          batch
              .<String>getBucket(timerKey(key), StringCodec.INSTANCE)
              .setAsync(json, Math.max(1L, ttlMillis), TimeUnit.MILLISECONDS);
          batch
              .<String>getScoredSortedSet(properties.timerIndexKey(), StringCodec.INSTANCE)
              .addAsync(timer.expiresAt().toEpochMilli(), key);
          batch.execute();
          return null;
        },
        redisTranslator,
        TaskContext.of(COMPONENT, "save", key));
  }

  @Override
  public Optional<GroupTimer> load(GroupKey key) {
    String json =
        executor.executeWithTranslation(
            () ->
                clientProvider
                    .get()
                    .<String>getBucket(timerKey(key.value()), StringCodec.INSTANCE)
                    .get(),
            redisTranslator,
            TaskContext.of(COMPONENT, "load", key.value()));
    if (json == null) {
      return Optional.empty();
    }
    return Optional.of(decode(key.value(), json));
  }

  @Override
  public void delete(GroupKey key) {
    executor.executeWithTranslation(
        () -> {
          RBatch batch =
              clientProvider
                  .get()
                  .createBatch(
                      BatchOptions.defaults()
                          .executionMode(BatchOptions.ExecutionMode.IN_MEMORY_ATOMIC));
          batch.getBucket(timerKey(key.value()), StringCodec.INSTANCE).deleteAsync();
          batch
              .getScoredSortedSet(properties.timerIndexKey(), StringCodec.INSTANCE)
              .removeAsync(key.value());
          batch.execute();
          return null;
        },
        redisTranslator,
        TaskContext.of(COMPONENT, "delete", key.value()));
  }

  /** 만료 시각 순. 손상된 문서는 로그 후 건너뜁니다. */
  @Override
  public List<GroupTimer> listAll() {
    return executor.executeWithTranslation(
        () -> {
          RScoredSortedSet<String> index =
              clientProvider
                  .get()
                  .getScoredSortedSet(properties.timerIndexKey(), StringCodec.INSTANCE);
          Collection<String> members = index.readAll();
          if (members.isEmpty()) {
            return List.of();
          }
          String[] keys = members.stream().map(this::timerKey).toArray(String[]::new);
          Map<String, String> documents =
              clientProvider.get().getBuckets(StringCodec.INSTANCE).get(keys);

          List<GroupTimer> timers = new ArrayList<>(members.size());
          List<String> stale = new ArrayList<>();
          for (String member : members) {
            String json = documents.get(timerKey(member));
            if (json == null) {
              stale.add(member);
              continue;
            }
            GroupTimer timer = decodeOrSkip(member, json);
            if (timer != null) {
              timers.add(timer);
            }
          }
          if (!stale.isEmpty()) {
            index.removeAll(stale);
            log.debug("[RedisTimerStorage] 문서 없는 인덱스 항목 정리 - count={}", stale.size());
          }
          return timers;
        },
        redisTranslator,
        TaskContext.of(COMPONENT, "listAll"));
  }

  private GroupTimer decode(String key, String json) {
    return executor.executeWithTranslation(
        () -> codec.decodeTimer(json),
        ExceptionTranslator.forTimerJson(),
        TaskContext.of(COMPONENT, "decode", key));
  }

  private GroupTimer decodeOrSkip(String key, String json) {
    return executor.executeOrCatch(
        () -> decode(key, json),
        e -> {
          log.error("[RedisTimerStorage] 손상된 타이머 문서 건너뜀 - key={}", key, e);
          return null;
        },
        TaskContext.of(COMPONENT, "decodeOrSkip", key));
  }

  private String timerKey(String key) {
    return properties.timerPrefix() + key;
  }
}
