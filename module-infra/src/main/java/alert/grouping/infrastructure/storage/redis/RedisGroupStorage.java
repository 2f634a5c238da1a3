package alert.grouping.infrastructure.storage.redis;

import alert.grouping.core.port.out.GroupStorage;
import alert.grouping.domain.model.group.AlertGroup;
import alert.grouping.domain.model.group.GroupKey;
import alert.grouping.domain.model.group.GroupState;
import alert.grouping.error.exception.GroupNotFoundException;
import alert.grouping.error.exception.GroupSerializationException;
import alert.grouping.error.exception.VersionMismatchException;
import alert.grouping.infrastructure.config.GroupStorageProperties;
import alert.grouping.infrastructure.executor.LogicExecutor;
import alert.grouping.infrastructure.executor.TaskContext;
import alert.grouping.infrastructure.executor.strategy.ExceptionTranslator;
import alert.grouping.infrastructure.redis.RedissonClientProvider;
import alert.grouping.infrastructure.redis.script.GroupLuaScriptProvider;
import alert.grouping.infrastructure.storage.document.GroupDocumentCodec;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.BatchOptions;
import org.redisson.api.RBatch;
import org.redisson.api.RBucket;
import org.redisson.api.RScoredSortedSet;
import org.redisson.api.RScript;
import org.redisson.api.RedissonClient;
import org.redisson.client.codec.StringCodec;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

/**
 * Redis 기반 분산 그룹 저장소
 *
 * <h3>키 구조</h3>
 *
 * <ul>
 *   <li>{@code group:<key>} - 그룹 JSON 문서 (PX TTL)
 *   <li>{@code group:index} - ZSET, score = updatedAt(epoch ms), member = 그룹 키
 * </ul>
 *
 * <h3>원자성</h3>
 *
 * <ul>
 *   <li>store: Lua CAS 스크립트로 버전 비교 + 문서 SET + 인덱스 ZADD 를 한 번에 실행
 *   <li>delete: MULTI/EXEC(IN_MEMORY_ATOMIC) 배치로 DEL + ZREM
 *   <li>storeAll: 비원자 파이프라인 (버전 검사 없음)
 * </ul>
 *
 * <p>인덱스는 그룹 내용의 근거가 아닌 best-effort 메타데이터입니다. TTL 로 만료된 문서의 인덱스 항목은 조회 시 정리됩니다.
 */
@Slf4j
public class RedisGroupStorage implements GroupStorage, DisposableBean {

  public static final String BACKEND = "redis";

  private static final String COMPONENT = "RedisGroupStorage";

  private final RedissonClientProvider clientProvider;
  private final GroupLuaScriptProvider scriptProvider;
  private final GroupDocumentCodec codec;
  private final LogicExecutor executor;
  private final GroupStorageProperties properties;
  private final Clock clock;
  private final ExecutorService loadPool;
  private final ExceptionTranslator redisTranslator = ExceptionTranslator.forRedis(BACKEND);

  public RedisGroupStorage(
      RedissonClientProvider clientProvider,
      GroupLuaScriptProvider scriptProvider,
      GroupDocumentCodec codec,
      LogicExecutor executor,
      GroupStorageProperties properties,
      Clock clock) {
    this.clientProvider = clientProvider;
    this.scriptProvider = scriptProvider;
    this.codec = codec;
    this.executor = executor;
    this.properties = properties;
    this.clock = clock;
    this.loadPool =
        Executors.newFixedThreadPool(
            properties.loadAllConcurrency(), new CustomizableThreadFactory("group-load-"));
  }

  @Override
  public long store(AlertGroup group) {
    String key = group.key().value();
    long expected = group.version();
    String json = encode(group, expected + 1);

    List<Object> result =
        redis(
            "store",
            key,
            client ->
                scriptProvider.<List<Object>>executeCompareAndStore(
                    sha ->
                        client
                            .getScript(StringCodec.INSTANCE)
                            .<List<Object>>evalSha(
                                RScript.Mode.READ_WRITE,
                                sha,
                                RScript.ReturnType.MULTI,
                                List.of(docKey(key), properties.indexKey()),
                                String.valueOf(expected),
                                json,
                                String.valueOf(ttlFor(group).toMillis()),
                                String.valueOf(group.metadata().updatedAt().toEpochMilli()),
                                key)));

    long outcome = asLong(result.get(0));
    long version = asLong(result.get(1));
    if (outcome != 1L) {
      throw new VersionMismatchException(key, expected, version);
    }
    return version;
  }

  @Override
  public AlertGroup load(GroupKey key) {
    String json =
        redis(
            "load",
            key.value(),
            client -> client.<String>getBucket(docKey(key.value()), StringCodec.INSTANCE).get());
    if (json == null) {
      throw new GroupNotFoundException(key.value());
    }
    return decode(key.value(), json);
  }

  @Override
  public void delete(GroupKey key) {
    redis(
        "delete",
        key.value(),
        client -> {
          RBatch batch =
              client.createBatch(
                  BatchOptions.defaults()
                      .executionMode(BatchOptions.ExecutionMode.IN_MEMORY_ATOMIC));
          batch.getBucket(docKey(key.value()), StringCodec.INSTANCE).deleteAsync();
          batch
              .getScoredSortedSet(properties.indexKey(), StringCodec.INSTANCE)
              .removeAsync(key.value());
          batch.execute();
          return null;
        });
  }

  @Override
  public List<GroupKey> listKeys() {
    Collection<String> members =
        redis(
            "listKeys",
            "",
            client -> {
              RScoredSortedSet<String> index = index(client);
              pruneExpiredIndexEntries(index);
              return index.readAll();
            });
    return members.stream().map(GroupKey::of).toList();
  }

  @Override
  public int size() {
    return redis(
        "size",
        "",
        client -> {
          RScoredSortedSet<String> index = index(client);
          pruneExpiredIndexEntries(index);
          return index.size();
        });
  }

  /**
   * 인덱스의 모든 키를 bounded pool 에서 병렬 로드
   *
   * <p>개별 키 실패(NotFound, 손상 문서, 타임아웃)는 로그 후 건너뜁니다. 인덱스 조회 자체가 실패하면 예외를 전파합니다.
   */
  @Override
  public List<AlertGroup> loadAll() {
    List<GroupKey> keys = listKeys();
    List<CompletableFuture<AlertGroup>> futures = new ArrayList<>(keys.size());
    for (GroupKey key : keys) {
      futures.add(CompletableFuture.supplyAsync(() -> loadOrSkip(key), loadPool));
    }

    boolean completed =
        executor.executeOrCatch(
            () -> {
              CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
                  .get(properties.loadAllTimeout().toMillis(), TimeUnit.MILLISECONDS);
              return true;
            },
            e -> false,
            TaskContext.of(COMPONENT, "loadAll", keys.size() + " keys"));
    if (!completed) {
      log.warn(
          "[RedisGroupStorage] loadAll 마감 시간 초과 - 완료된 항목만 반환 (keys={}, timeout={})",
          keys.size(),
          properties.loadAllTimeout());
    }

    List<AlertGroup> groups = new ArrayList<>(keys.size());
    for (CompletableFuture<AlertGroup> future : futures) {
      if (!future.isDone()) {
        future.cancel(true);
        continue;
      }
      AlertGroup group = future.getNow(null);
      if (group != null) {
        groups.add(group);
      }
    }
    return groups;
  }

  private AlertGroup loadOrSkip(GroupKey key) {
    return executor.executeWithFallback(
        () -> load(key),
        e -> {
          if (e instanceof GroupNotFoundException) {
            log.debug("[RedisGroupStorage] 인덱스에만 남은 키 정리 - key={}", key);
            removeFromIndex(key);
          } else if (e instanceof GroupSerializationException) {
            log.error("[RedisGroupStorage] 손상된 그룹 문서 건너뜀 - key={}", key, e);
          } else {
            log.warn("[RedisGroupStorage] 그룹 로드 실패, 건너뜀 - key={}, cause={}", key, e.getMessage());
          }
          return null;
        },
        TaskContext.of(COMPONENT, "loadOne", key.value()));
  }

  private void removeFromIndex(GroupKey key) {
    executor.executeOrDefault(
        () -> index(clientProvider.get()).remove(key.value()),
        false,
        TaskContext.of(COMPONENT, "pruneIndex", key.value()));
  }

  /** 버전 검사 없는 배치 쓰기. 직렬화에 실패한 그룹만 건너뜁니다. */
  @Override
  public void storeAll(Collection<AlertGroup> groups) {
    if (groups.isEmpty()) {
      return;
    }
    redis(
        "storeAll",
        groups.size() + " groups",
        client -> {
          RBatch batch = client.createBatch(BatchOptions.defaults());
          int queued = 0;
          for (AlertGroup group : groups) {
            String json = encodeOrSkip(group);
            if (json == null) {
              continue;
            }
            String key = group.key().value();
            batch
                .<String>getBucket(docKey(key), StringCodec.INSTANCE)
                .setAsync(json, ttlFor(group).toMillis(), TimeUnit.MILLISECONDS);
            batch
                .<String>getScoredSortedSet(properties.indexKey(), StringCodec.INSTANCE)
                .addAsync(group.metadata().updatedAt().toEpochMilli(), key);
            queued++;
          }
          if (queued > 0) {
            batch.execute();
          }
          return queued;
        });
  }

  @Override
  public List<GroupKey> listKeysUpdatedBefore(Instant cutoff) {
    Collection<String> members =
        redis(
            "listKeysUpdatedBefore",
            cutoff.toString(),
            client ->
                index(client)
                    .valueRange(Double.NEGATIVE_INFINITY, true, cutoff.toEpochMilli(), false));
    return members.stream().map(GroupKey::of).toList();
  }

  /** 헬스체크용 왕복 명령. health-check-timeout 안에 응답이 없으면 실패입니다. */
  @Override
  public void ping() {
    redis(
        "ping",
        "",
        client -> {
          RBucket<String> bucket = client.getBucket(properties.healthKey(), StringCodec.INSTANCE);
          return bucket
              .isExistsAsync()
              .toCompletableFuture()
              .get(properties.healthCheckTimeout().toMillis(), TimeUnit.MILLISECONDS);
        });
  }

  @Override
  public String backendName() {
    return BACKEND;
  }

  /** RESOLVED 그룹은 짧은 TTL, 항상 grace period 를 더합니다. */
  Duration ttlFor(AlertGroup group) {
    Duration base =
        group.state() == GroupState.RESOLVED ? properties.resolvedTtl() : properties.ttl();
    return base.plus(properties.gracePeriod());
  }

  /** 보존 기간은 그룹 updatedAt 과 같은 시계(주입된 Clock) 기준입니다. */
  private void pruneExpiredIndexEntries(RScoredSortedSet<String> index) {
    long horizon =
        clock.instant().minus(properties.ttl()).minus(properties.gracePeriod()).toEpochMilli();
    index.removeRangeByScore(Double.NEGATIVE_INFINITY, true, horizon, false);
  }

  private RScoredSortedSet<String> index(RedissonClient client) {
    return client.getScoredSortedSet(properties.indexKey(), StringCodec.INSTANCE);
  }

  private String docKey(String key) {
    return properties.keyPrefix() + key;
  }

  private <T> T redis(String operation, String key, RedisCall<T> call) {
    return executor.executeWithTranslation(
        () -> call.apply(clientProvider.get()),
        redisTranslator,
        TaskContext.of(COMPONENT, operation, key));
  }

  private String encode(AlertGroup group, long version) {
    return executor.executeWithTranslation(
        () -> codec.encodeGroup(group, version),
        ExceptionTranslator.forGroupJson(),
        TaskContext.of(COMPONENT, "encode", group.key().value()));
  }

  private String encodeOrSkip(AlertGroup group) {
    return executor.executeOrCatch(
        () -> encode(group, group.version()),
        e -> {
          log.error("[RedisGroupStorage] storeAll 직렬화 실패, 건너뜀 - key={}", group.key(), e);
          return null;
        },
        TaskContext.of(COMPONENT, "storeAllEncode", group.key().value()));
  }

  private AlertGroup decode(String key, String json) {
    return executor.executeWithTranslation(
        () -> codec.decodeGroup(json),
        ExceptionTranslator.forGroupJson(),
        TaskContext.of(COMPONENT, "decode", key));
  }

  private static long asLong(Object value) {
    if (value instanceof Number number) {
      return number.longValue();
    }
    return Long.parseLong(String.valueOf(value));
  }

  @Override
  public void destroy() {
    loadPool.shutdownNow();
  }

  /** RedissonClient 를 받는 Redis 호출 (Checked Exception 허용) */
  @FunctionalInterface
  interface RedisCall<T> {
    T apply(RedissonClient client) throws Exception;
  }
}
