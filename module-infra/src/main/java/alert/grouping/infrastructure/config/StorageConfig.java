package alert.grouping.infrastructure.config;

import alert.grouping.core.port.out.TimerStorage;
import alert.grouping.error.exception.StorageInitializationException;
import alert.grouping.infrastructure.executor.LogicExecutor;
import alert.grouping.infrastructure.lock.GroupLockStrategy;
import alert.grouping.infrastructure.lock.LocalGroupLockStrategy;
import alert.grouping.infrastructure.lock.RedisGroupLockStrategy;
import alert.grouping.infrastructure.lock.ResilientGroupLockStrategy;
import alert.grouping.infrastructure.metrics.GroupingMetrics;
import alert.grouping.infrastructure.redis.RedissonClientProvider;
import alert.grouping.infrastructure.redis.script.GroupLuaScriptProvider;
import alert.grouping.infrastructure.storage.StorageCoordinator;
import alert.grouping.infrastructure.storage.document.GroupDocumentCodec;
import alert.grouping.infrastructure.storage.memory.InMemoryGroupStorage;
import alert.grouping.infrastructure.storage.redis.RedisGroupStorage;
import alert.grouping.infrastructure.timer.FailoverTimerStorage;
import alert.grouping.infrastructure.timer.InMemoryTimerStorage;
import alert.grouping.infrastructure.timer.RedisTimerStorage;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

/**
 * 저장소 구성
 *
 * <p>그룹/타이머/락 모두 "Redis 우선 + 프로세스 내 fallback" 조합이며, 활성 백엔드는 {@link StorageCoordinator} 하나가 결정합니다.
 * primary 가 응답하지 않고 fallback 도 비활성화되어 있으면 사용할 수 있는 저장소가 없으므로 기동을 중단합니다.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(GroupStorageProperties.class)
public class StorageConfig {

  @Bean
  public GroupDocumentCodec groupDocumentCodec(ObjectMapper objectMapper) {
    return new GroupDocumentCodec(objectMapper);
  }

  @Bean
  public GroupingMetrics groupingMetrics(MeterRegistry meterRegistry) {
    return new GroupingMetrics(meterRegistry);
  }

  @Bean(initMethod = "loadScripts")
  public GroupLuaScriptProvider groupLuaScriptProvider(
      RedissonClientProvider clientProvider, LogicExecutor executor) {
    return new GroupLuaScriptProvider(clientProvider, executor);
  }

  @Bean
  public RedisGroupStorage redisGroupStorage(
      RedissonClientProvider clientProvider,
      GroupLuaScriptProvider scriptProvider,
      GroupDocumentCodec codec,
      LogicExecutor executor,
      GroupStorageProperties properties,
      Clock clock) {
    return new RedisGroupStorage(
        clientProvider, scriptProvider, codec, executor, properties, clock);
  }

  @Bean
  public InMemoryGroupStorage inMemoryGroupStorage() {
    return new InMemoryGroupStorage();
  }

  @Bean
  @Primary
  public StorageCoordinator storageCoordinator(
      RedisGroupStorage redisGroupStorage,
      InMemoryGroupStorage inMemoryGroupStorage,
      LogicExecutor executor,
      GroupingMetrics metrics,
      GroupStorageProperties properties) {
    StorageCoordinator coordinator =
        new StorageCoordinator(
            redisGroupStorage,
            inMemoryGroupStorage,
            executor,
            metrics,
            properties.fallbackEnabled(),
            properties.reconcileOnRecovery());

    boolean primaryHealthy = coordinator.checkHealth();
    if (!primaryHealthy && !properties.fallbackEnabled()) {
      throw new StorageInitializationException("redis (fallback disabled)");
    }
    log.info(
        "[StorageConfig] 그룹 저장소 초기화 완료 - active={}, fallbackEnabled={}",
        coordinator.currentBackend(),
        properties.fallbackEnabled());
    return coordinator;
  }

  @Bean
  public RedisTimerStorage redisTimerStorage(
      RedissonClientProvider clientProvider,
      GroupDocumentCodec codec,
      LogicExecutor executor,
      GroupStorageProperties properties,
      Clock clock) {
    return new RedisTimerStorage(clientProvider, codec, executor, properties, clock);
  }

  @Bean
  public InMemoryTimerStorage inMemoryTimerStorage() {
    return new InMemoryTimerStorage();
  }

  @Bean
  @Primary
  public TimerStorage failoverTimerStorage(
      RedisTimerStorage redisTimerStorage,
      InMemoryTimerStorage inMemoryTimerStorage,
      StorageCoordinator coordinator,
      LogicExecutor executor) {
    return new FailoverTimerStorage(redisTimerStorage, inMemoryTimerStorage, coordinator, executor);
  }

  @Bean
  public RedisGroupLockStrategy redisGroupLockStrategy(
      RedissonClientProvider clientProvider, LogicExecutor executor) {
    return new RedisGroupLockStrategy(clientProvider, executor);
  }

  @Bean
  public LocalGroupLockStrategy localGroupLockStrategy(LogicExecutor executor) {
    return new LocalGroupLockStrategy(executor);
  }

  @Bean
  @Primary
  public GroupLockStrategy resilientGroupLockStrategy(
      RedisGroupLockStrategy redisGroupLockStrategy,
      LocalGroupLockStrategy localGroupLockStrategy,
      StorageCoordinator coordinator) {
    return new ResilientGroupLockStrategy(
        redisGroupLockStrategy, localGroupLockStrategy, coordinator);
  }
}
