package alert.grouping.infrastructure.executor.strategy;

import alert.grouping.error.exception.GroupSerializationException;
import alert.grouping.error.exception.InternalSystemException;
import alert.grouping.error.exception.StorageUnavailableException;
import alert.grouping.error.exception.TimerStorageException;
import alert.grouping.error.exception.base.BaseException;
import alert.grouping.infrastructure.executor.TaskContext;
import com.fasterxml.jackson.core.JsonProcessingException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;
import org.redisson.client.RedisException;

/** 기술적 예외를 도메인 예외로 변환하는 전략 */
@FunctionalInterface
public interface ExceptionTranslator {

  RuntimeException translate(Throwable e, TaskContext context);

  /**
   * Error guard + async unwrap + BaseException pass-through 를 선행 적용하는 Decorator
   *
   * @param inner unwrap된 예외를 받아 변환하는 내부 translator
   */
  static ExceptionTranslator withErrorGuardAndUnwrap(ExceptionTranslator inner) {
    return (e, context) -> {
      if (e instanceof Error err) {
        throw err;
      }
      Throwable unwrapped = unwrapAsync(e);
      if (unwrapped instanceof BaseException be) {
        return be;
      }
      return inner.translate(unwrapped, context);
    };
  }

  /**
   * Redis 통신 예외 변환기
   *
   * <p>RedisException(연결/타임아웃 포함), 응답 대기 타임아웃, 인터럽트는 모두 {@link StorageUnavailableException} 으로
   * 분류되어 StorageCoordinator 의 failover 대상이 됩니다.
   *
   * @param backend 백엔드 이름 (메트릭/로그용)
   */
  static ExceptionTranslator forRedis(String backend) {
    return withErrorGuardAndUnwrap(
        (unwrapped, context) -> {
          if (unwrapped instanceof InterruptedException) {
            Thread.currentThread().interrupt();
          }
          if (unwrapped instanceof RedisException
              || unwrapped instanceof TimeoutException
              || unwrapped instanceof InterruptedException) {
            return new StorageUnavailableException(backend, context.operation(), unwrapped);
          }
          return new InternalSystemException(context.toTaskName(), unwrapped);
        });
  }

  /** 그룹 문서 JSON 변환기. dynamicValue 에 그룹 키가 들어있어야 합니다. */
  static ExceptionTranslator forGroupJson() {
    return withErrorGuardAndUnwrap(
        (unwrapped, context) -> {
          if (unwrapped instanceof JsonProcessingException
              || unwrapped instanceof IllegalArgumentException) {
            return new GroupSerializationException(context.dynamicValue(), unwrapped);
          }
          return new InternalSystemException("json-processing:" + context.operation(), unwrapped);
        });
  }

  /** 타이머 문서 JSON 변환기 */
  static ExceptionTranslator forTimerJson() {
    return withErrorGuardAndUnwrap(
        (unwrapped, context) ->
            new TimerStorageException(context.operation(), context.dynamicValue(), unwrapped));
  }

  /** Lock 예외 변환기 */
  static ExceptionTranslator forLock() {
    return withErrorGuardAndUnwrap(
        (unwrapped, context) -> {
          if (unwrapped instanceof InterruptedException) {
            Thread.currentThread().interrupt();
            return new StorageUnavailableException("lock", context.operation(), unwrapped);
          }
          if (unwrapped instanceof RedisException) {
            return new StorageUnavailableException("lock", context.operation(), unwrapped);
          }
          return new InternalSystemException("lock-operation:" + context.toTaskName(), unwrapped);
        });
  }

  static ExceptionTranslator defaultTranslator() {
    return withErrorGuardAndUnwrap(
        (unwrapped, context) ->
            new InternalSystemException("default-task:" + context.toTaskName(), unwrapped));
  }

  private static Throwable unwrapAsync(Throwable e) {
    Throwable current = e;
    while ((current instanceof CompletionException || current instanceof ExecutionException)
        && current.getCause() != null) {
      current = current.getCause();
    }
    return current;
  }
}
