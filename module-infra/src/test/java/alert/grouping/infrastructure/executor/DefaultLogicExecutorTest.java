package alert.grouping.infrastructure.executor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import alert.grouping.error.exception.GroupNotFoundException;
import alert.grouping.error.exception.InternalSystemException;
import alert.grouping.error.exception.StorageUnavailableException;
import alert.grouping.infrastructure.executor.strategy.ExceptionTranslator;
import java.io.IOException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.redisson.client.RedisTimeoutException;

@Tag("unit")
@DisplayName("DefaultLogicExecutor 테스트")
class DefaultLogicExecutorTest {

  private final LogicExecutor executor = new DefaultLogicExecutor();
  private final TaskContext context = TaskContext.of("Test", "op", "key");

  @Nested
  @DisplayName("execute")
  class Execute {

    @Test
    @DisplayName("도메인 예외는 번역 없이 그대로 전파된다")
    void baseExceptionPassesThrough() {
      assertThatThrownBy(
              () ->
                  executor.execute(
                      () -> {
                        throw new GroupNotFoundException("k");
                      },
                      context))
          .isInstanceOf(GroupNotFoundException.class);
    }

    @Test
    @DisplayName("Checked 예외는 InternalSystemException 으로 번역된다")
    void checkedExceptionTranslated() {
      assertThatThrownBy(
              () ->
                  executor.execute(
                      () -> {
                        throw new IOException("disk");
                      },
                      context))
          .isInstanceOf(InternalSystemException.class)
          .hasCauseInstanceOf(IOException.class);
    }

    @Test
    @DisplayName("Error 는 번역하지 않는다")
    void errorIsRethrown() {
      assertThatThrownBy(
              () ->
                  executor.execute(
                      () -> {
                        throw new StackOverflowError();
                      },
                      context))
          .isInstanceOf(StackOverflowError.class);
    }
  }

  @Test
  @DisplayName("forRedis 번역기는 비동기 래핑을 벗겨 Redis 예외를 StorageUnavailable 로 분류한다")
  void redisTranslatorUnwrapsAsync() {
    assertThatThrownBy(
            () ->
                executor.executeWithTranslation(
                    () -> {
                      throw new CompletionException(new RedisTimeoutException("timeout"));
                    },
                    ExceptionTranslator.forRedis("redis"),
                    context))
        .isInstanceOf(StorageUnavailableException.class)
        .hasCauseInstanceOf(RedisTimeoutException.class);
  }

  @Test
  @DisplayName("executeOrDefault 는 실패 시 기본값을 반환한다")
  void executeOrDefault() {
    String result =
        executor.executeOrDefault(
            () -> {
              throw new IllegalStateException("boom");
            },
            "fallback",
            context);

    assertThat(result).isEqualTo("fallback");
  }

  @Test
  @DisplayName("executeWithFinally 는 실패해도 정리 작업을 실행한다")
  void finallyRunsOnFailure() {
    AtomicBoolean cleaned = new AtomicBoolean(false);

    assertThatThrownBy(
            () ->
                executor.executeWithFinally(
                    () -> {
                      throw new GroupNotFoundException("k");
                    },
                    () -> cleaned.set(true),
                    context))
        .isInstanceOf(GroupNotFoundException.class);
    assertThat(cleaned).isTrue();
  }

  @Test
  @DisplayName("executeWithFallback 은 원본 예외를 fallback 에 넘긴다")
  void fallbackReceivesOriginal() {
    Throwable[] seen = new Throwable[1];

    String result =
        executor.executeWithFallback(
            () -> {
              throw new IOException("raw");
            },
            e -> {
              seen[0] = e;
              return "recovered";
            },
            context);

    assertThat(result).isEqualTo("recovered");
    assertThat(seen[0]).isInstanceOf(IOException.class);
  }
}
