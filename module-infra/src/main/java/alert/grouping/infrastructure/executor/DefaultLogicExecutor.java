package alert.grouping.infrastructure.executor;

import alert.grouping.common.function.ThrowingSupplier;
import alert.grouping.error.exception.base.ClientBaseException;
import alert.grouping.infrastructure.executor.function.ThrowingRunnable;
import alert.grouping.infrastructure.executor.strategy.ExceptionTranslator;
import java.util.Objects;
import java.util.function.Function;
import lombok.extern.slf4j.Slf4j;

/**
 * LogicExecutor 기본 구현체
 *
 * <ul>
 *   <li>Error 즉시 rethrow
 *   <li>ClientBaseException (NotFound, 버전 충돌) 은 DEBUG, 그 외 실패는 WARN 으로 기록
 *   <li>정리 작업 실패는 primary 예외를 덮지 않고 suppressed 로 합류
 * </ul>
 */
@Slf4j
public class DefaultLogicExecutor implements LogicExecutor {

  private static final String UNEXPECTED_TRANSLATOR_FAILURE =
      "Translator failed with unexpected Throwable";

  private final ExceptionTranslator translator;

  public DefaultLogicExecutor() {
    this(ExceptionTranslator.defaultTranslator());
  }

  public DefaultLogicExecutor(ExceptionTranslator translator) {
    this.translator = Objects.requireNonNull(translator, "translator");
  }

  @Override
  public <T> T execute(ThrowingSupplier<T> task, TaskContext context) {
    return executeWithTranslation(task, translator, context);
  }

  @Override
  public <T> T executeOrCatch(
      ThrowingSupplier<T> task, Function<Throwable, T> recovery, TaskContext context) {
    Objects.requireNonNull(task, "task");
    Objects.requireNonNull(recovery, "recovery");
    Objects.requireNonNull(context, "context");

    try {
      return task.get();
    } catch (Error e) {
      throw e;
    } catch (Throwable t) {
      RuntimeException translated = translateSafe(translator, t, context);
      logFailure(translated, context);
      return recovery.apply(translated);
    }
  }

  @Override
  public <T> T executeOrDefault(ThrowingSupplier<T> task, T defaultValue, TaskContext context) {
    return executeOrCatch(task, e -> defaultValue, context);
  }

  @Override
  public void executeVoid(ThrowingRunnable task, TaskContext context) {
    Objects.requireNonNull(task, "task");
    execute(
        () -> {
          task.run();
          return null;
        },
        context);
  }

  @Override
  public <T> T executeWithFinally(
      ThrowingSupplier<T> task, Runnable finallyBlock, TaskContext context) {
    Objects.requireNonNull(finallyBlock, "finallyBlock");
    T result;
    try {
      result = execute(task, context);
    } catch (RuntimeException | Error primary) {
      runCleanupSuppressing(primary, finallyBlock);
      throw primary;
    }
    finallyBlock.run();
    return result;
  }

  @Override
  public <T> T executeWithTranslation(
      ThrowingSupplier<T> task, ExceptionTranslator customTranslator, TaskContext context) {
    Objects.requireNonNull(task, "task");
    Objects.requireNonNull(customTranslator, "customTranslator");
    Objects.requireNonNull(context, "context");

    try {
      return task.get();
    } catch (Error e) {
      throw e;
    } catch (Throwable t) {
      RuntimeException translated = translateSafe(customTranslator, t, context);
      logFailure(translated, context);
      throw translated;
    }
  }

  @Override
  public <T> T executeWithFallback(
      ThrowingSupplier<T> task, Function<Throwable, T> fallback, TaskContext context) {
    Objects.requireNonNull(task, "task");
    Objects.requireNonNull(fallback, "fallback");
    Objects.requireNonNull(context, "context");

    try {
      return task.get();
    } catch (Error e) {
      throw e;
    } catch (Throwable t) {
      return fallback.apply(t);
    }
  }

  private static RuntimeException translateSafe(
      ExceptionTranslator customTranslator, Throwable t, TaskContext context) {
    try {
      return customTranslator.translate(t, context);
    } catch (RuntimeException ex) {
      return ex;
    } catch (Error e) {
      throw e;
    } catch (Throwable unexpected) {
      return new IllegalStateException(UNEXPECTED_TRANSLATOR_FAILURE, unexpected);
    }
  }

  private static void logFailure(RuntimeException e, TaskContext context) {
    if (e instanceof ClientBaseException) {
      log.debug("[Task:{}] {}", context.toTaskName(), e.getMessage());
      return;
    }
    log.warn("[Task:{}] 실패 - {}", context.toTaskName(), e.getMessage());
  }

  private static void runCleanupSuppressing(Throwable primary, Runnable cleanup) {
    try {
      cleanup.run();
    } catch (RuntimeException cleanupEx) {
      if (primary != cleanupEx) {
        primary.addSuppressed(cleanupEx);
      }
    }
  }
}
