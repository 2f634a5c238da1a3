package alert.grouping.infrastructure.executor.function;

/**
 * 예외를 던질 수 있는 void 작업
 *
 * <p>표준 {@link Runnable}과 달리 Checked Exception(InterruptedException 등)을 던질 수 있습니다.
 *
 * @see alert.grouping.common.function.ThrowingSupplier
 */
@FunctionalInterface
public interface ThrowingRunnable {

  void run() throws Throwable;
}
