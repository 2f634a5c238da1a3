package alert.grouping.infrastructure.executor;

import alert.grouping.common.function.ThrowingSupplier;
import alert.grouping.infrastructure.executor.function.ThrowingRunnable;
import alert.grouping.infrastructure.executor.strategy.ExceptionTranslator;
import java.util.function.Function;

/**
 * 비즈니스 로직에서 try-catch 를 걷어내기 위한 실행 템플릿
 *
 * <h3>메서드 선택 기준</h3>
 *
 * <ul>
 *   <li>{@link #execute}: 실패 시 도메인 예외로 번역하여 전파
 *   <li>{@link #executeOrDefault}: 실패해도 흐름을 유지해야 하는 조회 (기본값 반환)
 *   <li>{@link #executeOrCatch}: 번역된 예외를 보고 복구값 결정
 *   <li>{@link #executeVoid}: 반환값 없는 작업
 *   <li>{@link #executeWithFinally}: 락 해제 등 정리 작업 보장
 *   <li>{@link #executeWithTranslation}: 작업 전용 번역기 (Redis, JSON, Lock)
 *   <li>{@link #executeWithFallback}: 원본 예외를 받아 fallback 결정 (번역 없음)
 * </ul>
 *
 * <p>{@link Error} 는 어떤 메서드에서도 번역/복구하지 않고 즉시 전파합니다.
 */
public interface LogicExecutor {

  <T> T execute(ThrowingSupplier<T> task, TaskContext context);

  <T> T executeOrDefault(ThrowingSupplier<T> task, T defaultValue, TaskContext context);

  <T> T executeOrCatch(
      ThrowingSupplier<T> task, Function<Throwable, T> recovery, TaskContext context);

  void executeVoid(ThrowingRunnable task, TaskContext context);

  <T> T executeWithFinally(ThrowingSupplier<T> task, Runnable finallyBlock, TaskContext context);

  <T> T executeWithTranslation(
      ThrowingSupplier<T> task, ExceptionTranslator translator, TaskContext context);

  <T> T executeWithFallback(
      ThrowingSupplier<T> task, Function<Throwable, T> fallback, TaskContext context);
}
