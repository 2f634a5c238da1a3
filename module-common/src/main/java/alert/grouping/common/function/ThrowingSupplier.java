package alert.grouping.common.function;

/**
 * 예외를 던질 수 있는 Supplier
 *
 * <p>표준 {@link java.util.function.Supplier}와 달리 Checked Exception을 던질 수 있어, LogicExecutor에 Redis/JSON
 * 작업을 try-catch 없이 넘길 수 있습니다.
 *
 * @param <T> 결과 타입
 */
@FunctionalInterface
public interface ThrowingSupplier<T> {

  T get() throws Throwable;
}
