package alert.grouping.error;

/**
 * 에러 코드 계약
 *
 * <p>{@link #getMessage()}는 {@link String#format(String, Object...)} 템플릿으로 사용됩니다.
 */
public interface ErrorCode {
  String getCode();

  String getMessage();

  /** 4xx 계열(비즈니스/기대된 흐름) 여부 */
  boolean isClientError();
}
