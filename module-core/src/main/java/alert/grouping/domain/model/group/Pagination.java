package alert.grouping.domain.model.group;

/**
 * offset/limit 페이지네이션. limit 0 은 제한 없음.
 */
public record Pagination(int offset, int limit) {

  public Pagination {
    if (offset < 0) {
      throw new IllegalArgumentException("offset cannot be negative: " + offset);
    }
    if (limit < 0) {
      throw new IllegalArgumentException("limit cannot be negative: " + limit);
    }
  }

  public static Pagination unpaged() {
    return new Pagination(0, 0);
  }

  public static Pagination of(int offset, int limit) {
    return new Pagination(offset, limit);
  }

  public boolean isUnpaged() {
    return limit == 0;
  }
}
