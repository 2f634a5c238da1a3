package alert.grouping.domain.model.group;

import java.util.List;

/**
 * @param items 키 순으로 정렬된 현재 페이지의 그룹 복사본
 * @param total 필터 적용 후 전체 개수
 */
public record GroupPage(List<AlertGroup> items, int total, Pagination pagination) {

  public GroupPage {
    items = List.copyOf(items);
  }

  public boolean hasNext() {
    return !pagination.isUnpaged() && pagination.offset() + items.size() < total;
  }
}
