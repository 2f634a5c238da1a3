package alert.grouping.domain.model.group;

/**
 * 그룹 상태 머신
 *
 * <pre>
 * FIRING ──(모든 알림 resolved)──▶ RESOLVED (종단)
 * </pre>
 *
 * <p>RESOLVED 그룹에 새 firing 알림이 들어오면 같은 인스턴스를 되살리지 않고 새 그룹 레코드를 만듭니다 ({@link
 * AlertGroup#recycle}).
 */
public enum GroupState {
  FIRING {
    @Override
    public GroupState next(int firingCount, int resolvedCount) {
      return firingCount == 0 && resolvedCount > 0 ? RESOLVED : FIRING;
    }
  },
  RESOLVED {
    @Override
    public GroupState next(int firingCount, int resolvedCount) {
      return RESOLVED;
    }
  };

  /**
   * 알림 구성 변경 후 다음 상태
   *
   * @param firingCount 해소되지 않은 알림 수
   * @param resolvedCount 해소된 알림 수
   */
  public abstract GroupState next(int firingCount, int resolvedCount);

  public boolean isTerminal() {
    return this == RESOLVED;
  }
}
