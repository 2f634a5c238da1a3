package alert.grouping.domain.model.alert;

public enum AlertStatus {
  FIRING,
  RESOLVED
}
