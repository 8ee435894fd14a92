package mailsched.model;

public enum NotificationType {
  INTERVIEW("interview"),
  RESCHEDULE("reschedule"),
  NO_SLOT_AVAILABLE("no_slot_available");

  private final String code;

  NotificationType(String code) {
    this.code = code;
  }

  public String code() {
    return code;
  }

  public static NotificationType fromCode(String code) {
    for (NotificationType type : values()) {
      if (type.code.equals(code)) {
        return type;
      }
    }
    throw new IllegalArgumentException("Unknown notification type: " + code);
  }
}
