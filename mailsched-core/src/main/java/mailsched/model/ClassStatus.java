package mailsched.model;

public enum ClassStatus {
  PENDING(0),
  DONE(1),
  SUPERSEDED(2);

  private final int code;

  ClassStatus(int code) {
    this.code = code;
  }

  public int code() {
    return code;
  }

  public static ClassStatus fromCode(int code) {
    for (ClassStatus status : values()) {
      if (status.code == code) {
        return status;
      }
    }
    throw new IllegalArgumentException("Unknown class status code: " + code);
  }
}
