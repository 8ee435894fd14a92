package mailsched.model;

public enum DriveStatus {
  PENDING(0),
  DONE(1);

  private final int code;

  DriveStatus(int code) {
    this.code = code;
  }

  public int code() {
    return code;
  }

  public static DriveStatus fromCode(int code) {
    for (DriveStatus status : values()) {
      if (status.code == code) {
        return status;
      }
    }
    throw new IllegalArgumentException("Unknown drive status code: " + code);
  }
}
