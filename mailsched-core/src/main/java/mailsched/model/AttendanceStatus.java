package mailsched.model;

public enum AttendanceStatus {
  ABSENT(0),
  PRESENT(1);

  private final int code;

  AttendanceStatus(int code) {
    this.code = code;
  }

  public int code() {
    return code;
  }
}
