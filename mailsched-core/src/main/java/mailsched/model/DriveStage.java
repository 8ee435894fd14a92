package mailsched.model;

public enum DriveStage {
  OA("OA"),
  INTERVIEW("Interview");

  private final String label;

  DriveStage(String label) {
    this.label = label;
  }

  public String label() {
    return label;
  }

  /**
   * Lenient parse of extractor output; anything that is not recognisably an online
   * assessment is treated as an interview.
   */
  public static DriveStage parse(String text) {
    if (text == null) {
      return INTERVIEW;
    }
    String normalized = text.strip().toUpperCase();
    if (normalized.equals("OA") || normalized.contains("ONLINE ASSESSMENT")
        || normalized.contains("ONLINE TEST") || normalized.contains("ASSESSMENT")) {
      return OA;
    }
    return INTERVIEW;
  }
}
