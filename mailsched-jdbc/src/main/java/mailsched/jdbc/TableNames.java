package mailsched.jdbc;

import java.util.List;
import java.util.Objects;

/**
 * Table names of the schedule store and validation of the optional prefix
 * prepended to each of them.
 */
public final class TableNames {
  public static final String STUDENT = "student";
  public static final String STUDENT_SUBJECT = "student_subject";
  public static final String WEEKLY_SLOT = "weekly_slot";
  public static final String SUBJECT_SCHEDULE = "subject_schedule";
  public static final String COMPANY_DRIVE = "company_drive";
  public static final String RESCHEDULED_CLASS = "rescheduled_class";
  public static final String CLASS_ASSIGNMENT = "class_assignment";
  public static final String ATTENDANCE = "attendance";
  public static final String NOTIFICATION = "notification";

  public static final List<String> ALL = List.of(STUDENT, STUDENT_SUBJECT, WEEKLY_SLOT, SUBJECT_SCHEDULE,
      COMPANY_DRIVE, RESCHEDULED_CLASS, CLASS_ASSIGNMENT, ATTENDANCE, NOTIFICATION);

  private static final String TABLE_NAME_PATTERN = "[a-zA-Z_][a-zA-Z0-9_]*";
  private static final String PREFIX_PATTERN = "([a-zA-Z_][a-zA-Z0-9_]*)?";

  private TableNames() {}

  public static String validate(String tableName) {
    Objects.requireNonNull(tableName, "tableName");
    if (!tableName.matches(TABLE_NAME_PATTERN)) {
      throw new IllegalArgumentException("Invalid table name: " + tableName);
    }
    return tableName;
  }

  /**
   * Validates a table prefix; the empty string means no prefix.
   */
  public static String validatePrefix(String prefix) {
    Objects.requireNonNull(prefix, "prefix");
    if (!prefix.matches(PREFIX_PATTERN)) {
      throw new IllegalArgumentException("Invalid table prefix: " + prefix);
    }
    return prefix;
  }

  public static String prefixed(String prefix, String tableName) {
    return validatePrefix(prefix) + validate(tableName);
  }
}
