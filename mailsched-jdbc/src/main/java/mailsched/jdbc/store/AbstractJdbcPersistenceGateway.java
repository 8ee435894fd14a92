package mailsched.jdbc.store;

import mailsched.jdbc.JdbcTemplate;
import mailsched.jdbc.TableNames;
import mailsched.model.AttendanceStatus;
import mailsched.model.Booking;
import mailsched.model.ClassStatus;
import mailsched.model.CompanyDrive;
import mailsched.model.DriveStage;
import mailsched.model.DriveStatus;
import mailsched.model.Notification;
import mailsched.model.NotificationType;
import mailsched.model.RescheduledClass;
import mailsched.model.TimeWindow;
import mailsched.model.WeeklySlot;
import mailsched.spi.PersistenceGateway;
import mailsched.spi.Upserted;

import java.sql.Connection;
import java.sql.Timestamp;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.List;
import java.util.Optional;

/**
 * Base JDBC persistence gateway with standard SQL implementations.
 *
 * <p>Subclasses override {@link #lockPendingClasses} to provide database-specific row
 * locking for booking counts. Register custom implementations via
 * {@code META-INF/services/mailsched.jdbc.store.AbstractJdbcPersistenceGateway}.
 *
 * <p>All tables may carry a common prefix (see {@link TableNames#validatePrefix}).
 *
 * @see JdbcPersistenceGateways
 */
public abstract class AbstractJdbcPersistenceGateway implements PersistenceGateway {
  private static final int MAX_MESSAGE_LENGTH = 1000;

  protected static final String PENDING = String.valueOf(ClassStatus.PENDING.code());

  private static final String DRIVE_COLUMNS = "id, student_id, company, stage, drive_datetime, status";
  private static final String CLASS_COLUMNS =
      "id, subject, slot_id, class_date, start_time, end_time, request_start, request_end, status";
  private static final String NOTIFICATION_COLUMNS =
      "id, student_id, notification_type, reference_id, message, dedup_key, created_at";

  protected static final JdbcTemplate.RowMapper<CompanyDrive> DRIVE_ROW_MAPPER = rs -> new CompanyDrive(
      rs.getLong("id"),
      rs.getString("student_id"),
      rs.getString("company"),
      DriveStage.valueOf(rs.getString("stage")),
      rs.getObject("drive_datetime", LocalDateTime.class),
      DriveStatus.fromCode(rs.getInt("status")));

  protected static final JdbcTemplate.RowMapper<RescheduledClass> CLASS_ROW_MAPPER = rs -> new RescheduledClass(
      rs.getLong("id"),
      rs.getString("subject"),
      rs.getLong("slot_id"),
      rs.getObject("class_date", LocalDate.class),
      rs.getObject("start_time", LocalTime.class),
      rs.getObject("end_time", LocalTime.class),
      rs.getObject("request_start", LocalDateTime.class),
      rs.getObject("request_end", LocalDateTime.class),
      ClassStatus.fromCode(rs.getInt("status")));

  protected static final JdbcTemplate.RowMapper<WeeklySlot> SLOT_ROW_MAPPER = rs -> new WeeklySlot(
      rs.getLong("slot_id"),
      DayOfWeek.of(rs.getInt("day_of_week")),
      rs.getObject("start_time", LocalTime.class),
      rs.getObject("end_time", LocalTime.class));

  protected static final JdbcTemplate.RowMapper<Notification> NOTIFICATION_ROW_MAPPER = rs -> {
    long reference = rs.getLong("reference_id");
    Long referenceId = rs.wasNull() ? null : reference;
    return new Notification(
        rs.getLong("id"),
        rs.getString("student_id"),
        NotificationType.fromCode(rs.getString("notification_type")),
        referenceId,
        rs.getString("message"),
        rs.getString("dedup_key"),
        rs.getTimestamp("created_at").toInstant());
  };

  private final String tablePrefix;

  protected AbstractJdbcPersistenceGateway() {
    this("");
  }

  protected AbstractJdbcPersistenceGateway(String tablePrefix) {
    this.tablePrefix = TableNames.validatePrefix(tablePrefix);
  }

  /**
   * Unique identifier for this gateway (e.g., "mysql", "postgresql", "h2").
   */
  public abstract String name();

  /**
   * JDBC URL prefixes this gateway handles (e.g., "jdbc:mysql:", "jdbc:mariadb:").
   */
  public abstract List<String> jdbcUrlPrefixes();

  /**
   * Returns a gateway of the same dialect whose tables carry {@code tablePrefix}.
   */
  public abstract AbstractJdbcPersistenceGateway withTablePrefix(String tablePrefix);

  protected String tablePrefix() {
    return tablePrefix;
  }

  protected String table(String name) {
    return tablePrefix + name;
  }

  @Override
  public Optional<CompanyDrive> findCompanyDrive(Connection conn, String studentId, String company,
      LocalDateTime datetime) {
    String sql = "SELECT " + DRIVE_COLUMNS + " FROM " + table(TableNames.COMPANY_DRIVE) +
        " WHERE student_id=? AND company=? AND drive_datetime=?";
    return JdbcTemplate.queryOne(conn, sql, DRIVE_ROW_MAPPER, studentId, company, datetime);
  }

  @Override
  public Upserted<CompanyDrive> upsertCompanyDrive(Connection conn, CompanyDrive drive) {
    Optional<CompanyDrive> existing = findCompanyDrive(conn, drive.studentId(), drive.company(), drive.datetime());
    if (existing.isPresent()) {
      return Upserted.existing(existing.get());
    }
    String sql = "INSERT INTO " + table(TableNames.COMPANY_DRIVE) +
        " (student_id, company, stage, drive_datetime, status) VALUES (?,?,?,?,?)";
    long id = JdbcTemplate.insert(conn, sql,
        drive.studentId(), drive.company(), drive.stage().name(), drive.datetime(), drive.status().code());
    return Upserted.created(drive.withId(id));
  }

  @Override
  public Optional<RescheduledClass> findRescheduledClass(Connection conn, String subject, long slotId,
      LocalDate date) {
    String sql = "SELECT " + CLASS_COLUMNS + " FROM " + table(TableNames.RESCHEDULED_CLASS) +
        " WHERE subject=? AND slot_id=? AND class_date=?";
    return JdbcTemplate.queryOne(conn, sql, CLASS_ROW_MAPPER, subject, slotId, date);
  }

  @Override
  public Upserted<RescheduledClass> upsertRescheduledClass(Connection conn, RescheduledClass cls) {
    Optional<RescheduledClass> existing = findRescheduledClass(conn, cls.subject(), cls.slotId(), cls.date());
    if (existing.isPresent()) {
      return Upserted.existing(existing.get());
    }
    String sql = "INSERT INTO " + table(TableNames.RESCHEDULED_CLASS) +
        " (subject, slot_id, class_date, start_time, end_time, request_start, request_end, status)" +
        " VALUES (?,?,?,?,?,?,?,?)";
    long id = JdbcTemplate.insert(conn, sql,
        cls.subject(), cls.slotId(), cls.date(), cls.start(), cls.end(),
        cls.requestStart(), cls.requestEnd(), cls.status().code());
    return Upserted.created(cls.withId(id));
  }

  @Override
  public Optional<RescheduledClass> findPendingClassForRequest(Connection conn, String subject, TimeWindow request) {
    String sql = "SELECT " + CLASS_COLUMNS + " FROM " + table(TableNames.RESCHEDULED_CLASS) +
        " WHERE subject=? AND request_start=? AND request_end=? AND status=" + PENDING +
        " ORDER BY id LIMIT 1";
    return JdbcTemplate.queryOne(conn, sql, CLASS_ROW_MAPPER, subject, request.start(), request.end());
  }

  @Override
  public void assignStudent(Connection conn, long rescheduledClassId, String studentId) {
    String sql = "INSERT INTO " + table(TableNames.CLASS_ASSIGNMENT) +
        " (rescheduled_class_id, student_id) VALUES (?,?)";
    JdbcTemplate.update(conn, sql, rescheduledClassId, studentId);
  }

  @Override
  public boolean isAssigned(Connection conn, long rescheduledClassId, String studentId) {
    String sql = "SELECT 1 FROM " + table(TableNames.CLASS_ASSIGNMENT) +
        " WHERE rescheduled_class_id=? AND student_id=?";
    return !JdbcTemplate.query(conn, sql, rs -> rs.getInt(1), rescheduledClassId, studentId).isEmpty();
  }

  @Override
  public int countAssignments(Connection conn, long rescheduledClassId) {
    String sql = "SELECT COUNT(*) FROM " + table(TableNames.CLASS_ASSIGNMENT) + " WHERE rescheduled_class_id=?";
    return JdbcTemplate.query(conn, sql, rs -> rs.getInt(1), rescheduledClassId).get(0);
  }

  @Override
  public void insertAttendance(Connection conn, String studentId, long rescheduledClassId, AttendanceStatus status) {
    String sql = "INSERT INTO " + table(TableNames.ATTENDANCE) +
        " (student_id, rescheduled_class_id, status) VALUES (?,?,?)";
    JdbcTemplate.update(conn, sql, studentId, rescheduledClassId, status.code());
  }

  @Override
  public Notification insertNotification(Connection conn, Notification notification) {
    String sql = "INSERT INTO " + table(TableNames.NOTIFICATION) +
        " (student_id, notification_type, reference_id, message, dedup_key, created_at) VALUES (?,?,?,?,?,?)";
    long id = JdbcTemplate.insert(conn, sql,
        notification.studentId(), notification.type().code(), notification.referenceId(),
        truncate(notification.message()), notification.dedupKey(), Timestamp.from(notification.createdAt()));
    return notification.withId(id);
  }

  @Override
  public List<WeeklySlot> listWeeklySlots(Connection conn) {
    String sql = "SELECT slot_id, day_of_week, start_time, end_time FROM " + table(TableNames.WEEKLY_SLOT) +
        " ORDER BY slot_id";
    return JdbcTemplate.query(conn, sql, SLOT_ROW_MAPPER);
  }

  @Override
  public List<Booking> loadBookings(Connection conn, LocalDate from, LocalDate toExclusive) {
    lockPendingClasses(conn, from, toExclusive);
    String sql = "SELECT c.slot_id, c.class_date, COUNT(a.student_id) AS assigned" +
        " FROM " + table(TableNames.RESCHEDULED_CLASS) + " c" +
        " LEFT JOIN " + table(TableNames.CLASS_ASSIGNMENT) + " a ON a.rescheduled_class_id = c.id" +
        " WHERE c.status=" + PENDING + " AND c.class_date >= ? AND c.class_date < ?" +
        " GROUP BY c.slot_id, c.class_date ORDER BY c.class_date, c.slot_id";
    return JdbcTemplate.query(conn, sql,
        rs -> new Booking(rs.getLong("slot_id"), rs.getObject("class_date", LocalDate.class), rs.getInt("assigned")),
        from, toExclusive);
  }

  /**
   * Locks the pending classes counted by {@link #loadBookings} until the transaction ends.
   * The default does nothing; engines that reject {@code FOR UPDATE} with aggregates lock
   * the rows with a separate statement here.
   */
  protected void lockPendingClasses(Connection conn, LocalDate from, LocalDate toExclusive) {
  }

  @Override
  public List<WeeklySlot> loadStudentCommitments(Connection conn, String studentId) {
    String sql = "SELECT DISTINCT w.slot_id, w.day_of_week, w.start_time, w.end_time" +
        " FROM " + table(TableNames.WEEKLY_SLOT) + " w" +
        " JOIN " + table(TableNames.SUBJECT_SCHEDULE) + " s ON s.slot_id = w.slot_id" +
        " JOIN " + table(TableNames.STUDENT_SUBJECT) + " ss ON ss.subject = s.subject" +
        " WHERE ss.student_id=? ORDER BY w.slot_id";
    return JdbcTemplate.query(conn, sql, SLOT_ROW_MAPPER, studentId);
  }

  @Override
  public List<RescheduledClass> loadStudentAssignments(Connection conn, String studentId) {
    String sql = "SELECT c.id, c.subject, c.slot_id, c.class_date, c.start_time, c.end_time," +
        " c.request_start, c.request_end, c.status" +
        " FROM " + table(TableNames.RESCHEDULED_CLASS) + " c" +
        " JOIN " + table(TableNames.CLASS_ASSIGNMENT) + " a ON a.rescheduled_class_id = c.id" +
        " WHERE a.student_id=? AND c.status=" + PENDING + " ORDER BY c.class_date, c.start_time";
    return JdbcTemplate.query(conn, sql, CLASS_ROW_MAPPER, studentId);
  }

  @Override
  public List<Notification> listNotifications(Connection conn, String studentId, int limit) {
    String sql = "SELECT " + NOTIFICATION_COLUMNS + " FROM " + table(TableNames.NOTIFICATION) +
        " WHERE student_id=? ORDER BY created_at DESC, id DESC LIMIT ?";
    return JdbcTemplate.query(conn, sql, NOTIFICATION_ROW_MAPPER, studentId, limit);
  }

  private static String truncate(String message) {
    if (message.length() <= MAX_MESSAGE_LENGTH) {
      return message;
    }
    return message.substring(0, MAX_MESSAGE_LENGTH - 3) + "...";
  }
}
