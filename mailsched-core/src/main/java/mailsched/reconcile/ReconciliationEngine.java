package mailsched.reconcile;

import mailsched.Identity;
import mailsched.model.AttendanceStatus;
import mailsched.model.CompanyDrive;
import mailsched.model.DriveStatus;
import mailsched.model.Notification;
import mailsched.model.NotificationType;
import mailsched.model.RescheduledClass;
import mailsched.model.ScheduleEvent;
import mailsched.model.TimeWindow;
import mailsched.model.WeeklySlot;
import mailsched.spi.ConnectionProvider;
import mailsched.spi.MetricsExporter;
import mailsched.spi.NotificationListener;
import mailsched.spi.PersistenceConflictException;
import mailsched.spi.PersistenceGateway;
import mailsched.spi.PersistenceUnavailableException;
import mailsched.spi.Upserted;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.format.DateTimeFormatter;
import java.time.format.TextStyle;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Turns one extracted event into the minimal set of idempotent writes and applies them
 * in a single transaction.
 *
 * <ul>
 *   <li>An interview creates a {@link CompanyDrive} and an interview notification, unless a
 *       drive with the same {@code (student, company, datetime)} already exists.</li>
 *   <li>A reschedule assigns the student to a rescheduled class. Students of the same
 *       request share one class while it has room; otherwise {@link SlotAllocator} picks
 *       an occurrence. When nothing is free a {@code NO_SLOT_AVAILABLE} notification is
 *       written instead.</li>
 *   <li>Anything else is a no-op.</li>
 * </ul>
 *
 * <p>A unique-key collision at write time rolls the whole unit back and is reported as
 * {@link Outcome#DUPLICATE}. Reschedules of the same subject are serialized within the
 * process so capacity checks and inserts do not interleave. Notifications are handed to
 * {@link NotificationListener}s only after commit.
 *
 * <p>Create instances via {@link #builder()}. Thread-safe.
 */
public final class ReconciliationEngine {
  private static final Logger logger = Logger.getLogger(ReconciliationEngine.class.getName());

  static final DateTimeFormatter DATETIME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");

  private final ConnectionProvider connectionProvider;
  private final PersistenceGateway gateway;
  private final SlotAllocator allocator;
  private final MetricsExporter metrics;
  private final List<NotificationListener> listeners;
  private final Clock clock;
  private final ConcurrentMap<String, ReentrantLock> subjectLocks = new ConcurrentHashMap<>();

  private ReconciliationEngine(Builder builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.gateway = Objects.requireNonNull(builder.gateway, "gateway");
    this.allocator = builder.allocator != null ? builder.allocator : new SlotAllocator();
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.listeners = List.copyOf(builder.listeners);
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Reconciles one event for one student.
   *
   * @return what was committed
   * @throws PersistenceUnavailableException if no connection can be obtained
   */
  public Outcome reconcile(Identity identity, ScheduleEvent event) {
    Objects.requireNonNull(identity, "identity");
    Objects.requireNonNull(event, "event");
    if (event instanceof ScheduleEvent.NoEvent) {
      return Outcome.NO_EVENT;
    }
    long startNanos = System.nanoTime();
    ReentrantLock subjectLock = event instanceof ScheduleEvent.RescheduleEvent reschedule
        ? subjectLocks.computeIfAbsent(reschedule.subject(), s -> new ReentrantLock())
        : null;
    if (subjectLock != null) {
      subjectLock.lock();
    }
    try {
      return reconcileInTransaction(identity.studentId(), event);
    } finally {
      if (subjectLock != null) {
        subjectLock.unlock();
      }
      metrics.recordReconcileDurationMs((System.nanoTime() - startNanos) / 1_000_000L);
    }
  }

  private Outcome reconcileInTransaction(String studentId, ScheduleEvent event) {
    Connection conn;
    try {
      conn = connectionProvider.getConnection();
    } catch (SQLException e) {
      throw new PersistenceUnavailableException("Cannot obtain connection for " + studentId, e);
    }
    List<Notification> committed = new ArrayList<>();
    Outcome outcome;
    try (conn) {
      conn.setAutoCommit(false);
      try {
        WriteSet writes = plan(conn, studentId, event);
        outcome = apply(conn, writes, committed);
        conn.commit();
      } catch (PersistenceConflictException e) {
        rollbackQuietly(conn, e);
        committed.clear();
        metrics.incrementConflicts();
        logger.log(Level.FINE, "Concurrent duplicate for student {0}: {1}",
            new Object[]{studentId, e.getMessage()});
        return Outcome.DUPLICATE;
      } catch (SQLException | RuntimeException e) {
        rollbackQuietly(conn, e);
        throw e;
      }
    } catch (SQLException e) {
      logger.log(Level.WARNING, "Reconciliation failed for student " + studentId, e);
      return Outcome.FAILED;
    } catch (PersistenceUnavailableException e) {
      throw e;
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Reconciliation failed for student " + studentId, e);
      return Outcome.FAILED;
    }
    record(outcome);
    publish(committed);
    return outcome;
  }

  /**
   * Computes the writes needed for {@code event} from the state visible on {@code conn}.
   * Performs reads only.
   */
  WriteSet plan(Connection conn, String studentId, ScheduleEvent event) {
    if (event instanceof ScheduleEvent.InterviewEvent interview) {
      return planInterview(conn, studentId, interview);
    }
    if (event instanceof ScheduleEvent.RescheduleEvent reschedule) {
      return planReschedule(conn, studentId, reschedule);
    }
    return WriteSet.nothing(studentId, Outcome.NO_EVENT);
  }

  private WriteSet planInterview(Connection conn, String studentId, ScheduleEvent.InterviewEvent interview) {
    if (gateway.findCompanyDrive(conn, studentId, interview.company(), interview.datetime()).isPresent()) {
      return WriteSet.nothing(studentId, Outcome.DUPLICATE);
    }
    CompanyDrive drive = new CompanyDrive(0L, studentId, interview.company(), interview.stage(),
        interview.datetime(), DriveStatus.PENDING);
    WriteSet.Draft note = new WriteSet.Draft(NotificationType.INTERVIEW,
        "Upcoming " + interview.stage().label() + " at " + interview.company()
            + " on " + DATETIME_FORMAT.format(interview.datetime()),
        "interview|" + studentId + "|" + interview.company() + "|" + interview.datetime());
    return new WriteSet(studentId, Outcome.CREATED_DRIVE, drive, null, note);
  }

  private WriteSet planReschedule(Connection conn, String studentId, ScheduleEvent.RescheduleEvent reschedule) {
    String subject = reschedule.subject();
    TimeWindow requested = reschedule.requestedWindow();

    List<RescheduledClass> assignments = gateway.loadStudentAssignments(conn, studentId);
    for (RescheduledClass assigned : assignments) {
      if (assigned.subject().equals(subject)
          && requested.start().equals(assigned.requestStart())
          && requested.end().equals(assigned.requestEnd())) {
        return WriteSet.nothing(studentId, Outcome.DUPLICATE);
      }
    }
    List<WeeklySlot> commitments = gateway.loadStudentCommitments(conn, studentId);

    Optional<RescheduledClass> shared = gateway.findPendingClassForRequest(conn, subject, requested);
    if (shared.isPresent()) {
      RescheduledClass cls = shared.get();
      if (gateway.isAssigned(conn, cls.id(), studentId)) {
        return WriteSet.nothing(studentId, Outcome.DUPLICATE);
      }
      if (gateway.countAssignments(conn, cls.id()) < allocator.slotCapacity()
          && !SlotAllocator.conflicts(cls.window(), commitments, assignments)) {
        return assignment(studentId, cls, requested);
      }
    }

    Allocation allocation = allocator.allocate(subject, requested, gateway.listWeeklySlots(conn),
        gateway.loadBookings(conn, allocator.rangeStart(requested), allocator.rangeEnd(requested)),
        commitments, assignments);
    if (allocation instanceof Allocation.Assigned assigned) {
      RescheduledClass cls = gateway.findRescheduledClass(conn, subject,
              assigned.occurrence().slot().slotId(), assigned.occurrence().date())
          .orElseGet(() -> RescheduledClass.pending(subject, assigned.occurrence(), requested));
      return assignment(studentId, cls, requested);
    }
    Allocation.Exhausted exhausted = (Allocation.Exhausted) allocation;
    logger.log(Level.FINE, "No slot for student {0}: {1}", new Object[]{studentId, exhausted.reason()});
    WriteSet.Draft note = new WriteSet.Draft(NotificationType.NO_SLOT_AVAILABLE,
        "No slot available to reschedule " + subject + " near " + requested
            + "; manual scheduling required",
        "no_slot|" + studentId + "|" + subject + "|" + requested.start());
    return new WriteSet(studentId, Outcome.NO_SLOT, null, null, note);
  }

  /** The notification key names the request, so a replay of it collides even on another slot. */
  private static WriteSet assignment(String studentId, RescheduledClass cls, TimeWindow requested) {
    String day = cls.date().getDayOfWeek().getDisplayName(TextStyle.FULL, Locale.ENGLISH);
    WriteSet.Draft note = new WriteSet.Draft(NotificationType.RESCHEDULE,
        "Your " + cls.subject() + " class has been rescheduled to " + day + " " + cls.date()
            + " " + cls.start() + "-" + cls.end(),
        "reschedule|" + studentId + "|" + cls.subject() + "|" + requested.start() + "|" + requested.end());
    return new WriteSet(studentId, Outcome.ASSIGNED, null, cls, note);
  }

  /**
   * Applies {@code writes} on {@code conn} without committing.
   */
  Outcome apply(Connection conn, WriteSet writes, List<Notification> created) {
    Long referenceId = null;
    if (writes.drive() != null) {
      Upserted<CompanyDrive> drive = gateway.upsertCompanyDrive(conn, writes.drive());
      if (!drive.created()) {
        return Outcome.DUPLICATE;
      }
      referenceId = drive.row().id();
    }
    if (writes.targetClass() != null) {
      RescheduledClass cls = writes.targetClass();
      if (cls.id() == 0L) {
        cls = gateway.upsertRescheduledClass(conn, cls).row();
      }
      gateway.assignStudent(conn, cls.id(), writes.studentId());
      gateway.insertAttendance(conn, writes.studentId(), cls.id(), AttendanceStatus.ABSENT);
      referenceId = cls.id();
    }
    if (writes.notification() != null) {
      WriteSet.Draft draft = writes.notification();
      created.add(gateway.insertNotification(conn, new Notification(0L, writes.studentId(),
          draft.type(), referenceId, draft.message(), draft.dedupKey(), clock.instant())));
    }
    return writes.outcome();
  }

  private void record(Outcome outcome) {
    switch (outcome) {
      case CREATED_DRIVE -> metrics.incrementDrivesCreated();
      case ASSIGNED -> metrics.incrementAssignmentsCreated();
      case NO_SLOT -> metrics.incrementNoSlot();
      default -> {
      }
    }
  }

  private void publish(List<Notification> notifications) {
    for (Notification notification : notifications) {
      for (NotificationListener listener : listeners) {
        try {
          listener.onNotification(notification);
        } catch (RuntimeException e) {
          logger.log(Level.WARNING, "Notification listener failed for " + notification.dedupKey(), e);
        }
      }
    }
  }

  private static void rollbackQuietly(Connection conn, Exception cause) {
    try {
      conn.rollback();
    } catch (SQLException e) {
      cause.addSuppressed(e);
    }
  }

  /** Builder for {@link ReconciliationEngine}. */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private PersistenceGateway gateway;
    private SlotAllocator allocator;
    private MetricsExporter metrics;
    private Clock clock;
    private final List<NotificationListener> listeners = new ArrayList<>();

    private Builder() {}

    /** <b>Required.</b> Source of connections, one per reconciled event. */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /** <b>Required.</b> */
    public Builder gateway(PersistenceGateway gateway) {
      this.gateway = gateway;
      return this;
    }

    /** Optional. Defaults to a {@link SlotAllocator} with capacity 40 and a two-week search. */
    public Builder allocator(SlotAllocator allocator) {
      this.allocator = allocator;
      return this;
    }

    /** Optional. Defaults to {@link MetricsExporter#NOOP}. */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /** Optional. Clock for notification timestamps, defaults to UTC system clock. */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    public Builder listener(NotificationListener listener) {
      this.listeners.add(Objects.requireNonNull(listener, "listener"));
      return this;
    }

    public Builder listeners(List<NotificationListener> listeners) {
      listeners.forEach(this::listener);
      return this;
    }

    public ReconciliationEngine build() {
      return new ReconciliationEngine(this);
    }
  }
}
