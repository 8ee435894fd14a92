package mailsched.jdbc;

import mailsched.Identity;
import mailsched.jdbc.store.H2PersistenceGateway;
import mailsched.model.Notification;
import mailsched.model.NotificationType;
import mailsched.model.ScheduleEvent;
import mailsched.model.TimeWindow;
import mailsched.model.WeeklySlot;
import mailsched.reconcile.Outcome;
import mailsched.reconcile.ReconciliationEngine;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.sql.Timestamp;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Reconciliation units of work against a real database.
 */
class JdbcReconciliationTest {

    private static final Identity ALICE = Identity.of("alice");
    private static final Identity BOB = Identity.of("bob");
    private static final LocalDate TUESDAY = LocalDate.of(2024, 5, 14);
    private static final WeeklySlot TUE_10 = new WeeklySlot(2, DayOfWeek.TUESDAY, LocalTime.of(10, 0), LocalTime.of(11, 0));
    private static final WeeklySlot TUE_14 = new WeeklySlot(3, DayOfWeek.TUESDAY, LocalTime.of(14, 0), LocalTime.of(15, 0));
    private static final ScheduleEvent.InterviewEvent ACME =
            new ScheduleEvent.InterviewEvent("Acme", LocalDateTime.of(2024, 5, 20, 15, 30));
    private static final ScheduleEvent.RescheduleEvent MATH = new ScheduleEvent.RescheduleEvent("Math",
            new TimeWindow(TUESDAY.atTime(10, 0), TUESDAY.atTime(11, 0)));

    private final H2PersistenceGateway gateway = new H2PersistenceGateway();
    private JdbcDataSource dataSource;
    private ReconciliationEngine engine;

    @BeforeEach
    void setup() throws Exception {
        dataSource = JdbcTestSupport.h2DataSource("reconcile");
        JdbcTestSupport.applySchema(dataSource, "h2");
        JdbcTestSupport.insertSlot(dataSource, TUE_10);
        JdbcTestSupport.insertSlot(dataSource, TUE_14);
        engine = ReconciliationEngine.builder()
                .connectionProvider(new DataSourceConnectionProvider(dataSource))
                .gateway(gateway)
                .build();
    }

    @Test
    void replayedInterviewLeavesOneDriveAndOneNotification() throws Exception {
        assertEquals(Outcome.CREATED_DRIVE, engine.reconcile(ALICE, ACME));
        assertEquals(Outcome.DUPLICATE, engine.reconcile(ALICE, ACME));

        assertEquals(1, JdbcTestSupport.count(dataSource, "company_drive"));
        assertEquals(1, JdbcTestSupport.count(dataSource, "notification"));
    }

    @Test
    void studentsOfOneRequestShareTheClass() throws Exception {
        assertEquals(Outcome.ASSIGNED, engine.reconcile(ALICE, MATH));
        assertEquals(Outcome.ASSIGNED, engine.reconcile(BOB, MATH));
        assertEquals(Outcome.DUPLICATE, engine.reconcile(BOB, MATH));

        assertEquals(1, JdbcTestSupport.count(dataSource, "rescheduled_class"));
        assertEquals(2, JdbcTestSupport.count(dataSource, "class_assignment"));
        assertEquals(2, JdbcTestSupport.count(dataSource, "attendance"));
        try (Connection conn = dataSource.getConnection()) {
            List<Notification> notes = gateway.listNotifications(conn, "bob", 10);
            assertEquals(NotificationType.RESCHEDULE, notes.get(0).type());
        }
    }

    @Test
    void regularTimetableIsAvoided() throws Exception {
        JdbcTestSupport.enroll(dataSource, "alice", "Chemistry", TUE_10);

        assertEquals(Outcome.ASSIGNED, engine.reconcile(ALICE, MATH));

        try (Connection conn = dataSource.getConnection()) {
            assertEquals(TUE_14.slotId(), gateway.loadStudentAssignments(conn, "alice").get(0).slotId());
        }
    }

    @Test
    void failedNotificationInsertRollsBackTheWholeUnit() throws Exception {
        // Occupy the dedup key the reschedule notification will use.
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement("INSERT INTO notification"
                     + " (student_id, notification_type, reference_id, message, dedup_key, created_at)"
                     + " VALUES (?,?,?,?,?,?)")) {
            ps.setString(1, "alice");
            ps.setString(2, NotificationType.RESCHEDULE.code());
            ps.setObject(3, null);
            ps.setString(4, "stale");
            ps.setString(5, "reschedule|alice|Math|" + TUESDAY.atTime(10, 0) + "|" + TUESDAY.atTime(11, 0));
            ps.setTimestamp(6, Timestamp.from(Instant.now()));
            ps.executeUpdate();
        }

        assertEquals(Outcome.DUPLICATE, engine.reconcile(ALICE, MATH));

        assertEquals(0, JdbcTestSupport.count(dataSource, "rescheduled_class"));
        assertEquals(0, JdbcTestSupport.count(dataSource, "class_assignment"));
        assertEquals(0, JdbcTestSupport.count(dataSource, "attendance"));
        assertEquals(1, JdbcTestSupport.count(dataSource, "notification"));
    }

    @Test
    void noSlotProducesNotificationOnly() throws Exception {
        JdbcTestSupport.enroll(dataSource, "alice", "Chemistry", TUE_10);
        JdbcTestSupport.enroll(dataSource, "alice", "Biology", TUE_14);

        assertEquals(Outcome.NO_SLOT, engine.reconcile(ALICE, MATH));

        assertEquals(0, JdbcTestSupport.count(dataSource, "rescheduled_class"));
        try (Connection conn = dataSource.getConnection()) {
            Notification note = gateway.listNotifications(conn, "alice", 1).get(0);
            assertEquals(NotificationType.NO_SLOT_AVAILABLE, note.type());
            assertTrue(note.message().contains("manual scheduling required"));
        }
    }
}
