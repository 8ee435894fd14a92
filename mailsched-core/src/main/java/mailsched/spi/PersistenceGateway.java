package mailsched.spi;

import mailsched.model.AttendanceStatus;
import mailsched.model.Booking;
import mailsched.model.CompanyDrive;
import mailsched.model.Notification;
import mailsched.model.RescheduledClass;
import mailsched.model.TimeWindow;
import mailsched.model.WeeklySlot;

import java.sql.Connection;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Durable store for drives, rescheduled classes, assignments, attendance and notifications.
 *
 * <p>All methods receive an explicit {@link Connection} so the caller controls transaction
 * boundaries: the reconciliation engine composes several calls into one atomic unit of
 * work per processed message. Implementations live in the {@code mailsched-jdbc} module.
 *
 * <p>Writes that would violate a natural key throw {@link PersistenceConflictException};
 * any other backend failure surfaces as an unchecked exception from the implementation.
 *
 * @see mailsched.jdbc.store.AbstractJdbcPersistenceGateway
 */
public interface PersistenceGateway {

    /**
     * Looks up a drive by its natural key.
     */
    Optional<CompanyDrive> findCompanyDrive(Connection conn, String studentId, String company,
        LocalDateTime datetime);

    /**
     * Inserts the drive unless one with the same {@code (studentId, company, datetime)} exists.
     *
     * @return the stored drive, flagged {@code created} when this call inserted it
     * @throws PersistenceConflictException if a concurrent writer inserted the same key
     */
    Upserted<CompanyDrive> upsertCompanyDrive(Connection conn, CompanyDrive drive);

    /**
     * Looks up a rescheduled class by {@code (subject, slotId, date)}.
     */
    Optional<RescheduledClass> findRescheduledClass(Connection conn, String subject, long slotId,
        LocalDate date);

    /**
     * Inserts the class unless one with the same {@code (subject, slotId, date)} exists.
     *
     * @return the stored class, flagged {@code created} when this call inserted it
     * @throws PersistenceConflictException if a concurrent writer inserted the same key
     */
    Upserted<RescheduledClass> upsertRescheduledClass(Connection conn, RescheduledClass rescheduledClass);

    /**
     * Finds a pending class of {@code subject} that was created for exactly {@code request}.
     */
    Optional<RescheduledClass> findPendingClassForRequest(Connection conn, String subject, TimeWindow request);

    /**
     * Adds a student to a class.
     *
     * @throws PersistenceConflictException if the student is already assigned
     */
    void assignStudent(Connection conn, long rescheduledClassId, String studentId);

    boolean isAssigned(Connection conn, long rescheduledClassId, String studentId);

    /**
     * Number of students assigned to a class.
     */
    int countAssignments(Connection conn, long rescheduledClassId);

    void insertAttendance(Connection conn, String studentId, long rescheduledClassId, AttendanceStatus status);

    /**
     * Appends a notification.
     *
     * @return the notification with its store-assigned id
     * @throws PersistenceConflictException if a notification with the same dedup key exists
     */
    Notification insertNotification(Connection conn, Notification notification);

    /**
     * All predefined weekly slots, ordered by slot id.
     */
    List<WeeklySlot> listWeeklySlots(Connection conn);

    /**
     * Assignment counts per slot occurrence for pending classes dated in
     * {@code [from, toExclusive)}. Implementations should lock the counted rows
     * for the rest of the transaction where the database supports it.
     */
    List<Booking> loadBookings(Connection conn, LocalDate from, LocalDate toExclusive);

    /**
     * The student's regular weekly timetable (slots of subjects the student is enrolled in).
     */
    List<WeeklySlot> loadStudentCommitments(Connection conn, String studentId);

    /**
     * Pending rescheduled classes the student is assigned to.
     */
    List<RescheduledClass> loadStudentAssignments(Connection conn, String studentId);

    /**
     * Dashboard read accessor: the student's notifications, newest first.
     */
    default List<Notification> listNotifications(Connection conn, String studentId, int limit) {
        return List.of();
    }
}
