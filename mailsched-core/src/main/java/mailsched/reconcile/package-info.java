/**
 * Event-to-store reconciliation and slot allocation.
 *
 * <p>{@link mailsched.reconcile.ReconciliationEngine} plans a
 * {@link mailsched.reconcile.WriteSet} from the current store state and applies it in one
 * transaction. {@link mailsched.reconcile.SlotAllocator} is a pure function over weekly
 * slots, current bookings and the student's timetable.
 */
package mailsched.reconcile;
