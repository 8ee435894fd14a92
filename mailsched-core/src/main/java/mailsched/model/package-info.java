/**
 * Immutable domain types: extracted {@linkplain mailsched.model.ScheduleEvent events},
 * {@linkplain mailsched.model.WeeklySlot weekly slots} and the persisted rows the
 * reconciliation engine produces.
 */
package mailsched.model;
