package mailsched.model;

import java.time.LocalDateTime;

/**
 * Persisted interview record. {@code (studentId, company, datetime)} is unique.
 *
 * @param id       store-assigned id, {@code 0} for a record that has not been inserted yet
 */
public record CompanyDrive(
    long id,
    String studentId,
    String company,
    DriveStage stage,
    LocalDateTime datetime,
    DriveStatus status
) {

  public CompanyDrive withId(long newId) {
    return new CompanyDrive(newId, studentId, company, stage, datetime, status);
  }
}
