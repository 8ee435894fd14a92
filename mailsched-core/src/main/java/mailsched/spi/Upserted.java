package mailsched.spi;

import java.util.Objects;

/**
 * Result of an insert-unless-present write.
 *
 * @param row     the stored row (existing or newly inserted)
 * @param created {@code true} if this call inserted the row
 */
public record Upserted<T>(T row, boolean created) {

  public Upserted {
    Objects.requireNonNull(row, "row");
  }

  public static <T> Upserted<T> created(T row) {
    return new Upserted<>(row, true);
  }

  public static <T> Upserted<T> existing(T row) {
    return new Upserted<>(row, false);
  }
}
