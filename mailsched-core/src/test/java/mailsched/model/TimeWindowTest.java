package mailsched.model;

import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;

import static org.junit.jupiter.api.Assertions.*;

class TimeWindowTest {

  private static TimeWindow window(int startHour, int endHour) {
    return new TimeWindow(LocalDateTime.of(2024, 5, 14, startHour, 0), LocalDateTime.of(2024, 5, 14, endHour, 0));
  }

  @Test
  void overlapIsHalfOpen() {
    assertTrue(window(10, 12).overlaps(window(11, 13)));
    assertFalse(window(10, 11).overlaps(window(11, 12)));
    assertFalse(window(11, 12).overlaps(window(10, 11)));
  }

  @Test
  void distanceInEitherDirection() {
    assertEquals(0, window(10, 12).distanceMinutes(window(11, 13)));
    assertEquals(0, window(10, 11).distanceMinutes(window(11, 12)));
    assertEquals(180, window(9, 10).distanceMinutes(window(13, 14)));
    assertEquals(180, window(13, 14).distanceMinutes(window(9, 10)));
  }

  @Test
  void endMustFollowStart() {
    assertThrows(IllegalArgumentException.class, () -> window(10, 10));
    assertThrows(IllegalArgumentException.class, () -> window(11, 10));
  }
}
