package mailsched;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class FingerprintTest {

  private static final Instant AT = Instant.parse("2024-05-01T08:00:00Z");

  @Test
  void derivedFromIdAndTimestamp() {
    Fingerprint fingerprint = Fingerprint.of("<m1@example.edu>", AT);

    assertEquals(Fingerprint.of("<m1@example.edu>", AT), fingerprint);
    assertEquals(64, fingerprint.value().length());
    assertTrue(fingerprint.value().matches("[0-9a-f]+"));
  }

  @Test
  void differsWhenEitherPartDiffers() {
    Fingerprint base = Fingerprint.of("m1", AT);

    assertNotEquals(base, Fingerprint.of("m2", AT));
    assertNotEquals(base, Fingerprint.of("m1", AT.plusMillis(1)));
  }

  @Test
  void rejectsEmptyValue() {
    assertThrows(IllegalArgumentException.class, () -> new Fingerprint(""));
    assertThrows(NullPointerException.class, () -> Fingerprint.of(null, AT));
  }
}
