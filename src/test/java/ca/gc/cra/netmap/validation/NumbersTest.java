package ca.gc.cra.netmap.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Duration;
import org.junit.jupiter.api.Test;

class NumbersTest {

  @Test
  void requireRangeAcceptsBounds() {
    assertEquals(1, Numbers.requireRange("attempts", 1, 1, 10));
    assertEquals(10, Numbers.requireRange("attempts", 10, 1, 10));
  }

  @Test
  void requireRangeRejectsOutside() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> Numbers.requireRange("attempts", 0, 1, 10));
    assertEquals("attempts must be between 1 and 10 (was 0)", ex.getMessage());
  }

  @Test
  void openUnitIntervalExcludesEndpoints() {
    assertEquals(0.5, Numbers.requireOpenUnitInterval("step", 0.5));
    assertThrows(IllegalArgumentException.class, () -> Numbers.requireOpenUnitInterval("step", 1.0));
    assertThrows(IllegalArgumentException.class, () -> Numbers.requireOpenUnitInterval("step", 0.0));
    assertThrows(IllegalArgumentException.class, () -> Numbers.requireOpenUnitInterval("step", Double.NaN));
  }

  @Test
  void unitIntervalIncludesEndpoints() {
    assertEquals(0.0, Numbers.requireUnitInterval("minConfidence", 0.0));
    assertEquals(1.0, Numbers.requireUnitInterval("minConfidence", 1.0));
    assertThrows(IllegalArgumentException.class, () -> Numbers.requireUnitInterval("minConfidence", 1.01));
  }

  @Test
  void requirePositiveRejectsZeroAndNull() {
    assertThrows(IllegalArgumentException.class, () -> Numbers.requirePositive("window", Duration.ZERO));
    assertThrows(IllegalArgumentException.class, () -> Numbers.requirePositive("window", null));
    assertEquals(Duration.ofSeconds(5), Numbers.requirePositive("window", Duration.ofSeconds(5)));
  }
}
