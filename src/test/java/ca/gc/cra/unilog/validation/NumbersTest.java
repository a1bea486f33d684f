package ca.gc.cra.unilog.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class NumbersTest {

  @Test
  void requireRangeReturnsValueWithinBounds() {
    assertEquals(10, Numbers.requireRange("rotation.maxBackups", 10, 0, 64));
  }

  @Test
  void requireRangeNamesTheKey() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> Numbers.requireRange("rotation.maxBackups", 65, 0, 64));
    assertTrue(ex.getMessage().contains("rotation.maxBackups"));
  }

  @Test
  void requireNonNegativeRejectsNegative() {
    assertThrows(IllegalArgumentException.class, () -> Numbers.requireNonNegative("size", -1));
  }
}
