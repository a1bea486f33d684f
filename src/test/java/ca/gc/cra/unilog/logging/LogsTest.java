package ca.gc.cra.unilog.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class LogsTest {

  @Test
  void shortValuesAreUnchanged() {
    assertEquals("hello", Logs.truncate("hello", 16));
    assertEquals("<null>", Logs.truncate(null, 16));
  }

  @Test
  void longValuesAreCutOnByteBudget() {
    String truncated = Logs.truncate("abcdefghij", 4);

    assertEquals("abcd... (truncated, 4 of 10)", truncated);
  }

  @Test
  void multiByteCharactersAreNotSplit() {
    String truncated = Logs.truncate("ééé", 3);

    assertTrue(truncated.startsWith("é..."), truncated);
  }

  @Test
  void rejectsNonPositiveBudget() {
    assertThrows(IllegalArgumentException.class, () -> Logs.truncate("x", 0));
  }
}
