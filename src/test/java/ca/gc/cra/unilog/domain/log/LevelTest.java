package ca.gc.cra.unilog.domain.log;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class LevelTest {

  @Test
  void parseIsCaseInsensitiveAndAcceptsWarning() {
    assertEquals(Level.DEBUG, Level.parse("DEBUG"));
    assertEquals(Level.WARN, Level.parse("Warning"));
    assertEquals(Level.WARN, Level.parse(" warn "));
    assertEquals(Level.FATAL, Level.parse("fatal"));
  }

  @Test
  void unknownLevelsFallBackToInfo() {
    assertEquals(Level.INFO, Level.parse("bogus"));
    assertEquals(Level.INFO, Level.parse(null));
    assertEquals(Level.INFO, Level.parse(""));
    assertTrue(Level.tryParse("bogus").isEmpty());
  }

  @Test
  void orderingIsTotal() {
    assertTrue(Level.ERROR.isAtLeast(Level.WARN));
    assertTrue(Level.ERROR.isAtLeast(Level.ERROR));
    assertFalse(Level.INFO.isAtLeast(Level.WARN));
    assertTrue(Level.FATAL.isAtLeast(Level.DEBUG));
  }
}
