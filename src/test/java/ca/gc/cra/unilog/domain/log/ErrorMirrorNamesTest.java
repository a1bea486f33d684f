package ca.gc.cra.unilog.domain.log;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

class ErrorMirrorNamesTest {

  @Test
  void insertsSuffixBeforeExtension() {
    assertEquals("service_error.log", ErrorMirrorNames.deriveErrorFileName("service.log"));
    assertEquals("app_error.log", ErrorMirrorNames.deriveErrorFileName("app.log"));
  }

  @Test
  void appendsSuffixWithoutExtension() {
    assertEquals("service_error", ErrorMirrorNames.deriveErrorFileName("service"));
  }

  @Test
  void onlyLastExtensionCounts() {
    assertEquals("app.2025_error.log", ErrorMirrorNames.deriveErrorFileName("app.2025.log"));
  }

  @Test
  void leadingDotFileKeepsWholeNameAsBase() {
    assertEquals(".log_error", ErrorMirrorNames.deriveErrorFileName(".log"));
  }
}
