package ca.gc.cra.unilog.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PathsTest {

  @TempDir Path tempDir;

  @Test
  void prepareWritableDirReturnsRealPathOfExistingDirectory() throws IOException {
    Path dir = Files.createDirectory(tempDir.resolve("existing"));
    assertEquals(dir.toRealPath(), Paths.prepareWritableDir(dir));
  }

  @Test
  void prepareWritableDirCreatesMissingParents() {
    Path dir = tempDir.resolve("a/b/c");
    Path prepared = Paths.prepareWritableDir(dir);
    assertTrue(Files.isDirectory(prepared));
  }

  @Test
  void prepareWritableDirRejectsRegularFile() throws IOException {
    Path file = Files.createFile(tempDir.resolve("plain.txt"));
    assertThrows(IllegalArgumentException.class, () -> Paths.prepareWritableDir(file));
  }

  @Test
  void prepareWritableDirRejectsDirectoryUnderAFile() throws IOException {
    Path file = Files.createFile(tempDir.resolve("blocker"));
    assertThrows(IllegalArgumentException.class, () -> Paths.prepareWritableDir(file.resolve("logs")));
  }
}
