package io.hclfmt;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/** Tests for persisting formatted files. */
public class FormatResultTest {
  @TempDir Path dir;

  @Test
  void testSaveReplacesContents() throws IOException, HclException {
    Path file = dir.resolve("main.tm");
    Files.writeString(file, "a=1\n");

    new FormatResult(file, "a = 1\n").save();

    assertEquals("a = 1\n", Files.readString(file));
    try (Stream<Path> entries = Files.list(dir)) {
      assertEquals(1, entries.count(), "no temporary file is left behind");
    }
  }

  @Test
  void testSaveKeepsPermissions() throws IOException, HclException {
    if (!FileSystems.getDefault().supportedFileAttributeViews().contains("posix")) {
      return;
    }
    Path file = dir.resolve("main.tm");
    Files.writeString(file, "a=1\n");
    Files.setPosixFilePermissions(file, PosixFilePermissions.fromString("rw-rw-r--"));

    new FormatResult(file, "a = 1\n").save();

    assertEquals("rw-rw-r--", PosixFilePermissions.toString(Files.getPosixFilePermissions(file)));
  }

  @Test
  void testSaveNewFile() throws IOException, HclException {
    Path file = dir.resolve("new.tm");

    new FormatResult(file, "a = 1\n").save();

    assertEquals("a = 1\n", Files.readString(file));
    if (FileSystems.getDefault().supportedFileAttributeViews().contains("posix")) {
      assertEquals("rw-r--r--", PosixFilePermissions.toString(Files.getPosixFilePermissions(file)));
    }
  }

  @Test
  void testSaveIntoMissingDirectory() {
    Path file = dir.resolve("missing").resolve("main.tm");
    HclException e =
        assertThrows(HclException.class, () -> new FormatResult(file, "a = 1\n").save());
    assertEquals(ErrorKind.IO, e.kind());
    assertTrue(e.getMessage().startsWith("saving " + file));
    assertNotNull(e.getCause());
  }

  @Test
  void testAccessors() {
    Path file = dir.resolve("main.tm");
    FormatResult result = new FormatResult(file, "a = 1\n");
    assertEquals(file, result.path());
    assertEquals("a = 1\n", result.formatted());
    assertEquals(new FormatResult(file, "a = 1\n"), result);
  }
}
