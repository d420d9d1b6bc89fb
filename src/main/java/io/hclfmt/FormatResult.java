package io.hclfmt;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFileAttributeView;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Objects;
import java.util.Set;

/**
 * The formatted contents of a file that was not already formatted.
 *
 * <p>Producing a result never changes the file; call {@link #save()} to do that.
 */
public final class FormatResult {
  private static final Set<PosixFilePermission> NEW_FILE_PERMISSIONS =
      PosixFilePermissions.fromString("rw-r--r--");

  private final Path path;
  private final String formatted;

  /**
   * Creates a result.
   *
   * @param path the file that was formatted
   * @param formatted its contents after formatting
   */
  public FormatResult(Path path, String formatted) {
    this.path = Objects.requireNonNull(path, "path");
    this.formatted = Objects.requireNonNull(formatted, "formatted");
  }

  /**
   * Returns the absolute path of the original file.
   *
   * @return the file path
   */
  public Path path() {
    return path;
  }

  /**
   * Returns the contents of the original file after formatting.
   *
   * @return the formatted text
   */
  public String formatted() {
    return formatted;
  }

  /**
   * Replaces the contents of the original file with the formatted text.
   *
   * <p>The text is written to a temporary file next to the original, which is then moved
   * over it, so the file is never left half written. Existing POSIX permissions are kept;
   * a new file gets {@code rw-r--r--}.
   *
   * @throws HclException if the file cannot be written
   */
  public void save() throws HclException {
    Path dir = path.toAbsolutePath().getParent();
    Path tmp = null;
    try {
      tmp = Files.createTempFile(dir, "." + path.getFileName(), ".tmp");
      Files.writeString(tmp, formatted, StandardCharsets.UTF_8);
      copyPermissions(tmp);
      try {
        Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
      } catch (AtomicMoveNotSupportedException e) {
        Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
      }
    } catch (IOException e) {
      if (tmp != null) {
        try {
          Files.deleteIfExists(tmp);
        } catch (IOException cleanup) {
          e.addSuppressed(cleanup);
        }
      }
      throw HclException.io("saving", path, e);
    }
  }

  private void copyPermissions(Path tmp) throws IOException {
    if (!Files.getFileStore(tmp).supportsFileAttributeView(PosixFileAttributeView.class)) {
      return;
    }
    Set<PosixFilePermission> perms =
        Files.exists(path) ? Files.getPosixFilePermissions(path) : NEW_FILE_PERMISSIONS;
    Files.setPosixFilePermissions(tmp, perms);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof FormatResult other)) {
      return false;
    }
    return path.equals(other.path) && formatted.equals(other.formatted);
  }

  @Override
  public int hashCode() {
    return Objects.hash(path, formatted);
  }

  @Override
  public String toString() {
    return "FormatResult[" + path + "]";
  }
}
