package io.hclfmt;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/** Exception thrown when HCL sources cannot be parsed, read, or written. */
public final class HclException extends Exception {
  /** The error kind. */
  private final ErrorKind kind;

  /** The name of the file the error refers to, if any. */
  private final String filename;

  /** The source span where the error occurred. */
  private final Span span;

  /** The original input string. */
  private final String input;

  /** The underlying errors of an aggregated failure. */
  private final List<HclException> errors;

  private HclException(
      ErrorKind kind,
      String message,
      String filename,
      Span span,
      String input,
      List<HclException> errors,
      Throwable cause) {
    super(message, cause);
    this.kind = kind;
    this.filename = filename;
    this.span = span;
    this.input = input;
    this.errors = errors;
  }

  /**
   * Creates a new syntax error.
   *
   * @param message the error message
   * @param filename the name of the file being parsed, may be empty
   * @param span the location of the error in the input
   * @param input the original input string
   * @return a new HclException for a syntax error
   */
  public static HclException syntax(String message, String filename, Span span, String input) {
    return new HclException(ErrorKind.SYNTAX, message, filename, span, input, List.of(), null);
  }

  /**
   * Creates a new I/O error.
   *
   * @param message what was being attempted
   * @param path the file involved
   * @param cause the underlying I/O failure
   * @return a new HclException for an I/O error
   */
  public static HclException io(String message, Path path, IOException cause) {
    return new HclException(
        ErrorKind.IO,
        message + " " + path + ": " + cause.getMessage(),
        path.toString(),
        null,
        null,
        List.of(),
        cause);
  }

  /**
   * Creates an aggregated error for a tree formatting pass.
   *
   * @param dir the root directory of the pass
   * @param errors every error collected during the pass
   * @return a new HclException wrapping all of them
   */
  public static HclException formatTree(Path dir, List<HclException> errors) {
    StringBuilder sb = new StringBuilder();
    sb.append(errors.size()).append(errors.size() == 1 ? " error" : " errors");
    sb.append(" formatting ").append(dir);
    for (HclException e : errors) {
      sb.append("\n  ").append(e.getMessage().replace("\n", "\n  "));
    }
    return new HclException(
        ErrorKind.FORMAT_TREE,
        sb.toString(),
        dir.toString(),
        null,
        null,
        List.copyOf(errors),
        null);
  }

  /**
   * Returns the kind of error.
   *
   * @return the error kind
   */
  public ErrorKind kind() {
    return kind;
  }

  /**
   * Returns the file the error refers to, if available.
   *
   * @return the filename, or empty if not available
   */
  public Optional<String> filename() {
    return Optional.ofNullable(filename).filter(s -> !s.isEmpty());
  }

  /**
   * Returns the span where the error occurred, if available.
   *
   * @return the span, or empty if not available
   */
  public Optional<Span> span() {
    return Optional.ofNullable(span);
  }

  /**
   * Returns the original input string, if available.
   *
   * @return the input, or empty if not available
   */
  public Optional<String> input() {
    return Optional.ofNullable(input);
  }

  /**
   * Returns the errors aggregated by a {@link ErrorKind#FORMAT_TREE} failure.
   *
   * @return the underlying errors, empty for other kinds
   */
  public List<HclException> errors() {
    return errors;
  }

  /**
   * Formats a rich error message with the offending source line and an underline.
   *
   * <p>For syntax errors with span and input, produces output like:
   *
   * <pre>
   * stack.tm:3:7: error: unexpected character '@'
   *   a = [@]
   *        ^
   * </pre>
   *
   * <p>Aggregated errors render each underlying error in turn.
   *
   * @return a formatted error message
   */
  public String displayRich() {
    if (kind == ErrorKind.SYNTAX && span != null && input != null) {
      Span.Position pos = span.startIn(input);
      int lineEnd = input.indexOf('\n', pos.lineOffset());
      String line = input.substring(pos.lineOffset(), lineEnd < 0 ? input.length() : lineEnd);

      StringBuilder sb = new StringBuilder();
      filename().ifPresent(f -> sb.append(f).append(':'));
      sb.append(pos.line()).append(':').append(pos.column()).append(": ");
      sb.append("error: ").append(getMessage()).append("\n");
      sb.append("  ").append(line).append("\n");

      int width = Math.min(span.length(), Math.max(1, line.length() - pos.column() + 1));
      sb.append(" ".repeat(pos.column() + 1));
      sb.append("^".repeat(width));
      return sb.toString();
    }

    if (kind == ErrorKind.FORMAT_TREE && !errors.isEmpty()) {
      StringBuilder sb = new StringBuilder();
      for (HclException e : errors) {
        if (sb.length() > 0) {
          sb.append("\n");
        }
        sb.append(e.displayRich());
      }
      return sb.toString();
    }

    return "error: " + getMessage();
  }
}
