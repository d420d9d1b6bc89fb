package io.hclfmt;

import io.hclfmt.ast.Body;
import io.hclfmt.display.Layout;
import io.hclfmt.format.BodyFormatter;
import io.hclfmt.parser.Parser;
import io.hclfmt.tree.TreeFormatter;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

/**
 * The main entry point for formatting HCL configuration.
 *
 * <p>Example usage:
 *
 * <pre>{@code
 * String formatted = Hcl.format("a = [1,2,3]\n", "main.tm");
 * // a = [
 * //   1,
 * //   2,
 * //   3,
 * // ]
 *
 * for (FormatResult result : Hcl.formatTree(Path.of("stacks"))) {
 *     result.save();
 * }
 * }</pre>
 */
public final class Hcl {
  /** The file name suffixes of configuration files found by {@link #formatTree(Path)}. */
  public static final Set<String> DEFAULT_SUFFIXES = Set.of(".tm", ".tm.hcl");

  private Hcl() {}

  /**
   * Formats the given source code.
   *
   * <p>Every list literal is rewritten with one element per line, each followed by a comma,
   * and the result is laid out canonically.
   *
   * @param source the HCL source
   * @param filename the name used in error messages, may be empty
   * @return the formatted source
   * @throws HclException if the source is not valid HCL
   */
  public static String format(String source, String filename) throws HclException {
    Body body = Parser.parse(source, filename);
    return Layout.render(BodyFormatter.format(body).tokens());
  }

  /**
   * Formats the given source code without rewriting lists; only blanks between tokens and
   * indentation change.
   *
   * @param source the HCL source
   * @param filename the name used in error messages, may be empty
   * @return the formatted source
   * @throws HclException if the source is not valid HCL
   */
  public static String formatWhitespace(String source, String filename) throws HclException {
    return Layout.render(Parser.parse(source, filename).tokens());
  }

  /**
   * Validates HCL source without throwing.
   *
   * @param source the HCL source
   * @return true if the source parses
   */
  public static boolean validate(String source) {
    try {
      Parser.parse(source, "");
      return true;
    } catch (HclException e) {
      return false;
    }
  }

  /**
   * Formats all configuration files of a directory tree, without writing anything.
   *
   * <p>Sub directories whose name starts with "." are skipped. Files that are already
   * formatted are left out of the result, so an empty list means nothing needs formatting.
   *
   * @param dir the root of the tree
   * @return the results for files whose formatting changed
   * @throws HclException of kind {@link ErrorKind#FORMAT_TREE} if any file could not be
   *     read or parsed; no results are returned in that case
   */
  public static List<FormatResult> formatTree(Path dir) throws HclException {
    return formatTree(dir, DEFAULT_SUFFIXES);
  }

  /**
   * Formats the files of a directory tree whose names end with one of the given suffixes.
   *
   * @param dir the root of the tree
   * @param suffixes the recognized file name suffixes
   * @return the results for files whose formatting changed
   * @throws HclException if any file could not be read or parsed
   */
  public static List<FormatResult> formatTree(Path dir, Set<String> suffixes)
      throws HclException {
    return new TreeFormatter(suffixes).format(dir);
  }
}
