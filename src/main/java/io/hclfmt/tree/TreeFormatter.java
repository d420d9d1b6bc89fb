package io.hclfmt.tree;

import io.hclfmt.ErrorKind;
import io.hclfmt.FormatResult;
import io.hclfmt.Hcl;
import io.hclfmt.HclException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Computes the formatted contents of every configuration file in a directory tree.
 *
 * <p>Errors of single files do not stop the others from being formatted, but any error
 * makes the whole pass fail: callers never get results for part of a tree.
 */
public final class TreeFormatter {
  private static final Logger logger = LogManager.getLogger(TreeFormatter.class);

  private final Set<String> suffixes;

  /**
   * Creates a tree formatter.
   *
   * @param suffixes file name suffixes of the files to format, e.g. ".tm"
   */
  public TreeFormatter(Set<String> suffixes) {
    this.suffixes = Set.copyOf(suffixes);
  }

  /**
   * Formats the files of the directory and, recursively, of its non-hidden sub directories.
   *
   * @param dir the directory to start from
   * @return results for the files whose contents would change, files of a directory
   *     before those of its sub directories
   * @throws HclException aggregating every read and parse error of the tree
   */
  public List<FormatResult> format(Path dir) throws HclException {
    Path root = dir.toAbsolutePath().normalize();
    logger.debug("formatting tree {}", root);

    List<FormatResult> results = new ArrayList<>();
    List<HclException> errors = new ArrayList<>();

    List<Path> files;
    try {
      files = listConfigFiles(root);
    } catch (IOException e) {
      throw HclException.formatTree(
          root, List.of(HclException.io("listing configuration files of", root, e)));
    }

    for (Path file : files) {
      formatFile(file, results, errors);
    }

    List<Path> dirs;
    try {
      dirs = listSubDirs(root);
    } catch (IOException e) {
      errors.add(HclException.io("listing directories of", root, e));
      throw HclException.formatTree(root, errors);
    }

    for (Path sub : dirs) {
      logger.trace("recursively formatting {}", sub);
      try {
        results.addAll(format(sub));
      } catch (HclException e) {
        if (e.kind() == ErrorKind.FORMAT_TREE) {
          errors.addAll(e.errors());
        } else {
          errors.add(e);
        }
      }
    }

    if (!errors.isEmpty()) {
      throw HclException.formatTree(root, errors);
    }
    return results;
  }

  private void formatFile(Path file, List<FormatResult> results, List<HclException> errors) {
    logger.trace("reading {}", file);
    String current;
    try {
      current = Files.readString(file, StandardCharsets.UTF_8);
    } catch (IOException e) {
      logger.warn("cannot read {}: {}", file, e.getMessage());
      errors.add(HclException.io("reading", file, e));
      return;
    }

    String formatted;
    try {
      formatted = Hcl.format(current, file.toString());
    } catch (HclException e) {
      logger.warn("cannot format {}: {}", file, e.getMessage());
      errors.add(e);
      return;
    }

    if (current.equals(formatted)) {
      logger.trace("{} is already formatted", file);
      return;
    }
    logger.debug("{} needs formatting", file);
    results.add(new FormatResult(file, formatted));
  }

  private List<Path> listConfigFiles(Path dir) throws IOException {
    try (Stream<Path> entries = Files.list(dir)) {
      return entries
          .filter(Files::isRegularFile)
          .filter(p -> isConfigFile(p.getFileName().toString()))
          .sorted()
          .collect(Collectors.toList());
    }
  }

  private static List<Path> listSubDirs(Path dir) throws IOException {
    try (Stream<Path> entries = Files.list(dir)) {
      return entries
          .filter(Files::isDirectory)
          .filter(p -> !p.getFileName().toString().startsWith("."))
          .sorted()
          .collect(Collectors.toList());
    }
  }

  private boolean isConfigFile(String name) {
    for (String suffix : suffixes) {
      if (name.endsWith(suffix)) {
        return true;
      }
    }
    return false;
  }
}
