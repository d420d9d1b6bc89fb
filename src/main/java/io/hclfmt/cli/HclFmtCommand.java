package io.hclfmt.cli;

import io.hclfmt.FormatResult;
import io.hclfmt.Hcl;
import io.hclfmt.HclException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.core.config.Configurator;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

/**
 * Formats the configuration files of a directory tree.
 *
 * <p>Prints the files whose formatting changed, relative to the {@code -C} directory. With
 * {@code --check} nothing is written and the exit code tells whether files need formatting.
 */
@Command(
    name = "hclfmt",
    mixinStandardHelpOptions = true,
    version = "hclfmt 0.1.0",
    description = "Formats the HCL configuration files of a directory tree.")
public class HclFmtCommand implements Callable<Integer> {
  private static final Logger logger = LogManager.getLogger(HclFmtCommand.class);

  @Spec CommandSpec spec;

  @Option(
      names = "--check",
      description = "Only list the files that are not formatted; exit with 1 if there are any.")
  boolean check;

  @Option(
      names = {"-C", "--chdir"},
      paramLabel = "DIR",
      defaultValue = ".",
      description = "Directory to format (default: ${DEFAULT-VALUE}).")
  Path dir;

  @Option(
      names = "--log-level",
      paramLabel = "LEVEL",
      description = "Log level: off, error, warn, info, debug or trace.")
  String logLevel;

  @Override
  public Integer call() {
    if (logLevel != null) {
      Configurator.setRootLevel(Level.toLevel(logLevel, Level.WARN));
    }

    PrintWriter out = spec.commandLine().getOut();
    PrintWriter err = spec.commandLine().getErr();
    Path root = dir.toAbsolutePath().normalize();

    List<FormatResult> results;
    try {
      results = Hcl.formatTree(root);
    } catch (HclException e) {
      err.println(e.displayRich());
      err.flush();
      return 1;
    }

    for (FormatResult result : results) {
      out.println(root.relativize(result.path()));
      if (check) {
        continue;
      }
      try {
        result.save();
      } catch (HclException e) {
        err.println(e.displayRich());
        err.flush();
        return 1;
      }
      logger.debug("saved {}", result.path());
    }
    out.flush();

    if (check && !results.isEmpty()) {
      return 1;
    }
    return 0;
  }

  /**
   * Runs the command and exits with its exit code.
   *
   * @param args the command line arguments
   */
  public static void main(String[] args) {
    System.exit(new CommandLine(new HclFmtCommand()).execute(args));
  }
}
