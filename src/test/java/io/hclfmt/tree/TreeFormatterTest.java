package io.hclfmt.tree;

import static org.junit.jupiter.api.Assertions.*;

import io.hclfmt.ErrorKind;
import io.hclfmt.FormatResult;
import io.hclfmt.Hcl;
import io.hclfmt.HclException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/** Tests for formatting whole directory trees. */
public class TreeFormatterTest {
  static final String UNFORMATTED =
      "\nglobals {\nname = \"name\"\n\t\tdescription = \"desc\"\n\ttest = true\n\t}\n\t";
  static final String FORMATTED =
      "\nglobals {\n  name        = \"name\"\n  description = \"desc\"\n  test        = true\n}\n";

  @TempDir Path root;

  private void write(String relative, String contents) throws IOException {
    Path file = root.resolve(relative);
    Files.createDirectories(file.getParent());
    Files.writeString(file, contents);
  }

  private List<String> relativePaths(List<FormatResult> results) {
    return results.stream()
        .map(r -> root.toAbsolutePath().normalize().relativize(r.path()).toString())
        .collect(Collectors.toList());
  }

  @Test
  void testEmptyTree() throws HclException {
    assertTrue(Hcl.formatTree(root).isEmpty());
  }

  @Test
  void testFilesBeforeSubDirectories() throws IOException, HclException {
    write("globals.tm", UNFORMATTED);
    write("stacks/stack-2/globals.tm", UNFORMATTED);
    write("stacks/stack-1/globals.tm", UNFORMATTED);
    write("stacks/globals.tm", UNFORMATTED);
    write("another-stacks/globals.tm.hcl", UNFORMATTED);

    List<FormatResult> results = Hcl.formatTree(root);

    assertEquals(
        List.of(
            "globals.tm",
            "another-stacks/globals.tm.hcl",
            "stacks/globals.tm",
            "stacks/stack-1/globals.tm",
            "stacks/stack-2/globals.tm"),
        relativePaths(results));
    for (FormatResult result : results) {
      assertTrue(result.path().isAbsolute());
      assertEquals(FORMATTED, result.formatted());
    }
  }

  @Test
  void testFormatTreeDoesNotWrite() throws IOException, HclException {
    write("globals.tm", UNFORMATTED);
    assertEquals(1, Hcl.formatTree(root).size());
    assertEquals(UNFORMATTED, Files.readString(root.resolve("globals.tm")));
  }

  @Test
  void testFormattedFilesAreSkipped() throws IOException, HclException {
    write("a.tm", FORMATTED);
    write("b.tm", UNFORMATTED);
    assertEquals(List.of("b.tm"), relativePaths(Hcl.formatTree(root)));
  }

  @Test
  void testHiddenDirectoriesAndOtherFilesAreSkipped() throws IOException, HclException {
    write(".hidden/globals.tm", UNFORMATTED);
    write("stack/.terraform/globals.tm", UNFORMATTED);
    write("main.tf", UNFORMATTED);
    write("notes.hcl", UNFORMATTED);
    write("stack/main.tm", UNFORMATTED);

    assertEquals(List.of("stack/main.tm"), relativePaths(Hcl.formatTree(root)));
  }

  @Test
  void testCustomSuffixes() throws IOException, HclException {
    write("main.tf", UNFORMATTED);
    write("globals.tm", UNFORMATTED);

    assertEquals(List.of("main.tf"), relativePaths(Hcl.formatTree(root, Set.of(".tf"))));
  }

  @Test
  void testErrorsAreAggregated() throws IOException {
    write("bad.tm", "a = [\n");
    write("good.tm", UNFORMATTED);
    write("sub/deeper/bad.tm.hcl", "a = 1\na = 2\n");

    HclException e = assertThrows(HclException.class, () -> Hcl.formatTree(root));
    assertEquals(ErrorKind.FORMAT_TREE, e.kind());
    assertEquals(2, e.errors().size());
    for (HclException err : e.errors()) {
      assertEquals(ErrorKind.SYNTAX, err.kind());
    }
    assertTrue(e.errors().get(0).filename().orElseThrow().endsWith("bad.tm"));
    assertTrue(e.errors().get(1).filename().orElseThrow().endsWith("bad.tm.hcl"));
    assertTrue(e.getMessage().startsWith("2 errors formatting "));
    assertTrue(e.displayRich().contains("error: unclosed '['"));
    assertTrue(e.displayRich().contains("error: attribute redefined"));
  }

  @Test
  void testMissingDirectory() {
    HclException e =
        assertThrows(HclException.class, () -> Hcl.formatTree(root.resolve("missing")));
    assertEquals(ErrorKind.FORMAT_TREE, e.kind());
    assertEquals(ErrorKind.IO, e.errors().get(0).kind());
  }

  @Test
  void testSaveMakesTreeFormatted() throws IOException, HclException {
    write("globals.tm", UNFORMATTED);
    write("stacks/globals.tm.hcl", UNFORMATTED);

    for (FormatResult result : new TreeFormatter(Hcl.DEFAULT_SUFFIXES).format(root)) {
      result.save();
    }

    assertEquals(FORMATTED, Files.readString(root.resolve("globals.tm")));
    assertEquals(FORMATTED, Files.readString(root.resolve("stacks/globals.tm.hcl")));
    assertTrue(Hcl.formatTree(root).isEmpty());
  }
}
