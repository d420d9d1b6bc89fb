package io.hclfmt.format;

import static org.junit.jupiter.api.Assertions.*;

import io.hclfmt.HclException;
import io.hclfmt.format.Formatted.Stop;
import io.hclfmt.lexer.Lexer;
import io.hclfmt.lexer.Token;
import java.util.List;
import org.junit.jupiter.api.Test;

/** Unit tests for list literal rewriting. */
public class ListFormatterTest {

  private static List<Token> tokens(String src) throws HclException {
    return Lexer.tokenize(src, "");
  }

  @Test
  void testOneElementPerLine() throws HclException {
    Formatted f = ListFormatter.format(tokens("[1, \"two\", c.d]"), false);
    assertEquals("[\n1,\n\"two\",\nc.d,\n]", Token.textOf(f.tokens()));
    assertEquals(Stop.END_OF_SPAN, f.stop());
  }

  @Test
  void testEmptyList() throws HclException {
    Formatted f = ListFormatter.format(tokens("[\n\n]"), false);
    assertEquals("[\n]", Token.textOf(f.tokens()));
    assertEquals(4, f.consumed());
  }

  @Test
  void testRepeatedCommasAreDropped() throws HclException {
    Formatted f = ListFormatter.format(tokens("[1,,2,]"), false);
    assertEquals("[\n1,\n2,\n]", Token.textOf(f.tokens()));
  }

  @Test
  void testCommentsAreKept() throws HclException {
    Formatted f = ListFormatter.format(tokens("[\n# first\n1, // one\n/* two */ 2\n]"), false);
    assertEquals("[\n# first\n1,\n// one\n/* two */2,\n]", Token.textOf(f.tokens()));
  }

  @Test
  void testHeredocElement() throws HclException {
    Formatted f = ListFormatter.format(tokens("[<<EOT\nx\nEOT\n]"), false);
    assertEquals("[\n<<EOT\nx\nEOT\n,\n]", Token.textOf(f.tokens()));
  }

  @Test
  void testOperatorAfterList() throws HclException {
    List<Token> src = tokens("[1] == [2]");
    Formatted f = ListFormatter.format(src, false);
    assertEquals("[\n1,\n]==[\n2,\n]", Token.textOf(f.tokens()));
    assertEquals(src.size(), f.consumed());
  }

  @Test
  void testIndexAccessAfterList() throws HclException {
    List<Token> src = tokens("[\"a\", \"b\"][1].c");
    Formatted f = ListFormatter.format(src, false);
    assertEquals("[\n\"a\",\n\"b\",\n][1].c", Token.textOf(f.tokens()));
    assertEquals(src.size(), f.consumed());
  }

  @Test
  void testIndexAccessOnNextLine() throws HclException {
    Formatted f = ListFormatter.format(tokens("[1]\n[0]"), false);
    assertEquals("[\n1,\n][0]", Token.textOf(f.tokens()));
  }

  @Test
  void testObjectKeyAfterList() throws HclException {
    Formatted f = ListFormatter.format(tokens("[1]\nb = 2"), true);
    assertEquals("[\n1,\n]\n", Token.textOf(f.tokens()));
    assertEquals(4, f.consumed());
    assertEquals(Stop.PENDING, f.stop());
  }

  @Test
  void testListKeyAfterListInsideObject() throws HclException {
    Formatted f = ListFormatter.format(tokens("[1]\n[2] = 3"), true);
    assertEquals("[\n1,\n]\n", Token.textOf(f.tokens()));
    assertEquals(Stop.PENDING, f.stop());
  }

  @Test
  void testStopsAtEnclosingTokens() throws HclException {
    assertEquals(Stop.ELEMENT_SEPARATOR, ListFormatter.format(tokens("[1], 2"), false).stop());
    assertEquals(Stop.ENCLOSING_LIST_CLOSED, ListFormatter.format(tokens("[1]]"), false).stop());
    assertEquals(Stop.PENDING, ListFormatter.format(tokens("[1])"), false).stop());
  }

  @Test
  void testTrailingCommentAfterList() throws HclException {
    Formatted f = ListFormatter.format(tokens("[1] # c\n"), false);
    assertEquals("[\n1,\n]# c\n", Token.textOf(f.tokens()));
    assertEquals(Stop.END_OF_SPAN, f.stop());
  }

  @Test
  void testUnclosedList() throws HclException {
    assertThrows(IllegalStateException.class, () -> ListFormatter.format(tokens("[1, 2"), false));
    assertThrows(IllegalStateException.class, () -> ListFormatter.format(tokens("["), false));
  }
}
