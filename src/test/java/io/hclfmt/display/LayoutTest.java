package io.hclfmt.display;

import static org.junit.jupiter.api.Assertions.*;

import io.hclfmt.HclException;
import io.hclfmt.lexer.Lexer;
import io.hclfmt.lexer.Token;
import io.hclfmt.lexer.TokenKind;
import org.junit.jupiter.api.Test;

class LayoutTest {

  private static String render(String src) throws HclException {
    return Layout.render(Lexer.tokenize(src, ""));
  }

  // =========================================================================
  // Spacing
  // =========================================================================

  @Test
  void operatorsAreSpaced() throws HclException {
    assertEquals("a = 1 + 2 * (3 - 4)", render("a=1+2*(3-4)"));
  }

  @Test
  void negationIsNotSpaced() throws HclException {
    assertEquals("a = -1\nb = 2 - -1\n", render("a = - 1\nb = 2- - 1\n"));
  }

  @Test
  void logicalNotIsNotSpaced() throws HclException {
    assertEquals("a = !b && !(c)\nd = !b\n", render("a = ! b&&! (c)\nd = !b\n"));
  }

  @Test
  void accessAndCalls() throws HclException {
    assertEquals("x = a.b[0].c\ny = f(a, b...)\n", render("x = a . b [0] . c\ny = f( a,b ... )\n"));
  }

  @Test
  void braces() throws HclException {
    assertEquals("a = { b = 1 }\nc = {}\n", render("a = {b = 1}\nc = { }\n"));
  }

  @Test
  void forKeywordIn() throws HclException {
    assertEquals("a = [for x in [1] : x]\n", render("a = [for x in [1]: x]\n"));
  }

  @Test
  void templateTextIsNotTouched() throws HclException {
    assertEquals("a = \"  x  ${b}  \"\n", render("a =   \"  x  ${ b }  \"\n"));
  }

  @Test
  void stripMarkersStayAttached() throws HclException {
    assertEquals("a = \" ${~b~} \"\n", render("a = \" ${~ b ~} \"\n"));
  }

  // =========================================================================
  // Indentation
  // =========================================================================

  @Test
  void nestedBlocks() throws HclException {
    assertEquals(
        "a {\n  b \"l\" {\n    c = 1\n  }\n}\n", render("a {\n      b \"l\" {\nc = 1\n}\n   }\n"));
  }

  @Test
  void blankLinesHaveNoIndentation() throws HclException {
    assertEquals("a {\n\n  b = 1\n}\n", render("a {\n    \n b = 1\n}\n"));
  }

  @Test
  void balancedLinesKeepTheCurrentLevel() throws HclException {
    assertEquals("a = [\n  1,\n  ] + [\n  2,\n]\n", render("a = [\n1,\n] + [\n2,\n]\n"));
  }

  @Test
  void heredocContentIsNotIndented() throws HclException {
    assertEquals(
        "b {\n  x = <<EOT\n  hi\nEOT\n}\n", render("b {\nx = <<EOT\n  hi\nEOT\n}\n"));
  }

  // =========================================================================
  // Alignment
  // =========================================================================

  @Test
  void equalsSignsAreAligned() throws HclException {
    assertEquals("a   = 1\nbbb = 2\n", render("a = 1\nbbb = 2\n"));
  }

  @Test
  void multiLineValuesBreakAlignment() throws HclException {
    assertEquals(
        "a = 1\nbbb = [\n  1,\n]\ncc = 2\n", render("a = 1\nbbb = [\n1,\n]\ncc = 2\n"));
  }

  @Test
  void blankLinesBreakAlignment() throws HclException {
    assertEquals("a = 1\n\nbbb = 2\n", render("a = 1\n\nbbb = 2\n"));
  }

  @Test
  void trailingCommentsAreAligned() throws HclException {
    assertEquals("a    = 1 # x\nlong = 2 # y\n", render("a = 1 # x\nlong = 2    # y\n"));
  }

  // =========================================================================
  // Single token decisions
  // =========================================================================

  @Test
  void spaceAfter() {
    Token ident = Token.synthetic(TokenKind.IDENT, "f");
    Token open = Token.synthetic(TokenKind.OPAREN, "(");
    Token comma = Token.comma();
    Token minus = Token.synthetic(TokenKind.MINUS, "-");
    Token number = Token.synthetic(TokenKind.NUMBER_LIT, "1");

    assertFalse(Layout.spaceAfter(ident, null, open));
    assertFalse(Layout.spaceAfter(ident, null, comma));
    assertTrue(Layout.spaceAfter(comma, ident, number));
    assertFalse(Layout.spaceAfter(minus, null, number));
    assertFalse(Layout.spaceAfter(minus, open, number));
    assertTrue(Layout.spaceAfter(minus, number, number));
    assertFalse(Layout.spaceAfter(Token.synthetic(TokenKind.BANG, "!"), comma, ident));
    assertFalse(Layout.spaceAfter(number, null, Token.newline()));
  }
}
