package io.hclfmt.lexer;

import io.hclfmt.Span;
import java.util.List;

/**
 * Represents a lexed token.
 *
 * @param kind the type of token
 * @param text the original characters of the token
 * @param spacesBefore the number of blanks that preceded the token
 * @param span the location in the input, or null for tokens synthesized by the formatter
 */
public record Token(TokenKind kind, String text, int spacesBefore, Span span) {
  /** Creates a token read from the source. */
  public static Token of(TokenKind kind, String text, int spacesBefore, Span span) {
    return new Token(kind, text, spacesBefore, span);
  }

  /** Creates a token that does not exist in the source. */
  public static Token synthetic(TokenKind kind, String text) {
    return new Token(kind, text, 0, null);
  }

  /** Creates a synthesized line break. */
  public static Token newline() {
    return synthetic(TokenKind.NEWLINE, "\n");
  }

  /** Creates a synthesized comma. */
  public static Token comma() {
    return synthetic(TokenKind.COMMA, ",");
  }

  /** Creates a synthesized closing bracket. */
  public static Token closeBracket() {
    return synthetic(TokenKind.CBRACK, "]");
  }

  /** Returns true if this token is of the given kind. */
  public boolean is(TokenKind other) {
    return kind == other;
  }

  /** Returns true if this token is the identifier with the given name. */
  public boolean isIdent(String name) {
    return kind == TokenKind.IDENT && text.equals(name);
  }

  /** Returns true if this token is synthesized rather than read from the source. */
  public boolean isSynthetic() {
    return span == null;
  }

  /**
   * Concatenates the text of the given tokens, ignoring their spacing.
   *
   * @param tokens the tokens to join
   * @return the joined text
   */
  public static String textOf(List<Token> tokens) {
    StringBuilder sb = new StringBuilder();
    for (Token t : tokens) {
      sb.append(t.text());
    }
    return sb.toString();
  }

  /**
   * Serializes tokens with their recorded leading blanks.
   *
   * @param tokens the tokens to serialize
   * @return the source text they represent
   */
  public static String render(List<Token> tokens) {
    StringBuilder sb = new StringBuilder();
    for (Token t : tokens) {
      sb.append(" ".repeat(t.spacesBefore())).append(t.text());
    }
    return sb.toString();
  }
}
