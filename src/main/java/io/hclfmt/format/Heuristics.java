package io.hclfmt.format;

import io.hclfmt.lexer.Token;
import io.hclfmt.lexer.TokenKind;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/** Structural guesses made from token kinds alone. */
public final class Heuristics {
  /** Kinds that end a value, so a "[" right after them indexes that value. */
  private static final Set<TokenKind> INDEXABLE =
      EnumSet.of(
          TokenKind.CBRACE,
          TokenKind.CBRACK,
          TokenKind.IDENT,
          TokenKind.QUOTED_LIT,
          TokenKind.STRING_LIT,
          TokenKind.NUMBER_LIT,
          TokenKind.CPAREN,
          TokenKind.CQUOTE,
          TokenKind.CHEREDOC,
          TokenKind.STAR);

  private Heuristics() {}

  /**
   * Decides whether the "[" at the given position opens a list literal.
   *
   * <p>List comprehensions and index or splat accesses on a preceding value are not list
   * literals. Only tokens of the given span are looked at.
   *
   * @param tokens the span being formatted
   * @param bracket the position of a "[" in the span
   * @return true if the bracket starts a list literal
   */
  public static boolean startsList(List<Token> tokens, int bracket) {
    if (isListComprehension(tokens, bracket)) {
      return false;
    }

    // Handles things like "[0\n[[]]]", comments included.
    int prev = bracket - 1;
    while (prev >= 0 && isNewlineOrComment(tokens.get(prev))) {
      prev--;
    }
    if (prev < 0) {
      return true;
    }
    return !INDEXABLE.contains(tokens.get(prev).kind());
  }

  /**
   * Checks whether the "[" at the given position starts a "[for ...]" expression.
   *
   * @param tokens the span being formatted
   * @param bracket the position of a "[" in the span
   * @return true for a list comprehension
   */
  public static boolean isListComprehension(List<Token> tokens, int bracket) {
    int next = bracket + 1;
    next += skipNewlinesAndComments(tokens, next);
    return next < tokens.size() && tokens.get(next).isIdent("for");
  }

  /**
   * Checks whether a list element ends with a heredoc terminator, after which a comma
   * cannot share the line.
   *
   * @param element the element tokens, already trimmed of newlines
   * @return true if the last token closes a heredoc
   */
  public static boolean isHeredoc(List<Token> element) {
    return !element.isEmpty() && element.get(element.size() - 1).is(TokenKind.CHEREDOC);
  }

  /**
   * Counts the newline tokens starting at the given position.
   *
   * @param tokens the tokens to look at
   * @param from the first position to check
   * @return the number of consecutive newlines
   */
  public static int skipNewlines(List<Token> tokens, int from) {
    int i = from;
    while (i < tokens.size() && tokens.get(i).is(TokenKind.NEWLINE)) {
      i++;
    }
    return i - from;
  }

  /**
   * Counts the newline and comment tokens starting at the given position.
   *
   * @param tokens the tokens to look at
   * @param from the first position to check
   * @return the number of consecutive newlines and comments
   */
  public static int skipNewlinesAndComments(List<Token> tokens, int from) {
    int i = from;
    while (i < tokens.size() && isNewlineOrComment(tokens.get(i))) {
      i++;
    }
    return i - from;
  }

  /**
   * Strips leading and trailing newline tokens.
   *
   * @param tokens the tokens to trim
   * @return a view of the tokens without the outer newlines
   */
  public static List<Token> trimNewlines(List<Token> tokens) {
    int start = 0;
    while (start < tokens.size() && tokens.get(start).is(TokenKind.NEWLINE)) {
      start++;
    }
    int end = tokens.size();
    while (end > start && tokens.get(end - 1).is(TokenKind.NEWLINE)) {
      end--;
    }
    return tokens.subList(start, end);
  }

  private static boolean isNewlineOrComment(Token token) {
    return token.is(TokenKind.NEWLINE) || token.is(TokenKind.COMMENT);
  }
}
