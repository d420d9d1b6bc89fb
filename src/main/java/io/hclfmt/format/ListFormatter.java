package io.hclfmt.format;

import io.hclfmt.format.Formatted.Stop;
import io.hclfmt.lexer.Token;
import io.hclfmt.lexer.TokenKind;
import java.util.ArrayList;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Rewrites list literals so that every element sits on its own line followed by a comma.
 *
 * <pre>
 * a = [1, 2]      a = [
 *                   1,
 *                   2,
 *                 ]
 * </pre>
 */
public final class ListFormatter {
  private static final Logger logger = LogManager.getLogger(ListFormatter.class);

  private ListFormatter() {}

  /**
   * Formats the list literal at the start of the given span.
   *
   * <p>The returned count may extend past the closing bracket when the list is followed by
   * an index access ({@code ["one"][0]}) or an operator ({@code [1] == [2]}).
   *
   * @param tokens the span, starting with a "[" known to open a list literal
   * @param insideObject whether the list is a value inside an object constructor; needed
   *     to tell an index access from a list used as the value of the next key
   * @return the formatted list and the number of input tokens it replaces
   * @throws IllegalStateException if the span ends before the list is closed
   */
  public static Formatted format(List<Token> tokens, boolean insideObject) {
    logger.trace("formatting list {}", () -> Token.render(tokens));

    List<Token> out = new ArrayList<>();
    out.add(tokens.get(0));
    out.add(Token.newline());
    int pos = 1;

    while (true) {
      pos += Heuristics.skipNewlines(tokens, pos);
      if (pos >= tokens.size()) {
        throw new IllegalStateException("list is not closed: " + Token.render(tokens));
      }

      Token token = tokens.get(pos);
      if (token.is(TokenKind.COMMA)) {
        pos++;
        continue;
      }
      if (token.is(TokenKind.COMMENT)) {
        out.add(token);
        pos++;
        continue;
      }
      if (token.is(TokenKind.CBRACK)) {
        break;
      }

      Formatted element = ExpressionFormatter.format(tokens.subList(pos, tokens.size()));
      if (element.consumed() == 0 || element.stop() == Stop.END_OF_SPAN) {
        throw new IllegalStateException(
            "list element at pos " + pos + " does not end inside the list: "
                + Token.render(tokens));
      }
      pos += element.consumed();

      List<Token> elem = Heuristics.trimNewlines(element.tokens());
      if (logger.isTraceEnabled()) {
        logger.trace("list element {}, next pos {}", Token.render(elem), pos);
      }
      out.addAll(elem);

      // A comma cannot share the line of a heredoc terminator.
      if (Heuristics.isHeredoc(elem)) {
        out.add(Token.newline());
      }
      // Nested constructs such as { [] = etc, ... } may already end in a comma.
      if (!out.get(out.size() - 1).is(TokenKind.COMMA)) {
        out.add(Token.comma());
      }
      out.add(Token.newline());
    }

    out.add(Token.closeBracket());
    pos++;

    return continueAfterList(tokens, pos, out, insideObject);
  }

  /** Handles whatever directly follows the closing bracket, e.g. "[..][0]" or "[..] + x". */
  private static Formatted continueAfterList(
      List<Token> tokens, int pos, List<Token> out, boolean insideObject) {
    // Comments right after the list are kept; the newlines around them are not.
    boolean newlineBefore = false;
    while (pos < tokens.size()) {
      Token token = tokens.get(pos);
      if (token.is(TokenKind.COMMENT)) {
        out.add(token);
        pos++;
      } else if (token.is(TokenKind.NEWLINE)) {
        newlineBefore = true;
        pos++;
      } else {
        break;
      }
    }

    if (pos == tokens.size()) {
      logger.trace("no tokens after list");
      return new Formatted(out, pos, Stop.END_OF_SPAN);
    }

    Token next = tokens.get(pos);
    switch (next.kind()) {
      case IDENT, CBRACE, NUMBER_LIT, OQUOTE -> {
        // The next key of an enclosing object: { a = []\n b = [] }
        logger.trace("list followed by an object key");
        out.add(Token.newline());
        return new Formatted(out, pos, Stop.PENDING);
      }
      case COMMA -> {
        return new Formatted(out, pos, Stop.ELEMENT_SEPARATOR);
      }
      case CBRACK -> {
        return new Formatted(out, pos, Stop.ENCLOSING_LIST_CLOSED);
      }
      case CPAREN -> {
        return new Formatted(out, pos, Stop.PENDING);
      }
      case OBRACK -> {
        // Either an index access "[]\n[0]" or, inside an object, a list that is the key
        // of the next entry. Only a newline tells them apart.
        if (insideObject && newlineBefore) {
          logger.trace("list followed by a list key of an enclosing object");
          out.add(Token.newline());
          return new Formatted(out, pos, Stop.PENDING);
        }
        Formatted access = IndexAccessScanner.scan(tokens.subList(pos, tokens.size()));
        logger.trace("list followed by index access {}", () -> Token.render(access.tokens()));
        out.addAll(access.tokens());
        return new Formatted(out, pos + access.consumed(), access.stop());
      }
      default -> {
        // Anything else is taken as an operator and the rest as its right operand.
        logger.trace("list followed by operator {}", next.text());
        out.add(next);
        pos++;
        pos += Heuristics.skipNewlines(tokens, pos);
        Formatted operand = ExpressionFormatter.format(tokens.subList(pos, tokens.size()));
        out.addAll(operand.tokens());
        return new Formatted(out, pos + operand.consumed(), operand.stop());
      }
    }
  }
}
