package io.hclfmt.format;

import io.hclfmt.format.Formatted.Stop;
import io.hclfmt.lexer.Token;
import java.util.ArrayList;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Formats expressions, rewriting every list literal they contain.
 *
 * <p>Tokens outside of list literals are copied unchanged. The formatter tracks bracket
 * nesting so it can stop at the comma or closing bracket that belongs to an enclosing list,
 * which is how {@link ListFormatter} splits a list into elements.
 */
public final class ExpressionFormatter {
  private static final Logger logger = LogManager.getLogger(ExpressionFormatter.class);

  private ExpressionFormatter() {}

  /**
   * Formats the whole value expression of an attribute.
   *
   * @param expression the expression tokens
   * @return the formatted tokens
   * @throws IllegalStateException if the expression was not consumed completely, which
   *     means the formatter misread the structure of valid input
   */
  public static List<Token> formatAttribute(List<Token> expression) {
    Formatted result = format(expression);
    if (result.consumed() != expression.size()) {
      throw new IllegalStateException(
          String.format(
              "last pos %d != tokens len %d for tokens: %s",
              result.consumed(), expression.size(), Token.render(expression)));
    }
    return result.tokens();
  }

  /**
   * Formats the expression at the start of the given span.
   *
   * <p>Formatting stops early, without consuming the token, at a comma outside of any
   * bracket or template, and at a "]" that closes a bracket opened before the span.
   *
   * @param tokens the span to format
   * @return the formatted tokens and how many input tokens they replace
   */
  public static Formatted format(List<Token> tokens) {
    List<Token> out = new ArrayList<>(tokens.size());
    int pos = 0;
    int openBrackets = 0;
    int openBraces = 0;
    int openParens = 0;
    int openTemplates = 0;

    while (pos < tokens.size()) {
      Token token = tokens.get(pos);

      switch (token.kind()) {
        case OPAREN -> openParens++;
        case CPAREN -> openParens--;
        case OBRACE -> openBraces++;
        case CBRACE -> openBraces--;
        case TEMPLATE_INTERP, TEMPLATE_CONTROL -> openTemplates++;
        case TEMPLATE_SEQ_END -> openTemplates--;
        case OBRACK -> {
          // Anything that looks like a list inside a template is left alone.
          if (openTemplates == 0 && Heuristics.startsList(tokens, pos)) {
            Formatted list =
                ListFormatter.format(tokens.subList(pos, tokens.size()), openBraces > 0);
            out.addAll(list.tokens());
            pos += list.consumed();
            continue;
          }
          openBrackets++;
        }
        case CBRACK -> {
          openBrackets--;
          if (openBrackets == -1) {
            logger.trace("expression ends at the close of the enclosing list, pos {}", pos);
            return new Formatted(out, pos, Stop.ENCLOSING_LIST_CLOSED);
          }
        }
        case COMMA -> {
          if (openBrackets == 0 && openParens == 0 && openBraces == 0 && openTemplates == 0) {
            logger.trace("expression ends at an element separator, pos {}", pos);
            return new Formatted(out, pos, Stop.ELEMENT_SEPARATOR);
          }
        }
        default -> {}
      }

      out.add(token);
      pos++;
    }

    return new Formatted(out, pos, Stop.END_OF_SPAN);
  }
}
