package io.hclfmt.format;

import io.hclfmt.format.Formatted.Stop;
import io.hclfmt.lexer.Token;
import java.util.List;

/**
 * Finds the end of an index access chain such as {@code [0].name.hi[1]}.
 *
 * <p>Lists inside the chain are not reformatted.
 */
public final class IndexAccessScanner {
  private IndexAccessScanner() {}

  /**
   * Returns the longest prefix of the span that belongs to the access chain.
   *
   * @param tokens a span starting with the first access of the chain
   * @return the chain tokens, unchanged, and their count
   */
  public static Formatted scan(List<Token> tokens) {
    int openBrackets = 0;
    int openBraces = 0;
    int openParens = 0;

    for (int i = 0; i < tokens.size(); i++) {
      switch (tokens.get(i).kind()) {
        case OPAREN -> openParens++;
        case CPAREN -> openParens--;
        case OBRACE -> openBraces++;
        case CBRACE -> openBraces--;
        case OBRACK -> openBrackets++;
        case CBRACK -> {
          openBrackets--;
          // The bracket of an outer list.
          if (openBrackets == -1) {
            return new Formatted(List.copyOf(tokens.subList(0, i)), i, Stop.ENCLOSING_LIST_CLOSED);
          }
        }
        case COMMA -> {
          if (openBrackets == 0 && openParens == 0 && openBraces == 0) {
            return new Formatted(List.copyOf(tokens.subList(0, i)), i, Stop.ELEMENT_SEPARATOR);
          }
        }
        default -> {}
      }
    }

    // The chain runs to the end of the expression, e.g. a = ["list"][0]
    return new Formatted(List.copyOf(tokens), tokens.size(), Stop.END_OF_SPAN);
  }
}
