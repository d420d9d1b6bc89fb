package io.hclfmt.format;

import io.hclfmt.lexer.Token;
import java.util.List;

/**
 * The output of formatting a prefix of a token span.
 *
 * @param tokens the rewritten tokens
 * @param consumed how many input tokens the rewritten tokens replace
 * @param stop why formatting ended where it did
 */
public record Formatted(List<Token> tokens, int consumed, Stop stop) {

  /** Where a formatter stopped, relative to the span it was given. */
  public enum Stop {
    /** Every token of the span was consumed. */
    END_OF_SPAN,
    /** Stopped in front of a comma that separates elements of an enclosing list. */
    ELEMENT_SEPARATOR,
    /** Stopped in front of the "]" that closes an enclosing list. */
    ENCLOSING_LIST_CLOSED,
    /** Stopped in front of a token the caller keeps scanning from. */
    PENDING
  }
}
