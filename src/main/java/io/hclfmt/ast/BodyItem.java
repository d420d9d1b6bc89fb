package io.hclfmt.ast;

import io.hclfmt.lexer.Token;
import java.util.List;

/**
 * Sealed interface for the entries of a configuration body.
 *
 * <ul>
 *   <li>{@link Attribute} - "name = expression"
 *   <li>{@link Block} - "type "label" { ... }"
 *   <li>{@link Trivia} - blank lines and standalone comments
 * </ul>
 */
public sealed interface BodyItem permits Attribute, Block, Trivia {
  /**
   * Returns every token of this item, in source order.
   *
   * @return the item's tokens
   */
  List<Token> tokens();
}
