package io.hclfmt.ast;

import io.hclfmt.lexer.Token;
import java.util.ArrayList;
import java.util.List;

/**
 * The contents of a configuration file or of a block.
 *
 * @param items the attributes, blocks and trivia in source order
 */
public record Body(List<BodyItem> items) {

  /**
   * Returns the attributes of this body, excluding those of nested blocks.
   *
   * @return the attributes in source order
   */
  public List<Attribute> attributes() {
    List<Attribute> attrs = new ArrayList<>();
    for (BodyItem item : items) {
      if (item instanceof Attribute a) {
        attrs.add(a);
      }
    }
    return attrs;
  }

  /**
   * Returns the blocks directly contained in this body.
   *
   * @return the blocks in source order
   */
  public List<Block> blocks() {
    List<Block> blocks = new ArrayList<>();
    for (BodyItem item : items) {
      if (item instanceof Block b) {
        blocks.add(b);
      }
    }
    return blocks;
  }

  /**
   * Flattens this body back into its token sequence.
   *
   * @return every token of the body in order
   */
  public List<Token> tokens() {
    List<Token> all = new ArrayList<>();
    for (BodyItem item : items) {
      all.addAll(item.tokens());
    }
    return all;
  }
}
