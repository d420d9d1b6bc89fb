package io.hclfmt.ast;

import io.hclfmt.lexer.Token;
import java.util.ArrayList;
import java.util.List;

/**
 * Represents a block: a type, optional labels and a nested body.
 *
 * @param header the type, label and opening brace tokens
 * @param body the nested body
 * @param footer the closing brace and whatever ends its line
 */
public record Block(List<Token> header, Body body, List<Token> footer) implements BodyItem {

  /**
   * Returns the block type.
   *
   * @return the text of the first header token
   */
  public String type() {
    return header.get(0).text();
  }

  /**
   * Returns a copy of this block with its body replaced.
   *
   * @param newBody the replacement body
   * @return a new block
   */
  public Block withBody(Body newBody) {
    return new Block(header, newBody, footer);
  }

  @Override
  public List<Token> tokens() {
    List<Token> all = new ArrayList<>(header);
    all.addAll(body.tokens());
    all.addAll(footer);
    return all;
  }
}
