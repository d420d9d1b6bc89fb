package io.hclfmt.ast;

import io.hclfmt.lexer.Token;
import java.util.ArrayList;
import java.util.List;

/**
 * Represents a "name = expression" definition.
 *
 * @param name the identifier being assigned
 * @param assign the "=" token
 * @param expression the tokens of the value expression
 * @param tail trailing comments and the terminating newline, if any
 */
public record Attribute(Token name, Token assign, List<Token> expression, List<Token> tail)
    implements BodyItem {

  /**
   * Returns the attribute name.
   *
   * @return the identifier text
   */
  public String nameText() {
    return name.text();
  }

  /**
   * Returns a copy of this attribute with its expression replaced.
   *
   * @param newExpression the replacement expression tokens
   * @return a new attribute
   */
  public Attribute withExpression(List<Token> newExpression) {
    return new Attribute(name, assign, List.copyOf(newExpression), tail);
  }

  @Override
  public List<Token> tokens() {
    List<Token> all = new ArrayList<>(expression.size() + tail.size() + 2);
    all.add(name);
    all.add(assign);
    all.addAll(expression);
    all.addAll(tail);
    return all;
  }
}
