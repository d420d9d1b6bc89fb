package io.hclfmt.ast;

import io.hclfmt.lexer.Token;
import java.util.List;

/**
 * Newlines and comments between attributes and blocks.
 *
 * @param tokens the newline and comment tokens
 */
public record Trivia(List<Token> tokens) implements BodyItem {}
