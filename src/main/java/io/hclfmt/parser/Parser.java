package io.hclfmt.parser;

import io.hclfmt.HclException;
import io.hclfmt.ast.Attribute;
import io.hclfmt.ast.Block;
import io.hclfmt.ast.Body;
import io.hclfmt.ast.BodyItem;
import io.hclfmt.ast.Trivia;
import io.hclfmt.lexer.Lexer;
import io.hclfmt.lexer.Token;
import io.hclfmt.lexer.TokenKind;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Recursive descent parser for the structure of HCL bodies.
 *
 * <p>Attributes and blocks are recognized and bracket nesting is validated, but expressions
 * are kept as flat token lists: nothing downstream needs their tree.
 */
public final class Parser {
  private final String input;
  private final String filename;
  private final List<Token> tokens;
  private int pos;

  private Parser(String input, String filename, List<Token> tokens) {
    this.input = input;
    this.filename = filename;
    this.tokens = tokens;
    this.pos = 0;
  }

  /**
   * Parses an HCL configuration file into a body.
   *
   * @param input the source text
   * @param filename the name used in error messages, may be empty
   * @return the parsed body
   * @throws HclException if the input is not valid HCL
   */
  public static Body parse(String input, String filename) throws HclException {
    List<Token> tokens = Lexer.tokenize(input, filename);
    Parser parser = new Parser(input, filename, tokens);
    Body body = parser.parseBody(false);
    if (parser.pos < tokens.size()) {
      throw parser.parseError("unexpected '}'", tokens.get(parser.pos));
    }
    return body;
  }

  private Body parseBody(boolean nested) throws HclException {
    List<BodyItem> items = new ArrayList<>();
    List<Token> trivia = new ArrayList<>();
    Set<String> names = new HashSet<>();

    while (pos < tokens.size()) {
      Token tok = tokens.get(pos);
      switch (tok.kind()) {
        case NEWLINE, COMMENT -> {
          trivia.add(tok);
          pos++;
        }
        case CBRACE -> {
          // Closes the enclosing block; the caller consumes it.
          flush(trivia, items);
          return new Body(items);
        }
        case IDENT -> {
          flush(trivia, items);
          if (peekKind(1) == TokenKind.EQUAL) {
            Attribute attr = parseAttribute();
            if (!names.add(attr.nameText())) {
              throw parseError(
                  "attribute redefined: '" + attr.nameText() + "' was already defined",
                  attr.name());
            }
            items.add(attr);
          } else {
            items.add(parseBlock());
          }
        }
        default -> throw parseError("expected an attribute or block definition", tok);
      }
    }

    flush(trivia, items);
    return new Body(items);
  }

  private Attribute parseAttribute() throws HclException {
    Token name = tokens.get(pos++);
    Token assign = tokens.get(pos++);

    int start = pos;
    Deque<Token> open = new ArrayDeque<>();
    boolean operandEnded = false;
    while (pos < tokens.size()) {
      Token tok = tokens.get(pos);
      if (open.isEmpty() && endsAttribute(tok)) {
        break;
      }
      if (open.isEmpty()) {
        if (tok.is(TokenKind.COMMA)) {
          throw parseError("unexpected ','", tok);
        }
        if (operandEnded && startsOperand(tok)) {
          throw parseError("unexpected '" + tok.text().strip() + "'", tok);
        }
      }
      if (tok.kind().bracketChange() > 0
          || tok.is(TokenKind.OQUOTE)
          || tok.is(TokenKind.OHEREDOC)) {
        open.push(tok);
      } else if (tok.kind().bracketChange() < 0
          || tok.is(TokenKind.CQUOTE)
          || tok.is(TokenKind.CHEREDOC)) {
        if (open.isEmpty()) {
          throw parseError("unexpected '" + tok.text().strip() + "'", tok);
        }
        Token opener = open.pop();
        if (closerOf(opener.kind()) != tok.kind()) {
          throw parseError(
              "mismatched '" + tok.text().strip() + "', expected the closer of '"
                  + opener.text().strip() + "'",
              tok);
        }
      }
      if (open.isEmpty() && !tok.is(TokenKind.COMMENT)) {
        operandEnded = endsOperand(tok);
      }
      pos++;
    }
    if (!open.isEmpty()) {
      Token opener = open.peek();
      throw parseError("unclosed '" + opener.text().strip() + "'", opener);
    }

    // Comments at the end of the line belong to the attribute, not to its value.
    int end = pos;
    while (end > start && tokens.get(end - 1).is(TokenKind.COMMENT)) {
      end--;
    }
    if (end == start) {
      throw parseError("missing expression for attribute '" + name.text() + "'", assign);
    }

    List<Token> expression = List.copyOf(tokens.subList(start, end));
    List<Token> tail = new ArrayList<>(tokens.subList(end, pos));
    if (pos < tokens.size() && !tokens.get(pos).is(TokenKind.CBRACE)) {
      tail.add(tokens.get(pos++));
    }
    return new Attribute(name, assign, expression, List.copyOf(tail));
  }

  private Block parseBlock() throws HclException {
    List<Token> header = new ArrayList<>();
    Token type = tokens.get(pos++);
    header.add(type);

    Token openBrace = null;
    while (openBrace == null) {
      Token tok = current();
      if (tok == null) {
        throw parseError("expected '{' to open block '" + type.text() + "'", type);
      }
      switch (tok.kind()) {
        case IDENT -> {
          header.add(tok);
          pos++;
        }
        case OQUOTE -> parseLabel(header);
        case OBRACE -> {
          header.add(tok);
          pos++;
          openBrace = tok;
        }
        case EQUAL -> throw parseError("unexpected '=' after block labels", tok);
        default -> throw parseError("expected a block label or '{'", tok);
      }
    }

    Body body = parseBody(true);

    Token close = current();
    if (close == null || !close.is(TokenKind.CBRACE)) {
      throw parseError("unclosed block '" + type.text() + "'", openBrace);
    }
    List<Token> footer = new ArrayList<>();
    footer.add(close);
    pos++;

    while (current() != null && current().is(TokenKind.COMMENT) && !isLineComment(current())) {
      footer.add(tokens.get(pos++));
    }
    Token next = current();
    if (next != null) {
      if (next.is(TokenKind.NEWLINE) || isLineComment(next)) {
        footer.add(next);
        pos++;
      } else if (!next.is(TokenKind.CBRACE)) {
        throw parseError("expected a newline after block '" + type.text() + "'", next);
      }
    }
    return new Block(List.copyOf(header), body, List.copyOf(footer));
  }

  private void parseLabel(List<Token> header) throws HclException {
    Token quote = tokens.get(pos++);
    header.add(quote);
    Token tok = current();
    if (tok != null && tok.is(TokenKind.QUOTED_LIT)) {
      header.add(tok);
      pos++;
      tok = current();
    }
    if (tok == null || !tok.is(TokenKind.CQUOTE)) {
      throw parseError("block labels must be plain quoted strings", tok == null ? quote : tok);
    }
    header.add(tok);
    pos++;
  }

  private static boolean endsAttribute(Token tok) {
    return tok.is(TokenKind.NEWLINE) || tok.is(TokenKind.CBRACE) || isLineComment(tok);
  }

  private static boolean isLineComment(Token tok) {
    return tok.is(TokenKind.COMMENT) && tok.text().endsWith("\n");
  }

  /** Tokens that can only begin a new operand, never continue one. */
  private static boolean startsOperand(Token tok) {
    return tok.is(TokenKind.IDENT)
        || tok.is(TokenKind.NUMBER_LIT)
        || tok.is(TokenKind.OQUOTE)
        || tok.is(TokenKind.OHEREDOC)
        || tok.is(TokenKind.OBRACE);
  }

  private static boolean endsOperand(Token tok) {
    return tok.is(TokenKind.IDENT)
        || tok.is(TokenKind.NUMBER_LIT)
        || tok.kind().bracketChange() < 0
        || tok.is(TokenKind.CQUOTE)
        || tok.is(TokenKind.CHEREDOC);
  }

  private static TokenKind closerOf(TokenKind opener) {
    return switch (opener) {
      case OBRACE -> TokenKind.CBRACE;
      case OBRACK -> TokenKind.CBRACK;
      case OPAREN -> TokenKind.CPAREN;
      case OQUOTE -> TokenKind.CQUOTE;
      case OHEREDOC -> TokenKind.CHEREDOC;
      case TEMPLATE_INTERP, TEMPLATE_CONTROL -> TokenKind.TEMPLATE_SEQ_END;
      default -> throw new IllegalArgumentException("not an opening token: " + opener);
    };
  }

  private static void flush(List<Token> trivia, List<BodyItem> items) {
    if (!trivia.isEmpty()) {
      items.add(new Trivia(List.copyOf(trivia)));
      trivia.clear();
    }
  }

  private Token current() {
    return pos < tokens.size() ? tokens.get(pos) : null;
  }

  private TokenKind peekKind(int offset) {
    int p = pos + offset;
    return p < tokens.size() ? tokens.get(p).kind() : null;
  }

  private HclException parseError(String message, Token at) {
    return HclException.syntax(message, filename, at.span(), input);
  }
}
