package io.hclfmt.display;

import io.hclfmt.lexer.Token;
import io.hclfmt.lexer.TokenKind;
import java.util.ArrayList;
import java.util.List;

/**
 * Renders tokens as canonically laid out HCL text.
 *
 * <p>Only the blanks between tokens change. Each line is split into up to three cells:
 *
 * <ul>
 *   <li>lead - everything before an attribute's "=", or the whole line
 *   <li>assign - the "=" and the value, when the value does not open a multi-line bracket
 *   <li>comment - a line comment ending the line
 * </ul>
 *
 * <p>Lines are indented by two blanks per bracket level, blanks between tokens follow a
 * fixed set of rules, and "=" signs and trailing comments of consecutive lines are aligned.
 */
public final class Layout {
  private Layout() {}

  /**
   * Renders the given tokens.
   *
   * @param tokens the tokens of a whole file
   * @return the formatted text
   */
  public static String render(List<Token> tokens) {
    int[] spaces = new int[tokens.size()];
    List<Line> lines = linesOf(tokens);

    indent(lines, tokens, spaces);
    space(lines, tokens, spaces);
    align(lines, tokens, spaces);

    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < tokens.size(); i++) {
      sb.append(" ".repeat(spaces[i])).append(tokens.get(i).text());
    }
    return sb.toString();
  }

  private static List<Line> linesOf(List<Token> tokens) {
    List<Line> lines = new ArrayList<>();
    int lineStart = 0;
    for (int i = 0; i < tokens.size(); i++) {
      if (endsLine(tokens.get(i))) {
        lines.add(new Line(lineStart, i + 1));
        lineStart = i + 1;
      }
    }
    if (lineStart < tokens.size()) {
      lines.add(new Line(lineStart, tokens.size()));
    }

    for (Line line : lines) {
      if (line.end - line.start > 1 && tokens.get(line.end - 1).is(TokenKind.COMMENT)) {
        line.comment = line.end - 1;
      }

      int leadEnd = line.leadEnd();
      for (int i = line.start + 1; i < leadEnd; i++) {
        if (!tokens.get(i).is(TokenKind.EQUAL)) {
          continue;
        }
        // A value that opens more brackets than it closes is a multi-line one; it stays in
        // the lead cell so it does not take part in alignment.
        int net = 0;
        for (int j = i; j < leadEnd; j++) {
          net += tokens.get(j).kind().bracketChange();
          if (tokens.get(j).is(TokenKind.OHEREDOC)) {
            break;
          }
        }
        if (net == 0) {
          line.assign = i;
        }
        break;
      }
    }
    return lines;
  }

  private static void indent(List<Line> lines, List<Token> tokens, int[] spaces) {
    // Each entry is the number of brackets a line opened; closing them pops the level.
    List<Integer> indents = new ArrayList<>();

    for (Line line : lines) {
      if (line.start == line.end) {
        continue;
      }
      if (tokens.get(line.start).is(TokenKind.NEWLINE)) {
        spaces[line.start] = 0;
        continue;
      }

      int net = bracketChange(tokens, line.start, line.leadEnd());
      if (line.assign >= 0) {
        net += bracketChange(tokens, line.assign, line.assignEnd());
      }

      if (net > 0) {
        spaces[line.start] = 2 * indents.size();
        indents.add(net);
        continue;
      }

      int closed = -net;
      while (closed > 0 && !indents.isEmpty()) {
        int top = indents.get(indents.size() - 1);
        if (closed > top) {
          closed -= top;
          indents.remove(indents.size() - 1);
        } else if (closed < top) {
          indents.set(indents.size() - 1, top - closed);
          closed = 0;
        } else {
          indents.remove(indents.size() - 1);
          closed = 0;
        }
      }
      spaces[line.start] = 2 * indents.size();
    }
  }

  private static void space(List<Line> lines, List<Token> tokens, int[] spaces) {
    for (Line line : lines) {
      spaceCell(tokens, spaces, line.start, line.leadEnd());
      if (line.assign >= 0) {
        // The "=" is always separated from what it assigns to.
        spaces[line.assign] = 1;
        spaceCell(tokens, spaces, line.assign, line.assignEnd());
      }
    }
  }

  private static void spaceCell(List<Token> tokens, int[] spaces, int from, int to) {
    for (int i = from; i < to - 1; i++) {
      Token before = i > from ? tokens.get(i - 1) : null;
      spaces[i + 1] = spaceAfter(tokens.get(i), before, tokens.get(i + 1)) ? 1 : 0;
    }
  }

  private static void align(List<Line> lines, List<Token> tokens, int[] spaces) {
    // "=" first, since moving it also moves the comments.
    int chainStart = -1;
    int maxColumns = 0;
    for (int i = 0; i <= lines.size(); i++) {
      Line line = i < lines.size() ? lines.get(i) : null;
      if (line == null || line.assign < 0) {
        if (chainStart != -1) {
          for (Line chained : lines.subList(chainStart, i)) {
            int columns = columns(tokens, spaces, chained.start, chained.leadEnd());
            spaces[chained.assign] = maxColumns - columns + 1;
          }
          chainStart = -1;
          maxColumns = 0;
        }
        continue;
      }
      if (chainStart == -1) {
        chainStart = i;
      }
      maxColumns = Math.max(maxColumns, columns(tokens, spaces, line.start, line.leadEnd()));
    }

    for (int i = 0; i <= lines.size(); i++) {
      Line line = i < lines.size() ? lines.get(i) : null;
      if (line == null || line.comment < 0) {
        if (chainStart != -1) {
          for (Line chained : lines.subList(chainStart, i)) {
            int columns = columns(tokens, spaces, chained.start, chained.comment);
            spaces[chained.comment] = maxColumns - columns + 1;
          }
          chainStart = -1;
          maxColumns = 0;
        }
        continue;
      }
      if (chainStart == -1) {
        chainStart = i;
      }
      maxColumns = Math.max(maxColumns, columns(tokens, spaces, line.start, line.comment));
    }
  }

  /** Decides whether a blank goes between the subject and the token after it. */
  static boolean spaceAfter(Token subject, Token before, Token after) {
    TokenKind s = subject.kind();
    TokenKind a = after.kind();

    if (a == TokenKind.NEWLINE) {
      return false;
    }
    if (s == TokenKind.IDENT && a == TokenKind.OPAREN) {
      // Function calls.
      return false;
    }
    if (s == TokenKind.DOT || a == TokenKind.DOT) {
      return false;
    }
    if (a == TokenKind.COMMA || a == TokenKind.ELLIPSIS) {
      return false;
    }
    if (s == TokenKind.COMMA) {
      return true;
    }
    if (opensOrHoldsTemplateText(s) || holdsOrClosesTemplateText(a)) {
      // Template content is never touched.
      return false;
    }
    if (subject.isIdent("in") && before != null && before.is(TokenKind.IDENT)) {
      // The keyword of [for x in [foo]: x], not a reference indexed by [foo].
      return true;
    }
    if (a == TokenKind.OBRACK
        && (s == TokenKind.IDENT || s == TokenKind.NUMBER_LIT || s.bracketChange() < 0)) {
      return false;
    }
    if (s == TokenKind.MINUS) {
      // Negation when nothing that could end an operand comes before it.
      return before != null && !isNegationContext(before.kind());
    }
    if (s == TokenKind.BANG) {
      // Always unary.
      return false;
    }
    if (s == TokenKind.OBRACE || a == TokenKind.CBRACE) {
      return !(s == TokenKind.OBRACE && a == TokenKind.CBRACE);
    }
    if ((s == TokenKind.TEMPLATE_INTERP || s == TokenKind.TEMPLATE_CONTROL)
        && a == TokenKind.OBRACE) {
      return true;
    }
    if (s == TokenKind.CBRACE && a == TokenKind.TEMPLATE_SEQ_END) {
      return true;
    }
    if (s == TokenKind.TEMPLATE_SEQ_END
        && (a == TokenKind.TEMPLATE_INTERP || a == TokenKind.TEMPLATE_CONTROL)) {
      return false;
    }
    if (s.bracketChange() > 0 || a.bracketChange() < 0) {
      return false;
    }
    return true;
  }

  private static boolean opensOrHoldsTemplateText(TokenKind kind) {
    return kind == TokenKind.QUOTED_LIT
        || kind == TokenKind.STRING_LIT
        || kind == TokenKind.OQUOTE
        || kind == TokenKind.OHEREDOC;
  }

  private static boolean holdsOrClosesTemplateText(TokenKind kind) {
    return kind == TokenKind.QUOTED_LIT
        || kind == TokenKind.STRING_LIT
        || kind == TokenKind.CQUOTE
        || kind == TokenKind.CHEREDOC;
  }

  private static boolean isNegationContext(TokenKind kind) {
    return switch (kind) {
      case OPAREN, OBRACE, OBRACK, EQUAL, COLON, COMMA, QUESTION -> true;
      case PLUS, STAR, SLASH, PERCENT, MINUS -> true;
      case EQUAL_OP, NOT_EQUAL, GREATER_THAN, GREATER_THAN_EQ, LESS_THAN, LESS_THAN_EQ -> true;
      case AND, OR, BANG -> true;
      default -> false;
    };
  }

  private static boolean endsLine(Token token) {
    // Line comments carry their own newline.
    return token.is(TokenKind.NEWLINE)
        || (token.is(TokenKind.COMMENT) && token.text().endsWith("\n"));
  }

  private static int bracketChange(List<Token> tokens, int from, int to) {
    int net = 0;
    for (int i = from; i < to; i++) {
      net += tokens.get(i).kind().bracketChange();
      if (tokens.get(i).is(TokenKind.OHEREDOC)) {
        break;
      }
    }
    return net;
  }

  private static int columns(List<Token> tokens, int[] spaces, int from, int to) {
    int columns = 0;
    for (int i = from; i < to; i++) {
      String text = tokens.get(i).text();
      columns += spaces[i] + text.codePointCount(0, text.length());
    }
    return columns;
  }

  /** Token offsets of one line and of its cells; -1 marks an absent cell. */
  private static final class Line {
    final int start;
    final int end;
    int assign = -1;
    int comment = -1;

    Line(int start, int end) {
      this.start = start;
      this.end = end;
    }

    int leadEnd() {
      if (assign >= 0) {
        return assign;
      }
      return comment >= 0 ? comment : end;
    }

    int assignEnd() {
      return comment >= 0 ? comment : end;
    }
  }
}
