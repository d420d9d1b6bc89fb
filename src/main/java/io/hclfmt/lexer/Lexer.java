package io.hclfmt.lexer;

import io.hclfmt.HclException;
import io.hclfmt.Span;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Tokenizes HCL native syntax into a list of tokens.
 *
 * <p>Blanks are not tokens: they are recorded as {@link Token#spacesBefore()} of the token
 * that follows them. Template and heredoc content is kept verbatim.
 */
public final class Lexer {
  private static final Logger logger = LogManager.getLogger(Lexer.class);

  private final String input;
  private final String filename;
  private final List<Token> tokens = new ArrayList<>();
  private final Deque<Mode> modes = new ArrayDeque<>();
  private int pos;

  private Lexer(String input, String filename) {
    this.input = input;
    this.filename = filename;
    this.pos = 0;
    this.modes.push(new Mode(ModeKind.EXPRESSION, 0, null));
  }

  /**
   * Tokenizes the input string into a list of tokens.
   *
   * @param input the HCL source to tokenize
   * @param filename the name used in error messages, may be empty
   * @return a list of tokens
   * @throws HclException if the input contains invalid tokens
   */
  public static List<Token> tokenize(String input, String filename) throws HclException {
    List<Token> tokens = new Lexer(input, filename).doTokenize();
    logger.trace("tokenized {} into {} tokens", filename, tokens.size());
    return tokens;
  }

  private List<Token> doTokenize() throws HclException {
    while (pos < input.length()) {
      Mode mode = modes.peek();
      switch (mode.kind) {
        case QUOTED -> lexQuoted(mode);
        case HEREDOC -> lexHeredoc(mode);
        default -> lexExpression(mode);
      }
    }

    Mode open = modes.peek();
    switch (open.kind) {
      case QUOTED -> throw error("unterminated template string", open.openedAt);
      case HEREDOC -> throw error("unterminated heredoc, expected " + open.marker, open.openedAt);
      case INTERPOLATION -> throw error("unclosed template interpolation", open.openedAt);
      default -> {}
    }
    return tokens;
  }

  private void lexExpression(Mode mode) throws HclException {
    int spaces = skipBlanks();
    if (pos >= input.length()) {
      return;
    }

    int start = pos;
    char ch = input.charAt(pos);

    if (ch == '\n') {
      pos++;
      add(TokenKind.NEWLINE, start, spaces);
      return;
    }
    if (ch == '\r' && peek(1) == '\n') {
      pos += 2;
      add(TokenKind.NEWLINE, start, spaces);
      return;
    }

    if (ch == '#' || input.startsWith("//", pos)) {
      int nl = input.indexOf('\n', pos);
      pos = nl < 0 ? input.length() : nl + 1;
      add(TokenKind.COMMENT, start, spaces);
      return;
    }

    if (input.startsWith("/*", pos)) {
      int close = input.indexOf("*/", pos + 2);
      if (close < 0) {
        throw error("unterminated comment", start);
      }
      pos = close + 2;
      add(TokenKind.COMMENT, start, spaces);
      return;
    }

    if (isDigit(ch)) {
      lexNumber(spaces);
      return;
    }

    if (isIdentStart(ch)) {
      pos++;
      while (pos < input.length() && isIdentPart(input.charAt(pos))) {
        pos++;
      }
      add(TokenKind.IDENT, start, spaces);
      return;
    }

    if (ch == '"') {
      pos++;
      add(TokenKind.OQUOTE, start, spaces);
      modes.push(new Mode(ModeKind.QUOTED, start, null));
      return;
    }

    if (input.startsWith("<<", pos) && lexHeredocHeader(spaces)) {
      return;
    }

    if (ch == '{') {
      pos++;
      mode.braces++;
      add(TokenKind.OBRACE, start, spaces);
      return;
    }

    if (ch == '~' && peek(1) == '}' && mode.kind == ModeKind.INTERPOLATION && mode.braces == 0) {
      pos += 2;
      modes.pop();
      add(TokenKind.TEMPLATE_SEQ_END, start, spaces);
      return;
    }

    if (ch == '}') {
      pos++;
      if (mode.kind == ModeKind.INTERPOLATION && mode.braces == 0) {
        modes.pop();
        add(TokenKind.TEMPLATE_SEQ_END, start, spaces);
      } else {
        mode.braces--;
        add(TokenKind.CBRACE, start, spaces);
      }
      return;
    }

    if (input.startsWith("...", pos)) {
      pos += 3;
      add(TokenKind.ELLIPSIS, start, spaces);
      return;
    }

    if (pos + 1 < input.length()) {
      TokenKind pair = PAIRS.get(input.substring(pos, pos + 2));
      if (pair != null) {
        pos += 2;
        add(pair, start, spaces);
        return;
      }
    }

    TokenKind single = SINGLES.get(ch);
    if (single != null) {
      pos++;
      add(single, start, spaces);
      return;
    }

    throw error("unexpected character '" + ch + "'", start);
  }

  private void lexNumber(int spaces) {
    int start = pos;
    skipDigits();
    if (peek(0) == '.' && isDigit(peek(1))) {
      pos++;
      skipDigits();
    }
    if (peek(0) == 'e' || peek(0) == 'E') {
      int sign = (peek(1) == '+' || peek(1) == '-') ? 1 : 0;
      if (isDigit(peek(1 + sign))) {
        pos += 1 + sign;
        skipDigits();
      }
    }
    add(TokenKind.NUMBER_LIT, start, spaces);
  }

  /** Lexes "&lt;&lt;EOT\n" or "&lt;&lt;-EOT\n"; returns false if the input is not a heredoc. */
  private boolean lexHeredocHeader(int spaces) {
    int start = pos;
    int p = pos + 2;
    if (p < input.length() && input.charAt(p) == '-') {
      p++;
    }
    if (p >= input.length() || !isIdentStart(input.charAt(p))) {
      return false;
    }
    int markerStart = p;
    while (p < input.length() && isIdentPart(input.charAt(p))) {
      p++;
    }
    String marker = input.substring(markerStart, p);
    if (input.startsWith("\r\n", p)) {
      p += 2;
    } else if (p < input.length() && input.charAt(p) == '\n') {
      p++;
    } else {
      return false;
    }
    pos = p;
    add(TokenKind.OHEREDOC, start, spaces);
    modes.push(new Mode(ModeKind.HEREDOC, start, marker));
    return true;
  }

  private void lexQuoted(Mode mode) throws HclException {
    int start = pos;
    while (pos < input.length()) {
      char c = input.charAt(pos);
      if (c == '"' || c == '\n' || startsTemplateSequence()) {
        break;
      }
      if (c == '\\' && pos + 1 < input.length() && input.charAt(pos + 1) != '\n') {
        pos += 2;
        continue;
      }
      if (input.startsWith("$${", pos) || input.startsWith("%%{", pos)) {
        pos += 3;
        continue;
      }
      pos++;
    }
    if (pos > start) {
      add(TokenKind.QUOTED_LIT, start, 0);
    }
    if (pos >= input.length()) {
      return;
    }

    int at = pos;
    char c = input.charAt(pos);
    if (c == '"') {
      pos++;
      modes.pop();
      add(TokenKind.CQUOTE, at, 0);
    } else if (c == '\n') {
      throw error("unterminated template string", mode.openedAt);
    } else {
      openTemplateSequence();
    }
  }

  private void lexHeredoc(Mode mode) {
    if (mode.startOfLine) {
      int nl = input.indexOf('\n', pos);
      int end = nl < 0 ? input.length() : nl;
      if (end > pos && input.charAt(end - 1) == '\r') {
        end--;
      }
      if (input.substring(pos, end).strip().equals(mode.marker)) {
        int start = pos;
        pos = end;
        modes.pop();
        add(TokenKind.CHEREDOC, start, 0);
        return;
      }
    }

    mode.startOfLine = false;
    int start = pos;
    while (pos < input.length()) {
      char c = input.charAt(pos);
      if (c == '\n') {
        pos++;
        mode.startOfLine = true;
        break;
      }
      if (input.startsWith("$${", pos) || input.startsWith("%%{", pos)) {
        pos += 3;
        continue;
      }
      if (startsTemplateSequence()) {
        break;
      }
      pos++;
    }
    if (pos > start) {
      add(TokenKind.STRING_LIT, start, 0);
    }
    if (!mode.startOfLine && pos < input.length()) {
      openTemplateSequence();
    }
  }

  private boolean startsTemplateSequence() {
    return input.startsWith("${", pos) || input.startsWith("%{", pos);
  }

  private void openTemplateSequence() {
    int start = pos;
    TokenKind kind =
        input.charAt(pos) == '$' ? TokenKind.TEMPLATE_INTERP : TokenKind.TEMPLATE_CONTROL;
    pos += 2;
    // "${~" and "%{~" strip the whitespace before the sequence
    if (peek(0) == '~') {
      pos++;
    }
    add(kind, start, 0);
    modes.push(new Mode(ModeKind.INTERPOLATION, start, null));
  }

  private int skipBlanks() {
    int start = pos;
    while (pos < input.length()) {
      char c = input.charAt(pos);
      if (c == ' ' || c == '\t' || (c == '\r' && peek(1) != '\n')) {
        pos++;
      } else {
        break;
      }
    }
    return pos - start;
  }

  private void skipDigits() {
    while (pos < input.length() && isDigit(input.charAt(pos))) {
      pos++;
    }
  }

  private char peek(int offset) {
    int p = pos + offset;
    return p < input.length() ? input.charAt(p) : '\0';
  }

  private void add(TokenKind kind, int start, int spaces) {
    tokens.add(Token.of(kind, input.substring(start, pos), spaces, new Span(start, pos)));
  }

  private HclException error(String message, int at) {
    return HclException.syntax(message, filename, new Span(at, at + 1), input);
  }

  private static boolean isDigit(char c) {
    return c >= '0' && c <= '9';
  }

  private static boolean isIdentStart(char c) {
    return Character.isLetter(c) || c == '_';
  }

  private static boolean isIdentPart(char c) {
    return isIdentStart(c) || isDigit(c) || c == '-';
  }

  private enum ModeKind {
    EXPRESSION,
    INTERPOLATION,
    QUOTED,
    HEREDOC
  }

  /** One level of the lexer's mode stack. */
  private static final class Mode {
    final ModeKind kind;
    final int openedAt;
    final String marker;
    int braces;
    boolean startOfLine = true;

    Mode(ModeKind kind, int openedAt, String marker) {
      this.kind = kind;
      this.openedAt = openedAt;
      this.marker = marker;
    }
  }

  private static final Map<String, TokenKind> PAIRS =
      Map.ofEntries(
          Map.entry("==", TokenKind.EQUAL_OP),
          Map.entry("!=", TokenKind.NOT_EQUAL),
          Map.entry("<=", TokenKind.LESS_THAN_EQ),
          Map.entry(">=", TokenKind.GREATER_THAN_EQ),
          Map.entry("&&", TokenKind.AND),
          Map.entry("||", TokenKind.OR),
          Map.entry("=>", TokenKind.FAT_ARROW));

  private static final Map<Character, TokenKind> SINGLES =
      Map.ofEntries(
          Map.entry('[', TokenKind.OBRACK),
          Map.entry(']', TokenKind.CBRACK),
          Map.entry('(', TokenKind.OPAREN),
          Map.entry(')', TokenKind.CPAREN),
          Map.entry(',', TokenKind.COMMA),
          Map.entry('.', TokenKind.DOT),
          Map.entry('?', TokenKind.QUESTION),
          Map.entry(':', TokenKind.COLON),
          Map.entry('=', TokenKind.EQUAL),
          Map.entry('!', TokenKind.BANG),
          Map.entry('<', TokenKind.LESS_THAN),
          Map.entry('>', TokenKind.GREATER_THAN),
          Map.entry('+', TokenKind.PLUS),
          Map.entry('-', TokenKind.MINUS),
          Map.entry('*', TokenKind.STAR),
          Map.entry('/', TokenKind.SLASH),
          Map.entry('%', TokenKind.PERCENT));
}
