package io.hclfmt.lexer;

/** The type of token in HCL native syntax. */
public enum TokenKind {
  // Brackets
  /** An opening brace "{". */
  OBRACE,
  /** A closing brace "}". */
  CBRACE,
  /** An opening bracket "[". */
  OBRACK,
  /** A closing bracket "]". */
  CBRACK,
  /** An opening parenthesis "(". */
  OPAREN,
  /** A closing parenthesis ")". */
  CPAREN,
  /** The opening quote of a quoted template. */
  OQUOTE,
  /** The closing quote of a quoted template. */
  CQUOTE,
  /** A heredoc introducer such as "&lt;&lt;-EOT", including its newline. */
  OHEREDOC,
  /** A heredoc terminator line, including any leading blanks. */
  CHEREDOC,

  // Operators and punctuation
  /** "*", also the splat operator. */
  STAR,
  /** "/". */
  SLASH,
  /** "+". */
  PLUS,
  /** "-". */
  MINUS,
  /** "%". */
  PERCENT,
  /** "=", the attribute assignment. */
  EQUAL,
  /** "==". */
  EQUAL_OP,
  /** "!=". */
  NOT_EQUAL,
  /** "&lt;". */
  LESS_THAN,
  /** "&lt;=". */
  LESS_THAN_EQ,
  /** "&gt;". */
  GREATER_THAN,
  /** "&gt;=". */
  GREATER_THAN_EQ,
  /** "&amp;&amp;". */
  AND,
  /** "||". */
  OR,
  /** "!". */
  BANG,
  /** ".". */
  DOT,
  /** ",". */
  COMMA,
  /** "...". */
  ELLIPSIS,
  /** "=&gt;". */
  FAT_ARROW,
  /** "?". */
  QUESTION,
  /** ":". */
  COLON,

  // Templates
  /** "${", opening an interpolation. */
  TEMPLATE_INTERP,
  /** "%{", opening a template directive. */
  TEMPLATE_CONTROL,
  /** "}", closing an interpolation or directive. */
  TEMPLATE_SEQ_END,

  // Value-carrying tokens
  /** Literal text inside a quoted template. */
  QUOTED_LIT,
  /** Literal text inside a heredoc template. */
  STRING_LIT,
  /** A numeric literal. */
  NUMBER_LIT,
  /** An identifier or keyword. */
  IDENT,

  // Layout
  /** A comment; line comments include their terminating newline. */
  COMMENT,
  /** A line break. */
  NEWLINE;

  /**
   * Returns how this kind changes the bracket nesting of a line.
   *
   * @return 1 for openers, -1 for closers, 0 otherwise
   */
  public int bracketChange() {
    return switch (this) {
      case OBRACE, OBRACK, OPAREN, TEMPLATE_INTERP, TEMPLATE_CONTROL -> 1;
      case CBRACE, CBRACK, CPAREN, TEMPLATE_SEQ_END -> -1;
      default -> 0;
    };
  }
}
