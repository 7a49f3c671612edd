package io.rerun.lexer;

import io.rerun.Span;

/**
 * Represents a lexed token.
 *
 * @param kind the type of token
 * @param span the location in the input
 * @param text the raw token text, including the sign for NUMBER tokens
 */
public record Token(TokenKind kind, Span span, String text) {
  /** Creates a number token. */
  public static Token number(String text, Span span) {
    return new Token(TokenKind.NUMBER, span, text);
  }

  /** Creates a unit token. */
  public static Token unit(String text, Span span) {
    return new Token(TokenKind.UNIT, span, text);
  }

  /** Creates a snap marker token. */
  public static Token at(Span span) {
    return new Token(TokenKind.AT, span, "@");
  }

  /** Creates a token for the untokenizable remainder of the input. */
  public static Token rest(String text, Span span) {
    return new Token(TokenKind.REST, span, text);
  }

  /**
   * Returns true if this is a NUMBER token written with an explicit '+' or '-'.
   *
   * @return whether the number carries a sign
   */
  public boolean isSigned() {
    return kind == TokenKind.NUMBER
        && !text.isEmpty()
        && (text.charAt(0) == '+' || text.charAt(0) == '-');
  }
}
