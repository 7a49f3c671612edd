package io.rerun.lexer;

import io.rerun.Span;
import java.util.ArrayList;
import java.util.List;

/**
 * Tokenizes relative-time expressions.
 *
 * <p>Lexing never fails. The first character that cannot start a token ends the scan and the
 * remaining input is emitted as a single {@link TokenKind#REST} token, so the parser can match
 * the longest valid prefix and report what it ignored.
 */
public final class Lexer {
  private final String input;
  private int pos;

  private Lexer(String input) {
    this.input = input;
    this.pos = 0;
  }

  /**
   * Tokenizes the input string into a list of tokens.
   *
   * @param input the input string to tokenize
   * @return a list of tokens, ending with at most one REST token
   */
  public static List<Token> tokenize(String input) {
    return new Lexer(input).doTokenize();
  }

  private List<Token> doTokenize() {
    List<Token> tokens = new ArrayList<>();
    while (pos < input.length()) {
      int start = pos;
      char ch = input.charAt(pos);

      if (ch == '@') {
        pos++;
        tokens.add(Token.at(new Span(start, pos)));
        continue;
      }

      if (startsNumber()) {
        tokens.add(lexNumber());
        continue;
      }

      if (isUnitLetter(ch)) {
        tokens.add(lexUnit());
        continue;
      }

      tokens.add(Token.rest(input.substring(start), new Span(start, input.length())));
      pos = input.length();
    }
    return tokens;
  }

  private boolean startsNumber() {
    char ch = input.charAt(pos);
    if (isDigit(ch)) {
      return true;
    }
    return isSign(ch) && pos + 1 < input.length() && isDigit(input.charAt(pos + 1));
  }

  private Token lexNumber() {
    int start = pos;
    if (isSign(input.charAt(pos))) {
      pos++;
    }
    while (pos < input.length() && isDigit(input.charAt(pos))) {
      pos++;
    }
    return Token.number(input.substring(start, pos), new Span(start, pos));
  }

  private Token lexUnit() {
    int start = pos;
    while (pos < input.length() && isUnitLetter(input.charAt(pos))) {
      pos++;
    }
    return Token.unit(input.substring(start, pos), new Span(start, pos));
  }

  private static boolean isDigit(char c) {
    return c >= '0' && c <= '9';
  }

  private static boolean isSign(char c) {
    return c == '+' || c == '-';
  }

  // ASCII only; unit names are never localized.
  private static boolean isUnitLetter(char c) {
    return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
  }
}
