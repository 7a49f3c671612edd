package io.rerun.parser;

import io.rerun.RerunException;
import io.rerun.Span;
import io.rerun.ast.LiteralTime;
import io.rerun.ast.NowTime;
import io.rerun.ast.Offset;
import io.rerun.ast.OffsetPlan;
import io.rerun.ast.TimeExpr;
import io.rerun.lexer.Lexer;
import io.rerun.lexer.Token;
import io.rerun.lexer.TokenKind;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parser for relative-time expressions.
 *
 * <p>Grammar, matched as a prefix of the input:
 *
 * <pre>
 * expr       := digits | "now" | [offset1 [offset2]] ["@" unit [snapOffset]]
 * offset1    := [+-]? digits unit
 * offset2    := [+-] digits unit
 * snapOffset := [+-] digits unit
 * unit       := [a-zA-Z]+
 * </pre>
 *
 * <p>Each optional group is all-or-nothing: a number without unit letters, or an "@" without unit
 * letters, ends the match. Anything after the matched prefix is ignored. An empty match is an
 * error.
 */
public final class Parser {
  private static final Logger LOG = LoggerFactory.getLogger(Parser.class);

  private final String input;
  private final List<Token> tokens;
  private int pos;

  private Parser(String input, List<Token> tokens) {
    this.input = input;
    this.tokens = tokens;
    this.pos = 0;
  }

  /**
   * Parses a relative-time expression.
   *
   * @param input the input string to parse
   * @return the parsed expression
   * @throws RerunException if the input is not a literal, "now", or a non-empty grammar match
   */
  public static TimeExpr parse(String input) throws RerunException {
    if (input == null || input.isEmpty()) {
      throw RerunException.grammar("empty expression", new Span(0, 0), "", null);
    }

    if (isAllDigits(input)) {
      return parseLiteral(input);
    }

    if (input.equals("now")) {
      return NowTime.INSTANCE;
    }

    return new Parser(input, Lexer.tokenize(input)).parsePlan();
  }

  private static TimeExpr parseLiteral(String input) throws RerunException {
    try {
      return new LiteralTime(Long.parseLong(input));
    } catch (NumberFormatException e) {
      throw RerunException.grammar(
          "literal time out of range", new Span(0, input.length()), input, null);
    }
  }

  private OffsetPlan parsePlan() throws RerunException {
    Offset offset1 = tryOffset(false);
    Offset offset2 = offset1 != null ? tryOffset(true) : null;

    String snapUnit = null;
    Span snapSpan = null;
    Offset snapOffset = null;
    if (peekKind(0) == TokenKind.AT && peekKind(1) == TokenKind.UNIT) {
      pos++;
      Token unit = tokens.get(pos++);
      snapUnit = unit.text();
      snapSpan = unit.span();
      snapOffset = tryOffset(true);
    }

    if (offset1 == null && snapUnit == null) {
      Span at = pos < tokens.size() ? tokens.get(pos).span() : new Span(0, input.length());
      throw RerunException.grammar(
          "expected an offset like '-1d' or a snap like '@d'", at, input, suggest());
    }

    if (pos < tokens.size()) {
      Span ignored = tokens.get(pos).span().to(tokens.get(tokens.size() - 1).span());
      LOG.warn(
          "Ignoring trailing text '{}' in time expression '{}'",
          input.substring(ignored.start()),
          input);
    }

    return new OffsetPlan(offset1, offset2, snapUnit, snapSpan, snapOffset);
  }

  /** Consumes NUMBER UNIT if present; the number must carry a sign when {@code signed}. */
  private Offset tryOffset(boolean signed) throws RerunException {
    if (peekKind(0) != TokenKind.NUMBER || peekKind(1) != TokenKind.UNIT) {
      return null;
    }
    Token number = tokens.get(pos);
    if (signed && !number.isSigned()) {
      return null;
    }
    Token unit = tokens.get(pos + 1);
    pos += 2;
    return new Offset(parseAmount(number), unit.text(), number.span().to(unit.span()));
  }

  private long parseAmount(Token number) throws RerunException {
    String text = number.text();
    if (text.startsWith("+")) {
      text = text.substring(1);
    }
    try {
      return Long.parseLong(text);
    } catch (NumberFormatException e) {
      throw RerunException.grammar("offset amount out of range", number.span(), input, null);
    }
  }

  private TokenKind peekKind(int ahead) {
    int i = pos + ahead;
    return i < tokens.size() ? tokens.get(i).kind() : null;
  }

  private String suggest() {
    String trimmed = input.trim();
    if (!trimmed.equals(input) && !trimmed.isEmpty()) {
      return trimmed;
    }
    if (input.startsWith("@")) {
      return "@d";
    }
    return null;
  }

  private static boolean isAllDigits(String s) {
    for (int i = 0; i < s.length(); i++) {
      char c = s.charAt(i);
      if (c < '0' || c > '9') {
        return false;
      }
    }
    return true;
  }
}
