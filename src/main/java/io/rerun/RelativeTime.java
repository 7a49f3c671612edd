package io.rerun;

import io.rerun.ast.TimeExpr;
import io.rerun.display.Display;
import io.rerun.eval.Evaluator;
import io.rerun.parser.Parser;
import java.time.Instant;
import java.time.ZoneId;

/**
 * The main entry point for parsing and evaluating relative-time expressions.
 *
 * <p>An expression is an epoch-seconds literal, the word {@code now}, or a combination of up to
 * two signed offsets and a snap: {@code [<offset1>[<offset2>]][@<snap>[<snapOffset>]]}.
 *
 * <p>Example usage:
 *
 * <pre>{@code
 * RelativeTime earliest = RelativeTime.parse("-1d@d");
 * Instant start = earliest.evaluate(scheduledRun);  // yesterday, local midnight
 * }</pre>
 */
public final class RelativeTime {
  private final String input;
  private final TimeExpr expr;

  private RelativeTime(String input, TimeExpr expr) {
    this.input = input;
    this.expr = expr;
  }

  /**
   * Parses a relative-time expression.
   *
   * @param input the expression
   * @return the parsed expression
   * @throws RerunException if the input is malformed
   */
  public static RelativeTime parse(String input) throws RerunException {
    return new RelativeTime(input, Parser.parse(input));
  }

  /**
   * Validates an expression without throwing. Units are not checked, since they are resolved
   * only at evaluation time.
   *
   * @param input the expression
   * @return true if the expression parses
   */
  public static boolean validate(String input) {
    try {
      Parser.parse(input);
      return true;
    } catch (RerunException e) {
      return false;
    }
  }

  /**
   * Parses and evaluates an expression in one step.
   *
   * @param input the expression
   * @param reference the instant the expression is relative to
   * @param zone the zone for snap boundaries and calendar months
   * @return the absolute instant
   * @throws RerunException if the input is malformed or uses an unknown unit
   */
  public static Instant evaluate(String input, Instant reference, ZoneId zone)
      throws RerunException {
    return parse(input).evaluate(reference, zone);
  }

  /**
   * Evaluates this expression in the process's default time zone.
   *
   * @param reference the instant the expression is relative to
   * @return the absolute instant
   * @throws RerunException if a unit is unknown or the arithmetic overflows
   */
  public Instant evaluate(Instant reference) throws RerunException {
    return evaluate(reference, ZoneId.systemDefault());
  }

  /**
   * Evaluates this expression.
   *
   * @param reference the instant the expression is relative to
   * @param zone the zone for snap boundaries and calendar months
   * @return the absolute instant
   * @throws RerunException if a unit is unknown or the arithmetic overflows
   */
  public Instant evaluate(Instant reference, ZoneId zone) throws RerunException {
    return Evaluator.evaluate(expr, input, reference, zone);
  }

  /**
   * Returns the parsed expression.
   *
   * @return the expression tree
   */
  public TimeExpr expr() {
    return expr;
  }

  /**
   * Returns the expression as it was written.
   *
   * @return the original input
   */
  public String input() {
    return input;
  }

  /**
   * Returns the canonical string representation of this expression.
   *
   * @return the canonical form
   */
  @Override
  public String toString() {
    return Display.render(expr);
  }
}
