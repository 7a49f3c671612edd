package io.rerun.ast;

import io.rerun.Span;

/**
 * A signed amount of some unit, as written in the expression.
 *
 * <p>The unit is kept as raw text. It is resolved against {@link RelativeUnit} only when the
 * offset is applied, so that an unknown unit is reported by the evaluator, not the parser.
 *
 * @param amount the signed amount
 * @param unit the unit letters (e.g., "d", "mon", "hours")
 * @param span the location of the offset in the input
 */
public record Offset(long amount, String unit, Span span) {
  @Override
  public String toString() {
    return (amount < 0 ? "" : "+") + amount + unit;
  }
}
