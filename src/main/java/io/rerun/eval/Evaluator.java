package io.rerun.eval;

import io.rerun.RerunException;
import io.rerun.ast.LiteralTime;
import io.rerun.ast.NowTime;
import io.rerun.ast.Offset;
import io.rerun.ast.OffsetPlan;
import io.rerun.ast.TimeExpr;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Evaluates relative-time expressions against a reference instant.
 *
 * <h2>Evaluation order</h2>
 *
 * <p>An {@link OffsetPlan} is applied as:
 *
 * <ol>
 *   <li>snap to the start of the snap unit
 *   <li>the snap offset
 *   <li>offset1
 *   <li>offset2
 * </ol>
 *
 * <p>This order is part of the contract. With fixed-length units it makes no difference, but month
 * offsets clip at month ends, so "-1mon@mon+30d" and "+30d-1mon" style rewrites of the same plan
 * give different answers. Do not reorder.
 */
public final class Evaluator {
  private static final Logger LOG = LoggerFactory.getLogger(Evaluator.class);

  private Evaluator() {}

  /**
   * Resolves an expression to an absolute instant.
   *
   * @param expr the parsed expression
   * @param input the original text, used for error reporting (may be null)
   * @param reference the instant the expression is relative to
   * @param zone the zone for snap boundaries and calendar months
   * @return the absolute instant
   * @throws RerunException if a unit is unknown or the arithmetic overflows
   */
  public static Instant evaluate(TimeExpr expr, String input, Instant reference, ZoneId zone)
      throws RerunException {
    if (expr instanceof LiteralTime literal) {
      try {
        return Instant.ofEpochSecond(literal.epochSeconds());
      } catch (DateTimeException e) {
        throw RerunException.calendar(
            "epoch seconds " + literal.epochSeconds() + " are out of range", e);
      }
    }
    if (expr instanceof NowTime) {
      return reference;
    }

    OffsetPlan plan = (OffsetPlan) expr;
    LOG.debug("Evaluating '{}' against {}", input, reference);

    Instant t = reference;
    if (plan.hasSnap()) {
      t = SnapEvaluator.applySnap(plan.snapUnit(), plan.snapSpan(), input, t, zone);
    }
    t = offset(plan.snapOffset(), input, t, zone);
    t = offset(plan.offset1(), input, t, zone);
    t = offset(plan.offset2(), input, t, zone);

    LOG.debug("Evaluated '{}' to {}", input, t);
    return t;
  }

  private static Instant offset(Offset offset, String input, Instant t, ZoneId zone)
      throws RerunException {
    if (offset == null) {
      return t;
    }
    return OffsetEvaluator.applyOffset(
        offset.amount(), offset.unit(), offset.span(), input, t, zone);
  }
}
