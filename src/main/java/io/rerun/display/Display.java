package io.rerun.display;

import io.rerun.ast.LiteralTime;
import io.rerun.ast.NowTime;
import io.rerun.ast.Offset;
import io.rerun.ast.OffsetPlan;
import io.rerun.ast.TimeExpr;

/**
 * Renders parsed expressions as canonical strings.
 *
 * <p>Offsets are always written with an explicit sign, and ignored trailing text is dropped, so
 * "1d@d" renders as "+1d@d". Unit letters are kept as written.
 */
public final class Display {
  private Display() {}

  /**
   * Renders an expression as a canonical string.
   *
   * @param expr the expression to render
   * @return the canonical string representation
   */
  public static String render(TimeExpr expr) {
    if (expr instanceof LiteralTime literal) {
      return Long.toString(literal.epochSeconds());
    }
    if (expr instanceof NowTime) {
      return "now";
    }
    return renderPlan((OffsetPlan) expr);
  }

  private static String renderPlan(OffsetPlan plan) {
    StringBuilder sb = new StringBuilder();
    appendOffset(sb, plan.offset1());
    appendOffset(sb, plan.offset2());
    if (plan.hasSnap()) {
      sb.append('@').append(plan.snapUnit());
      appendOffset(sb, plan.snapOffset());
    }
    return sb.toString();
  }

  private static void appendOffset(StringBuilder sb, Offset offset) {
    if (offset != null) {
      sb.append(offset);
    }
  }
}
