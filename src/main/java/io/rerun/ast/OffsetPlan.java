package io.rerun.ast;

import io.rerun.Span;

/**
 * A parsed {@code [<offset1>[<offset2>]][@<snap>[<snapOffset>]]} expression.
 *
 * <p>Fields are applied in a fixed order: snap, snap offset, offset1, offset2. Calendar units make
 * the result depend on that order near month and year boundaries.
 *
 * @param offset1 the first offset (may be null)
 * @param offset2 the second offset (may be null, requires offset1)
 * @param snapUnit the snap unit letters (may be null)
 * @param snapSpan the location of the snap unit in the input (null when snapUnit is null)
 * @param snapOffset the offset attached to the snap (may be null, requires snapUnit)
 */
public record OffsetPlan(
    Offset offset1, Offset offset2, String snapUnit, Span snapSpan, Offset snapOffset)
    implements TimeExpr {
  /** Validates field dependencies. */
  public OffsetPlan {
    if (offset2 != null && offset1 == null) {
      throw new IllegalArgumentException("offset2 requires offset1");
    }
    if (snapOffset != null && snapUnit == null) {
      throw new IllegalArgumentException("snap offset requires a snap unit");
    }
    if (snapUnit != null && snapSpan == null) {
      throw new IllegalArgumentException("snap unit requires a span");
    }
  }

  /**
   * Returns true if the plan snaps before offsetting.
   *
   * @return whether a snap unit is present
   */
  public boolean hasSnap() {
    return snapUnit != null;
  }
}
