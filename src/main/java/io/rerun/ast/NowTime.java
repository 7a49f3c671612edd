package io.rerun.ast;

/** The literal {@code now}: the reference instant, unchanged. */
public record NowTime() implements TimeExpr {
  /** Shared instance. */
  public static final NowTime INSTANCE = new NowTime();
}
