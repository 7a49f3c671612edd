package io.rerun.ast;

/**
 * Sealed interface for parsed relative-time expressions.
 *
 * <p>There are 3 types of expressions:
 *
 * <ul>
 *   <li>{@link LiteralTime} - "1546300800", an absolute epoch-seconds value
 *   <li>{@link NowTime} - "now", the reference instant itself
 *   <li>{@link OffsetPlan} - "-1d@d", snap and offsets applied to the reference instant
 * </ul>
 */
public sealed interface TimeExpr permits LiteralTime, NowTime, OffsetPlan {}
