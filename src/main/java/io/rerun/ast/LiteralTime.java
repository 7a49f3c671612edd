package io.rerun.ast;

/**
 * An absolute time written as epoch seconds.
 *
 * @param epochSeconds seconds since 1970-01-01T00:00:00Z
 */
public record LiteralTime(long epochSeconds) implements TimeExpr {}
