package io.rerun.lexer;

/** The type of token in a relative-time expression. */
public enum TokenKind {
  /** An integer amount, optionally signed (e.g., "15", "-1", "+2"). */
  NUMBER,
  /** A run of unit letters (e.g., "d", "mon", "hours"). */
  UNIT,
  /** The snap marker "@". */
  AT,
  /** Input the lexer could not tokenize; always the last token and runs to the end. */
  REST
}
