package io.rerun;

/** The type of error raised while parsing, evaluating or replaying. */
public enum ErrorKind {
  /** Malformed relative-time expression. */
  GRAMMAR("grammar"),
  /** Unrecognized time unit in a snap or offset. */
  UNIT("unit"),
  /** Calendar arithmetic could not be performed. */
  CALENDAR("calendar"),
  /** Invalid cron schedule. */
  CRON("cron"),
  /** The control job of the run could not be resolved. */
  CONTROL("control"),
  /** The execution backend could not be reached or refused a request. */
  BACKEND("backend");

  private final String value;

  ErrorKind(String value) {
    this.value = value;
  }

  /**
   * Returns the lowercase string representation.
   *
   * @return the kind as a lowercase string
   */
  public String value() {
    return value;
  }

  @Override
  public String toString() {
    return value;
  }
}
