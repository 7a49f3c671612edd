package io.rerun.backfill;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneId;
import java.util.Objects;
import java.util.regex.Pattern;

/** Settings for one backfill run. Build with {@link #builder(OutageWindow)}. */
public final class BackfillOptions {
  /** Delay before the first poll of a freshly submitted replay. */
  public static final Duration DEFAULT_SETTLE_DELAY = Duration.ofMillis(250);

  /** Delay between polls of a running replay. */
  public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofSeconds(1);

  private final OutageWindow window;
  private final Pattern nameFilter;
  private final boolean triggerActions;
  private final ZoneId zone;
  private final Duration settleDelay;
  private final Duration pollInterval;
  private final Clock clock;
  private final Sleeper sleeper;

  private BackfillOptions(Builder b) {
    this.window = b.window;
    this.nameFilter = b.nameFilter;
    this.triggerActions = b.triggerActions;
    this.zone = b.zone;
    this.settleDelay = b.settleDelay;
    this.pollInterval = b.pollInterval;
    this.clock = b.clock;
    this.sleeper = b.sleeper;
  }

  /**
   * Starts a builder for a run over {@code window}.
   *
   * @param window the outage window
   * @return a builder with default settings
   */
  public static Builder builder(OutageWindow window) {
    return new Builder(window);
  }

  /**
   * Returns the outage window whose missed runs are replayed.
   *
   * @return the window
   */
  public OutageWindow window() {
    return window;
  }

  /**
   * Returns the job name filter. Jobs whose name contains a match are replayed.
   *
   * @return the unanchored name pattern
   */
  public Pattern nameFilter() {
    return nameFilter;
  }

  /**
   * Returns whether replays fire the jobs' alert actions.
   *
   * @return true to trigger actions
   */
  public boolean triggerActions() {
    return triggerActions;
  }

  /**
   * Returns the zone for cron wall-clock fields, snap boundaries and calendar months.
   *
   * @return the zone
   */
  public ZoneId zone() {
    return zone;
  }

  /**
   * Returns the delay before the first poll of a submitted replay.
   *
   * @return the settle delay
   */
  public Duration settleDelay() {
    return settleDelay;
  }

  /**
   * Returns the delay between polls of a running replay.
   *
   * @return the poll interval
   */
  public Duration pollInterval() {
    return pollInterval;
  }

  /**
   * Returns the clock that stamps emitted results.
   *
   * @return the clock
   */
  public Clock clock() {
    return clock;
  }

  /**
   * Returns the sleeper used between polls.
   *
   * @return the sleeper
   */
  public Sleeper sleeper() {
    return sleeper;
  }

  /** Builder for {@link BackfillOptions}. */
  public static final class Builder {
    private final OutageWindow window;
    private Pattern nameFilter = Pattern.compile(".*");
    private boolean triggerActions = false;
    private ZoneId zone = ZoneId.systemDefault();
    private Duration settleDelay = DEFAULT_SETTLE_DELAY;
    private Duration pollInterval = DEFAULT_POLL_INTERVAL;
    private Clock clock = Clock.systemUTC();
    private Sleeper sleeper = Sleeper.SYSTEM;

    private Builder(OutageWindow window) {
      this.window = Objects.requireNonNull(window, "window");
    }

    /**
     * Sets the job name filter.
     *
     * @param nameFilter the pattern, matched anywhere in the job name
     * @return this builder
     */
    public Builder nameFilter(Pattern nameFilter) {
      this.nameFilter = Objects.requireNonNull(nameFilter, "nameFilter");
      return this;
    }

    /**
     * Sets the job name filter from a regular expression.
     *
     * @param regex the expression, matched anywhere in the job name
     * @return this builder
     * @throws java.util.regex.PatternSyntaxException if the expression is invalid
     */
    public Builder nameFilter(String regex) {
      return nameFilter(Pattern.compile(regex));
    }

    /**
     * Sets whether replays fire the jobs' alert actions.
     *
     * @param triggerActions true to trigger actions
     * @return this builder
     */
    public Builder triggerActions(boolean triggerActions) {
      this.triggerActions = triggerActions;
      return this;
    }

    /**
     * Sets the zone for cron fields, snaps and calendar months.
     *
     * @param zone the zone
     * @return this builder
     */
    public Builder zone(ZoneId zone) {
      this.zone = Objects.requireNonNull(zone, "zone");
      return this;
    }

    /**
     * Sets the delay before the first poll of a submitted replay.
     *
     * @param settleDelay a non-negative delay
     * @return this builder
     * @throws IllegalArgumentException if the delay is negative
     */
    public Builder settleDelay(Duration settleDelay) {
      this.settleDelay = requireNonNegative(settleDelay, "settleDelay");
      return this;
    }

    /**
     * Sets the delay between polls of a running replay.
     *
     * @param pollInterval a non-negative delay
     * @return this builder
     * @throws IllegalArgumentException if the delay is negative
     */
    public Builder pollInterval(Duration pollInterval) {
      this.pollInterval = requireNonNegative(pollInterval, "pollInterval");
      return this;
    }

    /**
     * Sets the clock that stamps emitted results.
     *
     * @param clock the clock
     * @return this builder
     */
    public Builder clock(Clock clock) {
      this.clock = Objects.requireNonNull(clock, "clock");
      return this;
    }

    /**
     * Sets the sleeper used between polls.
     *
     * @param sleeper the sleeper
     * @return this builder
     */
    public Builder sleeper(Sleeper sleeper) {
      this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
      return this;
    }

    /**
     * Builds the options.
     *
     * @return the immutable options
     */
    public BackfillOptions build() {
      return new BackfillOptions(this);
    }

    private static Duration requireNonNegative(Duration d, String name) {
      Objects.requireNonNull(d, name);
      if (d.isNegative()) {
        throw new IllegalArgumentException(name + " must not be negative");
      }
      return d;
    }
  }
}
