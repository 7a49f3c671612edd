package io.rerun.cron;

import com.cronutils.model.Cron;
import com.cronutils.model.CronType;
import com.cronutils.model.definition.CronDefinitionBuilder;
import com.cronutils.model.time.ExecutionTime;
import com.cronutils.parser.CronParser;
import io.rerun.RerunException;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Walks the occurrences of a 5-field UNIX cron schedule.
 *
 * <p>Cron fields are matched against wall-clock time in the enumerator's zone, the same zone used
 * for snapping relative-time expressions.
 */
public final class OccurrenceEnumerator {
  private static final CronParser PARSER =
      new CronParser(CronDefinitionBuilder.instanceDefinitionFor(CronType.UNIX));

  private final String schedule;
  private final ExecutionTime executionTime;
  private final ZoneId zone;

  private OccurrenceEnumerator(String schedule, ExecutionTime executionTime, ZoneId zone) {
    this.schedule = schedule;
    this.executionTime = executionTime;
    this.zone = zone;
  }

  /**
   * Parses a 5-field cron schedule.
   *
   * @param schedule the cron expression, e.g. "0 4 * * *"
   * @param zone the zone the schedule's wall-clock fields refer to
   * @return an enumerator for the schedule
   * @throws RerunException if the schedule is not a valid UNIX cron expression
   */
  public static OccurrenceEnumerator forCron(String schedule, ZoneId zone) throws RerunException {
    Objects.requireNonNull(zone, "zone");
    if (schedule == null || schedule.isBlank()) {
      throw RerunException.cron("empty cron schedule", null);
    }
    try {
      Cron cron = PARSER.parse(schedule.trim()).validate();
      return new OccurrenceEnumerator(schedule, ExecutionTime.forCron(cron), zone);
    } catch (IllegalArgumentException e) {
      throw RerunException.cron("invalid cron schedule '" + schedule + "': " + e.getMessage(), e);
    }
  }

  /**
   * Returns the first occurrence strictly after {@code from}.
   *
   * @param from the cursor (exclusive)
   * @return the next occurrence, or empty if the schedule never fires again
   */
  public Optional<Instant> next(Instant from) {
    return executionTime.nextExecution(from.atZone(zone)).map(ZonedDateTime::toInstant);
  }

  /**
   * Returns a lazy stream of occurrences where from &lt; occurrence &lt;= to.
   *
   * @param from the start time (exclusive)
   * @param to the end time (inclusive)
   * @return a stream of occurrences in the range, in increasing order
   */
  public Stream<Instant> between(Instant from, Instant to) {
    Iterator<Instant> iterator =
        new Iterator<>() {
          private Instant current = from;
          private Instant next = null;
          private boolean computed = false;

          private void computeNext() {
            if (!computed) {
              next =
                  OccurrenceEnumerator.this.next(current).filter(t -> !t.isAfter(to)).orElse(null);
              computed = true;
            }
          }

          @Override
          public boolean hasNext() {
            computeNext();
            return next != null;
          }

          @Override
          public Instant next() {
            computeNext();
            if (next == null) {
              throw new NoSuchElementException();
            }
            current = next;
            computed = false;
            return next;
          }
        };

    return StreamSupport.stream(
        Spliterators.spliteratorUnknownSize(iterator, Spliterator.ORDERED | Spliterator.NONNULL),
        false);
  }

  /**
   * Returns the zone the schedule is evaluated in.
   *
   * @return the zone
   */
  public ZoneId zone() {
    return zone;
  }

  @Override
  public String toString() {
    return schedule;
  }
}
