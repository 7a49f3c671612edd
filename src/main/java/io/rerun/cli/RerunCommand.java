package io.rerun.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.rerun.RelativeTime;
import io.rerun.RerunException;
import io.rerun.UncheckedRerunException;
import io.rerun.backfill.BackfillOptions;
import io.rerun.backfill.BackfillScheduler;
import io.rerun.backfill.OutageWindow;
import java.io.PrintStream;
import java.nio.file.Path;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.TemporalAccessor;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command-line front end: replays the jobs of a JSON jobs file over an outage window against a
 * dry-run backend and prints one JSON line per replay.
 *
 * <p>{@code --from} and {@code --to} accept an ISO-8601 instant ("2019-01-01T00:00:00Z"), a local
 * date-time or date in the run's zone ("2019-01-01T00:00", "2019-01-01"), or any relative-time
 * expression, evaluated against the current time ("-2d@d", "now", "1546300800").
 */
public final class RerunCommand {
  private static final Logger LOG = LoggerFactory.getLogger(RerunCommand.class);
  private static final Pattern ISO_DATE_PREFIX = Pattern.compile("\\d{4}-\\d{2}-\\d{2}.*");

  private final Clock clock;
  private final PrintStream out;
  private final PrintStream err;

  RerunCommand(Clock clock, PrintStream out, PrintStream err) {
    this.clock = clock;
    this.out = out;
    this.err = err;
  }

  public static void main(String[] args) {
    LocalControlJob control = new LocalControlJob("rerun-" + ProcessHandle.current().pid());
    CountDownLatch finished = new CountDownLatch(1);
    Runtime.getRuntime()
        .addShutdownHook(
            new Thread(
                () -> {
                  // Let the run notice the cancelled control job and stop between replays.
                  control.cancel();
                  try {
                    finished.await(5, TimeUnit.SECONDS);
                  } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                  }
                },
                "rerun-shutdown"));

    RerunCommand command = new RerunCommand(Clock.systemUTC(), System.out, System.err);
    System.exit(command.run(args, control, finished));
  }

  /** Runs the command and releases {@code finished} however the run ends. */
  int run(String[] args, LocalControlJob control, CountDownLatch finished) {
    try {
      return run(args, control);
    } finally {
      finished.countDown();
    }
  }

  /**
   * Runs the command.
   *
   * @return the process exit code: 0 on success, 1 on a fatal error
   */
  int run(String[] args, LocalControlJob control) {
    CommandLine cmd;
    ZoneId zone;
    OutageWindow window;
    Pattern filter;
    try {
      cmd = CommandLine.parse(args);
      zone = cmd.timezone() == null ? ZoneId.systemDefault() : ZoneId.of(cmd.timezone());
      window = new OutageWindow(parseTime(cmd.from(), zone), parseTime(cmd.to(), zone));
      filter = Pattern.compile(cmd.regex());
    } catch (IllegalArgumentException | DateTimeException e) {
      // PatternSyntaxException is an IllegalArgumentException
      err.println("rerun: " + e.getMessage());
      err.println(CommandLine.USAGE);
      return 1;
    } catch (RerunException e) {
      err.println(e.displayRich());
      err.println(CommandLine.USAGE);
      return 1;
    }

    BackfillOptions options =
        BackfillOptions.builder(window)
            .nameFilter(filter)
            .triggerActions(cmd.trigger())
            .zone(zone)
            .clock(clock)
            .build();

    ObjectMapper mapper = new ObjectMapper();
    ResultWriter writer = new ResultWriter(mapper, out);
    try {
      JsonJobRegistry registry = JsonJobRegistry.load(mapper, Path.of(cmd.jobsFile()), control);
      BackfillScheduler scheduler =
          BackfillScheduler.open(registry, new DryRunBackend(), control.id(), options);
      scheduler.run().forEach(writer::write);
      return 0;
    } catch (RerunException e) {
      LOG.error("rerun failed: {}", e.getMessage());
      return 1;
    } catch (UncheckedRerunException e) {
      LOG.error("rerun failed: {}", e.getCause().getMessage());
      return 1;
    }
  }

  private Instant parseTime(String text, ZoneId zone) throws RerunException {
    if (!ISO_DATE_PREFIX.matcher(text).matches()) {
      return RelativeTime.evaluate(text, clock.instant(), zone);
    }
    if (text.length() == 10) {
      return LocalDate.parse(text).atStartOfDay(zone).toInstant();
    }
    TemporalAccessor parsed =
        DateTimeFormatter.ISO_DATE_TIME.parseBest(text, ZonedDateTime::from, LocalDateTime::from);
    if (parsed instanceof ZonedDateTime zoned) {
      return zoned.toInstant();
    }
    return ((LocalDateTime) parsed).atZone(zone).toInstant();
  }
}
