package io.rerun.backfill;

import io.rerun.RelativeTime;
import io.rerun.RerunException;
import io.rerun.UncheckedRerunException;
import io.rerun.cron.OccurrenceEnumerator;
import java.time.Instant;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Replays the scheduled runs of jobs that were missed during an outage.
 *
 * <h2>Per-job loop</h2>
 *
 * <p>A job is visited only if its name matches the name filter and it is scheduled and enabled.
 * Starting from the outage start, the scheduler repeatedly:
 *
 * <ol>
 *   <li>checks the control signal, and ends the whole run if it is no longer active
 *   <li>advances the cursor to the next cron occurrence; past the outage end the job is done
 *   <li>evaluates the job's earliest and latest expressions against the occurrence
 *   <li>submits a replay and polls it until the backend reports it done
 *   <li>emits a {@link ReplayResult}
 * </ol>
 *
 * <h2>Ordering and load</h2>
 *
 * <p>Jobs are visited one at a time in registry order, and within a job occurrences are replayed in
 * increasing time order. A replay is always awaited before the next one is submitted, so at most
 * one replay is in flight.
 *
 * <h2>Cancellation</h2>
 *
 * <p>The control signal is read once per occurrence, never while a replay is being polled.
 * Cancellation is best effort: a replay already submitted keeps running in the backend and is not
 * cancelled. Interrupting the thread that consumes the results also stops the run.
 *
 * <h2>Errors</h2>
 *
 * <p>Errors confined to one job (malformed expression, unknown unit, calendar overflow, invalid
 * cron) are logged and the job is skipped. Backend and control failures end the run with an
 * {@link UncheckedRerunException} from the result stream.
 */
public final class BackfillScheduler {
  private static final Logger LOG = LoggerFactory.getLogger(BackfillScheduler.class);

  private final JobRegistry registry;
  private final DispatchBackend backend;
  private final ControlSignal signal;
  private final BackfillOptions options;
  private final AtomicBoolean started = new AtomicBoolean();

  /**
   * Creates a scheduler.
   *
   * @param registry the source of job definitions
   * @param backend the system that runs replays
   * @param signal the cancellation signal for the run
   * @param options the run settings
   */
  public BackfillScheduler(
      JobRegistry registry,
      DispatchBackend backend,
      ControlSignal signal,
      BackfillOptions options) {
    this.registry = Objects.requireNonNull(registry, "registry");
    this.backend = Objects.requireNonNull(backend, "backend");
    this.signal = Objects.requireNonNull(signal, "signal");
    this.options = Objects.requireNonNull(options, "options");
  }

  /**
   * Creates a scheduler whose run is controlled by the job with id {@code runId}.
   *
   * @param registry the source of job definitions and of the control job
   * @param backend the system that runs replays
   * @param runId the id of the job that initiated the run
   * @param options the run settings
   * @return the scheduler
   * @throws RerunException with kind CONTROL if no job has that id
   */
  public static BackfillScheduler open(
      JobRegistry registry, DispatchBackend backend, String runId, BackfillOptions options)
      throws RerunException {
    ControlJob control =
        registry
            .findControlJob(runId)
            .orElseThrow(() -> RerunException.control("control job '" + runId + "' not found"));
    LOG.debug("Control job {} is {}", control.id(), control.dispatchState());
    return new BackfillScheduler(registry, backend, ControlSignal.of(control), options);
  }

  /**
   * Starts the run and returns its results as a lazy stream.
   *
   * <p>Work happens as the stream is consumed: each element is produced only after its replay has
   * completed. The stream ends when every job is exhausted or the control signal goes inactive.
   *
   * @return the replay results, in the order the replays completed
   * @throws IllegalStateException if the run was already started
   */
  public Stream<ReplayResult> run() {
    if (!started.compareAndSet(false, true)) {
      throw new IllegalStateException("backfill run already started");
    }
    LOG.info(
        "Backfilling jobs matching '{}' for outage {} .. {}",
        options.nameFilter().pattern(),
        options.window().start(),
        options.window().end());
    return StreamSupport.stream(
        Spliterators.spliteratorUnknownSize(
            new ReplayIterator(), Spliterator.ORDERED | Spliterator.NONNULL),
        false);
  }

  /** A job being scanned, with its parsed schedule and expressions and the occurrence cursor. */
  private static final class JobCursor {
    final JobDefinition job;
    final OccurrenceEnumerator schedule;
    final RelativeTime earliest;
    final RelativeTime latest;
    Instant cursor;

    JobCursor(
        JobDefinition job,
        OccurrenceEnumerator schedule,
        RelativeTime earliest,
        RelativeTime latest,
        Instant cursor) {
      this.job = job;
      this.schedule = schedule;
      this.earliest = earliest;
      this.latest = latest;
      this.cursor = cursor;
    }
  }

  private final class ReplayIterator implements Iterator<ReplayResult> {
    private Iterator<JobDefinition> jobs;
    private JobCursor current;
    private ReplayResult next;
    private boolean computed;
    private boolean stopped;
    private int replayed;

    @Override
    public boolean hasNext() {
      computeNext();
      return next != null;
    }

    @Override
    public ReplayResult next() {
      computeNext();
      if (next == null) {
        throw new NoSuchElementException();
      }
      computed = false;
      return next;
    }

    private void computeNext() {
      if (computed) {
        return;
      }
      try {
        next = advance();
      } catch (RerunException e) {
        stopped = true;
        LOG.error("Backfill aborted: {}", e.getMessage());
        throw new UncheckedRerunException(e);
      }
      computed = true;
    }

    private ReplayResult advance() throws RerunException {
      if (jobs == null) {
        jobs = registry.jobs().iterator();
      }
      while (!stopped) {
        if (current == null) {
          if (!jobs.hasNext()) {
            LOG.info("Backfill complete: {} replays", replayed);
            stopped = true;
            return null;
          }
          current = startJob(jobs.next());
          continue;
        }

        if (!signal.isActive()) {
          LOG.info("Control job no longer running; stopping after {} replays", replayed);
          stopped = true;
          return null;
        }

        ReplayResult result = replayNext(current);
        if (result != null) {
          replayed++;
          return result;
        }
      }
      return null;
    }

    /** Returns a cursor for {@code job}, or null if the job is skipped. */
    private JobCursor startJob(JobDefinition job) {
      if (!options.nameFilter().matcher(job.name()).find()) {
        return null;
      }
      if (!job.isActive()) {
        LOG.debug(
            "Skipping {}: scheduled={} disabled={}", job.name(), job.scheduled(), job.disabled());
        return null;
      }
      try {
        JobCursor cursor =
            new JobCursor(
                job,
                OccurrenceEnumerator.forCron(job.cronSchedule(), options.zone()),
                RelativeTime.parse(job.earliestPattern()),
                RelativeTime.parse(job.latestPattern()),
                options.window().start());
        LOG.info("Replaying {} on schedule '{}'", job.name(), job.cronSchedule());
        return cursor;
      } catch (RerunException e) {
        skip(job, e);
        return null;
      }
    }

    /**
     * Replays the occurrence after the cursor. Returns null and clears {@link #current} when the
     * job is exhausted or skipped.
     */
    private ReplayResult replayNext(JobCursor c) throws RerunException {
      Instant runTime = c.schedule.next(c.cursor).orElse(null);
      if (runTime == null || !options.window().accepts(runTime)) {
        LOG.debug("{} has no more occurrences in the outage window", c.job.name());
        current = null;
        return null;
      }
      c.cursor = runTime;

      Instant earliest;
      Instant latest;
      try {
        earliest = c.earliest.evaluate(runTime, options.zone());
        latest = c.latest.evaluate(runTime, options.zone());
      } catch (RerunException e) {
        skip(c.job, e);
        current = null;
        return null;
      }

      DispatchRequest request =
          new DispatchRequest(runTime, earliest, latest, options.triggerActions());
      JobHandle handle = backend.submit(c.job, request);
      LOG.debug(
          "Dispatched {} as {} for {} (earliest={}, latest={})",
          c.job.name(),
          handle.id(),
          runTime,
          earliest,
          latest);

      try {
        await(handle);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        LOG.warn("Interrupted while waiting for {}; stopping backfill", handle.id());
        stopped = true;
        return null;
      }

      String message =
          c.job.name() + " ran successfully for scheduled time " + runTime.getEpochSecond();
      LOG.info(message);
      return new ReplayResult(
          options.clock().instant(),
          message,
          c.job.name(),
          runTime,
          earliest,
          latest,
          options.triggerActions(),
          handle.isDone(),
          handle.doneProgress() * 100.0,
          handle.scanCount(),
          handle.eventCount(),
          handle.resultCount());
    }

    private void await(JobHandle handle) throws RerunException, InterruptedException {
      options.sleeper().sleep(options.settleDelay());
      handle.refresh();
      while (!handle.isDone()) {
        LOG.debug("{} is {}% done", handle.id(), handle.doneProgress() * 100.0);
        options.sleeper().sleep(options.pollInterval());
        handle.refresh();
      }
    }

    private void skip(JobDefinition job, RerunException e) {
      LOG.warn("Skipping {}: {}", job.name(), e.displayRich());
    }
  }
}
