package io.rerun.cli;

import io.rerun.backfill.DispatchBackend;
import io.rerun.backfill.DispatchRequest;
import io.rerun.backfill.JobDefinition;
import io.rerun.backfill.JobHandle;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Backend that runs nothing: every replay completes at once with zero counts. */
final class DryRunBackend implements DispatchBackend {
  private static final Logger LOG = LoggerFactory.getLogger(DryRunBackend.class);

  private final AtomicInteger ids = new AtomicInteger();

  @Override
  public JobHandle submit(JobDefinition job, DispatchRequest request) {
    String id = "dryrun-" + ids.incrementAndGet();
    LOG.info(
        "[dry run] {} {} earliest={} latest={} trigger={}",
        id,
        job.name(),
        request.earliest(),
        request.latest(),
        request.triggerActions());
    return new CompletedHandle(id);
  }

  private static final class CompletedHandle implements JobHandle {
    private final String id;

    CompletedHandle(String id) {
      this.id = id;
    }

    @Override
    public String id() {
      return id;
    }

    @Override
    public void refresh() {}

    @Override
    public boolean isDone() {
      return true;
    }

    @Override
    public double doneProgress() {
      return 1.0;
    }

    @Override
    public long scanCount() {
      return 0;
    }

    @Override
    public long eventCount() {
      return 0;
    }

    @Override
    public long resultCount() {
      return 0;
    }
  }
}
