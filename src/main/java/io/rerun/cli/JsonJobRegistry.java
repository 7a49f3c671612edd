package io.rerun.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.rerun.RerunException;
import io.rerun.backfill.ControlJob;
import io.rerun.backfill.JobDefinition;
import io.rerun.backfill.JobRegistry;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Job registry backed by a JSON file of saved-search style objects:
 *
 * <pre>{@code
 * [
 *   {
 *     "name": "TEST-0001-test search",
 *     "cron_schedule": "0 4 * * *",
 *     "dispatch.earliest_time": "-1d@d",
 *     "dispatch.latest_time": "@d",
 *     "is_scheduled": "1",
 *     "disabled": "0"
 *   }
 * ]
 * }</pre>
 */
final class JsonJobRegistry implements JobRegistry {
  private final List<JobDefinition> jobs;
  private final ControlJob control;

  JsonJobRegistry(List<JobDefinition> jobs, ControlJob control) {
    this.jobs = List.copyOf(jobs);
    this.control = control;
  }

  /**
   * Reads job definitions from {@code file}.
   *
   * @throws RerunException with kind BACKEND if the file cannot be read or is not a JSON array
   */
  static JsonJobRegistry load(ObjectMapper mapper, Path file, ControlJob control)
      throws RerunException {
    JsonNode root;
    try {
      root = mapper.readTree(file.toFile());
    } catch (IOException e) {
      throw RerunException.backend("cannot read jobs file " + file + ": " + e.getMessage(), e);
    }
    if (root == null || !root.isArray()) {
      throw RerunException.backend("jobs file " + file + " must contain a JSON array", null);
    }

    List<JobDefinition> jobs = new ArrayList<>();
    for (JsonNode node : root) {
      jobs.add(
          JobDefinition.fromRegistry(
              text(node, "name"),
              text(node, "cron_schedule"),
              text(node, "dispatch.earliest_time"),
              text(node, "dispatch.latest_time"),
              text(node, "is_scheduled"),
              text(node, "disabled")));
    }
    return new JsonJobRegistry(jobs, control);
  }

  private static String text(JsonNode node, String field) throws RerunException {
    JsonNode value = node.get(field);
    if (value == null || value.isNull()) {
      if (field.equals("name")) {
        throw RerunException.backend("job entry without a name: " + node, null);
      }
      return null;
    }
    return value.asText();
  }

  @Override
  public List<JobDefinition> jobs() {
    return jobs;
  }

  @Override
  public Optional<ControlJob> findControlJob(String runId) {
    return control.id().equals(runId) ? Optional.of(control) : Optional.empty();
  }
}
