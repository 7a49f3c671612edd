package io.rerun.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.rerun.backfill.ReplayResult;
import java.io.PrintStream;

/** Writes replay results as JSON lines, one object per result. */
final class ResultWriter {
  private final ObjectMapper mapper;
  private final PrintStream out;

  ResultWriter(ObjectMapper mapper, PrintStream out) {
    this.mapper = mapper;
    this.out = out;
  }

  void write(ReplayResult r) {
    try {
      out.println(mapper.writeValueAsString(toJson(r)));
    } catch (JsonProcessingException e) {
      // ObjectNode of scalars always serializes
      throw new IllegalStateException(e);
    }
  }

  ObjectNode toJson(ReplayResult r) {
    ObjectNode node = mapper.createObjectNode();
    node.put("_time", r.emittedAt().getEpochSecond());
    node.put("Message", r.message());
    node.put("Search", r.jobName());
    node.put("MissedRunTime", r.missedRunTime().getEpochSecond());
    node.put("MissedEarliest", r.missedEarliest().getEpochSecond());
    node.put("MissedLatest", r.missedLatest().getEpochSecond());
    node.put("TriggerActions", r.triggerActions());
    node.put("Finished", r.finished());
    node.put("CompletionPercentage", r.completionPercentage());
    node.put("ScanCount", r.scanCount());
    node.put("EventCount", r.eventCount());
    node.put("ResultCount", r.resultCount());
    return node;
  }
}
