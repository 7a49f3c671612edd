package io.rerun.cli;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Parsed {@code --name value} arguments.
 *
 * @param regex the job name filter
 * @param from the outage start, as written
 * @param to the outage end, as written
 * @param jobsFile the jobs file path
 * @param trigger whether replays fire the jobs' actions
 * @param timezone the zone id, or null for the system default
 */
record CommandLine(
    String regex, String from, String to, String jobsFile, boolean trigger, String timezone) {
  static final String USAGE =
      "usage: rerun --regex <pattern> --from <time> --to <time> --jobs <jobs.json>"
          + " [--trigger true|false] [--tz <zone>]";

  private static final Set<String> NAMES = Set.of("regex", "from", "to", "jobs", "trigger", "tz");

  /**
   * Parses command-line arguments.
   *
   * @throws IllegalArgumentException if an option is unknown, repeated, missing its value, or a
   *     required option is absent
   */
  static CommandLine parse(String[] args) {
    Map<String, String> values = new HashMap<>();
    for (int i = 0; i < args.length; i++) {
      String arg = args[i];
      if (!arg.startsWith("--")) {
        throw new IllegalArgumentException("unexpected argument '" + arg + "'");
      }
      String name = arg.substring(2);
      if (!NAMES.contains(name)) {
        throw new IllegalArgumentException("unknown option '" + arg + "'");
      }
      if (i + 1 >= args.length) {
        throw new IllegalArgumentException("option '" + arg + "' needs a value");
      }
      if (values.put(name, args[++i]) != null) {
        throw new IllegalArgumentException("option '" + arg + "' given twice");
      }
    }

    return new CommandLine(
        required(values, "regex"),
        required(values, "from"),
        required(values, "to"),
        required(values, "jobs"),
        parseBoolean(values.getOrDefault("trigger", "false")),
        values.get("tz"));
  }

  private static String required(Map<String, String> values, String name) {
    String value = values.get(name);
    if (value == null || value.isEmpty()) {
      throw new IllegalArgumentException("missing required option '--" + name + "'");
    }
    return value;
  }

  // Accepts the spellings Splunk's boolean validator accepts.
  private static boolean parseBoolean(String s) {
    switch (s.toLowerCase(Locale.ROOT)) {
      case "1":
      case "t":
      case "true":
      case "y":
      case "yes":
        return true;
      case "0":
      case "f":
      case "false":
      case "n":
      case "no":
        return false;
      default:
        throw new IllegalArgumentException("not a boolean: '" + s + "'");
    }
  }
}
