package cutshoot.cli;

import com.google.common.base.Splitter;
import cutshoot.core.InvalidInputException;
import java.util.List;
import java.util.Locale;

/** Shared helpers for CLI argument parsing. */
final class CliParsers {
  private static final Splitter LIST_SPLITTER = Splitter.on(',').trimResults().omitEmptyStrings();

  private CliParsers() {}

  static int parseInt(String raw, String optionName) {
    try {
      return Integer.parseInt(requireValue(raw, optionName).trim());
    } catch (NumberFormatException ex) {
      throw new InvalidInputException("Invalid integer for " + optionName + ": " + raw);
    }
  }

  static long parseLong(String raw, String optionName) {
    try {
      return Long.parseLong(requireValue(raw, optionName).trim());
    } catch (NumberFormatException ex) {
      throw new InvalidInputException("Invalid long for " + optionName + ": " + raw);
    }
  }

  static double parseDouble(String raw, String optionName) {
    try {
      return Double.parseDouble(requireValue(raw, optionName).trim());
    } catch (NumberFormatException ex) {
      throw new InvalidInputException("Invalid number for " + optionName + ": " + raw);
    }
  }

  static boolean parseBoolean(String raw, String optionName) {
    return switch (requireValue(raw, optionName).trim().toLowerCase(Locale.ROOT)) {
      case "true", "yes", "1", "on" -> true;
      case "false", "no", "0", "off" -> false;
      default -> throw new InvalidInputException("Invalid boolean for " + optionName + ": " + raw);
    };
  }

  /** Seconds (fractional allowed) to milliseconds. */
  static long parseSecondsAsMillis(String raw, String optionName) {
    double seconds = parseDouble(raw, optionName);
    if (!Double.isFinite(seconds) || seconds < 0) {
      throw new InvalidInputException(optionName + " must be a non-negative number of seconds");
    }
    return Math.round(seconds * 1000.0);
  }

  static List<String> parseList(String raw, String optionName) {
    List<String> values = LIST_SPLITTER.splitToList(requireValue(raw, optionName));
    if (values.isEmpty()) {
      throw new InvalidInputException("No values provided for " + optionName);
    }
    return values;
  }

  static List<Integer> parseIntList(String raw, String optionName) {
    return parseList(raw, optionName).stream().map(value -> parseInt(value, optionName)).toList();
  }

  private static String requireValue(String raw, String optionName) {
    if (raw == null || raw.isBlank()) {
      throw new InvalidInputException("Missing value for " + optionName);
    }
    return raw;
  }
}
