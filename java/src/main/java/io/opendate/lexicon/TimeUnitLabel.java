package io.opendate.lexicon;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/** A unit label written next to a number, as in "10h36m" or "36 minutes". */
public enum TimeUnitLabel {
  HOUR,
  MINUTE,
  SECOND;

  private static final Map<String, TimeUnitLabel> PARSE_MAP =
      Map.ofEntries(
          Map.entry("h", HOUR),
          Map.entry("hour", HOUR),
          Map.entry("hours", HOUR),
          Map.entry("m", MINUTE),
          Map.entry("minute", MINUTE),
          Map.entry("minutes", MINUTE),
          Map.entry("s", SECOND),
          Map.entry("second", SECOND),
          Map.entry("seconds", SECOND));

  /**
   * Parses a unit label (case insensitive).
   *
   * @param s the string to parse
   * @return the unit if recognized
   */
  public static Optional<TimeUnitLabel> parse(String s) {
    return Optional.ofNullable(PARSE_MAP.get(s.toLowerCase(Locale.ROOT)));
  }

  /**
   * Returns the next smaller unit, used for a number written after its label ("01h02" is 1:02).
   *
   * @return the smaller unit, or empty after seconds
   */
  public Optional<TimeUnitLabel> smaller() {
    return switch (this) {
      case HOUR -> Optional.of(MINUTE);
      case MINUTE -> Optional.of(SECOND);
      case SECOND -> Optional.empty();
    };
  }
}
