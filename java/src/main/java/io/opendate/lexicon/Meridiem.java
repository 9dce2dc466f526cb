package io.opendate.lexicon;

import java.util.Locale;
import java.util.Optional;

/** An AM/PM marker on a 12-hour clock value. */
public enum Meridiem {
  AM,
  PM;

  /**
   * Parses "am", "a", "pm" or "p" (case insensitive). The single letters come from the dotted
   * forms "a.m." and "p.m.", which the lexer splits.
   *
   * @param s the string to parse
   * @return the marker if recognized
   */
  public static Optional<Meridiem> parse(String s) {
    return switch (s.toLowerCase(Locale.ROOT)) {
      case "am", "a" -> Optional.of(AM);
      case "pm", "p" -> Optional.of(PM);
      default -> Optional.empty();
    };
  }

  /**
   * Converts a 12-hour clock hour to 24-hour form: 12 AM is 0, 12 PM is 12, 1-11 PM add 12.
   * Other hours pass through unchanged.
   *
   * @param hour the hour as written
   * @return the 24-hour value
   */
  public int toHour24(int hour) {
    if (this == PM && hour < 12) {
      return hour + 12;
    }
    if (this == AM && hour == 12) {
      return 0;
    }
    return hour;
  }
}
