package io.opendate.util;

import io.opendate.DateParseException;
import io.opendate.Span;
import java.util.OptionalInt;

/**
 * Reads {@code ±HH}, {@code ±HHMM} and {@code ±HH:MM} UTC offsets.
 *
 * <p>Shared by both resolvers so that numeric offsets have identical semantics everywhere.
 */
public final class TzOffsets {
  private TzOffsets() {}

  /**
   * Converts an offset body to signed seconds.
   *
   * @param sign '+' or '-'
   * @param body the digits after the sign: "HH", "HHMM" or "HH:MM"
   * @param span the location of the offset, for error reporting
   * @param input the original input, for error reporting
   * @return the offset in seconds, or empty if {@code body} has none of the three shapes
   * @throws DateParseException if the hours exceed 23 or the minutes exceed 59
   */
  public static OptionalInt parse(char sign, String body, Span span, String input)
      throws DateParseException {
    int mult;
    if (sign == '+') {
      mult = 1;
    } else if (sign == '-') {
      mult = -1;
    } else {
      return OptionalInt.empty();
    }

    int hours;
    int minutes;
    if (body.length() == 2 && isDigits(body)) {
      hours = Integer.parseInt(body);
      minutes = 0;
    } else if (body.length() == 4 && isDigits(body)) {
      hours = Integer.parseInt(body.substring(0, 2));
      minutes = Integer.parseInt(body.substring(2));
    } else if (body.length() == 5
        && body.charAt(2) == ':'
        && isDigits(body.substring(0, 2))
        && isDigits(body.substring(3))) {
      hours = Integer.parseInt(body.substring(0, 2));
      minutes = Integer.parseInt(body.substring(3));
    } else {
      return OptionalInt.empty();
    }
    return OptionalInt.of(toSeconds(mult, hours, minutes, span, input));
  }

  /**
   * Combines a sign, hours and minutes into signed seconds.
   *
   * @param mult 1 or -1
   * @param hours the hour part, 0..23
   * @param minutes the minute part, 0..59
   * @param span the location of the offset, for error reporting
   * @param input the original input, for error reporting
   * @return the offset in seconds
   * @throws DateParseException if either part is out of range
   */
  public static int toSeconds(int mult, int hours, int minutes, Span span, String input)
      throws DateParseException {
    if (hours > 23) {
      throw DateParseException.invalidNumeric("invalid hours in offset: " + hours, span, input);
    }
    if (minutes > 59) {
      throw DateParseException.invalidNumeric(
          "invalid minutes in offset: " + minutes, span, input);
    }
    return mult * (hours * 3600 + minutes * 60);
  }

  private static boolean isDigits(String s) {
    for (int i = 0; i < s.length(); i++) {
      char c = s.charAt(i);
      if (c < '0' || c > '9') {
        return false;
      }
    }
    return !s.isEmpty();
  }
}
