package io.opendate.iso;

import io.opendate.DateParseException;
import io.opendate.ParseResult;
import io.opendate.ParseResult.Field;
import io.opendate.Span;
import io.opendate.util.Fractions;
import io.opendate.util.TzOffsets;
import java.time.LocalDate;
import java.time.Year;
import java.util.OptionalInt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Strict ISO 8601 parser.
 *
 * <p>Accepted dates are {@code YYYY}, {@code YYYY-MM}, {@code YYYY-MM-DD}, {@code
 * YYYYMMDD}, week dates {@code YYYY-Www[-D]} / {@code YYYYWww[D]} and ordinal dates {@code
 * YYYY-DDD} / {@code YYYYDDD}. Times are {@code HH[:MM[:SS[.f]]]} or the compact {@code
 * HH[MM[SS[.f]]]}, with an optional {@code Z}, {@code ±HH}, {@code ±HHMM} or {@code ±HH:MM}
 * suffix. Trailing whitespace is allowed; any other leftover character is an error.
 *
 * <p>Reduced precision is filled with minimums: "2016" is January 1st, and "10" as a time is
 * 10:00:00.000000. Instances are immutable and safe to share.
 */
public final class IsoParser {
  private static final Logger log = LoggerFactory.getLogger(IsoParser.class);

  /** A parser using {@code 'T'} between date and time. */
  public static final IsoParser DEFAULT = new IsoParser('T');

  private static final int MAX_FRACTION_DIGITS = 9;

  // Date, time and offset punctuation plus the week and zulu designators.
  private static final String GRAMMAR_CHARS = "-:+.,WZz";

  private final char separator;

  /**
   * Creates a parser with a custom date/time separator.
   *
   * @param separator a single ASCII character that is neither a digit nor one of {@code
   *     -:+.,WZz}
   * @throws IllegalArgumentException if the separator is not ASCII, is a digit or is a character
   *     the date and time grammar already uses
   */
  public IsoParser(char separator) {
    if (separator > 0x7f || (separator >= '0' && separator <= '9')) {
      throw new IllegalArgumentException(
          "separator must be a single non-digit ASCII character: '" + separator + "'");
    }
    if (GRAMMAR_CHARS.indexOf(separator) >= 0) {
      throw new IllegalArgumentException(
          "separator '" + separator + "' is part of the ISO 8601 grammar");
    }
    this.separator = separator;
  }

  public char separator() {
    return separator;
  }

  /**
   * Parses a date, optionally followed by the separator and a time.
   *
   * @param input the text to parse
   * @return the date fields, plus time fields if a time was present
   * @throws DateParseException if the text is not strict ISO 8601
   */
  public ParseResult parse(String input) throws DateParseException {
    Cursor c = new Cursor(input);
    ParseResult.Builder result = ParseResult.builder(c.input);
    date(c, result);
    if (!c.restIsBlank()) {
      if (c.peek() != separator) {
        throw c.malformed("unexpected character '" + c.peek() + "' after date");
      }
      c.pos++;
      time(c, result);
    }
    return finish(c, result);
  }

  /**
   * Parses a date with nothing after it.
   *
   * @param input the text to parse
   * @return the date fields
   * @throws DateParseException if the text is not a strict ISO 8601 date
   */
  public ParseResult parseDate(String input) throws DateParseException {
    Cursor c = new Cursor(input);
    ParseResult.Builder result = ParseResult.builder(c.input);
    date(c, result);
    return finish(c, result);
  }

  /**
   * Parses a time with nothing before it.
   *
   * @param input the text to parse
   * @return the time fields, plus the offset if present
   * @throws DateParseException if the text is not a strict ISO 8601 time
   */
  public ParseResult parseTime(String input) throws DateParseException {
    Cursor c = new Cursor(input);
    ParseResult.Builder result = ParseResult.builder(c.input);
    time(c, result);
    return finish(c, result);
  }

  private ParseResult finish(Cursor c, ParseResult.Builder result) throws DateParseException {
    if (!c.restIsBlank()) {
      throw c.malformed("unexpected trailing characters");
    }
    ParseResult parsed = result.build();
    log.debug("parsed '{}' as {}", c.input, parsed);
    return parsed;
  }

  // --- dates ---

  private void date(Cursor c, ParseResult.Builder result) throws DateParseException {
    if (c.atEnd()) {
      throw DateParseException.malformedIso("empty input", Span.at(0), c.input);
    }
    int yearStart = c.pos;
    int year = c.digits(4, "year");
    Span yearSpan = new Span(yearStart, c.pos);

    if (c.atEnd() || c.peek() == separator || c.restIsBlank()) {
      setDate(result, year, 1, 1, yearSpan);
      return;
    }

    boolean dashed = c.peek() == '-';
    if (dashed) {
      c.pos++;
    }
    if (c.atEnd()) {
      throw c.malformed("expected month, week or day of year");
    }
    if (c.peek() == 'W') {
      weekDate(c, result, year, dashed, yearStart);
      return;
    }

    int run = c.digitRun();
    if (run == 3) {
      ordinalDate(c, result, year, yearStart);
    } else if (dashed && run == 2) {
      int month = c.digits(2, "month");
      int day = 1;
      if (!c.atEnd() && c.peek() == '-') {
        c.pos++;
        day = c.digits(2, "day");
      }
      setDate(result, year, month, day, new Span(yearStart, c.pos));
    } else if (!dashed && run == 4) {
      int month = c.digits(2, "month");
      int day = c.digits(2, "day");
      setDate(result, year, month, day, new Span(yearStart, c.pos));
    } else {
      throw c.malformed("expected month, week or day of year");
    }
  }

  private void weekDate(
      Cursor c, ParseResult.Builder result, int year, boolean dashed, int start)
      throws DateParseException {
    c.pos++;
    int week = c.digits(2, "week");
    int day = 1;
    if (!c.atEnd() && c.peek() != separator && !c.restIsBlank()) {
      if ((c.peek() == '-') != dashed) {
        throw c.malformed("inconsistent use of dash separator");
      }
      if (dashed) {
        c.pos++;
      }
      day = c.digits(1, "day of week");
    }
    Span span = new Span(start, c.pos);
    if (week < 1 || week > IsoWeekDates.weeksInYear(year)) {
      throw DateParseException.invalidWeekDate(
          "week " + week + " is out of range for " + year, span, c.input);
    }
    if (day < 1 || day > 7) {
      throw DateParseException.invalidWeekDate(
          "day of week " + day + " is out of range", span, c.input);
    }
    LocalDate date = IsoWeekDates.toDate(year, week, day);
    setDate(result, date.getYear(), date.getMonthValue(), date.getDayOfMonth(), span);
  }

  private void ordinalDate(Cursor c, ParseResult.Builder result, int year, int start)
      throws DateParseException {
    int dayOfYear = c.digits(3, "day of year");
    Span span = new Span(start, c.pos);
    if (dayOfYear < 1 || dayOfYear > Year.of(year).length()) {
      throw DateParseException.invalidNumeric(
          "day of year " + dayOfYear + " is out of range for " + year, span, c.input);
    }
    LocalDate date = LocalDate.ofYearDay(year, dayOfYear);
    setDate(result, year, date.getMonthValue(), date.getDayOfMonth(), span);
  }

  private static void setDate(ParseResult.Builder result, int year, int month, int day, Span span)
      throws DateParseException {
    result.set(Field.YEAR, year, span);
    result.set(Field.MONTH, month, span);
    result.set(Field.DAY, day, span);
  }

  // --- times ---

  private void time(Cursor c, ParseResult.Builder result) throws DateParseException {
    int start = c.pos;
    result.set(Field.HOUR, c.digits(2, "hour"), new Span(start, c.pos));
    int minute = 0;
    int second = 0;
    int micros = 0;

    boolean colon = !c.atEnd() && c.peek() == ':';
    if (colon) {
      c.pos++;
    }
    if (colon || c.peekDigit()) {
      minute = c.digits(2, "minute");
      boolean secondColon = !c.atEnd() && c.peek() == ':';
      if (secondColon && !colon) {
        throw c.malformed("inconsistent use of colon separator");
      }
      if (colon && c.peekDigit()) {
        throw c.malformed("inconsistent use of colon separator");
      }
      if (secondColon) {
        c.pos++;
      }
      if (secondColon || c.peekDigit()) {
        second = c.digits(2, "second");
        if (!c.atEnd() && (c.peek() == '.' || c.peek() == ',')) {
          c.pos++;
          micros = fraction(c);
        }
      }
    }
    Span span = new Span(start, c.pos);
    result.set(Field.MINUTE, minute, span);
    result.set(Field.SECOND, second, span);
    result.set(Field.MICROSECOND, micros, span);

    if (!c.atEnd()) {
      zone(c, result);
    }
  }

  private static int fraction(Cursor c) throws DateParseException {
    int start = c.pos;
    int run = c.digitRun();
    if (run == 0 || run > MAX_FRACTION_DIGITS) {
      throw c.malformed("fraction must have 1 to " + MAX_FRACTION_DIGITS + " digits");
    }
    c.pos += run;
    return Fractions.toMicroseconds(c.input.substring(start, c.pos));
  }

  private static void zone(Cursor c, ParseResult.Builder result) throws DateParseException {
    int start = c.pos;
    char ch = c.peek();
    if (ch == 'Z' || ch == 'z') {
      c.pos++;
      Span span = new Span(start, c.pos);
      result.set(Field.TZOFFSET, 0, span);
      result.tzname("UTC", span);
      return;
    }
    if (ch != '+' && ch != '-') {
      return;
    }
    c.pos++;
    int bodyStart = c.pos;
    while (!c.atEnd() && (c.peekDigit() || c.peek() == ':')) {
      c.pos++;
    }
    Span span = new Span(start, c.pos);
    OptionalInt offset =
        TzOffsets.parse(ch, c.input.substring(bodyStart, c.pos), span, c.input);
    if (offset.isEmpty()) {
      throw DateParseException.malformedIso("malformed UTC offset", span, c.input);
    }
    result.set(Field.TZOFFSET, offset.getAsInt(), span);
  }

  /** Read position over one input string. */
  private static final class Cursor {
    final String input;
    int pos;

    Cursor(String input) {
      this.input = input == null ? "" : input;
    }

    boolean atEnd() {
      return pos >= input.length();
    }

    char peek() {
      return input.charAt(pos);
    }

    boolean peekDigit() {
      return !atEnd() && isDigit(input.charAt(pos));
    }

    boolean restIsBlank() {
      return input.substring(Math.min(pos, input.length())).isBlank();
    }

    // Length of the digit run at pos, without consuming it.
    int digitRun() {
      int end = pos;
      while (end < input.length() && isDigit(input.charAt(end))) {
        end++;
      }
      return end - pos;
    }

    int digits(int count, String what) throws DateParseException {
      if (pos + count > input.length()) {
        throw malformed("expected " + count + "-digit " + what);
      }
      int value = 0;
      for (int i = 0; i < count; i++) {
        char ch = input.charAt(pos + i);
        if (!isDigit(ch)) {
          throw DateParseException.malformedIso(
              "expected " + count + "-digit " + what, Span.at(pos + i), input);
        }
        value = value * 10 + (ch - '0');
      }
      pos += count;
      return value;
    }

    DateParseException malformed(String message) {
      return DateParseException.malformedIso(message, Span.at(pos), input);
    }

    private static boolean isDigit(char ch) {
      return ch >= '0' && ch <= '9';
    }
  }
}
