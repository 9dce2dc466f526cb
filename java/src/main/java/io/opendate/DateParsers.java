package io.opendate;

import io.opendate.iso.IsoParser;
import io.opendate.parser.ClockTimeParser;
import io.opendate.parser.HeuristicParser;
import java.util.Objects;

/**
 * The main entry point for turning strings into date/time components.
 *
 * <p>Example usage:
 *
 * <pre>{@code
 * ParseResult r = DateParsers.parse("Thu Sep 25 10:36:28 BRST 2003");
 * r.year();    // OptionalInt[2003]
 * r.tzname();  // Optional[BRST]
 *
 * ParseResult iso = DateParsers.isoparse("2012-W05-5");
 * iso.toLocalDate();  // Optional[2012-02-03]
 * }</pre>
 *
 * <p>Every method is a pure function of its arguments and safe to call from any thread.
 */
public final class DateParsers {
  private DateParsers() {}

  /**
   * Parses free-form text with the default preferences (month first, year last, not fuzzy).
   *
   * @param input the text to interpret
   * @return the recovered components
   * @throws DateParseException if the text cannot be interpreted
   */
  public static ParseResult parse(String input) throws DateParseException {
    return parse(input, ParserConfig.DEFAULT);
  }

  /**
   * Parses free-form text.
   *
   * @param input the text to interpret
   * @param config day-first, year-first and fuzzy preferences
   * @return the recovered components
   * @throws DateParseException if the text cannot be interpreted
   */
  public static ParseResult parse(String input, ParserConfig config) throws DateParseException {
    Objects.requireNonNull(config, "config");
    return HeuristicParser.parse(input, config);
  }

  /**
   * Parses free-form text, skipping what cannot be attributed and reporting it.
   *
   * @param input the text to interpret
   * @param config the preferences; must be fuzzy
   * @return the components and the skipped substrings
   * @throws DateParseException if no date or time can be recovered
   * @throws IllegalArgumentException if {@code config} is not fuzzy
   */
  public static FuzzyResult parseFuzzyWithTokens(String input, ParserConfig config)
      throws DateParseException {
    Objects.requireNonNull(config, "config");
    if (!config.fuzzy()) {
      throw new IllegalArgumentException("parseFuzzyWithTokens requires a fuzzy config");
    }
    return HeuristicParser.parseWithSkipped(input, config.withSkippedTokens());
  }

  /**
   * Parses a strict ISO 8601 date, optionally followed by {@code 'T'} and a time.
   *
   * @param input the text to parse
   * @return the date fields, plus time fields if present
   * @throws DateParseException if the text is not strict ISO 8601
   */
  public static ParseResult isoparse(String input) throws DateParseException {
    return IsoParser.DEFAULT.parse(input);
  }

  /**
   * Parses a strict ISO 8601 date-time with a custom date/time separator.
   *
   * @param input the text to parse
   * @param separator the character between date and time
   * @return the date fields, plus time fields if present
   * @throws DateParseException if the text is not strict ISO 8601
   * @throws IllegalArgumentException if the separator is a digit or not ASCII
   */
  public static ParseResult isoparse(String input, char separator) throws DateParseException {
    return new IsoParser(separator).parse(input);
  }

  /**
   * Parses a strict ISO 8601 date with nothing after it.
   *
   * @param input the text to parse
   * @return the date fields
   * @throws DateParseException if the text is not a strict ISO 8601 date
   */
  public static ParseResult parseIsoDate(String input) throws DateParseException {
    return IsoParser.DEFAULT.parseDate(input);
  }

  /**
   * Parses a strict ISO 8601 time, with optional offset.
   *
   * @param input the text to parse
   * @return the time fields
   * @throws DateParseException if the text is not a strict ISO 8601 time
   */
  public static ParseResult parseIsoTime(String input) throws DateParseException {
    return IsoParser.DEFAULT.parseTime(input);
  }

  /**
   * Parses a clock time such as "9:30 pm", "14.30.15" or "1430".
   *
   * @param input the text to parse
   * @return the time fields
   * @throws DateParseException if the text is not a time of day
   */
  public static ParseResult parseTime(String input) throws DateParseException {
    return ClockTimeParser.parse(input);
  }

  /**
   * Checks whether {@link #parse(String)} would succeed, without throwing.
   *
   * @param input the text to check
   * @return true if the text can be interpreted
   */
  public static boolean isParseable(String input) {
    try {
      HeuristicParser.parse(input, ParserConfig.DEFAULT);
      return true;
    } catch (DateParseException e) {
      return false;
    }
  }
}
