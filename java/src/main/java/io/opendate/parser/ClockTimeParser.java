package io.opendate.parser;

import io.opendate.DateParseException;
import io.opendate.ParseResult;
import io.opendate.ParseResult.Field;
import io.opendate.Span;
import io.opendate.lexer.Lexer;
import io.opendate.lexer.Token;
import io.opendate.lexicon.Meridiem;
import io.opendate.util.Fractions;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Parses a bare time of day: {@code 9:30}, {@code 09.30.15,5}, {@code 1430}, {@code 143015.25},
 * each optionally followed by {@code am}, {@code pm}, {@code a.m.} or {@code p.m.}.
 *
 * <p>Unlike {@link HeuristicParser} nothing is skipped and no date part is accepted.
 */
public final class ClockTimeParser {
  private final String input;
  private final List<Token> tokens;
  private int pos;

  private ClockTimeParser(String input, List<Token> tokens) {
    this.input = input;
    this.tokens = tokens;
    this.pos = 0;
  }

  /**
   * Parses a time of day.
   *
   * @param input the text to parse
   * @return a result with only time fields set
   * @throws DateParseException if the text is not a time of day or a value is out of range
   */
  public static ParseResult parse(String input) throws DateParseException {
    String text = input == null ? "" : input;
    if (text.isBlank()) {
      throw DateParseException.noComponents(text);
    }
    return new ClockTimeParser(text, Lexer.tokenize(text)).parseClock();
  }

  private ParseResult parseClock() throws DateParseException {
    skipSpaces();
    Token first = expectDigits();
    ParseResult.Builder result = ParseResult.builder(input);
    int hour;
    Span hourSpan;

    if (first.length() <= 2 && (check(':') || check('.'))) {
      hour = Integer.parseInt(first.text());
      hourSpan = first.span();
      pos++;
      Token minute = expectDigits(2);
      result.set(Field.MINUTE, Integer.parseInt(minute.text()), minute.span());
      if ((check(':') || check('.')) && digitsAhead(1, 2)) {
        pos++;
        Token second = expectDigits(2);
        result.set(Field.SECOND, Integer.parseInt(second.text()), second.span());
        fraction(result);
      }
    } else if (first.length() == 4 || first.length() == 6) {
      String digits = first.text();
      hour = Integer.parseInt(digits.substring(0, 2));
      hourSpan = first.span();
      result.set(Field.MINUTE, Integer.parseInt(digits.substring(2, 4)), first.span());
      if (first.length() == 6) {
        result.set(Field.SECOND, Integer.parseInt(digits.substring(4)), first.span());
        fraction(result);
      }
    } else {
      throw DateParseException.unrecognized(first.text(), first.span(), input);
    }

    skipSpaces();
    Optional<Meridiem> meridiem = marker();
    skipSpaces();
    if (pos < tokens.size()) {
      Token extra = tokens.get(pos);
      throw DateParseException.unrecognized(extra.text(), extra.span(), input);
    }

    if (meridiem.isPresent()) {
      if (hour < 1 || hour > 12) {
        throw DateParseException.invalidNumeric(
            "hour " + hour + " is not a 12-hour clock value", hourSpan, input);
      }
      hour = meridiem.get().toHour24(hour);
    }
    result.set(Field.HOUR, hour, hourSpan);
    return result.build();
  }

  private void fraction(ParseResult.Builder result) throws DateParseException {
    if ((check('.') || check(',')) && digitsAhead(1, -1)) {
      pos++;
      Token frac = tokens.get(pos++);
      result.set(Field.MICROSECOND, Fractions.toMicroseconds(frac.text()), frac.span());
    }
  }

  private Optional<Meridiem> marker() throws DateParseException {
    if (pos >= tokens.size() || !tokens.get(pos).isLetters()) {
      return Optional.empty();
    }
    Token word = tokens.get(pos);
    String text = word.text().toLowerCase(Locale.ROOT);
    if (text.equals("am") || text.equals("pm")) {
      pos++;
      return Meridiem.parse(text);
    }
    // a.m. / p.m.
    if ((text.equals("a") || text.equals("p"))
        && pos + 2 < tokens.size()
        && tokens.get(pos + 1).is('.')
        && tokens.get(pos + 2).text().equalsIgnoreCase("m")) {
      pos += 3;
      if (check('.')) {
        pos++;
      }
      return Meridiem.parse(text);
    }
    throw DateParseException.unrecognized(word.text(), word.span(), input);
  }

  private void skipSpaces() {
    while (pos < tokens.size() && tokens.get(pos).isWhitespace()) {
      pos++;
    }
  }

  private boolean check(char ch) {
    return pos < tokens.size() && tokens.get(pos).is(ch);
  }

  // True if the token at pos + offset is a digit run of the given length (-1 for any).
  private boolean digitsAhead(int offset, int length) {
    int at = pos + offset;
    if (at >= tokens.size() || !tokens.get(at).isDigits()) {
      return false;
    }
    return length < 0 || tokens.get(at).length() == length;
  }

  private Token expectDigits() throws DateParseException {
    return expectDigits(-1);
  }

  private Token expectDigits(int length) throws DateParseException {
    if (pos >= tokens.size()) {
      throw DateParseException.unrecognized("", Span.at(input.length()), input);
    }
    Token tok = tokens.get(pos);
    if (!tok.isDigits() || (length >= 0 && tok.length() != length)) {
      throw DateParseException.unrecognized(tok.text(), tok.span(), input);
    }
    pos++;
    return tok;
  }
}
