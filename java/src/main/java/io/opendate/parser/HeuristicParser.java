package io.opendate.parser;

import io.opendate.DateParseException;
import io.opendate.FuzzyResult;
import io.opendate.ParseResult;
import io.opendate.ParseResult.Field;
import io.opendate.ParserConfig;
import io.opendate.Span;
import io.opendate.lexer.Lexer;
import io.opendate.lexicon.Lexicon;
import io.opendate.lexicon.Meridiem;
import io.opendate.lexicon.MonthName;
import io.opendate.lexicon.TimeUnitLabel;
import io.opendate.lexicon.Weekday;
import io.opendate.util.CenturyWindow;
import io.opendate.util.Fractions;
import io.opendate.util.TzOffsets;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Interprets free-form date/time text such as "Thu Sep 25 10:36:28 BRST 2003" or "3rd of May
 * 2001".
 *
 * <p>Tokens are visited left to right. Each one is tried as a number, a weekday, a month name, an
 * AM/PM marker, a zone name, a signed offset and finally a filler word. Numbers that are not
 * obviously times are collected and placed into year, month and day once the whole input has
 * been seen. With {@link ParserConfig#fuzzy()} set, tokens no rule accepts are skipped instead of
 * failing the parse.
 */
public final class HeuristicParser {
  private static final Logger log = LoggerFactory.getLogger(HeuristicParser.class);

  private static final BigDecimal SIXTY = BigDecimal.valueOf(60);

  private final String input;
  private final ParserConfig config;
  private final List<Lexeme> lexemes;
  private final ParseResult.Builder result;
  private final YmdAccumulator ymd;
  private final List<Integer> skipped = new ArrayList<>();
  private boolean meridiemSeen;
  // Set after "GMT" or "UTC" directly before a sign: "GMT+3" means 3 hours behind GMT.
  private boolean reverseNextSign;

  private HeuristicParser(String input, ParserConfig config) {
    this.input = input;
    this.config = config;
    this.lexemes = Lexeme.fromTokens(Lexer.tokenize(input));
    this.result = ParseResult.builder(input);
    this.ymd = new YmdAccumulator(input);
  }

  /**
   * Parses {@code input} with the given preferences.
   *
   * @param input the text to interpret
   * @param config day-first, year-first and fuzzy preferences
   * @return the recovered components
   * @throws DateParseException if the text cannot be interpreted
   */
  public static ParseResult parse(String input, ParserConfig config) throws DateParseException {
    return parseWithSkipped(input, config).result();
  }

  /**
   * Parses {@code input} and also reports the runs of text that were skipped. Adjacent skipped
   * tokens are joined, so "Today is 25" reports "Today is " as one run.
   *
   * @param input the text to interpret
   * @param config the preferences; skipped runs are only collected when fuzzy is set
   * @return the components and the skipped runs
   * @throws DateParseException if the text cannot be interpreted
   */
  public static FuzzyResult parseWithSkipped(String input, ParserConfig config)
      throws DateParseException {
    String text = input == null ? "" : input;
    HeuristicParser parser = new HeuristicParser(text, config);
    ParseResult parsed = parser.run();
    log.debug("parsed '{}' as {}", text, parsed);
    return new FuzzyResult(parsed, parser.skippedRuns());
  }

  private ParseResult run() throws DateParseException {
    int n = lexemes.size();
    int i = 0;
    while (i < n) {
      Lexeme lex = lexemes.get(i);
      Optional<Weekday> weekday;
      Optional<MonthName> month;
      Optional<Meridiem> meridiem;

      if (lex.number()) {
        i = numeric(i);
      } else if ((weekday = Weekday.parse(lex.text())).isPresent()) {
        result.set(Field.WEEKDAY, weekday.get().index(), lex.span());
      } else if ((month = MonthName.parse(lex.text())).isPresent()) {
        i = monthName(i, month.get());
      } else if ((meridiem = Meridiem.parse(lex.text())).isPresent()) {
        applyMeridiem(i, meridiem.get());
      } else if (couldBeZoneName(lex)) {
        zoneName(i);
      } else if (result.isSet(Field.HOUR)
          && !result.isSet(Field.TZOFFSET)
          && (lex.is('+') || lex.is('-'))) {
        i = signedOffset(i);
      } else if (Lexicon.isJump(lex.text())) {
        skipped.add(i);
      } else if (config.fuzzy()) {
        log.trace("skipping '{}' at {}", lex.text(), lex.span().start());
        skipped.add(i);
      } else {
        throw DateParseException.unrecognized(lex.text(), lex.span(), input);
      }
      i++;
    }
    return finish();
  }

  private int monthName(int i, MonthName month) throws DateParseException {
    Lexeme lex = lexemes.get(i);
    ymd.appendMonth(month.number(), lex.span());
    int n = lexemes.size();
    if (i + 2 < n
        && (lexemes.get(i + 1).is('-') || lexemes.get(i + 1).is('/'))
        && isDateNumber(lexemes.get(i + 2))) {
      // Jan-01[-99]
      char sep = lexemes.get(i + 1).text().charAt(0);
      appendDateNumber(lexemes.get(i + 2));
      if (i + 4 < n && lexemes.get(i + 3).is(sep) && isDateNumber(lexemes.get(i + 4))) {
        appendDateNumber(lexemes.get(i + 4));
        i += 2;
      }
      i += 2;
    } else if (i + 4 < n
        && lexemes.get(i + 1).isSpace()
        && lexemes.get(i + 3).isSpace()
        && Lexicon.isPertain(lexemes.get(i + 2).text())) {
      // Jan of 01
      Lexeme yearLex = lexemes.get(i + 4);
      if (isDateNumber(yearLex)) {
        int year = yearLex.intValue();
        if (year < 100 && yearLex.integerDigits().length() <= 2) {
          year = CenturyWindow.expand(year);
        }
        ymd.appendYear(year, yearLex.span());
        i += 4;
      }
    }
    return i;
  }

  private void applyMeridiem(int i, Meridiem meridiem) throws DateParseException {
    Lexeme lex = lexemes.get(i);
    if (meridiemApplies(lex)) {
      int hour = result.peek(Field.HOUR).getAsInt();
      result.replaceHour(meridiem.toHour24(hour));
      meridiemSeen = true;
    } else if (config.fuzzy()) {
      skipped.add(i);
    }
  }

  private boolean meridiemApplies(Lexeme lex) throws DateParseException {
    if (config.fuzzy() && meridiemSeen) {
      return false;
    }
    OptionalInt hour = result.peek(Field.HOUR);
    if (hour.isEmpty()) {
      if (config.fuzzy()) {
        return false;
      }
      throw DateParseException.unrecognized(lex.text(), lex.span(), input);
    }
    if (hour.getAsInt() > 12) {
      if (config.fuzzy()) {
        return false;
      }
      throw DateParseException.invalidNumeric(
          "AM/PM marker after hour " + hour.getAsInt(), lex.span(), input);
    }
    return true;
  }

  private boolean couldBeZoneName(Lexeme lex) {
    return result.isSet(Field.HOUR)
        && !result.hasTzname()
        && !result.isSet(Field.TZOFFSET)
        && Lexicon.looksLikeZoneName(lex.text());
  }

  private void zoneName(int i) throws DateParseException {
    Lexeme lex = lexemes.get(i);
    String name = lex.text();
    boolean signFollows =
        i + 1 < lexemes.size() && (lexemes.get(i + 1).is('+') || lexemes.get(i + 1).is('-'));
    if (signFollows) {
      reverseNextSign = true;
      // "GMT+3" carries its meaning in the offset alone.
      if (!Lexicon.isUtcZone(name)) {
        result.tzname(name, lex.span());
      }
      return;
    }
    if (Lexicon.isZulu(name)) {
      result.tzname("UTC", lex.span());
    } else {
      result.tzname(name, lex.span());
    }
    if (Lexicon.isUtcZone(name)) {
      result.set(Field.TZOFFSET, 0, lex.span());
    }
  }

  private int signedOffset(int i) throws DateParseException {
    Lexeme signLex = lexemes.get(i);
    int n = lexemes.size();
    int mult = signLex.is('+') ? 1 : -1;
    if (reverseNextSign) {
      mult = -mult;
      reverseNextSign = false;
    }
    if (i + 1 >= n || !lexemes.get(i + 1).isInteger()) {
      skipped.add(i);
      return i;
    }
    Lexeme body = lexemes.get(i + 1);
    String text = body.text();
    Span span = signLex.span().to(body.span());
    int end = i + 1;
    if (text.length() <= 2
        && i + 3 < n
        && lexemes.get(i + 2).is(':')
        && lexemes.get(i + 3).isInteger()) {
      text = text + ":" + lexemes.get(i + 3).text();
      span = span.to(lexemes.get(i + 3).span());
      end = i + 3;
    }
    // GMT+3, -3:30
    if (text.length() == 1 || text.charAt(1) == ':') {
      text = "0" + text;
    }
    OptionalInt offset = TzOffsets.parse(mult > 0 ? '+' : '-', text, span, input);
    if (offset.isEmpty()) {
      if (config.fuzzy()) {
        skipped.add(i);
        return i;
      }
      throw DateParseException.invalidNumeric("malformed UTC offset", span, input);
    }
    result.set(Field.TZOFFSET, offset.getAsInt(), span);
    i = end - 1;

    // -0300 (BRST)
    if (i + 5 < n
        && Lexicon.isJump(lexemes.get(i + 2).text())
        && lexemes.get(i + 3).is('(')
        && lexemes.get(i + 5).is(')')
        && lexemes.get(i + 4).text().length() >= 3
        && !result.hasTzname()
        && Lexicon.looksLikeZoneName(lexemes.get(i + 4).text())) {
      result.tzname(lexemes.get(i + 4).text(), lexemes.get(i + 4).span());
      i += 4;
    }
    return i + 1;
  }

  private int numeric(int idx) throws DateParseException {
    Lexeme tok = lexemes.get(idx);
    int n = lexemes.size();
    String digits = tok.integerDigits();
    int len = digits.length();
    Lexeme next = idx + 1 < n ? lexemes.get(idx + 1) : null;

    if (ymd.size() == 3
        && (len == 2 || len == 4)
        && !tok.hasFraction()
        && !result.isSet(Field.HOUR)
        && (next == null || (!next.is(':') && findUnit(idx) < 0))) {
      // 19990101T23[59]
      result.set(Field.HOUR, Integer.parseInt(digits.substring(0, 2)), tok.span());
      if (len == 4) {
        result.set(Field.MINUTE, Integer.parseInt(digits.substring(2)), tok.span());
      }
      return idx;
    }

    if (len == 6) {
      if (ymd.isEmpty() && !tok.hasFraction()) {
        // YYMMDD
        ymd.appendDigits(digits.substring(0, 2), tok.span());
        ymd.appendDigits(digits.substring(2, 4), tok.span());
        ymd.appendDigits(digits.substring(4), tok.span());
      } else {
        // HHMMSS[.ss]
        result.set(Field.HOUR, Integer.parseInt(digits.substring(0, 2)), tok.span());
        result.set(Field.MINUTE, Integer.parseInt(digits.substring(2, 4)), tok.span());
        setSeconds(Integer.parseInt(digits.substring(4)), tok.fractionDigits(), tok.span());
      }
      return idx;
    }

    if (((len == 8 || len == 12) && !tok.hasFraction()) || len == 14) {
      // YYYYMMDD[hhmm[ss]]
      ymd.appendDigits(digits.substring(0, 4), tok.span());
      ymd.appendDigits(digits.substring(4, 6), tok.span());
      ymd.appendDigits(digits.substring(6, 8), tok.span());
      if (len > 8) {
        result.set(Field.HOUR, Integer.parseInt(digits.substring(8, 10)), tok.span());
        result.set(Field.MINUTE, Integer.parseInt(digits.substring(10, 12)), tok.span());
        if (len > 12) {
          setSeconds(Integer.parseInt(digits.substring(12)), tok.fractionDigits(), tok.span());
        }
      }
      return idx;
    }

    int unitIdx = findUnit(idx);
    if (unitIdx >= 0) {
      return labelledValue(idx, unitIdx);
    }

    if (idx + 2 < n && next.is(':') && lexemes.get(idx + 2).number()) {
      // HH:MM[:SS[.ss]]
      result.set(Field.HOUR, tok.intValue(), tok.span());
      Lexeme minuteLex = lexemes.get(idx + 2);
      result.set(Field.MINUTE, minuteLex.intValue(), minuteLex.span());
      if (minuteLex.hasFraction()) {
        result.set(
            Field.SECOND, minuteLex.fraction().multiply(SIXTY).intValue(), minuteLex.span());
      }
      if (idx + 4 < n && lexemes.get(idx + 3).is(':') && lexemes.get(idx + 4).number()) {
        Lexeme secondLex = lexemes.get(idx + 4);
        setSeconds(secondLex.intValue(), secondLex.fractionDigits(), secondLex.span());
        idx += 2;
      }
      return idx + 2;
    }

    if (next != null && (next.is('-') || next.is('/') || next.is('.'))) {
      return separatedDate(idx);
    }

    if (next == null || Lexicon.isJump(next.text())) {
      Optional<Meridiem> meridiem =
          idx + 2 < n ? Meridiem.parse(lexemes.get(idx + 2).text()) : Optional.empty();
      if (meridiem.isPresent()) {
        // 12 am
        if (!setMeridiemHour(tok, meridiem.get())) {
          skipRange(idx, idx + 2);
        }
        return idx + 2;
      }
      if (!isDateNumber(tok)) {
        return rejectDateNumber(idx);
      }
      appendDateNumber(tok);
      if (next != null) {
        skipped.add(idx + 1);
      }
      return idx + 1;
    }

    Optional<Meridiem> meridiem = Meridiem.parse(next.text());
    if (meridiem.isPresent() && tok.intValue() < 24) {
      // 12am
      if (!setMeridiemHour(tok, meridiem.get())) {
        skipRange(idx, idx + 1);
      }
      return idx + 1;
    }

    if (isDateNumber(tok) && ymd.couldBeDay(tok.intValue())) {
      appendDateNumber(tok);
      return idx;
    }

    return rejectDateNumber(idx);
  }

  private int separatedDate(int idx) throws DateParseException {
    Lexeme tok = lexemes.get(idx);
    int n = lexemes.size();
    char sep = lexemes.get(idx + 1).text().charAt(0);
    if (!isDateNumber(tok)) {
      int end = rejectDateNumber(idx);
      // The rest of the group goes with its head.
      while (end + 2 < n && lexemes.get(end + 1).is(sep) && lexemes.get(end + 2).number()) {
        skipRange(end + 1, end + 2);
        end += 2;
      }
      return end;
    }
    appendDateNumber(tok);
    if (idx + 2 < n && !Lexicon.isJump(lexemes.get(idx + 2).text())) {
      Lexeme part = lexemes.get(idx + 2);
      if (part.number() && !isDateNumber(part)) {
        skipped.add(idx + 1);
        return rejectDateNumber(idx + 2);
      }
      if (!appendDatePart(part)) {
        if (config.fuzzy()) {
          return idx;
        }
        throw DateParseException.unrecognized(part.text(), part.span(), input);
      }
      if (idx + 4 < n && lexemes.get(idx + 3).is(sep) && appendDatePart(lexemes.get(idx + 4))) {
        idx += 2;
      }
      idx += 1;
    }
    return idx + 1;
  }

  // Appends a date number or a month name; false if the lexeme is neither.
  private boolean appendDatePart(Lexeme lex) throws DateParseException {
    if (isDateNumber(lex)) {
      appendDateNumber(lex);
      return true;
    }
    Optional<MonthName> month = MonthName.parse(lex.text());
    if (month.isPresent()) {
      ymd.appendMonth(month.get().number(), lex.span());
      return true;
    }
    return false;
  }

  private void appendDateNumber(Lexeme lex) throws DateParseException {
    ymd.appendDigits(lex.integerDigits(), lex.span());
  }

  // Whole numbers of at most 4, 6 or 8 digits; runs of 5, 7 or 9+ digits never encode a date
  // part.
  private static boolean isDateNumber(Lexeme lex) {
    if (!lex.isInteger()) {
      return false;
    }
    int len = lex.text().length();
    return len <= 4 || len == 6 || len == 8;
  }

  // A decimal in a date slot is a numeric error even in fuzzy mode. Any other misfit is an
  // unrecognized token, which fuzzy mode skips.
  private int rejectDateNumber(int idx) throws DateParseException {
    Lexeme tok = lexemes.get(idx);
    if (tok.hasFraction()) {
      throw DateParseException.invalidNumeric(
          "decimal '" + tok.text() + "' cannot be a date part", tok.span(), input);
    }
    if (!config.fuzzy()) {
      throw DateParseException.unrecognized(tok.text(), tok.span(), input);
    }
    log.trace("skipping number '{}' at {}", tok.text(), tok.span().start());
    skipped.add(idx);
    return idx;
  }

  private void skipRange(int from, int to) {
    for (int idx = from; idx <= to; idx++) {
      skipped.add(idx);
    }
  }

  // False when the hour takes no marker and fuzzy mode lets the caller skip the pair.
  private boolean setMeridiemHour(Lexeme tok, Meridiem meridiem) throws DateParseException {
    int hour = tok.intValue();
    if (hour > 12) {
      if (config.fuzzy()) {
        return false;
      }
      throw DateParseException.invalidNumeric(
          "AM/PM marker after hour " + hour, tok.span(), input);
    }
    result.set(Field.HOUR, meridiem.toHour24(hour), tok.span());
    meridiemSeen = true;
    return true;
  }

  private void setSeconds(int seconds, String fraction, Span span) throws DateParseException {
    result.set(Field.SECOND, seconds, span);
    if (!fraction.isEmpty()) {
      result.set(Field.MICROSECOND, Fractions.toMicroseconds(fraction), span);
    }
  }

  /**
   * Finds the unit label that belongs to the number at {@code idx}: directly after it, after one
   * space, directly before it, or two back when the number ends the input.
   */
  private int findUnit(int idx) {
    int n = lexemes.size();
    if (idx + 1 < n && isUnit(lexemes.get(idx + 1))) {
      return idx + 1;
    }
    if (idx + 2 < n && lexemes.get(idx + 1).isSpace() && isUnit(lexemes.get(idx + 2))) {
      return idx + 2;
    }
    if (idx > 0 && isUnit(lexemes.get(idx - 1))) {
      return idx - 1;
    }
    if (idx > 1
        && idx == n - 1
        && lexemes.get(idx - 1).isSpace()
        && isUnit(lexemes.get(idx - 2))) {
      return idx - 2;
    }
    return -1;
  }

  private static boolean isUnit(Lexeme lex) {
    return lex.word() && TimeUnitLabel.parse(lex.text()).isPresent();
  }

  private int labelledValue(int idx, int unitIdx) throws DateParseException {
    TimeUnitLabel label = TimeUnitLabel.parse(lexemes.get(unitIdx).text()).get();
    Optional<TimeUnitLabel> unit;
    int newIdx;
    if (unitIdx > idx) {
      unit = Optional.of(label);
      newIdx = unitIdx;
    } else {
      // A label before the number names the unit above it: "01h02" is 1:02.
      unit = label.smaller();
      newIdx = idx;
    }
    if (unit.isPresent()) {
      assignUnit(lexemes.get(idx), unit.get());
    }
    return newIdx;
  }

  private void assignUnit(Lexeme tok, TimeUnitLabel unit) throws DateParseException {
    BigDecimal carry = tok.fraction().multiply(SIXTY);
    switch (unit) {
      case HOUR -> {
        result.set(Field.HOUR, tok.intValue(), tok.span());
        if (tok.hasFraction()) {
          result.set(Field.MINUTE, carry.intValue(), tok.span());
        }
      }
      case MINUTE -> {
        result.set(Field.MINUTE, tok.intValue(), tok.span());
        if (tok.hasFraction()) {
          result.set(Field.SECOND, carry.intValue(), tok.span());
        }
      }
      case SECOND -> setSeconds(tok.intValue(), tok.fractionDigits(), tok.span());
    }
  }

  private ParseResult finish() throws DateParseException {
    YmdAccumulator.Resolved date = ymd.resolve(config.yearfirst(), config.dayfirst());
    if (date.year() != null) {
      int year = date.year();
      if (year < 100 && !ymd.centurySpecified()) {
        year = CenturyWindow.expand(year);
      }
      result.set(Field.YEAR, year, date.yearSpan());
    }
    if (date.month() != null) {
      result.set(Field.MONTH, date.month(), date.monthSpan());
    }
    if (date.day() != null) {
      result.set(Field.DAY, date.day(), date.daySpan());
    }
    ParseResult parsed = result.build();
    if (!parsed.hasDate() && !parsed.hasTime()) {
      throw DateParseException.noComponents(input);
    }
    return parsed;
  }

  private List<String> skippedRuns() {
    List<String> runs = new ArrayList<>();
    if (!config.fuzzyWithTokens()) {
      return runs;
    }
    int last = -2;
    StringBuilder run = null;
    for (int idx : skipped) {
      if (idx == last) {
        continue;
      }
      if (run != null && idx == last + 1) {
        run.append(lexemes.get(idx).text());
      } else {
        if (run != null) {
          runs.add(run.toString());
        }
        run = new StringBuilder(lexemes.get(idx).text());
      }
      last = idx;
    }
    if (run != null) {
      runs.add(run.toString());
    }
    return runs;
  }
}
