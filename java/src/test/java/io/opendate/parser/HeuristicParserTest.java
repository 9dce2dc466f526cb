package io.opendate.parser;

import static org.junit.jupiter.api.Assertions.*;

import io.opendate.DateParseException;
import io.opendate.ErrorKind;
import io.opendate.FuzzyResult;
import io.opendate.ParseResult;
import io.opendate.ParserConfig;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import org.junit.jupiter.api.Test;

/** Unit tests for the heuristic resolver. */
public class HeuristicParserTest {
  private static final ParserConfig FUZZY = ParserConfig.DEFAULT.withFuzzy(true);

  private static ParseResult parse(String input) throws DateParseException {
    return HeuristicParser.parse(input, ParserConfig.DEFAULT);
  }

  private static void assertDate(ParseResult r, int year, int month, int day) {
    assertEquals(Optional.of(LocalDate.of(year, month, day)), r.toLocalDate(), r.toString());
  }

  private static void assertTime(ParseResult r, int hour, int minute, int second) {
    assertEquals(OptionalInt.of(hour), r.hour(), r.toString());
    assertEquals(OptionalInt.of(minute), r.minute(), r.toString());
    assertEquals(OptionalInt.of(second), r.second(), r.toString());
  }

  private static ErrorKind errorKind(String input, ParserConfig config) {
    DateParseException e =
        assertThrows(DateParseException.class, () -> HeuristicParser.parse(input, config));
    return e.kind();
  }

  // Common formats

  @Test
  void testIsoLikeWithZulu() throws DateParseException {
    ParseResult r = parse("2024-01-15T10:30:45Z");
    assertDate(r, 2024, 1, 15);
    assertTime(r, 10, 30, 45);
    assertEquals(OptionalInt.of(0), r.tzoffset());
    assertEquals(Optional.of("UTC"), r.tzname());
  }

  @Test
  void testCtimeWithNamedZone() throws DateParseException {
    ParseResult r = parse("Thu Sep 25 10:36:28 BRST 2003");
    assertDate(r, 2003, 9, 25);
    assertTime(r, 10, 36, 28);
    assertEquals(OptionalInt.of(3), r.weekday());
    assertEquals(Optional.of("BRST"), r.tzname());
    assertTrue(r.tzoffset().isEmpty());
  }

  @Test
  void testCtimeWithoutYear() throws DateParseException {
    ParseResult r = parse("Thu Sep 25 10:36:28");
    assertTrue(r.year().isEmpty());
    assertEquals(OptionalInt.of(9), r.month());
    assertEquals(OptionalInt.of(25), r.day());
    assertTime(r, 10, 36, 28);
  }

  @Test
  void testMonthNameWithApostropheYear() throws DateParseException {
    ParseResult r = parse("Wed, July 10, '96");
    assertDate(r, 1996, 7, 10);
    assertEquals(OptionalInt.of(2), r.weekday());
  }

  @Test
  void testDottedMonthNameWithMeridiem() throws DateParseException {
    ParseResult r = parse("1996.July.10 AD 12:08 PM");
    assertDate(r, 1996, 7, 10);
    assertTime(r, 12, 8, 0);
  }

  @Test
  void testTimeBeforeDate() throws DateParseException {
    ParseResult r = parse("0:01:02 on July 4, 1976");
    assertDate(r, 1976, 7, 4);
    assertTime(r, 0, 1, 2);
  }

  @Test
  void testOrdinalWithPertain() throws DateParseException {
    assertDate(parse("3rd of May 2001"), 2001, 5, 3);
  }

  @Test
  void testMonthOfYear() throws DateParseException {
    ParseResult r = parse("25 of September of 2003");
    assertDate(r, 2003, 9, 25);
  }

  @Test
  void testMonthAndYearOnly() throws DateParseException {
    ParseResult r = parse("September 2003");
    assertEquals(OptionalInt.of(2003), r.year());
    assertEquals(OptionalInt.of(9), r.month());
    assertTrue(r.day().isEmpty());
  }

  @Test
  void testGluedDayMonthYear() throws DateParseException {
    assertDate(parse("13NOV2017"), 2017, 11, 13);
  }

  @Test
  void testDayMonthNameTwoDigitYear() throws DateParseException {
    assertDate(parse("31-Dec-00"), 2000, 12, 31);
  }

  @Test
  void testFourDigitYearLeading() throws DateParseException {
    ParseResult r = parse("2004 10 Apr 11h30m");
    assertDate(r, 2004, 4, 10);
    assertEquals(OptionalInt.of(11), r.hour());
    assertEquals(OptionalInt.of(30), r.minute());
  }

  // Compact digit runs

  @Test
  void testCompactDateTime() throws DateParseException {
    ParseResult r = parse("199709020908");
    assertDate(r, 1997, 9, 2);
    assertEquals(OptionalInt.of(9), r.hour());
    assertEquals(OptionalInt.of(8), r.minute());
  }

  @Test
  void testCompactSixDigitDateThenTime() throws DateParseException {
    ParseResult r = parse("950404 122212");
    assertDate(r, 1995, 4, 4);
    assertTime(r, 12, 22, 12);
  }

  @Test
  void testCompactHourAfterDate() throws DateParseException {
    ParseResult r = parse("19990101T23");
    assertDate(r, 1999, 1, 1);
    assertEquals(OptionalInt.of(23), r.hour());
    assertTrue(r.minute().isEmpty());
  }

  @Test
  void testNanosecondsTruncated() throws DateParseException {
    ParseResult r = parse("20080227T21:26:01.123456789");
    assertDate(r, 2008, 2, 27);
    assertTime(r, 21, 26, 1);
    assertEquals(OptionalInt.of(123456), r.microsecond());
  }

  @Test
  void testCommaFraction() throws DateParseException {
    ParseResult r = parse("2003-09-25 10:49:41,502");
    assertEquals(OptionalInt.of(502000), r.microsecond());
  }

  @Test
  void testCenturyKeptWhenWritten() throws DateParseException {
    assertEquals(OptionalInt.of(99), parse("0099-01-01T00:00:00").year());
  }

  // Ambiguous numeric dates

  @Test
  void testDashedDateMonthFirstByDefault() throws DateParseException {
    assertDate(parse("10-09-2003"), 2003, 10, 9);
  }

  @Test
  void testDashedDateDayFirst() throws DateParseException {
    ParseResult r = HeuristicParser.parse("10-09-2003", ParserConfig.DEFAULT.withDayfirst(true));
    assertDate(r, 2003, 9, 10);
  }

  @Test
  void testDayAboveTwelveSwaps() throws DateParseException {
    assertDate(parse("25-09-2003"), 2003, 9, 25);
  }

  @Test
  void testAllTwoDigitDefaultsToYearLast() throws DateParseException {
    assertDate(parse("10-09-03"), 2003, 10, 9);
  }

  @Test
  void testTwoNumbersWithMonthName() throws DateParseException {
    assertDate(parse("25 03 Sep"), 2025, 9, 3);
    assertDate(parse("03 25 Sep"), 2003, 9, 25);
  }

  @Test
  void testSixDigitPermutations() throws DateParseException {
    ParserConfig base = ParserConfig.DEFAULT;
    assertDate(HeuristicParser.parse("090107", base), 2007, 9, 1);
    assertDate(HeuristicParser.parse("090107", base.withYearfirst(true)), 2009, 1, 7);
    assertDate(HeuristicParser.parse("090107", base.withDayfirst(true)), 2007, 1, 9);
    assertDate(
        HeuristicParser.parse("090107", base.withDayfirst(true).withYearfirst(true)),
        2009,
        7,
        1);
  }

  @Test
  void testFourDigitYearIgnoresFlags() throws DateParseException {
    ParserConfig both = ParserConfig.DEFAULT.withDayfirst(true).withYearfirst(true);
    assertDate(HeuristicParser.parse("2003-09-25", both), 2003, 9, 25);
    ParseResult slashed =
        HeuristicParser.parse("09/25/2003", ParserConfig.DEFAULT.withYearfirst(true));
    assertDate(slashed, 2003, 9, 25);
  }

  // Times

  @Test
  void testMidnightAndNoon() throws DateParseException {
    assertEquals(OptionalInt.of(0), parse("12:00 AM").hour());
    assertEquals(OptionalInt.of(12), parse("12:00 PM").hour());
    assertEquals(OptionalInt.of(17), parse("5 pm").hour());
    assertEquals(OptionalInt.of(17), parse("5pm").hour());
  }

  @Test
  void testDottedMeridiem() throws DateParseException {
    ParseResult r = parse("10:00a.m.");
    assertEquals(OptionalInt.of(10), r.hour());
    assertEquals(OptionalInt.of(0), r.minute());
  }

  @Test
  void testLabelledUnits() throws DateParseException {
    ParseResult r = parse("10h36m28.5s");
    assertTime(r, 10, 36, 28);
    assertEquals(OptionalInt.of(500000), r.microsecond());
  }

  @Test
  void testDecimalMinuteSpills() throws DateParseException {
    assertEquals(Optional.of(LocalTime.of(10, 36, 30)), parse("10 h 36.5").toLocalTime());
  }

  @Test
  void testValueAfterLabelIsSmallerUnit() throws DateParseException {
    ParseResult r = parse("36 m 5");
    assertTrue(r.hour().isEmpty());
    assertEquals(OptionalInt.of(36), r.minute());
    assertEquals(OptionalInt.of(5), r.second());
  }

  @Test
  void testHourAndSecondLabels() throws DateParseException {
    ParseResult r = parse("01h02s");
    assertEquals(OptionalInt.of(1), r.hour());
    assertTrue(r.minute().isEmpty());
    assertEquals(OptionalInt.of(2), r.second());
  }

  @Test
  void testLabelsInAnyOrder() throws DateParseException {
    ParseResult r = parse("01m02h");
    assertEquals(OptionalInt.of(2), r.hour());
    assertEquals(OptionalInt.of(1), r.minute());
  }

  @Test
  void testLabelledTimeWithMeridiem() throws DateParseException {
    assertTime(parse("12h 01m02s am"), 0, 1, 2);
  }

  // Zones

  @Test
  void testGmtSignReversal() throws DateParseException {
    ParseResult plus = parse("10:00 GMT+3");
    assertEquals(OptionalInt.of(-10800), plus.tzoffset());
    assertTrue(plus.tzname().isEmpty());
    assertEquals(OptionalInt.of(18000), parse("10:00 GMT-5").tzoffset());
  }

  @Test
  void testNamedZoneSetsNameOnly() throws DateParseException {
    for (String zone : List.of("EST", "PST", "CET")) {
      ParseResult r = parse("2024-01-15 10:00 " + zone);
      assertEquals(Optional.of(zone), r.tzname());
      assertTrue(r.tzoffset().isEmpty());
    }
  }

  @Test
  void testBareUtcSetsZeroOffset() throws DateParseException {
    ParseResult r = parse("2024-01-15 10:00 UTC");
    assertEquals(OptionalInt.of(0), r.tzoffset());
    assertEquals(Optional.of("UTC"), r.tzname());
  }

  @Test
  void testNumericOffsets() throws DateParseException {
    assertEquals(OptionalInt.of(19800), parse("2024-01-15T10:30:00+05:30").tzoffset());
    assertEquals(OptionalInt.of(-18000), parse("2024-01-15 10:30 -0500").tzoffset());
    assertEquals(OptionalInt.of(18000), parse("2024-01-15T10:30:00+05").tzoffset());
    assertEquals(OptionalInt.of(-12600), parse("10:00 -3:30").tzoffset());
    assertEquals(OptionalInt.of(12600), parse("10:00 GMT-3:30").tzoffset());
    assertEquals(
        ErrorKind.AMBIGUOUS_OR_INVALID_NUMERIC, errorKind("10:00 +123", ParserConfig.DEFAULT));
    assertEquals(
        ErrorKind.AMBIGUOUS_OR_INVALID_NUMERIC, errorKind("10:00 +2500", ParserConfig.DEFAULT));
  }

  @Test
  void testParenthesisedZoneName() throws DateParseException {
    ParseResult r = parse("2024-01-15 10:30:45 -0300 (BRST)");
    assertEquals(OptionalInt.of(-10800), r.tzoffset());
    assertEquals(Optional.of("BRST"), r.tzname());
  }

  // Fuzzy

  @Test
  void testFuzzySentence() throws DateParseException {
    FuzzyResult fr =
        HeuristicParser.parseWithSkipped(
            "Today is 25 of September of 2003, exactly at 10:49:41 with timezone -03:00.",
            ParserConfig.DEFAULT.withSkippedTokens());
    assertDate(fr.result(), 2003, 9, 25);
    assertTime(fr.result(), 10, 49, 41);
    assertEquals(OptionalInt.of(-10800), fr.result().tzoffset());
    assertEquals(
        List.of("Today is ", " of ", ", exactly at ", " with timezone ", "."),
        fr.skippedTokens());
  }

  @Test
  void testFuzzyIgnoresStrayMeridiemWords() throws DateParseException {
    assertDate(
        HeuristicParser.parse("I have a meeting on March 1, 1974.", FUZZY), 1974, 3, 1);
    assertDate(
        HeuristicParser.parse(
            "On June 8th, 2020, I am going to be the first man on Mars", FUZZY),
        2020,
        6,
        8);
  }

  @Test
  void testFuzzySkipsNonDateNumbers() throws DateParseException {
    FuzzyResult fr =
        HeuristicParser.parseWithSkipped(
            "Order #12345 placed on 2024-01-15", ParserConfig.DEFAULT.withSkippedTokens());
    assertDate(fr.result(), 2024, 1, 15);
    assertEquals(List.of("Order #12345 placed on "), fr.skippedTokens());
  }

  @Test
  void testSpaceAfterNumberIsReported() throws DateParseException {
    FuzzyResult fr =
        HeuristicParser.parseWithSkipped("Jan 5 2024", ParserConfig.DEFAULT.withSkippedTokens());
    assertDate(fr.result(), 2024, 1, 5);
    assertEquals(List.of(" ", " "), fr.skippedTokens());
  }

  @Test
  void testFuzzySkipsLongRunWithItsGroup() throws DateParseException {
    FuzzyResult fr =
        HeuristicParser.parseWithSkipped(
            "ref 12345678901/2 on 2024-01-15", ParserConfig.DEFAULT.withSkippedTokens());
    assertDate(fr.result(), 2024, 1, 15);
    assertEquals(List.of("ref 12345678901/2 on "), fr.skippedTokens());
  }

  @Test
  void testFuzzySkipsMeridiemOnLateHour() throws DateParseException {
    FuzzyResult fr =
        HeuristicParser.parseWithSkipped(
            "I woke at 13 am on 2024-01-15", ParserConfig.DEFAULT.withSkippedTokens());
    assertDate(fr.result(), 2024, 1, 15);
    assertTrue(fr.result().hour().isEmpty());
    assertEquals(List.of("I woke at 13 am on "), fr.skippedTokens());

    ParseResult glued = HeuristicParser.parse("13am 2024-01-15", FUZZY);
    assertDate(glued, 2024, 1, 15);
    assertTrue(glued.hour().isEmpty());
    assertEquals(ErrorKind.NO_COMPONENTS_FOUND, errorKind("13am", FUZZY));
  }

  @Test
  void testSkippedTokensOnlyWhenRequested() throws DateParseException {
    FuzzyResult fr = HeuristicParser.parseWithSkipped("The date 2024-01-15 is important", FUZZY);
    assertDate(fr.result(), 2024, 1, 15);
    assertTrue(fr.skippedTokens().isEmpty());
  }

  // Errors

  @Test
  void testEmptyInput() {
    assertEquals(ErrorKind.NO_COMPONENTS_FOUND, errorKind("", ParserConfig.DEFAULT));
    assertEquals(ErrorKind.NO_COMPONENTS_FOUND, errorKind("   ", ParserConfig.DEFAULT));
    assertEquals(ErrorKind.NO_COMPONENTS_FOUND, errorKind(null, ParserConfig.DEFAULT));
  }

  @Test
  void testWeekdayAloneIsNotADate() {
    assertEquals(ErrorKind.NO_COMPONENTS_FOUND, errorKind("Thursday", ParserConfig.DEFAULT));
  }

  @Test
  void testUnrecognizedWord() {
    assertEquals(ErrorKind.UNRECOGNIZED_TOKEN, errorKind("hello", ParserConfig.DEFAULT));
    assertEquals(
        ErrorKind.UNRECOGNIZED_TOKEN,
        errorKind("Order #12345 placed on 2024-01-15", ParserConfig.DEFAULT));
  }

  @Test
  void testFiveDigitRunRejected() {
    assertEquals(ErrorKind.UNRECOGNIZED_TOKEN, errorKind("12345", ParserConfig.DEFAULT));
  }

  @Test
  void testLongRunsNextToSeparatorsRejected() {
    for (String input : List.of("12345678901-01-01", "2024-01-12345678901", "Jan-12345678901")) {
      assertEquals(ErrorKind.UNRECOGNIZED_TOKEN, errorKind(input, ParserConfig.DEFAULT), input);
    }
  }

  @Test
  void testMeridiemOnLateHourRejected() {
    assertEquals(
        ErrorKind.AMBIGUOUS_OR_INVALID_NUMERIC, errorKind("13 am", ParserConfig.DEFAULT));
    assertEquals(
        ErrorKind.AMBIGUOUS_OR_INVALID_NUMERIC, errorKind("13am", ParserConfig.DEFAULT));
  }

  @Test
  void testDecimalInDateSlotRejected() {
    assertEquals(
        ErrorKind.AMBIGUOUS_OR_INVALID_NUMERIC, errorKind("Jan 3.5 2024", ParserConfig.DEFAULT));
    assertEquals(ErrorKind.AMBIGUOUS_OR_INVALID_NUMERIC, errorKind("Jan 3.5 2024", FUZZY));
  }

  @Test
  void testFuzzyWithNothingLeft() {
    assertEquals(ErrorKind.NO_COMPONENTS_FOUND, errorKind("nothing to see", FUZZY));
  }

  @Test
  void testTwoYearsIsAmbiguous() {
    assertEquals(
        ErrorKind.AMBIGUOUS_OR_INVALID_NUMERIC, errorKind("2003 2004 Sep", ParserConfig.DEFAULT));
  }

  @Test
  void testOutOfRangeFields() {
    assertEquals(
        ErrorKind.AMBIGUOUS_OR_INVALID_NUMERIC, errorKind("Feb 30 2024", ParserConfig.DEFAULT));
    assertEquals(
        ErrorKind.AMBIGUOUS_OR_INVALID_NUMERIC, errorKind("13:61", ParserConfig.DEFAULT));
    assertEquals(
        ErrorKind.AMBIGUOUS_OR_INVALID_NUMERIC, errorKind("25:00", ParserConfig.DEFAULT));
  }

  @Test
  void testFuzzyNeverHidesNumericErrors() {
    assertEquals(ErrorKind.AMBIGUOUS_OR_INVALID_NUMERIC, errorKind("meet on Feb 30 2024", FUZZY));
  }

  @Test
  void testErrorSpanPointsAtToken() {
    DateParseException e =
        assertThrows(DateParseException.class, () -> parse("2024-01-15 foo"));
    assertEquals(11, e.span().get().start());
    assertTrue(e.displayRich().contains("^^^"));
  }
}
