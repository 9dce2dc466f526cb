package io.opendate.iso;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.Year;

/**
 * Gregorian conversions for ISO 8601 week dates. Week 1 is the week containing the year's first
 * Thursday, so a week date can fall in the previous or the next civil year.
 */
public final class IsoWeekDates {
  private IsoWeekDates() {}

  /**
   * Returns the number of ISO weeks in {@code isoYear}: 53 when the year starts on a Thursday, or
   * on a Wednesday in a leap year, otherwise 52.
   *
   * @param isoYear the week-numbering year
   * @return 52 or 53
   */
  public static int weeksInYear(int isoYear) {
    DayOfWeek jan1 = LocalDate.of(isoYear, 1, 1).getDayOfWeek();
    if (jan1 == DayOfWeek.THURSDAY) {
      return 53;
    }
    if (jan1 == DayOfWeek.WEDNESDAY && Year.isLeap(isoYear)) {
      return 53;
    }
    return 52;
  }

  /**
   * Converts an ISO week date to a calendar date.
   *
   * @param isoYear the week-numbering year
   * @param week the week, 1..{@link #weeksInYear(int)}
   * @param day the day of the week, Monday=1 through Sunday=7
   * @return the calendar date
   * @throws IllegalArgumentException if the week or day is out of range
   */
  public static LocalDate toDate(int isoYear, int week, int day) {
    if (week < 1 || week > weeksInYear(isoYear)) {
      throw new IllegalArgumentException("week " + week + " is out of range for " + isoYear);
    }
    if (day < 1 || day > 7) {
      throw new IllegalArgumentException("day of week " + day + " is out of range");
    }
    LocalDate jan4 = LocalDate.of(isoYear, 1, 4);
    LocalDate week1Monday = jan4.minusDays(jan4.getDayOfWeek().getValue() - 1L);
    return week1Monday.plusDays((week - 1) * 7L + (day - 1));
  }
}
