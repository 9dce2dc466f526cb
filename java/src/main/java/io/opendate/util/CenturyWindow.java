package io.opendate.util;

import java.time.Year;

/**
 * Expands two-digit years into the sliding window {@code [reference - 50, reference + 49]}.
 *
 * <p>Shared by both resolvers so that "96" means the same year everywhere.
 */
public final class CenturyWindow {
  private CenturyWindow() {}

  /**
   * Expands a two-digit year relative to the current year.
   *
   * @param twoDigitYear a year in 0..99
   * @return the four-digit year
   */
  public static int expand(int twoDigitYear) {
    return expand(twoDigitYear, Year.now().getValue());
  }

  /**
   * Expands a two-digit year relative to {@code referenceYear}.
   *
   * @param twoDigitYear a year in 0..99
   * @param referenceYear the centre of the window
   * @return the four-digit year
   * @throws IllegalArgumentException if {@code twoDigitYear} is not in 0..99
   */
  public static int expand(int twoDigitYear, int referenceYear) {
    if (twoDigitYear < 0 || twoDigitYear > 99) {
      throw new IllegalArgumentException("not a two-digit year: " + twoDigitYear);
    }
    int year = twoDigitYear + referenceYear / 100 * 100;
    if (year >= referenceYear + 50) {
      year -= 100;
    } else if (year < referenceYear - 50) {
      year += 100;
    }
    return year;
  }
}
