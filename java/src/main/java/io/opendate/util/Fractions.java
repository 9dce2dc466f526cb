package io.opendate.util;

/** Fractional-second normalization shared by every parser. */
public final class Fractions {
  private Fractions() {}

  /**
   * Converts the digits after a decimal separator to microseconds by truncation: "5" is 500000,
   * "000098" is 98 and "123456789" is 123456.
   *
   * @param digits one or more ASCII digits
   * @return the microseconds, 0..999999
   * @throws IllegalArgumentException if {@code digits} is empty or not all digits
   */
  public static int toMicroseconds(String digits) {
    if (digits.isEmpty()) {
      throw new IllegalArgumentException("empty fraction");
    }
    int micros = 0;
    for (int i = 0; i < 6; i++) {
      int d = 0;
      if (i < digits.length()) {
        char c = digits.charAt(i);
        if (c < '0' || c > '9') {
          throw new IllegalArgumentException("not a digit in fraction: " + digits);
        }
        d = c - '0';
      }
      micros = micros * 10 + d;
    }
    return micros;
  }
}
