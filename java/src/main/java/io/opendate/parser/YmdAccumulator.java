package io.opendate.parser;

import io.opendate.DateParseException;
import io.opendate.Span;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Collects up to three date numbers in the order they appear and decides which is the year, the
 * month and the day.
 *
 * <p>A number may arrive labelled: a month name is always the month, and a run of more than two
 * digits (or a value above 100) is always the year. Unlabelled numbers are placed by position,
 * magnitude and the day-first / year-first preferences.
 */
final class YmdAccumulator {
  private static final Logger log = LoggerFactory.getLogger(YmdAccumulator.class);

  enum Label {
    YEAR,
    MONTH
  }

  private record Entry(int value, Label label, Span span) {}

  /** The resolved slots; any of them may be null. */
  record Resolved(
      Integer year, Integer month, Integer day, Span yearSpan, Span monthSpan, Span daySpan) {}

  private final String input;
  private final List<Entry> entries = new ArrayList<>(3);
  private boolean centurySpecified;

  YmdAccumulator(String input) {
    this.input = input;
  }

  int size() {
    return entries.size();
  }

  boolean isEmpty() {
    return entries.isEmpty();
  }

  boolean centurySpecified() {
    return centurySpecified;
  }

  /** Adds a digit string; more than two digits marks it as the year. */
  void appendDigits(String digits, Span span) throws DateParseException {
    Label label = null;
    if (digits.length() > 2) {
      centurySpecified = true;
      label = Label.YEAR;
    }
    append(Integer.parseInt(digits), label, span);
  }

  void appendMonth(int month, Span span) throws DateParseException {
    append(month, Label.MONTH, span);
  }

  /** Adds a year already expanded to four digits, as after "September of 03". */
  void appendYear(int year, Span span) throws DateParseException {
    centurySpecified = true;
    append(year, Label.YEAR, span);
  }

  private void append(int value, Label label, Span span) throws DateParseException {
    if (label == null && value > 100) {
      centurySpecified = true;
      label = Label.YEAR;
    }
    if (label != null && indexOf(label) >= 0) {
      throw DateParseException.invalidNumeric(
          (label == Label.YEAR ? "year" : "month") + " is already set", span, input);
    }
    if (entries.size() == 3) {
      throw DateParseException.invalidNumeric("more than three date numbers", span, input);
    }
    entries.add(new Entry(value, label, span));
  }

  /**
   * Returns true if {@code value} can still be a day given the numbers seen so far.
   *
   * @param value the candidate
   * @return whether a day slot is open and the value fits the known month
   */
  boolean couldBeDay(int value) {
    int month = indexOf(Label.MONTH);
    if (month < 0) {
      return value >= 1 && value <= 31;
    }
    int year = indexOf(Label.YEAR);
    int maxDay =
        YearMonth.of(year < 0 ? 2000 : entries.get(year).value(), entries.get(month).value())
            .lengthOfMonth();
    return value >= 1 && value <= maxDay;
  }

  Resolved resolve(boolean yearfirst, boolean dayfirst) throws DateParseException {
    int n = entries.size();
    int labelled = 0;
    for (Entry e : entries) {
      if (e.label() != null) {
        labelled++;
      }
    }
    int yIdx = indexOf(Label.YEAR);
    int mIdx = indexOf(Label.MONTH);

    int[] order;
    if (n > 0 && (labelled == n || (n == 3 && labelled == 2))) {
      order = fromLabels(yIdx, mIdx);
    } else if (n == 3 && yIdx >= 0 && mIdx < 0) {
      order = aroundYear(yIdx, dayfirst);
    } else {
      order = byPosition(n, mIdx, yearfirst, dayfirst);
    }
    log.debug("resolved {} date numbers as y={} m={} d={}", n, order[0], order[1], order[2]);
    return new Resolved(
        valueAt(order[0]),
        valueAt(order[1]),
        valueAt(order[2]),
        spanAt(order[0]),
        spanAt(order[1]),
        spanAt(order[2]));
  }

  // Returns {yearIdx, monthIdx, dayIdx}; -1 for an empty slot.
  private int[] fromLabels(int yIdx, int mIdx) {
    int dIdx = -1;
    if (entries.size() == 3) {
      // Two labelled, the third is the day.
      for (int i = 0; i < 3; i++) {
        if (i != yIdx && i != mIdx) {
          dIdx = i;
        }
      }
    }
    return new int[] {yIdx, mIdx, dIdx};
  }

  private int[] aroundYear(int yIdx, boolean dayfirst) {
    int first = yIdx == 0 ? 1 : 0;
    int second = yIdx == 2 ? 1 : 2;
    int a = entries.get(first).value();
    int b = entries.get(second).value();
    if ((dayfirst && b <= 12) || (a > 12 && b <= 12)) {
      return new int[] {yIdx, second, first};
    }
    return new int[] {yIdx, first, second};
  }

  private int[] byPosition(int n, int mIdx, boolean yearfirst, boolean dayfirst)
      throws DateParseException {
    if (n > 3) {
      throw DateParseException.invalidNumeric("more than three date numbers", null, input);
    }
    if (n == 1 || (mIdx >= 0 && n == 2)) {
      if (mIdx >= 0) {
        int other = n == 2 ? 1 - mIdx : -1;
        if (other < 0) {
          return new int[] {-1, mIdx, -1};
        }
        return entries.get(other).value() > 31
            ? new int[] {other, mIdx, -1}
            : new int[] {-1, mIdx, other};
      }
      int v = entries.get(0).value();
      if (v > 31) {
        return new int[] {0, -1, -1};
      }
      return new int[] {-1, -1, 0};
    }
    if (n == 2) {
      int a = entries.get(0).value();
      int b = entries.get(1).value();
      if (a > 31) {
        return new int[] {0, 1, -1};
      }
      if (b > 31) {
        return new int[] {1, 0, -1};
      }
      if (dayfirst && b <= 12) {
        return new int[] {-1, 1, 0};
      }
      return new int[] {-1, 0, 1};
    }
    if (n == 3) {
      return threeNumbers(mIdx, yearfirst, dayfirst);
    }
    return new int[] {-1, -1, -1};
  }

  private int[] threeNumbers(int mIdx, boolean yearfirst, boolean dayfirst) {
    int a = entries.get(0).value();
    int b = entries.get(1).value();
    int c = entries.get(2).value();
    switch (mIdx) {
      case 0 -> {
        if (b > 31) {
          return new int[] {1, 0, 2};
        }
        return new int[] {2, 0, 1};
      }
      case 1 -> {
        if (a > 31 || (yearfirst && c <= 31)) {
          return new int[] {0, 1, 2};
        }
        return new int[] {2, 1, 0};
      }
      case 2 -> {
        if (b > 31) {
          return new int[] {1, 2, 0};
        }
        return new int[] {0, 2, 1};
      }
      default -> {
        if (a > 31 || (yearfirst && b <= 12 && c <= 31)) {
          if (dayfirst && c <= 12) {
            return new int[] {0, 2, 1};
          }
          return new int[] {0, 1, 2};
        }
        if (a > 12 || (dayfirst && b <= 12)) {
          return new int[] {2, 1, 0};
        }
        return new int[] {2, 0, 1};
      }
    }
  }

  private int indexOf(Label label) {
    for (int i = 0; i < entries.size(); i++) {
      if (entries.get(i).label() == label) {
        return i;
      }
    }
    return -1;
  }

  private Integer valueAt(int idx) {
    return idx < 0 ? null : entries.get(idx).value();
  }

  private Span spanAt(int idx) {
    return idx < 0 ? null : entries.get(idx).span();
  }
}
