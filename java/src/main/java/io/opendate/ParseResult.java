package io.opendate;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.StringJoiner;

/**
 * The date/time components recovered from one input string.
 *
 * <p>Every component is independently optional. Unset fields are left for the caller to default;
 * this type never invents a value. {@code weekday} is informational only (Monday=0, Sunday=6) and
 * is never checked against the date. {@code tzoffset} (signed seconds east of UTC) and {@code
 * tzname} are set independently: a bare named zone such as "EST" sets only the name.
 *
 * <p>Instances are immutable and built through {@link Builder}, which rejects a second assignment
 * to the same field and validates ranges when {@link Builder#build()} is called.
 */
public final class ParseResult {

  /** The integer-valued components of a result. */
  public enum Field {
    YEAR("year", Integer.MIN_VALUE, Integer.MAX_VALUE),
    MONTH("month", 1, 12),
    DAY("day", 1, 31),
    HOUR("hour", 0, 23),
    MINUTE("minute", 0, 59),
    SECOND("second", 0, 59),
    MICROSECOND("microsecond", 0, 999_999),
    WEEKDAY("weekday", 0, 6),
    TZOFFSET("tzoffset", -86_399, 86_399);

    private final String displayName;
    private final int min;
    private final int max;

    Field(String displayName, int min, int max) {
      this.displayName = displayName;
      this.min = min;
      this.max = max;
    }

    boolean inRange(int value) {
      return value >= min && value <= max;
    }

    @Override
    public String toString() {
      return displayName;
    }
  }

  private static final ParseResult EMPTY = new ParseResult(new EnumMap<>(Field.class), null);

  private final Map<Field, Integer> values;
  private final String tzname;

  private ParseResult(Map<Field, Integer> values, String tzname) {
    this.values = values;
    this.tzname = tzname;
  }

  /**
   * Returns a result with no fields set.
   *
   * @return the empty result
   */
  public static ParseResult empty() {
    return EMPTY;
  }

  /**
   * Creates a new builder for a parse of {@code input}.
   *
   * @param input the string being parsed, used in error messages
   * @return a new builder
   */
  public static Builder builder(String input) {
    return new Builder(input);
  }

  public OptionalInt year() {
    return get(Field.YEAR);
  }

  public OptionalInt month() {
    return get(Field.MONTH);
  }

  public OptionalInt day() {
    return get(Field.DAY);
  }

  public OptionalInt hour() {
    return get(Field.HOUR);
  }

  public OptionalInt minute() {
    return get(Field.MINUTE);
  }

  public OptionalInt second() {
    return get(Field.SECOND);
  }

  public OptionalInt microsecond() {
    return get(Field.MICROSECOND);
  }

  /**
   * Returns the weekday named in the input, Monday=0 through Sunday=6.
   *
   * @return the weekday, or empty if no weekday name appeared
   */
  public OptionalInt weekday() {
    return get(Field.WEEKDAY);
  }

  /**
   * Returns the UTC offset in signed seconds.
   *
   * @return the offset, or empty if no numeric offset or UTC literal appeared
   */
  public OptionalInt tzoffset() {
    return get(Field.TZOFFSET);
  }

  /**
   * Returns the literal timezone name as it appeared in the input ("UTC" for {@code Z}).
   *
   * @return the zone name, or empty if none appeared
   */
  public Optional<String> tzname() {
    return Optional.ofNullable(tzname);
  }

  /**
   * Returns the value of {@code field}.
   *
   * @param field the component to read
   * @return the value, or empty if unset
   */
  public OptionalInt get(Field field) {
    Integer v = values.get(field);
    return v == null ? OptionalInt.empty() : OptionalInt.of(v);
  }

  /**
   * Returns true if any of year, month or day is set.
   *
   * @return whether a date component is present
   */
  public boolean hasDate() {
    return values.containsKey(Field.YEAR)
        || values.containsKey(Field.MONTH)
        || values.containsKey(Field.DAY);
  }

  /**
   * Returns true if any of hour, minute, second or microsecond is set.
   *
   * @return whether a time component is present
   */
  public boolean hasTime() {
    return values.containsKey(Field.HOUR)
        || values.containsKey(Field.MINUTE)
        || values.containsKey(Field.SECOND)
        || values.containsKey(Field.MICROSECOND);
  }

  /**
   * Converts year, month and day to a {@link LocalDate} when all three are set.
   *
   * @return the date, or empty if any of the three is missing or the year is unsupported
   */
  public Optional<LocalDate> toLocalDate() {
    if (!values.containsKey(Field.YEAR)
        || !values.containsKey(Field.MONTH)
        || !values.containsKey(Field.DAY)) {
      return Optional.empty();
    }
    try {
      return Optional.of(
          LocalDate.of(values.get(Field.YEAR), values.get(Field.MONTH), values.get(Field.DAY)));
    } catch (DateTimeException e) {
      return Optional.empty();
    }
  }

  /**
   * Converts the time fields to a {@link LocalTime} when at least the hour is set. Missing
   * minute, second and microsecond count as zero.
   *
   * @return the time of day, or empty if no hour is set
   */
  public Optional<LocalTime> toLocalTime() {
    if (!values.containsKey(Field.HOUR)) {
      return Optional.empty();
    }
    return Optional.of(
        LocalTime.of(
            values.get(Field.HOUR),
            values.getOrDefault(Field.MINUTE, 0),
            values.getOrDefault(Field.SECOND, 0),
            values.getOrDefault(Field.MICROSECOND, 0) * 1000));
  }

  /**
   * Converts the numeric offset to a {@link ZoneOffset}. Zone names are not resolved.
   *
   * @return the offset, or empty if no numeric offset is set
   */
  public Optional<ZoneOffset> toZoneOffset() {
    Integer offset = values.get(Field.TZOFFSET);
    return offset == null ? Optional.empty() : Optional.of(ZoneOffset.ofTotalSeconds(offset));
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ParseResult)) {
      return false;
    }
    ParseResult other = (ParseResult) o;
    return values.equals(other.values) && Objects.equals(tzname, other.tzname);
  }

  @Override
  public int hashCode() {
    return Objects.hash(values, tzname);
  }

  @Override
  public String toString() {
    StringJoiner sj = new StringJoiner(", ", "ParseResult{", "}");
    for (Map.Entry<Field, Integer> e : values.entrySet()) {
      sj.add(e.getKey() + "=" + e.getValue());
    }
    if (tzname != null) {
      sj.add("tzname=" + tzname);
    }
    return sj.toString();
  }

  /** Accumulates the fields of one parse. Not thread-safe; one builder per parse call. */
  public static final class Builder {
    private final String input;
    private final EnumMap<Field, Integer> values = new EnumMap<>(Field.class);
    private final EnumMap<Field, Span> spans = new EnumMap<>(Field.class);
    private String tzname;

    private Builder(String input) {
      this.input = input;
    }

    /**
     * Sets {@code field} to {@code value}.
     *
     * @param field the component to set
     * @param value the value
     * @param span the location of the value in the input, or null
     * @return this builder
     * @throws DateParseException if the field was already set
     */
    public Builder set(Field field, int value, Span span) throws DateParseException {
      if (values.containsKey(field)) {
        throw DateParseException.invalidNumeric(field + " is already set", span, input);
      }
      values.put(field, value);
      if (span != null) {
        spans.put(field, span);
      }
      return this;
    }

    /**
     * Overwrites the hour with its 24-hour value after a trailing AM/PM marker.
     *
     * @param hour the 24-hour clock value
     * @return this builder
     */
    public Builder replaceHour(int hour) {
      values.put(Field.HOUR, hour);
      return this;
    }

    /**
     * Sets the timezone name.
     *
     * @param name the literal zone name
     * @param span the location of the name, or null
     * @return this builder
     * @throws DateParseException if a name was already set
     */
    public Builder tzname(String name, Span span) throws DateParseException {
      if (tzname != null) {
        throw DateParseException.invalidNumeric("timezone name is already set", span, input);
      }
      tzname = name;
      return this;
    }

    /**
     * Returns true if {@code field} has been set.
     *
     * @param field the component to test
     * @return whether the field is set
     */
    public boolean isSet(Field field) {
      return values.containsKey(field);
    }

    /**
     * Returns the current value of {@code field}.
     *
     * @param field the component to read
     * @return the value, or empty if unset
     */
    public OptionalInt peek(Field field) {
      Integer v = values.get(field);
      return v == null ? OptionalInt.empty() : OptionalInt.of(v);
    }

    /**
     * Returns true if a timezone name has been set.
     *
     * @return whether a name is set
     */
    public boolean hasTzname() {
      return tzname != null;
    }

    /**
     * Validates every set field against its range and returns the immutable result.
     *
     * @return the result
     * @throws DateParseException if a field is out of range
     */
    public ParseResult build() throws DateParseException {
      for (Map.Entry<Field, Integer> e : values.entrySet()) {
        if (!e.getKey().inRange(e.getValue())) {
          throw outOfRange(e.getKey(), e.getValue());
        }
      }
      Integer day = values.get(Field.DAY);
      Integer month = values.get(Field.MONTH);
      if (day != null && month != null) {
        Integer year = values.get(Field.YEAR);
        // Without a year, allow Feb 29.
        int maxDay = YearMonth.of(year == null ? 2000 : year, month).lengthOfMonth();
        if (day > maxDay) {
          throw DateParseException.invalidNumeric(
              "day " + day + " is out of range for month " + month, spans.get(Field.DAY), input);
        }
      }
      return new ParseResult(new EnumMap<>(values), tzname);
    }

    private DateParseException outOfRange(Field field, int value) {
      return DateParseException.invalidNumeric(
          field + " " + value + " is out of range", spans.get(field), input);
    }
  }
}
