package io.opendate;

/**
 * Options for the heuristic resolver.
 *
 * @param dayfirst read an ambiguous pair as day before month ("01/05" is 1 May)
 * @param yearfirst read an ambiguous leading number as the year ("01/05/09" is 2001-05-09)
 * @param fuzzy skip text no rule can attribute instead of failing
 * @param fuzzyWithTokens also report the skipped text; requires {@code fuzzy}
 */
public record ParserConfig(
    boolean dayfirst, boolean yearfirst, boolean fuzzy, boolean fuzzyWithTokens) {

  /** Month first, year last, no fuzzy matching. */
  public static final ParserConfig DEFAULT = new ParserConfig(false, false, false, false);

  public ParserConfig {
    if (fuzzyWithTokens && !fuzzy) {
      throw new IllegalArgumentException("fuzzyWithTokens requires fuzzy");
    }
  }

  /**
   * Returns a copy with {@code dayfirst} replaced.
   *
   * @param value the new value
   * @return a new config
   */
  public ParserConfig withDayfirst(boolean value) {
    return new ParserConfig(value, yearfirst, fuzzy, fuzzyWithTokens);
  }

  /**
   * Returns a copy with {@code yearfirst} replaced.
   *
   * @param value the new value
   * @return a new config
   */
  public ParserConfig withYearfirst(boolean value) {
    return new ParserConfig(dayfirst, value, fuzzy, fuzzyWithTokens);
  }

  /**
   * Returns a copy with {@code fuzzy} replaced. Turning fuzzy off also turns off token reporting.
   *
   * @param value the new value
   * @return a new config
   */
  public ParserConfig withFuzzy(boolean value) {
    return new ParserConfig(dayfirst, yearfirst, value, value && fuzzyWithTokens);
  }

  /**
   * Returns a copy that is fuzzy and reports skipped tokens.
   *
   * @return a new config
   */
  public ParserConfig withSkippedTokens() {
    return new ParserConfig(dayfirst, yearfirst, true, true);
  }
}
