package io.opendate.lexicon;

import java.util.Locale;
import java.util.Set;

/** Words and zone literals the heuristic resolver treats specially. */
public final class Lexicon {

  /** Filler that may appear anywhere and carries no meaning on its own. */
  private static final Set<String> JUMP =
      Set.of(
          " ", ".", ",", ";", "-", "/", "'", "at", "on", "and", "ad", "m", "t", "of", "st", "nd",
          "rd", "th");

  /** Words linking a month to its year, as in "September of 2003". */
  private static final Set<String> PERTAIN = Set.of("of");

  /** Zone literals with a known zero offset. */
  private static final Set<String> UTC_ZONES = Set.of("UTC", "GMT", "Z", "z");

  private Lexicon() {}

  /**
   * Returns true if {@code s} is filler: whitespace, light punctuation, a preposition or an
   * ordinal suffix.
   *
   * @param s the token text
   * @return whether the token can be skipped silently
   */
  public static boolean isJump(String s) {
    if (s.length() == 1 && Character.isWhitespace(s.charAt(0))) {
      return true;
    }
    return JUMP.contains(s.toLowerCase(Locale.ROOT));
  }

  /**
   * Returns true if {@code s} links a month name to a following year.
   *
   * @param s the token text
   * @return whether the token is a pertain word
   */
  public static boolean isPertain(String s) {
    return PERTAIN.contains(s.toLowerCase(Locale.ROOT));
  }

  /**
   * Returns true if {@code s} is a zone literal with offset zero (UTC, GMT, Z).
   *
   * @param s the token text
   * @return whether the zone is fixed at UTC
   */
  public static boolean isUtcZone(String s) {
    return UTC_ZONES.contains(s);
  }

  /**
   * Returns true for the Zulu designator, which is reported under the name "UTC".
   *
   * @param s the token text
   * @return whether the token is Z or z
   */
  public static boolean isZulu(String s) {
    return s.equals("Z") || s.equals("z");
  }

  /**
   * Returns true if {@code s} is shaped like a zone abbreviation: at most five uppercase ASCII
   * letters, or one of the UTC literals. The name is recorded as written; no offset is looked
   * up for ambiguous names such as EST or CET.
   *
   * @param s the token text
   * @return whether the token may name a zone
   */
  public static boolean looksLikeZoneName(String s) {
    if (s.length() > 5 || s.isEmpty()) {
      return false;
    }
    if (UTC_ZONES.contains(s)) {
      return true;
    }
    for (int i = 0; i < s.length(); i++) {
      char c = s.charAt(i);
      if (c < 'A' || c > 'Z') {
        return false;
      }
    }
    return true;
  }
}
