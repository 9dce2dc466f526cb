package io.opendate.parser;

import io.opendate.Span;
import io.opendate.lexer.Token;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * A token as the heuristic resolver sees it: a lexer token, or a decimal number rebuilt from
 * {@code digits . digits} (or {@code digits , digits} after a colon, as in "10:49:41,502").
 */
record Lexeme(String text, Span span, boolean number, boolean word) {

  static List<Lexeme> fromTokens(List<Token> tokens) {
    List<Lexeme> out = new ArrayList<>(tokens.size());
    int i = 0;
    while (i < tokens.size()) {
      Token tok = tokens.get(i);
      if (tok.isDigits() && startsDecimal(tokens, i)) {
        Token frac = tokens.get(i + 2);
        String text = tok.text() + tokens.get(i + 1).text() + frac.text();
        out.add(new Lexeme(text, tok.span().to(frac.span()), true, false));
        i += 3;
        continue;
      }
      out.add(new Lexeme(tok.text(), tok.span(), tok.isDigits(), tok.isLetters()));
      i++;
    }
    return out;
  }

  // A single separator between two digit runs, not part of a dotted chain like 2003.09.25.
  private static boolean startsDecimal(List<Token> tokens, int i) {
    if (i + 2 >= tokens.size() || !tokens.get(i + 2).isDigits()) {
      return false;
    }
    Token sep = tokens.get(i + 1);
    boolean dot = sep.is('.');
    boolean comma =
        sep.is(',') && tokens.get(i).length() >= 2 && i > 0 && tokens.get(i - 1).is(':');
    if (!dot && !comma) {
      return false;
    }
    if (i > 0 && tokens.get(i - 1).is('.')) {
      return false;
    }
    boolean chainContinues =
        i + 4 < tokens.size() && tokens.get(i + 3).is('.') && tokens.get(i + 4).isDigits();
    return !chainContinues;
  }

  boolean is(char ch) {
    return !number && !word && text.length() == 1 && text.charAt(0) == ch;
  }

  boolean isSpace() {
    return !number && !word && text.length() == 1 && Character.isWhitespace(text.charAt(0));
  }

  boolean isInteger() {
    return number && integerDigits().length() == text.length();
  }

  boolean hasFraction() {
    return number && integerDigits().length() < text.length();
  }

  /** The digits before the decimal separator. */
  String integerDigits() {
    int end = 0;
    while (end < text.length() && Character.isDigit(text.charAt(end))) {
      end++;
    }
    return text.substring(0, end);
  }

  /** The digits after the decimal separator, or "" for an integer. */
  String fractionDigits() {
    String whole = integerDigits();
    return whole.length() < text.length() ? text.substring(whole.length() + 1) : "";
  }

  int intValue() {
    // Long runs are never field values; clamp so range checks reject them.
    String digits = integerDigits();
    return digits.length() > 9 ? Integer.MAX_VALUE : Integer.parseInt(digits);
  }

  /** The fractional part as a value in [0, 1). */
  BigDecimal fraction() {
    String frac = fractionDigits();
    return frac.isEmpty() ? BigDecimal.ZERO : new BigDecimal("0." + frac);
  }
}
