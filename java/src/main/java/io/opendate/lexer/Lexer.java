package io.opendate.lexer;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits input into digit runs, letter runs and single-character separators.
 *
 * <p>The split is purely lexical: {@code "2h30m"} is four tokens, {@code "a.m."} is four tokens
 * and every whitespace character is its own token. Tokens are returned in input order with their
 * offsets. Tokenizing never fails.
 */
public final class Lexer {
  private final String input;
  private int pos;

  private Lexer(String input) {
    this.input = input;
    this.pos = 0;
  }

  /**
   * Tokenizes the input string.
   *
   * @param input the input string, may be null
   * @return the tokens in input order; empty for null or empty input
   */
  public static List<Token> tokenize(String input) {
    if (input == null || input.isEmpty()) {
      return List.of();
    }
    return new Lexer(input).doTokenize();
  }

  private List<Token> doTokenize() {
    List<Token> tokens = new ArrayList<>();
    while (pos < input.length()) {
      int start = pos;
      char ch = input.charAt(pos);

      if (isDigit(ch)) {
        while (pos < input.length() && isDigit(input.charAt(pos))) {
          pos++;
        }
        tokens.add(Token.digits(input.substring(start, pos), start));
        continue;
      }

      if (isAlpha(ch)) {
        while (pos < input.length() && isAlpha(input.charAt(pos))) {
          pos++;
        }
        tokens.add(Token.letters(input.substring(start, pos), start));
        continue;
      }

      pos++;
      tokens.add(Token.separator(ch, start));
    }
    return tokens;
  }

  private static boolean isDigit(char c) {
    return c >= '0' && c <= '9';
  }

  private static boolean isAlpha(char c) {
    return Character.isLetter(c);
  }
}
