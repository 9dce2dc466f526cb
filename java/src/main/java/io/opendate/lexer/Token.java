package io.opendate.lexer;

import io.opendate.Span;

/**
 * A lexed token.
 *
 * @param kind the lexical class
 * @param text the exact characters of the token
 * @param span the location in the input
 */
public record Token(TokenKind kind, String text, Span span) {
  /** Creates a digit-run token. */
  public static Token digits(String text, int start) {
    return new Token(TokenKind.DIGITS, text, new Span(start, start + text.length()));
  }

  /** Creates a letter-run token. */
  public static Token letters(String text, int start) {
    return new Token(TokenKind.LETTERS, text, new Span(start, start + text.length()));
  }

  /** Creates a single-character separator token. */
  public static Token separator(char ch, int start) {
    return new Token(TokenKind.SEPARATOR, String.valueOf(ch), Span.at(start));
  }

  public boolean isDigits() {
    return kind == TokenKind.DIGITS;
  }

  public boolean isLetters() {
    return kind == TokenKind.LETTERS;
  }

  /** Returns true if this is the separator {@code ch}. */
  public boolean is(char ch) {
    return kind == TokenKind.SEPARATOR && text.charAt(0) == ch;
  }

  /** Returns true if this is a whitespace separator. */
  public boolean isWhitespace() {
    return kind == TokenKind.SEPARATOR && Character.isWhitespace(text.charAt(0));
  }

  /** Returns the offset of the first character. */
  public int start() {
    return span.start();
  }

  /** Returns the number of characters in the token. */
  public int length() {
    return text.length();
  }
}
