package io.opendate.lexer;

/** The lexical class of a token. */
public enum TokenKind {
  /** A maximal run of ASCII digits. */
  DIGITS,
  /** A maximal run of letters. */
  LETTERS,
  /** A single whitespace or punctuation character. */
  SEPARATOR
}
