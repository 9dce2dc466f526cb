package io.opendate;

import java.util.List;

/**
 * The outcome of a fuzzy parse that reports what it ignored.
 *
 * @param result the recovered components
 * @param skippedTokens the ignored substrings in input order, adjacent ones joined
 */
public record FuzzyResult(ParseResult result, List<String> skippedTokens) {
  public FuzzyResult {
    skippedTokens = List.copyOf(skippedTokens);
  }
}
