package dev.taxomatch.match;

import org.jspecify.annotations.Nullable;

/**
 * Outcome for a single source term.
 *
 * @param sourceTerm the source category term
 * @param candidateTerm the candidate term it matched, null when unmatched
 * @param kind how it matched; {@link MatchKind#NO_MATCH} when it did not
 * @param similarity 1.0 for exact and ontology matches, the edit-distance ratio otherwise
 */
public record TermMatch(
    String sourceTerm, @Nullable String candidateTerm, MatchKind kind, double similarity) {

  static TermMatch unmatched(String sourceTerm, double bestSimilarity) {
    return new TermMatch(sourceTerm, null, MatchKind.NO_MATCH, bestSimilarity);
  }

  public boolean isMatch() {
    return kind.isMatch();
  }
}
