package dev.taxomatch.keypath;

import dev.taxomatch.path.Path;

/**
 * A candidate with its ranking score.
 *
 * @param candidate the candidate path
 * @param matched its aligned key path
 * @param score ranking score in [0, 1]
 */
public record RankedCandidate(Path candidate, MatchedKeyPath matched, double score) {

  /** Length difference between the candidate's and the source's key paths. */
  public int keyPathLengthDelta() {
    return Math.abs(matched.candidateKeyPath().size() - matched.sourceKeyPath().size());
  }
}
