package dev.taxomatch.keypath;

import dev.taxomatch.path.Path;
import java.util.List;

/**
 * Alignment results for a candidate set.
 *
 * @param keyPaths matched key paths of the candidates whose leaf matched, in input order
 * @param candidates the candidates of {@code keyPaths}, index-aligned with it
 * @param unmatched well-formed candidates whose leaf did not match the source leaf, in input order
 * @param skipped number of malformed candidates ignored (null, empty, or a leaf without terms)
 */
public record CandidateMatches(
    List<MatchedKeyPath> keyPaths, List<Path> candidates, List<Path> unmatched, int skipped) {

  public CandidateMatches {
    keyPaths = List.copyOf(keyPaths);
    candidates = List.copyOf(candidates);
    unmatched = List.copyOf(unmatched);
    if (keyPaths.size() != candidates.size()) {
      throw new IllegalArgumentException("keyPaths and candidates must be index-aligned");
    }
  }

  public boolean isEmpty() {
    return keyPaths.isEmpty();
  }
}
