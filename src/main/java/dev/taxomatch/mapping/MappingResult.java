package dev.taxomatch.mapping;

import dev.taxomatch.keypath.RankedCandidate;
import dev.taxomatch.path.KeyPath;
import dev.taxomatch.path.Path;
import java.util.List;
import java.util.Optional;

/**
 * Outcome of mapping one source path.
 *
 * @param sourceKeyPath the discriminating nodes of the source path
 * @param ranked leaf-matched candidates, best first, after score filtering and truncation
 * @param unmatched candidates whose leaf did not match, in input order
 * @param skipped number of malformed candidates ignored
 */
public record MappingResult(
    KeyPath sourceKeyPath, List<RankedCandidate> ranked, List<Path> unmatched, int skipped) {

  public MappingResult {
    ranked = List.copyOf(ranked);
    unmatched = List.copyOf(unmatched);
  }

  /** The top-ranked candidate, if any candidate's leaf matched. */
  public Optional<RankedCandidate> best() {
    return ranked.isEmpty() ? Optional.empty() : Optional.of(ranked.get(0));
  }
}
