package dev.taxomatch.keypath;

import dev.taxomatch.match.MatchingConfig;
import dev.taxomatch.match.NodeMatch;
import java.util.Comparator;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Scores a matched key path against the source key path.
 *
 * <p>Positions are weighed leaf first with a geometric decay: the leaf counts fully, its key parent
 * {@code depthDecay}, the next one {@code depthDecay^2}, and so on. Each position contributes its
 * weight times the match kind weight times the node coverage. Neutral positions (either side had no
 * terms) drop out of both the sum and the normalization, so they neither help nor hurt. A candidate
 * whose leaf did not match scores zero.
 *
 * <p>The score is not symmetric: coverage counts the source node's terms.
 */
@Component
public class KeyPathRanker {

  private static final Comparator<RankedCandidate> ORDER =
      Comparator.comparingDouble(RankedCandidate::score)
          .reversed()
          .thenComparingInt(RankedCandidate::keyPathLengthDelta);

  private final double depthDecay;

  public KeyPathRanker(MatchingConfig config) {
    this.depthDecay = config.depthDecay();
  }

  /**
   * Scores an alignment against the source key path it was built from.
   *
   * @param matched the source key path aligned with one candidate
   * @return a score in [0, 1]; 0 for an empty key path or an unmatched leaf
   */
  public double rank(MatchedKeyPath matched) {
    List<NodePairing> leafFirst = matched.leafFirst();
    if (leafFirst.isEmpty() || !leafFirst.get(0).match().isMatch()) {
      return 0.0;
    }

    double weighted = 0.0;
    double norm = 0.0;
    double weight = 1.0;
    for (NodePairing pairing : leafFirst) {
      NodeMatch match = pairing.match();
      if (!match.isNeutral()) {
        weighted += weight * match.strength();
        norm += weight;
      }
      weight *= depthDecay;
    }
    return norm == 0.0 ? 0.0 : weighted / norm;
  }

  /**
   * Best first: higher score, then the candidate key path closest in length to the source one.
   * Remaining ties keep their order when used with a stable sort.
   */
  public Comparator<RankedCandidate> comparator() {
    return ORDER;
  }
}
