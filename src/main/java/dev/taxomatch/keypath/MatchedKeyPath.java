package dev.taxomatch.keypath;

import dev.taxomatch.match.NodeMatch;
import dev.taxomatch.path.KeyPath;
import dev.taxomatch.path.Node;
import dev.taxomatch.path.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * The source key path aligned against one candidate.
 *
 * @param sourceKeyPath the source key path the pairings follow
 * @param candidate the candidate path
 * @param pairings one pairing per source key-path node, root first
 */
public record MatchedKeyPath(KeyPath sourceKeyPath, Path candidate, List<NodePairing> pairings) {

  public MatchedKeyPath {
    pairings = List.copyOf(pairings);
    if (pairings.size() != sourceKeyPath.size()) {
      throw new IllegalArgumentException(
          "Expected one pairing per key node ("
              + sourceKeyPath.size()
              + "), got "
              + pairings.size());
    }
  }

  /** The candidate nodes that confirmed a source key node, root first. */
  public KeyPath candidateKeyPath() {
    List<Node> nodes = new ArrayList<>(pairings.size());
    for (NodePairing pairing : pairings) {
      if (pairing.candidateNode() != null) {
        nodes.add(pairing.candidateNode());
      }
    }
    return new KeyPath(nodes);
  }

  /** Decision for the leaf pair. */
  public NodeMatch leafMatch() {
    if (pairings.isEmpty()) {
      return NodeMatch.noMatch();
    }
    return pairings.get(pairings.size() - 1).match();
  }

  /** Pairings leaf first, the order the ranker weighs them in. */
  public List<NodePairing> leafFirst() {
    List<NodePairing> reversed = new ArrayList<>(pairings.size());
    for (int i = pairings.size() - 1; i >= 0; i--) {
      reversed.add(pairings.get(i));
    }
    return reversed;
  }
}
