package dev.taxomatch.keypath;

import dev.taxomatch.match.NodeMatch;
import dev.taxomatch.path.Node;
import org.jspecify.annotations.Nullable;

/**
 * One source key-path node and the candidate node it was aligned with.
 *
 * @param sourceNode node of the source key path
 * @param candidateNode the candidate ancestor that confirmed it, null when none did
 * @param match the node-level decision; NO_MATCH or INSUFFICIENT_INFORMATION when unaligned
 */
public record NodePairing(Node sourceNode, @Nullable Node candidateNode, NodeMatch match) {

  public boolean isAligned() {
    return candidateNode != null;
  }
}
