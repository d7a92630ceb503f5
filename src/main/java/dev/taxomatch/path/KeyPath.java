package dev.taxomatch.path;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * A reduced, root-first subsequence of a {@link Path}: only the nodes needed to characterise the
 * leaf against a particular candidate set. Key paths are derived by the key-path generator, never
 * constructed independently by callers.
 *
 * @param nodes the selected nodes, root first, with strictly increasing depths
 */
public record KeyPath(List<Node> nodes) {

  private static final KeyPath EMPTY = new KeyPath(List.of());

  public KeyPath {
    nodes = List.copyOf(nodes);
    for (int i = 1; i < nodes.size(); i++) {
      if (nodes.get(i).depth() <= nodes.get(i - 1).depth()) {
        throw new IllegalArgumentException("Key path nodes must have increasing depths: " + nodes);
      }
    }
  }

  /** The zero-length key path. */
  public static KeyPath empty() {
    return EMPTY;
  }

  /** Key path covering every node of the given node list. */
  public static KeyPath full(List<Node> pathNodes) {
    return new KeyPath(pathNodes);
  }

  /** Selects the nodes at the given depths from a path snapshot. */
  public static KeyPath of(List<Node> pathNodes, List<Integer> depths) {
    List<Node> selected = new ArrayList<>(depths.size());
    for (int depth : depths) {
      selected.add(pathNodes.get(depth));
    }
    return new KeyPath(selected);
  }

  public int size() {
    return nodes.size();
  }

  public boolean isEmpty() {
    return nodes.isEmpty();
  }

  /** The leaf of the key path. */
  public Node leaf() {
    if (nodes.isEmpty()) {
      throw new IllegalStateException("Empty key path has no leaf");
    }
    return nodes.get(nodes.size() - 1);
  }

  /** Nodes leaf first, the order in which key paths are walked for matching and ranking. */
  public List<Node> leafFirst() {
    List<Node> reversed = new ArrayList<>(nodes);
    Collections.reverse(reversed);
    return reversed;
  }

  public List<Integer> depths() {
    return nodes.stream().map(Node::depth).toList();
  }

  @Override
  public String toString() {
    return nodes.stream().map(Node::label).collect(Collectors.joining(" > ", "[", "]"));
  }
}
