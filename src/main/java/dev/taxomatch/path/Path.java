package dev.taxomatch.path;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Ordered sequence of category nodes from root to leaf.
 *
 * <p>A path is built append-only by the taxonomy loader via {@link #addNode(String)}. The engine
 * works on {@link #nodes()} snapshots, so appending after a match has started has no effect on
 * it. An empty path is representable so that loaders can hand malformed input over; it is rejected
 * as a source and skipped as a candidate.
 *
 * <pre>{@code
 * Path path = Path.of("Dairy", "Cheese", "Cottage Cheese");
 * }</pre>
 */
public final class Path {

  private final List<Node> nodes = new ArrayList<>();

  public Path() {}

  /** Creates a path from root-first labels. */
  public static Path of(String... labels) {
    return of(List.of(labels));
  }

  /** Creates a path from root-first labels. */
  public static Path of(Collection<String> labels) {
    Path path = new Path();
    labels.forEach(path::addNode);
    return path;
  }

  /**
   * Appends a node at the end of the path.
   *
   * @param label the category label
   * @return this path, for chaining
   * @throws InvalidInputException if the label is blank
   */
  public Path addNode(String label) {
    return addNode(label, List.of());
  }

  /**
   * Appends a node that carries the labels of its other tree children as context.
   *
   * @param label the category label
   * @param childLabels labels of children of this category that are not on the path
   * @return this path, for chaining
   * @throws InvalidInputException if the label is blank
   */
  public synchronized Path addNode(String label, List<String> childLabels) {
    nodes.add(new Node(nodes.size(), label, childLabels));
    return this;
  }

  /** Immutable snapshot of the nodes, root first. */
  public synchronized List<Node> nodes() {
    return List.copyOf(nodes);
  }

  public synchronized int size() {
    return nodes.size();
  }

  public synchronized boolean isEmpty() {
    return nodes.isEmpty();
  }

  public synchronized Node get(int depth) {
    return nodes.get(depth);
  }

  /** The last node, or empty for an empty path. */
  public synchronized Optional<Node> leaf() {
    return nodes.isEmpty() ? Optional.empty() : Optional.of(nodes.get(nodes.size() - 1));
  }

  /** The node one level up, or empty for the root. */
  public synchronized Optional<Node> parentOf(Node node) {
    checkOwned(node);
    return node.depth() == 0 ? Optional.empty() : Optional.of(nodes.get(node.depth() - 1));
  }

  /** The node one level down on this path, or empty for the leaf. */
  public synchronized Optional<Node> childOf(Node node) {
    checkOwned(node);
    int next = node.depth() + 1;
    return next < nodes.size() ? Optional.of(nodes.get(next)) : Optional.empty();
  }

  /** Labels root first. */
  public synchronized List<String> labels() {
    return nodes.stream().map(Node::label).toList();
  }

  private void checkOwned(Node node) {
    if (node.depth() >= nodes.size() || !nodes.get(node.depth()).equals(node)) {
      throw new IllegalArgumentException("Node " + node + " does not belong to path " + this);
    }
  }

  @Override
  public synchronized String toString() {
    return nodes.stream().map(Node::label).collect(Collectors.joining(" > "));
  }
}
