package dev.taxomatch.path;

import java.util.List;

/**
 * A single taxonomy category at a fixed position of its owning {@link Path}.
 *
 * <p>Nodes do not reference their neighbours. Parent and child are resolved through the owning
 * path by index ({@link Path#parentOf(Node)}, {@link Path#childOf(Node)}), so two nodes sharing a
 * label are never confused.
 *
 * @param depth index of this node in the owning path (root = 0)
 * @param label human-readable category name, may contain separators such as "&amp;" or "/"
 * @param childLabels labels of tree children that are not on the path; extra context only
 */
public record Node(int depth, String label, List<String> childLabels) {

  public Node {
    if (depth < 0) {
      throw new IllegalArgumentException("depth must not be negative, got: " + depth);
    }
    if (label == null || label.isBlank()) {
      throw new InvalidInputException("Node label must not be blank");
    }
    childLabels = childLabels == null ? List.of() : List.copyOf(childLabels);
  }

  @Override
  public String toString() {
    return label;
  }
}
