package dev.taxomatch.term;

import dev.taxomatch.path.Node;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.springframework.stereotype.Component;

/**
 * Builds {@link ExtendedTermSet}s from category labels, using the parent and children of a
 * category as context.
 *
 * <p>For a node on a path, the parent is the preceding node, and the children are the following
 * node plus any extra child labels the taxonomy loader attached to the node.
 */
@Component
public class ExtendedSplitTermSet {

  private final TermSplitter splitter;

  public ExtendedSplitTermSet(TermSplitter splitter) {
    this.splitter = splitter;
  }

  public TermSplitter splitter() {
    return splitter;
  }

  /**
   * Splits a category and its context labels.
   *
   * @param category the category label
   * @param parent the parent label, or null for a root
   * @param children child labels, possibly empty
   * @return the extended term set; the category group may be empty for degenerate labels
   */
  public ExtendedTermSet splitTerms(
      String category, @Nullable String parent, List<String> children) {
    List<TermSet> childTerms = new ArrayList<>(children.size());
    for (String child : children) {
      childTerms.add(splitter.split(child));
    }
    return new ExtendedTermSet(splitter.split(category), splitter.split(parent), childTerms);
  }

  /**
   * Builds one extended term set per node of a path snapshot, index-aligned with it.
   *
   * @param nodes path nodes, root first
   * @return extended term sets in the same order
   */
  public List<ExtendedTermSet> forPath(List<Node> nodes) {
    List<ExtendedTermSet> termSets = new ArrayList<>(nodes.size());
    for (int i = 0; i < nodes.size(); i++) {
      Node node = nodes.get(i);
      String parent = i > 0 ? nodes.get(i - 1).label() : null;
      List<String> children = new ArrayList<>();
      if (i + 1 < nodes.size()) {
        children.add(nodes.get(i + 1).label());
      }
      children.addAll(node.childLabels());
      termSets.add(splitTerms(node.label(), parent, children));
    }
    return termSets;
  }
}
