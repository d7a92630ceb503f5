package dev.taxomatch.term;

import java.util.List;

/**
 * The term set of one category together with the term sets of its tree neighbours, kept as
 * separate groups. The matcher reads the neighbours as context: a hit against any one child's
 * vocabulary confirms the sense of the category, and keeping children apart preserves which child
 * it was.
 *
 * @param category terms of the category itself; empty means "insufficient information"
 * @param parent terms of the parent category; empty for a root
 * @param children one term set per child; empty for a leaf
 */
public record ExtendedTermSet(TermSet category, TermSet parent, List<TermSet> children) {

  public ExtendedTermSet {
    category = category == null ? TermSet.empty() : category;
    parent = parent == null ? TermSet.empty() : parent;
    children = children == null ? List.of() : List.copyOf(children);
  }

  /** Category-only term set with no context. */
  public static ExtendedTermSet of(TermSet category) {
    return new ExtendedTermSet(category, TermSet.empty(), List.of());
  }

  /** True when the category label yielded no terms. */
  public boolean isDegenerate() {
    return category.isEmpty();
  }

  /** Parent and children terms merged, used to pick between word senses. */
  public TermSet context() {
    TermSet context = parent;
    for (TermSet child : children) {
      context = context.union(child);
    }
    return context;
  }

  public boolean hasContext() {
    return !parent.isEmpty() || children.stream().anyMatch(child -> !child.isEmpty());
  }
}
