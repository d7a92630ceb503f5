package dev.taxomatch.match;

/**
 * How many of a source node's terms must find a counterpart before the node as a whole is
 * considered matched.
 */
public enum TermMatchPolicy {
  /** At least one source term matches. */
  ANY,
  /** Strictly more than half of the source terms match. */
  MAJORITY,
  /** Every source term matches. */
  ALL;

  /**
   * @param matched number of source terms that found a counterpart
   * @param total number of source terms
   * @return whether the node-level match is accepted
   */
  public boolean accepts(int matched, int total) {
    if (total == 0) {
      return false;
    }
    return switch (this) {
      case ANY -> matched >= 1;
      case MAJORITY -> matched * 2 > total;
      case ALL -> matched == total;
    };
  }
}
