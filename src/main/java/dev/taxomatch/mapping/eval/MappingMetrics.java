package dev.taxomatch.mapping.eval;

import java.util.List;

/**
 * Mapping quality metrics. Each golden mapping has exactly one expected target, so a mapping is
 * summarised by the 1-based rank at which the target was returned, 0 meaning not returned.
 */
public final class MappingMetrics {

  private MappingMetrics() {}

  /** 1-based rank of {@code expected} in {@code rankedLabels}, or 0 when absent. */
  public static int rankOf(List<List<String>> rankedLabels, List<String> expected) {
    for (int i = 0; i < rankedLabels.size(); i++) {
      if (rankedLabels.get(i).equals(expected)) {
        return i + 1;
      }
    }
    return 0;
  }

  /** 1/rank, 0 when the target was not returned. */
  public static double reciprocalRank(int rank) {
    return rank <= 0 ? 0.0 : 1.0 / rank;
  }

  /** Fraction of mappings whose target came first. */
  public static double accuracyAt1(List<Integer> ranks) {
    return hitRate(ranks, 1);
  }

  /** Fraction of mappings whose target was among the first {@code k}. */
  public static double hitRate(List<Integer> ranks, int k) {
    if (ranks.isEmpty()) {
      return 0.0;
    }
    long hits = ranks.stream().filter(rank -> rank >= 1 && rank <= k).count();
    return (double) hits / ranks.size();
  }

  /** Mean reciprocal rank. */
  public static double mrr(List<Integer> ranks) {
    if (ranks.isEmpty()) {
      return 0.0;
    }
    return ranks.stream().mapToDouble(MappingMetrics::reciprocalRank).average().orElse(0.0);
  }
}
