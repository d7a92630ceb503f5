package dev.taxomatch.mapping.eval;

import java.util.List;

/**
 * Per-mapping evaluation result.
 *
 * @param id the golden mapping id
 * @param rank 1-based rank of the expected target, 0 if it was not returned
 * @param topScore score of the first-ranked candidate, 0.0 when nothing was ranked
 * @param returned labels of the returned candidates, best first
 */
public record EvaluationResult(String id, int rank, double topScore, List<List<String>> returned) {

  public EvaluationResult {
    returned = List.copyOf(returned);
  }

  public boolean correct() {
    return rank == 1;
  }

  public double reciprocalRank() {
    return MappingMetrics.reciprocalRank(rank);
  }
}
