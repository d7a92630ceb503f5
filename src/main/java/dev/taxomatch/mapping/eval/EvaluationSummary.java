package dev.taxomatch.mapping.eval;

import java.util.List;

/**
 * Aggregate evaluation summary with pass/fail status.
 *
 * @param count number of golden mappings evaluated
 * @param accuracyAt1 fraction of mappings whose expected target ranked first
 * @param mrr mean reciprocal rank
 * @param hitRateAtK fraction of mappings whose target ranked within {@code k}
 * @param k the hit-rate depth
 * @param passed true if all threshold constraints are met
 * @param failedMappings ids of mappings whose target did not rank first
 */
public record EvaluationSummary(
    int count,
    double accuracyAt1,
    double mrr,
    double hitRateAtK,
    int k,
    boolean passed,
    List<String> failedMappings) {

  public EvaluationSummary {
    failedMappings = List.copyOf(failedMappings);
  }
}
