package dev.taxomatch.match;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Externalised configuration for node matching, key-path generation and ranking.
 *
 * <p>Properties are bound from {@code taxomatch.matching.*} in application.yml:
 *
 * <ul>
 *   <li>{@code threshold} - minimum Damerau-Levenshtein similarity ratio for the edit-distance
 *       fallback (tnode, default 0.8, bounded [0.0, 1.0]). Ontology relations ignore it.
 *   <li>{@code term-match-policy} - node aggregation policy: ANY, MAJORITY or ALL (default
 *       MAJORITY)
 *   <li>{@code use-stemming} - fold English plurals on every term set (default true)
 *   <li>{@code depth-decay} - per-level weight factor applied from the leaf upward when ranking
 *       (default 0.5, bounded (0.0, 1.0])
 *   <li>{@code concurrency} - worker threads used to evaluate candidates (default 4, at least 1)
 * </ul>
 *
 * <p>Validated on construction; the application fails to start if values are out of range.
 */
@ConfigurationProperties(prefix = "taxomatch.matching")
public record MatchingConfig(
    @DefaultValue("0.8") double threshold,
    @DefaultValue("MAJORITY") TermMatchPolicy termMatchPolicy,
    @DefaultValue("true") boolean useStemming,
    @DefaultValue("0.5") double depthDecay,
    @DefaultValue("4") int concurrency) {

  public MatchingConfig {
    if (threshold < 0.0 || threshold > 1.0) {
      throw new IllegalStateException(
          "taxomatch.matching.threshold must be in [0.0, 1.0], got: " + threshold);
    }
    if (termMatchPolicy == null) {
      throw new IllegalStateException("taxomatch.matching.term-match-policy must be set");
    }
    if (depthDecay <= 0.0 || depthDecay > 1.0) {
      throw new IllegalStateException(
          "taxomatch.matching.depth-decay must be in (0.0, 1.0], got: " + depthDecay);
    }
    if (concurrency < 1) {
      throw new IllegalStateException(
          "taxomatch.matching.concurrency must be at least 1, got: " + concurrency);
    }
  }

  /** The documented defaults, for use outside a Spring context. */
  public static MatchingConfig defaults() {
    return new MatchingConfig(0.8, TermMatchPolicy.MAJORITY, true, 0.5, 4);
  }

  public MatchingConfig withThreshold(double newThreshold) {
    return new MatchingConfig(newThreshold, termMatchPolicy, useStemming, depthDecay, concurrency);
  }

  public MatchingConfig withTermMatchPolicy(TermMatchPolicy policy) {
    return new MatchingConfig(threshold, policy, useStemming, depthDecay, concurrency);
  }

  public MatchingConfig withStemming(boolean stemming) {
    return new MatchingConfig(threshold, termMatchPolicy, stemming, depthDecay, concurrency);
  }

  public MatchingConfig withDepthDecay(double decay) {
    return new MatchingConfig(threshold, termMatchPolicy, useStemming, decay, concurrency);
  }
}
