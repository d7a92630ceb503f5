package dev.taxomatch.match;

import java.util.List;

/**
 * Node-level match decision.
 *
 * @param kind weakest kind among the matched terms when accepted, {@link MatchKind#NO_MATCH} when
 *     the aggregation policy rejected it, {@link MatchKind#INSUFFICIENT_INFORMATION} when either
 *     side had no terms
 * @param coverage fraction of source terms that found a counterpart, in [0, 1]
 * @param termMatches per-term outcomes in source term order
 */
public record NodeMatch(MatchKind kind, double coverage, List<TermMatch> termMatches) {

  private static final NodeMatch INSUFFICIENT =
      new NodeMatch(MatchKind.INSUFFICIENT_INFORMATION, 0.0, List.of());

  public NodeMatch {
    if (coverage < 0.0 || coverage > 1.0) {
      throw new IllegalArgumentException("coverage must be in [0, 1], got: " + coverage);
    }
    termMatches = List.copyOf(termMatches);
  }

  public static NodeMatch insufficientInformation() {
    return INSUFFICIENT;
  }

  public static NodeMatch noMatch() {
    return new NodeMatch(MatchKind.NO_MATCH, 0.0, List.of());
  }

  /** Node matched with every term exact; what an identical node yields. */
  public static NodeMatch exact() {
    return new NodeMatch(MatchKind.EXACT, 1.0, List.of());
  }

  public boolean isMatch() {
    return kind.isMatch();
  }

  public boolean isNeutral() {
    return kind == MatchKind.INSUFFICIENT_INFORMATION;
  }

  /** Ranking contribution before depth weighting. */
  public double strength() {
    return kind.weight() * coverage;
  }
}
