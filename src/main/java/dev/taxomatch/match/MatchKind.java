package dev.taxomatch.match;

/**
 * How a source term or node found its counterpart, strongest first. The declaration order is the
 * strength order; {@link #weight()} is the contribution of a node matched this way when ranking.
 */
public enum MatchKind {
  EXACT(1.0),
  SYNONYM(0.9),
  /** Hypernym or hyponym relation, or a hit in the candidate's parent/children context. */
  HYPERNYM(0.75),
  EDIT_DISTANCE(0.6),
  NO_MATCH(0.0),
  /** Neutral: one side had no terms to compare. Neither confirms nor penalizes. */
  INSUFFICIENT_INFORMATION(0.0);

  private final double weight;

  MatchKind(double weight) {
    this.weight = weight;
  }

  public double weight() {
    return weight;
  }

  /** True for the kinds that confirm a match. */
  public boolean isMatch() {
    return this != NO_MATCH && this != INSUFFICIENT_INFORMATION;
  }

  /** The weaker of two confirming kinds. */
  public MatchKind weakest(MatchKind other) {
    return ordinal() >= other.ordinal() ? this : other;
  }
}
