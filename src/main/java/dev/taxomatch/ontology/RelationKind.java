package dev.taxomatch.ontology;

/** Kind of lexical relation between a looked-up term and a related term. */
public enum RelationKind {
  SYNONYM,
  HYPERNYM,
  HYPONYM,
  /** The related term names a part of the looked-up term. */
  MERONYM,
  /** The related term names a whole the looked-up term is a part of. */
  HOLONYM;

  /** Whether this is a part-whole relation rather than a same-meaning or is-a one. */
  public boolean isPartWhole() {
    return this == MERONYM || this == HOLONYM;
  }
}
