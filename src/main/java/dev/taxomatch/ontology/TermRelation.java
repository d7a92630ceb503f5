package dev.taxomatch.ontology;

/**
 * A term related to a looked-up term.
 *
 * @param term the related lemma, possibly multi-word ("cottage cheese")
 * @param kind how it relates to the looked-up term
 */
public record TermRelation(String term, RelationKind kind) {

  public TermRelation {
    if (term == null || term.isBlank()) {
      throw new IllegalArgumentException("Related term must not be blank");
    }
    if (kind == null) {
      throw new IllegalArgumentException("Relation kind must not be null");
    }
  }
}
