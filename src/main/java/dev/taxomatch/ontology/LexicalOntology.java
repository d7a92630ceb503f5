package dev.taxomatch.ontology;

import java.util.List;
import java.util.Set;
import java.util.function.Function;

/**
 * The lexical-ontology capability the matcher is built on: synonym, hypernym and hyponym relations
 * for a single normalized term.
 *
 * <p>Implementations must return an empty result, not throw, for unknown terms. Failures of the
 * underlying resource are reported as {@link OntologyLookupException}. Lookups are synchronous and
 * idempotent; callers that talk to a remote lexicon wrap them with their own timeouts.
 */
public interface LexicalOntology {

  /**
   * The meanings of a term, most common first. Ontologies without sense distinctions return a
   * single sense.
   *
   * @param term a normalized term
   * @return the senses, empty for unknown terms
   * @throws OntologyLookupException if the resource cannot be queried
   */
  List<Sense> senses(String term);

  /**
   * All relations of a term across its senses.
   *
   * @param term a normalized term
   * @return related terms tagged by relation kind, empty for unknown terms
   * @throws OntologyLookupException if the resource cannot be queried
   */
  default Set<TermRelation> relations(String term) {
    return Sense.relationsOf(senses(term));
  }

  /** Adapts a plain relation lookup, which knows nothing about senses. */
  static LexicalOntology fromRelations(Function<String, Set<TermRelation>> lookup) {
    return term -> {
      Set<TermRelation> relations = lookup.apply(term);
      if (relations == null || relations.isEmpty()) {
        return List.of();
      }
      return List.of(Sense.fromRelations(term, relations));
    };
  }

  /** An ontology that knows no terms; every match falls back to edit distance. */
  static LexicalOntology empty() {
    return term -> List.of();
  }
}
