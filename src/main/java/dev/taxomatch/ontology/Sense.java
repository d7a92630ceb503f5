package dev.taxomatch.ontology;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * One meaning of a term (a WordNet synset seen from one of its members).
 *
 * <p>Relation sets keep the order the ontology lists them in, including when read from JSON.
 *
 * @param id identifier of the sense, unique within its ontology
 * @param synonyms other lemmas with the same meaning
 * @param hypernyms lemmas of directly broader meanings
 * @param hyponyms lemmas of directly narrower meanings
 * @param meronyms lemmas of the parts of this meaning
 * @param holonyms lemmas of the wholes this meaning is a part of
 * @param gloss free-text definition, empty when the ontology has none
 * @param relatedGlosses definitions of the directly related meanings
 */
public record Sense(
    String id,
    @JsonDeserialize(as = LinkedHashSet.class) Set<String> synonyms,
    @JsonDeserialize(as = LinkedHashSet.class) Set<String> hypernyms,
    @JsonDeserialize(as = LinkedHashSet.class) Set<String> hyponyms,
    @JsonDeserialize(as = LinkedHashSet.class) Set<String> meronyms,
    @JsonDeserialize(as = LinkedHashSet.class) Set<String> holonyms,
    String gloss,
    List<String> relatedGlosses) {

  public Sense {
    id = id == null ? "" : id;
    synonyms = copy(synonyms);
    hypernyms = copy(hypernyms);
    hyponyms = copy(hyponyms);
    meronyms = copy(meronyms);
    holonyms = copy(holonyms);
    gloss = gloss == null ? "" : gloss;
    relatedGlosses =
        relatedGlosses == null
            ? List.of()
            : relatedGlosses.stream().filter(g -> g != null && !g.isBlank()).toList();
  }

  /** A sense without part-whole relations or related glosses. */
  public Sense(
      String id, Set<String> synonyms, Set<String> hypernyms, Set<String> hyponyms, String gloss) {
    this(id, synonyms, hypernyms, hyponyms, Set.of(), Set.of(), gloss, List.of());
  }

  /** Groups flat relations into a single anonymous sense. */
  public static Sense fromRelations(String term, Collection<TermRelation> relations) {
    Set<String> synonyms = new LinkedHashSet<>();
    Set<String> hypernyms = new LinkedHashSet<>();
    Set<String> hyponyms = new LinkedHashSet<>();
    Set<String> meronyms = new LinkedHashSet<>();
    Set<String> holonyms = new LinkedHashSet<>();
    for (TermRelation relation : relations) {
      switch (relation.kind()) {
        case SYNONYM -> synonyms.add(relation.term());
        case HYPERNYM -> hypernyms.add(relation.term());
        case HYPONYM -> hyponyms.add(relation.term());
        case MERONYM -> meronyms.add(relation.term());
        case HOLONYM -> holonyms.add(relation.term());
      }
    }
    return new Sense(term, synonyms, hypernyms, hyponyms, meronyms, holonyms, "", List.of());
  }

  /** The relations of this sense, synonyms first and part-whole relations last. */
  public Set<TermRelation> relations() {
    Set<TermRelation> relations = new LinkedHashSet<>();
    synonyms.forEach(s -> relations.add(new TermRelation(s, RelationKind.SYNONYM)));
    hypernyms.forEach(s -> relations.add(new TermRelation(s, RelationKind.HYPERNYM)));
    hyponyms.forEach(s -> relations.add(new TermRelation(s, RelationKind.HYPONYM)));
    meronyms.forEach(s -> relations.add(new TermRelation(s, RelationKind.MERONYM)));
    holonyms.forEach(s -> relations.add(new TermRelation(s, RelationKind.HOLONYM)));
    return Collections.unmodifiableSet(relations);
  }

  /** Union of the relations of several senses. */
  public static Set<TermRelation> relationsOf(List<Sense> senses) {
    Set<TermRelation> relations = new LinkedHashSet<>();
    for (Sense sense : senses) {
      relations.addAll(sense.relations());
    }
    return Collections.unmodifiableSet(relations);
  }

  private static Set<String> copy(Set<String> values) {
    return values == null
        ? Set.of()
        : Collections.unmodifiableSet(new LinkedHashSet<>(values));
  }
}
