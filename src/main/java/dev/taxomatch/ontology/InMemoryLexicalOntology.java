package dev.taxomatch.ontology;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Lexical ontology held entirely in memory, built programmatically or loaded from a JSON lexicon.
 *
 * <p>The JSON form maps each term to its senses:
 *
 * <pre>{@code
 * {
 *   "sofa": [
 *     { "id": "sofa.n.01", "synonyms": ["couch", "lounge"], "hypernyms": ["seat"],
 *       "meronyms": ["armrest"], "gloss": "an upholstered seat for more than one person",
 *       "relatedGlosses": ["furniture that is designed for sitting on"] }
 *   ]
 * }
 * }</pre>
 *
 * <p>Terms are matched case-insensitively. Instances are immutable and safe for concurrent use.
 */
public final class InMemoryLexicalOntology implements LexicalOntology {

  private static final TypeReference<Map<String, List<Sense>>> LEXICON_TYPE =
      new TypeReference<>() {};

  private final Map<String, List<Sense>> senses;

  private InMemoryLexicalOntology(Map<String, List<Sense>> senses) {
    Map<String, List<Sense>> copy = new LinkedHashMap<>();
    senses.forEach((term, list) -> copy.put(key(term), List.copyOf(list)));
    this.senses = Map.copyOf(copy);
  }

  /**
   * Reads a JSON lexicon.
   *
   * @param json the lexicon stream; not closed by this method
   * @param objectMapper the mapper used to read it
   * @return the ontology
   * @throws OntologyLookupException if the lexicon cannot be read
   */
  public static InMemoryLexicalOntology fromJson(InputStream json, ObjectMapper objectMapper) {
    try {
      Map<String, List<Sense>> lexicon = objectMapper.readValue(json, LEXICON_TYPE);
      return new InMemoryLexicalOntology(lexicon);
    } catch (IOException e) {
      throw new OntologyLookupException("Failed to read JSON lexicon", e);
    }
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override
  public List<Sense> senses(String term) {
    return senses.getOrDefault(key(term), List.of());
  }

  /** Number of distinct terms with at least one sense. */
  public int size() {
    return senses.size();
  }

  private static String key(String term) {
    return term.trim().toLowerCase(Locale.ROOT);
  }

  /**
   * Builds an ontology sense by sense. Synonym groups become one sense per member; hypernym and
   * part links are recorded in both directions on the first sense of each term.
   *
   * <pre>{@code
   * LexicalOntology ontology = InMemoryLexicalOntology.builder()
   *     .synonyms("sofa", "couch")
   *     .hypernym("sofa", "furniture")
   *     .build();
   * }</pre>
   */
  public static final class Builder {

    private final Map<String, List<MutableSense>> senses = new LinkedHashMap<>();
    private int groupCounter = 0;

    private Builder() {}

    /** Declares that all given terms share one meaning. */
    public Builder synonyms(String... terms) {
      String id = "group-" + (++groupCounter);
      for (String term : terms) {
        MutableSense sense = new MutableSense(id);
        for (String other : terms) {
          if (!other.equalsIgnoreCase(term)) {
            sense.synonyms.add(key(other));
          }
        }
        senses.computeIfAbsent(key(term), k -> new ArrayList<>()).add(sense);
      }
      return this;
    }

    /** Declares {@code broader} as a hypernym of {@code term} and the reverse hyponym link. */
    public Builder hypernym(String term, String broader) {
      firstSense(term).hypernyms.add(key(broader));
      firstSense(broader).hyponyms.add(key(term));
      return this;
    }

    /** Declares {@code part} as a part of {@code whole} and the reverse holonym link. */
    public Builder part(String whole, String part) {
      firstSense(whole).meronyms.add(key(part));
      firstSense(part).holonyms.add(key(whole));
      return this;
    }

    /** Adds a fully specified sense for a term, after any senses it already has. */
    public Builder sense(String term, Sense sense) {
      MutableSense mutable = new MutableSense(sense.id());
      mutable.synonyms.addAll(sense.synonyms());
      mutable.hypernyms.addAll(sense.hypernyms());
      mutable.hyponyms.addAll(sense.hyponyms());
      mutable.meronyms.addAll(sense.meronyms());
      mutable.holonyms.addAll(sense.holonyms());
      mutable.gloss = sense.gloss();
      mutable.relatedGlosses.addAll(sense.relatedGlosses());
      senses.computeIfAbsent(key(term), k -> new ArrayList<>()).add(mutable);
      return this;
    }

    public InMemoryLexicalOntology build() {
      Map<String, List<Sense>> built = new LinkedHashMap<>();
      senses.forEach(
          (term, list) -> built.put(term, list.stream().map(MutableSense::toSense).toList()));
      return new InMemoryLexicalOntology(built);
    }

    private MutableSense firstSense(String term) {
      List<MutableSense> list = senses.computeIfAbsent(key(term), k -> new ArrayList<>());
      if (list.isEmpty()) {
        list.add(new MutableSense("group-" + (++groupCounter)));
      }
      return list.get(0);
    }
  }

  private static final class MutableSense {
    private final String id;
    private final Set<String> synonyms = new LinkedHashSet<>();
    private final Set<String> hypernyms = new LinkedHashSet<>();
    private final Set<String> hyponyms = new LinkedHashSet<>();
    private final Set<String> meronyms = new LinkedHashSet<>();
    private final Set<String> holonyms = new LinkedHashSet<>();
    private final List<String> relatedGlosses = new ArrayList<>();
    private String gloss = "";

    private MutableSense(String id) {
      this.id = id;
    }

    private Sense toSense() {
      return new Sense(
          id, synonyms, hypernyms, hyponyms, meronyms, holonyms, gloss, relatedGlosses);
    }
  }
}
