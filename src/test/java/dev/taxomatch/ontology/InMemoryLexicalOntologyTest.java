package dev.taxomatch.ontology;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class InMemoryLexicalOntologyTest {

  @Nested
  class Builder {

    @Test
    void synonymGroupGivesEachMemberTheOthers() {
      InMemoryLexicalOntology ontology =
          InMemoryLexicalOntology.builder().synonyms("sofa", "couch", "lounge").build();

      assertThat(ontology.senses("sofa")).hasSize(1);
      assertThat(ontology.senses("sofa").get(0).synonyms()).containsExactly("couch", "lounge");
      assertThat(ontology.senses("couch").get(0).synonyms()).containsExactly("sofa", "lounge");
    }

    @Test
    void hypernymIsRecordedInBothDirections() {
      InMemoryLexicalOntology ontology =
          InMemoryLexicalOntology.builder().hypernym("sofa", "furniture").build();

      assertThat(ontology.relations("sofa"))
          .containsExactly(new TermRelation("furniture", RelationKind.HYPERNYM));
      assertThat(ontology.relations("furniture"))
          .containsExactly(new TermRelation("sofa", RelationKind.HYPONYM));
    }

    @Test
    void partIsRecordedInBothDirections() {
      InMemoryLexicalOntology ontology =
          InMemoryLexicalOntology.builder().part("Sofa", "Armrest").build();

      assertThat(ontology.relations("sofa"))
          .containsExactly(new TermRelation("armrest", RelationKind.MERONYM));
      assertThat(ontology.relations("armrest"))
          .containsExactly(new TermRelation("sofa", RelationKind.HOLONYM));
    }

    @Test
    void explicitSensesKeepTheirOrder() {
      Sense food = new Sense("food", null, null, null, "a solid food");
      Sense slang = new Sense("slang", null, null, null, "a very important person");

      InMemoryLexicalOntology ontology =
          InMemoryLexicalOntology.builder().sense("cheese", food).sense("cheese", slang).build();

      assertThat(ontology.senses("cheese")).extracting(Sense::id).containsExactly("food", "slang");
    }

    @Test
    void lookupIsCaseInsensitive() {
      InMemoryLexicalOntology ontology =
          InMemoryLexicalOntology.builder().synonyms("TV", "Television").build();

      assertThat(ontology.senses(" tv ")).hasSize(1);
      assertThat(ontology.senses("tv").get(0).synonyms()).containsExactly("television");
    }

    @Test
    void unknownTermHasNoSenses() {
      InMemoryLexicalOntology ontology = InMemoryLexicalOntology.builder().build();

      assertThat(ontology.senses("anything")).isEmpty();
      assertThat(ontology.relations("anything")).isEmpty();
      assertThat(ontology.size()).isZero();
    }
  }

  @Nested
  class Json {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void readsLexiconFromClasspath() throws IOException {
      try (InputStream is = getClass().getResourceAsStream("/ontology/test-lexicon.json")) {
        InMemoryLexicalOntology ontology = InMemoryLexicalOntology.fromJson(is, objectMapper);

        assertThat(ontology.size()).isEqualTo(2);
        assertThat(ontology.senses("sofa").get(0).synonyms()).containsExactly("couch", "lounge");
        assertThat(ontology.senses("cheese")).hasSize(2);
      }
    }

    @Test
    void relationListsKeepLexiconOrder() throws IOException {
      try (InputStream is = getClass().getResourceAsStream("/ontology/test-lexicon.json")) {
        Sense sofa = InMemoryLexicalOntology.fromJson(is, objectMapper).senses("sofa").get(0);

        assertThat(sofa.hyponyms())
            .containsExactly(
                "settee", "divan", "chesterfield", "daybed", "loveseat", "convertible");
        assertThat(sofa.meronyms()).containsExactly("armrest", "cushion");
        assertThat(sofa.relatedGlosses())
            .containsExactly("furniture that is designed for sitting on");
      }
    }

    @Test
    void missingFieldsDefaultToEmpty() throws IOException {
      try (InputStream is = getClass().getResourceAsStream("/ontology/test-lexicon.json")) {
        Sense slang = InMemoryLexicalOntology.fromJson(is, objectMapper).senses("cheese").get(1);

        assertThat(slang.hypernyms()).isEmpty();
        assertThat(slang.gloss()).isEmpty();
        assertThat(slang.holonyms()).isEmpty();
        assertThat(slang.relatedGlosses()).isEmpty();
        assertThat(slang.relations())
            .containsExactly(new TermRelation("big cheese", RelationKind.SYNONYM));
      }
    }

    @Test
    void malformedJsonIsOntologyLookupException() {
      InputStream is = new ByteArrayInputStream("{ not json".getBytes(StandardCharsets.UTF_8));

      assertThatThrownBy(() -> InMemoryLexicalOntology.fromJson(is, objectMapper))
          .isInstanceOf(OntologyLookupException.class)
          .hasMessage("Failed to read JSON lexicon");
    }
  }

  @Test
  void relationLookupAdapterWrapsOneSense() {
    LexicalOntology ontology =
        LexicalOntology.fromRelations(
            term ->
                term.equals("soda")
                    ? Set.of(new TermRelation("pop", RelationKind.SYNONYM))
                    : Set.of());

    assertThat(ontology.senses("soda")).hasSize(1);
    assertThat(ontology.relations("soda"))
        .containsExactly(new TermRelation("pop", RelationKind.SYNONYM));
    assertThat(ontology.senses("juice")).isEqualTo(List.of());
  }
}
