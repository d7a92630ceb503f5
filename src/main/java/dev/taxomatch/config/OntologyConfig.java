package dev.taxomatch.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.taxomatch.match.MatchingConfig;
import dev.taxomatch.ontology.CachingLexicalOntology;
import dev.taxomatch.ontology.InMemoryLexicalOntology;
import dev.taxomatch.ontology.LexicalOntology;
import dev.taxomatch.ontology.OntologyLookupException;
import dev.taxomatch.ontology.WordNetPrologOntology;
import dev.taxomatch.term.TermSplitter;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

/**
 * Provides the lexical ontology and the term splitter shared by every matching component.
 *
 * <p>The ontology comes from the WordNet Prolog files when {@code
 * taxomatch.ontology.wordnet-location} is set, and from the JSON lexicon otherwise. A source that
 * cannot be read fails startup.
 */
@Configuration
public class OntologyConfig {

  private static final Logger log = LoggerFactory.getLogger(OntologyConfig.class);

  static final String SYNSETS_FILE = "wn_s.pl";
  static final String HYPERNYMS_FILE = "wn_hyp.pl";
  static final String GLOSSES_FILE = "wn_g.pl";
  static final String PART_MERONYMS_FILE = "wn_mp.pl";

  @Bean
  public TermSplitter termSplitter(MatchingConfig matchingConfig) {
    return new TermSplitter(matchingConfig.useStemming());
  }

  @Bean
  public LexicalOntology lexicalOntology(
      OntologyProperties properties, ResourceLoader resourceLoader, ObjectMapper objectMapper) {
    LexicalOntology ontology =
        properties.wordnetLocation() != null
            ? loadWordNet(resourceLoader.getResource(properties.wordnetLocation()))
            : loadLexicon(resourceLoader.getResource(properties.lexicon()), objectMapper);
    return properties.cache() ? new CachingLexicalOntology(ontology) : ontology;
  }

  static InMemoryLexicalOntology loadLexicon(Resource resource, ObjectMapper objectMapper) {
    try (InputStream is = resource.getInputStream()) {
      InMemoryLexicalOntology ontology = InMemoryLexicalOntology.fromJson(is, objectMapper);
      log.info("Loaded lexicon {} with {} terms", resource.getDescription(), ontology.size());
      return ontology;
    } catch (IOException e) {
      throw new OntologyLookupException("Cannot read lexicon " + resource.getDescription(), e);
    }
  }

  static WordNetPrologOntology loadWordNet(Resource directory) {
    try (Reader synsets = open(directory.createRelative(SYNSETS_FILE), true);
        Reader hypernyms = open(directory.createRelative(HYPERNYMS_FILE), false);
        Reader glosses = open(directory.createRelative(GLOSSES_FILE), false);
        Reader parts = open(directory.createRelative(PART_MERONYMS_FILE), false)) {
      return WordNetPrologOntology.load(synsets, hypernyms, glosses, parts);
    } catch (IOException e) {
      throw new OntologyLookupException(
          "Cannot read WordNet files under " + directory.getDescription(), e);
    }
  }

  private static @Nullable Reader open(Resource resource, boolean required) throws IOException {
    if (!resource.exists()) {
      if (required) {
        throw new IOException("Missing " + resource.getDescription());
      }
      log.warn(
          "Optional WordNet file {} not found, continuing without it", resource.getDescription());
      return null;
    }
    return new InputStreamReader(resource.getInputStream(), StandardCharsets.UTF_8);
  }
}
