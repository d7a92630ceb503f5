package dev.taxomatch.mapping.eval;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.taxomatch.keypath.KeyPathRanker;
import dev.taxomatch.keypath.MatchedKeyPath;
import dev.taxomatch.keypath.NodePairing;
import dev.taxomatch.keypath.RankedCandidate;
import dev.taxomatch.mapping.MappingRequest;
import dev.taxomatch.mapping.MappingResult;
import dev.taxomatch.mapping.TaxonomyMappingService;
import dev.taxomatch.match.MatchingConfig;
import dev.taxomatch.match.NodeMatch;
import dev.taxomatch.match.SemanticMatcher;
import dev.taxomatch.ontology.InMemoryLexicalOntology;
import dev.taxomatch.path.InvalidInputException;
import dev.taxomatch.path.KeyPath;
import dev.taxomatch.path.Path;
import dev.taxomatch.term.ExtendedSplitTermSet;
import dev.taxomatch.term.TermSplitter;
import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.io.ClassPathResource;

class MappingEvaluationServiceTest {

  private final ObjectMapper objectMapper = new ObjectMapper();

  private static RankedCandidate ranked(Path candidate, double score) {
    KeyPath keyPath = KeyPath.full(List.of(candidate.leaf().orElseThrow()));
    MatchedKeyPath matched =
        new MatchedKeyPath(
            keyPath,
            candidate,
            List.of(
                new NodePairing(
                    candidate.leaf().orElseThrow(),
                    candidate.leaf().orElseThrow(),
                    NodeMatch.exact())));
    return new RankedCandidate(candidate, matched, score);
  }

  @Nested
  @SuppressWarnings("NullAway.Init")
  @ExtendWith(MockitoExtension.class)
  class WithMockedMapping {

    @Mock TaxonomyMappingService mappingService;

    @Captor ArgumentCaptor<MappingRequest> requestCaptor;

    MappingEvaluationService evaluationService;

    private final GoldenMapping sofas =
        new GoldenMapping(
            "sofas",
            List.of("Furniture", "Sofas"),
            List.of(List.of("Furniture", "Tables"), List.of("Furniture", "Couches")),
            List.of("Furniture", "Couches"));

    @BeforeEach
    void setUp() {
      evaluationService = new MappingEvaluationService(mappingService, objectMapper, 0.7, 0.75, 3);
    }

    @Test
    void targetAtSecondRankFailsTheThresholds() {
      given(mappingService.map(any(MappingRequest.class)))
          .willReturn(
              new MappingResult(
                  KeyPath.empty(),
                  List.of(
                      ranked(Path.of("Furniture", "Tables"), 0.9),
                      ranked(Path.of("Furniture", "Couches"), 0.8)),
                  List.of(),
                  0));

      EvaluationSummary summary = evaluationService.evaluate(List.of(sofas));

      assertThat(summary.count()).isEqualTo(1);
      assertThat(summary.accuracyAt1()).isZero();
      assertThat(summary.mrr()).isCloseTo(0.5, within(1e-9));
      assertThat(summary.hitRateAtK()).isCloseTo(1.0, within(1e-9));
      assertThat(summary.k()).isEqualTo(3);
      assertThat(summary.passed()).isFalse();
      assertThat(summary.failedMappings()).containsExactly("sofas");
    }

    @Test
    void targetAtFirstRankPasses() {
      given(mappingService.map(any(MappingRequest.class)))
          .willReturn(
              new MappingResult(
                  KeyPath.empty(),
                  List.of(ranked(Path.of("Furniture", "Couches"), 0.8)),
                  List.of(),
                  0));

      EvaluationSummary summary = evaluationService.evaluate(List.of(sofas));

      assertThat(summary.accuracyAt1()).isCloseTo(1.0, within(1e-9));
      assertThat(summary.passed()).isTrue();
      assertThat(summary.failedMappings()).isEmpty();
    }

    @Test
    void everyCandidateIsRequested() {
      given(mappingService.map(any(MappingRequest.class)))
          .willReturn(new MappingResult(KeyPath.empty(), List.of(), List.of(), 0));

      evaluationService.evaluate(List.of(sofas));

      verify(mappingService).map(requestCaptor.capture());
      MappingRequest request = requestCaptor.getValue();
      assertThat(request.source().labels()).containsExactly("Furniture", "Sofas");
      assertThat(request.candidates()).hasSize(2);
      assertThat(request.maxResults()).isEqualTo(2);
    }

    @Test
    void invalidSourceCountsAsMiss() {
      given(mappingService.map(any(MappingRequest.class)))
          .willThrow(new InvalidInputException("Source path must not be empty"));

      EvaluationSummary summary = evaluationService.evaluate(List.of(sofas));

      assertThat(summary.mrr()).isZero();
      assertThat(summary.failedMappings()).containsExactly("sofas");
    }
  }

  @Nested
  class BundledGoldenSet {

    @Test
    void goldenSetIsReadable() throws IOException {
      MappingEvaluationService evaluationService =
          new MappingEvaluationService(
              mock(TaxonomyMappingService.class), objectMapper, 0.7, 0.75, 3);

      List<GoldenMapping> goldenSet =
          evaluationService.loadGoldenSet(new ClassPathResource("eval/golden-mappings.json"));

      assertThat(goldenSet).hasSize(5);
      assertThat(goldenSet.get(0).id()).isEqualTo("cottage-cheese");
      assertThat(goldenSet)
          .allSatisfy(mapping -> assertThat(mapping.candidates()).contains(mapping.expected()));
    }

    @Test
    void bundledLexiconRanksEveryExpectedTargetFirst() throws IOException {
      InMemoryLexicalOntology lexicon;
      try (InputStream is = new ClassPathResource("ontology/lexicon.json").getInputStream()) {
        lexicon = InMemoryLexicalOntology.fromJson(is, objectMapper);
      }
      MatchingConfig config = MatchingConfig.defaults();
      TermSplitter splitter = new TermSplitter(config.useStemming());
      TaxonomyMappingService mappingService =
          new TaxonomyMappingService(
              new ExtendedSplitTermSet(splitter),
              new SemanticMatcher(lexicon, splitter, config),
              new KeyPathRanker(config),
              Runnable::run);

      EvaluationSummary summary =
          new MappingEvaluationService(mappingService, objectMapper, 0.7, 0.75, 3).evaluate();

      assertThat(summary.count()).isEqualTo(5);
      assertThat(summary.failedMappings()).isEmpty();
      assertThat(summary.passed()).isTrue();
    }
  }
}
