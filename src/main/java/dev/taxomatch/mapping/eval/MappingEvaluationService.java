package dev.taxomatch.mapping.eval;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.taxomatch.keypath.RankedCandidate;
import dev.taxomatch.mapping.MappingRequest;
import dev.taxomatch.mapping.MappingResult;
import dev.taxomatch.mapping.TaxonomyMappingService;
import dev.taxomatch.path.InvalidInputException;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Service;

/**
 * Runs a golden set of curated mappings through {@link TaxonomyMappingService} and reports how
 * often the expected target comes out on top.
 */
@Service
public class MappingEvaluationService {

  private static final Logger log = LoggerFactory.getLogger(MappingEvaluationService.class);

  private static final String GOLDEN_SET_PATH = "eval/golden-mappings.json";

  private final TaxonomyMappingService mappingService;
  private final ObjectMapper objectMapper;
  private final double accuracyThreshold;
  private final double mrrThreshold;
  private final int hitRateDepth;

  public MappingEvaluationService(
      TaxonomyMappingService mappingService,
      ObjectMapper objectMapper,
      @Value("${taxomatch.eval.thresholds.accuracy-at-1:0.70}") double accuracyThreshold,
      @Value("${taxomatch.eval.thresholds.mrr:0.75}") double mrrThreshold,
      @Value("${taxomatch.eval.hit-rate-depth:3}") int hitRateDepth) {
    this.mappingService = mappingService;
    this.objectMapper = objectMapper;
    this.accuracyThreshold = accuracyThreshold;
    this.mrrThreshold = mrrThreshold;
    this.hitRateDepth = hitRateDepth;
  }

  /**
   * Evaluates the bundled golden set.
   *
   * @throws IOException if the golden set cannot be read
   */
  public EvaluationSummary evaluate() throws IOException {
    return evaluate(loadGoldenSet(new ClassPathResource(GOLDEN_SET_PATH)));
  }

  /** Evaluates the given golden mappings. */
  public EvaluationSummary evaluate(List<GoldenMapping> goldenSet) {
    log.info("Evaluating {} golden mappings", goldenSet.size());
    List<EvaluationResult> results = new ArrayList<>(goldenSet.size());
    for (GoldenMapping mapping : goldenSet) {
      results.add(evaluateMapping(mapping));
    }
    return buildSummary(results);
  }

  /**
   * Reads a golden set from a JSON array of {@link GoldenMapping}s.
   *
   * @throws IOException if the resource cannot be read or parsed
   */
  public List<GoldenMapping> loadGoldenSet(Resource resource) throws IOException {
    try (InputStream is = resource.getInputStream()) {
      return objectMapper.readValue(is, new TypeReference<List<GoldenMapping>>() {});
    }
  }

  private EvaluationResult evaluateMapping(GoldenMapping mapping) {
    MappingResult result;
    try {
      result =
          mappingService.map(
              new MappingRequest(
                  mapping.sourcePath(),
                  mapping.candidatePaths(),
                  Math.max(1, mapping.candidates().size())));
    } catch (InvalidInputException e) {
      log.warn("Golden mapping '{}' has an invalid source: {}", mapping.id(), e.getMessage());
      return new EvaluationResult(mapping.id(), 0, 0.0, List.of());
    }

    List<List<String>> returned = new ArrayList<>(result.ranked().size());
    for (RankedCandidate candidate : result.ranked()) {
      returned.add(candidate.candidate().labels());
    }
    int rank = MappingMetrics.rankOf(returned, mapping.expected());
    double topScore = result.best().map(RankedCandidate::score).orElse(0.0);
    log.debug("Golden mapping '{}': expected target at rank {}", mapping.id(), rank);
    return new EvaluationResult(mapping.id(), rank, topScore, returned);
  }

  private EvaluationSummary buildSummary(List<EvaluationResult> results) {
    List<Integer> ranks = results.stream().map(EvaluationResult::rank).toList();
    double accuracy = MappingMetrics.accuracyAt1(ranks);
    double mrr = MappingMetrics.mrr(ranks);
    double hitRate = MappingMetrics.hitRate(ranks, hitRateDepth);

    List<String> failed = new ArrayList<>();
    for (EvaluationResult result : results) {
      if (!result.correct()) {
        failed.add(result.id());
      }
    }

    boolean passed = accuracy >= accuracyThreshold && mrr >= mrrThreshold;

    log.info(
        "Evaluation complete: accuracy@1={}, mrr={}, hitRate@{}={}, passed={}",
        accuracy,
        mrr,
        hitRateDepth,
        hitRate,
        passed);

    return new EvaluationSummary(
        results.size(), accuracy, mrr, hitRate, hitRateDepth, passed, failed);
  }
}
