package dev.taxomatch.mapping;

import dev.taxomatch.keypath.CandidateMatches;
import dev.taxomatch.keypath.KeyPathGenerator;
import dev.taxomatch.keypath.KeyPathRanker;
import dev.taxomatch.keypath.MatchedKeyPath;
import dev.taxomatch.keypath.RankedCandidate;
import dev.taxomatch.match.SemanticMatcher;
import dev.taxomatch.path.KeyPath;
import dev.taxomatch.path.Path;
import dev.taxomatch.term.ExtendedSplitTermSet;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Mapping orchestration: derive the source key path for the candidate set, align it with every
 * candidate, score the alignments and return the best candidates.
 *
 * <p>Pipeline: build a {@link KeyPathGenerator} for the request -> compute the source key path ->
 * align it with each well-formed candidate (in parallel on the matching executor) -> score each
 * alignment with {@link KeyPathRanker} -> sort best first -> apply {@code minScore} and {@code
 * maxResults}.
 */
@Service
public class TaxonomyMappingService {

  private static final Logger log = LoggerFactory.getLogger(TaxonomyMappingService.class);

  private final ExtendedSplitTermSet splitTermSet;
  private final SemanticMatcher matcher;
  private final KeyPathRanker ranker;
  private final Executor executor;

  public TaxonomyMappingService(
      ExtendedSplitTermSet splitTermSet,
      SemanticMatcher matcher,
      KeyPathRanker ranker,
      @Qualifier("matchingExecutor") Executor executor) {
    this.splitTermSet = splitTermSet;
    this.matcher = matcher;
    this.ranker = ranker;
    this.executor = executor;
  }

  /** Maps with default result limits. */
  public MappingResult map(Path source, List<Path> candidates) {
    return map(new MappingRequest(source, candidates));
  }

  /**
   * Maps a source path onto the request's candidates.
   *
   * @param request source, candidates and result limits
   * @return ranked candidates with the source key path
   * @throws dev.taxomatch.path.InvalidInputException if the source path is empty or its leaf has no
   *     usable terms
   */
  public MappingResult map(MappingRequest request) {
    KeyPathGenerator generator =
        new KeyPathGenerator(
            request.source(), request.candidates(), splitTermSet, matcher, executor);
    KeyPath sourceKeyPath = generator.sourceKeyPath();
    CandidateMatches matches = generator.matchedCandidateKeyPaths();

    List<RankedCandidate> ranked = new ArrayList<>(matches.keyPaths().size());
    for (int i = 0; i < matches.keyPaths().size(); i++) {
      MatchedKeyPath matched = matches.keyPaths().get(i);
      ranked.add(new RankedCandidate(matches.candidates().get(i), matched, ranker.rank(matched)));
    }
    ranked.sort(ranker.comparator());

    List<RankedCandidate> selected = new ArrayList<>(Math.min(ranked.size(), request.maxResults()));
    for (RankedCandidate candidate : ranked) {
      if (selected.size() == request.maxResults()) {
        break;
      }
      if (request.minScore() != null && candidate.score() < request.minScore()) {
        continue;
      }
      selected.add(candidate);
    }

    log.info(
        "Mapped '{}' (key path {}): {} ranked, {} returned, {} unmatched, {} skipped",
        request.source(),
        sourceKeyPath,
        ranked.size(),
        selected.size(),
        matches.unmatched().size(),
        matches.skipped());

    return new MappingResult(sourceKeyPath, selected, matches.unmatched(), matches.skipped());
  }
}
