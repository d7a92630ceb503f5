package dev.taxomatch.keypath;

import dev.taxomatch.match.NodeMatch;
import dev.taxomatch.match.SemanticMatcher;
import dev.taxomatch.path.InvalidInputException;
import dev.taxomatch.path.KeyPath;
import dev.taxomatch.path.Node;
import dev.taxomatch.path.Path;
import dev.taxomatch.term.ExtendedSplitTermSet;
import dev.taxomatch.term.ExtendedTermSet;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reduces a source path to the nodes that discriminate between the candidates, and aligns that key
 * path with each candidate.
 *
 * <p>The source leaf is always part of the key path. The candidates whose leaf matches the source
 * leaf are the survivors. Source ancestors are then visited from the leaf towards the root, and an
 * ancestor is kept when it rules out at least one remaining survivor, meaning it neither matches
 * nor neutrally meets any ancestor of that candidate. Ruled-out candidates leave the survivor set.
 * Ancestors without terms never discriminate and are never kept.
 * Because a node is only kept when it removes a candidate, a smaller candidate set never yields a
 * longer key path, and the candidates consistent with the key path are exactly those consistent
 * with the full source path.
 *
 * <p>One generator serves one source and one candidate set. Node matching per candidate runs on
 * the supplied executor; results are computed once, on first access, and keep input order.
 */
public final class KeyPathGenerator {

  private static final Logger log = LoggerFactory.getLogger(KeyPathGenerator.class);

  private final List<Node> sourceNodes;
  private final List<ExtendedTermSet> sourceTerms;
  private final List<Candidate> candidates;
  private final int skipped;
  private final SemanticMatcher matcher;
  private final Executor executor;

  private @Nullable List<Evaluation> evaluations;
  private @Nullable KeyPath sourceKeyPath;
  private @Nullable CandidateMatches candidateMatches;

  /** Generator that matches candidates on the calling thread. */
  public KeyPathGenerator(
      Path source,
      Collection<Path> candidates,
      ExtendedSplitTermSet splitTermSet,
      SemanticMatcher matcher) {
    this(source, candidates, splitTermSet, matcher, Runnable::run);
  }

  /**
   * @param source the path to map
   * @param candidates target-taxonomy paths; malformed entries are skipped
   * @param splitTermSet term extraction shared with the matcher
   * @param matcher node matcher
   * @param executor runs the per-candidate node matching
   * @throws InvalidInputException if the source path is empty or its leaf yields no terms
   */
  public KeyPathGenerator(
      Path source,
      Collection<Path> candidates,
      ExtendedSplitTermSet splitTermSet,
      SemanticMatcher matcher,
      Executor executor) {
    if (source == null || source.isEmpty()) {
      throw new InvalidInputException("Source path must not be empty");
    }
    this.sourceNodes = source.nodes();
    this.sourceTerms = splitTermSet.forPath(sourceNodes);
    if (sourceTerms.get(sourceTerms.size() - 1).isDegenerate()) {
      throw new InvalidInputException(
          "Source leaf '" + source.leaf().orElseThrow().label() + "' has no usable terms");
    }
    this.matcher = matcher;
    this.executor = executor;

    List<Candidate> wellFormed = new ArrayList<>(candidates.size());
    int skippedCount = 0;
    for (Path candidate : candidates) {
      if (candidate == null || candidate.isEmpty()) {
        log.debug("Skipping empty candidate path");
        skippedCount++;
        continue;
      }
      List<Node> nodes = candidate.nodes();
      List<ExtendedTermSet> terms = splitTermSet.forPath(nodes);
      if (terms.get(terms.size() - 1).isDegenerate()) {
        log.debug("Skipping candidate '{}': leaf has no usable terms", candidate);
        skippedCount++;
        continue;
      }
      wellFormed.add(new Candidate(candidate, nodes, terms));
    }
    this.candidates = wellFormed;
    this.skipped = skippedCount;
  }

  /**
   * The minimal root-first subsequence of the source path that still tells the candidates apart.
   * Never empty; always ends with the source leaf.
   */
  public synchronized KeyPath sourceKeyPath() {
    if (sourceKeyPath == null) {
      sourceKeyPath = computeSourceKeyPath(evaluations());
    }
    return sourceKeyPath;
  }

  /** Aligns the source key path with every well-formed candidate. */
  public synchronized CandidateMatches matchedCandidateKeyPaths() {
    if (candidateMatches == null) {
      candidateMatches = computeCandidateMatches(sourceKeyPath(), evaluations());
    }
    return candidateMatches;
  }

  /** Number of candidates ignored as malformed. */
  public int skipped() {
    return skipped;
  }

  private KeyPath computeSourceKeyPath(List<Evaluation> all) {
    int leafDepth = sourceNodes.size() - 1;
    List<Evaluation> survivors = new ArrayList<>();
    for (Evaluation evaluation : all) {
      if (evaluation.leafMatched()) {
        survivors.add(evaluation);
      }
    }

    List<Integer> depths = new ArrayList<>();
    depths.add(leafDepth);
    for (int depth = leafDepth - 1; depth >= 0 && !survivors.isEmpty(); depth--) {
      if (sourceTerms.get(depth).isDegenerate()) {
        continue;
      }
      int sourceDepth = depth;
      if (survivors.removeIf(evaluation -> !evaluation.explains(sourceDepth))) {
        depths.add(depth);
      }
    }
    Collections.reverse(depths);

    KeyPath keyPath = KeyPath.of(sourceNodes, depths);
    log.debug("Key path {} for source of {} nodes", keyPath, sourceNodes.size());
    return keyPath;
  }

  private CandidateMatches computeCandidateMatches(KeyPath keyPath, List<Evaluation> all) {
    List<MatchedKeyPath> keyPaths = new ArrayList<>();
    List<Path> matchedCandidates = new ArrayList<>();
    List<Path> unmatched = new ArrayList<>();
    for (Evaluation evaluation : all) {
      if (!evaluation.leafMatched()) {
        unmatched.add(evaluation.candidate().path());
        continue;
      }
      keyPaths.add(align(keyPath, evaluation));
      matchedCandidates.add(evaluation.candidate().path());
    }
    return new CandidateMatches(keyPaths, matchedCandidates, unmatched, skipped);
  }

  /**
   * Pairs each source key node, leaf upward, with the strongest matching candidate ancestor not yet
   * used, the nearest one on equal strength. Pairings never cross: a later source node only looks
   * above the last paired one.
   */
  private MatchedKeyPath align(KeyPath keyPath, Evaluation evaluation) {
    Candidate candidate = evaluation.candidate();
    int candidateLeaf = candidate.nodes().size() - 1;
    List<Node> leafFirst = keyPath.leafFirst();

    List<NodePairing> pairings = new ArrayList<>(leafFirst.size());
    pairings.add(
        new NodePairing(
            leafFirst.get(0), candidate.nodes().get(candidateLeaf), evaluation.leafMatch()));

    int cursor = candidateLeaf - 1;
    for (Node sourceNode : leafFirst.subList(1, leafFirst.size())) {
      int sourceDepth = sourceNode.depth();
      boolean neutral = sourceTerms.get(sourceDepth).isDegenerate();
      NodePairing pairing = null;
      int pairedDepth = -1;
      for (int j = cursor; j >= 0; j--) {
        NodeMatch match = evaluation.match(sourceDepth, j);
        if (match.isMatch()) {
          if (pairing == null || match.strength() > pairing.match().strength()) {
            pairing = new NodePairing(sourceNode, candidate.nodes().get(j), match);
            pairedDepth = j;
          }
        } else if (match.isNeutral()) {
          neutral = true;
        }
      }
      if (pairing != null) {
        cursor = pairedDepth - 1;
      } else {
        NodeMatch unpaired =
            neutral ? NodeMatch.insufficientInformation() : NodeMatch.noMatch();
        pairing = new NodePairing(sourceNode, null, unpaired);
      }
      pairings.add(pairing);
    }

    Collections.reverse(pairings);
    return new MatchedKeyPath(keyPath, candidate.path(), pairings);
  }

  private synchronized List<Evaluation> evaluations() {
    if (evaluations == null) {
      List<CompletableFuture<Evaluation>> futures = new ArrayList<>(candidates.size());
      for (Candidate candidate : candidates) {
        futures.add(CompletableFuture.supplyAsync(() -> evaluate(candidate), executor));
      }
      List<Evaluation> results = new ArrayList<>(futures.size());
      for (CompletableFuture<Evaluation> future : futures) {
        results.add(join(future));
      }
      evaluations = List.copyOf(results);
      log.debug(
          "Evaluated {} candidates ({} skipped) against '{}'",
          results.size(),
          skipped,
          sourceNodes.get(sourceNodes.size() - 1).label());
    }
    return evaluations;
  }

  /**
   * Matches the leaves, and for a matching leaf every source ancestor against every candidate
   * ancestor.
   */
  private Evaluation evaluate(Candidate candidate) {
    int sourceLeaf = sourceNodes.size() - 1;
    int candidateLeaf = candidate.nodes().size() - 1;
    NodeMatch leafMatch =
        matcher.match(sourceTerms.get(sourceLeaf), candidate.terms().get(candidateLeaf));
    if (!leafMatch.isMatch()) {
      return new Evaluation(candidate, leafMatch, new NodeMatch[0][0]);
    }

    NodeMatch[][] ancestors = new NodeMatch[sourceLeaf][candidateLeaf];
    for (int i = 0; i < sourceLeaf; i++) {
      for (int j = 0; j < candidateLeaf; j++) {
        ancestors[i][j] = matcher.match(sourceTerms.get(i), candidate.terms().get(j));
      }
    }
    return new Evaluation(candidate, leafMatch, ancestors);
  }

  private static <T> T join(CompletableFuture<T> future) {
    try {
      return future.join();
    } catch (CompletionException e) {
      if (e.getCause() instanceof RuntimeException cause) {
        throw cause;
      }
      throw e;
    }
  }

  private record Candidate(Path path, List<Node> nodes, List<ExtendedTermSet> terms) {}

  /**
   * Node matches of one candidate.
   *
   * @param ancestors {@code ancestors[i][j]} matches source depth {@code i} against candidate
   *     depth {@code j}, both proper ancestors of their leaves; empty when the leaf did not match
   */
  private record Evaluation(Candidate candidate, NodeMatch leafMatch, NodeMatch[][] ancestors) {

    boolean leafMatched() {
      return leafMatch.isMatch();
    }

    NodeMatch match(int sourceDepth, int candidateDepth) {
      return ancestors[sourceDepth][candidateDepth];
    }

    /** True when some candidate ancestor matches, or neutrally meets, the source node. */
    boolean explains(int sourceDepth) {
      for (NodeMatch match : ancestors[sourceDepth]) {
        if (match.isMatch() || match.isNeutral()) {
          return true;
        }
      }
      return false;
    }
  }
}
