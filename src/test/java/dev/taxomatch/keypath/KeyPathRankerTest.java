package dev.taxomatch.keypath;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import dev.taxomatch.fixture.MatcherBuilder;
import dev.taxomatch.match.MatchKind;
import dev.taxomatch.match.MatchingConfig;
import dev.taxomatch.match.NodeMatch;
import dev.taxomatch.match.TermMatchPolicy;
import dev.taxomatch.path.KeyPath;
import dev.taxomatch.path.Node;
import dev.taxomatch.path.Path;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class KeyPathRankerTest {

  private static final double TOLERANCE = 1e-9;

  private final KeyPathRanker ranker = new KeyPathRanker(MatchingConfig.defaults());

  private final Path source = Path.of("Furniture", "Living Room", "Sofas");
  private final KeyPath keyPath = KeyPath.full(source.nodes());

  /** Aligns the full source path with itself, using the given matches root first. */
  private MatchedKeyPath matched(NodeMatch... rootFirst) {
    List<NodePairing> pairings = new ArrayList<>();
    for (int i = 0; i < rootFirst.length; i++) {
      Node node = source.get(i);
      pairings.add(new NodePairing(node, rootFirst[i].isMatch() ? node : null, rootFirst[i]));
    }
    return new MatchedKeyPath(keyPath, source, pairings);
  }

  private static NodeMatch of(MatchKind kind, double coverage) {
    return new NodeMatch(kind, coverage, List.of());
  }

  @Test
  void identicalPathScoresOne() {
    MatchedKeyPath self = matched(NodeMatch.exact(), NodeMatch.exact(), NodeMatch.exact());

    assertThat(ranker.rank(self)).isCloseTo(1.0, within(TOLERANCE));
  }

  @Test
  void unmatchedLeafScoresZero() {
    MatchedKeyPath leafMiss = matched(NodeMatch.exact(), NodeMatch.exact(), NodeMatch.noMatch());

    assertThat(ranker.rank(leafMiss)).isZero();
  }

  @Test
  void emptyKeyPathScoresZero() {
    MatchedKeyPath empty = new MatchedKeyPath(KeyPath.empty(), source, List.of());

    assertThat(ranker.rank(empty)).isZero();
  }

  @Test
  void weighsOnlyThePositionsOfTheAlignedKeyPath() {
    KeyPath leafOnly = new KeyPath(List.of(source.get(2)));
    MatchedKeyPath aligned =
        new MatchedKeyPath(
            leafOnly,
            source,
            List.of(new NodePairing(source.get(2), source.get(2), of(MatchKind.SYNONYM, 1.0))));

    assertThat(ranker.rank(aligned)).isCloseTo(0.9, within(TOLERANCE));
  }

  @Test
  void ancestorsWeighLessThanTheLeaf() {
    // weights 1, 0.5, 0.25 from the leaf upward
    MatchedKeyPath rootMiss = matched(NodeMatch.noMatch(), NodeMatch.exact(), NodeMatch.exact());
    MatchedKeyPath parentMiss = matched(NodeMatch.exact(), NodeMatch.noMatch(), NodeMatch.exact());

    assertThat(ranker.rank(rootMiss)).isCloseTo(1.5 / 1.75, within(TOLERANCE));
    assertThat(ranker.rank(parentMiss)).isCloseTo(1.25 / 1.75, within(TOLERANCE));
  }

  @Test
  void matchKindAndCoverageScaleTheContribution() {
    MatchedKeyPath synonymLeaf =
        matched(NodeMatch.exact(), NodeMatch.exact(), of(MatchKind.SYNONYM, 1.0));
    MatchedKeyPath halfLeaf =
        matched(NodeMatch.exact(), NodeMatch.exact(), of(MatchKind.EXACT, 0.5));

    assertThat(ranker.rank(synonymLeaf)).isCloseTo(1.65 / 1.75, within(TOLERANCE));
    assertThat(ranker.rank(halfLeaf)).isCloseTo(1.25 / 1.75, within(TOLERANCE));
  }

  @Test
  void neutralPositionsAreIgnored() {
    MatchedKeyPath neutralParent =
        matched(NodeMatch.exact(), NodeMatch.insufficientInformation(), NodeMatch.exact());

    assertThat(ranker.rank(neutralParent)).isCloseTo(1.0, within(TOLERANCE));
  }

  @Test
  void depthDecayIsConfigurable() {
    KeyPathRanker flat = new KeyPathRanker(MatchingConfig.defaults().withDepthDecay(1.0));
    MatchedKeyPath rootMiss = matched(NodeMatch.noMatch(), NodeMatch.exact(), NodeMatch.exact());

    assertThat(flat.rank(rootMiss)).isCloseTo(2.0 / 3.0, within(TOLERANCE));
  }

  @Test
  void scoreIsNotSymmetric() {
    MatcherBuilder builder = new MatcherBuilder().policy(TermMatchPolicy.ANY);
    Path cottageCheese = Path.of("Cottage Cheese");
    Path cheese = Path.of("Cheese");

    double forward = rankSingle(builder, cottageCheese, cheese);
    double backward = rankSingle(builder, cheese, cottageCheese);

    assertThat(forward).isCloseTo(0.5, within(TOLERANCE));
    assertThat(backward).isCloseTo(1.0, within(TOLERANCE));
  }

  private double rankSingle(MatcherBuilder builder, Path from, Path to) {
    KeyPathGenerator generator =
        new KeyPathGenerator(from, List.of(to), builder.splitTermSet(), builder.build());
    MatchedKeyPath matched = generator.matchedCandidateKeyPaths().keyPaths().get(0);
    return ranker.rank(matched);
  }

  @Test
  void comparatorOrdersByScoreThenKeyPathLengthThenInput() {
    Path shortPath = Path.of("Sofas");
    MatchedKeyPath full = matched(NodeMatch.exact(), NodeMatch.exact(), NodeMatch.exact());
    MatchedKeyPath partial =
        new MatchedKeyPath(
            keyPath,
            shortPath,
            List.of(
                new NodePairing(source.get(0), null, NodeMatch.noMatch()),
                new NodePairing(source.get(1), null, NodeMatch.noMatch()),
                new NodePairing(source.get(2), shortPath.get(0), NodeMatch.exact())));

    RankedCandidate low = new RankedCandidate(shortPath, partial, 0.4);
    RankedCandidate tiedFar = new RankedCandidate(shortPath, partial, 0.8);
    RankedCandidate tiedNear = new RankedCandidate(source, full, 0.8);
    RankedCandidate tiedNearLater = new RankedCandidate(Path.of("Sofa"), full, 0.8);

    List<RankedCandidate> ranked = new ArrayList<>(List.of(low, tiedFar, tiedNear, tiedNearLater));
    ranked.sort(ranker.comparator());

    assertThat(ranked).containsExactly(tiedNear, tiedNearLater, tiedFar, low);
  }
}
