package dev.taxomatch.match;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import org.junit.jupiter.api.Test;

class DamerauLevenshteinTest {

  @Test
  void identicalStringsHaveDistanceZero() {
    assertThat(DamerauLevenshtein.distance("cheese", "cheese")).isZero();
    assertThat(DamerauLevenshtein.similarity("cheese", "cheese")).isEqualTo(1.0);
  }

  @Test
  void adjacentTranspositionCostsOneEdit() {
    assertThat(DamerauLevenshtein.distance("cheese", "cheees")).isEqualTo(1);
    assertThat(DamerauLevenshtein.distance("ab", "ba")).isEqualTo(1);
  }

  @Test
  void insertionDeletionAndSubstitution() {
    assertThat(DamerauLevenshtein.distance("sofa", "sofas")).isEqualTo(1);
    assertThat(DamerauLevenshtein.distance("sofas", "sofa")).isEqualTo(1);
    assertThat(DamerauLevenshtein.distance("milk", "silk")).isEqualTo(1);
    assertThat(DamerauLevenshtein.distance("kitten", "sitting")).isEqualTo(3);
  }

  @Test
  void emptyStrings() {
    assertThat(DamerauLevenshtein.distance("", "milk")).isEqualTo(4);
    assertThat(DamerauLevenshtein.similarity("", "")).isEqualTo(1.0);
    assertThat(DamerauLevenshtein.similarity("", "milk")).isEqualTo(0.0);
  }

  @Test
  void similarityIsNormalizedByLongerString() {
    assertThat(DamerauLevenshtein.similarity("cheese", "cheees"))
        .isCloseTo(5.0 / 6.0, within(1e-9));
    assertThat(DamerauLevenshtein.similarity("milk", "silk")).isCloseTo(0.75, within(1e-9));
  }
}
