package dev.taxomatch.mapping.eval;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import java.util.List;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class MappingMetricsTest {

  private static final double TOLERANCE = 0.001;

  private static final List<String> SOFAS = List.of("Furniture", "Sofas");
  private static final List<String> TABLES = List.of("Furniture", "Tables");
  private static final List<String> CHAIRS = List.of("Garden", "Chairs");

  @Nested
  class RankOf {

    @Test
    void first_position_is_rank_one() {
      assertThat(MappingMetrics.rankOf(List.of(SOFAS, TABLES), SOFAS)).isEqualTo(1);
    }

    @Test
    void later_position_is_one_based() {
      assertThat(MappingMetrics.rankOf(List.of(TABLES, CHAIRS, SOFAS), SOFAS)).isEqualTo(3);
    }

    @Test
    void missing_target_is_rank_zero() {
      assertThat(MappingMetrics.rankOf(List.of(TABLES, CHAIRS), SOFAS)).isZero();
      assertThat(MappingMetrics.rankOf(List.of(), SOFAS)).isZero();
    }

    @Test
    void labels_must_match_the_whole_path() {
      assertThat(MappingMetrics.rankOf(List.of(List.of("Sofas")), SOFAS)).isZero();
    }
  }

  @Nested
  class ReciprocalRank {

    @Test
    void inverse_of_rank() {
      assertThat(MappingMetrics.reciprocalRank(1)).isCloseTo(1.0, within(TOLERANCE));
      assertThat(MappingMetrics.reciprocalRank(4)).isCloseTo(0.25, within(TOLERANCE));
    }

    @Test
    void not_returned_is_zero() {
      assertThat(MappingMetrics.reciprocalRank(0)).isZero();
    }
  }

  @Nested
  class Aggregates {

    private final List<Integer> ranks = List.of(1, 2, 0, 1);

    @Test
    void accuracy_counts_first_ranks() {
      assertThat(MappingMetrics.accuracyAt1(ranks)).isCloseTo(0.5, within(TOLERANCE));
    }

    @Test
    void hit_rate_counts_ranks_within_k() {
      assertThat(MappingMetrics.hitRate(ranks, 2)).isCloseTo(0.75, within(TOLERANCE));
      assertThat(MappingMetrics.hitRate(ranks, 10)).isCloseTo(0.75, within(TOLERANCE));
    }

    @Test
    void mrr_averages_reciprocal_ranks() {
      // (1 + 0.5 + 0 + 1) / 4
      assertThat(MappingMetrics.mrr(ranks)).isCloseTo(0.625, within(TOLERANCE));
    }

    @Test
    void empty_input_gives_zero() {
      assertThat(MappingMetrics.accuracyAt1(List.of())).isZero();
      assertThat(MappingMetrics.hitRate(List.of(), 3)).isZero();
      assertThat(MappingMetrics.mrr(List.of())).isZero();
    }
  }
}
