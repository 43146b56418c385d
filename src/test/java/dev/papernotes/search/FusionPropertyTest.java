package dev.papernotes.search;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import dev.papernotes.note.EmbeddingField;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import net.jqwik.api.Arbitraries;
import net.jqwik.api.Arbitrary;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.Provide;

/**
 * Property-based tests for {@link ScoreFusion} invariants using jqwik.
 *
 * <p>Evidence maps are generated over random subsets of the fusable fields with distances in the
 * cosine range [0, 2].
 */
class FusionPropertyTest {

  @Provide
  Arbitrary<Map<EmbeddingField, Double>> evidence() {
    Arbitrary<Double> distance = Arbitraries.doubles().between(0.0, 2.0);
    return Arbitraries.subsetOf(EmbeddingField.FUSABLE)
        .flatMap(
            fields -> {
              List<EmbeddingField> ordered = new ArrayList<>(fields);
              return distance
                  .list()
                  .ofSize(ordered.size())
                  .map(
                      values -> {
                        Map<EmbeddingField, Double> map = new EnumMap<>(EmbeddingField.class);
                        for (int i = 0; i < ordered.size(); i++) {
                          map.put(ordered.get(i), values.get(i));
                        }
                        return map;
                      });
            });
  }

  @Provide
  Arbitrary<Map<Long, Map<EmbeddingField, Double>>> candidates() {
    return Arbitraries.longs()
        .between(1, 500)
        .flatMap(id -> evidence().map(e -> Map.entry(id, e)))
        .list()
        .ofMaxSize(30)
        .map(
            entries -> {
              Map<Long, Map<EmbeddingField, Double>> byId = new HashMap<>();
              entries.forEach(e -> byId.put(e.getKey(), e.getValue()));
              return byId;
            });
  }

  @Property
  void fusedScoreLiesBetweenSmallestAndLargestDistance(
      @ForAll("evidence") Map<EmbeddingField, Double> evidence) {
    FusedScore fused = ScoreFusion.fuse(evidence);

    if (evidence.isEmpty()) {
      assertThat(fused.score()).isEqualTo(FusionWeights.NO_EVIDENCE_SCORE);
      return;
    }
    double min = evidence.values().stream().mapToDouble(Double::doubleValue).min().orElseThrow();
    double max = evidence.values().stream().mapToDouble(Double::doubleValue).max().orElseThrow();
    assertThat(fused.score()).isBetween(min - 1e-9, max + 1e-9);
  }

  @Property
  void breakdownKeepsEveryFusableField(@ForAll("evidence") Map<EmbeddingField, Double> evidence) {
    FusedScore fused = ScoreFusion.fuse(evidence);

    assertThat(fused.breakdown().keySet()).containsExactlyInAnyOrderElementsOf(EmbeddingField.FUSABLE);
    for (EmbeddingField field : EmbeddingField.FUSABLE) {
      if (evidence.containsKey(field)) {
        assertThat(fused.field(field).distance()).hasValue(evidence.get(field));
      } else {
        assertThat(fused.field(field).distance()).isEmpty();
      }
    }
  }

  @Property
  void equalDistancesFuseToThatDistance(
      @ForAll("evidence") Map<EmbeddingField, Double> evidence) {
    if (evidence.isEmpty()) {
      return;
    }
    Map<EmbeddingField, Double> uniform = new EnumMap<>(EmbeddingField.class);
    evidence.keySet().forEach(field -> uniform.put(field, 0.15));

    assertThat(ScoreFusion.fuse(uniform).score()).isCloseTo(0.15, within(1e-9));
  }

  @Property
  void rankedOutputIsBelowThresholdAndSortedAscending(
      @ForAll("candidates") Map<Long, Map<EmbeddingField, Double>> candidates) {
    List<ScoreFusion.RankedCandidate> ranked = ScoreFusion.rank(candidates, 0.2);

    assertThat(ranked).allSatisfy(c -> assertThat(c.score().score()).isLessThan(0.2));
    for (int i = 1; i < ranked.size(); i++) {
      ScoreFusion.RankedCandidate prev = ranked.get(i - 1);
      ScoreFusion.RankedCandidate next = ranked.get(i);
      assertThat(prev.score().score()).isLessThanOrEqualTo(next.score().score());
      if (prev.score().score() == next.score().score()) {
        assertThat(prev.noteId()).isLessThan(next.noteId());
      }
    }
  }

  @Property
  void rankingIsDeterministic(
      @ForAll("candidates") Map<Long, Map<EmbeddingField, Double>> candidates) {
    assertThat(ScoreFusion.rank(new HashMap<>(candidates), 0.2))
        .isEqualTo(ScoreFusion.rank(candidates, 0.2));
  }
}
