package dev.papernotes.search;

import static dev.papernotes.note.EmbeddingField.CLIP;
import static dev.papernotes.note.EmbeddingField.OCR_TEXT_A;
import static dev.papernotes.note.EmbeddingField.OCR_TEXT_B;
import static dev.papernotes.note.EmbeddingField.VISUAL;
import static dev.papernotes.note.EmbeddingField.VISUAL_TEXT;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import dev.papernotes.note.EmbeddingField;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ScoreFusionTest {

  private static final double THRESHOLD = 0.2;

  // --- Helper factory methods ---

  private static Map<EmbeddingField, Double> evidence(Object... fieldAndDistance) {
    Map<EmbeddingField, Double> map = new EnumMap<>(EmbeddingField.class);
    for (int i = 0; i < fieldAndDistance.length; i += 2) {
      map.put((EmbeddingField) fieldAndDistance[i], (Double) fieldAndDistance[i + 1]);
    }
    return map;
  }

  // --- fuse ---

  @Test
  void clipAndTextAUseFortySixtyWeights() {
    FusedScore fused = ScoreFusion.fuse(evidence(CLIP, 0.10, OCR_TEXT_A, 0.05));

    assertThat(fused.score()).isCloseTo(0.07, within(1e-9));
  }

  @Test
  void singleTextFieldScoresItsOwnDistance() {
    FusedScore fused = ScoreFusion.fuse(evidence(OCR_TEXT_A, 0.50));

    assertThat(fused.score()).isCloseTo(0.50, within(1e-9));
  }

  @Test
  void noEvidenceScoresSentinel() {
    FusedScore fused = ScoreFusion.fuse(Map.of());

    assertThat(fused.score()).isEqualTo(1.0);
    assertThat(fused.breakdown().values()).allMatch(s -> s.distance().isEmpty());
  }

  @Test
  void allFourFieldsWeightedPerTable() {
    FusedScore fused =
        ScoreFusion.fuse(
            evidence(CLIP, 0.10, OCR_TEXT_A, 0.20, OCR_TEXT_B, 0.30, VISUAL_TEXT, 0.40));

    // 0.30*0.10 + 0.25*0.20 + 0.20*0.30 + 0.25*0.40
    assertThat(fused.score()).isCloseTo(0.24, within(1e-9));
  }

  @Test
  void missingFieldsAreNotRenormalised() {
    // CLIP + visualText row is 0.5/0.5, not the 0.30/0.25 of the full row rescaled
    FusedScore fused = ScoreFusion.fuse(evidence(CLIP, 0.10, VISUAL_TEXT, 0.30));

    assertThat(fused.score()).isCloseTo(0.20, within(1e-9));
  }

  @Test
  void breakdownRecordsMatchedAndAbsentFields() {
    FusedScore fused = ScoreFusion.fuse(evidence(CLIP, 0.10, OCR_TEXT_B, 0.12));

    assertThat(fused.field(CLIP)).isEqualTo(FieldScore.matched(0.10));
    assertThat(fused.field(OCR_TEXT_B)).isEqualTo(FieldScore.matched(0.12));
    assertThat(fused.field(OCR_TEXT_A)).isEqualTo(FieldScore.absent());
    assertThat(fused.field(VISUAL_TEXT)).isEqualTo(FieldScore.absent());
  }

  @Test
  void nonFusableFieldIsRejected() {
    assertThatThrownBy(() -> ScoreFusion.fuse(evidence(VISUAL, 0.05)))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void nonFiniteDistanceIsRejected() {
    assertThatThrownBy(() -> ScoreFusion.fuse(evidence(CLIP, Double.NaN)))
        .isInstanceOf(IllegalArgumentException.class);
  }

  // --- rank ---

  @Test
  void scenarioAIsIncludedAndScenarioBAndCAreExcluded() {
    Map<Long, Map<EmbeddingField, Double>> candidates = new LinkedHashMap<>();
    candidates.put(1L, evidence(CLIP, 0.10, OCR_TEXT_A, 0.05));
    candidates.put(2L, evidence(OCR_TEXT_A, 0.50));
    candidates.put(3L, Map.of());

    List<ScoreFusion.RankedCandidate> ranked = ScoreFusion.rank(candidates, THRESHOLD);

    assertThat(ranked).extracting(ScoreFusion.RankedCandidate::noteId).containsExactly(1L);
    assertThat(ranked.get(0).score().score()).isCloseTo(0.07, within(1e-9));
  }

  @Test
  void scoreExactlyAtThresholdIsExcluded() {
    List<ScoreFusion.RankedCandidate> ranked =
        ScoreFusion.rank(Map.of(7L, evidence(CLIP, 0.2)), THRESHOLD);

    assertThat(ranked).isEmpty();
  }

  @Test
  void scoreJustBelowThresholdIsIncluded() {
    List<ScoreFusion.RankedCandidate> ranked =
        ScoreFusion.rank(Map.of(7L, evidence(CLIP, 0.1999)), THRESHOLD);

    assertThat(ranked).extracting(ScoreFusion.RankedCandidate::noteId).containsExactly(7L);
  }

  @Test
  void resultsSortedAscendingWithIdTieBreak() {
    Map<Long, Map<EmbeddingField, Double>> candidates = new LinkedHashMap<>();
    candidates.put(30L, evidence(CLIP, 0.15));
    candidates.put(20L, evidence(CLIP, 0.05));
    candidates.put(10L, evidence(CLIP, 0.15));
    candidates.put(40L, evidence(OCR_TEXT_A, 0.01));

    List<ScoreFusion.RankedCandidate> ranked = ScoreFusion.rank(candidates, THRESHOLD);

    assertThat(ranked)
        .extracting(ScoreFusion.RankedCandidate::noteId)
        .containsExactly(40L, 20L, 10L, 30L);
  }

  @Test
  void emptyInputRanksToEmptyList() {
    assertThat(ScoreFusion.rank(Map.of(), THRESHOLD)).isEmpty();
  }
}
