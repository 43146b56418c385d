package dev.papernotes.search;

import dev.papernotes.note.EmbeddingField;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Pure static utility that turns per-field distances into one ranking score.
 *
 * <p>Weights come from {@link FusionWeights}, selected by the exact set of fields that carry
 * evidence. Distances are cosine distances (lower is better), so the fused score is also "lower is
 * better". This class has no Spring dependencies and no state.
 */
public final class ScoreFusion {

  private ScoreFusion() {}

  /**
   * Fuses one candidate's evidence.
   *
   * @param evidence distance per field, already filtered by each field's own threshold
   * @return weighted sum with the full per-field breakdown; {@link
   *     FusionWeights#NO_EVIDENCE_SCORE} when {@code evidence} is empty
   * @throws IllegalArgumentException if a field is not fusable or a distance is not finite
   */
  public static FusedScore fuse(Map<EmbeddingField, Double> evidence) {
    Map<EmbeddingField, FieldScore> breakdown = new EnumMap<>(EmbeddingField.class);
    for (EmbeddingField field : EmbeddingField.FUSABLE) {
      breakdown.put(field, FieldScore.absent());
    }
    for (Map.Entry<EmbeddingField, Double> entry : evidence.entrySet()) {
      EmbeddingField field = entry.getKey();
      Double distance = entry.getValue();
      if (!field.fusable()) {
        throw new IllegalArgumentException("Field " + field + " does not take part in fusion");
      }
      if (distance == null || !Double.isFinite(distance)) {
        throw new IllegalArgumentException("Distance for " + field + " must be finite: " + distance);
      }
      breakdown.put(field, FieldScore.matched(distance));
    }

    if (evidence.isEmpty()) {
      return new FusedScore(FusionWeights.NO_EVIDENCE_SCORE, breakdown);
    }

    Map<EmbeddingField, Double> weights = FusionWeights.forFields(evidence.keySet());
    double score = 0.0;
    // fixed enum order keeps the floating point sum deterministic
    for (EmbeddingField field : EmbeddingField.FUSABLE) {
      Double distance = evidence.get(field);
      if (distance != null) {
        score += weights.get(field) * distance;
      }
    }
    return new FusedScore(score, breakdown);
  }

  /**
   * Fuses every candidate and keeps those strictly below the global threshold.
   *
   * @param evidenceByNote per-field evidence keyed by note id
   * @param globalThreshold exclusive upper bound on the fused score
   * @return candidates sorted ascending by fused score, ties broken by ascending id
   */
  public static List<RankedCandidate> rank(
      Map<Long, Map<EmbeddingField, Double>> evidenceByNote, double globalThreshold) {
    return evidenceByNote.entrySet().stream()
        .map(e -> new RankedCandidate(e.getKey(), fuse(e.getValue())))
        .filter(c -> c.score().score() < globalThreshold)
        .sorted(
            Comparator.comparingDouble((RankedCandidate c) -> c.score().score())
                .thenComparingLong(RankedCandidate::noteId))
        .toList();
  }

  /** A fused candidate before its note record is resolved. */
  public record RankedCandidate(long noteId, FusedScore score) {}
}
