package dev.papernotes.search;

import dev.papernotes.note.EmbeddingField;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Result of fusing one candidate's per-field evidence.
 *
 * @param score weighted sum of per-field distances (lower is better; 1.0 when there is no evidence)
 * @param breakdown distance or absence for every fusable field, kept for observability
 */
public record FusedScore(double score, Map<EmbeddingField, FieldScore> breakdown) {

  public FusedScore {
    breakdown = Collections.unmodifiableMap(new EnumMap<>(breakdown));
  }

  public FieldScore field(EmbeddingField field) {
    return breakdown.getOrDefault(field, FieldScore.absent());
  }
}
