package dev.papernotes.search;

import static dev.papernotes.note.EmbeddingField.CLIP;
import static dev.papernotes.note.EmbeddingField.OCR_TEXT_A;
import static dev.papernotes.note.EmbeddingField.OCR_TEXT_B;
import static dev.papernotes.note.EmbeddingField.VISUAL_TEXT;

import dev.papernotes.note.EmbeddingField;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Fixed weight table keyed by the exact set of evidence fields present for a candidate.
 *
 * <p>Each row has its own weight vector summing to 1.0; weights are never re-normalised for missing
 * fields. Single-field rows weight that field 1.0. The empty set has no row: a candidate without
 * evidence gets the {@link #NO_EVIDENCE_SCORE} sentinel. Completeness of the table over every
 * subset of {@link EmbeddingField#FUSABLE} is checked when the class initialises.
 */
public final class FusionWeights {

  /** Score of a candidate with no evidence; never below any usable threshold. */
  public static final double NO_EVIDENCE_SCORE = 1.0;

  static final double SUM_TOLERANCE = 1e-6;

  private static final Map<Set<EmbeddingField>, Map<EmbeddingField, Double>> TABLE = buildTable();

  private FusionWeights() {}

  /**
   * Weights for an evidence set.
   *
   * @param present non-empty subset of the fusable fields
   * @return weight per field of {@code present}
   * @throws IllegalArgumentException if the set is empty or contains a non-fusable field
   */
  public static Map<EmbeddingField, Double> forFields(Set<EmbeddingField> present) {
    Map<EmbeddingField, Double> row =
        present.isEmpty() ? null : TABLE.get(EnumSet.copyOf(present));
    if (row == null) {
      throw new IllegalArgumentException("No fusion weights for evidence set " + present);
    }
    return row;
  }

  /** Every row of the table, keyed by its evidence set. */
  public static Map<Set<EmbeddingField>, Map<EmbeddingField, Double>> table() {
    return TABLE;
  }

  private static Map<Set<EmbeddingField>, Map<EmbeddingField, Double>> buildTable() {
    Map<Set<EmbeddingField>, Map<EmbeddingField, Double>> table = new HashMap<>();

    row(table, List.of(CLIP, OCR_TEXT_A, OCR_TEXT_B, VISUAL_TEXT), 0.30, 0.25, 0.20, 0.25);

    row(table, List.of(CLIP, OCR_TEXT_A, VISUAL_TEXT), 0.35, 0.35, 0.30);
    row(table, List.of(CLIP, OCR_TEXT_A, OCR_TEXT_B), 0.35, 0.40, 0.25);
    row(table, List.of(CLIP, OCR_TEXT_B, VISUAL_TEXT), 0.35, 0.30, 0.35);

    row(table, List.of(CLIP, OCR_TEXT_A), 0.40, 0.60);
    row(table, List.of(CLIP, OCR_TEXT_B), 0.40, 0.60);
    row(table, List.of(CLIP, VISUAL_TEXT), 0.50, 0.50);

    // without the primary image signal
    row(table, List.of(OCR_TEXT_A, OCR_TEXT_B, VISUAL_TEXT), 0.35, 0.25, 0.40);
    row(table, List.of(OCR_TEXT_A, OCR_TEXT_B), 0.55, 0.45);
    row(table, List.of(OCR_TEXT_A, VISUAL_TEXT), 0.50, 0.50);
    row(table, List.of(OCR_TEXT_B, VISUAL_TEXT), 0.50, 0.50);

    for (EmbeddingField field : EmbeddingField.FUSABLE) {
      row(table, List.of(field), 1.0);
    }

    verifyComplete(table);
    return Collections.unmodifiableMap(table);
  }

  private static void row(
      Map<Set<EmbeddingField>, Map<EmbeddingField, Double>> table,
      List<EmbeddingField> fields,
      double... weights) {
    if (fields.size() != weights.length) {
      throw new IllegalStateException("Weight row " + fields + " has " + weights.length + " weights");
    }
    Map<EmbeddingField, Double> row = new EnumMap<>(EmbeddingField.class);
    double sum = 0.0;
    for (int i = 0; i < weights.length; i++) {
      row.put(fields.get(i), weights[i]);
      sum += weights[i];
    }
    if (Math.abs(sum - 1.0) > SUM_TOLERANCE) {
      throw new IllegalStateException("Weights for " + fields + " sum to " + sum);
    }
    Set<EmbeddingField> key = EnumSet.copyOf(fields);
    if (table.put(key, Collections.unmodifiableMap(row)) != null) {
      throw new IllegalStateException("Duplicate weight row " + key);
    }
  }

  private static void verifyComplete(Map<Set<EmbeddingField>, Map<EmbeddingField, Double>> table) {
    List<EmbeddingField> fusable = List.copyOf(EmbeddingField.FUSABLE);
    int subsets = 1 << fusable.size();
    for (int mask = 1; mask < subsets; mask++) {
      Set<EmbeddingField> subset = EnumSet.noneOf(EmbeddingField.class);
      for (int bit = 0; bit < fusable.size(); bit++) {
        if ((mask & (1 << bit)) != 0) {
          subset.add(fusable.get(bit));
        }
      }
      if (!table.containsKey(subset)) {
        throw new IllegalStateException("Missing fusion weights for " + subset);
      }
    }
  }
}
