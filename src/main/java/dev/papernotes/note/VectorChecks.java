package dev.papernotes.note;

import dev.langchain4j.data.embedding.Embedding;
import org.jspecify.annotations.Nullable;

/** Static checks for the stored-vector invariants: fixed dimension per field and unit L2 norm. */
public final class VectorChecks {

  /** Allowed deviation of the L2 norm from 1. */
  public static final double NORM_TOLERANCE = 1e-2;

  private VectorChecks() {
    // utility class
  }

  public static double l2Norm(Embedding embedding) {
    double sum = 0.0;
    for (float v : embedding.vector()) {
      sum += (double) v * v;
    }
    return Math.sqrt(sum);
  }

  public static boolean isUnitLength(Embedding embedding) {
    return Math.abs(l2Norm(embedding) - 1.0) <= NORM_TOLERANCE;
  }

  /**
   * Describes why {@code embedding} cannot be stored in {@code field}.
   *
   * @return a violation message, or null when the vector is acceptable
   */
  public static @Nullable String violation(EmbeddingField field, Embedding embedding) {
    if (embedding.dimension() != field.dimension()) {
      return "expected " + field.dimension() + " dimensions, got " + embedding.dimension();
    }
    if (!isUnitLength(embedding)) {
      return "not L2-normalized (norm=" + l2Norm(embedding) + ")";
    }
    return null;
  }
}
