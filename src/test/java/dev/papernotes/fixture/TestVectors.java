package dev.papernotes.fixture;

import dev.langchain4j.data.embedding.Embedding;
import dev.papernotes.note.EmbeddingField;
import java.util.Random;

/**
 * Deterministic unit vectors for tests.
 *
 * <pre>{@code
 * Embedding q = TestVectors.axis(EmbeddingField.CLIP);
 * Embedding near = TestVectors.atDistance(EmbeddingField.CLIP, 0.05); // cosine distance 0.05 to q
 * }</pre>
 */
public final class TestVectors {

  private TestVectors() {}

  /** Unit vector along the first axis of the field's space. */
  public static Embedding axis(EmbeddingField field) {
    float[] v = new float[field.dimension()];
    v[0] = 1f;
    return Embedding.from(v);
  }

  /** Unit vector whose cosine distance to {@link #axis} is {@code distance}. */
  public static Embedding atDistance(EmbeddingField field, double distance) {
    double cos = 1.0 - distance;
    float[] v = new float[field.dimension()];
    v[0] = (float) cos;
    v[1] = (float) Math.sqrt(Math.max(0.0, 1.0 - cos * cos));
    return Embedding.from(v);
  }

  /** Pseudo-random unit vector of the field's dimension. */
  public static Embedding random(EmbeddingField field, long seed) {
    Random random = new Random(seed);
    float[] v = new float[field.dimension()];
    double sum = 0.0;
    for (int i = 0; i < v.length; i++) {
      v[i] = (float) random.nextGaussian();
      sum += (double) v[i] * v[i];
    }
    double norm = Math.sqrt(sum);
    for (int i = 0; i < v.length; i++) {
      v[i] = (float) (v[i] / norm);
    }
    return Embedding.from(v);
  }
}
