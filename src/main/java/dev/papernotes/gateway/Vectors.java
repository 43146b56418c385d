package dev.papernotes.gateway;

import dev.langchain4j.data.embedding.Embedding;
import dev.papernotes.note.VectorChecks;

/** L2 normalisation applied by gateway adapters before vectors leave the gateway. */
final class Vectors {

  private static final double EPSILON = 1e-12;

  private Vectors() {
    // utility class
  }

  /**
   * Returns a unit-length copy of {@code raw}.
   *
   * @throws FieldDerivationException if the vector has (near) zero norm and no direction
   */
  static Embedding normalized(float[] raw) {
    Embedding embedding = Embedding.from(raw.clone());
    if (VectorChecks.l2Norm(embedding) < EPSILON) {
      throw new FieldDerivationException("Model produced a zero vector");
    }
    embedding.normalize();
    return embedding;
  }
}
