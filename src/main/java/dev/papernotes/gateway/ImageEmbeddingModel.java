package dev.papernotes.gateway;

import dev.langchain4j.data.embedding.Embedding;
import java.awt.image.BufferedImage;

/** An image encoder producing L2-normalized vectors of a fixed dimension. */
public interface ImageEmbeddingModel {

  Embedding embed(BufferedImage image);

  int dimension();

  default boolean isReady() {
    return true;
  }
}
