package dev.papernotes.gateway;

import dev.langchain4j.data.embedding.Embedding;
import dev.papernotes.note.OcrReading;
import java.awt.image.BufferedImage;
import java.util.Map;

/**
 * Uniform contract over the external ML models. Every returned vector is already L2-normalized;
 * callers never re-normalize. Every method may block and throws {@link FieldDerivationException}
 * when the model cannot produce an output.
 */
public interface EmbeddingGateway {

  Embedding embedImage(BufferedImage image, ImageModelKind kind);

  OcrReading recognizeText(BufferedImage image, OcrEngineKind engine);

  Embedding embedText(String text);

  /** Readiness of every model behind the gateway, keyed by model name. */
  Map<String, Boolean> status();
}
