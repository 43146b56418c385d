package dev.papernotes.gateway;

import dev.papernotes.note.EmbeddingField;

/** Image encoders reachable through the {@link EmbeddingGateway}. */
public enum ImageModelKind {
  /** Baseline classifier features (MobileNetV3-style). */
  VISUAL(EmbeddingField.VISUAL),
  /** General-purpose image-text aligned features. */
  CLIP(EmbeddingField.CLIP),
  /** OCR-specialised visual encoder features (TrOCR-style encoder). */
  VISUAL_TEXT(EmbeddingField.VISUAL_TEXT);

  private final EmbeddingField field;

  ImageModelKind(EmbeddingField field) {
    this.field = field;
  }

  /** The note field this model's output is stored in. */
  public EmbeddingField field() {
    return field;
  }

  /** Property-style key, e.g. {@code visual-text}. */
  public String key() {
    return name().toLowerCase().replace('_', '-');
  }
}
