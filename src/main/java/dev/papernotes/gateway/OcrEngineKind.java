package dev.papernotes.gateway;

import dev.papernotes.note.EmbeddingField;

/** The two independent OCR engines. */
public enum OcrEngineKind {
  /** Engine tuned for printed text. */
  A(EmbeddingField.OCR_TEXT_A),
  /** Engine tuned for handwriting. */
  B(EmbeddingField.OCR_TEXT_B);

  private final EmbeddingField textField;

  OcrEngineKind(EmbeddingField textField) {
    this.textField = textField;
  }

  /** The note field holding the embedding of this engine's text. */
  public EmbeddingField textField() {
    return textField;
  }

  public String key() {
    return name().toLowerCase();
  }
}
