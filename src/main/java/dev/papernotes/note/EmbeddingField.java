package dev.papernotes.note;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Named vector slots of a {@link NoteRecord}. Each field has a fixed dimensionality shared by every
 * record and maps to its own column in the vector index.
 *
 * <p>{@link #VISUAL} is stored on every note but is not part of fused retrieval; the remaining four
 * fields are the fusable evidence fields.
 */
public enum EmbeddingField {
  VISUAL("visual_embedding", 1280, false),
  CLIP("clip_embedding", 512, true),
  VISUAL_TEXT("visual_text_embedding", 768, true),
  OCR_TEXT_A("ocr_text_a_embedding", 384, true),
  OCR_TEXT_B("ocr_text_b_embedding", 384, true);

  /** Fields that contribute evidence to score fusion. */
  public static final Set<EmbeddingField> FUSABLE =
      Collections.unmodifiableSet(EnumSet.of(CLIP, VISUAL_TEXT, OCR_TEXT_A, OCR_TEXT_B));

  private final String column;
  private final int dimension;
  private final boolean fusable;

  EmbeddingField(String column, int dimension, boolean fusable) {
    this.column = column;
    this.dimension = dimension;
    this.fusable = fusable;
  }

  /** Column name in the {@code notes} table. */
  public String column() {
    return column;
  }

  public int dimension() {
    return dimension;
  }

  public boolean fusable() {
    return fusable;
  }
}
