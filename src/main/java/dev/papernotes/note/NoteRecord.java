package dev.papernotes.note;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * The unit stored in and retrieved from the vector index: one scanned note with its named vector
 * slots and raw OCR output.
 *
 * <p>Every {@link EmbeddingField} has an entry in {@code vectors}; fields that were not computed are
 * {@link FieldVector#absent()}. Instances are immutable, re-ingestion produces a new record that
 * replaces the stored one wholesale.
 *
 * @param id index-assigned identifier, null until first insert
 * @param title display title
 * @param imagePath opaque reference to the source image
 * @param collection optional grouping label
 * @param vectors vector slot per field
 * @param ocrA output of OCR engine A
 * @param ocrB output of OCR engine B
 * @param timestamp last-modified time
 */
public record NoteRecord(
    @Nullable Long id,
    String title,
    String imagePath,
    @Nullable String collection,
    Map<EmbeddingField, FieldVector> vectors,
    OcrReading ocrA,
    OcrReading ocrB,
    Instant timestamp) {

  public NoteRecord {
    EnumMap<EmbeddingField, FieldVector> complete = new EnumMap<>(EmbeddingField.class);
    for (EmbeddingField field : EmbeddingField.values()) {
      FieldVector v = vectors == null ? null : vectors.get(field);
      complete.put(field, v == null ? FieldVector.absent() : v);
    }
    vectors = Collections.unmodifiableMap(complete);
    ocrA = ocrA == null ? OcrReading.EMPTY : ocrA;
    ocrB = ocrB == null ? OcrReading.EMPTY : ocrB;
  }

  public FieldVector vector(EmbeddingField field) {
    return vectors.get(field);
  }

  /** Fields holding a computed vector. */
  public Set<EmbeddingField> presentFields() {
    EnumSet<EmbeddingField> present = EnumSet.noneOf(EmbeddingField.class);
    vectors.forEach(
        (field, v) -> {
          if (v.isPresent()) {
            present.add(field);
          }
        });
    return present;
  }

  public NoteRecord withId(long newId) {
    return new NoteRecord(newId, title, imagePath, collection, vectors, ocrA, ocrB, timestamp);
  }

  public NoteRecord withTitle(String newTitle) {
    return new NoteRecord(id, newTitle, imagePath, collection, vectors, ocrA, ocrB, timestamp);
  }
}
