package dev.papernotes.api;

import dev.papernotes.note.EmbeddingField;
import dev.papernotes.note.NoteRecord;
import java.time.Instant;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * JSON summary of a stored note. Vectors are not serialised, only which fields are present.
 *
 * @param embeddings present fields, in declaration order
 */
public record NoteView(
        long id,
        String title,
        String imagePath,
        @Nullable String collection,
        List<EmbeddingField> embeddings,
        String ocrTextA,
        float ocrConfidenceA,
        String ocrTextB,
        float ocrConfidenceB,
        Instant updatedAt
) {

    public static NoteView from(NoteRecord note) {
        if (note.id() == null) {
            throw new IllegalArgumentException("Note has not been stored yet");
        }
        return new NoteView(
                note.id(),
                note.title(),
                note.imagePath(),
                note.collection(),
                List.copyOf(note.presentFields()),
                note.ocrA().text(),
                note.ocrA().confidence(),
                note.ocrB().text(),
                note.ocrB().confidence(),
                note.timestamp());
    }
}
