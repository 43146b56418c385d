package dev.papernotes.ingestion;

import java.nio.file.Path;
import java.time.Duration;
import org.jspecify.annotations.Nullable;

/**
 * Request to scan a note image into the index.
 *
 * @param imagePath  image on disk
 * @param existingId id of a note to re-scan in place; an unknown id creates a new note
 * @param collection optional grouping label; on re-scan a null keeps the stored label
 * @param deadline   optional time budget for the whole run
 */
public record IngestionRequest(
        Path imagePath,
        @Nullable Long existingId,
        @Nullable String collection,
        @Nullable Duration deadline
) {

    public IngestionRequest {
        if (imagePath == null) {
            throw new IllegalArgumentException("imagePath must not be null");
        }
        if (deadline != null && (deadline.isNegative() || deadline.isZero())) {
            throw new IllegalArgumentException("deadline must be positive, got: " + deadline);
        }
        if (collection != null && collection.isBlank()) {
            collection = null;
        }
    }

    public static IngestionRequest of(Path imagePath) {
        return new IngestionRequest(imagePath, null, null, null);
    }

    public static IngestionRequest rescan(Path imagePath, long existingId) {
        return new IngestionRequest(imagePath, existingId, null, null);
    }
}
