package dev.papernotes.ingestion;

/**
 * Thrown when the thread running an ingestion is interrupted. Nothing has been persisted and the
 * interrupt flag is left set.
 */
public class IngestionCancelledException extends RuntimeException {

    public IngestionCancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}
