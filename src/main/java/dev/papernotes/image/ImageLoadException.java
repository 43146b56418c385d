package dev.papernotes.image;

/**
 * Thrown when a note image cannot be read or decoded. This is the only fatal ingestion failure;
 * nothing is persisted when it is raised.
 */
public class ImageLoadException extends RuntimeException {

    public ImageLoadException(String message) {
        super(message);
    }

    public ImageLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
