package dev.papernotes.api;

/** Thrown when a requested note id or collection match does not exist. */
public class NoteNotFoundException extends RuntimeException {

    public NoteNotFoundException(String message) {
        super(message);
    }
}
