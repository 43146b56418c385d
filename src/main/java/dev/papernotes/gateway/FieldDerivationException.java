package dev.papernotes.gateway;

/**
 * Raised when a single embedding or OCR step cannot produce its output. Pipelines recover from it
 * at field scope; it never ends a pipeline run.
 */
public class FieldDerivationException extends RuntimeException {

  public FieldDerivationException(String message) {
    super(message);
  }

  public FieldDerivationException(String message, Throwable cause) {
    super(message, cause);
  }
}
