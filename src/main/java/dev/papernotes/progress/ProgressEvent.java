package dev.papernotes.progress;

/**
 * Immutable progress notification emitted by a pipeline run.
 *
 * @param stage the pipeline stage the run is in
 * @param fraction completion fraction in [0, 1]
 * @param message human-readable status
 * @param <S> stage enum of the emitting pipeline
 */
public record ProgressEvent<S extends Enum<S>>(S stage, float fraction, String message) {

  public ProgressEvent {
    if (fraction < 0f || fraction > 1f) {
      throw new IllegalArgumentException("fraction must be in [0, 1], got: " + fraction);
    }
    message = message == null ? "" : message;
  }
}
