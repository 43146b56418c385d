package dev.papernotes.progress;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Per-run wrapper around a {@link ProgressObserver} that keeps the emitted fractions
 * non-decreasing and isolates the pipeline from observer failures.
 *
 * <p>Not thread-safe; a reporter belongs to the thread orchestrating one pipeline run.
 *
 * @param <S> stage enum of the pipeline
 */
public final class ProgressReporter<S extends Enum<S>> {

  private static final Logger log = LoggerFactory.getLogger(ProgressReporter.class);

  private final ProgressObserver<S> observer;
  private float lastFraction = 0f;

  public ProgressReporter(ProgressObserver<S> observer) {
    this.observer = observer;
  }

  /**
   * Emits an event. A fraction lower than the previous one is raised to the previous value.
   *
   * @param stage current stage
   * @param fraction completion fraction in [0, 1]
   * @param message status text
   */
  public void report(S stage, float fraction, String message) {
    float clamped = Math.max(lastFraction, Math.min(1f, Math.max(0f, fraction)));
    lastFraction = clamped;
    log.debug("[{}] {} {}", stage, clamped, message);
    try {
      observer.onProgress(new ProgressEvent<>(stage, clamped, message));
    } catch (RuntimeException e) {
      log.warn("Progress observer failed at stage {}: {}", stage, e.getMessage());
    }
  }

  public float lastFraction() {
    return lastFraction;
  }
}
