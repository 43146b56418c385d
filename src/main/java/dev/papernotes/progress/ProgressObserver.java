package dev.papernotes.progress;

/**
 * Side-channel receiver of pipeline progress. Purely observational: nothing an observer does
 * changes the outcome of a run.
 *
 * @param <S> stage enum of the observed pipeline
 */
@FunctionalInterface
public interface ProgressObserver<S extends Enum<S>> {

  void onProgress(ProgressEvent<S> event);

  static <S extends Enum<S>> ProgressObserver<S> none() {
    return event -> {};
  }
}
