package dev.papernotes.search;

import java.nio.file.Path;
import java.time.Duration;
import org.jspecify.annotations.Nullable;

/**
 * Query by example: find notes resembling the given image.
 *
 * @param imagePath query image on disk
 * @param deadline optional time budget for the whole run; unfinished work counts as failed
 */
public record SearchRequest(Path imagePath, @Nullable Duration deadline) {

  public SearchRequest {
    if (imagePath == null) {
      throw new IllegalArgumentException("imagePath must not be null");
    }
    if (deadline != null && (deadline.isNegative() || deadline.isZero())) {
      throw new IllegalArgumentException("deadline must be positive, got: " + deadline);
    }
  }

  public static SearchRequest of(Path imagePath) {
    return new SearchRequest(imagePath, null);
  }
}
