package dev.papernotes.api;

import dev.papernotes.image.ImageLoadException;
import dev.papernotes.ingestion.IngestionCancelledException;
import dev.papernotes.search.SearchCancelledException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Global REST error handler that maps application exceptions to RFC 9457 Problem Detail responses.
 *
 * <ul>
 *   <li>{@link IllegalArgumentException} - 400 Bad Request
 *   <li>{@link NoteNotFoundException} - 404 Not Found
 *   <li>{@link ImageLoadException} - 422 Unprocessable Entity (nothing was stored)
 *   <li>cancelled pipeline runs - 503 Service Unavailable
 * </ul>
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  @ExceptionHandler(IllegalArgumentException.class)
  ProblemDetail handleIllegalArgument(IllegalArgumentException ex) {
    return ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, ex.getMessage());
  }

  @ExceptionHandler(NoteNotFoundException.class)
  ProblemDetail handleNotFound(NoteNotFoundException ex) {
    return ProblemDetail.forStatusAndDetail(HttpStatus.NOT_FOUND, ex.getMessage());
  }

  @ExceptionHandler(ImageLoadException.class)
  ProblemDetail handleImageLoad(ImageLoadException ex) {
    log.warn("Rejected image: {}", ex.getMessage());
    ProblemDetail problem =
        ProblemDetail.forStatusAndDetail(HttpStatus.UNPROCESSABLE_ENTITY, ex.getMessage());
    problem.setTitle("Image could not be loaded");
    return problem;
  }

  @ExceptionHandler({IngestionCancelledException.class, SearchCancelledException.class})
  ProblemDetail handleCancelled(RuntimeException ex) {
    return ProblemDetail.forStatusAndDetail(HttpStatus.SERVICE_UNAVAILABLE, ex.getMessage());
  }
}
