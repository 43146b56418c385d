package dev.papernotes.search;

import dev.langchain4j.data.embedding.Embedding;
import dev.papernotes.concurrent.TaskGroup;
import dev.papernotes.concurrent.TaskGroup.Subtask;
import dev.papernotes.gateway.EmbeddingGateway;
import dev.papernotes.gateway.ImageModelKind;
import dev.papernotes.gateway.OcrEngineKind;
import dev.papernotes.image.ImageLoadException;
import dev.papernotes.image.LoadedImage;
import dev.papernotes.image.NoteImageLoader;
import dev.papernotes.image.OcrImagePreprocessor;
import dev.papernotes.index.NeighborMatch;
import dev.papernotes.index.VectorIndex;
import dev.papernotes.note.EmbeddingField;
import dev.papernotes.note.FieldVector;
import dev.papernotes.note.NoteRecord;
import dev.papernotes.note.OcrReading;
import dev.papernotes.note.VectorChecks;
import dev.papernotes.progress.ProgressObserver;
import dev.papernotes.progress.ProgressReporter;
import java.awt.image.BufferedImage;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;

/**
 * Query pipeline: derive query vectors from an image, look up nearest neighbours per field, fuse.
 *
 * <p>Pipeline: load image -> derive CLIP, visual-text, OCR-A and OCR-B query vectors in parallel
 * -> stop with an empty list if CLIP is missing -> one ANN lookup per present field in parallel ->
 * drop matches at or above the field's own threshold -> merge evidence by note id -> {@link
 * ScoreFusion#rank} -> resolve records.
 *
 * <p>Every failure except cancellation is recovered: a failed derivation or lookup only removes
 * that field's evidence. Callers always get a list, possibly empty.
 */
@Service
public class SearchService {

  private static final Logger log = LoggerFactory.getLogger(SearchService.class);

  private final EmbeddingGateway gateway;
  private final VectorIndex index;
  private final NoteImageLoader imageLoader;
  private final OcrImagePreprocessor ocrPreprocessor;
  private final AsyncTaskExecutor executor;
  private final SearchProperties properties;
  private final Clock clock;

  public SearchService(
      EmbeddingGateway gateway,
      VectorIndex index,
      NoteImageLoader imageLoader,
      OcrImagePreprocessor ocrPreprocessor,
      @Qualifier("embeddingExecutor") AsyncTaskExecutor executor,
      SearchProperties properties,
      Clock clock) {
    this.gateway = gateway;
    this.index = index;
    this.imageLoader = imageLoader;
    this.ocrPreprocessor = ocrPreprocessor;
    this.executor = executor;
    this.properties = properties;
    this.clock = clock;
  }

  public List<SearchResult> search(SearchRequest request) {
    return search(request, ProgressObserver.none());
  }

  /**
   * Runs one query.
   *
   * @param request query image and optional deadline
   * @param observer receives progress events; its failures are ignored
   * @return matches with fused score below the global threshold, best first
   * @throws SearchCancelledException if the calling thread is interrupted
   */
  public List<SearchResult> search(SearchRequest request, ProgressObserver<QueryStage> observer) {
    ProgressReporter<QueryStage> progress = new ProgressReporter<>(observer);
    Instant deadline = TaskGroup.deadlineFrom(clock, request.deadline());

    progress.report(QueryStage.LOADING_IMAGE, 0.10f, "Loading search image...");
    LoadedImage loaded;
    try {
      loaded = imageLoader.load(request.imagePath());
    } catch (ImageLoadException e) {
      log.warn("Search image {} could not be loaded: {}", request.imagePath(), e.getMessage());
      progress.report(QueryStage.COMPLETE, 1.0f, "Search image could not be loaded");
      return List.of();
    }

    progress.report(
        QueryStage.GENERATING_EMBEDDINGS, 0.20f, "Generating query embeddings in parallel...");
    Map<EmbeddingField, FieldVector> queryVectors = deriveQueryVectors(loaded.image(), deadline);

    if (!queryVectors.get(EmbeddingField.CLIP).isPresent()) {
      log.warn("CLIP query embedding unavailable, returning no results");
      progress.report(QueryStage.COMPLETE, 1.0f, "Primary image signal missing, no results");
      return List.of();
    }

    long active = queryVectors.values().stream().filter(FieldVector::isPresent).count();
    progress.report(
        QueryStage.SEARCHING,
        0.70f,
        "Searching database with " + active + " active embeddings...");
    Map<EmbeddingField, List<NeighborMatch>> neighbors = lookupNeighbors(queryVectors, deadline);

    progress.report(QueryStage.FUSING, 0.90f, "Fusing scores...");
    Map<Long, Map<EmbeddingField, Double>> evidence = collectEvidence(neighbors);
    List<ScoreFusion.RankedCandidate> ranked =
        ScoreFusion.rank(evidence, properties.getGlobalThreshold());
    List<SearchResult> results = resolve(ranked);

    log.info(
        "Search over {} fields: {} candidates, {} results",
        active,
        evidence.size(),
        results.size());
    progress.report(QueryStage.COMPLETE, 1.0f, "Found " + results.size() + " matching notes");
    return results;
  }

  /**
   * Finds the closest note of a collection by baseline visual similarity.
   *
   * @param imagePath query image
   * @param collection collection label the match must carry
   * @return best match below the visual threshold, or empty on no match or any failure
   */
  public Optional<SearchResult> findSimilarInCollection(Path imagePath, String collection) {
    try {
      BufferedImage image = imageLoader.load(imagePath).image();
      Embedding query = gateway.embedImage(image, ImageModelKind.VISUAL);
      double threshold = properties.thresholdFor(EmbeddingField.VISUAL);
      for (NeighborMatch match :
          index.nearestNeighbors(EmbeddingField.VISUAL, query, properties.getNeighbors())) {
        if (match.distance() >= threshold) {
          break;
        }
        Optional<NoteRecord> note =
            index.get(match.noteId()).filter(n -> collection.equals(n.collection()));
        if (note.isPresent()) {
          log.debug(
              "Collection '{}' match: note {} at distance {}",
              collection,
              match.noteId(),
              match.distance());
          FusedScore score =
              new FusedScore(
                  match.distance(),
                  Map.of(EmbeddingField.VISUAL, FieldScore.matched(match.distance())));
          return Optional.of(new SearchResult(note.get(), score));
        }
      }
      return Optional.empty();
    } catch (RuntimeException e) {
      log.warn("Collection match in '{}' failed: {}", collection, e.getMessage());
      return Optional.empty();
    }
  }

  Map<EmbeddingField, FieldVector> deriveQueryVectors(BufferedImage image, @Nullable Instant deadline) {
    BufferedImage ocrImage = ocrPreprocessor.prepare(image);
    TaskGroup group = new TaskGroup(executor, clock, deadline);
    Map<EmbeddingField, Subtask<Embedding>> tasks = new EnumMap<>(EmbeddingField.class);
    tasks.put(
        EmbeddingField.CLIP,
        group.fork("clip", () -> gateway.embedImage(image, ImageModelKind.CLIP)));
    tasks.put(
        EmbeddingField.VISUAL_TEXT,
        group.fork("visual-text", () -> gateway.embedImage(image, ImageModelKind.VISUAL_TEXT)));
    for (OcrEngineKind engine : OcrEngineKind.values()) {
      tasks.put(
          engine.textField(), group.fork("ocr-" + engine.key(), () -> ocrChain(ocrImage, engine)));
    }
    joinOrCancel(group);

    Map<EmbeddingField, FieldVector> vectors = new EnumMap<>(EmbeddingField.class);
    tasks.forEach(
        (field, task) -> {
          if (!task.succeeded()) {
            log.warn("Query {} embedding failed: {}", field, describe(task.failure()));
            vectors.put(field, FieldVector.absent());
            return;
          }
          Embedding embedding = task.result().orElse(null);
          String violation = embedding == null ? null : VectorChecks.violation(field, embedding);
          if (violation != null) {
            log.warn("Query {} embedding rejected: {}", field, violation);
            embedding = null;
          }
          vectors.put(field, FieldVector.ofNullable(embedding));
        });
    return vectors;
  }

  /** Recognise then embed; null when the engine read no text. */
  private @Nullable Embedding ocrChain(BufferedImage image, OcrEngineKind engine) {
    OcrReading reading = gateway.recognizeText(image, engine);
    log.debug(
        "Query OCR {}: {} chars, confidence {}",
        engine,
        reading.text().length(),
        reading.confidence());
    if (!reading.hasText()) {
      return null;
    }
    return gateway.embedText(reading.text());
  }

  Map<EmbeddingField, List<NeighborMatch>> lookupNeighbors(
      Map<EmbeddingField, FieldVector> queryVectors, @Nullable Instant deadline) {
    TaskGroup group = new TaskGroup(executor, clock, deadline);
    Map<EmbeddingField, Subtask<List<NeighborMatch>>> lookups = new EnumMap<>(EmbeddingField.class);
    int k = properties.getNeighbors();
    queryVectors.forEach(
        (field, vector) ->
            vector
                .embedding()
                .ifPresent(
                    query ->
                        lookups.put(
                            field,
                            group.fork(
                                "ann-" + field,
                                () -> index.nearestNeighbors(field, query, k)))));
    joinOrCancel(group);

    Map<EmbeddingField, List<NeighborMatch>> results = new EnumMap<>(EmbeddingField.class);
    lookups.forEach(
        (field, lookup) -> {
          if (lookup.succeeded()) {
            results.put(field, lookup.result().orElse(List.of()));
          } else {
            log.warn("Index query for {} failed: {}", field, describe(lookup.failure()));
          }
        });
    return results;
  }

  /**
   * Applies each field's own threshold and merges by note id. Every candidate seen in a raw list
   * gets an entry, possibly empty, so candidates without surviving evidence fuse to the sentinel
   * score.
   */
  Map<Long, Map<EmbeddingField, Double>> collectEvidence(
      Map<EmbeddingField, List<NeighborMatch>> neighbors) {
    Map<Long, Map<EmbeddingField, Double>> evidence = new TreeMap<>();
    neighbors.forEach(
        (field, matches) -> {
          double threshold = properties.thresholdFor(field);
          int kept = 0;
          for (NeighborMatch match : matches) {
            Map<EmbeddingField, Double> perField =
                evidence.computeIfAbsent(
                    match.noteId(), id -> new EnumMap<>(EmbeddingField.class));
            if (match.distance() < threshold) {
              perField.merge(field, match.distance(), Math::min);
              kept++;
            }
          }
          log.debug("{}: {}/{} matches below threshold {}", field, kept, matches.size(), threshold);
        });
    return evidence;
  }

  private List<SearchResult> resolve(List<ScoreFusion.RankedCandidate> ranked) {
    List<SearchResult> results = new ArrayList<>(ranked.size());
    for (ScoreFusion.RankedCandidate candidate : ranked) {
      Optional<NoteRecord> note;
      try {
        note = index.get(candidate.noteId());
      } catch (RuntimeException e) {
        log.warn("Index read for note {} failed, skipping: {}", candidate.noteId(), describe(e));
        continue;
      }
      if (note.isEmpty()) {
        log.debug("Note {} disappeared before resolution, skipping", candidate.noteId());
        continue;
      }
      results.add(new SearchResult(note.get(), candidate.score()));
    }
    return results;
  }

  private static void joinOrCancel(TaskGroup group) {
    try {
      group.join();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new SearchCancelledException("Search cancelled", e);
    }
  }

  private static String describe(@Nullable Throwable failure) {
    if (failure == null) {
      return "unknown";
    }
    return failure.getClass().getSimpleName() + ": " + failure.getMessage();
  }
}
