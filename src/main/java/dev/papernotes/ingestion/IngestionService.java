package dev.papernotes.ingestion;

import dev.langchain4j.data.embedding.Embedding;
import dev.papernotes.concurrent.TaskGroup;
import dev.papernotes.concurrent.TaskGroup.Subtask;
import dev.papernotes.gateway.EmbeddingGateway;
import dev.papernotes.gateway.ImageModelKind;
import dev.papernotes.gateway.OcrEngineKind;
import dev.papernotes.image.LoadedImage;
import dev.papernotes.image.NoteImageLoader;
import dev.papernotes.image.OcrImagePreprocessor;
import dev.papernotes.index.VectorIndex;
import dev.papernotes.note.EmbeddingField;
import dev.papernotes.note.FieldVector;
import dev.papernotes.note.NoteRecord;
import dev.papernotes.note.OcrReading;
import dev.papernotes.note.VectorChecks;
import dev.papernotes.progress.ProgressObserver;
import dev.papernotes.progress.ProgressReporter;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;

import java.awt.image.BufferedImage;
import java.time.Clock;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Orchestrates the ingestion pipeline: image -> five embeddings and two OCR readings -> one upsert.
 *
 * <p>The baseline visual, CLIP and visual-text embeddings and the two OCR chains (recognise, then
 * embed the text) are independent and run concurrently on the {@code embeddingExecutor}. Each is
 * best-effort: a failure leaves its field absent and is logged, it never fails the run. Only an
 * unreadable image is fatal, and then nothing is written.
 *
 * <p><strong>Write semantics:</strong> the record is assembled in full and written with a single
 * {@link VectorIndex#upsert}, after every forked task has finished. Re-scanning an existing id
 * recomputes and replaces every field; stale vectors are never merged with fresh ones.
 */
@Service
public class IngestionService {

    private static final Logger log = LoggerFactory.getLogger(IngestionService.class);

    static final String TITLE_PREFIX = "Note ";

    private final EmbeddingGateway gateway;
    private final VectorIndex index;
    private final NoteImageLoader imageLoader;
    private final OcrImagePreprocessor ocrPreprocessor;
    private final AsyncTaskExecutor executor;
    private final Clock clock;

    public IngestionService(EmbeddingGateway gateway,
                            VectorIndex index,
                            NoteImageLoader imageLoader,
                            OcrImagePreprocessor ocrPreprocessor,
                            @Qualifier("embeddingExecutor") AsyncTaskExecutor executor,
                            Clock clock) {
        this.gateway = gateway;
        this.index = index;
        this.imageLoader = imageLoader;
        this.ocrPreprocessor = ocrPreprocessor;
        this.executor = executor;
        this.clock = clock;
    }

    public NoteRecord ingest(IngestionRequest request) {
        return ingest(request, ProgressObserver.none());
    }

    /**
     * Scans one note image and persists the resulting record.
     *
     * @param request  image, optional id to re-scan and optional deadline
     * @param observer receives progress events; its failures are ignored
     * @return the stored record
     * @throws dev.papernotes.image.ImageLoadException if the image cannot be loaded
     * @throws IngestionCancelledException             if the calling thread is interrupted
     */
    public NoteRecord ingest(IngestionRequest request, ProgressObserver<IngestionStage> observer) {
        ProgressReporter<IngestionStage> progress = new ProgressReporter<>(observer);

        progress.report(IngestionStage.LOADING_IMAGE, 0.10f, "Loading image...");
        LoadedImage loaded = imageLoader.load(request.imagePath());
        BufferedImage image = loaded.image();
        progress.report(IngestionStage.LOADING_IMAGE, 0.15f, loadedMessage(loaded));

        Instant deadline = TaskGroup.deadlineFrom(clock, request.deadline());
        TaskGroup group = new TaskGroup(executor, clock, deadline);
        Map<ImageModelKind, Subtask<Embedding>> imageTasks = new EnumMap<>(ImageModelKind.class);
        Map<OcrEngineKind, Subtask<OcrOutcome>> ocrTasks = new EnumMap<>(OcrEngineKind.class);

        progress.report(IngestionStage.GENERATING_IMAGE_EMBEDDING, 0.20f,
                "Generating image embedding...");
        imageTasks.put(ImageModelKind.VISUAL, forkImage(group, image, ImageModelKind.VISUAL));

        progress.report(IngestionStage.GENERATING_VISUAL_EMBEDDINGS, 0.30f,
                "Generating CLIP and visual-text embeddings...");
        imageTasks.put(ImageModelKind.CLIP, forkImage(group, image, ImageModelKind.CLIP));
        imageTasks.put(ImageModelKind.VISUAL_TEXT, forkImage(group, image, ImageModelKind.VISUAL_TEXT));

        progress.report(IngestionStage.RUNNING_OCR, 0.40f, "Running both OCR engines...");
        BufferedImage ocrImage = ocrPreprocessor.prepare(image);
        for (OcrEngineKind engine : OcrEngineKind.values()) {
            ocrTasks.put(engine, group.fork("ocr-" + engine.key(), () -> ocrChain(ocrImage, engine)));
        }

        join(group);

        Map<EmbeddingField, FieldVector> vectors = new EnumMap<>(EmbeddingField.class);
        imageTasks.forEach((kind, task) -> vectors.put(kind.field(), collect(kind.field(), task)));

        Map<OcrEngineKind, OcrReading> readings = new EnumMap<>(OcrEngineKind.class);
        ocrTasks.forEach((engine, task) -> {
            OcrOutcome outcome = task.succeeded() ? task.result().orElse(null) : null;
            if (outcome == null) {
                log.warn("OCR engine {} failed: {}", engine, describe(task.failure()));
                readings.put(engine, OcrReading.EMPTY);
                vectors.put(engine.textField(), FieldVector.absent());
            } else {
                readings.put(engine, outcome.reading());
                vectors.put(engine.textField(), validated(engine.textField(), outcome.embedding()));
            }
        });
        long textEmbeddings = countTextEmbeddings(vectors);
        progress.report(IngestionStage.GENERATING_TEXT_EMBEDDING, 0.60f,
                "Generated " + textEmbeddings + " text embeddings");

        if (Thread.currentThread().isInterrupted()) {
            throw new IngestionCancelledException("Ingestion cancelled before saving",
                    new InterruptedException());
        }

        progress.report(IngestionStage.SAVING, 0.90f, "Saving note...");
        NoteRecord stored = index.upsert(assemble(request, vectors, readings));

        int active = stored.presentFields().size();
        int total = EmbeddingField.values().length;
        log.info("Note {} saved with {}/{} embeddings {}", stored.id(), active, total,
                stored.presentFields());
        progress.report(IngestionStage.COMPLETE, 1.0f,
                "Note saved with " + active + "/" + total + " embeddings");
        return stored;
    }

    private NoteRecord assemble(IngestionRequest request,
                                Map<EmbeddingField, FieldVector> vectors,
                                Map<OcrEngineKind, OcrReading> readings) {
        Optional<NoteRecord> existing = request.existingId() == null
                ? Optional.empty()
                : index.get(request.existingId());
        if (request.existingId() != null && existing.isEmpty()) {
            log.info("Note {} not found, creating a new note", request.existingId());
        }

        Instant now = clock.instant();
        Long id = existing.map(NoteRecord::id).orElse(null);
        String title = existing.map(NoteRecord::title).orElse(TITLE_PREFIX + now.toEpochMilli());
        String collection = request.collection() != null
                ? request.collection()
                : existing.map(NoteRecord::collection).orElse(null);

        return new NoteRecord(id, title, request.imagePath().toString(), collection, vectors,
                readings.get(OcrEngineKind.A), readings.get(OcrEngineKind.B), now);
    }

    private Subtask<Embedding> forkImage(TaskGroup group, BufferedImage image, ImageModelKind kind) {
        return group.fork(kind.key(), () -> gateway.embedImage(image, kind));
    }

    /**
     * Recognises text with one engine and embeds it. A failure to embed keeps the raw reading; blank
     * text is not embedded.
     */
    private OcrOutcome ocrChain(BufferedImage image, OcrEngineKind engine) {
        OcrReading reading = gateway.recognizeText(image, engine);
        log.debug("OCR {}: {} chars, confidence {}", engine, reading.text().length(),
                reading.confidence());
        if (!reading.hasText()) {
            log.debug("OCR {} returned no text, skipping text embedding", engine);
            return new OcrOutcome(reading, null);
        }
        try {
            return new OcrOutcome(reading, gateway.embedText(reading.text()));
        } catch (RuntimeException e) {
            log.warn("Text embedding for OCR {} failed: {}", engine, e.getMessage());
            return new OcrOutcome(reading, null);
        }
    }

    private FieldVector collect(EmbeddingField field, Subtask<Embedding> task) {
        if (!task.succeeded()) {
            log.warn("{} embedding failed: {}", field, describe(task.failure()));
            return FieldVector.absent();
        }
        return validated(field, task.result().orElse(null));
    }

    private FieldVector validated(EmbeddingField field, @Nullable Embedding embedding) {
        if (embedding == null) {
            return FieldVector.absent();
        }
        String violation = VectorChecks.violation(field, embedding);
        if (violation != null) {
            log.warn("{} embedding rejected: {}", field, violation);
            return FieldVector.absent();
        }
        return FieldVector.present(embedding);
    }

    private static void join(TaskGroup group) {
        try {
            group.join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IngestionCancelledException("Ingestion cancelled", e);
        }
    }

    private static long countTextEmbeddings(Map<EmbeddingField, FieldVector> vectors) {
        long count = 0;
        for (OcrEngineKind engine : OcrEngineKind.values()) {
            if (vectors.get(engine.textField()).isPresent()) {
                count++;
            }
        }
        return count;
    }

    private static String loadedMessage(LoadedImage loaded) {
        String size = "Image loaded: " + loaded.sourceWidth() + "x" + loaded.sourceHeight();
        return loaded.warnings().isEmpty() ? size : size + " (" + String.join(", ", loaded.warnings()) + ")";
    }

    private static String describe(@Nullable Throwable failure) {
        if (failure == null) {
            return "unknown";
        }
        return failure.getClass().getSimpleName() + ": " + failure.getMessage();
    }

    /** Output of one OCR chain: the raw reading and, when text was found and embedded, its vector. */
    private record OcrOutcome(OcrReading reading, @Nullable Embedding embedding) {}
}
