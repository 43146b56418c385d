package dev.papernotes.api;

import dev.papernotes.gateway.EmbeddingGateway;
import dev.papernotes.index.VectorIndex;
import dev.papernotes.ingestion.IngestionRequest;
import dev.papernotes.ingestion.IngestionService;
import dev.papernotes.note.NoteRecord;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

import org.jspecify.annotations.Nullable;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

/**
 * Scans note images and reads stored notes.
 */
@RestController
@RequestMapping("/api")
public class NoteController {

    private final IngestionService ingestionService;
    private final VectorIndex index;
    private final EmbeddingGateway gateway;
    private final ImageUploadStore uploads;

    public NoteController(IngestionService ingestionService,
                          VectorIndex index,
                          EmbeddingGateway gateway,
                          ImageUploadStore uploads) {
        this.ingestionService = ingestionService;
        this.index = index;
        this.gateway = gateway;
        this.uploads = uploads;
    }

    /**
     * Stores the uploaded image and ingests it. With {@code noteId} the note is re-scanned in place.
     */
    @PostMapping(path = "/notes", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @ResponseStatus(HttpStatus.CREATED)
    public NoteView scan(@RequestParam("image") MultipartFile image,
                         @RequestParam(name = "noteId", required = false) @Nullable Long noteId,
                         @RequestParam(name = "collection", required = false) @Nullable String collection,
                         @RequestParam(name = "deadlineMs", required = false) @Nullable Long deadlineMs) {
        Path stored = uploads.storeNoteImage(image);
        try {
            NoteRecord note = ingestionService.ingest(
                    new IngestionRequest(stored, noteId, collection, toDeadline(deadlineMs)));
            return NoteView.from(note);
        } catch (RuntimeException e) {
            uploads.discard(stored);
            throw e;
        }
    }

    @GetMapping("/notes/{id}")
    public NoteView get(@PathVariable long id) {
        return index.get(id)
                .map(NoteView::from)
                .orElseThrow(() -> new NoteNotFoundException("Note " + id + " not found"));
    }

    /** Readiness of every model behind the embedding gateway. */
    @GetMapping("/embedders/status")
    public Map<String, Boolean> embeddersStatus() {
        return gateway.status();
    }

    static @Nullable Duration toDeadline(@Nullable Long deadlineMs) {
        if (deadlineMs == null) {
            return null;
        }
        if (deadlineMs <= 0) {
            throw new IllegalArgumentException("deadlineMs must be positive, got: " + deadlineMs);
        }
        return Duration.ofMillis(deadlineMs);
    }
}
