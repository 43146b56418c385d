package dev.papernotes.ingestion;

import dev.papernotes.fixture.NoteRecordBuilder;
import dev.papernotes.fixture.TestImages;
import dev.papernotes.fixture.TestVectors;
import dev.papernotes.gateway.EmbeddingGateway;
import dev.papernotes.gateway.FieldDerivationException;
import dev.papernotes.gateway.ImageModelKind;
import dev.papernotes.gateway.OcrEngineKind;
import dev.papernotes.image.ImageLoadException;
import dev.papernotes.image.NoteImageLoader;
import dev.papernotes.image.OcrImagePreprocessor;
import dev.papernotes.index.InMemoryVectorIndex;
import dev.papernotes.note.EmbeddingField;
import dev.papernotes.note.FieldVector;
import dev.papernotes.note.NoteRecord;
import dev.papernotes.note.OcrReading;
import dev.papernotes.progress.ProgressEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.task.SimpleAsyncTaskExecutor;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;

import static dev.papernotes.note.EmbeddingField.CLIP;
import static dev.papernotes.note.EmbeddingField.OCR_TEXT_A;
import static dev.papernotes.note.EmbeddingField.OCR_TEXT_B;
import static dev.papernotes.note.EmbeddingField.VISUAL;
import static dev.papernotes.note.EmbeddingField.VISUAL_TEXT;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class IngestionServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    @Mock
    EmbeddingGateway gateway;

    @TempDir
    Path tempDir;

    InMemoryVectorIndex index;
    IngestionService ingestionService;
    Path noteImage;

    @BeforeEach
    void setUp() {
        index = new InMemoryVectorIndex();
        ingestionService = new IngestionService(
                gateway,
                index,
                new NoteImageLoader(2048),
                new OcrImagePreprocessor(false, 1600),
                new SimpleAsyncTaskExecutor("ingest-test-"),
                Clock.fixed(NOW, ZoneOffset.UTC));
        noteImage = TestImages.writePng(tempDir, "note.png", 640, 480);
    }

    private void stubHealthyGateway() {
        for (ImageModelKind kind : ImageModelKind.values()) {
            lenient().when(gateway.embedImage(any(), eq(kind))).thenReturn(TestVectors.axis(kind.field()));
        }
        lenient().when(gateway.recognizeText(any(), eq(OcrEngineKind.A)))
                .thenReturn(new OcrReading("buy milk", 0.92f));
        lenient().when(gateway.recognizeText(any(), eq(OcrEngineKind.B)))
                .thenReturn(new OcrReading("buy mllk", 0.71f));
        lenient().when(gateway.embedText(anyString())).thenReturn(TestVectors.axis(OCR_TEXT_A));
    }

    // --- Partial failure ---

    @Test
    void ocrEngineFailureLeavesOnlyThatFieldAbsent() {
        stubHealthyGateway();
        when(gateway.recognizeText(any(), eq(OcrEngineKind.B)))
                .thenThrow(new FieldDerivationException("handwriting engine offline"));

        NoteRecord stored = ingestionService.ingest(IngestionRequest.of(noteImage));

        assertThat(stored.presentFields()).containsExactlyInAnyOrder(VISUAL, CLIP, VISUAL_TEXT, OCR_TEXT_A);
        assertThat(stored.ocrA().text()).isEqualTo("buy milk");
        assertThat(stored.ocrB()).isEqualTo(OcrReading.EMPTY);
        assertThat(index.count()).isEqualTo(1);
    }

    @Test
    void everyFieldFailingStillPersistsRecord() {
        when(gateway.embedImage(any(), any())).thenThrow(new FieldDerivationException("no models"));
        when(gateway.recognizeText(any(), any())).thenThrow(new FieldDerivationException("no ocr"));

        NoteRecord stored = ingestionService.ingest(IngestionRequest.of(noteImage));

        assertThat(stored.presentFields()).isEmpty();
        assertThat(index.get(stored.id())).contains(stored);
    }

    @Test
    void blankOcrTextIsNotEmbedded() {
        stubHealthyGateway();
        when(gateway.recognizeText(any(), eq(OcrEngineKind.A))).thenReturn(new OcrReading("  ", 0.1f));
        when(gateway.recognizeText(any(), eq(OcrEngineKind.B))).thenReturn(OcrReading.EMPTY);

        NoteRecord stored = ingestionService.ingest(IngestionRequest.of(noteImage));

        assertThat(stored.presentFields()).doesNotContain(OCR_TEXT_A, OCR_TEXT_B);
        verify(gateway, never()).embedText(anyString());
    }

    @Test
    void textEmbeddingFailureKeepsRawOcrText() {
        stubHealthyGateway();
        when(gateway.embedText(anyString())).thenThrow(new FieldDerivationException("encoder crashed"));

        NoteRecord stored = ingestionService.ingest(IngestionRequest.of(noteImage));

        assertThat(stored.ocrA().text()).isEqualTo("buy milk");
        assertThat(stored.ocrB().text()).isEqualTo("buy mllk");
        assertThat(stored.presentFields()).containsExactlyInAnyOrder(VISUAL, CLIP, VISUAL_TEXT);
    }

    @Test
    void vectorOfWrongDimensionIsDropped() {
        stubHealthyGateway();
        when(gateway.embedImage(any(), eq(ImageModelKind.VISUAL_TEXT))).thenReturn(TestVectors.axis(CLIP));

        NoteRecord stored = ingestionService.ingest(IngestionRequest.of(noteImage));

        assertThat(stored.vector(VISUAL_TEXT).isPresent()).isFalse();
        assertThat(stored.vector(CLIP).isPresent()).isTrue();
    }

    @Test
    void slowModelPastDeadlineIsTreatedAsFailedField() {
        stubHealthyGateway();
        when(gateway.embedImage(any(), eq(ImageModelKind.CLIP))).thenAnswer(invocation -> {
            Thread.sleep(5_000);
            return TestVectors.axis(CLIP);
        });

        NoteRecord stored = ingestionService.ingest(
                new IngestionRequest(noteImage, null, null, Duration.ofMillis(300)));

        assertThat(stored.presentFields()).doesNotContain(CLIP).contains(VISUAL, OCR_TEXT_A);
        assertThat(index.count()).isEqualTo(1);
    }

    // --- Fatal failures ---

    @Test
    void unreadableImageFailsWithoutPersisting() {
        assertThatThrownBy(() -> ingestionService.ingest(IngestionRequest.of(tempDir.resolve("gone.png"))))
                .isInstanceOf(ImageLoadException.class);

        assertThat(index.count()).isZero();
        verify(gateway, never()).embedImage(any(), any());
    }

    @Test
    void interruptedCallerCancelsWithoutPersisting() {
        stubHealthyGateway();
        Thread.currentThread().interrupt();
        try {
            assertThatThrownBy(() -> ingestionService.ingest(IngestionRequest.of(noteImage)))
                    .isInstanceOf(IngestionCancelledException.class);
        } finally {
            Thread.interrupted();
        }

        assertThat(index.count()).isZero();
    }

    // --- Re-scan ---

    @Test
    void rescanKeepsIdTitleAndCollectionAndReplacesEveryField() {
        stubHealthyGateway();
        when(gateway.recognizeText(any(), eq(OcrEngineKind.B)))
                .thenThrow(new FieldDerivationException("handwriting engine offline"));
        long id = index.upsert(new NoteRecordBuilder()
                .title("Groceries")
                .collection("home")
                .allVectors(99)
                .ocrB("old text", 0.5f)
                .build()).id();

        NoteRecord stored = ingestionService.ingest(IngestionRequest.rescan(noteImage, id));

        assertThat(stored.id()).isEqualTo(id);
        assertThat(stored.title()).isEqualTo("Groceries");
        assertThat(stored.collection()).isEqualTo("home");
        assertThat(stored.vector(OCR_TEXT_B).isPresent()).isFalse();
        assertThat(stored.ocrB()).isEqualTo(OcrReading.EMPTY);
        assertThat(stored.vector(CLIP)).isEqualTo(FieldVector.present(TestVectors.axis(CLIP)));
        assertThat(stored.imagePath()).isEqualTo(noteImage.toString());
        assertThat(index.count()).isEqualTo(1);
    }

    @Test
    void rescanWithCollectionOverridesStoredLabel() {
        stubHealthyGateway();
        long id = index.upsert(new NoteRecordBuilder().collection("home").build()).id();

        NoteRecord stored = ingestionService.ingest(new IngestionRequest(noteImage, id, "work", null));

        assertThat(stored.collection()).isEqualTo("work");
    }

    @Test
    void unknownExistingIdCreatesNewNote() {
        stubHealthyGateway();

        NoteRecord stored = ingestionService.ingest(IngestionRequest.rescan(noteImage, 42L));

        assertThat(stored.id()).isNotNull();
        assertThat(stored.title()).isEqualTo(IngestionService.TITLE_PREFIX + NOW.toEpochMilli());
        assertThat(stored.timestamp()).isEqualTo(NOW);
        assertThat(index.count()).isEqualTo(1);
    }

    @Test
    void noteDeletedDuringRescanIsNotRecreatedUnderItsOldId() {
        stubHealthyGateway();
        InMemoryVectorIndex deletingIndex = new InMemoryVectorIndex() {
            @Override
            public Optional<NoteRecord> get(long id) {
                Optional<NoteRecord> found = super.get(id);
                delete(id);
                return found;
            }
        };
        long id = deletingIndex.upsert(new NoteRecordBuilder().title("Groceries").build()).id();
        IngestionService service = new IngestionService(
                gateway,
                deletingIndex,
                new NoteImageLoader(2048),
                new OcrImagePreprocessor(false, 1600),
                new SimpleAsyncTaskExecutor("ingest-test-"),
                Clock.fixed(NOW, ZoneOffset.UTC));

        NoteRecord stored = service.ingest(IngestionRequest.rescan(noteImage, id));

        assertThat(stored.id()).isNotEqualTo(id);
        assertThat(deletingIndex.count()).isEqualTo(1);
    }

    @Test
    void rescanningTwiceWithSameModelsIsIdempotent() {
        stubHealthyGateway();
        NoteRecord first = ingestionService.ingest(IngestionRequest.of(noteImage));

        NoteRecord second = ingestionService.ingest(IngestionRequest.rescan(noteImage, first.id()));
        NoteRecord third = ingestionService.ingest(IngestionRequest.rescan(noteImage, first.id()));

        assertThat(third).isEqualTo(second);
        assertThat(index.get(first.id())).contains(third);
        assertThat(index.count()).isEqualTo(1);
    }

    // --- Progress ---

    @Test
    void progressAdvancesThroughStagesInOrder() {
        stubHealthyGateway();
        List<ProgressEvent<IngestionStage>> events = new ArrayList<>();

        ingestionService.ingest(IngestionRequest.of(noteImage), events::add);

        for (int i = 1; i < events.size(); i++) {
            assertThat(events.get(i).fraction()).isGreaterThanOrEqualTo(events.get(i - 1).fraction());
        }
        assertThat(events).extracting(ProgressEvent::stage)
                .containsSubsequence(
                        IngestionStage.LOADING_IMAGE,
                        IngestionStage.GENERATING_IMAGE_EMBEDDING,
                        IngestionStage.GENERATING_VISUAL_EMBEDDINGS,
                        IngestionStage.RUNNING_OCR,
                        IngestionStage.GENERATING_TEXT_EMBEDDING,
                        IngestionStage.SAVING,
                        IngestionStage.COMPLETE);
        ProgressEvent<IngestionStage> last = events.get(events.size() - 1);
        assertThat(last.fraction()).isEqualTo(1.0f);
        assertThat(last.message()).isEqualTo("Note saved with 5/5 embeddings");
    }

    @Test
    void failingObserverDoesNotAffectOutcome() {
        stubHealthyGateway();

        NoteRecord stored = ingestionService.ingest(IngestionRequest.of(noteImage), event -> {
            throw new IllegalStateException("observer bug");
        });

        assertThat(stored.presentFields()).isEqualTo(EnumSet.allOf(EmbeddingField.class));
    }
}
