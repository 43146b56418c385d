package dev.papernotes;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

import dev.langchain4j.data.embedding.Embedding;
import dev.papernotes.fixture.TestImages;
import dev.papernotes.fixture.TestVectors;
import dev.papernotes.gateway.EmbeddingGateway;
import dev.papernotes.gateway.FieldDerivationException;
import dev.papernotes.gateway.ImageModelKind;
import dev.papernotes.gateway.OcrEngineKind;
import dev.papernotes.ingestion.IngestionRequest;
import dev.papernotes.ingestion.IngestionService;
import dev.papernotes.note.EmbeddingField;
import dev.papernotes.note.NoteRecord;
import dev.papernotes.note.OcrReading;
import dev.papernotes.search.SearchRequest;
import dev.papernotes.search.SearchResult;
import dev.papernotes.search.SearchService;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.test.context.bean.override.mockito.MockitoBean;

/** Ingest then query through the real executor and pgvector index, with a scripted gateway. */
class NotePipelineIT extends BaseIntegrationTest {

  @MockitoBean EmbeddingGateway gateway;

  @Autowired IngestionService ingestionService;

  @Autowired SearchService searchService;

  @TempDir Path tempDir;

  /** Scripts the gateway so every field returns a vector at {@code distance} from its axis. */
  private void scriptGateway(double distance) {
    for (ImageModelKind kind : ImageModelKind.values()) {
      when(gateway.embedImage(any(), eq(kind))).thenReturn(vectorAt(kind.field(), distance));
    }
    when(gateway.recognizeText(any(), any())).thenReturn(new OcrReading("call mum", 0.9f));
    when(gateway.embedText(anyString())).thenReturn(vectorAt(EmbeddingField.OCR_TEXT_A, distance));
  }

  private static Embedding vectorAt(EmbeddingField field, double distance) {
    return distance == 0.0 ? TestVectors.axis(field) : TestVectors.atDistance(field, distance);
  }

  @Test
  void closeNoteIsFoundAndDistantNoteIsExcluded() {
    Path image = TestImages.writePng(tempDir, "note.png", 300, 300);
    scriptGateway(0.05);
    NoteRecord close = ingestionService.ingest(IngestionRequest.of(image));
    scriptGateway(0.6);
    NoteRecord distant = ingestionService.ingest(IngestionRequest.of(image));

    scriptGateway(0.0);
    List<SearchResult> results = searchService.search(SearchRequest.of(image));

    assertThat(results).extracting(r -> r.note().id()).containsExactly(close.id());
    assertThat(results.get(0).score().score()).isLessThan(0.2);
    assertThat(results).extracting(r -> r.note().id()).doesNotContain(distant.id());
  }

  @Test
  void partialOcrFailureStillPersistsRemainingFields() {
    Path image = TestImages.writePng(tempDir, "note.png", 300, 300);
    scriptGateway(0.0);
    when(gateway.recognizeText(any(), eq(OcrEngineKind.B)))
        .thenThrow(new FieldDerivationException("engine B down"));

    NoteRecord stored = ingestionService.ingest(IngestionRequest.of(image));

    assertThat(stored.presentFields())
        .containsExactlyInAnyOrder(
            EmbeddingField.VISUAL,
            EmbeddingField.CLIP,
            EmbeddingField.VISUAL_TEXT,
            EmbeddingField.OCR_TEXT_A);
    assertThat(jdbcTemplate.queryForObject(
            "SELECT count(*) FROM notes WHERE ocr_text_b_embedding IS NULL", Long.class))
        .isEqualTo(1L);
  }

  @Test
  void rescanKeepsTheSameRow() {
    Path image = TestImages.writePng(tempDir, "note.png", 300, 300);
    scriptGateway(0.1);
    NoteRecord first = ingestionService.ingest(IngestionRequest.of(image));

    scriptGateway(0.0);
    NoteRecord rescanned = ingestionService.ingest(IngestionRequest.rescan(image, first.id()));

    assertThat(rescanned.id()).isEqualTo(first.id());
    assertThat(rescanned.title()).isEqualTo(first.title());
    assertThat(jdbcTemplate.queryForObject("SELECT count(*) FROM notes", Long.class)).isEqualTo(1L);
  }
}
