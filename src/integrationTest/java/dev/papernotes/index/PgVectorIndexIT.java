package dev.papernotes.index;

import static dev.papernotes.note.EmbeddingField.CLIP;
import static dev.papernotes.note.EmbeddingField.OCR_TEXT_A;
import static dev.papernotes.note.EmbeddingField.VISUAL;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import dev.papernotes.BaseIntegrationTest;
import dev.papernotes.fixture.NoteRecordBuilder;
import dev.papernotes.fixture.TestVectors;
import dev.papernotes.note.EmbeddingField;
import dev.papernotes.note.NoteRecord;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

class PgVectorIndexIT extends BaseIntegrationTest {

  @Autowired VectorIndex index;

  @Test
  void upsertAssignsIdAndRoundTripsEveryColumn() {
    NoteRecord note =
        new NoteRecordBuilder()
            .title("Groceries")
            .collection("home")
            .allVectors(11)
            .ocrA("buy milk", 0.9f)
            .ocrB("buy mllk", 0.6f)
            .build();

    NoteRecord stored = index.upsert(note);

    assertThat(stored.id()).isNotNull();
    NoteRecord loaded = index.get(stored.id()).orElseThrow();
    assertThat(loaded.title()).isEqualTo("Groceries");
    assertThat(loaded.collection()).isEqualTo("home");
    assertThat(loaded.ocrA().text()).isEqualTo("buy milk");
    assertThat(loaded.ocrB().confidence()).isEqualTo(0.6f);
    assertThat(loaded.timestamp()).isEqualTo(note.timestamp());
    for (EmbeddingField field : EmbeddingField.values()) {
      assertThat(loaded.vector(field).embedding().orElseThrow().vector())
          .containsExactly(note.vector(field).embedding().orElseThrow().vector());
    }
  }

  @Test
  void absentFieldsAreStoredAsNullAndStayAbsent() {
    NoteRecord stored =
        index.upsert(new NoteRecordBuilder().vector(CLIP, TestVectors.axis(CLIP)).build());

    NoteRecord loaded = index.get(stored.id()).orElseThrow();

    assertThat(loaded.presentFields()).containsExactly(CLIP);
    assertThat(index.nearestNeighbors(VISUAL, TestVectors.axis(VISUAL), 10)).isEmpty();
  }

  @Test
  void upsertWithIdReplacesStoredRecordWholesale() {
    NoteRecord first = index.upsert(new NoteRecordBuilder().allVectors(5).ocrA("old", 0.4f).build());

    index.upsert(
        new NoteRecordBuilder()
            .id(first.id())
            .title("Rescanned")
            .vector(OCR_TEXT_A, TestVectors.axis(OCR_TEXT_A))
            .build());

    NoteRecord loaded = index.get(first.id()).orElseThrow();
    assertThat(loaded.title()).isEqualTo("Rescanned");
    assertThat(loaded.presentFields()).containsExactly(OCR_TEXT_A);
    assertThat(loaded.ocrA().text()).isEmpty();
    assertThat(index.count()).isEqualTo(1);
  }

  @Test
  void upsertWithDeletedIdInsertsUnderFreshId() {
    NoteRecord first = index.upsert(new NoteRecordBuilder().allVectors(3).build());
    index.delete(first.id());

    NoteRecord stored = index.upsert(new NoteRecordBuilder().id(first.id()).allVectors(3).build());

    assertThat(stored.id()).isGreaterThan(first.id());
    assertThat(index.get(first.id())).isEmpty();
    assertThat(index.get(stored.id()).orElseThrow().presentFields()).hasSize(5);
  }

  @Test
  void nearestNeighborsReturnsCosineDistancesAscending() {
    long far = index.upsert(noteWithClipAt(0.4)).id();
    long near = index.upsert(noteWithClipAt(0.02)).id();
    long mid = index.upsert(noteWithClipAt(0.15)).id();

    List<NeighborMatch> matches = index.nearestNeighbors(CLIP, TestVectors.axis(CLIP), 3);

    assertThat(matches).extracting(NeighborMatch::noteId).containsExactly(near, mid, far);
    assertThat(matches.get(0).distance()).isCloseTo(0.02, within(1e-4));
    assertThat(matches.get(2).distance()).isCloseTo(0.4, within(1e-4));
  }

  @Test
  void deleteRemovesRecord() {
    long id = index.upsert(new NoteRecordBuilder().build()).id();

    assertThat(index.delete(id)).isTrue();
    assertThat(index.get(id)).isEmpty();
    assertThat(index.delete(id)).isFalse();
  }

  private static NoteRecord noteWithClipAt(double distance) {
    return new NoteRecordBuilder().vector(CLIP, TestVectors.atDistance(CLIP, distance)).build();
  }
}
