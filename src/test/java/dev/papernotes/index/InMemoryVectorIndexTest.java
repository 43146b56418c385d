package dev.papernotes.index;

import static dev.papernotes.note.EmbeddingField.CLIP;
import static dev.papernotes.note.EmbeddingField.OCR_TEXT_A;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import dev.papernotes.fixture.NoteRecordBuilder;
import dev.papernotes.fixture.TestVectors;
import dev.papernotes.note.NoteRecord;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class InMemoryVectorIndexTest {

  private InMemoryVectorIndex index;

  @BeforeEach
  void setUp() {
    index = new InMemoryVectorIndex();
  }

  @Test
  void upsertAssignsFreshIds() {
    NoteRecord first = index.upsert(new NoteRecordBuilder().build());
    NoteRecord second = index.upsert(new NoteRecordBuilder().build());

    assertThat(first.id()).isNotNull();
    assertThat(second.id()).isNotEqualTo(first.id());
    assertThat(index.count()).isEqualTo(2);
  }

  @Test
  void idsAreNeverReusedAfterDelete() {
    NoteRecord first = index.upsert(new NoteRecordBuilder().build());
    index.delete(first.id());

    NoteRecord next = index.upsert(new NoteRecordBuilder().build());

    assertThat(next.id()).isGreaterThan(first.id());
  }

  @Test
  void upsertWithDeletedIdInsertsUnderFreshId() {
    NoteRecord original = index.upsert(new NoteRecordBuilder().title("Groceries").build());
    index.delete(original.id());

    NoteRecord stored = index.upsert(new NoteRecordBuilder().id(original.id()).title("Groceries").build());

    assertThat(stored.id()).isGreaterThan(original.id());
    assertThat(index.get(original.id())).isEmpty();
    assertThat(index.get(stored.id())).contains(stored);
  }

  @Test
  void upsertWithIdReplacesWholeRecord() {
    NoteRecord original =
        index.upsert(new NoteRecordBuilder().allVectors(1).ocrA("old", 0.4f).build());

    NoteRecord replacement =
        new NoteRecordBuilder().id(original.id()).vector(CLIP, TestVectors.axis(CLIP)).build();
    index.upsert(replacement);

    NoteRecord stored = index.get(original.id()).orElseThrow();
    assertThat(stored.presentFields()).containsExactly(CLIP);
    assertThat(stored.ocrA().text()).isEmpty();
    assertThat(index.count()).isEqualTo(1);
  }

  @Test
  void nearestNeighborsAreSortedByDistanceAndLimitedToK() {
    long far = index.upsert(noteWithClipAt(0.30)).id();
    long near = index.upsert(noteWithClipAt(0.05)).id();
    long mid = index.upsert(noteWithClipAt(0.15)).id();

    List<NeighborMatch> matches = index.nearestNeighbors(CLIP, TestVectors.axis(CLIP), 2);

    assertThat(matches).extracting(NeighborMatch::noteId).containsExactly(near, mid);
    assertThat(matches.get(0).distance()).isCloseTo(0.05, within(1e-5));
    assertThat(matches).extracting(NeighborMatch::noteId).doesNotContain(far);
  }

  @Test
  void notesWithoutTheFieldAreNeverReturned() {
    index.upsert(noteWithClipAt(0.05));

    assertThat(index.nearestNeighbors(OCR_TEXT_A, TestVectors.axis(OCR_TEXT_A), 10)).isEmpty();
  }

  @Test
  void equalDistancesAreOrderedById() {
    long a = index.upsert(noteWithClipAt(0.1)).id();
    long b = index.upsert(noteWithClipAt(0.1)).id();

    assertThat(index.nearestNeighbors(CLIP, TestVectors.axis(CLIP), 5))
        .extracting(NeighborMatch::noteId)
        .containsExactly(a, b);
  }

  @Test
  void queryOfWrongDimensionIsRejected() {
    assertThatThrownBy(() -> index.nearestNeighbors(CLIP, TestVectors.axis(OCR_TEXT_A), 5))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void getAndDeleteOfUnknownIdAreEmpty() {
    assertThat(index.get(404)).isEmpty();
    assertThat(index.delete(404)).isFalse();
  }

  private static NoteRecord noteWithClipAt(double distance) {
    return new NoteRecordBuilder().vector(CLIP, TestVectors.atDistance(CLIP, distance)).build();
  }
}
