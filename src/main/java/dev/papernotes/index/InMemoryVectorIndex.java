package dev.papernotes.index;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.store.embedding.CosineSimilarity;
import dev.papernotes.note.EmbeddingField;
import dev.papernotes.note.NoteRecord;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Brute-force {@link VectorIndex} held in memory. Exact search is a valid (if slow) answer to an
 * approximate query, which makes this index the reference for tests and single-node use.
 *
 * <p>Records are immutable and swapped whole in a {@link ConcurrentHashMap}, so each upsert is
 * atomic and searches run concurrently with writes.
 */
public class InMemoryVectorIndex implements VectorIndex {

  private final ConcurrentHashMap<Long, NoteRecord> notes = new ConcurrentHashMap<>();
  private final AtomicLong sequence = new AtomicLong();

  @Override
  public NoteRecord upsert(NoteRecord note) {
    if (note.id() != null) {
      NoteRecord replaced = notes.computeIfPresent(note.id(), (key, previous) -> note);
      if (replaced != null) {
        return replaced;
      }
    }
    long id = sequence.incrementAndGet();
    NoteRecord stored = note.withId(id);
    notes.put(id, stored);
    return stored;
  }

  @Override
  public List<NeighborMatch> nearestNeighbors(EmbeddingField field, Embedding query, int k) {
    if (query.dimension() != field.dimension()) {
      throw new IllegalArgumentException(
          field + " expects " + field.dimension() + " dims, query has " + query.dimension());
    }
    return notes.values().stream()
        .filter(note -> note.vector(field).isPresent())
        .map(
            note ->
                new NeighborMatch(
                    note.id(),
                    1.0 - CosineSimilarity.between(note.vector(field).embedding().get(), query)))
        .sorted(
            Comparator.comparingDouble(NeighborMatch::distance)
                .thenComparingLong(NeighborMatch::noteId))
        .limit(k)
        .toList();
  }

  @Override
  public Optional<NoteRecord> get(long id) {
    return Optional.ofNullable(notes.get(id));
  }

  @Override
  public long count() {
    return notes.size();
  }

  @Override
  public boolean delete(long id) {
    return notes.remove(id) != null;
  }
}
