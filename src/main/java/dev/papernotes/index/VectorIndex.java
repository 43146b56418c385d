package dev.papernotes.index;

import dev.langchain4j.data.embedding.Embedding;
import dev.papernotes.note.EmbeddingField;
import dev.papernotes.note.NoteRecord;
import java.util.List;
import java.util.Optional;

/**
 * Shared store of note records with one ANN-searchable vector column per {@link EmbeddingField}.
 *
 * <p>Implementations must allow concurrent reads and writes. Each {@link #upsert} is atomic for its
 * record: readers observe either the previous or the new version in full, never a mix.
 */
public interface VectorIndex {

  /**
   * Writes every field of {@code note} in one atomic operation, replacing any stored version.
   *
   * <p>A record whose id is no longer stored is inserted under a fresh id; deleted ids are never
   * brought back.
   *
   * @param note record to store; a null id requests a fresh, never reused id
   * @return the stored record with its id set
   */
  NoteRecord upsert(NoteRecord note);

  /**
   * Nearest neighbours of {@code query} within one field, ascending by cosine distance. Records
   * without a vector in that field are never returned.
   */
  List<NeighborMatch> nearestNeighbors(EmbeddingField field, Embedding query, int k);

  Optional<NoteRecord> get(long id);

  long count();

  /** Removes a record; used by the collaborators that own note deletion. */
  boolean delete(long id);
}
