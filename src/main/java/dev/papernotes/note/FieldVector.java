package dev.papernotes.note;

import dev.langchain4j.data.embedding.Embedding;
import java.util.Arrays;
import java.util.Optional;
import org.jspecify.annotations.Nullable;

/**
 * Optional vector slot of a note: either {@link Present} with an embedding or {@link Absent},
 * meaning "not computed". Absence is never represented by a zero vector.
 */
public sealed interface FieldVector permits FieldVector.Present, FieldVector.Absent {

  static FieldVector present(Embedding embedding) {
    return new Present(embedding);
  }

  static FieldVector absent() {
    return Absent.INSTANCE;
  }

  static FieldVector ofNullable(@Nullable Embedding embedding) {
    return embedding == null ? absent() : present(embedding);
  }

  boolean isPresent();

  Optional<Embedding> embedding();

  /** A computed vector. Equality compares vector contents. */
  record Present(Embedding value) implements FieldVector {

    public Present {
      if (value == null) {
        throw new IllegalArgumentException("Present vector requires an embedding");
      }
    }

    @Override
    public boolean isPresent() {
      return true;
    }

    @Override
    public Optional<Embedding> embedding() {
      return Optional.of(value);
    }

    @Override
    public boolean equals(Object o) {
      return o instanceof Present other && Arrays.equals(value.vector(), other.value.vector());
    }

    @Override
    public int hashCode() {
      return Arrays.hashCode(value.vector());
    }

    @Override
    public String toString() {
      return "Present[dim=" + value.dimension() + "]";
    }
  }

  /** No vector was computed for this field. */
  final class Absent implements FieldVector {

    private static final Absent INSTANCE = new Absent();

    private Absent() {}

    @Override
    public boolean isPresent() {
      return false;
    }

    @Override
    public Optional<Embedding> embedding() {
      return Optional.empty();
    }

    @Override
    public String toString() {
      return "Absent";
    }
  }
}
