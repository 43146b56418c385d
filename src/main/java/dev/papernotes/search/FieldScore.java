package dev.papernotes.search;

import java.util.OptionalDouble;

/**
 * Per-field entry of a fused score breakdown: the field either matched with a distance below its
 * threshold or contributed no evidence.
 */
public sealed interface FieldScore permits FieldScore.Matched, FieldScore.Absent {

  static FieldScore matched(double distance) {
    return new Matched(distance);
  }

  static FieldScore absent() {
    return Absent.INSTANCE;
  }

  OptionalDouble distance();

  /** Evidence from this field. */
  record Matched(double value) implements FieldScore {
    @Override
    public OptionalDouble distance() {
      return OptionalDouble.of(value);
    }
  }

  /** No evidence from this field. */
  final class Absent implements FieldScore {

    private static final Absent INSTANCE = new Absent();

    private Absent() {}

    @Override
    public OptionalDouble distance() {
      return OptionalDouble.empty();
    }

    @Override
    public String toString() {
      return "Absent";
    }
  }
}
