package dev.papernotes.search;

import dev.papernotes.note.NoteRecord;

/**
 * One ranked hit.
 *
 * @param note the matched note
 * @param score fused score with its per-field breakdown
 */
public record SearchResult(NoteRecord note, FusedScore score) {}
