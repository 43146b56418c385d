package dev.papernotes.api;

import dev.papernotes.note.EmbeddingField;
import dev.papernotes.search.SearchResult;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JSON view of one ranked match.
 *
 * @param note      matched note
 * @param score     fused distance, lower is closer
 * @param breakdown per-field distance, null where the field gave no evidence
 */
public record SearchHit(NoteView note, double score, Map<EmbeddingField, Double> breakdown) {

    public static SearchHit from(SearchResult result) {
        Map<EmbeddingField, Double> breakdown = new LinkedHashMap<>();
        result.score().breakdown().forEach((field, fieldScore) -> {
            var distance = fieldScore.distance();
            breakdown.put(field, distance.isPresent() ? distance.getAsDouble() : null);
        });
        return new SearchHit(NoteView.from(result.note()), result.score().score(), breakdown);
    }
}
