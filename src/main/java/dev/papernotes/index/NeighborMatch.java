package dev.papernotes.index;

/**
 * One approximate nearest-neighbour hit.
 *
 * @param noteId id of the matching note
 * @param distance cosine distance to the query vector (0 identical, 2 opposite)
 */
public record NeighborMatch(long noteId, double distance) {}
