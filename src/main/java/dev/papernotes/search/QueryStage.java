package dev.papernotes.search;

/** Progress stages of a query run. */
public enum QueryStage {
  LOADING_IMAGE,
  GENERATING_EMBEDDINGS,
  SEARCHING,
  FUSING,
  COMPLETE
}
