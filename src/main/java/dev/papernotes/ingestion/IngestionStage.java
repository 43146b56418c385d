package dev.papernotes.ingestion;

/** Progress stages of an ingestion run, in emission order. */
public enum IngestionStage {
    LOADING_IMAGE,
    GENERATING_IMAGE_EMBEDDING,
    GENERATING_VISUAL_EMBEDDINGS,
    RUNNING_OCR,
    GENERATING_TEXT_EMBEDDING,
    SAVING,
    COMPLETE
}
