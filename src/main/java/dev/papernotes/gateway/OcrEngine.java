package dev.papernotes.gateway;

import dev.papernotes.note.OcrReading;
import java.awt.image.BufferedImage;

/** A text recogniser returning the full page text and an overall confidence. */
public interface OcrEngine {

  OcrReading recognize(BufferedImage image);

  default boolean isReady() {
    return true;
  }
}
