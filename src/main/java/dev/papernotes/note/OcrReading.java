package dev.papernotes.note;

/**
 * Text recognised by one OCR engine together with the engine's confidence.
 *
 * @param text recognised text, possibly empty
 * @param confidence engine-reported confidence, 0 when nothing was recognised
 */
public record OcrReading(String text, float confidence) {

  public static final OcrReading EMPTY = new OcrReading("", 0f);

  public OcrReading {
    text = text == null ? "" : text;
  }

  public boolean hasText() {
    return !text.isBlank();
  }
}
