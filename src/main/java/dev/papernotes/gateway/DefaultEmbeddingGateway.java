package dev.papernotes.gateway;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.papernotes.note.OcrReading;
import java.awt.image.BufferedImage;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link EmbeddingGateway} backed by in-process models and OCR sidecars.
 *
 * <p>Image encoders and OCR engines are optional per kind: a kind without a configured backend
 * fails every call with {@link FieldDerivationException}, which pipelines record as an absent
 * field. Any runtime failure of a backend is wrapped the same way.
 */
public class DefaultEmbeddingGateway implements EmbeddingGateway, AutoCloseable {

  private static final Logger log = LoggerFactory.getLogger(DefaultEmbeddingGateway.class);

  private final Map<ImageModelKind, ImageEmbeddingModel> imageModels;
  private final Map<OcrEngineKind, OcrEngine> ocrEngines;
  private final EmbeddingModel textModel;

  public DefaultEmbeddingGateway(
      Map<ImageModelKind, ImageEmbeddingModel> imageModels,
      Map<OcrEngineKind, OcrEngine> ocrEngines,
      EmbeddingModel textModel) {
    this.imageModels =
        imageModels.isEmpty() ? new EnumMap<>(ImageModelKind.class) : new EnumMap<>(imageModels);
    this.ocrEngines =
        ocrEngines.isEmpty() ? new EnumMap<>(OcrEngineKind.class) : new EnumMap<>(ocrEngines);
    this.textModel = textModel;
  }

  @Override
  public Embedding embedImage(BufferedImage image, ImageModelKind kind) {
    ImageEmbeddingModel model = imageModels.get(kind);
    if (model == null || !model.isReady()) {
      throw new FieldDerivationException("Image model " + kind + " is not available");
    }
    try {
      Embedding embedding = model.embed(image);
      log.debug("{} embedding generated ({} dims)", kind, embedding.dimension());
      return embedding;
    } catch (FieldDerivationException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new FieldDerivationException(kind + " embedding failed: " + e.getMessage(), e);
    }
  }

  @Override
  public OcrReading recognizeText(BufferedImage image, OcrEngineKind engine) {
    OcrEngine ocr = ocrEngines.get(engine);
    if (ocr == null || !ocr.isReady()) {
      throw new FieldDerivationException("OCR engine " + engine + " is not available");
    }
    try {
      OcrReading reading = ocr.recognize(image);
      log.debug(
          "OCR {} recognised {} characters (confidence {})",
          engine,
          reading.text().length(),
          reading.confidence());
      return reading;
    } catch (FieldDerivationException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new FieldDerivationException("OCR " + engine + " failed: " + e.getMessage(), e);
    }
  }

  @Override
  public Embedding embedText(String text) {
    if (text == null || text.isBlank()) {
      throw new FieldDerivationException("Cannot embed blank text");
    }
    try {
      return Vectors.normalized(textModel.embed(text).content().vector());
    } catch (FieldDerivationException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new FieldDerivationException("Text embedding failed: " + e.getMessage(), e);
    }
  }

  @Override
  public Map<String, Boolean> status() {
    Map<String, Boolean> status = new LinkedHashMap<>();
    for (ImageModelKind kind : ImageModelKind.values()) {
      ImageEmbeddingModel model = imageModels.get(kind);
      status.put("image:" + kind.key(), model != null && model.isReady());
    }
    for (OcrEngineKind engine : OcrEngineKind.values()) {
      OcrEngine ocr = ocrEngines.get(engine);
      status.put("ocr:" + engine.key(), ocr != null && ocr.isReady());
    }
    status.put("text", true);
    return status;
  }

  /** Releases image models that hold native resources. */
  @Override
  public void close() {
    for (ImageEmbeddingModel model : imageModels.values()) {
      if (model instanceof AutoCloseable closeable) {
        try {
          closeable.close();
        } catch (Exception e) {
          log.warn("Failed to close image model: {}", e.getMessage());
        }
      }
    }
  }
}
