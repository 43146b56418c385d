package dev.papernotes.config;

import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.embedding.onnx.allminilml6v2q.AllMiniLmL6V2QuantizedEmbeddingModel;
import dev.papernotes.gateway.DefaultEmbeddingGateway;
import dev.papernotes.gateway.HttpOcrEngine;
import dev.papernotes.gateway.ImageEmbeddingModel;
import dev.papernotes.gateway.ImageModelKind;
import dev.papernotes.gateway.ImageTensors;
import dev.papernotes.gateway.OcrEngine;
import dev.papernotes.gateway.OcrEngineKind;
import dev.papernotes.gateway.OnnxImageEmbeddingModel;
import java.awt.Color;
import java.util.EnumMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configures the text encoder and the {@link DefaultEmbeddingGateway}.
 *
 * <p>Text uses the ONNX all-MiniLM-L6-v2 quantized model (384 dimensions) running in-process.
 * Image encoders are ONNX files configured by path under {@code papernotes.models.<kind>.path};
 * a kind with a blank path is left out and its field is never computed.
 */
@Configuration
public class EmbeddingConfig {

    private static final Logger log = LoggerFactory.getLogger(EmbeddingConfig.class);

    private static final float[] IMAGENET_MEAN = {0.485f, 0.456f, 0.406f};
    private static final float[] IMAGENET_STD = {0.229f, 0.224f, 0.225f};
    private static final float[] CLIP_MEAN = {0.48145466f, 0.4578275f, 0.40821073f};
    private static final float[] CLIP_STD = {0.26862954f, 0.26130258f, 0.27577711f};
    private static final float[] HALF = {0.5f, 0.5f, 0.5f};

    /**
     * Provides the in-process ONNX text encoder (all-MiniLM-L6-v2 quantized, 384 dimensions).
     *
     * @return a ready-to-use embedding model requiring no external API
     */
    @Bean
    public EmbeddingModel textEmbeddingModel() {
        return new AllMiniLmL6V2QuantizedEmbeddingModel();
    }

    /**
     * Assembles the gateway from the configured image encoders, the OCR engines that have a
     * sidecar URL, and the text encoder.
     */
    @Bean(destroyMethod = "close")
    public DefaultEmbeddingGateway embeddingGateway(
            EmbeddingModel textEmbeddingModel,
            ObjectProvider<HttpOcrEngine> ocrEngines,
            @Value("${papernotes.models.visual.path:}") String visualPath,
            @Value("${papernotes.models.clip.path:}") String clipPath,
            @Value("${papernotes.models.visual-text.path:}") String visualTextPath) {
        Map<ImageModelKind, ImageEmbeddingModel> imageModels = new EnumMap<>(ImageModelKind.class);
        loadIfConfigured(imageModels, ImageModelKind.VISUAL, visualPath);
        loadIfConfigured(imageModels, ImageModelKind.CLIP, clipPath);
        loadIfConfigured(imageModels, ImageModelKind.VISUAL_TEXT, visualTextPath);

        Map<OcrEngineKind, OcrEngine> engines = new EnumMap<>(OcrEngineKind.class);
        ocrEngines.orderedStream().forEach(engine -> engines.put(engine.kind(), engine));
        log.info("Embedding gateway: image models {}, OCR engines {}",
                imageModels.keySet(), engines.keySet());

        return new DefaultEmbeddingGateway(imageModels, engines, textEmbeddingModel);
    }

    /** Preprocessing settings for each image encoder kind. */
    static OnnxImageEmbeddingModel.Settings settingsFor(ImageModelKind kind) {
        return switch (kind) {
            case VISUAL -> new OnnxImageEmbeddingModel.Settings(224, kind.field().dimension(),
                    IMAGENET_MEAN, IMAGENET_STD, Color.BLACK, ImageTensors.Pooling.FLAT);
            case CLIP -> new OnnxImageEmbeddingModel.Settings(224, kind.field().dimension(),
                    CLIP_MEAN, CLIP_STD, new Color(128, 128, 128), ImageTensors.Pooling.FLAT);
            case VISUAL_TEXT -> new OnnxImageEmbeddingModel.Settings(384, kind.field().dimension(),
                    HALF, HALF, Color.BLACK, ImageTensors.Pooling.CLS);
        };
    }

    private static void loadIfConfigured(Map<ImageModelKind, ImageEmbeddingModel> models,
                                         ImageModelKind kind, String path) {
        if (path == null || path.isBlank()) {
            log.warn("No model path for {} (papernotes.models.{}.path), field disabled",
                    kind, kind.key());
            return;
        }
        models.put(kind, OnnxImageEmbeddingModel.load(kind.key(), path, settingsFor(kind)));
    }
}
