package dev.papernotes.gateway;

import dev.papernotes.note.OcrReading;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import javax.imageio.ImageIO;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Recover;
import org.springframework.retry.annotation.Retryable;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * OCR engine served by an HTTP sidecar. The page image is posted as PNG to {@code /ocr} and the
 * sidecar answers with the recognised text and an overall confidence.
 * Retries on transient {@link RestClientException} with exponential backoff.
 */
public class HttpOcrEngine implements OcrEngine {

    private static final Logger log = LoggerFactory.getLogger(HttpOcrEngine.class);

    private final OcrEngineKind engine;
    private final RestClient restClient;

    public HttpOcrEngine(OcrEngineKind engine, RestClient restClient) {
        this.engine = engine;
        this.restClient = restClient;
    }

    public OcrEngineKind kind() {
        return engine;
    }

    @Override
    @Retryable(
            retryFor = RestClientException.class,
            maxAttemptsExpression = "${papernotes.ocr.retry.max-attempts:3}",
            backoff = @Backoff(
                    delayExpression = "${papernotes.ocr.retry.delay-ms:200}",
                    multiplierExpression = "${papernotes.ocr.retry.multiplier:2.0}"
            )
    )
    public OcrReading recognize(BufferedImage image) {
        OcrResponse response = restClient.post()
                .uri("/ocr")
                .contentType(MediaType.IMAGE_PNG)
                .body(toPng(image))
                .retrieve()
                .body(OcrResponse.class);

        if (response == null) {
            throw new FieldDerivationException("OCR " + engine + " sidecar returned no body");
        }
        return new OcrReading(response.text(), response.confidence());
    }

    @Recover
    OcrReading recoverRecognize(RestClientException e, BufferedImage image) {
        log.warn("OCR {} request failed after retries: {}", engine, e.getMessage());
        throw new FieldDerivationException("OCR " + engine + " unavailable: " + e.getMessage(), e);
    }

    private byte[] toPng(BufferedImage image) {
        try (ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            if (!ImageIO.write(image, "png", out)) {
                throw new FieldDerivationException("No PNG writer available");
            }
            return out.toByteArray();
        } catch (IOException e) {
            throw new FieldDerivationException("Failed to encode image for OCR " + engine, e);
        }
    }

    /**
     * JSON body returned by the OCR sidecar.
     *
     * @param text       recognised page text
     * @param confidence overall confidence in [0, 1]
     */
    public record OcrResponse(String text, float confidence) {}
}
