package dev.papernotes.image;

import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Optional preparation of a note image before it is handed to the OCR engines: grayscale
 * conversion and a cap on the longer side. Disabled by default, in which case the image is
 * returned unchanged.
 */
@Component
public class OcrImagePreprocessor {

    private final boolean enabled;
    private final int maxSide;

    public OcrImagePreprocessor(@Value("${papernotes.ocr.preprocess:false}") boolean enabled,
                                @Value("${papernotes.ocr.max-side:1600}") int maxSide) {
        if (maxSide < 1) {
            throw new IllegalArgumentException("papernotes.ocr.max-side must be positive");
        }
        this.enabled = enabled;
        this.maxSide = maxSide;
    }

    public BufferedImage prepare(BufferedImage image) {
        if (!enabled) {
            return image;
        }
        int width = image.getWidth();
        int height = image.getHeight();
        double scale = Math.min(1.0, (double) maxSide / Math.max(width, height));
        int targetWidth = Math.max(1, (int) Math.round(width * scale));
        int targetHeight = Math.max(1, (int) Math.round(height * scale));
        return ImageResizing.scale(image, targetWidth, targetHeight,
                BufferedImage.TYPE_BYTE_GRAY, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
    }

    public boolean isEnabled() {
        return enabled;
    }
}
