package dev.papernotes.image;

import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import javax.imageio.ImageIO;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Reads note images from disk and annotates suspicious dimensions.
 *
 * <p>Images whose longer side exceeds {@code papernotes.image.max-dimension} are downsampled by
 * powers of two until they fit. Size checks run on the original dimensions and never fail the
 * load.
 */
@Component
public class NoteImageLoader {

    private static final Logger log = LoggerFactory.getLogger(NoteImageLoader.class);

    static final int MIN_SIDE = 100;
    static final int LARGE_SIDE = 4000;
    static final String TOO_SMALL = "image too small (min 100x100)";
    static final String VERY_LARGE = "image very large (may be slow)";

    private final int maxDimension;

    public NoteImageLoader(@Value("${papernotes.image.max-dimension:2048}") int maxDimension) {
        if (maxDimension < MIN_SIDE) {
            throw new IllegalArgumentException("papernotes.image.max-dimension must be >= " + MIN_SIDE);
        }
        this.maxDimension = maxDimension;
    }

    /**
     * Loads and decodes an image file.
     *
     * @param path image location
     * @return decoded image with annotations
     * @throws ImageLoadException if the file is missing, unreadable or not a supported image format
     */
    public LoadedImage load(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new ImageLoadException("Image not found: " + path);
        }
        BufferedImage decoded;
        try {
            decoded = ImageIO.read(path.toFile());
        } catch (IOException e) {
            throw new ImageLoadException("Cannot read image " + path + ": " + e.getMessage(), e);
        }
        if (decoded == null) {
            throw new ImageLoadException("Unsupported or corrupt image: " + path);
        }

        int width = decoded.getWidth();
        int height = decoded.getHeight();
        List<String> warnings = new ArrayList<>();
        if (width < MIN_SIDE || height < MIN_SIDE) {
            warnings.add(TOO_SMALL);
        }
        if (width > LARGE_SIDE || height > LARGE_SIDE) {
            warnings.add(VERY_LARGE);
        }
        for (String warning : warnings) {
            log.warn("{}: {} ({}x{})", path.getFileName(), warning, width, height);
        }

        BufferedImage image = downsample(decoded);
        log.debug("Loaded {} {}x{} -> {}x{}", path.getFileName(), width, height,
                image.getWidth(), image.getHeight());
        return new LoadedImage(image, width, height, warnings);
    }

    private BufferedImage downsample(BufferedImage source) {
        int sampleSize = 1;
        while (Math.max(source.getWidth(), source.getHeight()) / sampleSize > maxDimension) {
            sampleSize *= 2;
        }
        if (sampleSize == 1) {
            return source;
        }
        return ImageResizing.scale(source,
                Math.max(1, source.getWidth() / sampleSize),
                Math.max(1, source.getHeight() / sampleSize),
                BufferedImage.TYPE_INT_RGB,
                RenderingHints.VALUE_INTERPOLATION_BILINEAR);
    }
}
