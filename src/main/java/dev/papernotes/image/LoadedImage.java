package dev.papernotes.image;

import java.awt.image.BufferedImage;
import java.util.List;

/**
 * A decoded note image together with the non-fatal sanity annotations raised while loading it.
 *
 * @param image       decoded pixels, possibly downsampled
 * @param sourceWidth width of the file before downsampling
 * @param sourceHeight height of the file before downsampling
 * @param warnings    dimension annotations, empty when the image looks normal
 */
public record LoadedImage(BufferedImage image, int sourceWidth, int sourceHeight, List<String> warnings) {

    public LoadedImage {
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }
}
