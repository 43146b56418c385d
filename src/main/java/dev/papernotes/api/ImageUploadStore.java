package dev.papernotes.api;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Locale;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.multipart.MultipartFile;

/**
 * Writes uploaded images below {@code papernotes.storage.image-dir}. Note images are kept under
 * {@code notes/} because the stored record points at them; query images go to {@code queries/}
 * and are deleted by the caller once the query has run.
 */
@Component
public class ImageUploadStore {

    private static final Logger log = LoggerFactory.getLogger(ImageUploadStore.class);

    private final Path root;

    public ImageUploadStore(@Value("${papernotes.storage.image-dir:data/images}") String imageDir) {
        this.root = Path.of(imageDir).toAbsolutePath().normalize();
    }

    public Path storeNoteImage(MultipartFile file) {
        return store(file, "notes");
    }

    public Path storeQueryImage(MultipartFile file) {
        return store(file, "queries");
    }

    /** Deletes a stored query image; failures are logged only. */
    public void discard(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.warn("Could not delete temporary image {}: {}", path, e.getMessage());
        }
    }

    private Path store(MultipartFile file, String subDir) {
        if (file == null || file.isEmpty()) {
            throw new IllegalArgumentException("Image upload is empty");
        }
        Path dir = root.resolve(subDir);
        Path target = dir.resolve(UUID.randomUUID() + extension(file.getOriginalFilename()));
        try (InputStream in = file.getInputStream()) {
            Files.createDirectories(dir);
            Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to store upload " + file.getOriginalFilename(), e);
        }
        log.debug("Stored upload {} ({} bytes) at {}", file.getOriginalFilename(), file.getSize(), target);
        return target;
    }

    static String extension(String originalFilename) {
        String ext = StringUtils.getFilenameExtension(originalFilename);
        if (ext == null || !ext.matches("[A-Za-z0-9]{1,5}")) {
            return ".img";
        }
        return "." + ext.toLowerCase(Locale.ROOT);
    }
}
