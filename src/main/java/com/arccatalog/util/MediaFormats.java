package com.arccatalog.util;

import com.arccatalog.model.Card;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.Optional;
import java.util.Set;

/**
 * Maps file extensions to card media types and builds new cards for files of the working directory.
 */
public class MediaFormats {

    private static final Set<String> IMAGE_EXTENSIONS = Set.of(
            "jpg", "jpeg", "png", "webp", "bmp", "gif", "tiff", "tif", "svg",
            "heic", "heif", "avif"
    );

    private static final Set<String> VIDEO_EXTENSIONS = Set.of("mp4", "mov", "avi", "mkv", "webm", "m4v", "flv", "wmv");

    public static Optional<Card.MediaType> detectType(String fileName) {
        String extension = FileUtils.getExtension(fileName);
        if (IMAGE_EXTENSIONS.contains(extension)) {
            return Optional.of(Card.MediaType.IMAGE);
        }
        if (VIDEO_EXTENSIONS.contains(extension)) {
            return Optional.of(Card.MediaType.VIDEO);
        }
        return Optional.empty();
    }

    public static boolean isSupported(String fileName) {
        return detectType(fileName).isPresent();
    }

    /**
     * Creates an unsaved card describing {@code file}.
     *
     * @throws IllegalArgumentException if the extension is not a supported image or video format
     */
    public static Card newCard(Path file) throws IOException {
        String fileName = file.getFileName().toString();
        Card.MediaType type = detectType(fileName)
                .orElseThrow(() -> new IllegalArgumentException("Unsupported media format: " + fileName));

        Card card = new Card(fileName, file.toAbsolutePath().toString(), type,
                FileUtils.getExtension(fileName), Files.size(file));
        card.setDateAdded(LocalDateTime.now());
        return card;
    }
}
