package com.arccatalog.repository;

import com.arccatalog.model.Card;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PreviewCacheTest {

    private static final int TARGET_SIZE = 64;

    @Mock
    private CatalogDatabaseManager db;

    @TempDir
    Path tempDir;

    private PreviewCache previewCache;

    @BeforeEach
    void setUp() {
        previewCache = new PreviewCache(db, tempDir.resolve("logs"), TARGET_SIZE);
    }

    @Test
    void testGetOrRender_CacheMiss_RendersAndStores() throws IOException {
        // Arrange
        File imageFile = tempDir.resolve("photo.png").toFile();
        createDummyImage(imageFile, 300, 150);
        Card card = card("photo.png", imageFile.getPath(), Card.MediaType.IMAGE);
        when(db.loadPreview("c1")).thenReturn(Optional.empty());

        // Act
        byte[] preview = previewCache.getOrRender(card);

        // Assert
        verify(db, times(1)).savePreview(eq("c1"), any(byte[].class));
        BufferedImage decoded = ImageIO.read(new ByteArrayInputStream(preview));
        assertNotNull(decoded, "Preview must be a readable JPEG");
        assertEquals(TARGET_SIZE, decoded.getWidth());
        assertEquals(TARGET_SIZE / 2, decoded.getHeight());
    }

    @Test
    void testGetOrRender_CacheHit_DoesNotRender() {
        Card card = card("photo.png", tempDir.resolve("missing.png").toString(), Card.MediaType.IMAGE);
        byte[] cached = {9, 9, 9};
        when(db.loadPreview("c1")).thenReturn(Optional.of(cached));

        assertArrayEquals(cached, previewCache.getOrRender(card));
        verify(db, never()).savePreview(anyString(), any(byte[].class));
    }

    @Test
    void testRender_VideoAndMissingFile_UsePlaceholder() throws IOException {
        Path video = tempDir.resolve("clip.mp4");
        Files.write(video, new byte[]{0, 1, 2});

        byte[] videoPreview = previewCache.render(card("clip.mp4", video.toString(), Card.MediaType.VIDEO));
        byte[] missingPreview = previewCache.render(card("gone.jpg", tempDir.resolve("gone.jpg").toString(), Card.MediaType.IMAGE));

        BufferedImage decoded = ImageIO.read(new ByteArrayInputStream(videoPreview));
        assertEquals(TARGET_SIZE, decoded.getWidth());
        assertNotNull(ImageIO.read(new ByteArrayInputStream(missingPreview)));
        verifyNoInteractions(db);
    }

    @Test
    void testRender_UnreadableImage_UsesPlaceholder() throws IOException {
        Path broken = tempDir.resolve("broken.jpg");
        Files.write(broken, "not an image".getBytes());

        byte[] preview = previewCache.render(card("broken.jpg", broken.toString(), Card.MediaType.IMAGE));

        assertNotNull(ImageIO.read(new ByteArrayInputStream(preview)));
    }

    private static Card card(String name, String path, Card.MediaType type) {
        Card card = new Card(name, path, type, "png", 1);
        card.setId("c1");
        return card;
    }

    private static void createDummyImage(File file, int width, int height) throws IOException {
        BufferedImage img = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        ImageIO.write(img, "png", file);
    }
}
