package com.arccatalog.repository;

import com.arccatalog.model.Card;
import com.arccatalog.util.CatalogLogger;
import net.coobird.thumbnailator.Thumbnails;
import net.coobird.thumbnailator.tasks.UnsupportedFormatException;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Renders JPEG previews of card files and keeps them in the {@code thumbnail_cache} table.
 * Videos and formats ImageIO cannot read get a placeholder. Entries are evicted by the card delete cascade.
 */
public class PreviewCache {
    private static final String CONTEXT = "PreviewCache";
    public static final int DEFAULT_SIZE = 256;
    private static final double JPEG_QUALITY = 0.8;

    private final CatalogDatabaseManager db;
    private final Path logDirectory;
    private final int targetSize;

    public PreviewCache(CatalogDatabaseManager db, Path logDirectory) {
        this(db, logDirectory, DEFAULT_SIZE);
    }

    public PreviewCache(CatalogDatabaseManager db, Path logDirectory, int targetSize) {
        this.db = db;
        this.logDirectory = logDirectory;
        this.targetSize = targetSize;
    }

    public Optional<byte[]> get(String cardId) {
        return db.loadPreview(cardId);
    }

    /**
     * Returns the cached preview, rendering and storing it first if needed.
     */
    public byte[] getOrRender(Card card) {
        Optional<byte[]> cached = db.loadPreview(card.getId());
        if (cached.isPresent()) {
            return cached.get();
        }
        byte[] preview = render(card);
        db.savePreview(card.getId(), preview);
        return preview;
    }

    /**
     * Renders a preview without touching the cache. Never fails: unreadable files get a placeholder.
     */
    public byte[] render(Card card) {
        File file = new File(card.getFilePath());
        try {
            if (card.getType() == Card.MediaType.IMAGE && file.isFile()) {
                try {
                    return toJpeg(Thumbnails.of(file));
                } catch (UnsupportedFormatException e) {
                    CatalogLogger.logInfo(logDirectory, CONTEXT, "Unsupported image format: " + card.getFileName() + ". Using placeholder.");
                }
            } else if (card.getType() == Card.MediaType.IMAGE) {
                CatalogLogger.logWarning(logDirectory, CONTEXT, "Missing file for card " + card.getId() + ": " + file);
            }
            return toJpeg(Thumbnails.of(createPlaceholder(card.getType() == Card.MediaType.VIDEO)));
        } catch (IOException e) {
            CatalogLogger.logWarning(logDirectory, CONTEXT, "Could not render preview of card " + card.getId() + ": " + e.getMessage());
            return placeholderBytes(card.getType() == Card.MediaType.VIDEO);
        }
    }

    private byte[] placeholderBytes(boolean video) {
        try {
            return toJpeg(Thumbnails.of(createPlaceholder(video)));
        } catch (IOException e) {
            throw new IllegalStateException("Could not encode placeholder preview", e);
        }
    }

    private byte[] toJpeg(Thumbnails.Builder<?> builder) throws IOException {
        ByteArrayOutputStream baos = new ByteArrayOutputStream();
        builder.size(targetSize, targetSize)
                .outputFormat("jpg")
                .outputQuality(JPEG_QUALITY)
                .toOutputStream(baos);
        return baos.toByteArray();
    }

    private BufferedImage createPlaceholder(boolean video) {
        BufferedImage img = new BufferedImage(targetSize, targetSize, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = img.createGraphics();
        g.setColor(video ? Color.DARK_GRAY : Color.GRAY);
        g.fillRect(0, 0, targetSize, targetSize);
        g.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
        g.setColor(Color.WHITE);
        int third = targetSize / 3;
        if (video) {
            // Play triangle
            g.fillPolygon(new int[]{third, third, 2 * third}, new int[]{third, 2 * third, targetSize / 2}, 3);
        } else {
            g.drawRect(third, third, third, third);
        }
        g.dispose();
        return img;
    }
}
