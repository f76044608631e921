package com.arccatalog.model;

/**
 * Aggregate counters shown on the settings page.
 */
public class CatalogStatistics {
    private final int totalCards;
    private final int imageCount;
    private final int videoCount;
    private final long totalSize;
    private final int tagCount;
    private final int categoryCount;
    private final int collectionCount;
    private final int moodboardCount;

    public CatalogStatistics(int totalCards, int imageCount, int videoCount, long totalSize,
                             int tagCount, int categoryCount, int collectionCount, int moodboardCount) {
        this.totalCards = totalCards;
        this.imageCount = imageCount;
        this.videoCount = videoCount;
        this.totalSize = totalSize;
        this.tagCount = tagCount;
        this.categoryCount = categoryCount;
        this.collectionCount = collectionCount;
        this.moodboardCount = moodboardCount;
    }

    public int getTotalCards() { return totalCards; }
    public int getImageCount() { return imageCount; }
    public int getVideoCount() { return videoCount; }
    public long getTotalSize() { return totalSize; }
    public int getTagCount() { return tagCount; }
    public int getCategoryCount() { return categoryCount; }
    public int getCollectionCount() { return collectionCount; }
    public int getMoodboardCount() { return moodboardCount; }
}
