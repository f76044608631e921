package com.arccatalog.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Whole-catalog export: one array of records per entity kind.
 * This is the payload written to {@code _database/arc_database.json} inside a backup archive.
 * Unknown top-level keys (settings, history tables of older exports) are ignored on read.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class CatalogSnapshot {
    public static final String CURRENT_VERSION = "1.0";

    private String version = CURRENT_VERSION;
    private LocalDateTime exportDate;
    private List<Card> cards = new ArrayList<>();
    private List<Tag> tags = new ArrayList<>();
    private List<Category> categories = new ArrayList<>();
    private List<Collection> collections = new ArrayList<>();
    private List<Moodboard> moodboard = new ArrayList<>();

    public String getVersion() { return version; }
    public void setVersion(String version) { this.version = version; }

    public LocalDateTime getExportDate() { return exportDate; }
    public void setExportDate(LocalDateTime exportDate) { this.exportDate = exportDate; }

    public List<Card> getCards() { return cards; }
    public void setCards(List<Card> cards) { this.cards = cards != null ? cards : new ArrayList<>(); }

    public List<Tag> getTags() { return tags; }
    public void setTags(List<Tag> tags) { this.tags = tags != null ? tags : new ArrayList<>(); }

    public List<Category> getCategories() { return categories; }
    public void setCategories(List<Category> categories) {
        this.categories = categories != null ? categories : new ArrayList<>();
    }

    public List<Collection> getCollections() { return collections; }
    public void setCollections(List<Collection> collections) {
        this.collections = collections != null ? collections : new ArrayList<>();
    }

    public List<Moodboard> getMoodboard() { return moodboard; }
    public void setMoodboard(List<Moodboard> moodboard) {
        this.moodboard = moodboard != null ? moodboard : new ArrayList<>();
    }

    /**
     * Compares the entity graph only; version and export date are ignored.
     */
    public boolean sameGraphAs(CatalogSnapshot other) {
        return other != null &&
                Objects.equals(cards, other.cards) &&
                Objects.equals(tags, other.tags) &&
                Objects.equals(categories, other.categories) &&
                Objects.equals(collections, other.collections) &&
                Objects.equals(moodboard, other.moodboard);
    }
}
