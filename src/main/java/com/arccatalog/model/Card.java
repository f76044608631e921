package com.arccatalog.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDateTime;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Catalog record for one media file of the working directory.
 * Tags and collections are held as id sets; the referenced records live in their own tables.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class Card implements CatalogEntity {
    private String id;
    private String fileName;
    private String filePath;     // Absolute path inside the working directory
    private MediaType type;
    private String format;       // Lowercase extension, e.g. "jpg"
    private long fileSize;
    private Integer width;
    private Integer height;
    private Double duration;     // Seconds, videos only
    private LocalDateTime dateAdded;
    private LocalDateTime dateModified;
    private String thumbnailUrl; // Cached preview reference
    private Set<String> tags = new LinkedHashSet<>();
    private Set<String> collections = new LinkedHashSet<>();
    private boolean inMoodboard;
    private String description;

    public enum MediaType {
        @JsonProperty("image") IMAGE,
        @JsonProperty("video") VIDEO
    }

    public Card() {
    }

    public Card(String fileName, String filePath, MediaType type, String format, long fileSize) {
        this.fileName = fileName;
        this.filePath = filePath;
        this.type = type;
        this.format = format;
        this.fileSize = fileSize;
    }

    @Override
    public String getId() { return id; }
    @Override
    public void setId(String id) { this.id = id; }

    public String getFileName() { return fileName; }
    public void setFileName(String fileName) { this.fileName = fileName; }

    public String getFilePath() { return filePath; }
    public void setFilePath(String filePath) { this.filePath = filePath; }

    public MediaType getType() { return type; }
    public void setType(MediaType type) { this.type = type; }

    public String getFormat() { return format; }
    public void setFormat(String format) { this.format = format; }

    public long getFileSize() { return fileSize; }
    public void setFileSize(long fileSize) { this.fileSize = fileSize; }

    public Integer getWidth() { return width; }
    public void setWidth(Integer width) { this.width = width; }

    public Integer getHeight() { return height; }
    public void setHeight(Integer height) { this.height = height; }

    public Double getDuration() { return duration; }
    public void setDuration(Double duration) { this.duration = duration; }

    public LocalDateTime getDateAdded() { return dateAdded; }
    public void setDateAdded(LocalDateTime dateAdded) { this.dateAdded = dateAdded; }

    public LocalDateTime getDateModified() { return dateModified; }
    public void setDateModified(LocalDateTime dateModified) { this.dateModified = dateModified; }

    public String getThumbnailUrl() { return thumbnailUrl; }
    public void setThumbnailUrl(String thumbnailUrl) { this.thumbnailUrl = thumbnailUrl; }

    public Set<String> getTags() { return tags; }
    public void setTags(Set<String> tags) {
        this.tags = tags != null ? new LinkedHashSet<>(tags) : new LinkedHashSet<>();
    }

    public Set<String> getCollections() { return collections; }
    public void setCollections(Set<String> collections) {
        this.collections = collections != null ? new LinkedHashSet<>(collections) : new LinkedHashSet<>();
    }

    public boolean isInMoodboard() { return inMoodboard; }
    public void setInMoodboard(boolean inMoodboard) { this.inMoodboard = inMoodboard; }

    public String getDescription() { return description; }
    public void setDescription(String description) { this.description = description; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Card card = (Card) o;
        return fileSize == card.fileSize &&
                inMoodboard == card.inMoodboard &&
                Objects.equals(id, card.id) &&
                Objects.equals(fileName, card.fileName) &&
                Objects.equals(filePath, card.filePath) &&
                type == card.type &&
                Objects.equals(format, card.format) &&
                Objects.equals(width, card.width) &&
                Objects.equals(height, card.height) &&
                Objects.equals(duration, card.duration) &&
                Objects.equals(dateAdded, card.dateAdded) &&
                Objects.equals(dateModified, card.dateModified) &&
                Objects.equals(thumbnailUrl, card.thumbnailUrl) &&
                Objects.equals(tags, card.tags) &&
                Objects.equals(collections, card.collections) &&
                Objects.equals(description, card.description);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, fileName, filePath, type, format, fileSize, dateAdded, tags, collections, inMoodboard);
    }

    @Override
    public String toString() {
        return "Card{" +
                "id='" + id + '\'' +
                ", fileName='" + fileName + '\'' +
                ", type=" + type +
                '}';
    }
}
