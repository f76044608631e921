package com.arccatalog.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * Categorization label. Belongs to exactly one {@link Category}.
 * {@code cardCount} is a maintained counter of the cards referencing this tag; it is allowed to go
 * stale and is recomputed by the integrity repairer or {@code EntityStore#recalculateTagCounts()}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class Tag implements CatalogEntity {
    private String id;
    private String name;
    private String categoryId;
    private String color;
    private String description;
    private LocalDateTime dateCreated;
    private int cardCount;

    public Tag() {
    }

    public Tag(String name, String categoryId) {
        this.name = name;
        this.categoryId = categoryId;
    }

    @Override
    public String getId() { return id; }
    @Override
    public void setId(String id) { this.id = id; }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public String getCategoryId() { return categoryId; }
    public void setCategoryId(String categoryId) { this.categoryId = categoryId; }

    public String getColor() { return color; }
    public void setColor(String color) { this.color = color; }

    public String getDescription() { return description; }
    public void setDescription(String description) { this.description = description; }

    public LocalDateTime getDateCreated() { return dateCreated; }
    public void setDateCreated(LocalDateTime dateCreated) { this.dateCreated = dateCreated; }

    public int getCardCount() { return cardCount; }
    public void setCardCount(int cardCount) { this.cardCount = cardCount; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Tag tag = (Tag) o;
        return cardCount == tag.cardCount &&
                Objects.equals(id, tag.id) &&
                Objects.equals(name, tag.name) &&
                Objects.equals(categoryId, tag.categoryId) &&
                Objects.equals(color, tag.color) &&
                Objects.equals(description, tag.description) &&
                Objects.equals(dateCreated, tag.dateCreated);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, categoryId, cardCount);
    }

    @Override
    public String toString() {
        return "Tag{id='" + id + "', name='" + name + "', cardCount=" + cardCount + '}';
    }
}
