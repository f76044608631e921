package com.arccatalog.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Transient working set of cards. There is a single record, stored under {@link #DEFAULT_ID}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class Moodboard implements CatalogEntity {
    public static final String DEFAULT_ID = "default";

    private String id = DEFAULT_ID;
    private List<String> cardIds = new ArrayList<>();
    private LocalDateTime dateModified;

    public Moodboard() {
    }

    public static Moodboard empty() {
        Moodboard moodboard = new Moodboard();
        moodboard.setDateModified(LocalDateTime.now());
        return moodboard;
    }

    @Override
    public String getId() { return id; }
    @Override
    public void setId(String id) { this.id = id; }

    public List<String> getCardIds() { return cardIds; }
    public void setCardIds(List<String> cardIds) {
        this.cardIds = cardIds != null ? new ArrayList<>(cardIds) : new ArrayList<>();
    }

    public LocalDateTime getDateModified() { return dateModified; }
    public void setDateModified(LocalDateTime dateModified) { this.dateModified = dateModified; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Moodboard that = (Moodboard) o;
        return Objects.equals(id, that.id) &&
                Objects.equals(cardIds, that.cardIds) &&
                Objects.equals(dateModified, that.dateModified);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, cardIds);
    }
}
