package com.arccatalog.repository;

import com.arccatalog.model.Card;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Card filter: optional media type, a conjunctive set of tag ids and an optional moodboard restriction.
 * An empty search matches every card.
 */
public class CardSearch {
    private Card.MediaType type;
    private final Set<String> tagIds = new LinkedHashSet<>();
    private boolean onlyInMoodboard;

    public static CardSearch all() {
        return new CardSearch();
    }

    public CardSearch ofType(Card.MediaType type) {
        this.type = type;
        return this;
    }

    public CardSearch withTag(String tagId) {
        this.tagIds.add(tagId);
        return this;
    }

    public CardSearch withTags(Set<String> tagIds) {
        this.tagIds.addAll(tagIds);
        return this;
    }

    public CardSearch inMoodboard() {
        this.onlyInMoodboard = true;
        return this;
    }

    public Card.MediaType getType() { return type; }
    public Set<String> getTagIds() { return Collections.unmodifiableSet(tagIds); }
    public boolean isOnlyInMoodboard() { return onlyInMoodboard; }

    /**
     * @param moodboardCardIds Current moodboard membership, consulted only for moodboard-restricted searches
     */
    public boolean matches(Card card, Set<String> moodboardCardIds) {
        if (type != null && card.getType() != type) {
            return false;
        }
        if (!card.getTags().containsAll(tagIds)) {
            return false;
        }
        return !onlyInMoodboard || moodboardCardIds.contains(card.getId());
    }

    @Override
    public String toString() {
        return "CardSearch{type=" + type + ", tagIds=" + tagIds + ", onlyInMoodboard=" + onlyInMoodboard + '}';
    }
}
