package com.arccatalog.service.integrity;

import com.arccatalog.model.Card;
import com.arccatalog.model.Category;
import com.arccatalog.model.Collection;
import com.arccatalog.model.EntityKind;
import com.arccatalog.model.Moodboard;
import com.arccatalog.model.Tag;
import com.arccatalog.repository.EntityStore;
import com.arccatalog.util.CatalogLogger;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Applies one fix per reported issue. Each fix re-reads the current state, so issues that were already
 * resolved, or whose record is gone, are skipped and not counted. A failing fix is logged and does not
 * stop the others. Missing files are never fixed.
 */
public class IntegrityRepairer {
    private static final String CONTEXT = "IntegrityRepairer";

    private final EntityStore store;
    private final Path logDirectory;

    public IntegrityRepairer(EntityStore store, Path logDirectory) {
        this.store = store;
        this.logDirectory = logDirectory;
    }

    /**
     * @return the number of issues actually fixed
     */
    public int repair(List<IntegrityIssue> issues) {
        // Tag deletions go first: they change card tags and category lists that later fixes read
        List<IntegrityIssue> ordered = new ArrayList<>(issues);
        ordered.sort(Comparator.comparing(i -> i.getType() == IssueType.ORPHANED_TAG_CATEGORY ? 0 : 1));

        int fixed = 0;
        for (IntegrityIssue issue : ordered) {
            try {
                if (fix(issue)) {
                    fixed++;
                }
            } catch (RuntimeException e) {
                CatalogLogger.logError(logDirectory, CONTEXT, "Failed to repair " + issue, e);
            }
        }
        CatalogLogger.logInfo(logDirectory, CONTEXT, "Repaired " + fixed + " of " + issues.size() + " issues");
        return fixed;
    }

    private boolean fix(IntegrityIssue issue) {
        switch (issue.getType()) {
            case ORPHANED_TAG:
            case STALE_TAG_COUNT:
                return fixTagCount(issue.getEntityId());
            case ORPHANED_TAG_CATEGORY:
                return fixTagCategory(issue.getEntityId());
            case ORPHANED_COLLECTION:
                return fixCollection(issue.getEntityId());
            case ORPHANED_CATEGORY:
                return fixCategory(issue.getEntityId());
            case MOODBOARD_MISMATCH:
                return fixMoodboard();
            case MOODBOARD_FLAG_MISMATCH:
                return fixMoodboardFlag(issue.getEntityId());
            case MISSING_FILE:
                CatalogLogger.logInfo(logDirectory, CONTEXT, "Skipped missing file of card " + issue.getEntityId() + " (manual action required)");
                return false;
            default:
                return false;
        }
    }

    private boolean fixTagCount(String tagId) {
        Optional<Tag> tag = store.getTag(tagId);
        if (tag.isEmpty()) {
            return false;
        }
        int actual = EntityStore.countTagReferences(store.listCards()).getOrDefault(tagId, 0);
        if (tag.get().getCardCount() == actual) {
            return false;
        }
        return store.update(EntityKind.TAG, tagId, Map.of("cardCount", actual)) > 0;
    }

    private boolean fixTagCategory(String tagId) {
        Optional<Tag> tag = store.getTag(tagId);
        if (tag.isEmpty() || tag.get().getCategoryId() == null || store.getCategory(tag.get().getCategoryId()).isPresent()) {
            return false;
        }
        store.deleteTag(tagId);
        // Drop the id from any other category that still lists it
        for (Category category : store.listCategories()) {
            if (category.getTagIds().contains(tagId)) {
                List<String> remaining = category.getTagIds().stream()
                        .filter(id -> !id.equals(tagId))
                        .collect(Collectors.toList());
                store.update(EntityKind.CATEGORY, category.getId(), Map.of("tagIds", remaining));
            }
        }
        return true;
    }

    private boolean fixCollection(String collectionId) {
        Optional<Collection> collection = store.getCollection(collectionId);
        if (collection.isEmpty()) {
            return false;
        }
        Set<String> cardIds = existingIds(store.listCards().stream().map(Card::getId));
        List<String> kept = keep(collection.get().getCardIds(), cardIds);
        if (kept.size() == collection.get().getCardIds().size()) {
            return false;
        }
        // dateModified is bumped by the store on collection updates
        return store.update(EntityKind.COLLECTION, collectionId, Map.of("cardIds", kept)) > 0;
    }

    private boolean fixCategory(String categoryId) {
        Optional<Category> category = store.getCategory(categoryId);
        if (category.isEmpty()) {
            return false;
        }
        Set<String> tagIds = existingIds(store.listTags().stream().map(Tag::getId));
        List<String> kept = keep(category.get().getTagIds(), tagIds);
        if (kept.size() == category.get().getTagIds().size()) {
            return false;
        }
        return store.update(EntityKind.CATEGORY, categoryId, Map.of("tagIds", kept)) > 0;
    }

    private boolean fixMoodboard() {
        Optional<Moodboard> moodboard = store.get(EntityKind.MOODBOARD, Moodboard.DEFAULT_ID, Moodboard.class);
        if (moodboard.isEmpty()) {
            return false;
        }
        Set<String> cardIds = existingIds(store.listCards().stream().map(Card::getId));
        List<String> kept = keep(moodboard.get().getCardIds(), cardIds);
        if (kept.size() == moodboard.get().getCardIds().size()) {
            return false;
        }
        Map<String, Object> changes = new HashMap<>();
        changes.put("cardIds", kept);
        changes.put("dateModified", LocalDateTime.now());
        return store.update(EntityKind.MOODBOARD, Moodboard.DEFAULT_ID, changes) > 0;
    }

    private boolean fixMoodboardFlag(String cardId) {
        Optional<Card> card = store.getCard(cardId);
        if (card.isEmpty()) {
            return false;
        }
        boolean member = store.get(EntityKind.MOODBOARD, Moodboard.DEFAULT_ID, Moodboard.class)
                .map(m -> m.getCardIds().contains(cardId))
                .orElse(false);
        if (card.get().isInMoodboard() == member) {
            return false;
        }
        return store.update(EntityKind.CARD, cardId, Map.of("inMoodboard", member)) > 0;
    }

    private static Set<String> existingIds(Stream<String> ids) {
        return ids.collect(Collectors.toSet());
    }

    private static List<String> keep(List<String> ids, Set<String> existing) {
        return ids.stream().filter(existing::contains).collect(Collectors.toList());
    }
}
