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
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Scans the whole catalog for broken references, stale counters and missing media files.
 * The scan only reads; nothing is created or changed, not even the moodboard singleton.
 */
public class IntegrityValidator {
    private static final String CONTEXT = "IntegrityValidator";

    private final EntityStore store;
    private final FileExistenceChecker fileChecker;
    private final Path logDirectory;

    public IntegrityValidator(EntityStore store, FileExistenceChecker fileChecker, Path logDirectory) {
        this.store = store;
        this.fileChecker = fileChecker;
        this.logDirectory = logDirectory;
    }

    public IntegrityReport validate() {
        List<Card> cards = store.listCards();
        List<Tag> tags = store.listTags();
        List<Category> categories = store.listCategories();
        List<Collection> collections = store.listCollections();
        Moodboard moodboard = store.get(EntityKind.MOODBOARD, Moodboard.DEFAULT_ID, Moodboard.class).orElse(null);

        Set<String> cardIds = cards.stream().map(Card::getId).collect(Collectors.toSet());
        Set<String> tagIds = tags.stream().map(Tag::getId).collect(Collectors.toSet());
        Set<String> categoryIds = categories.stream().map(Category::getId).collect(Collectors.toSet());

        List<IntegrityIssue> issues = new ArrayList<>();
        checkFiles(cards, issues);
        checkTags(cards, tags, categoryIds, issues);
        checkCollections(collections, cardIds, issues);
        checkCategories(categories, tagIds, issues);
        checkMoodboard(cards, moodboard, cardIds, issues);
        CatalogLogger.flush(logDirectory);

        IntegrityReport report = new IntegrityReport(issues);
        CatalogLogger.logInfo(logDirectory, CONTEXT, "Validation finished: " + report);
        return report;
    }

    private void checkFiles(List<Card> cards, List<IntegrityIssue> issues) {
        for (Card card : cards) {
            try {
                if (!fileChecker.exists(card.getFilePath())) {
                    issues.add(IntegrityIssue.of(IssueType.MISSING_FILE, card.getId(),
                            String.format("File not found: \"%s\" (%s). Not repaired automatically: "
                                    + "restore the file from a backup or delete the card.", card.getFileName(), card.getFilePath())));
                }
            } catch (Exception e) {
                CatalogLogger.logRecurringError(logDirectory, CONTEXT, "File check failed for card " + card.getId(), e);
            }
        }
    }

    private void checkTags(List<Card> cards, List<Tag> tags, Set<String> categoryIds, List<IntegrityIssue> issues) {
        Map<String, Integer> references = EntityStore.countTagReferences(cards);
        for (Tag tag : tags) {
            int actual = references.getOrDefault(tag.getId(), 0);
            if (actual == 0 && tag.getCardCount() > 0) {
                issues.add(IntegrityIssue.of(IssueType.ORPHANED_TAG, tag.getId(),
                        String.format("Tag \"%s\" is not used by any card but has cardCount = %d. "
                                + "Repair resets the count to 0.", tag.getName(), tag.getCardCount())));
            } else if (actual > 0 && tag.getCardCount() != actual) {
                issues.add(IntegrityIssue.of(IssueType.STALE_TAG_COUNT, tag.getId(),
                        String.format("Tag \"%s\" is used by %d cards but has cardCount = %d. "
                                + "Repair sets the count to %d.", tag.getName(), actual, tag.getCardCount(), actual)));
            }

            if (tag.getCategoryId() != null && !categoryIds.contains(tag.getCategoryId())) {
                issues.add(IntegrityIssue.of(IssueType.ORPHANED_TAG_CATEGORY, tag.getId(),
                        String.format("Tag \"%s\" refers to a missing category. "
                                + "Repair deletes the tag and removes it from every card.", tag.getName())));
            }
        }
    }

    private void checkCollections(List<Collection> collections, Set<String> cardIds, List<IntegrityIssue> issues) {
        for (Collection collection : collections) {
            List<String> missing = unresolved(collection.getCardIds(), cardIds);
            if (!missing.isEmpty()) {
                issues.add(IntegrityIssue.ofList(IssueType.ORPHANED_COLLECTION, collection.getId(),
                        String.format("Collection \"%s\" contains %d missing cards (of %d). "
                                        + "Repair removes the dangling references.",
                                collection.getName(), missing.size(), collection.getCardIds().size()),
                        missing, collection.getCardIds().size()));
            }
        }
    }

    private void checkCategories(List<Category> categories, Set<String> tagIds, List<IntegrityIssue> issues) {
        for (Category category : categories) {
            List<String> missing = unresolved(category.getTagIds(), tagIds);
            if (!missing.isEmpty()) {
                issues.add(IntegrityIssue.ofList(IssueType.ORPHANED_CATEGORY, category.getId(),
                        String.format("Category \"%s\" contains %d missing tags (of %d). "
                                        + "Repair removes the dangling references.",
                                category.getName(), missing.size(), category.getTagIds().size()),
                        missing, category.getTagIds().size()));
            }
        }
    }

    private void checkMoodboard(List<Card> cards, Moodboard moodboard, Set<String> cardIds, List<IntegrityIssue> issues) {
        List<String> members = moodboard != null ? moodboard.getCardIds() : List.of();

        List<String> missing = unresolved(members, cardIds);
        if (!missing.isEmpty()) {
            issues.add(IntegrityIssue.ofList(IssueType.MOODBOARD_MISMATCH, Moodboard.DEFAULT_ID,
                    String.format("Moodboard contains %d missing cards (of %d). "
                            + "Repair removes the dangling references.", missing.size(), members.size()),
                    missing, members.size()));
        }

        Set<String> memberSet = new HashSet<>(members);
        for (Card card : cards) {
            boolean member = memberSet.contains(card.getId());
            if (card.isInMoodboard() != member) {
                issues.add(IntegrityIssue.of(IssueType.MOODBOARD_FLAG_MISMATCH, card.getId(),
                        String.format("Card \"%s\" is %s the moodboard but its flag says otherwise. "
                                + "Repair sets the flag to %s.", card.getFileName(), member ? "in" : "not in", member)));
            }
        }
    }

    private static List<String> unresolved(List<String> ids, Set<String> existing) {
        List<String> missing = new ArrayList<>();
        for (String id : ids) {
            if (!existing.contains(id)) {
                missing.add(id);
            }
        }
        return missing;
    }
}
