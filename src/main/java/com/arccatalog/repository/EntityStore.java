package com.arccatalog.repository;

import com.arccatalog.model.*;
import com.arccatalog.model.Collection;
import com.arccatalog.util.CatalogLogger;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.LocalDateTime;
import java.util.*;
import java.util.function.Predicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Owns the canonical catalog records and applies the cascade rules that keep cards, tags,
 * categories, collections and the moodboard consistent with each other.
 * <p>
 * Every cascading mutation is a {@link CascadePlan} run in one transaction. Tag card counts are
 * maintained on card creation and tag edits only; {@link #recalculateTagCounts()} brings them back in line.
 */
public class EntityStore {
    private static final String CONTEXT = "EntityStore";

    private static final Pattern DATED_PATH = Pattern.compile("(\\d{4}[\\\\/]\\d{2}[\\\\/]\\d{2}[\\\\/].+)$");
    private static final Pattern THUMB_PATH = Pattern.compile("(_cache[\\\\/]thumbs[\\\\/].+)$");

    private final CatalogDatabaseManager db;
    private final ObjectMapper mapper;
    private final Path logDirectory;

    public EntityStore(CatalogDatabaseManager db, Path logDirectory) {
        this.db = db;
        this.mapper = db.getMapper();
        this.logDirectory = logDirectory;

        if (db.isTagRecountRequired()) {
            int changed = recalculateTagCounts();
            db.setTagRecountRequired(false);
            CatalogLogger.logInfo(logDirectory, CONTEXT, "Recounted tags after schema upgrade, " + changed + " changed");
        }
    }

    // ========== Generic access ==========

    /**
     * Stores a new record. Assigns a UUID when the record has none and stamps creation dates.
     * A new card increments the card count of every referenced tag that exists; a new tag is
     * appended to its category's tag list.
     *
     * @return the record id
     * @throws DatabaseException if a record with the same id already exists
     */
    public String create(CatalogEntity entity) {
        EntityKind kind = EntityKind.of(entity);
        if (entity.getId() == null || entity.getId().isBlank()) {
            entity.setId(UUID.randomUUID().toString());
        }
        stampCreation(entity);

        CascadePlan plan = CascadePlan.named("create " + kind.name().toLowerCase() + " " + entity.getId())
                .step("insert record", conn -> db.insert(conn, kind, entity));

        if (entity instanceof Card) {
            Card card = (Card) entity;
            plan.step("increment tag counts", conn -> adjustTagCounts(conn, card.getTags(), 1));
        } else if (entity instanceof Tag) {
            Tag tag = (Tag) entity;
            plan.step("register tag in category", conn -> {
                Optional<Category> category = db.find(conn, EntityKind.CATEGORY, tag.getCategoryId(), Category.class);
                if (category.isPresent() && !category.get().getTagIds().contains(tag.getId())) {
                    category.get().getTagIds().add(tag.getId());
                    db.upsert(conn, EntityKind.CATEGORY, category.get());
                }
            });
        }
        plan.execute(db);
        return entity.getId();
    }

    /**
     * @throws IllegalArgumentException if {@code type} is not the record class of {@code kind}
     */
    public <T extends CatalogEntity> Optional<T> get(EntityKind kind, String id, Class<T> type) {
        requireRecordClass(kind, type);
        return db.read("Get " + kind.getTableName() + " " + id, conn -> db.find(conn, kind, id, type));
    }

    public <T extends CatalogEntity> List<T> list(EntityKind kind, Class<T> type) {
        requireRecordClass(kind, type);
        return db.read("List " + kind.getTableName(), conn -> db.findAll(conn, kind, type));
    }

    public <T extends CatalogEntity> List<T> list(EntityKind kind, Class<T> type, Predicate<? super T> filter) {
        return list(kind, type).stream().filter(filter).collect(Collectors.toList());
    }

    private static void requireRecordClass(EntityKind kind, Class<?> type) {
        if (!kind.getEntityClass().equals(type)) {
            throw new IllegalArgumentException(kind + " records are " + kind.getEntityClass().getSimpleName()
                    + ", not " + type.getSimpleName());
        }
    }

    public Optional<Card> getCard(String id) { return get(EntityKind.CARD, id, Card.class); }
    public Optional<Tag> getTag(String id) { return get(EntityKind.TAG, id, Tag.class); }
    public Optional<Category> getCategory(String id) { return get(EntityKind.CATEGORY, id, Category.class); }
    public Optional<Collection> getCollection(String id) { return get(EntityKind.COLLECTION, id, Collection.class); }

    public List<Card> listCards() { return list(EntityKind.CARD, Card.class); }
    public List<Tag> listTags() { return list(EntityKind.TAG, Tag.class); }
    public List<Category> listCategories() { return list(EntityKind.CATEGORY, Category.class); }
    public List<Collection> listCollections() { return list(EntityKind.COLLECTION, Collection.class); }

    /**
     * Merges {@code changes} (field name to new value) onto the stored record. Fields not named keep
     * their value; the id cannot be changed. Card tag changes adjust tag card counts; collection
     * updates bump {@code dateModified}.
     *
     * @return 1 if the record was updated, 0 if no record has this id
     * @throws IllegalArgumentException if a value does not fit the field it is assigned to
     */
    public int update(EntityKind kind, String id, Map<String, ?> changes) {
        return db.inTransaction("Update " + kind.getTableName() + " " + id, conn -> {
            Optional<? extends CatalogEntity> existing = db.find(conn, kind, id, kind.getEntityClass());
            if (existing.isEmpty()) {
                return 0;
            }
            CatalogEntity updated = merge(existing.get(), changes);

            CascadePlan plan = CascadePlan.named("update " + kind.name().toLowerCase() + " " + id);
            if (updated instanceof Card && changes.containsKey("tags")) {
                Set<String> before = ((Card) existing.get()).getTags();
                Set<String> after = ((Card) updated).getTags();
                Set<String> added = new LinkedHashSet<>(after);
                added.removeAll(before);
                Set<String> removed = new LinkedHashSet<>(before);
                removed.removeAll(after);
                plan.step("increment counts of added tags", c -> adjustTagCounts(c, added, 1));
                plan.step("decrement counts of removed tags", c -> adjustTagCounts(c, removed, -1));
            } else if (updated instanceof Collection) {
                ((Collection) updated).setDateModified(LocalDateTime.now());
            }
            plan.step("write record", c -> db.upsert(c, kind, updated));
            plan.executeOn(conn);
            return 1;
        });
    }

    /**
     * Deletes a record with its cascade. Deleting the moodboard clears it.
     */
    public void delete(EntityKind kind, String id) {
        switch (kind) {
            case CARD:
                deleteCard(id);
                break;
            case TAG:
                deleteTag(id);
                break;
            case CATEGORY:
                deleteCategory(id);
                break;
            case COLLECTION:
                deleteCollection(id);
                break;
            case MOODBOARD:
                clearMoodboard();
                break;
            default:
                throw new IllegalArgumentException("Unsupported kind: " + kind);
        }
    }

    // ========== Cascading deletes ==========

    /**
     * Removes the card, its collection and moodboard memberships and its cached preview.
     * Tag card counts are left as they are.
     */
    public void deleteCard(String id) {
        deleteCardPlan(id).execute(db);
    }

    CascadePlan deleteCardPlan(String id) {
        return CascadePlan.named("deleteCard " + id)
                .step("remove card record", conn -> db.deleteRow(conn, EntityKind.CARD, id))
                .step("remove card from collections", conn -> {
                    for (Collection collection : db.findAll(conn, EntityKind.COLLECTION, Collection.class)) {
                        if (collection.getCardIds().removeIf(id::equals)) {
                            collection.setDateModified(LocalDateTime.now());
                            db.upsert(conn, EntityKind.COLLECTION, collection);
                        }
                    }
                })
                .step("remove card from moodboard", conn -> {
                    Optional<Moodboard> moodboard = db.find(conn, EntityKind.MOODBOARD, Moodboard.DEFAULT_ID, Moodboard.class);
                    if (moodboard.isPresent() && moodboard.get().getCardIds().removeIf(id::equals)) {
                        moodboard.get().setDateModified(LocalDateTime.now());
                        db.upsert(conn, EntityKind.MOODBOARD, moodboard.get());
                    }
                })
                .step("evict cached preview", conn -> db.deletePreview(conn, id));
    }

    /**
     * Removes the tag and strips it from every card. The owning category's tag list is not touched.
     */
    public void deleteTag(String id) {
        deleteTagPlan(id).execute(db);
    }

    CascadePlan deleteTagPlan(String id) {
        return CascadePlan.named("deleteTag " + id)
                .step("remove tag record", conn -> db.deleteRow(conn, EntityKind.TAG, id))
                .step("remove tag from cards", conn -> {
                    for (Card card : db.findAll(conn, EntityKind.CARD, Card.class)) {
                        if (card.getTags().remove(id)) {
                            db.upsert(conn, EntityKind.CARD, card);
                        }
                    }
                });
    }

    /**
     * Deletes every tag listed by the category (each with the tag cascade), then the category.
     */
    public void deleteCategory(String id) {
        CascadePlan.named("deleteCategory " + id)
                .step("delete tags of category", conn -> {
                    Optional<Category> category = db.find(conn, EntityKind.CATEGORY, id, Category.class);
                    if (category.isPresent()) {
                        for (String tagId : category.get().getTagIds()) {
                            deleteTagPlan(tagId).executeOn(conn);
                        }
                    }
                })
                .step("remove category record", conn -> db.deleteRow(conn, EntityKind.CATEGORY, id))
                .execute(db);
    }

    /**
     * Removes the collection and strips it from every card.
     */
    public void deleteCollection(String id) {
        CascadePlan.named("deleteCollection " + id)
                .step("remove collection record", conn -> db.deleteRow(conn, EntityKind.COLLECTION, id))
                .step("remove collection from cards", conn -> {
                    for (Card card : db.findAll(conn, EntityKind.CARD, Card.class)) {
                        if (card.getCollections().remove(id)) {
                            db.upsert(conn, EntityKind.CARD, card);
                        }
                    }
                })
                .execute(db);
    }

    // ========== Moodboard ==========

    /**
     * Returns the moodboard, creating the empty singleton on first access.
     */
    public Moodboard getMoodboard() {
        return db.inTransaction("Get moodboard", this::loadOrCreateMoodboard);
    }

    private Moodboard loadOrCreateMoodboard(Connection conn) throws SQLException {
        Optional<Moodboard> existing = db.find(conn, EntityKind.MOODBOARD, Moodboard.DEFAULT_ID, Moodboard.class);
        if (existing.isPresent()) {
            return existing.get();
        }
        Moodboard moodboard = Moodboard.empty();
        db.insert(conn, EntityKind.MOODBOARD, moodboard);
        return moodboard;
    }

    /**
     * Adds a card to the moodboard and sets its flag. Unknown cards and existing members are ignored.
     */
    public void addToMoodboard(String cardId) {
        CascadePlan.named("addToMoodboard " + cardId)
                .step("append card to moodboard", conn -> {
                    Optional<Card> card = db.find(conn, EntityKind.CARD, cardId, Card.class);
                    if (card.isEmpty()) {
                        return;
                    }
                    Moodboard moodboard = loadOrCreateMoodboard(conn);
                    if (!moodboard.getCardIds().contains(cardId)) {
                        moodboard.getCardIds().add(cardId);
                        moodboard.setDateModified(LocalDateTime.now());
                        db.upsert(conn, EntityKind.MOODBOARD, moodboard);
                    }
                })
                .step("set card flag", conn -> setMoodboardFlag(conn, cardId, true))
                .execute(db);
    }

    public void removeFromMoodboard(String cardId) {
        CascadePlan.named("removeFromMoodboard " + cardId)
                .step("remove card from moodboard", conn -> {
                    Moodboard moodboard = loadOrCreateMoodboard(conn);
                    moodboard.getCardIds().removeIf(cardId::equals);
                    moodboard.setDateModified(LocalDateTime.now());
                    db.upsert(conn, EntityKind.MOODBOARD, moodboard);
                })
                .step("clear card flag", conn -> setMoodboardFlag(conn, cardId, false))
                .execute(db);
    }

    /**
     * Resets the flag of every member card, then empties the moodboard.
     */
    public void clearMoodboard() {
        CascadePlan.named("clearMoodboard")
                .step("clear card flags", conn -> {
                    Moodboard moodboard = loadOrCreateMoodboard(conn);
                    for (String cardId : moodboard.getCardIds()) {
                        setMoodboardFlag(conn, cardId, false);
                    }
                })
                .step("empty moodboard", conn -> {
                    Moodboard moodboard = loadOrCreateMoodboard(conn);
                    moodboard.setCardIds(new ArrayList<>());
                    moodboard.setDateModified(LocalDateTime.now());
                    db.upsert(conn, EntityKind.MOODBOARD, moodboard);
                })
                .execute(db);
    }

    private void setMoodboardFlag(Connection conn, String cardId, boolean value) throws SQLException {
        Optional<Card> card = db.find(conn, EntityKind.CARD, cardId, Card.class);
        if (card.isPresent() && card.get().isInMoodboard() != value) {
            card.get().setInMoodboard(value);
            db.upsert(conn, EntityKind.CARD, card.get());
        }
    }

    // ========== Queries ==========

    public List<Card> searchCards(CardSearch search) {
        return db.read("Search cards", conn -> {
            Set<String> moodboardIds = Collections.emptySet();
            if (search.isOnlyInMoodboard()) {
                Optional<Moodboard> moodboard = db.find(conn, EntityKind.MOODBOARD, Moodboard.DEFAULT_ID, Moodboard.class);
                if (moodboard.isPresent()) {
                    moodboardIds = new HashSet<>(moodboard.get().getCardIds());
                }
            }
            List<Card> result = new ArrayList<>();
            for (Card card : db.findAll(conn, EntityKind.CARD, Card.class)) {
                if (search.matches(card, moodboardIds)) {
                    result.add(card);
                }
            }
            return result;
        });
    }

    /**
     * Cards sharing at least {@code minMatches} tags with the given card, most shared tags first.
     */
    public List<Card> findSimilarCards(String cardId, int minMatches) {
        Optional<Card> current = getCard(cardId);
        if (current.isEmpty() || current.get().getTags().isEmpty()) {
            return Collections.emptyList();
        }
        Set<String> tags = current.get().getTags();
        Map<Card, Long> matches = new LinkedHashMap<>();
        for (Card card : listCards()) {
            if (card.getId().equals(cardId)) {
                continue;
            }
            long matchCount = card.getTags().stream().filter(tags::contains).count();
            if (matchCount >= minMatches) {
                matches.put(card, matchCount);
            }
        }
        return matches.entrySet().stream()
                .sorted(Map.Entry.<Card, Long>comparingByValue().reversed())
                .map(Map.Entry::getKey)
                .collect(Collectors.toList());
    }

    public CatalogStatistics getStatistics() {
        return db.read("Compute statistics", conn -> {
            List<Card> cards = db.findAll(conn, EntityKind.CARD, Card.class);
            int images = 0;
            int videos = 0;
            long totalSize = 0;
            for (Card card : cards) {
                if (card.getType() == Card.MediaType.IMAGE) {
                    images++;
                } else if (card.getType() == Card.MediaType.VIDEO) {
                    videos++;
                }
                totalSize += card.getFileSize();
            }
            int moodboardCount = db.find(conn, EntityKind.MOODBOARD, Moodboard.DEFAULT_ID, Moodboard.class)
                    .map(m -> m.getCardIds().size())
                    .orElse(0);
            return new CatalogStatistics(
                    cards.size(), images, videos, totalSize,
                    db.findAll(conn, EntityKind.TAG, Tag.class).size(),
                    db.findAll(conn, EntityKind.CATEGORY, Category.class).size(),
                    db.findAll(conn, EntityKind.COLLECTION, Collection.class).size(),
                    moodboardCount);
        });
    }

    // ========== Linked edits ==========

    /**
     * Rewrites the card's collection set and keeps each affected collection's card list in sync.
     * Collection ids that do not resolve are dropped.
     *
     * @return false if the card does not exist
     */
    public boolean updateCardCollections(String cardId, Set<String> collectionIds) {
        return db.inTransaction("Update collections of card " + cardId, conn -> {
            Optional<Card> card = db.find(conn, EntityKind.CARD, cardId, Card.class);
            if (card.isEmpty()) {
                return false;
            }
            Set<String> target = new LinkedHashSet<>();
            for (String collectionId : collectionIds) {
                if (db.exists(conn, EntityKind.COLLECTION, collectionId)) {
                    target.add(collectionId);
                }
            }

            CascadePlan.named("updateCardCollections " + cardId)
                    .step("sync collection card lists", c -> {
                        for (Collection collection : db.findAll(c, EntityKind.COLLECTION, Collection.class)) {
                            boolean member = collection.getCardIds().contains(cardId);
                            boolean wanted = target.contains(collection.getId());
                            if (wanted && !member) {
                                collection.getCardIds().add(cardId);
                            } else if (!wanted && member) {
                                collection.getCardIds().removeIf(cardId::equals);
                            } else {
                                continue;
                            }
                            collection.setDateModified(LocalDateTime.now());
                            db.upsert(c, EntityKind.COLLECTION, collection);
                        }
                    })
                    .step("write card collections", c -> {
                        card.get().setCollections(target);
                        db.upsert(c, EntityKind.CARD, card.get());
                    })
                    .executeOn(conn);
            return true;
        });
    }

    /**
     * Moves a tag to another category, updating both categories' tag lists.
     *
     * @throws IllegalArgumentException if the tag or the target category does not exist
     */
    public void moveTagToCategory(String tagId, String categoryId) {
        db.inTransaction("Move tag " + tagId, conn -> {
            Tag tag = db.find(conn, EntityKind.TAG, tagId, Tag.class)
                    .orElseThrow(() -> new IllegalArgumentException("Unknown tag: " + tagId));
            Category target = db.find(conn, EntityKind.CATEGORY, categoryId, Category.class)
                    .orElseThrow(() -> new IllegalArgumentException("Unknown category: " + categoryId));

            CascadePlan.named("moveTagToCategory " + tagId)
                    .step("remove tag from old category", c -> {
                        if (Objects.equals(tag.getCategoryId(), categoryId)) {
                            return;
                        }
                        Optional<Category> old = db.find(c, EntityKind.CATEGORY, tag.getCategoryId(), Category.class);
                        if (old.isPresent() && old.get().getTagIds().removeIf(tagId::equals)) {
                            db.upsert(c, EntityKind.CATEGORY, old.get());
                        }
                    })
                    .step("append tag to new category", c -> {
                        if (!target.getTagIds().contains(tagId)) {
                            target.getTagIds().add(tagId);
                            db.upsert(c, EntityKind.CATEGORY, target);
                        }
                    })
                    .step("write tag category", c -> {
                        tag.setCategoryId(categoryId);
                        db.upsert(c, EntityKind.TAG, tag);
                    })
                    .executeOn(conn);
            return null;
        });
    }

    /**
     * Sets every tag's card count to the number of cards referencing it.
     *
     * @return the number of tags whose count changed
     */
    public int recalculateTagCounts() {
        return db.inTransaction("Recalculate tag counts", conn -> {
            Map<String, Integer> actual = countTagReferences(db.findAll(conn, EntityKind.CARD, Card.class));
            int changed = 0;
            for (Tag tag : db.findAll(conn, EntityKind.TAG, Tag.class)) {
                int count = actual.getOrDefault(tag.getId(), 0);
                if (tag.getCardCount() != count) {
                    tag.setCardCount(count);
                    db.upsert(conn, EntityKind.TAG, tag);
                    changed++;
                }
            }
            return changed;
        });
    }

    /**
     * Number of cards referencing each tag id.
     */
    public static Map<String, Integer> countTagReferences(List<Card> cards) {
        Map<String, Integer> counts = new HashMap<>();
        for (Card card : cards) {
            for (String tagId : card.getTags()) {
                counts.merge(tagId, 1, Integer::sum);
            }
        }
        return counts;
    }

    // ========== Snapshot export / import ==========

    public CatalogSnapshot exportSnapshot() {
        return db.read("Export snapshot", conn -> {
            CatalogSnapshot snapshot = new CatalogSnapshot();
            snapshot.setExportDate(LocalDateTime.now());
            snapshot.setCards(db.findAll(conn, EntityKind.CARD, Card.class));
            snapshot.setTags(db.findAll(conn, EntityKind.TAG, Tag.class));
            snapshot.setCategories(db.findAll(conn, EntityKind.CATEGORY, Category.class));
            snapshot.setCollections(db.findAll(conn, EntityKind.COLLECTION, Collection.class));
            snapshot.setMoodboard(db.findAll(conn, EntityKind.MOODBOARD, Moodboard.class));
            return snapshot;
        });
    }

    public void importSnapshot(CatalogSnapshot snapshot) {
        importSnapshot(snapshot, null);
    }

    /**
     * Replaces the whole catalog with the snapshot content. The cached previews are dropped.
     *
     * @param newWorkingDirectory When not null, card file and preview paths are rebased onto this directory
     */
    public void importSnapshot(CatalogSnapshot snapshot, Path newWorkingDirectory) {
        if (newWorkingDirectory != null) {
            for (Card card : snapshot.getCards()) {
                card.setFilePath(rebase(card.getFilePath(), DATED_PATH, newWorkingDirectory));
                card.setThumbnailUrl(rebase(card.getThumbnailUrl(), THUMB_PATH, newWorkingDirectory));
            }
        }

        CascadePlan plan = CascadePlan.named("importSnapshot");
        for (EntityKind kind : EntityKind.values()) {
            plan.step("clear " + kind.getTableName(), conn -> db.clear(conn, kind));
        }
        plan.step("clear preview cache", db::clearPreviews)
                .step("insert cards", conn -> db.upsertAll(conn, EntityKind.CARD, snapshot.getCards()))
                .step("insert tags", conn -> db.upsertAll(conn, EntityKind.TAG, snapshot.getTags()))
                .step("insert categories", conn -> db.upsertAll(conn, EntityKind.CATEGORY, snapshot.getCategories()))
                .step("insert collections", conn -> db.upsertAll(conn, EntityKind.COLLECTION, snapshot.getCollections()))
                .step("insert moodboard", conn -> db.upsertAll(conn, EntityKind.MOODBOARD, snapshot.getMoodboard()))
                .execute(db);

        CatalogLogger.logInfo(logDirectory, CONTEXT, String.format("Imported snapshot: %d cards, %d tags, %d collections",
                snapshot.getCards().size(), snapshot.getTags().size(), snapshot.getCollections().size()));
    }

    static String rebase(String path, Pattern suffixPattern, Path newWorkingDirectory) {
        if (path == null || path.startsWith("data:")) {
            return path;
        }
        Matcher matcher = suffixPattern.matcher(path);
        if (!matcher.find()) {
            return path;
        }
        String relative = matcher.group(1).replace('\\', '/');
        return newWorkingDirectory.resolve(relative).toString();
    }

    // ========== Internals ==========

    private void adjustTagCounts(Connection conn, Set<String> tagIds, int delta) throws SQLException {
        for (String tagId : tagIds) {
            Optional<Tag> tag = db.find(conn, EntityKind.TAG, tagId, Tag.class);
            if (tag.isPresent()) {
                tag.get().setCardCount(Math.max(0, tag.get().getCardCount() + delta));
                db.upsert(conn, EntityKind.TAG, tag.get());
            }
        }
    }

    private void stampCreation(CatalogEntity entity) {
        LocalDateTime now = LocalDateTime.now();
        if (entity instanceof Card) {
            Card card = (Card) entity;
            if (card.getDateAdded() == null) card.setDateAdded(now);
            if (card.getDateModified() == null) card.setDateModified(now);
        } else if (entity instanceof Tag) {
            Tag tag = (Tag) entity;
            if (tag.getDateCreated() == null) tag.setDateCreated(now);
        } else if (entity instanceof Category) {
            Category category = (Category) entity;
            if (category.getDateCreated() == null) category.setDateCreated(now);
        } else if (entity instanceof Collection) {
            Collection collection = (Collection) entity;
            if (collection.getDateCreated() == null) collection.setDateCreated(now);
            if (collection.getDateModified() == null) collection.setDateModified(now);
        } else if (entity instanceof Moodboard) {
            Moodboard moodboard = (Moodboard) entity;
            if (moodboard.getDateModified() == null) moodboard.setDateModified(now);
        }
    }

    private CatalogEntity merge(CatalogEntity existing, Map<String, ?> changes) {
        ObjectNode node = mapper.valueToTree(existing);
        for (Map.Entry<String, ?> change : changes.entrySet()) {
            if ("id".equals(change.getKey())) {
                continue;
            }
            node.set(change.getKey(), mapper.valueToTree(change.getValue()));
        }
        try {
            CatalogEntity merged = mapper.treeToValue(node, existing.getClass());
            merged.setId(existing.getId());
            return merged;
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid changes for record " + existing.getId() + ": " + changes.keySet(), e);
        }
    }
}
