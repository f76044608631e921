package com.arccatalog.repository;

import com.arccatalog.model.*;
import com.arccatalog.model.Collection;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.time.LocalDateTime;
import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

class EntityStoreTest {

    private static final String TEST_DB_URL = "jdbc:sqlite:file:entitystoretest?mode=memory&cache=shared";

    @TempDir
    Path tempDir;

    private Connection sharedConnection;
    private CatalogDatabaseManager db;
    private EntityStore store;

    @BeforeEach
    void setUp() throws SQLException {
        // Keep a shared connection open to preserve the in-memory DB state
        sharedConnection = DriverManager.getConnection(TEST_DB_URL);
        db = new CatalogDatabaseManager(TEST_DB_URL, true);
        store = new EntityStore(db, tempDir.resolve("logs"));
    }

    @AfterEach
    void tearDown() throws SQLException {
        if (sharedConnection != null && !sharedConnection.isClosed()) {
            sharedConnection.close();
        }
    }

    private Card newCard(String name, String... tagIds) {
        Card card = new Card(name, tempDir.resolve(name).toString(), Card.MediaType.IMAGE, "jpg", 100);
        card.setTags(new LinkedHashSet<>(Arrays.asList(tagIds)));
        return card;
    }

    private String newTag(String name, String categoryId, int cardCount) {
        Tag tag = new Tag(name, categoryId);
        tag.setCardCount(cardCount);
        return store.create(tag);
    }

    // ========== create / get / update ==========

    @Test
    void testCreate_AssignsIdAndStampsDates() {
        Collection collection = new Collection("Refs");

        String id = store.create(collection);

        assertNotNull(id);
        Collection stored = store.getCollection(id).orElseThrow();
        assertEquals("Refs", stored.getName());
        assertNotNull(stored.getDateCreated());
        assertNotNull(stored.getDateModified());
    }

    @Test
    void testCreate_KeepsGivenId() {
        Category category = new Category("Style");
        category.setId("style");

        assertEquals("style", store.create(category));
        assertTrue(store.getCategory("style").isPresent());
    }

    @Test
    void testCreate_DuplicateId_Throws() {
        Category first = new Category("Style");
        first.setId("style");
        store.create(first);

        Category second = new Category("Other");
        second.setId("style");

        assertThrows(DatabaseException.class, () -> store.create(second));
        assertEquals("Style", store.getCategory("style").orElseThrow().getName(), "Existing record must be untouched");
    }

    @Test
    void testCreateCard_IncrementsCountOfExistingTagsOnly() {
        String tagId = newTag("Minimal", null, 0);

        store.create(newCard("a.jpg", tagId, "unknown-tag"));
        store.create(newCard("b.jpg", tagId));

        assertEquals(2, store.getTag(tagId).orElseThrow().getCardCount());
        assertTrue(store.getTag("unknown-tag").isEmpty(), "No tag must be created for unknown ids");
    }

    @Test
    void testCreateTag_RegistersInCategory() {
        String categoryId = store.create(new Category("Style"));

        String tagId = newTag("Bold", categoryId, 0);

        assertEquals(List.of(tagId), store.getCategory(categoryId).orElseThrow().getTagIds());
    }

    @Test
    void testUpdate_MergesOnlyNamedFields() {
        String cardId = store.create(newCard("a.jpg"));

        int updated = store.update(EntityKind.CARD, cardId, Map.of("description", "Sunset", "id", "hijacked"));

        assertEquals(1, updated);
        Card card = store.getCard(cardId).orElseThrow();
        assertEquals("Sunset", card.getDescription());
        assertEquals("a.jpg", card.getFileName());
        assertEquals(100, card.getFileSize());
        assertTrue(store.getCard("hijacked").isEmpty(), "The id cannot be changed");
    }

    @Test
    void testUpdate_UnknownId_ReturnsZero() {
        assertEquals(0, store.update(EntityKind.TAG, "missing", Map.of("name", "x")));
    }

    @Test
    void testUpdate_InvalidValue_Throws() {
        String cardId = store.create(newCard("a.jpg"));

        assertThrows(IllegalArgumentException.class,
                () -> store.update(EntityKind.CARD, cardId, Map.of("fileSize", "not a number")));
    }

    @Test
    void testUpdateCardTags_AdjustsCountsNeverBelowZero() {
        String kept = newTag("Kept", null, 0);
        String removed = newTag("Removed", null, 0);
        String added = newTag("Added", null, 0);
        String cardId = store.create(newCard("a.jpg", kept, removed));
        // Simulate a count that already went stale
        store.update(EntityKind.TAG, removed, Map.of("cardCount", 0));

        store.update(EntityKind.CARD, cardId, Map.of("tags", List.of(kept, added)));

        assertEquals(1, store.getTag(kept).orElseThrow().getCardCount());
        assertEquals(0, store.getTag(removed).orElseThrow().getCardCount());
        assertEquals(1, store.getTag(added).orElseThrow().getCardCount());
        assertEquals(Set.of(kept, added), store.getCard(cardId).orElseThrow().getTags());
    }

    @Test
    void testUpdateCollection_BumpsDateModified() {
        Collection collection = new Collection("Refs");
        LocalDateTime past = LocalDateTime.of(2020, 1, 1, 0, 0);
        collection.setDateModified(past);
        String id = store.create(collection);

        store.update(EntityKind.COLLECTION, id, Map.of("name", "References"));

        Collection stored = store.getCollection(id).orElseThrow();
        assertEquals("References", stored.getName());
        assertTrue(stored.getDateModified().isAfter(past));
    }

    @Test
    void testList_WithFilter() {
        store.create(newCard("a.jpg"));
        Card video = newCard("b.mp4");
        video.setType(Card.MediaType.VIDEO);
        store.create(video);

        List<Card> videos = store.list(EntityKind.CARD, Card.class, c -> c.getType() == Card.MediaType.VIDEO);

        assertEquals(1, videos.size());
        assertEquals("b.mp4", videos.get(0).getFileName());
    }

    @Test
    void testGet_WrongRecordClass_Throws() {
        String cardId = store.create(newCard("a.jpg"));

        assertThrows(IllegalArgumentException.class, () -> store.get(EntityKind.CARD, cardId, Tag.class));
        assertThrows(IllegalArgumentException.class, () -> store.list(EntityKind.TAG, Card.class));
    }

    // ========== cascades ==========

    @Test
    void testDeleteCard_RemovesBackReferencesButKeepsTagCount() {
        String tagId = newTag("Minimal", null, 0);
        String cardId = store.create(newCard("a.jpg", tagId));
        String otherId = store.create(newCard("b.jpg"));
        Collection collection = new Collection("Refs");
        collection.setCardIds(List.of(cardId, otherId));
        String collectionId = store.create(collection);
        store.addToMoodboard(cardId);
        store.addToMoodboard(otherId);
        db.savePreview(cardId, new byte[]{1, 2, 3});

        store.deleteCard(cardId);

        assertTrue(store.getCard(cardId).isEmpty());
        assertEquals(List.of(otherId), store.getCollection(collectionId).orElseThrow().getCardIds());
        assertEquals(List.of(otherId), store.getMoodboard().getCardIds());
        assertTrue(db.loadPreview(cardId).isEmpty(), "Cached preview must be evicted");
        assertEquals(1, store.getTag(tagId).orElseThrow().getCardCount(), "Tag counts are repaired lazily");
    }

    @Test
    void testDeleteCard_UnknownId_IsNoOp() {
        String cardId = store.create(newCard("a.jpg"));

        assertDoesNotThrow(() -> store.deleteCard("missing"));
        assertTrue(store.getCard(cardId).isPresent());
    }

    @Test
    void testDeleteTag_StripsCardsButLeavesCategory() {
        String categoryId = store.create(new Category("Style"));
        String tagId = newTag("Bold", categoryId, 0);
        String otherTag = newTag("Minimal", categoryId, 0);
        String cardId = store.create(newCard("a.jpg", tagId, otherTag));

        store.deleteTag(tagId);

        assertTrue(store.getTag(tagId).isEmpty());
        assertEquals(Set.of(otherTag), store.getCard(cardId).orElseThrow().getTags());
        assertTrue(store.getCategory(categoryId).orElseThrow().getTagIds().contains(tagId),
                "The owning category is healed by the repairer, not by the cascade");
    }

    @Test
    void testDeleteCategory_DeletesItsTagsWithCascade() {
        String categoryId = store.create(new Category("Style"));
        String bold = newTag("Bold", categoryId, 0);
        String minimal = newTag("Minimal", categoryId, 0);
        String keep = newTag("Outdoor", null, 0);
        String cardId = store.create(newCard("a.jpg", bold, minimal, keep));

        store.delete(EntityKind.CATEGORY, categoryId);

        assertTrue(store.getCategory(categoryId).isEmpty());
        assertTrue(store.getTag(bold).isEmpty());
        assertTrue(store.getTag(minimal).isEmpty());
        assertTrue(store.getTag(keep).isPresent());
        assertEquals(Set.of(keep), store.getCard(cardId).orElseThrow().getTags());
    }

    @Test
    void testDeleteCollection_StripsCards() {
        String collectionId = store.create(new Collection("Refs"));
        String otherCollection = store.create(new Collection("Other"));
        Card card = newCard("a.jpg");
        card.setCollections(Set.of(collectionId, otherCollection));
        String cardId = store.create(card);

        store.delete(EntityKind.COLLECTION, collectionId);

        assertTrue(store.getCollection(collectionId).isEmpty());
        assertEquals(Set.of(otherCollection), store.getCard(cardId).orElseThrow().getCollections());
    }

    // ========== moodboard ==========

    @Test
    void testGetMoodboard_CreatesSingletonOnFirstAccess() {
        assertTrue(store.get(EntityKind.MOODBOARD, Moodboard.DEFAULT_ID, Moodboard.class).isEmpty());

        Moodboard moodboard = store.getMoodboard();

        assertEquals(Moodboard.DEFAULT_ID, moodboard.getId());
        assertTrue(moodboard.getCardIds().isEmpty());
        assertTrue(store.get(EntityKind.MOODBOARD, Moodboard.DEFAULT_ID, Moodboard.class).isPresent());
    }

    @Test
    void testMoodboard_AddRemoveMirrorsCardFlag() {
        String a = store.create(newCard("a.jpg"));
        String b = store.create(newCard("b.jpg"));

        store.addToMoodboard(a);
        store.addToMoodboard(b);
        store.addToMoodboard(a);
        store.addToMoodboard("missing");

        assertEquals(List.of(a, b), store.getMoodboard().getCardIds());
        assertTrue(store.getCard(a).orElseThrow().isInMoodboard());

        store.removeFromMoodboard(a);

        assertEquals(List.of(b), store.getMoodboard().getCardIds());
        assertFalse(store.getCard(a).orElseThrow().isInMoodboard());
        assertTrue(store.getCard(b).orElseThrow().isInMoodboard());
    }

    @Test
    void testClearMoodboard_ResetsFlags() {
        String a = store.create(newCard("a.jpg"));
        String b = store.create(newCard("b.jpg"));
        store.addToMoodboard(a);
        store.addToMoodboard(b);

        store.delete(EntityKind.MOODBOARD, Moodboard.DEFAULT_ID);

        assertTrue(store.getMoodboard().getCardIds().isEmpty());
        assertFalse(store.getCard(a).orElseThrow().isInMoodboard());
        assertFalse(store.getCard(b).orElseThrow().isInMoodboard());
    }

    // ========== queries ==========

    @Test
    void testSearchCards_TypeTagsAndMoodboard() {
        String red = newTag("Red", null, 0);
        String blue = newTag("Blue", null, 0);
        String both = store.create(newCard("both.jpg", red, blue));
        String onlyRed = store.create(newCard("red.jpg", red));
        Card video = newCard("clip.mp4", red, blue);
        video.setType(Card.MediaType.VIDEO);
        String clip = store.create(video);
        store.addToMoodboard(onlyRed);
        store.addToMoodboard(clip);

        assertEquals(3, store.searchCards(CardSearch.all()).size());
        assertEquals(Set.of(both, clip), ids(store.searchCards(CardSearch.all().withTag(red).withTag(blue))));
        assertEquals(Set.of(both), ids(store.searchCards(CardSearch.all().withTag(red).withTag(blue)
                .ofType(Card.MediaType.IMAGE))));
        assertEquals(Set.of(onlyRed, clip), ids(store.searchCards(CardSearch.all().withTag(red).inMoodboard())));
    }

    @Test
    void testFindSimilarCards_OrdersByMatches() {
        String t1 = newTag("t1", null, 0);
        String t2 = newTag("t2", null, 0);
        String t3 = newTag("t3", null, 0);
        String source = store.create(newCard("source.jpg", t1, t2, t3));
        String close = store.create(newCard("close.jpg", t1, t2, t3));
        String partial = store.create(newCard("partial.jpg", t1, t2));
        store.create(newCard("far.jpg", t3));

        List<Card> similar = store.findSimilarCards(source, 2);

        assertEquals(List.of(close, partial), similar.stream().map(Card::getId).toList());
    }

    @Test
    void testGetStatistics() {
        store.create(newCard("a.jpg"));
        Card video = newCard("b.mp4");
        video.setType(Card.MediaType.VIDEO);
        video.setFileSize(900);
        String videoId = store.create(video);
        store.create(new Collection("Refs"));
        newTag("Bold", null, 0);
        store.addToMoodboard(videoId);

        CatalogStatistics stats = store.getStatistics();

        assertEquals(2, stats.getTotalCards());
        assertEquals(1, stats.getImageCount());
        assertEquals(1, stats.getVideoCount());
        assertEquals(1000, stats.getTotalSize());
        assertEquals(1, stats.getTagCount());
        assertEquals(0, stats.getCategoryCount());
        assertEquals(1, stats.getCollectionCount());
        assertEquals(1, stats.getMoodboardCount());
    }

    // ========== linked edits ==========

    @Test
    void testUpdateCardCollections_SyncsBothSides() {
        String first = store.create(new Collection("First"));
        String second = store.create(new Collection("Second"));
        String cardId = store.create(newCard("a.jpg"));
        store.updateCardCollections(cardId, Set.of(first));

        assertTrue(store.updateCardCollections(cardId, Set.of(second, "missing")));

        assertEquals(Set.of(second), store.getCard(cardId).orElseThrow().getCollections());
        assertTrue(store.getCollection(first).orElseThrow().getCardIds().isEmpty());
        assertEquals(List.of(cardId), store.getCollection(second).orElseThrow().getCardIds());
        assertFalse(store.updateCardCollections("missing", Set.of(first)));
    }

    @Test
    void testMoveTagToCategory() {
        String from = store.create(new Category("From"));
        String to = store.create(new Category("To"));
        String tagId = newTag("Bold", from, 0);

        store.moveTagToCategory(tagId, to);

        assertEquals(to, store.getTag(tagId).orElseThrow().getCategoryId());
        assertTrue(store.getCategory(from).orElseThrow().getTagIds().isEmpty());
        assertEquals(List.of(tagId), store.getCategory(to).orElseThrow().getTagIds());
    }

    @Test
    void testMoveTagToCategory_UnknownIds_Throw() {
        String categoryId = store.create(new Category("Style"));
        String tagId = newTag("Bold", categoryId, 0);

        assertThrows(IllegalArgumentException.class, () -> store.moveTagToCategory("missing", categoryId));
        assertThrows(IllegalArgumentException.class, () -> store.moveTagToCategory(tagId, "missing"));
        assertEquals(categoryId, store.getTag(tagId).orElseThrow().getCategoryId());
    }

    @Test
    void testRecalculateTagCounts() {
        String used = newTag("Used", null, 0);
        String stale = newTag("Stale", null, 5);
        store.create(newCard("a.jpg", used));
        String b = store.create(newCard("b.jpg", used));
        store.deleteCard(b);

        int changed = store.recalculateTagCounts();

        assertEquals(2, changed);
        assertEquals(1, store.getTag(used).orElseThrow().getCardCount());
        assertEquals(0, store.getTag(stale).orElseThrow().getCardCount());
        assertEquals(0, store.recalculateTagCounts(), "Second pass has nothing to change");
    }

    // ========== snapshot ==========

    @Test
    void testExportImport_ReplacesCatalog() {
        String categoryId = store.create(new Category("Style"));
        String tagId = newTag("Bold", categoryId, 0);
        String cardId = store.create(newCard("a.jpg", tagId));
        store.addToMoodboard(cardId);
        CatalogSnapshot snapshot = store.exportSnapshot();

        store.deleteCategory(categoryId);
        store.create(newCard("extra.jpg"));
        store.importSnapshot(snapshot);

        assertTrue(snapshot.sameGraphAs(store.exportSnapshot()));
        assertEquals(1, store.listCards().size());
    }

    @Test
    void testImportSnapshot_RebasesPaths() {
        Card card = newCard("photo.jpg");
        card.setFilePath("C:\\Users\\old\\ARC\\2024\\05\\17\\photo.jpg");
        card.setThumbnailUrl("/home/old/ARC/_cache/thumbs/photo.jpg");
        Card dataUrl = newCard("inline.jpg");
        dataUrl.setFilePath("/elsewhere/inline.jpg");
        dataUrl.setThumbnailUrl("data:image/jpeg;base64,AAAA");
        CatalogSnapshot snapshot = new CatalogSnapshot();
        snapshot.setCards(List.of(card, dataUrl));
        card.setId("c1");
        dataUrl.setId("c2");

        Path newRoot = tempDir.resolve("restored");
        store.importSnapshot(snapshot, newRoot);

        Card rebased = store.getCard("c1").orElseThrow();
        assertEquals(newRoot.resolve("2024/05/17/photo.jpg").toString(), rebased.getFilePath());
        assertEquals(newRoot.resolve("_cache/thumbs/photo.jpg").toString(), rebased.getThumbnailUrl());
        Card untouched = store.getCard("c2").orElseThrow();
        assertEquals("/elsewhere/inline.jpg", untouched.getFilePath());
        assertEquals("data:image/jpeg;base64,AAAA", untouched.getThumbnailUrl());
    }

    private static Set<String> ids(List<Card> cards) {
        Set<String> ids = new HashSet<>();
        for (Card card : cards) {
            ids.add(card.getId());
        }
        return ids;
    }
}
