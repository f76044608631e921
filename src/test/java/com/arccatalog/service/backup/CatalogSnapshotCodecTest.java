package com.arccatalog.service.backup;

import com.arccatalog.model.Card;
import com.arccatalog.model.CatalogSnapshot;
import com.arccatalog.model.Tag;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class CatalogSnapshotCodecTest {

    private final CatalogSnapshotCodec codec = new CatalogSnapshotCodec();

    @Test
    void testEncode_WritesIsoDatesAndLowercaseType() throws BackupException {
        Card card = new Card("a.jpg", "/w/2024/01/02/a.jpg", Card.MediaType.IMAGE, "jpg", 12);
        card.setId("c1");
        card.setDateAdded(LocalDateTime.of(2024, 1, 2, 3, 4, 5));
        CatalogSnapshot snapshot = new CatalogSnapshot();
        snapshot.setCards(List.of(card));

        String json = codec.encode(snapshot);

        assertTrue(json.contains("\"2024-01-02T03:04:05\""), json);
        assertTrue(json.contains("\"image\""), json);
    }

    @Test
    void testDecode_IgnoresUnknownFields() throws BackupException {
        String json = "{\"version\":\"1.0\",\"futureField\":true,"
                + "\"cards\":[{\"id\":\"c1\",\"fileName\":\"a.mp4\",\"type\":\"video\",\"tags\":[\"t1\"],\"rating\":5}],"
                + "\"tags\":[{\"id\":\"t1\",\"name\":\"Bold\",\"cardCount\":1}]}";

        CatalogSnapshot snapshot = codec.decode(json);

        Card card = snapshot.getCards().get(0);
        assertEquals(Card.MediaType.VIDEO, card.getType());
        assertEquals(Set.of("t1"), card.getTags());
        Tag tag = snapshot.getTags().get(0);
        assertEquals(1, tag.getCardCount());
        assertTrue(snapshot.getCollections().isEmpty());
        assertTrue(snapshot.getMoodboard().isEmpty());
    }

    @Test
    void testDecode_Malformed_Throws() {
        assertThrows(BackupException.class, () -> codec.decode("{not json"));
        assertThrows(BackupException.class, () -> codec.decode("null"));
    }
}
