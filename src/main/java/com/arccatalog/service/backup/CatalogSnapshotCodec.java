package com.arccatalog.service.backup;

import com.arccatalog.model.CatalogSnapshot;
import com.arccatalog.util.CatalogJson;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Converts a catalog snapshot to and from the JSON payload stored in backup archives.
 */
public class CatalogSnapshotCodec {

    private final ObjectMapper mapper;

    public CatalogSnapshotCodec() {
        this(CatalogJson.newMapper());
    }

    public CatalogSnapshotCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public String encode(CatalogSnapshot snapshot) throws BackupException {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(snapshot);
        } catch (JsonProcessingException e) {
            throw new BackupException("Could not serialize catalog snapshot", e);
        }
    }

    /**
     * @throws BackupException if the payload is not a catalog export
     */
    public CatalogSnapshot decode(String json) throws BackupException {
        try {
            CatalogSnapshot snapshot = mapper.readValue(json, CatalogSnapshot.class);
            if (snapshot == null) {
                throw new BackupException("Catalog payload is empty");
            }
            return snapshot;
        } catch (JsonProcessingException e) {
            throw new BackupException("Catalog payload is malformed", e);
        }
    }
}
