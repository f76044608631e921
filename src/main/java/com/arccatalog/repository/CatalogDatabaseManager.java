package com.arccatalog.repository;

import com.arccatalog.model.CatalogEntity;
import com.arccatalog.model.EntityKind;
import com.arccatalog.util.CatalogConfig;
import com.arccatalog.util.CatalogJson;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.File;
import java.sql.*;
import java.time.LocalDateTime;
import java.util.*;

/**
 * Manages the catalog database (arc_catalog.sqlite).
 * Each entity kind has its own keyed table holding one JSON document per record;
 * rendered previews live in the {@code thumbnail_cache} table.
 */
public class CatalogDatabaseManager {
    private static final int CURRENT_DB_VERSION = 2;

    private static final String SQL_CREATE_METADATA = """
            CREATE TABLE IF NOT EXISTS metadata (
            version integer PRIMARY KEY,
            tag_recount_required integer DEFAULT 0
            );""";

    private static final String SQL_CREATE_ENTITY_TABLE = """
            CREATE TABLE IF NOT EXISTS %s (
             id text PRIMARY KEY,
             data text NOT NULL,
             updated_at text
            );""";

    private static final String SQL_CREATE_THUMBNAIL_CACHE = """
            CREATE TABLE IF NOT EXISTS thumbnail_cache (
             card_id text PRIMARY KEY,
             preview blob,
             date_generated text
            );""";

    private final String connectionUrl;
    private final ObjectMapper mapper = CatalogJson.newMapper();

    public CatalogDatabaseManager(CatalogConfig config) {
        File dbFile = config.getDatabaseFile().toFile();
        File dbFolder = dbFile.getAbsoluteFile().getParentFile();
        if (dbFolder != null && !dbFolder.exists()) {
            if (!dbFolder.mkdirs()) {
                throw new DatabaseException("Could not create catalog database directory: " + dbFolder.getAbsolutePath());
            }
        }
        this.connectionUrl = "jdbc:sqlite:" + dbFile.getAbsolutePath();
        initialize();
    }

    // Constructor for testing purposes
    public CatalogDatabaseManager(String connectionUrl, boolean isTest) {
        this.connectionUrl = connectionUrl;
        if (isTest) {
            initialize();
        }
    }

    Connection connect() throws SQLException {
        return DriverManager.getConnection(connectionUrl);
    }

    ObjectMapper getMapper() {
        return mapper;
    }

    /**
     * Initializes the catalog schema and handles migrations.
     */
    private void initialize() {
        try (Connection conn = connect()) {
            // WAL is not supported for in-memory databases
            if (!connectionUrl.contains(":memory:") && !connectionUrl.contains("mode=memory")) {
                try (Statement stmt = conn.createStatement()) {
                    stmt.execute("PRAGMA journal_mode=WAL;");
                    stmt.execute("PRAGMA synchronous=NORMAL;");
                }
            }

            conn.setAutoCommit(false);
            try (Statement stmt = conn.createStatement()) {
                int version = 0;
                try (ResultSet rs = stmt.executeQuery("SELECT version FROM metadata ORDER BY version DESC LIMIT 1")) {
                    if (rs.next()) {
                        version = rs.getInt("version");
                    }
                } catch (SQLException e) {
                    // Metadata table doesn't exist yet
                }

                if (version < CURRENT_DB_VERSION) {
                    migrate(conn, version);
                }

                conn.commit();
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new DatabaseException("Catalog database initialization failed", e);
        }
    }

    private void migrate(Connection conn, int currentVersion) throws SQLException {
        System.out.println("Migrating catalog database from version " + currentVersion + " to " + CURRENT_DB_VERSION);

        Map<String, Map<String, String>> expectedSchema = new LinkedHashMap<>();

        Map<String, String> metadataCols = new LinkedHashMap<>();
        metadataCols.put("version", "integer PRIMARY KEY");
        metadataCols.put("tag_recount_required", "integer DEFAULT 0");
        expectedSchema.put("metadata", metadataCols);

        for (EntityKind kind : EntityKind.values()) {
            Map<String, String> entityCols = new LinkedHashMap<>();
            entityCols.put("id", "text PRIMARY KEY");
            entityCols.put("data", "text NOT NULL");
            entityCols.put("updated_at", "text");
            expectedSchema.put(kind.getTableName(), entityCols);
        }

        Map<String, String> thumbnailCols = new LinkedHashMap<>();
        thumbnailCols.put("card_id", "text PRIMARY KEY");
        thumbnailCols.put("preview", "blob");
        thumbnailCols.put("date_generated", "text");
        expectedSchema.put("thumbnail_cache", thumbnailCols);

        try (Statement stmt = conn.createStatement()) {
            createTablesIfNotExist(stmt);

            for (Map.Entry<String, Map<String, String>> entry : expectedSchema.entrySet()) {
                String tableName = entry.getKey();
                Set<String> existingColumns = getExistingColumns(conn, tableName);

                for (Map.Entry<String, String> colEntry : entry.getValue().entrySet()) {
                    if (!existingColumns.contains(colEntry.getKey())) {
                        System.out.println("Adding missing column " + colEntry.getKey() + " to table " + tableName);
                        addColumn(stmt, tableName, colEntry.getKey(), colEntry.getValue());
                    }
                }
            }

            stmt.execute("INSERT OR REPLACE INTO metadata (version) VALUES (" + CURRENT_DB_VERSION + ");");

            // Older catalogs maintained tag counts differently; recount them once on next open
            if (currentVersion > 0) {
                stmt.execute("UPDATE metadata SET tag_recount_required = 1 WHERE version = " + CURRENT_DB_VERSION);
            }
        }
    }

    private void createTablesIfNotExist(Statement stmt) throws SQLException {
        stmt.execute(SQL_CREATE_METADATA);
        for (EntityKind kind : EntityKind.values()) {
            stmt.execute(String.format(SQL_CREATE_ENTITY_TABLE, kind.getTableName()));
        }
        stmt.execute(SQL_CREATE_THUMBNAIL_CACHE);
    }

    private Set<String> getExistingColumns(Connection conn, String tableName) throws SQLException {
        Set<String> columns = new HashSet<>();
        try (ResultSet rs = conn.getMetaData().getColumns(null, null, tableName, null)) {
            while (rs.next()) {
                columns.add(rs.getString("COLUMN_NAME"));
            }
        }
        return columns;
    }

    private void addColumn(Statement stmt, String tableName, String columnName, String columnDefinition) throws SQLException {
        String safeDefinition = columnDefinition.replaceAll("(?i)PRIMARY KEY", "")
                .replaceAll("(?i)NOT NULL", "").trim();
        stmt.execute("ALTER TABLE " + tableName + " ADD COLUMN " + columnName + " " + safeDefinition);
    }

    public int getSchemaVersion() {
        try (Connection conn = connect();
             Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery("SELECT MAX(version) FROM metadata")) {
            return rs.next() ? rs.getInt(1) : 0;
        } catch (SQLException e) {
            throw new DatabaseException("Failed to read schema version", e);
        }
    }

    public boolean isTagRecountRequired() {
        String sql = "SELECT tag_recount_required FROM metadata ORDER BY version DESC LIMIT 1";
        try (Connection conn = connect();
             Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery(sql)) {
            if (rs.next()) {
                return rs.getInt("tag_recount_required") == 1;
            }
        } catch (SQLException e) {
            throw new DatabaseException("Failed to check flag tag_recount_required", e);
        }
        return false;
    }

    public void setTagRecountRequired(boolean required) {
        String sql = "UPDATE metadata SET tag_recount_required = ? WHERE version = (SELECT MAX(version) FROM metadata)";
        try (Connection conn = connect();
             PreparedStatement pstmt = conn.prepareStatement(sql)) {
            pstmt.setInt(1, required ? 1 : 0);
            pstmt.executeUpdate();
        } catch (SQLException e) {
            throw new DatabaseException("Failed to set flag tag_recount_required", e);
        }
    }

    /**
     * Unit of work run on a single connection.
     */
    @FunctionalInterface
    public interface SqlWork<T> {
        T execute(Connection conn) throws SQLException;
    }

    /**
     * Runs {@code work} inside one transaction. Any failure rolls back every write of the unit.
     *
     * @param description Used in the exception message when the work fails
     */
    public <T> T inTransaction(String description, SqlWork<T> work) {
        try (Connection conn = connect()) {
            conn.setAutoCommit(false);
            try {
                T result = work.execute(conn);
                conn.commit();
                return result;
            } catch (SQLException | RuntimeException e) {
                conn.rollback();
                throw e;
            }
        } catch (DatabaseException e) {
            throw e;
        } catch (SQLException e) {
            throw new DatabaseException(description + " failed", e);
        }
    }

    /**
     * Runs read-only {@code work} on a fresh auto-commit connection.
     */
    public <T> T read(String description, SqlWork<T> work) {
        try (Connection conn = connect()) {
            return work.execute(conn);
        } catch (SQLException e) {
            throw new DatabaseException(description + " failed", e);
        }
    }

    // Internal record access; every method joins the caller's connection

    <T extends CatalogEntity> Optional<T> find(Connection conn, EntityKind kind, String id, Class<T> type) throws SQLException {
        if (id == null) {
            return Optional.empty();
        }
        String sql = "SELECT data FROM " + kind.getTableName() + " WHERE id = ?";
        try (PreparedStatement pstmt = conn.prepareStatement(sql)) {
            pstmt.setString(1, id);
            try (ResultSet rs = pstmt.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(fromJson(rs.getString("data"), type, kind, id));
                }
            }
        }
        return Optional.empty();
    }

    <T extends CatalogEntity> List<T> findAll(Connection conn, EntityKind kind, Class<T> type) throws SQLException {
        List<T> records = new ArrayList<>();
        String sql = "SELECT id, data FROM " + kind.getTableName() + " ORDER BY rowid";
        try (Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery(sql)) {
            while (rs.next()) {
                records.add(fromJson(rs.getString("data"), type, kind, rs.getString("id")));
            }
        }
        return records;
    }

    boolean exists(Connection conn, EntityKind kind, String id) throws SQLException {
        if (id == null) {
            return false;
        }
        String sql = "SELECT 1 FROM " + kind.getTableName() + " WHERE id = ?";
        try (PreparedStatement pstmt = conn.prepareStatement(sql)) {
            pstmt.setString(1, id);
            try (ResultSet rs = pstmt.executeQuery()) {
                return rs.next();
            }
        }
    }

    /**
     * Inserts a new record. Fails if a record with the same id exists.
     */
    void insert(Connection conn, EntityKind kind, CatalogEntity entity) throws SQLException {
        String sql = "INSERT INTO " + kind.getTableName() + "(id, data, updated_at) VALUES(?, ?, ?)";
        try (PreparedStatement pstmt = conn.prepareStatement(sql)) {
            pstmt.setString(1, entity.getId());
            pstmt.setString(2, toJson(entity));
            pstmt.setString(3, LocalDateTime.now().toString());
            pstmt.executeUpdate();
        }
    }

    /**
     * Inserts the record or replaces the stored document with the same id.
     */
    void upsert(Connection conn, EntityKind kind, CatalogEntity entity) throws SQLException {
        String sql = "INSERT OR REPLACE INTO " + kind.getTableName() + "(id, data, updated_at) VALUES(?, ?, ?)";
        try (PreparedStatement pstmt = conn.prepareStatement(sql)) {
            pstmt.setString(1, entity.getId());
            pstmt.setString(2, toJson(entity));
            pstmt.setString(3, LocalDateTime.now().toString());
            pstmt.executeUpdate();
        }
    }

    void upsertAll(Connection conn, EntityKind kind, List<? extends CatalogEntity> entities) throws SQLException {
        String sql = "INSERT OR REPLACE INTO " + kind.getTableName() + "(id, data, updated_at) VALUES(?, ?, ?)";
        String now = LocalDateTime.now().toString();
        try (PreparedStatement pstmt = conn.prepareStatement(sql)) {
            int batchSize = 0;
            for (CatalogEntity entity : entities) {
                pstmt.setString(1, entity.getId());
                pstmt.setString(2, toJson(entity));
                pstmt.setString(3, now);
                pstmt.addBatch();
                batchSize++;

                if (batchSize >= 1000) {
                    pstmt.executeBatch();
                    batchSize = 0;
                }
            }
            if (batchSize > 0) {
                pstmt.executeBatch();
            }
        }
    }

    boolean deleteRow(Connection conn, EntityKind kind, String id) throws SQLException {
        String sql = "DELETE FROM " + kind.getTableName() + " WHERE id = ?";
        try (PreparedStatement pstmt = conn.prepareStatement(sql)) {
            pstmt.setString(1, id);
            return pstmt.executeUpdate() > 0;
        }
    }

    void clear(Connection conn, EntityKind kind) throws SQLException {
        try (Statement stmt = conn.createStatement()) {
            stmt.executeUpdate("DELETE FROM " + kind.getTableName());
        }
    }

    public int count(EntityKind kind) {
        return read("Count " + kind.getTableName(), conn -> {
            try (Statement stmt = conn.createStatement();
                 ResultSet rs = stmt.executeQuery("SELECT COUNT(*) FROM " + kind.getTableName())) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        });
    }

    // Preview cache

    public void savePreview(String cardId, byte[] preview) {
        String sql = "INSERT OR REPLACE INTO thumbnail_cache(card_id, preview, date_generated) VALUES(?, ?, ?)";
        try (Connection conn = connect();
             PreparedStatement pstmt = conn.prepareStatement(sql)) {
            pstmt.setString(1, cardId);
            pstmt.setBytes(2, preview);
            pstmt.setString(3, LocalDateTime.now().toString());
            pstmt.executeUpdate();
        } catch (SQLException e) {
            throw new DatabaseException("Failed to store preview for card " + cardId, e);
        }
    }

    public Optional<byte[]> loadPreview(String cardId) {
        String sql = "SELECT preview FROM thumbnail_cache WHERE card_id = ?";
        try (Connection conn = connect();
             PreparedStatement pstmt = conn.prepareStatement(sql)) {
            pstmt.setString(1, cardId);
            try (ResultSet rs = pstmt.executeQuery()) {
                if (rs.next()) {
                    byte[] bytes = rs.getBytes("preview");
                    if (bytes != null && bytes.length > 0) {
                        return Optional.of(bytes);
                    }
                }
            }
        } catch (SQLException e) {
            throw new DatabaseException("Failed to load preview for card " + cardId, e);
        }
        return Optional.empty();
    }

    void deletePreview(Connection conn, String cardId) throws SQLException {
        try (PreparedStatement pstmt = conn.prepareStatement("DELETE FROM thumbnail_cache WHERE card_id = ?")) {
            pstmt.setString(1, cardId);
            pstmt.executeUpdate();
        }
    }

    void clearPreviews(Connection conn) throws SQLException {
        try (Statement stmt = conn.createStatement()) {
            stmt.executeUpdate("DELETE FROM thumbnail_cache");
        }
    }

    private String toJson(CatalogEntity entity) {
        try {
            return mapper.writeValueAsString(entity);
        } catch (JsonProcessingException e) {
            throw new DatabaseException("Could not serialize record " + entity.getId(), e);
        }
    }

    private <T extends CatalogEntity> T fromJson(String json, Class<T> type, EntityKind kind, String id) {
        try {
            T entity = mapper.readValue(json, type);
            // The row key is authoritative
            entity.setId(id);
            return entity;
        } catch (JsonProcessingException e) {
            throw new DatabaseException("Corrupt " + kind.getTableName() + " record " + id, e);
        }
    }
}
