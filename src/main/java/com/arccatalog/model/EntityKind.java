package com.arccatalog.model;

/**
 * The record kinds of the catalog, each backed by its own keyed table.
 */
public enum EntityKind {
    CARD("cards", Card.class),
    TAG("tags", Tag.class),
    CATEGORY("categories", Category.class),
    COLLECTION("collections", Collection.class),
    MOODBOARD("moodboard", Moodboard.class);

    private final String tableName;
    private final Class<? extends CatalogEntity> entityClass;

    EntityKind(String tableName, Class<? extends CatalogEntity> entityClass) {
        this.tableName = tableName;
        this.entityClass = entityClass;
    }

    public String getTableName() {
        return tableName;
    }

    public Class<? extends CatalogEntity> getEntityClass() {
        return entityClass;
    }

    /**
     * Resolves the kind of a record instance.
     *
     * @throws IllegalArgumentException if the instance is not one of the catalog record classes
     */
    public static EntityKind of(CatalogEntity entity) {
        for (EntityKind kind : values()) {
            if (kind.entityClass.isInstance(entity)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unsupported entity type: " + entity.getClass().getName());
    }
}
