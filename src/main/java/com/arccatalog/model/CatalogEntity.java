package com.arccatalog.model;

/**
 * Common contract of the five record kinds kept in the catalog database.
 * Every record is addressed by a unique string identifier.
 */
public interface CatalogEntity {

    String getId();

    void setId(String id);
}
