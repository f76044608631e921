package com.arccatalog.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Named, ordered group of tags.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class Category implements CatalogEntity {
    private String id;
    private String name;
    private String color;
    private Integer order;   // Display position, null when never reordered
    private LocalDateTime dateCreated;
    private List<String> tagIds = new ArrayList<>();

    public Category() {
    }

    public Category(String name) {
        this.name = name;
    }

    @Override
    public String getId() { return id; }
    @Override
    public void setId(String id) { this.id = id; }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public String getColor() { return color; }
    public void setColor(String color) { this.color = color; }

    public Integer getOrder() { return order; }
    public void setOrder(Integer order) { this.order = order; }

    public LocalDateTime getDateCreated() { return dateCreated; }
    public void setDateCreated(LocalDateTime dateCreated) { this.dateCreated = dateCreated; }

    public List<String> getTagIds() { return tagIds; }
    public void setTagIds(List<String> tagIds) {
        this.tagIds = tagIds != null ? new ArrayList<>(tagIds) : new ArrayList<>();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Category category = (Category) o;
        return Objects.equals(id, category.id) &&
                Objects.equals(name, category.name) &&
                Objects.equals(color, category.color) &&
                Objects.equals(order, category.order) &&
                Objects.equals(dateCreated, category.dateCreated) &&
                Objects.equals(tagIds, category.tagIds);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, tagIds);
    }

    @Override
    public String toString() {
        return "Category{id='" + id + "', name='" + name + "', tags=" + tagIds.size() + '}';
    }
}
