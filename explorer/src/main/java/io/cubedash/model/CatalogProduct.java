package io.cubedash.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A product as defined in the dataset catalog.
 */
public record CatalogProduct(int id, String name, String metadataTypeName, JsonNode definition) {

    public String description() {
        return definition == null ? null : definition.path("description").asText(null);
    }
}
