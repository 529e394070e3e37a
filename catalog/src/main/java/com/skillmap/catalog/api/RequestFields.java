package com.skillmap.catalog.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.skillmap.catalog.service.CatalogException;
import com.skillmap.catalog.service.FieldUpdate;

import java.util.UUID;

/**
 * Helpers turning raw request values into service arguments.
 *
 * Update bodies are read as a JSON tree so that an omitted key
 * ({@link FieldUpdate#unchanged()}) and an explicit null
 * ({@code FieldUpdate.set(null)}) remain distinguishable.
 */
final class RequestFields {

    private RequestFields() {}

    static FieldUpdate<String> text(JsonNode body, String field) {
        if (body == null || !body.has(field)) return FieldUpdate.unchanged();
        return FieldUpdate.set(textOrNull(body.get(field)));
    }

    /** Like {@link #text} but accepts a reference id under any of {@code aliases}, first match wins. */
    static FieldUpdate<UUID> reference(JsonNode body, String field, String... aliases) {
        if (body == null) return FieldUpdate.unchanged();
        if (body.has(field)) {
            return FieldUpdate.set(parseReference(textOrNull(body.get(field)), field));
        }
        for (String alias : aliases) {
            if (body.has(alias)) {
                return FieldUpdate.set(parseReference(textOrNull(body.get(alias)), field));
            }
        }
        return FieldUpdate.unchanged();
    }

    /**
     * Parse a foreign-key value from a request body.
     * Empty means "no reference"; a malformed or whitespace-only id cannot
     * match any row, so it is reported the same way as an unknown one.
     */
    static UUID parseReference(String raw, String field) {
        if (raw == null || raw.isEmpty()) return null;
        try {
            return UUID.fromString(raw);
        } catch (IllegalArgumentException e) {
            throw CatalogException.danglingReference(field);
        }
    }

    private static String textOrNull(JsonNode node) {
        if (node == null || node.isNull()) return null;
        return node.isValueNode() ? node.asText() : node.toString();
    }
}
