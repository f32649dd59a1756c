package com.rentdesk.backend.mappers;

import java.util.UUID;

/**
 * Shared checks for the mappers: a required field that is missing is a data error, not a default.
 */
final class MappingSupport {

    private MappingSupport() {}

    static <T> T required(T value, String entity, String field) {
        if (value == null) {
            throw new IllegalStateException(entity + "." + field + " is required but was null");
        }
        return value;
    }

    static String idOf(UUID id, String entity) {
        return required(id, entity, "id").toString();
    }

    static String nullableId(UUID id) {
        return id != null ? id.toString() : null;
    }
}
