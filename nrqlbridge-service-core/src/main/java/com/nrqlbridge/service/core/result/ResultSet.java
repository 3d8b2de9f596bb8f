package com.nrqlbridge.service.core.result;

import java.util.List;
import java.util.Map;

/**
 * Decoded NRDB response. Rows are untyped maps; {@code facetNames} names the positions of the
 * {@code facet} array carried by faceted rows.
 */
public record ResultSet(List<Map<String, Object>> rows, List<String> facetNames) {

    public ResultSet {
        rows = rows != null ? rows : List.of();
        facetNames = facetNames != null ? facetNames : List.of();
    }

    public static ResultSet of(List<Map<String, Object>> rows) {
        return new ResultSet(rows, List.of());
    }

    public static ResultSet empty() {
        return new ResultSet(List.of(), List.of());
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public int size() {
        return rows.size();
    }

    /** First row, or an empty map when there are no rows. */
    public Map<String, Object> firstRow() {
        return rows.isEmpty() ? Map.of() : rows.get(0);
    }
}
