package dev.aparikh.torrentsearch.search.relational;

import java.util.List;

/**
 * Listing and count statements sharing one WHERE clause and its parameters.
 * Paging ({@code LIMIT ? OFFSET ?}) is appended by the executor.
 */
public record SqlQuery(String selectSql, String countSql, List<Object> params) {

    public SqlQuery {
        params = List.copyOf(params);
    }
}
