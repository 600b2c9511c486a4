package dev.aparikh.torrentsearch.search.filter;

import dev.aparikh.torrentsearch.model.Torrent;

/**
 * Backend-neutral filter predicate. Each backend translates the same clause list into its own
 * query language, and {@link #matches(Torrent)} states what every translation must select.
 */
public interface FilterClause {

    boolean matches(Torrent torrent);
}
