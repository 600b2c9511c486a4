package dev.aparikh.torrentsearch.search;

/**
 * A built backend query, ready to be fetched a window at a time and counted.
 * Implementations wrap any backend failure in {@link SearchBackendException}.
 */
public interface CountedQuery<T> {

    QueryPage<T> fetch(long offset, int limit);

    long count();

    /**
     * Identifies the shape of the count query: two queries with equal keys must count the same rows.
     */
    String countKey();
}
