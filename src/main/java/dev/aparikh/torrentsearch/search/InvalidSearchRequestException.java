package dev.aparikh.torrentsearch.search;

/**
 * A search request that must be rejected before any backend is queried: malformed or unknown
 * category, sort key, order or quality filter, or a page number beyond {@link SearchRequest#MAX_PAGE}.
 */
public class InvalidSearchRequestException extends IllegalArgumentException {

    public InvalidSearchRequestException(String message) {
        super(message);
    }
}
