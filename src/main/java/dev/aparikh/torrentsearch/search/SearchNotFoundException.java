package dev.aparikh.torrentsearch.search;

/**
 * The request was well formed but refers to something that does not exist.
 */
public class SearchNotFoundException extends RuntimeException {

    public SearchNotFoundException(String message) {
        super(message);
    }
}
