package dev.aparikh.torrentsearch.search;

/**
 * The index or relational store failed while executing a search. Never retried here.
 */
public class SearchBackendException extends RuntimeException {

    public SearchBackendException(String message, Throwable cause) {
        super(message, cause);
    }
}
