package dev.aparikh.torrentsearch.search;

/**
 * Requested page lies outside the available results, or beyond the page cap for this viewer.
 */
public class PageOutOfRangeException extends SearchNotFoundException {

    private final long page;

    public PageOutOfRangeException(long page, String message) {
        super(message);
        this.page = page;
    }

    public long getPage() {
        return page;
    }
}
