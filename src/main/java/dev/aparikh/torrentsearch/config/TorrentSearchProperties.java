package dev.aparikh.torrentsearch.config;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Typed configuration of torrent search.
 */
@Validated
@ConfigurationProperties(prefix = "torrent-search")
public class TorrentSearchProperties {

    public enum Backend { INDEX, RELATIONAL }

    @NotNull
    private Backend backend = Backend.RELATIONAL;

    @Positive
    private int defaultPerPage = 75;

    @Positive
    private int maxPerPage = 100;

    @Positive
    private int feedMaxResults = 75;

    @PositiveOrZero
    private int maxPages = 0; // 0 = no page cap

    @Positive
    private int maxSearchResults = 1000;

    @NotNull
    private Duration countCacheDuration = Duration.ZERO; // zero disables the count cache

    @Positive
    private int countCacheSize = 256;

    private boolean highlight = false;

    @Positive
    private int minTokenLength = 2;

    private boolean indexHints = true;

    public Backend getBackend() {
        return backend;
    }

    public void setBackend(Backend backend) {
        this.backend = backend;
    }

    public int getDefaultPerPage() {
        return defaultPerPage;
    }

    public void setDefaultPerPage(int defaultPerPage) {
        this.defaultPerPage = defaultPerPage;
    }

    public int getMaxPerPage() {
        return maxPerPage;
    }

    public void setMaxPerPage(int maxPerPage) {
        this.maxPerPage = maxPerPage;
    }

    public int getFeedMaxResults() {
        return feedMaxResults;
    }

    public void setFeedMaxResults(int feedMaxResults) {
        this.feedMaxResults = feedMaxResults;
    }

    public int getMaxPages() {
        return maxPages;
    }

    public void setMaxPages(int maxPages) {
        this.maxPages = maxPages;
    }

    public int getMaxSearchResults() {
        return maxSearchResults;
    }

    public void setMaxSearchResults(int maxSearchResults) {
        this.maxSearchResults = maxSearchResults;
    }

    public Duration getCountCacheDuration() {
        return countCacheDuration;
    }

    public void setCountCacheDuration(Duration countCacheDuration) {
        this.countCacheDuration = countCacheDuration;
    }

    public int getCountCacheSize() {
        return countCacheSize;
    }

    public void setCountCacheSize(int countCacheSize) {
        this.countCacheSize = countCacheSize;
    }

    public boolean isHighlight() {
        return highlight;
    }

    public void setHighlight(boolean highlight) {
        this.highlight = highlight;
    }

    public int getMinTokenLength() {
        return minTokenLength;
    }

    public void setMinTokenLength(int minTokenLength) {
        this.minTokenLength = minTokenLength;
    }

    public boolean isIndexHints() {
        return indexHints;
    }

    public void setIndexHints(boolean indexHints) {
        this.indexHints = indexHints;
    }

    public boolean isCountCacheEnabled() {
        return countCacheDuration != null && !countCacheDuration.isZero() && !countCacheDuration.isNegative();
    }
}
