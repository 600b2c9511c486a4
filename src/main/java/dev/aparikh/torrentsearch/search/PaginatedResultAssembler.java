package dev.aparikh.torrentsearch.search;

import dev.aparikh.torrentsearch.cache.BoundedExpiringCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Runs a {@link CountedQuery} and shapes its output into a {@link PagedResult}.
 * <p>
 * A total reported with the fetched window is always used as is. Backends that need a separate count
 * query can have their totals memoized in a {@link BoundedExpiringCache} keyed by the count query's
 * shape: a stale cached total is tolerated, and is never reported below the number of items actually
 * returned.
 */
public class PaginatedResultAssembler {

    private static final Logger LOG = LoggerFactory.getLogger(PaginatedResultAssembler.class);

    static final String MAX_PAGES_MESSAGE = "You've exceeded the maximum number of pages. "
            + "Please make your search query less broad.";

    private final BoundedExpiringCache<String, Long> countCache;
    private final Duration countCacheTtl;

    public PaginatedResultAssembler() {
        this(null, Duration.ZERO);
    }

    public PaginatedResultAssembler(BoundedExpiringCache<String, Long> countCache, Duration countCacheTtl) {
        this.countCache = countCache;
        this.countCacheTtl = countCacheTtl;
    }

    /**
     * @param maxPage highest page that may be requested, 0 for no limit
     */
    public <T> PagedResult<T> execute(CountedQuery<T> query, long page, int perPage, int maxPage, boolean feedView) {
        if (feedView) {
            List<T> items = query.fetch(0, perPage).items();
            return PagedResult.of(items, 1, perPage, items.size(), items.size());
        }

        if (page < 1) {
            throw new PageOutOfRangeException(page, "Page must be >= 1");
        }
        if (maxPage > 0 && page > maxPage) {
            throw new PageOutOfRangeException(page, MAX_PAGES_MESSAGE);
        }

        long offset = (page - 1) * (long) perPage;
        QueryPage<T> window = query.fetch(offset, perPage);
        List<T> items = window.items();

        long total;
        if (window.totalHits().isPresent()) {
            total = window.totalHits().getAsLong();
        } else {
            Optional<Long> cachedTotal = cachedCount(query);
            if (cachedTotal.isPresent()) {
                total = cachedTotal.get();
            } else {
                total = query.count();
                rememberCount(query, total);
            }
        }

        long uncappedTotal = total;
        if (maxPage > 0) {
            total = Math.min(total, (long) maxPage * perPage);
        }
        // a cached total may predate newer matches
        total = Math.max(total, items.size());

        if (items.isEmpty() && page != 1) {
            throw new PageOutOfRangeException(page, "Page " + page + " is beyond the last page of results");
        }
        return PagedResult.of(items, page, perPage, total, Math.max(uncappedTotal, total));
    }

    private Optional<Long> cachedCount(CountedQuery<?> query) {
        if (countCache == null) {
            return Optional.empty();
        }
        Optional<Long> cached = countCache.get(query.countKey());
        if (cached.isPresent()) {
            LOG.debug("Count cache hit for {}", query.countKey());
        }
        return cached;
    }

    private void rememberCount(CountedQuery<?> query, long total) {
        if (countCache != null) {
            countCache.put(query.countKey(), total, countCacheTtl);
        }
    }
}
