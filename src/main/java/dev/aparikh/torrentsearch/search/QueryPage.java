package dev.aparikh.torrentsearch.search;

import java.util.List;
import java.util.OptionalLong;

/**
 * One window of backend results. Backends that report the total with every page (the index)
 * fill in {@code totalHits}; the others leave it empty and are counted separately.
 */
public record QueryPage<T>(List<T> items, OptionalLong totalHits) {

    public QueryPage {
        items = items == null ? List.of() : List.copyOf(items);
        totalHits = totalHits == null ? OptionalLong.empty() : totalHits;
    }

    public static <T> QueryPage<T> of(List<T> items) {
        return new QueryPage<>(items, OptionalLong.empty());
    }

    public static <T> QueryPage<T> of(List<T> items, long totalHits) {
        return new QueryPage<>(items, OptionalLong.of(totalHits));
    }
}
