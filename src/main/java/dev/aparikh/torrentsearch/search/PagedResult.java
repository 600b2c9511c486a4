package dev.aparikh.torrentsearch.search;

import java.util.ArrayList;
import java.util.List;

/**
 * One page of search results, shaped the same whichever backend produced it.
 *
 * @param total              reported total, possibly capped by the page limit; never below {@code items.size()}
 * @param uncappedTotal      total before the page cap was applied
 * @param effectivePageCount number of pages {@code total} spans
 */
public record PagedResult<T>(
        List<T> items,
        long page,
        int perPage,
        long total,
        long uncappedTotal,
        long effectivePageCount
) {
    public PagedResult {
        items = List.copyOf(items);
        if (total < items.size()) {
            throw new IllegalArgumentException("total must be >= number of items");
        }
    }

    public static <T> PagedResult<T> of(List<T> items, long page, int perPage, long total, long uncappedTotal) {
        return new PagedResult<>(items, page, perPage, total, uncappedTotal, pageCount(total, perPage));
    }

    static long pageCount(long total, int perPage) {
        if (perPage <= 0 || total <= 0) {
            return 0;
        }
        return Math.max(1, (total + perPage - 1) / perPage);
    }

    public boolean hasPrev() {
        return page > 1;
    }

    public boolean hasNext() {
        return page < effectivePageCount;
    }

    public Long prevNum() {
        return hasPrev() ? page - 1 : null;
    }

    public Long nextNum() {
        return hasNext() ? page + 1 : null;
    }

    /** 1-based position of the first item on this page, 0 when the page is empty. */
    public long first() {
        return items.isEmpty() ? 0 : (page - 1) * perPage + 1;
    }

    /** 1-based position of the last item on this page, 0 when the page is empty. */
    public long last() {
        return items.isEmpty() ? 0 : Math.min(total, page * perPage);
    }

    /**
     * Page numbers for a pagination widget: the edges plus a window around the current page.
     * A {@code null} marks a skipped run of pages.
     */
    public List<Long> iterPages(int leftEdge, int leftCurrent, int rightCurrent, int rightEdge) {
        List<Long> pages = new ArrayList<>();
        long last = 0;
        for (long num = 1; num <= effectivePageCount; num++) {
            boolean inLeftEdge = num <= leftEdge;
            boolean aroundCurrent = num > page - leftCurrent - 1 && num < page + rightCurrent;
            boolean inRightEdge = num > effectivePageCount - rightEdge;
            if (inLeftEdge || aroundCurrent || inRightEdge) {
                if (last + 1 != num) {
                    pages.add(null);
                }
                pages.add(num);
                last = num;
            } else if (num > leftEdge && num < page - leftCurrent) {
                // jump over the gap instead of walking it, page counts can be huge
                num = page - leftCurrent - 1;
            } else if (num >= page + rightCurrent && num <= effectivePageCount - rightEdge) {
                num = effectivePageCount - rightEdge;
            }
        }
        return pages;
    }

    public List<Long> iterPages() {
        return iterPages(2, 2, 5, 2);
    }
}
