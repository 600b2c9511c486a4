package dev.aparikh.torrentsearch.search;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Normalized search criteria.
 * Feed views are always sorted by id, newest first, whatever sort was requested.
 * Pages are validated against {@link #MAX_PAGE} here, before any backend is involved.
 */
public record SearchRequest(
        String term,
        CategoryFilter category,
        QualityFilter quality,
        SortKey sortKey,
        SortOrder sortOrder,
        long page,
        int perPage,
        boolean feedView,
        Long targetUserId
) {
    public static final long MAX_PAGE = 4294967295L;

    public SearchRequest {
        if (page > MAX_PAGE) {
            throw new InvalidSearchRequestException("page must be <= " + MAX_PAGE);
        }
        if (perPage <= 0) {
            throw new InvalidSearchRequestException("perPage must be > 0");
        }
        category = category != null ? category : CategoryFilter.ALL;
        quality = quality != null ? quality : QualityFilter.NONE;
        sortKey = sortKey != null ? sortKey : SortKey.ID;
        sortOrder = sortOrder != null ? sortOrder : SortOrder.DESC;
        if (feedView) {
            sortKey = SortKey.ID;
            sortOrder = SortOrder.DESC;
        }
    }

    public Optional<String> termOpt() {
        return Optional.ofNullable(term).map(String::trim).filter(s -> !s.isEmpty());
    }

    public ViewerCategory viewerCategory(Viewer viewer) {
        return ViewerCategory.of(viewer, targetUserId);
    }

    /**
     * Viewers who bypass the page cap: administrators and users browsing their own uploads.
     */
    public boolean isPrivileged(Viewer viewer) {
        return viewer.administrator() || (targetUserId != null && viewer.is(targetUserId));
    }

    /**
     * Canonical query-string parameters of this request, for building page links.
     */
    public Map<String, String> toQueryParameters() {
        Map<String, String> params = new LinkedHashMap<>();
        termOpt().ifPresent(t -> params.put("q", t));
        params.put("c", category.parameter());
        params.put("f", quality.parameter());
        if (targetUserId != null) {
            params.put("u", String.valueOf(targetUserId));
        }
        return params;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String term;
        private CategoryFilter category = CategoryFilter.ALL;
        private QualityFilter quality = QualityFilter.NONE;
        private SortKey sortKey = SortKey.ID;
        private SortOrder sortOrder = SortOrder.DESC;
        private long page = 1;
        private int perPage = 75;
        private boolean feedView;
        private Long targetUserId;

        public Builder term(String term) {
            this.term = term;
            return this;
        }

        public Builder category(CategoryFilter category) {
            this.category = category;
            return this;
        }

        public Builder category(String category) {
            this.category = CategoryFilter.fromParameter(category);
            return this;
        }

        public Builder quality(QualityFilter quality) {
            this.quality = quality;
            return this;
        }

        public Builder sort(SortKey sortKey, SortOrder sortOrder) {
            this.sortKey = sortKey;
            this.sortOrder = sortOrder;
            return this;
        }

        public Builder page(long page) {
            this.page = page;
            return this;
        }

        public Builder perPage(int perPage) {
            this.perPage = perPage;
            return this;
        }

        public Builder feedView(boolean feedView) {
            this.feedView = feedView;
            return this;
        }

        public Builder targetUserId(Long targetUserId) {
            this.targetUserId = targetUserId;
            return this;
        }

        public SearchRequest build() {
            return new SearchRequest(term, category, quality, sortKey, sortOrder, page, perPage, feedView, targetUserId);
        }
    }
}
