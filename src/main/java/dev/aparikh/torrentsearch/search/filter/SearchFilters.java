package dev.aparikh.torrentsearch.search.filter;

import dev.aparikh.torrentsearch.model.Torrent;
import dev.aparikh.torrentsearch.model.TorrentFlag;
import dev.aparikh.torrentsearch.search.CategoryFilter;
import dev.aparikh.torrentsearch.search.QualityFilter;
import dev.aparikh.torrentsearch.search.SearchRequest;
import dev.aparikh.torrentsearch.search.Viewer;
import dev.aparikh.torrentsearch.search.Visibility;
import dev.aparikh.torrentsearch.search.VisibilityPolicy;

import java.util.ArrayList;
import java.util.List;

/**
 * Emits the filter clauses of a request once, in a fixed order: uploader, visibility, category, quality.
 * Listing and count queries of both backends are built from this one list.
 */
public final class SearchFilters {

    private SearchFilters() {
    }

    public static List<FilterClause> build(SearchRequest request, Viewer viewer) {
        List<FilterClause> clauses = new ArrayList<>();

        if (request.targetUserId() != null) {
            clauses.add(new UploaderClause(request.targetUserId()));
        }

        Visibility visibility = VisibilityPolicy.resolve(viewer, request);
        if (!visibility.includeDeleted()) {
            clauses.add(FlagClause.isNotSet(TorrentFlag.DELETED));
        }
        if (visibility.restrictToOwnerOrVisible() && viewer.isLoggedIn()) {
            clauses.add(AnyOfClause.of(FlagClause.isNotSet(TorrentFlag.HIDDEN), new UploaderClause(viewer.userId())));
        } else if (!visibility.includeHidden()) {
            clauses.add(FlagClause.isNotSet(TorrentFlag.HIDDEN));
        }
        if (!visibility.includeAnonymous()) {
            clauses.add(FlagClause.isNotSet(TorrentFlag.ANONYMOUS));
        }

        CategoryFilter category = request.category();
        if (!category.isAll()) {
            clauses.add(new CategoryClause(category.mainCategoryId(), category.subCategoryId()));
        }

        QualityFilter quality = request.quality();
        if (quality.flag() != null) {
            clauses.add(new FlagClause(quality.flag(), quality.required()));
        }
        return List.copyOf(clauses);
    }

    public static boolean matchesAll(List<FilterClause> clauses, Torrent torrent) {
        return clauses.stream().allMatch(c -> c.matches(torrent));
    }
}
