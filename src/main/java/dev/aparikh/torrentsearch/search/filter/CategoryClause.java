package dev.aparikh.torrentsearch.search.filter;

import dev.aparikh.torrentsearch.model.Torrent;

/**
 * Main category match, narrowed to one sub category when {@code subCategoryId > 0}.
 */
public record CategoryClause(int mainCategoryId, int subCategoryId) implements FilterClause {

    public boolean hasSubCategory() {
        return subCategoryId > 0;
    }

    @Override
    public boolean matches(Torrent torrent) {
        return torrent.mainCategoryId() == mainCategoryId
                && (!hasSubCategory() || torrent.subCategoryId() == subCategoryId);
    }
}
