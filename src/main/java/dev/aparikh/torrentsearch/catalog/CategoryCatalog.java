package dev.aparikh.torrentsearch.catalog;

/**
 * Category taxonomy lookup.
 */
public interface CategoryCatalog {

    boolean mainCategoryExists(int mainCategoryId);

    boolean subCategoryExists(int mainCategoryId, int subCategoryId);
}
