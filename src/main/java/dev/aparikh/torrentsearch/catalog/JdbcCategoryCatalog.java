package dev.aparikh.torrentsearch.catalog;

import org.springframework.jdbc.core.JdbcTemplate;

public class JdbcCategoryCatalog implements CategoryCatalog {

    private final JdbcTemplate jdbcTemplate;

    public JdbcCategoryCatalog(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public boolean mainCategoryExists(int mainCategoryId) {
        Integer count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM main_categories WHERE id = ?", Integer.class, mainCategoryId);
        return count != null && count > 0;
    }

    @Override
    public boolean subCategoryExists(int mainCategoryId, int subCategoryId) {
        Integer count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM sub_categories WHERE main_category_id = ? AND id = ?",
                Integer.class, mainCategoryId, subCategoryId);
        return count != null && count > 0;
    }
}
