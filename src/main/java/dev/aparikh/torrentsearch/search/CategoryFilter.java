package dev.aparikh.torrentsearch.search;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Category selection in {@code <main>_<sub>} form. {@code 0_0} selects everything, {@code N_0}
 * a main category and {@code N_M} one exact sub category. A sub category without a main one is invalid.
 */
public record CategoryFilter(int mainCategoryId, int subCategoryId) {

    public static final CategoryFilter ALL = new CategoryFilter(0, 0);

    private static final Pattern CATEGORY_PATTERN = Pattern.compile("^(\\d+)_(\\d+)$");

    public CategoryFilter {
        if (mainCategoryId < 0 || subCategoryId < 0) {
            throw new InvalidSearchRequestException("Category ids must be non-negative");
        }
        if (mainCategoryId == 0 && subCategoryId > 0) {
            throw new InvalidSearchRequestException("Sub category " + subCategoryId + " requires a main category");
        }
    }

    public static CategoryFilter fromParameter(String value) {
        if (value == null || value.isBlank()) {
            return ALL;
        }
        Matcher matcher = CATEGORY_PATTERN.matcher(value.trim());
        if (!matcher.matches()) {
            throw new InvalidSearchRequestException("Malformed category: " + value);
        }
        try {
            return new CategoryFilter(Integer.parseInt(matcher.group(1)), Integer.parseInt(matcher.group(2)));
        } catch (NumberFormatException e) {
            throw new InvalidSearchRequestException("Malformed category: " + value);
        }
    }

    public boolean isAll() {
        return mainCategoryId == 0;
    }

    public boolean isMainOnly() {
        return mainCategoryId > 0 && subCategoryId == 0;
    }

    public boolean isSubCategory() {
        return mainCategoryId > 0 && subCategoryId > 0;
    }

    public String parameter() {
        return mainCategoryId + "_" + subCategoryId;
    }
}
