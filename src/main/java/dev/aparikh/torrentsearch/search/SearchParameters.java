package dev.aparikh.torrentsearch.search;

/**
 * Raw listing parameters as they arrive in the query string ({@code q}, {@code c}, {@code f},
 * {@code s}, {@code o}, {@code p}, {@code u}). Any of them may be null.
 */
public record SearchParameters(
        String term,
        String category,
        String filter,
        String sort,
        String order,
        Long page,
        Integer perPage,
        Long userId
) {
    public static SearchParameters empty() {
        return new SearchParameters(null, null, null, null, null, null, null, null);
    }
}
