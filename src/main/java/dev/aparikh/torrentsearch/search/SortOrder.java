package dev.aparikh.torrentsearch.search;

import java.util.Locale;

public enum SortOrder {
    ASC,
    DESC;

    public static SortOrder fromParameter(String value) {
        if (value == null || value.isBlank()) {
            return DESC;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "asc" -> ASC;
            case "desc" -> DESC;
            default -> throw new InvalidSearchRequestException("Unknown sort order: " + value);
        };
    }

    public String parameter() {
        return name().toLowerCase(Locale.ROOT);
    }
}
