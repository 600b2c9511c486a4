package dev.aparikh.torrentsearch.search;

import java.util.Locale;

/**
 * Sortable listing keys. Sorting by name is not offered: it is slow on both backends.
 */
public enum SortKey {
    ID("id"),
    SIZE("size"),
    COMMENTS("comments"),
    SEEDERS("seeders"),
    LEECHERS("leechers"),
    DOWNLOADS("downloads");

    private final String parameter;

    SortKey(String parameter) {
        this.parameter = parameter;
    }

    public String parameter() {
        return parameter;
    }

    public static SortKey fromParameter(String value) {
        if (value == null || value.isBlank()) {
            return ID;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (SortKey key : values()) {
            if (key.parameter.equals(normalized)) {
                return key;
            }
        }
        throw new InvalidSearchRequestException("Unknown sort key: " + value);
    }
}
