package dev.aparikh.torrentsearch.search;

import dev.aparikh.torrentsearch.model.TorrentFlag;

/**
 * Coarse quality classification, selected by the {@code f} parameter.
 * Each value other than {@link #NONE} maps to exactly one flag predicate.
 */
public enum QualityFilter {
    NONE("0", null, false),
    NO_REMAKES("1", TorrentFlag.REMAKE, false),
    TRUSTED_ONLY("2", TorrentFlag.TRUSTED, true),
    COMPLETED_ONLY("3", TorrentFlag.COMPLETE, true);

    private final String parameter;
    private final TorrentFlag flag;
    private final boolean required;

    QualityFilter(String parameter, TorrentFlag flag, boolean required) {
        this.parameter = parameter;
        this.flag = flag;
        this.required = required;
    }

    public String parameter() {
        return parameter;
    }

    /** Flag constrained by this filter, or {@code null} for {@link #NONE}. */
    public TorrentFlag flag() {
        return flag;
    }

    /** Value the flag must have. */
    public boolean required() {
        return required;
    }

    public static QualityFilter fromParameter(String value) {
        if (value == null || value.isBlank()) {
            return NONE;
        }
        for (QualityFilter filter : values()) {
            if (filter.parameter.equals(value.trim())) {
                return filter;
            }
        }
        throw new InvalidSearchRequestException("Unknown quality filter: " + value);
    }
}
