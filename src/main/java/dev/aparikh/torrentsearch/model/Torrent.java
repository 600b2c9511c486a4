package dev.aparikh.torrentsearch.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Torrent record as listed by search. Fetched from either Solr or the relational store.
 * {@code highlightedName} is only populated by the index backend when highlighting is enabled.
 */
public record Torrent(
        long id,
        String displayName,
        Long uploaderId,
        int flags,
        int mainCategoryId,
        int subCategoryId,
        long filesize,
        int commentCount,
        long seeders,
        long leechers,
        long downloads,
        String highlightedName
) {
    // Solr field names - centralized constants for use across the application
    public static final String FIELD_ID = "id";
    // numeric copy of the id; the unique key is a string and can't be sorted numerically
    public static final String FIELD_TORRENT_ID = "torrent_id";
    public static final String FIELD_DISPLAY_NAME = "display_name";
    public static final String FIELD_DISPLAY_NAME_EXACT = "display_name_exact";
    public static final String FIELD_DISPLAY_NAME_FULLWORD = "display_name_fullword";
    public static final String FIELD_UPLOADER_ID = "uploader_id";
    public static final String FIELD_MAIN_CATEGORY_ID = "main_category_id";
    public static final String FIELD_SUB_CATEGORY_ID = "sub_category_id";
    public static final String FIELD_FILESIZE = "filesize";
    public static final String FIELD_COMMENT_COUNT = "comment_count";
    public static final String FIELD_SEED_COUNT = "seed_count";
    public static final String FIELD_LEECH_COUNT = "leech_count";
    public static final String FIELD_DOWNLOAD_COUNT = "download_count";

    public boolean has(TorrentFlag flag) {
        return (flags & flag.mask()) != 0;
    }

    public Set<TorrentFlag> flagSet() {
        EnumSet<TorrentFlag> set = EnumSet.noneOf(TorrentFlag.class);
        for (TorrentFlag flag : TorrentFlag.values()) {
            if (has(flag)) set.add(flag);
        }
        return set;
    }

    public Torrent withHighlightedName(String highlighted) {
        return new Torrent(id, displayName, uploaderId, flags, mainCategoryId, subCategoryId,
                filesize, commentCount, seeders, leechers, downloads, highlighted);
    }
}
