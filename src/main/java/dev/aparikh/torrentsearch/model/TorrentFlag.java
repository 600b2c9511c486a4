package dev.aparikh.torrentsearch.model;

/**
 * Bit flags stored on every torrent. The relational store keeps them packed in a single
 * integer column, the index keeps one boolean field per flag.
 */
public enum TorrentFlag {
    ANONYMOUS(1, "anonymous"),
    HIDDEN(2, "hidden"),
    TRUSTED(4, "trusted"),
    REMAKE(8, "remake"),
    COMPLETE(16, "complete"),
    DELETED(32, "deleted");

    private final int mask;
    private final String indexField;

    TorrentFlag(int mask, String indexField) {
        this.mask = mask;
        this.indexField = indexField;
    }

    public int mask() {
        return mask;
    }

    public String indexField() {
        return indexField;
    }

    public static int pack(TorrentFlag... flags) {
        int bits = 0;
        for (TorrentFlag flag : flags) {
            bits |= flag.mask;
        }
        return bits;
    }
}
