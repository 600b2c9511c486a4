package dev.aparikh.torrentsearch.search.filter;

import dev.aparikh.torrentsearch.model.Torrent;
import dev.aparikh.torrentsearch.model.TorrentFlag;

public record FlagClause(TorrentFlag flag, boolean value) implements FilterClause {

    public static FlagClause isSet(TorrentFlag flag) {
        return new FlagClause(flag, true);
    }

    public static FlagClause isNotSet(TorrentFlag flag) {
        return new FlagClause(flag, false);
    }

    @Override
    public boolean matches(Torrent torrent) {
        return torrent.has(flag) == value;
    }
}
