package dev.aparikh.torrentsearch.search.filter;

import dev.aparikh.torrentsearch.model.Torrent;

public record UploaderClause(long uploaderId) implements FilterClause {

    @Override
    public boolean matches(Torrent torrent) {
        return torrent.uploaderId() != null && torrent.uploaderId() == uploaderId;
    }
}
