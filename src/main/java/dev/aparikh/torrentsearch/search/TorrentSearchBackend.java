package dev.aparikh.torrentsearch.search;

import dev.aparikh.torrentsearch.model.Torrent;

/**
 * A store torrents can be searched in. Implementations translate a request into their
 * native query but must select the same torrents for the same filters.
 */
public interface TorrentSearchBackend {

    CountedQuery<Torrent> prepare(SearchRequest request, ParsedTerm term, Viewer viewer);

    /**
     * Highest reachable page for the given page size, or 0 when unbounded.
     */
    int pageLimit(int perPage, boolean privileged);

    String name();
}
