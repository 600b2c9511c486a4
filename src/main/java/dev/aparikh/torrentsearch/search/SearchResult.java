package dev.aparikh.torrentsearch.search;

import dev.aparikh.torrentsearch.model.Torrent;

/**
 * A page of torrents together with the normalized request that produced it.
 */
public record SearchResult(
        SearchRequest request,
        PagedResult<Torrent> page
) {
}
