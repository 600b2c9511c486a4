package dev.aparikh.torrentsearch.api;

import dev.aparikh.torrentsearch.model.Torrent;
import dev.aparikh.torrentsearch.search.PagedResult;
import dev.aparikh.torrentsearch.search.SearchResult;
import dev.aparikh.torrentsearch.search.Viewer;
import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;
import java.util.Map;

/**
 * Response DTO for torrent listing and search.
 */
@Schema(description = "Torrent search response")
public record SearchResponse(
        @Schema(description = "Torrents on this page")
        List<TorrentView> torrents,

        @Schema(description = "Current page number (1-based)", example = "1")
        long page,

        @Schema(description = "Number of results per page", example = "75")
        int perPage,

        @Schema(description = "Total number of matching torrents, capped when the page limit applies", example = "42")
        long total,

        @Schema(description = "Total number of pages", example = "1")
        long pages,

        @Schema(description = "Previous page number, absent on the first page")
        Long prevPage,

        @Schema(description = "Next page number, absent on the last page")
        Long nextPage,

        @Schema(description = "Position of the first torrent on this page (1-based, 0 when empty)", example = "1")
        long first,

        @Schema(description = "Position of the last torrent on this page (1-based, 0 when empty)", example = "42")
        long last,

        @Schema(description = "Page numbers to offer for navigation, null marks skipped pages")
        List<Long> pageNumbers,

        @Schema(description = "Query parameters reproducing this search", example = "{\"q\": \"hello\", \"c\": \"1_2\", \"f\": \"0\"}")
        Map<String, String> query
) {
    public static SearchResponse from(SearchResult result, Viewer viewer) {
        PagedResult<Torrent> page = result.page();
        return new SearchResponse(
                page.items().stream().map(torrent -> TorrentView.of(torrent, viewer)).toList(),
                page.page(),
                page.perPage(),
                page.total(),
                page.effectivePageCount(),
                page.prevNum(),
                page.nextNum(),
                page.first(),
                page.last(),
                page.iterPages(),
                result.request().toQueryParameters()
        );
    }
}
