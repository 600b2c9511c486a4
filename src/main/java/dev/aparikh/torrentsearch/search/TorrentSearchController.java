package dev.aparikh.torrentsearch.search;

import dev.aparikh.torrentsearch.api.ErrorResponse;
import dev.aparikh.torrentsearch.api.SearchResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.Positive;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST Controller for torrent listing and search.
 * <p>
 * The viewer is identified by the {@code X-Viewer-Id} and {@code X-Viewer-Admin} headers,
 * which the authentication layer in front of this service sets.
 */
@RestController
@RequestMapping("/api/torrents")
@Tag(name = "Torrent Search", description = "Torrent listing, search and feed operations")
public class TorrentSearchController {

    static final String VIEWER_ID_HEADER = "X-Viewer-Id";
    static final String VIEWER_ADMIN_HEADER = "X-Viewer-Admin";

    private final TorrentSearchService torrentSearchService;

    public TorrentSearchController(TorrentSearchService torrentSearchService) {
        this.torrentSearchService = torrentSearchService;
    }

    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(
            summary = "Search torrents with pagination",
            description = "Lists torrents matching free text, category, quality filter and uploader. " +
                    "Quoted phrases are matched literally, -\"phrase\" excludes and \"a\"|\"b\" matches either. " +
                    "Hidden, anonymous and deleted torrents are shown according to the viewer."
    )
    @ApiResponses(value = {
            @ApiResponse(
                    responseCode = "200",
                    description = "Search completed successfully",
                    content = @Content(schema = @Schema(implementation = SearchResponse.class))
            ),
            @ApiResponse(
                    responseCode = "400",
                    description = "Invalid search parameters",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class))
            ),
            @ApiResponse(
                    responseCode = "404",
                    description = "Page beyond the results, or unknown user",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class))
            ),
            @ApiResponse(
                    responseCode = "503",
                    description = "Search backend unavailable",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class))
            )
    })
    public ResponseEntity<SearchResponse> search(
            @Parameter(description = "Search text") @RequestParam(name = "q", required = false) String term,
            @Parameter(description = "Category as <main>_<sub>", example = "1_2") @RequestParam(name = "c", required = false) String category,
            @Parameter(description = "Quality filter: 0 all, 1 no remakes, 2 trusted, 3 completed") @RequestParam(name = "f", required = false) String filter,
            @Parameter(description = "Sort key: id, size, comments, seeders, leechers, downloads") @RequestParam(name = "s", required = false) String sort,
            @Parameter(description = "Sort order: asc or desc") @RequestParam(name = "o", required = false) String order,
            @Parameter(description = "Page number (1-based)") @RequestParam(name = "p", required = false) Long page,
            @Parameter(description = "Results per page") @RequestParam(name = "perPage", required = false) @Positive Integer perPage,
            @Parameter(description = "Only list uploads of this user, 0 for all users") @RequestParam(name = "u", required = false) Long userId,
            @RequestHeader(name = VIEWER_ID_HEADER, required = false) Long viewerId,
            @RequestHeader(name = VIEWER_ADMIN_HEADER, required = false, defaultValue = "false") boolean viewerAdmin) {

        SearchParameters params = new SearchParameters(term, category, filter, sort, order, page, perPage, userId);
        Viewer viewer = toViewer(viewerId, viewerAdmin);
        SearchResult result = torrentSearchService.search(params, viewer, false);
        return ResponseEntity.ok(SearchResponse.from(result, viewer));
    }

    @GetMapping(value = "/feed", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(
            summary = "Feed of the newest torrents",
            description = "Newest matching torrents first, without pagination or total count. " +
                    "Hidden and anonymous uploads are never included."
    )
    public ResponseEntity<SearchResponse> feed(
            @RequestParam(name = "q", required = false) String term,
            @RequestParam(name = "c", required = false) String category,
            @RequestParam(name = "f", required = false) String filter,
            @RequestParam(name = "u", required = false) Long userId,
            @RequestHeader(name = VIEWER_ID_HEADER, required = false) Long viewerId,
            @RequestHeader(name = VIEWER_ADMIN_HEADER, required = false, defaultValue = "false") boolean viewerAdmin) {

        SearchParameters params = new SearchParameters(term, category, filter, null, null, null, null, userId);
        Viewer viewer = toViewer(viewerId, viewerAdmin);
        SearchResult result = torrentSearchService.search(params, viewer, true);
        return ResponseEntity.ok(SearchResponse.from(result, viewer));
    }

    private static Viewer toViewer(Long viewerId, boolean admin) {
        if (viewerId == null) {
            return Viewer.ANONYMOUS;
        }
        return admin ? Viewer.administrator(viewerId) : Viewer.user(viewerId);
    }
}
