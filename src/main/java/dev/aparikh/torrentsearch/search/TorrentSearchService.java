package dev.aparikh.torrentsearch.search;

import dev.aparikh.torrentsearch.catalog.CategoryCatalog;
import dev.aparikh.torrentsearch.catalog.UserDirectory;
import dev.aparikh.torrentsearch.config.TorrentSearchProperties;
import dev.aparikh.torrentsearch.model.Torrent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;

/**
 * Entry point of torrent search: validates a request, parses its text, has the configured backend
 * build the query and pages the results.
 */
public class TorrentSearchService {

    private static final Logger LOG = LoggerFactory.getLogger(TorrentSearchService.class);

    private final TorrentSearchBackend backend;
    private final TermParser termParser;
    private final PaginatedResultAssembler assembler;
    private final CategoryCatalog categories;
    private final UserDirectory users;
    private final TorrentSearchProperties properties;

    public TorrentSearchService(TorrentSearchBackend backend,
                                TermParser termParser,
                                PaginatedResultAssembler assembler,
                                CategoryCatalog categories,
                                UserDirectory users,
                                TorrentSearchProperties properties) {
        this.backend = backend;
        this.termParser = termParser;
        this.assembler = assembler;
        this.categories = categories;
        this.users = users;
        this.properties = properties;
    }

    public SearchResult search(SearchParameters params, Viewer viewer, boolean feedView) {
        SearchRequest request = toRequest(params, feedView);
        return new SearchResult(request, search(request, viewer));
    }

    public PagedResult<Torrent> search(SearchRequest request, Viewer viewer) {
        checkReferences(request);

        ParsedTerm term = request.termOpt().map(termParser::parse).orElse(ParsedTerm.EMPTY);
        CountedQuery<Torrent> query = backend.prepare(request, term, viewer);

        int perPage = request.feedView() ? Math.min(request.perPage(), properties.getFeedMaxResults()) : request.perPage();
        int maxPage = backend.pageLimit(perPage, request.isPrivileged(viewer));

        PagedResult<Torrent> result = assembler.execute(query, request.page(), perPage, maxPage, request.feedView());
        LOG.debug("{} search returned {} of {} torrents for page {}",
                backend.name(), result.items().size(), result.total(), result.page());
        return result;
    }

    SearchRequest toRequest(SearchParameters params, boolean feedView) {
        int perPage = params.perPage() != null ? params.perPage() : properties.getDefaultPerPage();
        if (perPage <= 0) {
            throw new InvalidSearchRequestException("perPage must be > 0");
        }
        // u=0 is the same as no user filter
        Long userId = params.userId() != null && params.userId() != 0 ? params.userId() : null;
        return SearchRequest.builder()
                .term(params.term())
                .category(params.category())
                .quality(QualityFilter.fromParameter(params.filter()))
                .sort(SortKey.fromParameter(params.sort()), SortOrder.fromParameter(params.order()))
                .page(params.page() != null ? params.page() : 1)
                .perPage(Math.min(perPage, properties.getMaxPerPage()))
                .feedView(feedView)
                .targetUserId(userId)
                .build();
    }

    private void checkReferences(SearchRequest request) {
        CategoryFilter category = request.category();
        try {
            if (category.isSubCategory()
                    && !categories.subCategoryExists(category.mainCategoryId(), category.subCategoryId())) {
                throw new InvalidSearchRequestException("Unknown category " + category.parameter());
            }
            if (category.isMainOnly() && !categories.mainCategoryExists(category.mainCategoryId())) {
                throw new InvalidSearchRequestException("Unknown category " + category.parameter());
            }
            if (request.targetUserId() != null && !users.userExists(request.targetUserId())) {
                throw new UnknownUserException(request.targetUserId());
            }
        } catch (DataAccessException e) {
            throw new SearchBackendException("Reference lookup failed", e);
        }
    }
}
