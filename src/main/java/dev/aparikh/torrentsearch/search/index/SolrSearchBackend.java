package dev.aparikh.torrentsearch.search.index;

import dev.aparikh.torrentsearch.model.Torrent;
import dev.aparikh.torrentsearch.model.TorrentFlag;
import dev.aparikh.torrentsearch.search.CountedQuery;
import dev.aparikh.torrentsearch.search.ParsedTerm;
import dev.aparikh.torrentsearch.search.QueryPage;
import dev.aparikh.torrentsearch.search.SearchBackendException;
import dev.aparikh.torrentsearch.search.SearchRequest;
import dev.aparikh.torrentsearch.search.TorrentSearchBackend;
import dev.aparikh.torrentsearch.search.Viewer;
import org.apache.solr.client.solrj.SolrClient;
import org.apache.solr.client.solrj.SolrQuery;
import org.apache.solr.client.solrj.SolrServerException;
import org.apache.solr.client.solrj.response.QueryResponse;
import org.apache.solr.common.SolrDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Searches the Solr torrent index. Solr only serves the first {@code maxSearchResults} hits of a query,
 * so totals are capped to that window and pages beyond it are unreachable.
 */
public class SolrSearchBackend implements TorrentSearchBackend {

    private static final Logger LOG = LoggerFactory.getLogger(SolrSearchBackend.class);

    private final SolrClient solr;
    private final SolrQueryBuilder queryBuilder;
    private final int maxSearchResults;
    private final int maxPages;

    public SolrSearchBackend(SolrClient solr, SolrQueryBuilder queryBuilder, int maxSearchResults, int maxPages) {
        this.solr = solr;
        this.queryBuilder = queryBuilder;
        this.maxSearchResults = maxSearchResults;
        this.maxPages = maxPages;
    }

    @Override
    public CountedQuery<Torrent> prepare(SearchRequest request, ParsedTerm term, Viewer viewer) {
        SolrQuery query = queryBuilder.build(request, term, viewer);
        LOG.debug("Built index query {}", query);
        return new SolrCountedQuery(query);
    }

    @Override
    public int pageLimit(int perPage, boolean privileged) {
        int windowPages = (int) Math.ceil(maxSearchResults / (double) perPage);
        if (!privileged && maxPages > 0) {
            return Math.min(windowPages, maxPages);
        }
        return windowPages;
    }

    @Override
    public String name() {
        return "index";
    }

    private final class SolrCountedQuery implements CountedQuery<Torrent> {

        private final SolrQuery query;

        private SolrCountedQuery(SolrQuery query) {
            this.query = query;
        }

        @Override
        public QueryPage<Torrent> fetch(long offset, int limit) {
            if (offset >= maxSearchResults) {
                return QueryPage.of(List.of());
            }
            SolrQuery q = query.getCopy();
            q.setStart((int) offset);
            q.setRows((int) Math.min(limit, maxSearchResults - offset));
            QueryResponse resp = execute(q, "Search failed");
            Map<String, Map<String, List<String>>> highlighting = resp.getHighlighting();
            List<Torrent> torrents = resp.getResults().stream()
                    .map(d -> withHighlight(fromSolrDoc(d), d, highlighting))
                    .toList();
            return QueryPage.of(torrents, capped(resp.getResults().getNumFound()));
        }

        @Override
        public long count() {
            SolrQuery q = query.getCopy();
            q.setRows(0); // We only want the count, no documents
            q.setHighlight(false);
            return capped(execute(q, "Hit count failed").getResults().getNumFound());
        }

        @Override
        public String countKey() {
            SolrQuery q = query.getCopy();
            q.setHighlight(false);
            return "index:" + q.toQueryString();
        }
    }

    private long capped(long numFound) {
        return Math.min(numFound, maxSearchResults);
    }

    private QueryResponse execute(SolrQuery q, String failure) {
        try {
            return solr.query(q);
        } catch (SolrServerException | IOException | RuntimeException e) {
            throw new SearchBackendException(failure, e);
        }
    }

    private static Torrent withHighlight(Torrent torrent, SolrDocument d,
                                         Map<String, Map<String, List<String>>> highlighting) {
        if (highlighting == null) return torrent;
        Map<String, List<String>> fields = highlighting.get(getFieldAsString(d, Torrent.FIELD_ID));
        if (fields == null) return torrent;
        List<String> snippets = fields.get(Torrent.FIELD_DISPLAY_NAME);
        if (snippets == null || snippets.isEmpty()) return torrent;
        return torrent.withHighlightedName(snippets.get(0));
    }

    static Torrent fromSolrDoc(SolrDocument d) {
        String displayName = getFieldAsString(d, Torrent.FIELD_DISPLAY_NAME);
        Long uploaderId = getLong(d, Torrent.FIELD_UPLOADER_ID);
        Long torrentId = getLong(d, Torrent.FIELD_TORRENT_ID);
        if (torrentId == null) {
            torrentId = Long.valueOf(getFieldAsString(d, Torrent.FIELD_ID));
        }
        int flags = 0;
        for (TorrentFlag flag : TorrentFlag.values()) {
            if (Boolean.TRUE.equals(getBoolean(d, flag.indexField()))) {
                flags |= flag.mask();
            }
        }
        return new Torrent(
                torrentId,
                displayName,
                uploaderId,
                flags,
                (int) getLongOrZero(d, Torrent.FIELD_MAIN_CATEGORY_ID),
                (int) getLongOrZero(d, Torrent.FIELD_SUB_CATEGORY_ID),
                getLongOrZero(d, Torrent.FIELD_FILESIZE),
                (int) getLongOrZero(d, Torrent.FIELD_COMMENT_COUNT),
                getLongOrZero(d, Torrent.FIELD_SEED_COUNT),
                getLongOrZero(d, Torrent.FIELD_LEECH_COUNT),
                getLongOrZero(d, Torrent.FIELD_DOWNLOAD_COUNT),
                null);
    }

    private static Object firstValue(SolrDocument d, String fieldName) {
        Object value = d.getFieldValue(fieldName);
        if (value instanceof Collection<?> collection) {
            return collection.isEmpty() ? null : collection.iterator().next();
        }
        return value;
    }

    private static String getFieldAsString(SolrDocument d, String fieldName) {
        Object value = firstValue(d, fieldName);
        return value == null ? null : String.valueOf(value);
    }

    private static Long getLong(SolrDocument d, String fieldName) {
        Object value = firstValue(d, fieldName);
        if (value == null) return null;
        if (value instanceof Number n) return n.longValue();
        return Long.valueOf(value.toString());
    }

    private static long getLongOrZero(SolrDocument d, String fieldName) {
        Long value = getLong(d, fieldName);
        return value == null ? 0L : value;
    }

    private static Boolean getBoolean(SolrDocument d, String fieldName) {
        Object value = firstValue(d, fieldName);
        if (value == null) return null;
        if (value instanceof Boolean b) return b;
        return Boolean.valueOf(value.toString());
    }
}
