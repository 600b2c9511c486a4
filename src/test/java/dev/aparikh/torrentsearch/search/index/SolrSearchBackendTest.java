package dev.aparikh.torrentsearch.search.index;

import dev.aparikh.torrentsearch.model.Torrent;
import dev.aparikh.torrentsearch.model.TorrentFlag;
import dev.aparikh.torrentsearch.search.CountedQuery;
import dev.aparikh.torrentsearch.search.ParsedTerm;
import dev.aparikh.torrentsearch.search.QueryPage;
import dev.aparikh.torrentsearch.search.SearchBackendException;
import dev.aparikh.torrentsearch.search.SearchRequest;
import dev.aparikh.torrentsearch.search.TermParser;
import dev.aparikh.torrentsearch.search.Viewer;
import org.apache.solr.client.solrj.SolrClient;
import org.apache.solr.client.solrj.SolrQuery;
import org.apache.solr.client.solrj.SolrServerException;
import org.apache.solr.client.solrj.response.QueryResponse;
import org.apache.solr.common.SolrDocument;
import org.apache.solr.common.SolrDocumentList;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SolrSearchBackendTest {

    @Mock
    private SolrClient solrClient;

    @Mock
    private QueryResponse queryResponse;

    private SolrSearchBackend backend;

    @BeforeEach
    void setUp() {
        backend = new SolrSearchBackend(solrClient, new SolrQueryBuilder(true), 1000, 0);
    }

    private CountedQuery<Torrent> prepare(String term) {
        SearchRequest request = SearchRequest.builder().term(term).build();
        ParsedTerm parsed = new TermParser().parse(term);
        return backend.prepare(request, parsed, Viewer.ANONYMOUS);
    }

    private void respondWith(long numFound, SolrDocument... docs) throws Exception {
        SolrDocumentList results = new SolrDocumentList();
        results.addAll(List.of(docs));
        results.setNumFound(numFound);
        when(queryResponse.getResults()).thenReturn(results);
        when(solrClient.query(any(SolrQuery.class))).thenReturn(queryResponse);
    }

    private static SolrDocument doc(long id, String name) {
        SolrDocument d = new SolrDocument();
        d.setField(Torrent.FIELD_ID, String.valueOf(id));
        d.setField(Torrent.FIELD_TORRENT_ID, id);
        d.setField(Torrent.FIELD_DISPLAY_NAME, name);
        d.setField(Torrent.FIELD_UPLOADER_ID, 5L);
        d.setField(Torrent.FIELD_MAIN_CATEGORY_ID, 1);
        d.setField(Torrent.FIELD_SUB_CATEGORY_ID, 2);
        d.setField(Torrent.FIELD_FILESIZE, 2048L);
        d.setField(Torrent.FIELD_SEED_COUNT, 12);
        d.setField("trusted", true);
        d.setField("remake", false);
        return d;
    }

    @Test
    void fetchSetsWindowAndMapsDocuments() throws Exception {
        respondWith(42, doc(9, "Hello World"));

        QueryPage<Torrent> page = prepare("hello").fetch(20, 10);

        ArgumentCaptor<SolrQuery> captor = ArgumentCaptor.forClass(SolrQuery.class);
        verify(solrClient).query(captor.capture());
        assertThat(captor.getValue().getStart()).isEqualTo(20);
        assertThat(captor.getValue().getRows()).isEqualTo(10);

        assertThat(page.totalHits()).hasValue(42);
        Torrent torrent = page.items().get(0);
        assertThat(torrent.id()).isEqualTo(9);
        assertThat(torrent.displayName()).isEqualTo("Hello World");
        assertThat(torrent.uploaderId()).isEqualTo(5L);
        assertThat(torrent.subCategoryId()).isEqualTo(2);
        assertThat(torrent.seeders()).isEqualTo(12);
        assertThat(torrent.flagSet()).containsExactly(TorrentFlag.TRUSTED);
        assertThat(torrent.highlightedName()).isNull();
    }

    @Test
    void fetchAttachesHighlightedName() throws Exception {
        respondWith(1, doc(9, "Hello World"));
        when(queryResponse.getHighlighting()).thenReturn(Map.of(
                "9", Map.of(Torrent.FIELD_DISPLAY_NAME, List.of("<em class=\"hlt1\">Hello</em> World"))));

        Torrent torrent = prepare("hello").fetch(0, 10).items().get(0);

        assertThat(torrent.highlightedName()).isEqualTo("<em class=\"hlt1\">Hello</em> World");
    }

    @Test
    void fetchStopsAtResultWindow() throws Exception {
        respondWith(5000, doc(1, "a"));

        QueryPage<Torrent> page = prepare("a").fetch(990, 75);

        ArgumentCaptor<SolrQuery> captor = ArgumentCaptor.forClass(SolrQuery.class);
        verify(solrClient).query(captor.capture());
        assertThat(captor.getValue().getRows()).isEqualTo(10);
        assertThat(page.totalHits()).hasValue(1000);
    }

    @Test
    void fetchBeyondResultWindowDoesNotQuery() throws Exception {
        QueryPage<Torrent> page = prepare("a").fetch(1000, 75);

        assertThat(page.items()).isEmpty();
        verify(solrClient, never()).query(any(SolrQuery.class));
    }

    @Test
    void countRequestsNoRowsAndNoHighlighting() throws Exception {
        respondWith(1500);

        long count = prepare("a").count();

        ArgumentCaptor<SolrQuery> captor = ArgumentCaptor.forClass(SolrQuery.class);
        verify(solrClient).query(captor.capture());
        assertThat(captor.getValue().getRows()).isZero();
        assertThat(captor.getValue().getHighlight()).isFalse();
        assertThat(count).isEqualTo(1000);
    }

    @Test
    void countKeyDependsOnQueryShapeOnly() {
        assertThat(prepare("a").countKey()).isEqualTo(prepare("a").countKey());
        assertThat(prepare("a").countKey()).isNotEqualTo(prepare("b").countKey());
        assertThat(prepare("a").countKey()).startsWith("index:").doesNotContain("hl=true");
    }

    @Test
    void wrapsSolrFailures() throws Exception {
        when(solrClient.query(any(SolrQuery.class))).thenThrow(new SolrServerException("down"));
        CountedQuery<Torrent> query = prepare("a");

        assertThatThrownBy(() -> query.fetch(0, 10))
                .isInstanceOf(SearchBackendException.class)
                .hasMessage("Search failed")
                .hasCauseInstanceOf(SolrServerException.class);
        assertThatThrownBy(query::count)
                .isInstanceOf(SearchBackendException.class)
                .hasMessage("Hit count failed");
    }

    @Test
    void pageLimitFollowsResultWindow() {
        SolrSearchBackend capped = new SolrSearchBackend(solrClient, new SolrQueryBuilder(false), 1000, 5);

        assertThat(backend.pageLimit(75, false)).isEqualTo(14);
        assertThat(backend.pageLimit(100, true)).isEqualTo(10);
        assertThat(capped.pageLimit(75, false)).isEqualTo(5);
        assertThat(capped.pageLimit(75, true)).isEqualTo(14);
    }

    @Test
    void readsIdFromUniqueKeyWhenNumericIdIsMissing() {
        SolrDocument d = new SolrDocument();
        d.setField(Torrent.FIELD_ID, "17");
        d.setField(Torrent.FIELD_DISPLAY_NAME, "x");

        Torrent torrent = SolrSearchBackend.fromSolrDoc(d);

        assertThat(torrent.id()).isEqualTo(17);
        assertThat(torrent.uploaderId()).isNull();
        assertThat(torrent.flags()).isZero();
    }
}
