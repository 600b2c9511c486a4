package dev.aparikh.torrentsearch.search.index;

import dev.aparikh.torrentsearch.model.Torrent;
import dev.aparikh.torrentsearch.search.ParsedTerm;
import dev.aparikh.torrentsearch.search.SearchRequest;
import dev.aparikh.torrentsearch.search.SortKey;
import dev.aparikh.torrentsearch.search.SortOrder;
import dev.aparikh.torrentsearch.search.Viewer;
import dev.aparikh.torrentsearch.search.filter.AnyOfClause;
import dev.aparikh.torrentsearch.search.filter.CategoryClause;
import dev.aparikh.torrentsearch.search.filter.FilterClause;
import dev.aparikh.torrentsearch.search.filter.FlagClause;
import dev.aparikh.torrentsearch.search.filter.SearchFilters;
import dev.aparikh.torrentsearch.search.filter.UploaderClause;
import org.apache.solr.client.solrj.SolrQuery;
import org.apache.solr.client.solrj.util.ClientUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Translates a search request into a {@link SolrQuery}.
 * <p>
 * Quoted literals become phrase queries on the exact display name field: required ones are {@code +}
 * clauses, excluded ones {@code -} clauses, and {@code "a"|"b"} groups a parenthesised disjunction.
 * The remaining free text goes through edismax over the tokenized display name fields with every
 * word required. Visibility, category and quality clauses become filter queries, one per clause.
 * Paging is left to the caller.
 */
public class SolrQueryBuilder {

    static final String RESIDUAL_PARAM = "residual";
    static final String HIGHLIGHT_PRE = "<em class=\"hlt1\">";
    static final String HIGHLIGHT_POST = "</em>";

    private static final String MATCH_ALL = "*:*";
    // display_name_fullword catches words longer than the n-gram analyzer of display_name indexes
    private static final String RESIDUAL_QUERY = "_query_:\"{!edismax qf='" + Torrent.FIELD_DISPLAY_NAME + " "
            + Torrent.FIELD_DISPLAY_NAME_FULLWORD + "' q.op=AND v=$" + RESIDUAL_PARAM + "}\"";

    private final boolean highlight;

    public SolrQueryBuilder(boolean highlight) {
        this.highlight = highlight;
    }

    public SolrQuery build(SearchRequest request, ParsedTerm parsedTerm, Viewer viewer) {
        SolrQuery q = new SolrQuery();
        ParsedTerm term = parsedTerm != null ? parsedTerm : ParsedTerm.EMPTY;

        applyTerm(q, term);

        for (FilterClause clause : SearchFilters.build(request, viewer)) {
            q.addFilterQuery(toFilterQuery(clause));
        }

        q.setSort(sortField(request.sortKey()),
                request.sortOrder() == SortOrder.DESC ? SolrQuery.ORDER.desc : SolrQuery.ORDER.asc);
        if (request.sortKey() != SortKey.ID) {
            q.addSort(Torrent.FIELD_TORRENT_ID, SolrQuery.ORDER.desc);
        }

        if (highlight && !term.isEmpty()) {
            q.setHighlight(true);
            q.addHighlightField(Torrent.FIELD_DISPLAY_NAME);
            q.setHighlightSimplePre(HIGHLIGHT_PRE);
            q.setHighlightSimplePost(HIGHLIGHT_POST);
        }
        return q;
    }

    private void applyTerm(SolrQuery q, ParsedTerm term) {
        if (term.isEmpty()) {
            q.setQuery(MATCH_ALL);
            return;
        }
        List<String> must = new ArrayList<>();
        List<String> mustNot = new ArrayList<>();

        term.requiredPhrases().forEach(p -> must.add(exactPhrase(p)));
        term.excludedPhrases().forEach(p -> mustNot.add(exactPhrase(p)));
        for (ParsedTerm.PhraseGroup group : term.requiredPhraseGroups()) {
            String disjunction = group.alternatives().stream()
                    .map(SolrQueryBuilder::exactPhrase)
                    .collect(Collectors.joining(" OR ", "(", ")"));
            (group.negated() ? mustNot : must).add(disjunction);
        }
        if (term.hasResidualText()) {
            must.add(RESIDUAL_QUERY);
            q.set(RESIDUAL_PARAM, term.residualText());
        }

        List<String> clauses = new ArrayList<>();
        if (must.isEmpty()) {
            // a purely negative query needs something to subtract from
            clauses.add(MATCH_ALL);
        }
        must.forEach(c -> clauses.add("+" + c));
        mustNot.forEach(c -> clauses.add("-" + c));
        q.setQuery(String.join(" ", clauses));
    }

    static String exactPhrase(String literal) {
        return Torrent.FIELD_DISPLAY_NAME_EXACT + ":\"" + ClientUtils.escapeQueryChars(literal) + "\"";
    }

    static String toFilterQuery(FilterClause clause) {
        if (clause instanceof FlagClause flag) {
            return flag.flag().indexField() + ":" + flag.value();
        }
        if (clause instanceof UploaderClause uploader) {
            return Torrent.FIELD_UPLOADER_ID + ":" + uploader.uploaderId();
        }
        if (clause instanceof CategoryClause category) {
            String main = Torrent.FIELD_MAIN_CATEGORY_ID + ":" + category.mainCategoryId();
            return category.hasSubCategory()
                    ? main + " AND " + Torrent.FIELD_SUB_CATEGORY_ID + ":" + category.subCategoryId()
                    : main;
        }
        if (clause instanceof AnyOfClause anyOf) {
            return anyOf.alternatives().stream()
                    .map(SolrQueryBuilder::toFilterQuery)
                    .collect(Collectors.joining(" OR ", "(", ")"));
        }
        throw new IllegalStateException("Unsupported filter clause: " + clause);
    }

    static String sortField(SortKey sortKey) {
        return switch (sortKey) {
            case ID -> Torrent.FIELD_TORRENT_ID;
            case SIZE -> Torrent.FIELD_FILESIZE;
            case COMMENTS -> Torrent.FIELD_COMMENT_COUNT;
            case SEEDERS -> Torrent.FIELD_SEED_COUNT;
            case LEECHERS -> Torrent.FIELD_LEECH_COUNT;
            case DOWNLOADS -> Torrent.FIELD_DOWNLOAD_COUNT;
        };
    }
}
