package dev.aparikh.torrentsearch.search.relational;

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

import java.util.ArrayList;
import java.util.List;

/**
 * Translates a search request into SQL over the {@code torrents} and {@code statistics} tables.
 * <p>
 * Predicates are emitted once and shared by the listing and the count statement. Flags are tested
 * against the packed {@code flags} column. Quoted literals become {@code LIKE} substring tests on the
 * display name; the remaining free text is split on whitespace and every token of at least
 * {@code minTokenLength} characters must match the full-text index.
 */
public class SqlQueryBuilder {

    static final String TORRENTS_TABLE = "torrents";
    static final String STATISTICS_TABLE = "statistics";

    private static final String SELECT_COLUMNS = "SELECT t.id, t.display_name, t.uploader_id, t.flags, "
            + "t.main_category_id, t.sub_category_id, t.filesize, t.comment_count, "
            + "s.seed_count, s.leech_count, s.download_count ";
    private static final String FULLTEXT_MATCH = "MATCH (t.display_name) AGAINST (? IN NATURAL LANGUAGE MODE)";

    private final int minTokenLength;
    private final IndexHintResolver indexHints;

    /**
     * @param indexHints resolver for {@code USE INDEX FOR ORDER BY} hints on sort columns, {@code null} to never hint
     */
    public SqlQueryBuilder(int minTokenLength, IndexHintResolver indexHints) {
        this.minTokenLength = minTokenLength;
        this.indexHints = indexHints;
    }

    public SqlQuery build(SearchRequest request, ParsedTerm parsedTerm, Viewer viewer) {
        List<String> where = new ArrayList<>();
        List<Object> params = new ArrayList<>();

        for (FilterClause clause : SearchFilters.build(request, viewer)) {
            where.add(toSql(clause, params));
        }
        if (parsedTerm != null && !parsedTerm.isEmpty()) {
            applyTerm(parsedTerm, where, params);
        }

        String whereSql = where.isEmpty() ? "" : "WHERE " + String.join(" AND ", where) + " ";
        SortColumn sort = sortColumn(request.sortKey());
        String direction = request.sortOrder() == SortOrder.DESC ? "DESC" : "ASC";

        StringBuilder select = new StringBuilder(SELECT_COLUMNS)
                .append("FROM ").append(TORRENTS_TABLE).append(" t ")
                .append("LEFT JOIN ").append(STATISTICS_TABLE).append(" s ")
                .append(indexHint(sort))
                .append("ON s.torrent_id = t.id ")
                .append(whereSql)
                .append("ORDER BY ").append(sort.qualified()).append(' ').append(direction);
        if (request.sortKey() != SortKey.ID) {
            select.append(", t.id DESC");
        }

        String count = "SELECT COUNT(*) FROM " + TORRENTS_TABLE + " t " + whereSql;
        return new SqlQuery(select.toString(), count.trim(), params);
    }

    private void applyTerm(ParsedTerm term, List<String> where, List<Object> params) {
        for (String phrase : term.requiredPhrases()) {
            where.add("t.display_name LIKE ?");
            params.add(containsPattern(phrase));
        }
        for (String phrase : term.excludedPhrases()) {
            where.add("t.display_name NOT LIKE ?");
            params.add(containsPattern(phrase));
        }
        for (ParsedTerm.PhraseGroup group : term.requiredPhraseGroups()) {
            List<String> alternatives = new ArrayList<>();
            for (String phrase : group.alternatives()) {
                alternatives.add("t.display_name LIKE ?");
                params.add(containsPattern(phrase));
            }
            String disjunction = "(" + String.join(" OR ", alternatives) + ")";
            where.add(group.negated() ? "NOT " + disjunction : disjunction);
        }
        for (String token : tokens(term.residualText())) {
            where.add(FULLTEXT_MATCH);
            params.add(token);
        }
    }

    List<String> tokens(String residualText) {
        if (residualText == null || residualText.isBlank()) {
            return List.of();
        }
        List<String> tokens = new ArrayList<>();
        for (String token : residualText.trim().split("\\s+")) {
            if (token.codePointCount(0, token.length()) >= minTokenLength) {
                tokens.add(token);
            }
        }
        return tokens;
    }

    static String toSql(FilterClause clause, List<Object> params) {
        if (clause instanceof FlagClause flag) {
            return "(t.flags & " + flag.flag().mask() + ") " + (flag.value() ? "<> 0" : "= 0");
        }
        if (clause instanceof UploaderClause uploader) {
            params.add(uploader.uploaderId());
            return "t.uploader_id = ?";
        }
        if (clause instanceof CategoryClause category) {
            params.add(category.mainCategoryId());
            if (!category.hasSubCategory()) {
                return "t.main_category_id = ?";
            }
            params.add(category.subCategoryId());
            return "(t.main_category_id = ? AND t.sub_category_id = ?)";
        }
        if (clause instanceof AnyOfClause anyOf) {
            List<String> alternatives = new ArrayList<>();
            for (FilterClause alternative : anyOf.alternatives()) {
                alternatives.add(toSql(alternative, params));
            }
            return "(" + String.join(" OR ", alternatives) + ")";
        }
        throw new IllegalStateException("Unsupported filter clause: " + clause);
    }

    static String containsPattern(String literal) {
        String escaped = literal.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
        return "%" + escaped + "%";
    }

    // scoped to ORDER BY so the join lookup on the statistics primary key stays available
    private String indexHint(SortColumn sort) {
        if (indexHints == null || !STATISTICS_TABLE.equals(sort.table())) {
            return "";
        }
        return indexHints.indexFor(sort.table(), sort.column())
                .map(index -> "USE INDEX FOR ORDER BY (" + index + ") ")
                .orElse("");
    }

    static SortColumn sortColumn(SortKey sortKey) {
        return switch (sortKey) {
            case ID -> new SortColumn(TORRENTS_TABLE, "t", "id");
            case SIZE -> new SortColumn(TORRENTS_TABLE, "t", "filesize");
            case COMMENTS -> new SortColumn(TORRENTS_TABLE, "t", "comment_count");
            case SEEDERS -> new SortColumn(STATISTICS_TABLE, "s", "seed_count");
            case LEECHERS -> new SortColumn(STATISTICS_TABLE, "s", "leech_count");
            case DOWNLOADS -> new SortColumn(STATISTICS_TABLE, "s", "download_count");
        };
    }

    record SortColumn(String table, String alias, String column) {
        String qualified() {
            return alias + "." + column;
        }
    }
}
