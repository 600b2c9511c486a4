package dev.aparikh.torrentsearch.search.relational;

import dev.aparikh.torrentsearch.model.Torrent;
import dev.aparikh.torrentsearch.search.CountedQuery;
import dev.aparikh.torrentsearch.search.ParsedTerm;
import dev.aparikh.torrentsearch.search.QueryPage;
import dev.aparikh.torrentsearch.search.SearchBackendException;
import dev.aparikh.torrentsearch.search.SearchRequest;
import dev.aparikh.torrentsearch.search.TorrentSearchBackend;
import dev.aparikh.torrentsearch.search.Viewer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.util.ArrayList;
import java.util.List;

/**
 * Searches the relational torrent store through {@link JdbcTemplate}.
 */
public class JdbcSearchBackend implements TorrentSearchBackend {

    private static final Logger LOG = LoggerFactory.getLogger(JdbcSearchBackend.class);

    static final RowMapper<Torrent> TORRENT_ROW_MAPPER = (rs, rowNum) -> {
        long uploaderId = rs.getLong("uploader_id");
        Long uploader = rs.wasNull() ? null : uploaderId;
        return new Torrent(
                rs.getLong("id"),
                rs.getString("display_name"),
                uploader,
                rs.getInt("flags"),
                rs.getInt("main_category_id"),
                rs.getInt("sub_category_id"),
                rs.getLong("filesize"),
                rs.getInt("comment_count"),
                rs.getLong("seed_count"),
                rs.getLong("leech_count"),
                rs.getLong("download_count"),
                null);
    };

    private final JdbcTemplate jdbcTemplate;
    private final SqlQueryBuilder queryBuilder;
    private final int maxPages;

    public JdbcSearchBackend(JdbcTemplate jdbcTemplate, SqlQueryBuilder queryBuilder, int maxPages) {
        this.jdbcTemplate = jdbcTemplate;
        this.queryBuilder = queryBuilder;
        this.maxPages = maxPages;
    }

    @Override
    public CountedQuery<Torrent> prepare(SearchRequest request, ParsedTerm term, Viewer viewer) {
        SqlQuery query = queryBuilder.build(request, term, viewer);
        LOG.debug("Built relational query {} with {}", query.selectSql(), query.params());
        return new JdbcCountedQuery(query);
    }

    @Override
    public int pageLimit(int perPage, boolean privileged) {
        return privileged ? 0 : maxPages;
    }

    @Override
    public String name() {
        return "relational";
    }

    private final class JdbcCountedQuery implements CountedQuery<Torrent> {

        private final SqlQuery query;

        private JdbcCountedQuery(SqlQuery query) {
            this.query = query;
        }

        @Override
        public QueryPage<Torrent> fetch(long offset, int limit) {
            List<Object> params = new ArrayList<>(query.params());
            params.add(limit);
            params.add(offset);
            try {
                return QueryPage.of(jdbcTemplate.query(query.selectSql() + " LIMIT ? OFFSET ?",
                        TORRENT_ROW_MAPPER, params.toArray()));
            } catch (DataAccessException e) {
                throw new SearchBackendException("Search failed", e);
            }
        }

        @Override
        public long count() {
            try {
                Long count = jdbcTemplate.queryForObject(query.countSql(), Long.class, query.params().toArray());
                return count == null ? 0L : count;
            } catch (DataAccessException e) {
                throw new SearchBackendException("Hit count failed", e);
            }
        }

        @Override
        public String countKey() {
            return "relational:" + query.countSql() + " " + query.params();
        }
    }
}
