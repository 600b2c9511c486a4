package dev.aparikh.torrentsearch.search.relational;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Finds the single-column index covering a column, so sorts on joined tables can name it in a
 * {@code USE INDEX FOR ORDER BY} hint. Index names are read from {@code information_schema} once per table and kept
 * for the lifetime of this resolver.
 */
public class IndexHintResolver {

    private static final Logger LOG = LoggerFactory.getLogger(IndexHintResolver.class);

    private static final String SINGLE_COLUMN_INDEXES_SQL =
            "SELECT index_name, MAX(column_name) AS column_name "
                    + "FROM information_schema.statistics "
                    + "WHERE table_schema = DATABASE() AND table_name = ? "
                    + "GROUP BY index_name "
                    + "HAVING COUNT(*) = 1";

    private final JdbcTemplate jdbcTemplate;
    // table -> (column -> index name)
    private final Map<String, Map<String, String>> indexNames = new ConcurrentHashMap<>();

    public IndexHintResolver(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public Optional<String> indexFor(String table, String column) {
        return Optional.ofNullable(indexNames.computeIfAbsent(table, this::loadIndexes).get(column));
    }

    private Map<String, String> loadIndexes(String table) {
        try {
            List<Map<String, Object>> rows = jdbcTemplate.queryForList(SINGLE_COLUMN_INDEXES_SQL, table);
            Map<String, String> byColumn = new HashMap<>();
            for (Map<String, Object> row : rows) {
                Object column = row.get("column_name");
                Object index = row.get("index_name");
                if (column != null && index != null) {
                    byColumn.put(column.toString(), index.toString());
                }
            }
            return Collections.unmodifiableMap(byColumn);
        } catch (RuntimeException e) {
            LOG.warn("Could not read indexes of table {}, sorting without index hints: {}", table, e.getMessage());
            return Map.of();
        }
    }
}
