package dev.aparikh.torrentsearch.config;

import dev.aparikh.torrentsearch.cache.BoundedExpiringCache;
import dev.aparikh.torrentsearch.catalog.CategoryCatalog;
import dev.aparikh.torrentsearch.catalog.JdbcCategoryCatalog;
import dev.aparikh.torrentsearch.catalog.JdbcUserDirectory;
import dev.aparikh.torrentsearch.catalog.UserDirectory;
import dev.aparikh.torrentsearch.search.PaginatedResultAssembler;
import dev.aparikh.torrentsearch.search.TermParser;
import dev.aparikh.torrentsearch.search.TorrentSearchBackend;
import dev.aparikh.torrentsearch.search.TorrentSearchService;
import dev.aparikh.torrentsearch.search.index.SolrQueryBuilder;
import dev.aparikh.torrentsearch.search.index.SolrSearchBackend;
import dev.aparikh.torrentsearch.search.relational.IndexHintResolver;
import dev.aparikh.torrentsearch.search.relational.JdbcSearchBackend;
import dev.aparikh.torrentsearch.search.relational.SqlQueryBuilder;
import org.apache.solr.client.solrj.SolrClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

/**
 * Wires the search core. Exactly one {@link TorrentSearchBackend} is created, chosen by
 * {@code torrent-search.backend}.
 */
@Configuration
@EnableConfigurationProperties(TorrentSearchProperties.class)
class SearchConfig {

    private static final Logger LOG = LoggerFactory.getLogger(SearchConfig.class);

    @Bean
    TermParser termParser() {
        return new TermParser();
    }

    @Bean
    PaginatedResultAssembler paginatedResultAssembler(TorrentSearchProperties properties) {
        if (!properties.isCountCacheEnabled()) {
            return new PaginatedResultAssembler();
        }
        LOG.info("Caching result counts for {} ({} entries)",
                properties.getCountCacheDuration(), properties.getCountCacheSize());
        BoundedExpiringCache<String, Long> cache = new BoundedExpiringCache<>(
                properties.getCountCacheSize(), properties.getCountCacheDuration());
        return new PaginatedResultAssembler(cache, properties.getCountCacheDuration());
    }

    @Bean
    CategoryCatalog categoryCatalog(JdbcTemplate jdbcTemplate) {
        return new JdbcCategoryCatalog(jdbcTemplate);
    }

    @Bean
    UserDirectory userDirectory(JdbcTemplate jdbcTemplate) {
        return new JdbcUserDirectory(jdbcTemplate);
    }

    @Bean
    @ConditionalOnProperty(prefix = "torrent-search", name = "backend", havingValue = "index")
    TorrentSearchBackend solrSearchBackend(SolrClient solrClient, TorrentSearchProperties properties) {
        return new SolrSearchBackend(solrClient, new SolrQueryBuilder(properties.isHighlight()),
                properties.getMaxSearchResults(), properties.getMaxPages());
    }

    @Bean
    @ConditionalOnProperty(prefix = "torrent-search", name = "backend", havingValue = "relational", matchIfMissing = true)
    TorrentSearchBackend jdbcSearchBackend(JdbcTemplate jdbcTemplate, TorrentSearchProperties properties) {
        IndexHintResolver hints = properties.isIndexHints() ? new IndexHintResolver(jdbcTemplate) : null;
        return new JdbcSearchBackend(jdbcTemplate, new SqlQueryBuilder(properties.getMinTokenLength(), hints),
                properties.getMaxPages());
    }

    @Bean
    TorrentSearchService torrentSearchService(TorrentSearchBackend backend,
                                              TermParser termParser,
                                              PaginatedResultAssembler assembler,
                                              CategoryCatalog categoryCatalog,
                                              UserDirectory userDirectory,
                                              TorrentSearchProperties properties) {
        LOG.info("Torrent search uses the {} backend", backend.name());
        return new TorrentSearchService(backend, termParser, assembler, categoryCatalog, userDirectory, properties);
    }
}
