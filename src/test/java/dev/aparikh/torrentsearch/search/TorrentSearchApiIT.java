package dev.aparikh.torrentsearch.search;

import dev.aparikh.torrentsearch.search.relational.IndexHintResolver;
import dev.aparikh.torrentsearch.search.relational.SqlQuery;
import dev.aparikh.torrentsearch.search.relational.SqlQueryBuilder;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import org.testcontainers.containers.MySQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Full stack over MySQL: HTTP parameters and viewer headers down to the relational backend.
 */
@Testcontainers
@SpringBootTest
@AutoConfigureMockMvc
class TorrentSearchApiIT {

    @Container
    static final MySQLContainer<?> MYSQL = new MySQLContainer<>(DockerImageName.parse("mysql:8.0.36"));

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @DynamicPropertySource
    static void props(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", MYSQL::getJdbcUrl);
        registry.add("spring.datasource.username", MYSQL::getUsername);
        registry.add("spring.datasource.password", MYSQL::getPassword);
        registry.add("spring.sql.init.mode", () -> "always");
        registry.add("spring.sql.init.schema-locations", () -> "classpath:schema/mysql-schema.sql");
        registry.add("spring.sql.init.data-locations", () -> "classpath:schema/mysql-data.sql");
        registry.add("torrent-search.backend", () -> "relational");
    }

    @Test
    void anonymousListingHidesHiddenAndDeleted() throws Exception {
        mockMvc.perform(get("/api/torrents"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.torrents[*].id", contains(6, 4, 3, 1)))
                .andExpect(jsonPath("$.total").value(4));
    }

    @Test
    void freeTextRequiresEveryWord() throws Exception {
        mockMvc.perform(get("/api/torrents").param("q", "hello world"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.torrents[*].id", contains(1)));
    }

    @Test
    void quotedPhrasesAndExclusions() throws Exception {
        mockMvc.perform(get("/api/torrents").param("q", "\"hello\" -\"spam\""))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.torrents[*].id", contains(1)));

        mockMvc.perform(get("/api/torrents")
                        .param("q", "\"hello world\"")
                        .header(TorrentSearchController.VIEWER_ID_HEADER, "1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.torrents[*].id", contains(2, 1)));
    }

    @Test
    void userListingDependsOnViewer() throws Exception {
        mockMvc.perform(get("/api/torrents").param("u", "1"))
                .andExpect(jsonPath("$.torrents[*].id", contains(1)));

        mockMvc.perform(get("/api/torrents").param("u", "1")
                        .header(TorrentSearchController.VIEWER_ID_HEADER, "1"))
                .andExpect(jsonPath("$.torrents[*].id", contains(2, 1)));

        mockMvc.perform(get("/api/torrents").param("u", "1")
                        .header(TorrentSearchController.VIEWER_ID_HEADER, "99")
                        .header(TorrentSearchController.VIEWER_ADMIN_HEADER, "true"))
                .andExpect(jsonPath("$.torrents[*].id", contains(5, 2, 1)));
    }

    @Test
    void sortsBySeedersUsingStatistics() throws Exception {
        mockMvc.perform(get("/api/torrents").param("s", "seeders").param("o", "desc"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.torrents[*].id", contains(3, 6, 1, 4)))
                .andExpect(jsonPath("$.torrents[0].seeders").value(50));
    }

    @Test
    void seedersSortKeepsPrimaryKeyJoinOnStatistics() {
        SqlQueryBuilder builder = new SqlQueryBuilder(2, new IndexHintResolver(jdbcTemplate));
        SearchRequest request = SearchRequest.builder().sort(SortKey.SEEDERS, SortOrder.DESC).build();
        SqlQuery query = builder.build(request, ParsedTerm.EMPTY, Viewer.ANONYMOUS);
        assertThat(query.selectSql()).contains("USE INDEX FOR ORDER BY (ix_statistics_seed_count)");

        List<Map<String, Object>> plan = jdbcTemplate.queryForList("EXPLAIN " + query.selectSql(),
                query.params().toArray());

        Map<String, Object> statistics = plan.stream()
                .filter(row -> "s".equals(row.get("table")))
                .findFirst()
                .orElseThrow();
        assertThat(statistics.get("type")).isEqualTo("eq_ref");
        assertThat(statistics.get("key")).isEqualTo("PRIMARY");
    }

    @Test
    void categoryAndQualityFilters() throws Exception {
        mockMvc.perform(get("/api/torrents").param("c", "1_1"))
                .andExpect(jsonPath("$.torrents[*].id", contains(6, 3)));

        mockMvc.perform(get("/api/torrents").param("f", "2"))
                .andExpect(jsonPath("$.torrents[*].id", contains(6)));
    }

    @Test
    void pagesThroughResults() throws Exception {
        mockMvc.perform(get("/api/torrents").param("p", "2").param("perPage", "2"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.torrents[*].id", contains(3, 1)))
                .andExpect(jsonPath("$.total").value(4))
                .andExpect(jsonPath("$.prevPage").value(1));

        mockMvc.perform(get("/api/torrents").param("p", "3").param("perPage", "2"))
                .andExpect(status().isNotFound());
    }

    @Test
    void rejectsUnknownReferences() throws Exception {
        mockMvc.perform(get("/api/torrents").param("c", "1_9"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_ARGUMENT"));

        mockMvc.perform(get("/api/torrents").param("u", "12345"))
                .andExpect(status().isNotFound());

        mockMvc.perform(get("/api/torrents").param("u", "0"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.torrents[*].id", contains(6, 4, 3, 1)));
    }

    @Test
    void feedListsNewestPublicUploads() throws Exception {
        mockMvc.perform(get("/api/torrents/feed").param("u", "1")
                        .header(TorrentSearchController.VIEWER_ID_HEADER, "1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.torrents[*].id", contains(1)));
    }
}
