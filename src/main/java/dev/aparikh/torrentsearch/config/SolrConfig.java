package dev.aparikh.torrentsearch.config;

import org.apache.solr.client.solrj.SolrClient;
import org.apache.solr.client.solrj.impl.HttpSolrClient;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Solr client for the torrent index, only created when the index backend is selected.
 */
@Configuration
@ConditionalOnProperty(prefix = "torrent-search", name = "backend", havingValue = "index")
@EnableConfigurationProperties(SolrConfigurationProperties.class)
class SolrConfig {

    private final SolrConfigurationProperties properties;

    SolrConfig(SolrConfigurationProperties properties) {
        this.properties = properties;
    }

    @Bean(destroyMethod = "close")
    SolrClient solrClient() {
        return new HttpSolrClient.Builder(coreUrl(properties.getBaseUrl(), properties.getCore())).build();
    }

    static String coreUrl(String baseUrl, String core) {
        String base = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        String name = core.startsWith("/") ? core.substring(1) : core;
        return base + "/" + name; // e.g., http://host:8983/solr/torrents
    }
}
