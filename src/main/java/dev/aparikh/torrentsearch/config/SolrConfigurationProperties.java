package dev.aparikh.torrentsearch.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.NotBlank;

/**
 * Typed configuration properties for the Solr torrent index.
 */
@Validated
@ConfigurationProperties(prefix = "solr")
class SolrConfigurationProperties {

    @NotBlank
    private String baseUrl;

    @NotBlank
    private String core = "torrents";

    String getBaseUrl() {
        return baseUrl;
    }

    void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    String getCore() {
        return core;
    }

    void setCore(String core) {
        this.core = core;
    }
}
