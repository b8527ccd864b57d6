package com.webharvest.core.model;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;

class ScrapeConfigTest {

    @Test
    void defaults_match_documented_values() {
        ScrapeConfig c = ScrapeConfig.defaults();
        assertThat(c.getMaxItems()).isEqualTo(100);
        assertThat(c.isUseBrowser()).isFalse();
        assertThat(c.getMaxConcurrent()).isEqualTo(10);
        assertThat(c.getChunkSize()).isEqualTo(8000);
        assertThat(c.getStrategyWorkers()).isEqualTo(3);
        assertThat(c.getTemplateThreshold()).isEqualTo(3);
        assertThat(c.getFetchTimeout()).isEqualTo(Duration.ofSeconds(15));
        assertThat(c.getDiscovery().getFallbackThreshold()).isEqualTo(5);
        assertThat(c.getDiscovery().isRespectRobots()).isFalse();
        assertThat(c.getRender().getTimeout()).isEqualTo(Duration.ofSeconds(30));
    }

    @Test
    void valid_https_target_passes() {
        ScrapeConfig c = ScrapeConfig.defaults().setBaseUrl("  https://example.com/blog  ");
        assertDoesNotThrow(c::validate);
        assertThat(c.getBaseUrl()).isEqualTo("https://example.com/blog");
        assertThat(c.baseUri().getHost()).isEqualTo("example.com");
    }

    @Test
    void missing_or_bad_target_is_rejected() {
        assertThatThrownBy(() -> ScrapeConfig.defaults().validate())
                .isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> ScrapeConfig.defaults().setBaseUrl("").validate())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ScrapeConfig.defaults().setBaseUrl("ftp://example.com").validate())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("http(s)");
        assertThatThrownBy(() -> ScrapeConfig.defaults().setBaseUrl("https://").validate())
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void non_positive_numbers_are_rejected() {
        assertThatThrownBy(() -> ScrapeConfig.defaults().setBaseUrl("https://a.com").setMaxItems(0).validate())
                .hasMessageContaining("maxItems");
        assertThatThrownBy(() -> ScrapeConfig.defaults().setBaseUrl("https://a.com").setMaxConcurrent(0).validate())
                .hasMessageContaining("maxConcurrent");
        assertThatThrownBy(() -> ScrapeConfig.defaults().setBaseUrl("https://a.com").setChunkSize(-5).validate())
                .hasMessageContaining("chunkSize");
        assertThatThrownBy(() -> ScrapeConfig.defaults().setBaseUrl("https://a.com").setFetchTimeout(Duration.ZERO).validate())
                .hasMessageContaining("fetchTimeout");
    }

    @Test
    void blank_user_agent_falls_back_to_default() {
        ScrapeConfig c = ScrapeConfig.defaults().setBaseUrl("https://a.com").setUserAgent(" ");
        c.validate();
        assertThat(c.getUserAgent()).isEqualTo(ScrapeConfig.DEFAULT_USER_AGENT);
    }
}
