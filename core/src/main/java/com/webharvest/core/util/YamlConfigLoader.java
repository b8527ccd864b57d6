package com.webharvest.core.util;

import com.webharvest.core.model.ScrapeConfig;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.IntConsumer;
import java.util.function.LongConsumer;

/**
 * scrape.yml 을 읽어 ScrapeConfig 로 변환.
 * baseUrl 은 CLI 인자로 덮어쓸 수 있으므로 여기서는 validate 하지 않는다(ScrapeService 생성 시 검증).
 *
 * 예상 YAML 키:
 * baseUrl: "https://example.com/blog"
 * maxItems: 100
 * useBrowser: false
 * maxConcurrent: 10
 * chunkSize: 8000
 * fetchTimeoutMs: 15000
 * strategyWorkers: 3
 * templateThreshold: 3
 * userAgent: "..."
 * http:
 *   maxAttempts: 2
 * discovery:
 *   sitemapTimeoutMs: 8000
 *   lookupTimeoutMs: 10000
 *   fallbackThreshold: 5
 *   respectRobots: false
 * render:
 *   timeoutMs: 30000
 *   settleMs: 2000
 *   headless: true
 */
public final class YamlConfigLoader {

    private YamlConfigLoader() {}

    public static ScrapeConfig load(Path yamlPath) throws IOException {
        Objects.requireNonNull(yamlPath, "yamlPath");
        if (!Files.exists(yamlPath)) {
            throw new IOException("Config file not found: " + yamlPath.toAbsolutePath());
        }
        try (InputStream in = Files.newInputStream(yamlPath)) {
            return load(in);
        }
    }

    public static ScrapeConfig load(InputStream in) throws IOException {
        Objects.requireNonNull(in, "in");
        Object root;
        try {
            Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
            root = yaml.load(in);
        } catch (YAMLException e) {
            throw new IOException("Malformed scrape.yml: " + e.getMessage(), e);
        }

        ScrapeConfig cfg = ScrapeConfig.defaults();
        if (!(root instanceof Map<?, ?> map)) {
            // 비어있거나 스칼라면 defaults 유지
            return cfg;
        }

        try {
            // 1) 평면 키
            setString(map, "baseUrl", cfg::setBaseUrl);
            setInt(map, "maxItems", cfg::setMaxItems);
            setBoolean(map, "useBrowser", cfg::setUseBrowser);
            setInt(map, "maxConcurrent", cfg::setMaxConcurrent);
            setInt(map, "chunkSize", cfg::setChunkSize);
            setLong(map, "fetchTimeoutMs", cfg::setFetchTimeoutMs);
            setInt(map, "strategyWorkers", cfg::setStrategyWorkers);
            setInt(map, "templateThreshold", cfg::setTemplateThreshold);
            setString(map, "userAgent", cfg::setUserAgent);

            // 2) http.*
            Map<?, ?> http = getMap(map, "http");
            if (http != null) {
                setInt(http, "maxAttempts", cfg::setHttpMaxAttempts);
            }

            // 3) discovery.*
            Map<?, ?> disc = getMap(map, "discovery");
            if (disc != null) {
                var d = cfg.getDiscovery();
                setLong(disc, "sitemapTimeoutMs", d::setSitemapTimeoutMs);
                setLong(disc, "lookupTimeoutMs", d::setLookupTimeoutMs);
                setInt(disc, "fallbackThreshold", d::setFallbackThreshold);
                setBoolean(disc, "respectRobots", d::setRespectRobots);
            }

            // 4) render.*
            Map<?, ?> render = getMap(map, "render");
            if (render != null) {
                var r = cfg.getRender();
                setLong(render, "timeoutMs", r::setTimeoutMs);
                setLong(render, "settleMs", r::setSettleMs);
                setBoolean(render, "headless", r::setHeadless);
            }
        } catch (NumberFormatException e) {
            throw new IOException("Invalid number in scrape.yml: " + e.getMessage(), e);
        }
        return cfg;
    }

    // ------------ helpers ------------
    private static Map<?, ?> getMap(Map<?, ?> map, String key) {
        Object v = map.get(key);
        return (v instanceof Map<?, ?> m) ? m : null;
    }

    private static void setString(Map<?, ?> map, String key, Consumer<String> setter) {
        Object v = map.get(key);
        if (v != null) setter.accept(String.valueOf(v));
    }

    private static void setBoolean(Map<?, ?> map, String key, Consumer<Boolean> setter) {
        Object v = map.get(key);
        if (v instanceof Boolean b) setter.accept(b);
        else if (v != null) setter.accept(Boolean.parseBoolean(String.valueOf(v)));
    }

    private static void setInt(Map<?, ?> map, String key, IntConsumer setter) {
        Object v = map.get(key);
        if (v instanceof Number n) setter.accept(n.intValue());
        else if (v != null) setter.accept(Integer.parseInt(String.valueOf(v).trim()));
    }

    private static void setLong(Map<?, ?> map, String key, LongConsumer setter) {
        Object v = map.get(key);
        if (v instanceof Number n) setter.accept(n.longValue());
        else if (v != null) setter.accept(Long.parseLong(String.valueOf(v).trim()));
    }
}
