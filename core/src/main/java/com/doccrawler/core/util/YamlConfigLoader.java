package com.doccrawler.core.util;

import com.doccrawler.core.model.CrawlConfig;
import com.doccrawler.core.model.OutputMode;
import com.doccrawler.core.model.TraversalOrder;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.*;
import java.util.function.Consumer;
import java.util.function.IntConsumer;

/**
 * crawl.yml 을 읽어 CrawlConfig 에 덮어쓴다.
 *
 * 예상 YAML 키:
 * target: "https://docs.example.org/en/latest/"
 * maxPages: 200
 * userAgent: "DocCrawler/1.0"
 * timeoutMs: 30000
 * output:
 *   dir: "output"
 *   mode: aggregate | per_page
 *   file: "crawled_content.md"
 * scope:
 *   pageSuffix: ".html"
 *   excludedSegments: ["/_sources/", "/_static/"]
 *   stayUnderBasePath: false
 * politeness:
 *   respectRobots: true
 *   defaultDelayMs: 1000
 * traversal:
 *   order: depth_first | breadth_first
 *
 * 검증(validate)은 CLI 병합 후 호출자가 한다(target 은 CLI 로만 줄 수도 있음).
 */
public final class YamlConfigLoader {

    private YamlConfigLoader() {}

    public static CrawlConfig load(Path yamlPath) throws IOException {
        return load(yamlPath, CrawlConfig.defaults());
    }

    /** base 위에 YAML 값을 덮어쓴다. 잘못된 값은 IllegalArgumentException */
    public static CrawlConfig load(Path yamlPath, CrawlConfig base) throws IOException {
        Objects.requireNonNull(yamlPath, "yamlPath");
        Objects.requireNonNull(base, "base");
        if (!Files.exists(yamlPath)) {
            throw new IOException("config file not found at: " + yamlPath.toAbsolutePath());
        }
        Object root;
        try (InputStream in = Files.newInputStream(yamlPath)) {
            Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
            root = yaml.load(in);
        } catch (YAMLException e) {
            throw new IllegalArgumentException("malformed YAML in " + yamlPath + ": " + e.getMessage(), e);
        }

        CrawlConfig cfg = base;
        if (!(root instanceof Map<?, ?> map)) {
            // 비어있거나 단순 스칼라면 base 유지
            return cfg;
        }

        // 1) 평면 키
        setString(map, "target", cfg::setTarget);
        setInt(map, "maxPages", cfg::setMaxPages);
        setString(map, "userAgent", cfg::setUserAgent);
        setIntAsDurationMs(map, "timeoutMs", cfg::setTimeout);

        // 2) output.*
        Map<String, Object> output = getMap(map, "output");
        if (output != null) {
            setPath(output, "dir", cfg::setOutputDir);
            setString(output, "mode", s -> cfg.setOutputMode(OutputMode.parse(s)));
            setString(output, "file", cfg::setOutputFileName);
        }

        // 3) scope.*
        Map<String, Object> scope = getMap(map, "scope");
        if (scope != null) {
            setString(scope, "pageSuffix", cfg::setPageSuffix);
            setStringList(scope, "excludedSegments", cfg::setExcludedSegments);
            setBoolean(scope, "stayUnderBasePath", cfg::setStayUnderBasePath);
        }

        // 4) politeness.*
        Map<String, Object> politeness = getMap(map, "politeness");
        if (politeness != null) {
            setBoolean(politeness, "respectRobots", cfg::setRespectRobots);
            Object d = politeness.get("defaultDelayMs");
            if (d != null) {
                long ms = toLong("politeness.defaultDelayMs", d);
                if (ms < 0) throw new IllegalArgumentException("politeness.defaultDelayMs must be >= 0");
                cfg.setDefaultDelay(Duration.ofMillis(ms));
            }
        }

        // 5) traversal.order
        Map<String, Object> traversal = getMap(map, "traversal");
        if (traversal != null) {
            setString(traversal, "order", s -> cfg.setTraversalOrder(TraversalOrder.parse(s)));
        }
        return cfg;
    }

    // ------------ helpers ------------
    @SuppressWarnings("unchecked")
    private static Map<String, Object> getMap(Map<?, ?> map, String key) {
        Object v = map.get(key);
        if (v instanceof Map<?, ?> m) return (Map<String, Object>) m;
        return null;
    }

    private static void setString(Map<?, ?> map, String key, Consumer<String> setter) {
        Object v = map.get(key);
        if (v != null) setter.accept(String.valueOf(v));
    }

    private static void setStringList(Map<?, ?> map, String key, Consumer<List<String>> setter) {
        Object v = map.get(key);
        if (v == null) return;
        if (v instanceof List<?> list) {
            List<String> out = new ArrayList<>();
            for (Object o : list) if (o != null) out.add(String.valueOf(o));
            setter.accept(List.copyOf(out));
            return;
        }
        // "a,b,c" 형태 지원
        String s = String.valueOf(v).trim();
        List<String> out = new ArrayList<>();
        for (String p : s.split("\\s*,\\s*")) if (!p.isEmpty()) out.add(p);
        setter.accept(List.copyOf(out));
    }

    private static void setBoolean(Map<?, ?> map, String key, Consumer<Boolean> setter) {
        Object v = map.get(key);
        if (v instanceof Boolean b) setter.accept(b);
        else if (v != null) setter.accept(Boolean.parseBoolean(String.valueOf(v)));
    }

    private static void setInt(Map<?, ?> map, String key, IntConsumer setter) {
        Object v = map.get(key);
        if (v != null) setter.accept((int) toLong(key, v));
    }

    private static void setIntAsDurationMs(Map<?, ?> map, String key, Consumer<Duration> setter) {
        Object v = map.get(key);
        if (v == null) return;
        long ms = toLong(key, v);
        if (ms > 0) setter.accept(Duration.ofMillis(ms));
    }

    private static void setPath(Map<?, ?> map, String key, Consumer<Path> setter) {
        Object v = map.get(key);
        if (v != null) setter.accept(Path.of(String.valueOf(v)));
    }

    private static long toLong(String key, Object v) {
        if (v instanceof Number n) return n.longValue();
        try {
            return Long.parseLong(String.valueOf(v).trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be a number: " + v, e);
        }
    }
}
