package com.sitewalker.core.util;

import com.sitewalker.core.model.WalkConfig;
import com.sitewalker.core.model.WalkConfig.ExtractorKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.IntConsumer;

/**
 * walk.yml 을 읽어 WalkConfig 로 변환.
 *
 * 예상 YAML 키:
 * start: "https://example.com/"
 * strategy: breadth-first        # depth-first | breadth-first | dfs | bfs
 * userAgent: "SiteWalker"
 * timeoutMs: 10000
 * followRedirects: true
 * maxPages: 0
 * extractor: pattern             # pattern | jsoup
 * output:
 *   dir: "out"
 * robots:
 *   respect: true
 * failures:
 *   abortAfterConsecutive: 0
 */
public final class YamlConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(YamlConfigLoader.class);

    public static final String DEFAULT_FILE = "walk.yml";

    private YamlConfigLoader() {}

    /** start 가 없어도 되는 로딩(CLI가 나중에 채우는 경우). validate 는 호출자 몫 */
    public static WalkConfig loadPartial(Path yamlPath) throws IOException {
        Objects.requireNonNull(yamlPath, "yamlPath");
        if (!Files.exists(yamlPath)) {
            throw new IOException("walk.yml not found at: " + yamlPath.toAbsolutePath());
        }
        try (InputStream in = Files.newInputStream(yamlPath)) {
            Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
            return apply(yaml.load(in), WalkConfig.defaults());
        }
    }

    public static WalkConfig load(Path yamlPath) throws IOException {
        WalkConfig cfg = loadPartial(yamlPath);
        cfg.validate();
        return cfg;
    }

    static WalkConfig apply(Object root, WalkConfig cfg) {
        if (!(root instanceof Map<?, ?> map)) {
            // 비어있거나 단순 스칼라면 defaults 유지
            return cfg;
        }

        // 1) 평면 키
        setString(map, "start", cfg::setStart);
        setString(map, "strategy", cfg::setStrategy);
        setString(map, "userAgent", cfg::setUserAgent);
        setLong(map, "timeoutMs", ms -> { if (ms > 0) cfg.setTimeoutMs(ms); });
        setBoolean(map, "followRedirects", cfg::setFollowRedirects);
        setInt(map, "maxPages", cfg::setMaxPages);
        setEnum(map, "extractor", ExtractorKind.class, cfg::setExtractor);

        // 2) output.dir
        Map<?, ?> output = getMap(map, "output");
        if (output != null) {
            setString(output, "dir", s -> cfg.setOutputDir(Path.of(s)));
        }

        // 3) robots.*
        Map<?, ?> robots = getMap(map, "robots");
        if (robots != null) {
            setBoolean(robots, "respect", cfg.getRobots()::setRespect);
        }

        // 4) failures.*
        Map<?, ?> failures = getMap(map, "failures");
        if (failures != null) {
            setInt(failures, "abortAfterConsecutive", cfg.getFailures()::setAbortAfterConsecutive);
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

    private static void setLong(Map<?, ?> map, String key, Consumer<Long> setter) {
        Object v = map.get(key);
        if (v instanceof Number n) setter.accept(n.longValue());
        else if (v != null) setter.accept(Long.parseLong(String.valueOf(v).trim()));
    }

    private static <E extends Enum<E>> void setEnum(Map<?, ?> map, String key, Class<E> type, Consumer<E> setter) {
        Object v = map.get(key);
        if (v == null) return;
        String s = String.valueOf(v).trim().replace('-', '_');
        for (E e : type.getEnumConstants()) {
            if (e.name().equalsIgnoreCase(s)) {
                setter.accept(e);
                return;
            }
        }
        // 사용자 오타 시 기본값 유지
        LOG.warn("Ignoring unknown value for '{}': {}", key, v);
    }
}
