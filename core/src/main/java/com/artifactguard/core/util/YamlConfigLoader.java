package com.artifactguard.core.util;

import com.artifactguard.core.model.ScanConfig;
import com.artifactguard.core.model.ScanConfig.OutputFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.function.Consumer;
import java.util.function.IntConsumer;
import java.util.function.LongConsumer;

/**
 * 루트 scan.yml을 읽어 ScanConfig로 변환.
 *
 * 예상 YAML 키:
 * nexus:
 *   url: "https://nexus.example.com"
 *   username: "reader"
 *   password: "secret"
 *   requestTimeoutMs: 30000
 *   downloadTimeoutMs: 60000
 *   repositoryTypes: [hosted]
 *   repositories: [maven-releases, npm-internal]
 * engine:
 *   path: "./trivy/trivy"
 *   timeoutSeconds: 300
 *   htmlTemplate: "./trivy/contrib/html.tpl"
 *   renderHtml: true
 *   vulnOnly: true
 * output:
 *   dir: "vulnerability_reports"
 *   formats: [json, csv]
 *   retainIndividualReports: false
 * synthesis:
 *   enabled: true
 *   maxManifests: 50
 *   maxDependencies: 100
 * debug: false
 */
public final class YamlConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(YamlConfigLoader.class);

    private YamlConfigLoader() {}

    public static ScanConfig load(Path yamlPath) throws IOException {
        return load(yamlPath, Map.of());
    }

    /** YAML → 환경변수 오버라이드 → validate 순서 */
    public static ScanConfig load(Path yamlPath, Map<String, String> env) throws IOException {
        Objects.requireNonNull(yamlPath, "yamlPath");
        if (!Files.exists(yamlPath)) {
            throw new IOException("scan.yml not found at: " + yamlPath.toAbsolutePath());
        }
        Object root;
        try (InputStream in = Files.newInputStream(yamlPath)) {
            Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
            root = yaml.load(in);
        } catch (YAMLException e) {
            throw new IOException("malformed YAML in " + yamlPath + ": " + e.getMessage(), e);
        }

        ScanConfig cfg = ScanConfig.defaults();
        if (root instanceof Map<?, ?> map) {
            apply(map, cfg);
        }
        // 비어있거나 단순 스칼라면 defaults 유지
        cfg.applyEnvironment(env);
        cfg.validate();
        return cfg;
    }

    private static void apply(Map<?, ?> map, ScanConfig cfg) {
        setBoolean(map, "debug", cfg::setDebug);

        // 1) nexus.*
        Map<String, Object> nexus = getMap(map, "nexus");
        if (nexus != null) {
            var n = cfg.nexus();
            setString(nexus, "url", n::setUrl);
            setString(nexus, "username", n::setUsername);
            setString(nexus, "password", n::setPassword);
            setLong(nexus, "requestTimeoutMs", n::setRequestTimeoutMs);
            setLong(nexus, "downloadTimeoutMs", n::setDownloadTimeoutMs);
            setStringList(nexus, "repositoryTypes", n::setRepositoryTypes);
            setStringList(nexus, "repositories", n::setRepositories);
        }

        // 2) engine.*
        Map<String, Object> engine = getMap(map, "engine");
        if (engine != null) {
            var e = cfg.engine();
            setString(engine, "path", e::setPath);
            setInt(engine, "timeoutSeconds", e::setTimeoutSeconds);
            setString(engine, "htmlTemplate", e::setHtmlTemplate);
            setBoolean(engine, "renderHtml", e::setRenderHtml);
            setBoolean(engine, "vulnOnly", e::setVulnOnly);
        }

        // 3) output.*
        Map<String, Object> output = getMap(map, "output");
        if (output != null) {
            var o = cfg.output();
            setPath(output, "dir", o::setDir);
            setStringList(output, "formats", list -> o.setFormats(toFormats(list)));
            setBoolean(output, "retainIndividualReports", o::setRetainIndividualReports);
        }

        // 4) synthesis.*
        Map<String, Object> synthesis = getMap(map, "synthesis");
        if (synthesis != null) {
            var s = cfg.synthesis();
            setBoolean(synthesis, "enabled", s::setEnabled);
            setInt(synthesis, "maxManifests", s::setMaxManifests);
            setInt(synthesis, "maxDependencies", s::setMaxDependencies);
        }
    }

    /** 모르는 형식은 경고 후 무시, 남는 게 없으면 기본값 유지 */
    private static Set<OutputFormat> toFormats(List<String> names) {
        Set<OutputFormat> out = EnumSet.noneOf(OutputFormat.class);
        for (String n : names) {
            parseEnum(OutputFormat.class, n).ifPresentOrElse(out::add,
                    () -> LOG.warn("Ignoring unknown output format '{}'", n));
        }
        return out;
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
        if (!s.isEmpty()) {
            for (String p : s.split("\\s*,\\s*")) if (!p.isEmpty()) out.add(p);
        }
        setter.accept(List.copyOf(out));
    }

    private static void setBoolean(Map<?, ?> map, String key, Consumer<Boolean> setter) {
        Object v = map.get(key);
        if (v instanceof Boolean b) setter.accept(b);
        else if (v != null) setter.accept(Boolean.parseBoolean(String.valueOf(v)));
    }

    private static void setInt(Map<?, ?> map, String key, IntConsumer setter) {
        Object v = map.get(key);
        if (v instanceof Number n) setter.accept(n.intValue());
        else if (v != null) setter.accept(parseNumber(key, v).intValue());
    }

    private static void setLong(Map<?, ?> map, String key, LongConsumer setter) {
        Object v = map.get(key);
        if (v instanceof Number n) setter.accept(n.longValue());
        else if (v != null) setter.accept(parseNumber(key, v));
    }

    private static Long parseNumber(String key, Object v) {
        try {
            return Long.parseLong(String.valueOf(v).trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be a number: " + v, e);
        }
    }

    private static void setPath(Map<?, ?> map, String key, Consumer<Path> setter) {
        Object v = map.get(key);
        if (v != null) setter.accept(Path.of(String.valueOf(v)));
    }

    private static <E extends Enum<E>> Optional<E> parseEnum(Class<E> type, String raw) {
        if (raw == null) return Optional.empty();
        String s = raw.trim();
        for (E e : type.getEnumConstants()) {
            if (e.name().equalsIgnoreCase(s)) return Optional.of(e);
        }
        return Optional.empty();
    }
}
