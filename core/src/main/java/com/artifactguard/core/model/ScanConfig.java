package com.artifactguard.core.model;

import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Consumer;

/**
 * 스캔 설정 (scan.yml 매핑 대상). 순수 설정 보관용.
 * 환경변수 오버라이드는 {@link #applyEnvironment(Map)}로 한 번 적용.
 */
public final class ScanConfig {

    /** 세션 보고서 형식 */
    public enum OutputFormat { JSON, CSV, HTML }

    /** YAML `nexus:` 섹션 */
    public static final class Nexus {
        private String url;                                   // 필수
        private String username = "";
        private String password = "";
        private Duration requestTimeout = Duration.ofSeconds(30);
        private Duration downloadTimeout = Duration.ofSeconds(60);
        private List<String> repositoryTypes = List.of("hosted");
        /** 비어있으면 전체 저장소 */
        private List<String> repositories = List.of();

        public String getUrl() { return url; }
        public String getUsername() { return username; }
        public String getPassword() { return password; }
        public Duration getRequestTimeout() { return requestTimeout; }
        public Duration getDownloadTimeout() { return downloadTimeout; }
        public List<String> getRepositoryTypes() { return repositoryTypes; }
        public List<String> getRepositories() { return repositories; }

        /** 끝 슬래시 제거 */
        public Nexus setUrl(String url) {
            String u = (url == null ? null : url.trim());
            while (u != null && u.endsWith("/")) u = u.substring(0, u.length() - 1);
            this.url = u;
            return this;
        }
        public Nexus setUsername(String v) { this.username = (v == null ? "" : v); return this; }
        public Nexus setPassword(String v) { this.password = (v == null ? "" : v); return this; }
        public Nexus setRequestTimeoutMs(long ms) { this.requestTimeout = Duration.ofMillis(Math.max(1, ms)); return this; }
        public Nexus setDownloadTimeoutMs(long ms) { this.downloadTimeout = Duration.ofMillis(Math.max(1, ms)); return this; }
        public Nexus setRepositoryTypes(List<String> v) {
            if (v != null && !v.isEmpty()) this.repositoryTypes = List.copyOf(v);
            return this;
        }
        public Nexus setRepositories(List<String> v) {
            this.repositories = (v == null ? List.of() : List.copyOf(v));
            return this;
        }

        public boolean hasCredentials() { return !username.isEmpty(); }

        /** 이미지 참조에 쓰는 호스트[:포트] */
        public String host() {
            URI u = URI.create(url);
            return u.getPort() > 0 ? u.getHost() + ":" + u.getPort() : u.getHost();
        }
    }

    /** YAML `engine:` 섹션 (외부 스캔 엔진) */
    public static final class Engine {
        private String path;                                  // null이면 자동 탐색
        private int timeoutSeconds = 300;
        private String htmlTemplate;                          // null이면 <엔진 디렉터리>/contrib/html.tpl
        private boolean renderHtml = true;
        private boolean vulnOnly = true;

        public String getPath() { return path; }
        public int getTimeoutSeconds() { return timeoutSeconds; }
        public Duration getTimeout() { return Duration.ofSeconds(timeoutSeconds); }
        public String getHtmlTemplate() { return htmlTemplate; }
        public boolean isRenderHtml() { return renderHtml; }
        public boolean isVulnOnly() { return vulnOnly; }

        public Engine setPath(String v) { this.path = (v == null || v.isBlank() ? null : v.trim()); return this; }
        public Engine setTimeoutSeconds(int v) { this.timeoutSeconds = v; return this; }
        public Engine setHtmlTemplate(String v) { this.htmlTemplate = (v == null || v.isBlank() ? null : v.trim()); return this; }
        public Engine setRenderHtml(boolean v) { this.renderHtml = v; return this; }
        public Engine setVulnOnly(boolean v) { this.vulnOnly = v; return this; }

        /**
         * 실행 파일 결정: 설정값 → ./trivy/trivy.exe → ./trivy/trivy → PATH 상의 trivy.
         * @param workDir 상대 경로 기준 디렉터리
         */
        public String resolvePath(Path workDir) {
            if (path != null) return path;
            Path base = (workDir == null ? Path.of(".") : workDir);
            for (String candidate : List.of("trivy.exe", "trivy")) {
                Path p = base.resolve("trivy").resolve(candidate);
                if (Files.isRegularFile(p)) return p.toString();
            }
            return "trivy";
        }

        public String resolveHtmlTemplate(String enginePath) {
            if (htmlTemplate != null) return htmlTemplate;
            Path parent = Path.of(enginePath).getParent();
            Path tpl = (parent == null ? Path.of("contrib", "html.tpl") : parent.resolve("contrib").resolve("html.tpl"));
            return tpl.toString();
        }
    }

    /** YAML `output:` 섹션 */
    public static final class Output {
        private Path dir = Path.of("vulnerability_reports");
        private Set<OutputFormat> formats = EnumSet.of(OutputFormat.JSON, OutputFormat.CSV, OutputFormat.HTML);
        private boolean retainIndividualReports = false;

        public Path getDir() { return dir; }
        public Set<OutputFormat> getFormats() { return formats; }
        public boolean isRetainIndividualReports() { return retainIndividualReports; }

        public Output setDir(Path v) { this.dir = v; return this; }
        public Output setFormats(Set<OutputFormat> v) {
            if (v != null && !v.isEmpty()) this.formats = EnumSet.copyOf(v);
            return this;
        }
        public Output setRetainIndividualReports(boolean v) { this.retainIndividualReports = v; return this; }

        /** 에셋 1건 분량만 머무는 작업 디렉터리 */
        public Path tempDir() { return dir.resolve("temp"); }
    }

    /** YAML `synthesis:` 섹션 (lock 파일 합성) */
    public static final class Synthesis {
        private boolean enabled = true;
        private int maxManifests = 50;
        private int maxDependencies = 100;

        public boolean isEnabled() { return enabled; }
        public int getMaxManifests() { return maxManifests; }
        public int getMaxDependencies() { return maxDependencies; }

        public Synthesis setEnabled(boolean v) { this.enabled = v; return this; }
        public Synthesis setMaxManifests(int v) { this.maxManifests = v; return this; }
        public Synthesis setMaxDependencies(int v) { this.maxDependencies = v; return this; }
    }

    private final Nexus nexus = new Nexus();
    private final Engine engine = new Engine();
    private final Output output = new Output();
    private final Synthesis synthesis = new Synthesis();
    private boolean debug = false;

    public Nexus nexus() { return nexus; }
    public Engine engine() { return engine; }
    public Output output() { return output; }
    public Synthesis synthesis() { return synthesis; }
    public boolean isDebug() { return debug; }

    public ScanConfig setDebug(boolean debug) { this.debug = debug; return this; }

    // ---------- env override ----------
    /** NEXUS_URL / NEXUS_USERNAME / NEXUS_PASSWORD / TRIVY_PATH / OUTPUT_DIR (값이 있을 때만) */
    public ScanConfig applyEnvironment(Map<String, String> env) {
        if (env == null) return this;
        ifSet(env, "NEXUS_URL", nexus::setUrl);
        ifSet(env, "NEXUS_USERNAME", nexus::setUsername);
        ifSet(env, "NEXUS_PASSWORD", nexus::setPassword);
        ifSet(env, "TRIVY_PATH", engine::setPath);
        ifSet(env, "OUTPUT_DIR", v -> output.setDir(Path.of(v)));
        return this;
    }

    private static void ifSet(Map<String, String> env, String key, Consumer<String> setter) {
        String v = env.get(key);
        if (v != null && !v.isBlank()) setter.accept(v.trim());
    }

    // ---------- validate ----------
    public void validate() {
        Objects.requireNonNull(nexus.getUrl(), "nexus.url");
        if (nexus.getUrl().isBlank()) throw new IllegalArgumentException("nexus.url must not be blank");
        URI uri;
        try {
            uri = URI.create(nexus.getUrl());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("nexus.url is not a valid URI: " + nexus.getUrl(), e);
        }
        String scheme = uri.getScheme();
        if (scheme == null || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https")))
            throw new IllegalArgumentException("nexus.url must be http(s): " + nexus.getUrl());
        if (uri.getHost() == null) throw new IllegalArgumentException("nexus.url has no host: " + nexus.getUrl());

        if (engine.getTimeoutSeconds() <= 0) throw new IllegalArgumentException("engine.timeoutSeconds must be > 0");
        Objects.requireNonNull(output.getDir(), "output.dir");
        Objects.requireNonNull(output.getFormats(), "output.formats");
        if (synthesis.getMaxManifests() < 1) throw new IllegalArgumentException("synthesis.maxManifests must be >= 1");
        if (synthesis.getMaxDependencies() < 0) throw new IllegalArgumentException("synthesis.maxDependencies must be >= 0");
    }

    // ---------- helpers ----------
    public static ScanConfig defaults() { return new ScanConfig(); }
}
