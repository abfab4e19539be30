package com.artifactguard.core.util;

import com.artifactguard.core.model.ScanConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class YamlConfigLoaderTest {

    @TempDir
    Path tmp;

    private Path yml(String content) throws IOException {
        Path p = tmp.resolve("scan.yml");
        Files.writeString(p, content);
        return p;
    }

    @Test
    void readsAllSections() throws Exception {
        Path p = yml("""
                debug: true
                nexus:
                  url: "https://nexus.local/"
                  username: reader
                  password: secret
                  requestTimeoutMs: 5000
                  repositoryTypes: [hosted, proxy]
                  repositories: "maven-releases, npm-internal"
                engine:
                  path: /opt/trivy/trivy
                  timeoutSeconds: 120
                  htmlTemplate: /opt/trivy/contrib/html.tpl
                  renderHtml: false
                  vulnOnly: "false"
                output:
                  dir: out/reports
                  formats: [json]
                  retainIndividualReports: true
                synthesis:
                  enabled: false
                  maxManifests: 5
                  maxDependencies: 10
                """);

        ScanConfig cfg = YamlConfigLoader.load(p);

        assertThat(cfg.isDebug()).isTrue();
        assertThat(cfg.nexus().getUrl()).isEqualTo("https://nexus.local");
        assertThat(cfg.nexus().getUsername()).isEqualTo("reader");
        assertThat(cfg.nexus().getRequestTimeout()).isEqualTo(Duration.ofMillis(5000));
        assertThat(cfg.nexus().getRepositoryTypes()).containsExactly("hosted", "proxy");
        assertThat(cfg.nexus().getRepositories()).containsExactly("maven-releases", "npm-internal");
        assertThat(cfg.engine().getPath()).isEqualTo("/opt/trivy/trivy");
        assertThat(cfg.engine().getTimeoutSeconds()).isEqualTo(120);
        assertThat(cfg.engine().getHtmlTemplate()).isEqualTo("/opt/trivy/contrib/html.tpl");
        assertThat(cfg.engine().isRenderHtml()).isFalse();
        assertThat(cfg.engine().isVulnOnly()).isFalse();
        assertThat(cfg.output().getDir()).isEqualTo(Path.of("out/reports"));
        assertThat(cfg.output().getFormats()).containsExactly(ScanConfig.OutputFormat.JSON);
        assertThat(cfg.output().isRetainIndividualReports()).isTrue();
        assertThat(cfg.synthesis().isEnabled()).isFalse();
        assertThat(cfg.synthesis().getMaxManifests()).isEqualTo(5);
    }

    @Test
    void unknownFormatIgnoredAndDefaultsKept() throws Exception {
        ScanConfig cfg = YamlConfigLoader.load(yml("""
                nexus: { url: "http://n:8081" }
                output: { formats: [pdf] }
                unknownKey: 1
                """));
        assertThat(cfg.output().getFormats()).hasSize(2);
    }

    @Test
    void environmentWinsOverYaml() throws Exception {
        ScanConfig cfg = YamlConfigLoader.load(yml("nexus: { url: \"http://yaml:8081\" }\n"),
                Map.of("NEXUS_URL", "http://env:8081", "OUTPUT_DIR", "envdir"));
        assertThat(cfg.nexus().getUrl()).isEqualTo("http://env:8081");
        assertThat(cfg.output().getDir()).isEqualTo(Path.of("envdir"));
    }

    @Test
    void urlMayComeFromEnvironmentOnly() throws Exception {
        ScanConfig cfg = YamlConfigLoader.load(yml(""), Map.of("NEXUS_URL", "http://env:8081"));
        assertThat(cfg.nexus().getUrl()).isEqualTo("http://env:8081");
    }

    @Test
    void missingFileIsIOException() {
        assertThatThrownBy(() -> YamlConfigLoader.load(tmp.resolve("nope.yml")))
                .isInstanceOf(IOException.class).hasMessageContaining("scan.yml not found");
    }

    @Test
    void malformedYamlIsIOException() throws Exception {
        Path p = yml("nexus: [unclosed");
        assertThatThrownBy(() -> YamlConfigLoader.load(p)).isInstanceOf(IOException.class);
    }

    @Test
    void badNumberNamesTheKey() throws Exception {
        Path p = yml("nexus: { url: \"http://n\", requestTimeoutMs: soon }\n");
        assertThatThrownBy(() -> YamlConfigLoader.load(p))
                .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("requestTimeoutMs");
    }

    @Test
    void missingUrlFailsValidation() throws Exception {
        Path p = yml("debug: false\n");
        assertThatThrownBy(() -> YamlConfigLoader.load(p)).isInstanceOf(NullPointerException.class)
                .hasMessageContaining("nexus.url");
    }
}
