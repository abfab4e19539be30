package com.artifactguard.core.service;

import com.artifactguard.core.api.IAssetDownloader;
import com.artifactguard.core.api.IAssetSource;
import com.artifactguard.core.engine.ScanExecutor;
import com.artifactguard.core.engine.ScriptedProcessRunner;
import com.artifactguard.core.engine.ScriptedProcessRunner.Reply;
import com.artifactguard.core.model.ArtifactType;
import com.artifactguard.core.model.Asset;
import com.artifactguard.core.model.Component;
import com.artifactguard.core.model.FailureKind;
import com.artifactguard.core.model.Finding;
import com.artifactguard.core.model.RepositoryDescriptor;
import com.artifactguard.core.model.RunningStatistics;
import com.artifactguard.core.model.ScanConfig;
import com.artifactguard.core.model.ScanIssue;
import com.artifactguard.core.model.Severity;
import com.artifactguard.core.model.StepResult;
import com.artifactguard.core.strategy.ScanStrategyPlanner;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.apache.commons.compress.archivers.tar.TarArchiveOutputStream;
import org.apache.commons.compress.compressors.gzip.GzipCompressorOutputStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ScanServiceTest {

    @TempDir
    Path tmp;

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-03-01T12:00:00Z"), ZoneOffset.UTC);

    private ScanConfig cfg;
    private ScriptedProcessRunner runner;
    private InMemorySource source;
    private final Map<String, byte[]> blobs = new HashMap<>();
    private final List<Boolean> lockPresentAtScan = new ArrayList<>();

    /** 저장소 서비스 대역 */
    private static final class InMemorySource implements IAssetSource {
        boolean reachable = true;
        final Map<RepositoryDescriptor, List<Component>> repos = new LinkedHashMap<>();

        @Override public boolean testConnection() { return reachable; }
        @Override public List<RepositoryDescriptor> listRepositories() { return List.copyOf(repos.keySet()); }
        @Override public List<Component> listComponents(RepositoryDescriptor r) { return repos.getOrDefault(r, List.of()); }
    }

    private final IAssetDownloader downloader = (asset, target) -> {
        byte[] data = blobs.get(asset.downloadUrl());
        if (data == null) return StepResult.fail(FailureKind.DOWNLOAD_ERROR, "HTTP 404");
        try {
            Files.createDirectories(target.getParent());
            Files.write(target, data);
            return StepResult.ok(target);
        } catch (IOException e) {
            return StepResult.fail(FailureKind.DOWNLOAD_ERROR, e.getMessage());
        }
    };

    @BeforeEach
    void setUp() {
        cfg = ScanConfig.defaults();
        cfg.nexus().setUrl("http://nexus:8081");
        cfg.output().setDir(tmp.resolve("out")).setRetainIndividualReports(true);
        runner = new ScriptedProcessRunner();
        source = new InMemorySource();
    }

    private ScanService service() {
        ScanExecutor exec = new ScanExecutor(cfg, "trivy", cfg.output().tempDir(), runner, new ObjectMapper());
        return new ScanService(cfg, source, downloader, exec, CLOCK);
    }

    private Asset asset(String name, byte[] data) {
        String url = "http://nexus:8081/repository/" + name;
        if (data != null) blobs.put(url, data);
        return new Asset(name, url, null, data == null ? -1 : data.length);
    }

    private static byte[] tgz(String entry, String content) throws IOException {
        ByteArrayOutputStream bos = new ByteArrayOutputStream();
        try (TarArchiveOutputStream tar = new TarArchiveOutputStream(new GzipCompressorOutputStream(bos))) {
            byte[] data = content.getBytes(StandardCharsets.UTF_8);
            TarArchiveEntry e = new TarArchiveEntry(entry);
            e.setSize(data.length);
            tar.putArchiveEntry(e);
            tar.write(data);
            tar.closeArchiveEntry();
        }
        return bos.toByteArray();
    }

    private void fullCatalog() throws IOException {
        RepositoryDescriptor maven = new RepositoryDescriptor("releases", "maven2", "hosted");
        RepositoryDescriptor npm = new RepositoryDescriptor("npm-internal", "npm", "hosted");
        RepositoryDescriptor raw = new RepositoryDescriptor("raw-files", "raw", "hosted");
        RepositoryDescriptor docker = new RepositoryDescriptor("docker-hosted", "docker", "hosted");

        source.repos.put(maven, List.of(Component.of("acme-core", "1.0",
                asset("org/acme/core/1.0/core-1.0.jar", "jar".getBytes()),
                asset("org/acme/core/1.0/core-1.0.jar.sha1", "abc".getBytes()),
                new Asset("org/acme/core/1.0/core-1.0.pom", "", null, -1))));
        source.repos.put(npm, List.of(Component.of("web-client", "2.0",
                asset("web-client/-/web-client-2.0.tgz", tgz("package/package.json",
                        "{\"name\":\"web-client\",\"version\":\"2.0.0\",\"dependencies\":{\"left-pad\":\"^1.3.0\"}}")))));
        source.repos.put(raw, List.of(Component.of("broken", "1", asset("broken.zip", null))));
        source.repos.put(docker, List.of(Component.of("app", "1.0", asset("v2/app/manifests/1.0", "{}".getBytes()))));

        runner.json(target -> {
            if (target.endsWith("core-1.0.jar")) {
                return Reply.ok(ScriptedProcessRunner.findings(target, "HIGH", "HIGH", "LOW", "CRITICAL"));
            }
            if (target.endsWith("_extracted")) {
                lockPresentAtScan.add(Files.exists(Path.of(target, "package", "package-lock.json")));
                return Reply.ok("{\"Results\":[{\"Target\":\"package-lock.json\"}]}");
            }
            if (target.startsWith("nexus:8081/")) return Reply.exit(1, "MANIFEST_UNKNOWN");
            if (target.equals("app:1.0")) return Reply.ok(ScriptedProcessRunner.findings(target, "CRITICAL"));
            return Reply.ok("{}");
        });
    }

    @Test
    @DisplayName("전체 세션: 스캔/건너뜀/다운로드 실패/컨테이너 폴백이 통계와 이슈 기록에 반영")
    void fullSession() throws Exception {
        fullCatalog();
        List<String> phases = new ArrayList<>();

        ScanReport report = service().run((p, phase, done, total) -> phases.add(phase));

        RunningStatistics.Snapshot s = report.statistics();
        assertThat(s.repositoriesScanned()).isEqualTo(4);
        assertThat(s.componentsFound()).isEqualTo(4);
        assertThat(s.assetsScanned()).isEqualTo(3);
        assertThat(s.assetsSkipped()).isEqualTo(1);
        assertThat(s.scanErrors()).isEqualTo(1);
        assertThat(s.vulnerabilitiesFound()).isEqualTo(5);
        assertThat(s.bySeverity()).containsEntry(Severity.CRITICAL, 2L).containsEntry(Severity.HIGH, 2L);
        assertThat(s.byArtifactType()).containsEntry("java_jar", 1L).containsEntry("script", 1L)
                .containsEntry("node_package", 1L).containsEntry("container_image", 1L).containsEntry("archive", 1L);
        assertThat(s.repositoryFormats()).containsExactly("docker", "maven2", "npm", "raw");

        ScanIssueLog issues = report.issues();
        assertThat(issues.skipped()).singleElement().satisfies(i -> {
            assertThat(i.asset()).endsWith(".sha1");
            assertThat(i.reason()).isEqualTo(ScanStrategyPlanner.REASON_CHECKSUM);
            assertThat(i.kind()).isEqualTo(ScanIssue.Kind.SKIP);
        });
        assertThat(issues.errors()).singleElement().satisfies(i -> {
            assertThat(i.reason()).isEqualTo("Asset download failed");
            assertThat(i.failureKind()).isEqualTo(FailureKind.DOWNLOAD_ERROR);
            assertThat(i.details()).contains("http://nexus:8081/repository/broken.zip");
        });
        assertThat(issues.warnings()).isEmpty();
        assertThat(issues.successes()).hasSize(3);
        assertThat(issues.cleanScans()).isEqualTo(1);

        assertThat(report.findings()).hasSize(5);
        assertThat(report.findings()).filteredOn(f -> f.artifactType() == ArtifactType.CONTAINER_IMAGE)
                .singleElement().satisfies(f -> {
                    assertThat(f.imageReference()).isEqualTo("app:1.0");
                    assertThat(f.asset()).isEqualTo("docker_image_1.0");
                });
        Finding jar = report.findings().get(0);
        assertThat(jar.repository()).isEqualTo("releases");
        assertThat(jar.component()).isEqualTo("acme-core");
        assertThat(jar.componentVersion()).isEqualTo("1.0");
        assertThat(jar.strategyReason()).isEqualTo(ScanStrategyPlanner.REASON_JAVA);
        assertThat(jar.scannedAt()).isEqualTo(CLOCK.instant());

        // node 패키지: 해제 + lock 합성 후 엔진 호출
        assertThat(lockPresentAtScan).containsExactly(true);

        // 컨테이너: host/repo/name:ver → host/name:ver → name:ver 순서
        assertThat(runner.commands()).extracting(c -> c.get(c.size() - 1)).contains(
                "nexus:8081/docker-hosted/app:1.0", "nexus:8081/app:1.0", "app:1.0");

        assertThat(report.engine()).isEqualTo("Version: 0.50.0");
        assertThat(report.individualReports()).isEqualTo(3);
        assertThat(cfg.output().tempDir()).doesNotExist();
        assertThat(phases).first().isEqualTo("connect");
        assertThat(phases).last().isEqualTo("done");
        assertThat(phases).contains("repository:releases", "repository:docker-hosted");
    }

    @Test
    void unreachableRepositoryServiceAborts() {
        source.reachable = false;
        assertThatThrownBy(() -> service().run()).isInstanceOf(ScanAbortedException.class)
                .hasMessageContaining("http://nexus:8081");
        assertThat(runner.commands()).isEmpty();
    }

    @Test
    @DisplayName("해제 실패는 경고로 남기고 원본 그대로 스캔")
    void extractionFailureFallsBackToUnextractedScan() {
        RepositoryDescriptor raw = new RepositoryDescriptor("raw-files", "raw", "hosted");
        source.repos.put(raw, List.of(Component.of("dist", "1", asset("dist.tar.gz", "not gzip".getBytes()))));

        ScanReport report = service().run();

        assertThat(report.issues().warnings()).singleElement()
                .satisfies(w -> assertThat(w.failureKind()).isEqualTo(FailureKind.EXTRACTION_ERROR));
        assertThat(report.issues().successes()).hasSize(1);
        assertThat(runner.commands()).extracting(c -> c.get(c.size() - 1))
                .anySatisfy(t -> assertThat(t).endsWith("dist.tar.gz"));
    }

    @Test
    void engineFailureIsRecordedAsError() {
        RepositoryDescriptor maven = new RepositoryDescriptor("releases", "maven2", "hosted");
        source.repos.put(maven, List.of(Component.of("lib", "1", asset("lib-1.jar", "jar".getBytes()))));
        runner.json(t -> Reply.exit(2, "db locked"));

        ScanReport report = service().run();

        assertThat(report.issues().errors()).singleElement().satisfies(e -> {
            assertThat(e.reason()).isEqualTo("Trivy scan failed");
            assertThat(e.failureKind()).isEqualTo(FailureKind.SCAN_INVOCATION_ERROR);
            assertThat(e.details()).contains("Strategy: " + ScanStrategyPlanner.REASON_JAVA).contains("db locked");
        });
        assertThat(report.statistics().scanErrors()).isEqualTo(1);
        assertThat(report.statistics().assetsScanned()).isZero();
    }

    @Test
    @DisplayName("컨테이너 이미지를 어떤 참조로도 못 찾으면 경고 + 실패 집계")
    void containerWithNoReachableReference() {
        RepositoryDescriptor docker = new RepositoryDescriptor("docker-hosted", "docker", "hosted");
        source.repos.put(docker, List.of(Component.of("ghost", "9.9")));
        runner.json(t -> Reply.exit(1, "not found"));

        ScanReport report = service().run();

        assertThat(report.issues().warnings()).singleElement().satisfies(w -> {
            assertThat(w.failureKind()).isEqualTo(FailureKind.SCAN_INVOCATION_ERROR);
            assertThat(w.details()).contains("ghost:9.9");
        });
        assertThat(report.statistics().scanErrors()).isEqualTo(1);
        assertThat(runner.commands()).filteredOn(c -> c.contains("image")).hasSize(3);
    }

    @Test
    @DisplayName("에셋 하나의 런타임 예외가 세션을 끝내지 않음")
    void unexpectedFailureIsContainedToOneAsset() {
        RepositoryDescriptor maven = new RepositoryDescriptor("releases", "maven2", "hosted");
        source.repos.put(maven, List.of(Component.of("lib", "1",
                asset("boom.jar", "x".getBytes()), asset("ok.jar", "y".getBytes()))));
        IAssetDownloader flaky = (a, target) -> {
            if (a.name().equals("boom.jar")) throw new IllegalStateException("disk vanished");
            return downloader.download(a, target);
        };
        ScanExecutor exec = new ScanExecutor(cfg, "trivy", cfg.output().tempDir(), runner, new ObjectMapper());

        ScanReport report = new ScanService(cfg, source, flaky, exec, CLOCK).run();

        assertThat(report.issues().errors()).singleElement()
                .satisfies(e -> assertThat(e.details()).contains("disk vanished"));
        assertThat(report.issues().successes()).singleElement()
                .satisfies(ok -> assertThat(ok.asset()).isEqualTo("ok.jar"));
    }

    @Test
    void individualReportsDiscardedWhenNotRetained() {
        cfg.output().setRetainIndividualReports(false);
        RepositoryDescriptor maven = new RepositoryDescriptor("releases", "maven2", "hosted");
        source.repos.put(maven, List.of(Component.of("lib", "1", asset("lib-1.jar", "jar".getBytes()))));

        ScanReport report = service().run();

        assertThat(report.individualReports()).isZero();
        assertThat(tmp.resolve("out")).isDirectory();
    }
}
