package com.artifactguard.core.engine;

import com.artifactguard.core.model.FailureKind;
import com.artifactguard.core.model.ScanConfig;
import com.artifactguard.core.model.ScanStrategy;
import com.artifactguard.core.model.StepResult;
import com.artifactguard.core.engine.ScriptedProcessRunner.Reply;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

class ScanExecutorTest {

    @TempDir
    Path tmp;

    private static final ScanStrategy.Scannable ARCHIVE = new ScanStrategy.FilesystemScan(false, true, "java");
    private static final ScanStrategy.Scannable CONFIG = new ScanStrategy.ConfigScan("cfg");

    private ScanConfig cfg() {
        ScanConfig c = ScanConfig.defaults();
        c.nexus().setUrl("http://nexus:8081");
        return c;
    }

    private ScanExecutor executor(ScanConfig c, ProcessRunner runner) {
        return new ScanExecutor(c, "/opt/trivy/trivy", tmp.resolve("work"), runner, new ObjectMapper());
    }

    private long workFiles() throws IOException {
        if (!Files.exists(tmp.resolve("work"))) return 0;
        try (Stream<Path> s = Files.list(tmp.resolve("work"))) {
            return s.count();
        }
    }

    @Test
    @DisplayName("성공: JSON + HTML 두 번 호출, 출력 파일과 해제 디렉터리 모두 삭제")
    void successCleansUp() throws Exception {
        ScriptedProcessRunner runner = new ScriptedProcessRunner()
                .json(t -> Reply.ok(ScriptedProcessRunner.findings(t, "HIGH", "LOW")));
        Path extracted = Files.createDirectories(tmp.resolve("pkg_extracted/package"));
        Path target = tmp.resolve("lib.jar");
        Files.writeString(target, "jar");

        StepResult<EngineOutput> r = executor(cfg(), runner).scanPath(target, ARCHIVE, tmp.resolve("pkg_extracted"));

        assertThat(r.isOk()).isTrue();
        assertThat(r.get().structured().get("Results").size()).isEqualTo(1);
        assertThat(r.get().rendering()).contains("<html>" + target + "</html>");
        assertThat(r.get().command()).startsWith("/opt/trivy/trivy fs --scanners vuln --format json");
        assertThat(runner.commands()).hasSize(2);
        assertThat(workFiles()).isZero();
        assertThat(extracted).doesNotExist();
    }

    @Test
    void commandShapePerMode() {
        ScanConfig c = cfg();
        ScanExecutor ex = executor(c, new ScriptedProcessRunner());

        assertThat(ex.command(ARCHIVE, List.of("--format", "json"), "x.jar"))
                .containsExactly("/opt/trivy/trivy", "fs", "--scanners", "vuln", "--format", "json", "--quiet", "x.jar");
        assertThat(ex.command(CONFIG, List.of("--format", "json"), "c.yaml"))
                .containsExactly("/opt/trivy/trivy", "config", "--format", "json", "--quiet", "c.yaml");
        assertThat(ex.command(new ScanStrategy.ImageScan("img"), List.of(), "nexus:8081/app:1.0"))
                .startsWith("/opt/trivy/trivy", "image");

        c.setDebug(true);
        c.engine().setVulnOnly(false);
        assertThat(executor(c, new ScriptedProcessRunner()).command(ARCHIVE, List.of(), "x.jar"))
                .containsExactly("/opt/trivy/trivy", "fs", "x.jar");
    }

    @Test
    void nonZeroExitIsInvocationError() throws Exception {
        ScriptedProcessRunner runner = new ScriptedProcessRunner().json(t -> Reply.exit(1, "FATAL db error"));

        StepResult<EngineOutput> r = executor(cfg(), runner).scanImage("app:1.0", new ScanStrategy.ImageScan("img"));

        assertThat(r.failure()).isEqualTo(FailureKind.SCAN_INVOCATION_ERROR);
        assertThat(r.message()).contains("exit code 1").contains("FATAL db error");
        assertThat(runner.commands()).hasSize(1); // 렌더링 시도 안 함
        assertThat(workFiles()).isZero();
    }

    @Test
    void timeoutIsInvocationError() {
        ScanConfig c = cfg();
        c.engine().setTimeoutSeconds(7);
        ScriptedProcessRunner runner = new ScriptedProcessRunner().json(t -> Reply.timeout());

        StepResult<EngineOutput> r = executor(c, runner).scanPath(tmp.resolve("x.jar"), ARCHIVE, null);

        assertThat(r.failure()).isEqualTo(FailureKind.SCAN_INVOCATION_ERROR);
        assertThat(r.message()).contains("timed out after 7s");
    }

    @Test
    void emptyOrMalformedOutputIsParseError() {
        StepResult<EngineOutput> empty = executor(cfg(), new ScriptedProcessRunner().json(t -> Reply.ok("")))
                .scanPath(tmp.resolve("x.jar"), ARCHIVE, null);
        assertThat(empty.failure()).isEqualTo(FailureKind.PARSE_ERROR);

        StepResult<EngineOutput> broken = executor(cfg(), new ScriptedProcessRunner().json(t -> Reply.ok("{\"Results\":[")))
                .scanPath(tmp.resolve("x.jar"), ARCHIVE, null);
        assertThat(broken.failure()).isEqualTo(FailureKind.PARSE_ERROR);

        StepResult<EngineOutput> missing = executor(cfg(), new ScriptedProcessRunner().json(t -> new Reply(0, null, "", false)))
                .scanPath(tmp.resolve("x.jar"), ARCHIVE, null);
        assertThat(missing.failure()).isEqualTo(FailureKind.PARSE_ERROR);
    }

    @Test
    @DisplayName("HTML 렌더링 실패는 결과에 영향 없음 (rendering만 비어 있음)")
    void renderingFailureTolerated() throws Exception {
        ScriptedProcessRunner runner = new ScriptedProcessRunner()
                .json(t -> Reply.ok(ScriptedProcessRunner.findings(t, "CRITICAL")))
                .html(t -> Reply.exit(2, "template not found"));

        StepResult<EngineOutput> r = executor(cfg(), runner).scanPath(tmp.resolve("x.jar"), ARCHIVE, null);

        assertThat(r.isOk()).isTrue();
        assertThat(r.get().rendering()).isEmpty();
        assertThat(workFiles()).isZero();
    }

    @Test
    @DisplayName("렌더링 호출이 IOException을 던져도 구조화 결과는 유지")
    void renderingStartFailureKeepsFindings() throws Exception {
        ScriptedProcessRunner scripted = new ScriptedProcessRunner()
                .json(t -> Reply.ok(ScriptedProcessRunner.findings(t, "HIGH")));
        ProcessRunner runner = (cmd, timeout) -> {
            if (cmd.contains("template")) throw new IOException("template engine crashed");
            return scripted.run(cmd, timeout);
        };

        StepResult<EngineOutput> r = executor(cfg(), runner).scanPath(tmp.resolve("x.jar"), ARCHIVE, null);

        assertThat(r.isOk()).isTrue();
        assertThat(r.get().structured().path("Results").get(0).path("Vulnerabilities")).hasSize(1);
        assertThat(r.get().rendering()).isEmpty();
        assertThat(workFiles()).isZero();
    }

    @Test
    void undecodableRenderingIsDropped() throws Exception {
        ScriptedProcessRunner scripted = new ScriptedProcessRunner()
                .json(t -> Reply.ok(ScriptedProcessRunner.findings(t, "HIGH")));
        ProcessRunner runner = (cmd, timeout) -> {
            if (!cmd.contains("template")) return scripted.run(cmd, timeout);
            Path out = Path.of(cmd.get(cmd.indexOf("--output") + 1));
            Files.write(out, new byte[]{'<', 'p', '>', (byte) 0xC3, (byte) 0x28});
            return new ProcessResult(0, "", "", false);
        };

        StepResult<EngineOutput> r = executor(cfg(), runner).scanPath(tmp.resolve("x.jar"), ARCHIVE, null);

        assertThat(r.isOk()).isTrue();
        assertThat(r.get().rendering()).isEmpty();
        assertThat(workFiles()).isZero();
    }

    @Test
    void renderingDisabledRunsOnce() {
        ScanConfig c = cfg();
        c.engine().setRenderHtml(false);
        ScriptedProcessRunner runner = new ScriptedProcessRunner();

        StepResult<EngineOutput> r = executor(c, runner).scanPath(tmp.resolve("x.jar"), ARCHIVE, null);

        assertThat(r.isOk()).isTrue();
        assertThat(runner.commands()).hasSize(1);
    }

    @Test
    void htmlTemplateResolvedNextToEngine() {
        ScriptedProcessRunner runner = new ScriptedProcessRunner();
        executor(cfg(), runner).scanPath(tmp.resolve("x.jar"), ARCHIVE, null);

        assertThat(runner.commands().get(1)).contains("@" + Path.of("/opt/trivy/contrib/html.tpl"));
    }

    @Test
    void engineVersionCheck() {
        assertThat(executor(cfg(), new ScriptedProcessRunner()).engineVersion()).contains("Version: 0.50.0");
        assertThat(executor(cfg(), new ScriptedProcessRunner().version(Reply.exit(127, "not found"))).engineVersion())
                .isEmpty();
        ProcessRunner missing = (cmd, timeout) -> { throw new IOException("No such file"); };
        assertThat(new ScanExecutor(cfg(), "trivy", tmp, missing, new ObjectMapper()).engineVersion()).isEmpty();
    }

    @Test
    void processTimeoutIsPassedThrough() throws Exception {
        ScanConfig c = cfg();
        c.engine().setTimeoutSeconds(42);
        Duration[] seen = new Duration[1];
        ProcessRunner spy = (cmd, timeout) -> { seen[0] = timeout; return new ProcessResult(1, "", "", false); };

        new ScanExecutor(c, "trivy", tmp, spy, new ObjectMapper()).scanPath(tmp.resolve("x"), ARCHIVE, null);

        assertThat(seen[0]).isEqualTo(Duration.ofSeconds(42));
    }
}
