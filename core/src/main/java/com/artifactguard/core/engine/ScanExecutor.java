package com.artifactguard.core.engine;

import com.artifactguard.core.model.EngineMode;
import com.artifactguard.core.model.FailureKind;
import com.artifactguard.core.model.ScanConfig;
import com.artifactguard.core.model.ScanStrategy;
import com.artifactguard.core.model.StepResult;
import com.artifactguard.core.util.FileCleanup;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 외부 스캔 엔진(trivy) 호출기.
 * 에셋 1건당 구조화(JSON) 1회 + 렌더링(HTML) 1회, 각 호출에 같은 timeout.
 * 출력 파일 2개와 넘겨받은 압축 해제 디렉터리는 어떤 경로로 끝나든 삭제한다.
 */
public final class ScanExecutor {
    private static final Logger LOG = LoggerFactory.getLogger(ScanExecutor.class);

    static final Duration VERSION_CHECK_TIMEOUT = Duration.ofSeconds(30);

    private final String enginePath;
    private final String htmlTemplate;
    private final Duration timeout;
    private final boolean renderHtml;
    private final boolean vulnOnly;
    private final boolean quiet;
    private final Path workDir;
    private final ProcessRunner runner;
    private final ObjectMapper mapper;
    private final AtomicLong seq = new AtomicLong();

    public ScanExecutor(ScanConfig cfg, String enginePath, Path workDir, ProcessRunner runner, ObjectMapper mapper) {
        Objects.requireNonNull(cfg, "cfg");
        this.enginePath = Objects.requireNonNull(enginePath, "enginePath");
        this.workDir = Objects.requireNonNull(workDir, "workDir");
        this.runner = Objects.requireNonNull(runner, "runner");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        ScanConfig.Engine e = cfg.engine();
        this.htmlTemplate = e.resolveHtmlTemplate(enginePath);
        this.timeout = e.getTimeout();
        this.renderHtml = e.isRenderHtml();
        this.vulnOnly = e.isVulnOnly();
        this.quiet = !cfg.isDebug();
    }

    /** 파일/디렉터리 스캔 (fs, config 모드) */
    public StepResult<EngineOutput> scanPath(Path target, ScanStrategy.Scannable strategy, Path extractionDir) {
        Objects.requireNonNull(target, "target");
        return execute(target.toString(), strategy, extractionDir);
    }

    /** 레지스트리 이미지 참조 스캔 (image 모드) */
    public StepResult<EngineOutput> scanImage(String imageReference, ScanStrategy.Scannable strategy) {
        Objects.requireNonNull(imageReference, "imageReference");
        return execute(imageReference, strategy, null);
    }

    /**
     * @param target        엔진에 넘길 마지막 인자
     * @param extractionDir 끝나면 지울 디렉터리 (없으면 null)
     */
    StepResult<EngineOutput> execute(String target, ScanStrategy.Scannable strategy, Path extractionDir) {
        Objects.requireNonNull(strategy, "strategy");
        long n = seq.incrementAndGet();
        Path jsonOut = workDir.resolve("scan-" + n + ".trivy.json");
        Path htmlOut = workDir.resolve("scan-" + n + ".trivy.html");
        long t0 = System.nanoTime();
        try {
            Files.createDirectories(workDir);

            // ---- 1) 구조화 출력 ----
            List<String> jsonCmd = command(strategy, List.of("--format", "json", "--output", jsonOut.toString()), target);
            String cmdLine = String.join(" ", jsonCmd);
            LOG.debug("Engine command: {}", cmdLine);
            ProcessResult json = runner.run(jsonCmd, timeout);
            Optional<String> failure = describeFailure(json);
            if (failure.isPresent()) {
                LOG.error("Engine scan failed for {}: {}", target, failure.get());
                if (!json.stderr().isBlank()) LOG.debug("Engine stderr: {}", json.stderr().strip());
                return StepResult.fail(FailureKind.SCAN_INVOCATION_ERROR, failure.get());
            }

            // ---- 2) 파싱 ----
            StepResult<JsonNode> parsed = parse(jsonOut);
            if (parsed.isFailure()) {
                LOG.error("Cannot parse engine output for {}: {}", target, parsed.message());
                return StepResult.fail(parsed.failure(), parsed.message());
            }

            // ---- 3) 사람용 렌더링 (실패해도 결과에는 영향 없음) ----
            String html = null;
            if (renderHtml) {
                html = render(strategy, htmlOut, target);
            }
            long ms = (System.nanoTime() - t0) / 1_000_000L;
            return StepResult.ok(new EngineOutput(parsed.get(), html, cmdLine, ms));
        } catch (IOException e) {
            LOG.error("Cannot run engine {} for {}: {}", enginePath, target, e.getMessage());
            return StepResult.fail(FailureKind.SCAN_INVOCATION_ERROR, "cannot start engine: " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return StepResult.fail(FailureKind.SCAN_INVOCATION_ERROR, "interrupted");
        } finally {
            FileCleanup.deleteRecursively(jsonOut);
            FileCleanup.deleteRecursively(htmlOut);
            if (extractionDir != null) FileCleanup.deleteRecursively(extractionDir);
        }
    }

    /** 렌더링 실패는 WARN 후 null. 이미 파싱한 구조화 결과에는 영향 없음 */
    private String render(ScanStrategy.Scannable strategy, Path htmlOut, String target)
            throws InterruptedException {
        List<String> cmd = command(strategy,
                List.of("--format", "template", "--template", "@" + htmlTemplate, "--output", htmlOut.toString()), target);
        LOG.debug("Engine render command: {}", String.join(" ", cmd));
        try {
            ProcessResult r = runner.run(cmd, timeout);
            Optional<String> failure = describeFailure(r);
            if (failure.isPresent()) {
                LOG.warn("HTML rendering failed for {}: {}", target, failure.get());
                return null;
            }
            if (!Files.exists(htmlOut)) {
                LOG.warn("HTML output file not found: {}", htmlOut);
                return null;
            }
            return Files.readString(htmlOut, StandardCharsets.UTF_8);
        } catch (IOException e) {
            LOG.warn("Could not render HTML report for {}: {}", target, e.toString());
            return null;
        }
    }

    /** 빈 파일/없는 파일/깨진 JSON → PARSE_ERROR */
    private StepResult<JsonNode> parse(Path jsonOut) throws IOException {
        if (!Files.exists(jsonOut)) {
            return StepResult.fail(FailureKind.PARSE_ERROR, "structured output file not found");
        }
        String content = Files.readString(jsonOut, StandardCharsets.UTF_8);
        if (content.isBlank()) {
            return StepResult.fail(FailureKind.PARSE_ERROR, "structured output is empty");
        }
        try {
            JsonNode node = mapper.readTree(content);
            if (node == null || !node.isObject()) {
                return StepResult.fail(FailureKind.PARSE_ERROR, "structured output is not a JSON object");
            }
            return StepResult.ok(node);
        } catch (JsonProcessingException e) {
            return StepResult.fail(FailureKind.PARSE_ERROR, "malformed structured output: " + e.getOriginalMessage());
        }
    }

    List<String> command(ScanStrategy.Scannable strategy, List<String> formatArgs, String target) {
        List<String> cmd = new ArrayList<>();
        cmd.add(enginePath);
        cmd.add(strategy.mode().command());
        if (vulnOnly && strategy.mode() != EngineMode.CONFIG) {
            cmd.add("--scanners");
            cmd.add("vuln");
        }
        cmd.addAll(formatArgs);
        if (quiet) cmd.add("--quiet");
        cmd.add(target);
        return cmd;
    }

    private Optional<String> describeFailure(ProcessResult r) {
        if (r.timedOut()) return Optional.of("timed out after " + timeout.toSeconds() + "s");
        if (r.exitCode() != 0) {
            String err = r.stderr().strip();
            if (err.length() > 500) err = err.substring(0, 500) + "...";
            return Optional.of("exit code " + r.exitCode() + (err.isEmpty() ? "" : ": " + err));
        }
        return Optional.empty();
    }

    /** 시작 시 1회: `<engine> --version`. 실패는 empty (치명적이지 않음) */
    public Optional<String> engineVersion() {
        try {
            ProcessResult r = runner.run(List.of(enginePath, "--version"), VERSION_CHECK_TIMEOUT);
            if (!r.succeeded()) {
                LOG.warn("Engine version check failed: {}", describeFailure(r).orElse("unknown"));
                return Optional.empty();
            }
            String v = r.stdout().strip();
            LOG.info("Scan engine: {} ({})", enginePath, v.lines().findFirst().orElse(""));
            return Optional.of(v);
        } catch (IOException e) {
            LOG.warn("Scan engine not runnable at {}: {}", enginePath, e.getMessage());
            return Optional.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        }
    }

    public String enginePath() { return enginePath; }
}
