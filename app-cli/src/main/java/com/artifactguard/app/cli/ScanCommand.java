package com.artifactguard.app.cli;

import com.artifactguard.app.logging.LogSetup;
import com.artifactguard.core.model.ScanConfig;
import com.artifactguard.core.service.ScanAbortedException;
import com.artifactguard.core.service.ScanReport;
import com.artifactguard.core.service.ScanService;
import com.artifactguard.core.service.ScanSummaryLogger;
import com.artifactguard.core.service.export.ExportCoordinator;
import com.artifactguard.core.util.ProgressListener;
import com.artifactguard.core.util.YamlConfigLoader;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.nio.file.Path;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.function.Function;

/**
 * 저장소 전체 취약점 스캔 1회 실행.
 * 종료 코드: 0 정상, 1 보고서 저장 실패, 2 설정 오류, 3 저장소 서비스 연결 불가
 */
@Command(
        name = "artifactguard",
        mixinStandardHelpOptions = true,
        version = "ArtifactGuard 0.3.0",
        description = "Scans every artifact of a Nexus repository manager with Trivy and writes JSON/CSV reports."
)
public class ScanCommand implements Callable<Integer> {
    private static final Logger LOG = LoggerFactory.getLogger(ScanCommand.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_EXPORT_FAILED = 1;
    public static final int EXIT_CONFIG = 2;
    public static final int EXIT_ABORTED = 3;

    @Option(names = {"-c", "--config"}, description = "Path to scan.yml (default: ${DEFAULT-VALUE})")
    Path configPath = Path.of("scan.yml");

    @Option(names = {"-o", "--output-dir"}, description = "Report output directory (overrides output.dir)")
    Path outputDir;

    @Option(names = {"-f", "--format"}, split = ",", description = "Result formats: json, csv, html (overrides output.formats)")
    List<ScanConfig.OutputFormat> formats;

    @Option(names = {"--retain-reports"}, description = "Keep the engine's HTML rendering per asset")
    boolean retainReports;

    @Option(names = {"--debug"}, description = "Verbose logging and engine output")
    boolean debug;

    private final Map<String, String> env;
    private final Function<ScanConfig, ScanService> serviceFactory;

    public ScanCommand() {
        this(System.getenv(), cfg -> ScanService.create(cfg, new ObjectMapper()));
    }

    /** 테스트용: 환경 변수와 서비스 생성 주입 */
    public ScanCommand(Map<String, String> env, Function<ScanConfig, ScanService> serviceFactory) {
        this.env = env;
        this.serviceFactory = serviceFactory;
    }

    @Override
    public Integer call() {
        // ---- 1) 설정 ----
        ScanConfig cfg;
        try {
            cfg = YamlConfigLoader.load(configPath, env);
            applyOverrides(cfg);
            cfg.validate();
        } catch (IOException | IllegalArgumentException | NullPointerException e) {
            LOG.error("Configuration error ({}): {}", configPath, e.getMessage());
            return EXIT_CONFIG;
        }

        LogSetup.configure(cfg.output().getDir(), cfg.isDebug());
        LOG.info("Nexus URL: {}", cfg.nexus().getUrl());
        LOG.info("Output directory: {}", cfg.output().getDir().toAbsolutePath());

        // ---- 2) 스캔 ----
        ScanReport report;
        try {
            report = serviceFactory.apply(cfg).run(progress());
        } catch (ScanAbortedException e) {
            LOG.error("Scan aborted: {}", e.getMessage());
            return EXIT_ABORTED;
        }

        // ---- 3) 보고서 ----
        try {
            Path dir = new ExportCoordinator().exportAll(report, cfg.output().getFormats());
            ScanSummaryLogger.log(report, cfg.output().isRetainIndividualReports());
            LOG.info("Reports: {}", dir.toAbsolutePath());
        } catch (IOException e) {
            LOG.error("Failed to save reports: {}", e.getMessage());
            return EXIT_EXPORT_FAILED;
        }
        return EXIT_OK;
    }

    /** json/JSON 모두 허용 */
    public static CommandLine commandLine(ScanCommand cmd) {
        return new CommandLine(cmd).setCaseInsensitiveEnumValuesAllowed(true);
    }

    private void applyOverrides(ScanConfig cfg) {
        if (debug) cfg.setDebug(true);
        if (outputDir != null) cfg.output().setDir(outputDir);
        if (formats != null && !formats.isEmpty()) cfg.output().setFormats(EnumSet.copyOf(formats));
        if (retainReports) cfg.output().setRetainIndividualReports(true);
    }

    private static ProgressListener progress() {
        return (p, phase, done, total) -> {
            if (phase.startsWith("repository:")) {
                LOG.info("[{}/{}] {}", done + 1, total, phase.substring("repository:".length()));
            }
        };
    }
}
