package com.artifactguard.core.service;

import com.artifactguard.core.api.IAssetDownloader;
import com.artifactguard.core.api.IAssetSource;
import com.artifactguard.core.classify.ArtifactClassifier;
import com.artifactguard.core.engine.DefaultProcessRunner;
import com.artifactguard.core.engine.EngineOutput;
import com.artifactguard.core.engine.ScanExecutor;
import com.artifactguard.core.extract.ArchiveExtractor;
import com.artifactguard.core.manifest.DependencyManifestSynthesizer;
import com.artifactguard.core.manifest.ManifestOutcome;
import com.artifactguard.core.model.*;
import com.artifactguard.core.nexus.NexusClient;
import com.artifactguard.core.normalize.ResultNormalizer;
import com.artifactguard.core.service.export.IndividualReportStore;
import com.artifactguard.core.service.export.ReportNaming;
import com.artifactguard.core.strategy.ScanStrategyPlanner;
import com.artifactguard.core.util.FileCleanup;
import com.artifactguard.core.util.ProgressListener;
import com.artifactguard.core.util.StructuredLog;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 스캔 오케스트레이터 (세션 1회):
 *  - 연결 확인 → 저장소 → 컴포넌트 → 에셋, 전부 순차
 *  - 에셋당: 분류 → 계획 → 다운로드 → (해제) → (lock 합성) → 엔진 → 정규화 → 집계 → 로컬 사본 삭제
 *  - 임시 디렉터리에는 항상 에셋 1건 분량만 머문다
 *  - 컨테이너 저장소는 에셋 대신 컴포넌트 단위 이미지 스캔
 */
public final class ScanService {

    private static final Logger LOG = LoggerFactory.getLogger(ScanService.class);
    private static final StructuredLog SLOG = StructuredLog.get(ScanService.class);

    static final String REASON_DOWNLOAD_FAILED = "Asset download failed";
    static final String REASON_SCAN_FAILED = "Trivy scan failed";
    static final String REASON_EXTRACTION_FAILED = "Archive extraction failed - scanned as-is";
    static final String REASON_SYNTHESIS_FAILED = "Dependency manifest synthesis failed";
    static final String REASON_IMAGE_UNREACHABLE = "Container image not scannable with any reference";
    static final String REASON_PIPELINE_FAILED = "Unexpected pipeline failure";

    private final ScanConfig config;
    private final IAssetSource source;
    private final IAssetDownloader downloader;
    private final ScanExecutor executor;
    private final Clock clock;

    private final ArtifactClassifier classifier = new ArtifactClassifier();
    private final ScanStrategyPlanner planner = new ScanStrategyPlanner();
    private final ArchiveExtractor extractor = new ArchiveExtractor();
    private final ResultNormalizer normalizer = new ResultNormalizer();
    private final DependencyManifestSynthesizer synthesizer;

    /** 기본 구현 (Nexus + 로컬 trivy) */
    public static ScanService create(ScanConfig config, ObjectMapper mapper) {
        NexusClient nexus = new NexusClient(config, mapper);
        String engine = config.engine().resolvePath(Path.of("."));
        ScanExecutor exec = new ScanExecutor(config, engine, config.output().tempDir(), new DefaultProcessRunner(), mapper);
        return new ScanService(config, nexus, nexus, exec, Clock.systemUTC());
    }

    /** DI/테스트용 */
    public ScanService(ScanConfig config, IAssetSource source, IAssetDownloader downloader,
                       ScanExecutor executor, Clock clock) {
        this.config = Objects.requireNonNull(config, "config");
        this.config.validate();
        this.source = Objects.requireNonNull(source, "source");
        this.downloader = Objects.requireNonNull(downloader, "downloader");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.synthesizer = new DependencyManifestSynthesizer(
                config.synthesis().getMaxManifests(), config.synthesis().getMaxDependencies());
    }

    public ScanReport run() {
        return run(ProgressListener.NONE);
    }

    /**
     * @throws ScanAbortedException 저장소 서비스에 연결할 수 없음 (에셋 처리 전)
     */
    public ScanReport run(ProgressListener listener) {
        final ProgressListener pl = (listener != null) ? listener : ProgressListener.NONE;
        final Instant started = clock.instant();
        final ReportNaming.ReportContext ctx = ReportNaming.context(config.output().getDir(), started);
        final Path tempDir = config.output().tempDir();

        Session s = new Session(ctx, new IndividualReportStore(ReportNaming.individualDir(ctx),
                config.output().isRetainIndividualReports()));

        pl.onProgress(0.0, "connect", 0, -1);
        if (!source.testConnection()) {
            throw new ScanAbortedException("Cannot connect to repository service " + config.nexus().getUrl());
        }
        String engine = executor.engineVersion()
                .map(v -> v.lines().findFirst().orElse(v))
                .orElse(executor.enginePath());

        List<RepositoryDescriptor> repositories = source.listRepositories();
        if (repositories.isEmpty()) {
            LOG.error("No repositories found to scan");
        }
        LOG.info("Starting scan of {} repositories", repositories.size());
        SLOG.info("scan-start", "repositories", repositories.size(), "engine", engine,
                "outputDir", String.valueOf(config.output().getDir()));

        try {
            Files.createDirectories(tempDir);
            int done = 0;
            for (RepositoryDescriptor repo : repositories) {
                pl.onProgress(repositories.isEmpty() ? 0.0 : (double) done / repositories.size(),
                        "repository:" + repo.name(), done, repositories.size());
                scanRepository(repo, s);
                done++;
            }
        } catch (IOException e) {
            LOG.error("Cannot create temp directory {}: {}", tempDir, e.getMessage());
        } finally {
            // 세션 종료 시 임시 디렉터리 전체 정리
            FileCleanup.deleteRecursively(tempDir);
        }

        pl.onProgress(1.0, "done", repositories.size(), repositories.size());
        RunningStatistics.Snapshot snap = s.stats.finish();
        SLOG.info("scan-end", "assetsScanned", snap.assetsScanned(), "vulnerabilities", snap.vulnerabilitiesFound(),
                "errors", snap.scanErrors(), "skipped", snap.assetsSkipped());
        return new ScanReport(ctx, clock.instant(), config.nexus().getUrl(), engine, s.findings, snap,
                s.issues, s.individual.storedCount());
    }

    /** 세션 상태 (한 번의 run 동안만 유효) */
    private final class Session {
        final ReportNaming.ReportContext ctx;
        final RunningStatistics stats = new RunningStatistics();
        final ScanIssueLog issues = new ScanIssueLog(clock);
        final List<Finding> findings = new ArrayList<>();
        final IndividualReportStore individual;

        Session(ReportNaming.ReportContext ctx, IndividualReportStore individual) {
            this.ctx = ctx;
            this.individual = individual;
        }
    }

    // ---- 저장소 ----
    private void scanRepository(RepositoryDescriptor repo, Session s) {
        LOG.info("Scanning repository: {} ({})", repo.name(), repo.format());
        s.stats.recordRepository(repo.format());
        List<Component> components = source.listComponents(repo);
        s.stats.addComponents(components.size());

        for (Component c : components) {
            LOG.info("Processing component: {}", c.coordinate());
            if (repo.isContainer()) {
                guarded(repo, c, "docker_image_" + c.version(), ArtifactType.CONTAINER_IMAGE, s,
                        () -> scanContainerComponent(repo, c, s));
                continue;
            }
            for (Asset a : c.assets()) {
                if (!a.hasDownloadUrl()) {
                    LOG.debug("Asset {} has no download URL, ignoring", a.name());
                    continue;
                }
                guarded(repo, c, a.name(), classifier.classify(a, repo), s, () -> scanAsset(repo, c, a, s));
            }
        }
    }

    /** 한 에셋의 예기치 못한 런타임 예외가 세션을 끝내지 않도록 */
    private void guarded(RepositoryDescriptor repo, Component c, String asset, ArtifactType type,
                         Session s, Runnable step) {
        try {
            step.run();
        } catch (RuntimeException e) {
            LOG.error("Unexpected failure processing {} in {}: {}", asset, repo.name(), e.toString());
            s.issues.error(new ScanIssueLog.Where(repo.name(), c.name(), asset, type),
                    FailureKind.SCAN_INVOCATION_ERROR, REASON_PIPELINE_FAILED, e.toString());
            s.stats.recordFailed(type);
        }
    }

    // ---- 에셋 1건 ----
    private void scanAsset(RepositoryDescriptor repo, Component c, Asset asset, Session s) {
        ArtifactType type = classifier.classify(asset, repo);
        if (type == ArtifactType.UNKNOWN) {
            SLOG.warn("classification-fallback", "kind", FailureKind.CLASSIFICATION_FALLBACK,
                    "repository", repo.name(), "asset", asset.name(), "format", repo.format());
        }
        ScanIssueLog.Where where = new ScanIssueLog.Where(repo.name(), c.name(), asset.name(), type);
        ScanStrategy strategy = planner.plan(type, asset.name(), repo.format());

        if (!(strategy instanceof ScanStrategy.Scannable scannable)) {
            s.issues.skip(where, strategy.reason(), "Download URL: " + asset.downloadUrl());
            s.stats.recordSkipped(type);
            return;
        }

        LOG.info("Scanning asset: {} (Type: {})", asset.name(), type);
        LOG.info("Strategy: {}", strategy.reason());

        Path tempDir = config.output().tempDir();
        Path local = tempDir.resolve(FileCleanup.safeFileName(asset.name()));
        Path extracted = null;
        try {
            // ---- 1) 다운로드 ----
            StepResult<Path> dl = downloader.download(asset, local);
            if (dl.isFailure()) {
                s.issues.error(where, FailureKind.DOWNLOAD_ERROR, REASON_DOWNLOAD_FAILED,
                        "URL: " + asset.downloadUrl() + " (" + dl.message() + ")");
                s.stats.recordFailed(type);
                return;
            }
            long fileSize = sizeOf(local, asset);

            // ---- 2) 해제 + lock 합성 ----
            Path target = local;
            if (scannable.extractBeforeScan()) {
                extracted = tempDir.resolve(local.getFileName() + "_extracted");
                StepResult<Path> ex = extractor.extract(local, extracted);
                if (ex.isOk()) {
                    target = ex.get();
                    LOG.info("Extracted {} archive for deeper scanning", type);
                    synthesize(where, type, repo, target, s);
                } else {
                    s.issues.warning(where, FailureKind.EXTRACTION_ERROR, REASON_EXTRACTION_FAILED, ex.message());
                }
            }

            // ---- 3) 엔진 ----
            StepResult<EngineOutput> run = executor.scanPath(target, scannable, extracted);
            extracted = null; // 실행기가 정리함
            if (run.isFailure()) {
                s.issues.error(where, run.failure(), REASON_SCAN_FAILED,
                        "Strategy: " + strategy.reason() + ", cause: " + run.message());
                s.stats.recordFailed(type);
                return;
            }

            // ---- 4) 정규화 + 집계 ----
            EngineOutput out = run.get();
            List<VulnerabilityRecord> records = normalizer.normalize(out.structured());
            record(repo, c, asset.name(), type, strategy.reason(), scannable, out, records, fileSize, "", s);
        } finally {
            FileCleanup.deleteRecursively(local);
            if (extracted != null) FileCleanup.deleteRecursively(extracted);
        }
    }

    /** node 패키지 트리에만 적용 */
    private void synthesize(ScanIssueLog.Where where, ArtifactType type, RepositoryDescriptor repo, Path tree, Session s) {
        if (!config.synthesis().isEnabled()) return;
        if (type != ArtifactType.NODE_PACKAGE && !RepositoryFormats.isNode(repo.format())) return;
        for (ManifestOutcome o : synthesizer.synthesize(tree)) {
            if (o.status() == ManifestOutcome.Status.FAILED) {
                s.issues.warning(where, FailureKind.MANIFEST_SYNTHESIS_ERROR, REASON_SYNTHESIS_FAILED,
                        tree.relativize(o.manifest()) + ": " + o.message());
            }
        }
    }

    // ---- 컨테이너 컴포넌트: 이미지 참조 후보를 순서대로, 첫 성공에서 멈춤 ----
    private void scanContainerComponent(RepositoryDescriptor repo, Component c, Session s) {
        ArtifactType type = ArtifactType.CONTAINER_IMAGE;
        ScanStrategy strategy = planner.plan(type, c.name(), repo.format());
        String assetLabel = "docker_image_" + c.version();
        ScanIssueLog.Where where = new ScanIssueLog.Where(repo.name(), c.name(), assetLabel, type);
        if (!(strategy instanceof ScanStrategy.Scannable scannable)) {
            s.issues.skip(where, strategy.reason(), "");
            s.stats.recordSkipped(type);
            return;
        }

        List<String> refs = ImageReferences.candidates(config.nexus().host(), repo.name(), c.name(), c.version());
        LOG.info("Attempting to scan container image: {}", c.coordinate());
        List<String> failures = new ArrayList<>();
        for (String ref : refs) {
            LOG.info("Trying image reference: {}", ref);
            StepResult<EngineOutput> run = executor.scanImage(ref, scannable);
            if (run.isOk()) {
                EngineOutput out = run.get();
                List<VulnerabilityRecord> records = normalizer.normalize(out.structured());
                record(repo, c, assetLabel, type, strategy.reason(), scannable, out, records, -1, ref, s);
                LOG.info("Successfully scanned container image with reference: {}", ref);
                return;
            }
            failures.add(ref + " -> " + run.message());
        }
        s.issues.warning(where, FailureKind.SCAN_INVOCATION_ERROR, REASON_IMAGE_UNREACHABLE, String.join("; ", failures));
        s.stats.recordFailed(type);
    }

    private void record(RepositoryDescriptor repo, Component c, String asset, ArtifactType type, String reason,
                        ScanStrategy.Scannable scannable, EngineOutput out, List<VulnerabilityRecord> records,
                        long fileSize, String imageRef, Session s) {
        Instant now = clock.instant();
        s.stats.recordScanned(repo.name(), c.name(), type, records);
        for (VulnerabilityRecord r : records) {
            s.findings.add(new Finding(r, repo.name(), repo.format(), c.name(), c.version(), asset, type,
                    reason, s.ctx.startedAt(), imageRef));
        }
        s.issues.success(new SuccessfulScan(now, repo.name(), c.name(), asset, type, reason, records.size(),
                scannable.mode(), fileSize, out.durationMs(), out.command()));
        out.rendering().ifPresent(html -> s.individual.store(c.name(), asset, html));
        SLOG.info("asset-scanned", "repository", repo.name(), "asset", asset, "type", type.tag(),
                "findings", records.size(), "durationMs", out.durationMs());
    }

    private static long sizeOf(Path local, Asset asset) {
        try {
            return Files.size(local);
        } catch (IOException e) {
            return asset.fileSize();
        }
    }
}
