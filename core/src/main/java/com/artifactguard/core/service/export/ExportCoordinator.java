package com.artifactguard.core.service.export;

import com.artifactguard.core.model.ScanConfig;
import com.artifactguard.core.service.ScanReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Set;

/**
 * 세션 결과 → 세션 폴더(scan_reports_&lt;ts&gt;).
 * 결과 보고서는 선택된 형식만, 종합 보고서와 이슈 보고서는 항상 기록.
 */
public final class ExportCoordinator {
    private static final Logger LOG = LoggerFactory.getLogger(ExportCoordinator.class);

    private final JsonReportExporter json = new JsonReportExporter();
    private final CsvReportExporter csv = new CsvReportExporter();
    private final HtmlReportExporter html = new HtmlReportExporter();
    private final ComprehensiveReportExporter comprehensive = new ComprehensiveReportExporter();
    private final IssuesReportExporter issues = new IssuesReportExporter();

    /** @return 세션 폴더 */
    public Path exportAll(ScanReport report, Set<ScanConfig.OutputFormat> formats) throws IOException {
        Objects.requireNonNull(report, "report");
        Objects.requireNonNull(formats, "formats");
        Path dir = ReportNaming.sessionDir(report.context());
        Files.createDirectories(dir);

        final boolean wantJson = formats.contains(ScanConfig.OutputFormat.JSON);
        final boolean wantCsv = formats.contains(ScanConfig.OutputFormat.CSV);
        final boolean wantHtml = formats.contains(ScanConfig.OutputFormat.HTML);
        LOG.info("[Export plan] json={}, csv={}, html={}, comprehensive=true, issues=true, dir={}",
                wantJson, wantCsv, wantHtml, dir.toAbsolutePath());

        if (wantJson) json.export(report);
        if (wantCsv) csv.export(report);
        if (wantHtml) html.export(report);
        comprehensive.export(report);
        issues.export(report);

        LOG.info("All reports saved to: {}", dir.toAbsolutePath());
        return dir;
    }
}
