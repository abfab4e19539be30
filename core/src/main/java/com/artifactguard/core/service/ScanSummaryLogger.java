package com.artifactguard.core.service;

import com.artifactguard.core.model.RunningStatistics;
import com.artifactguard.core.model.SuccessfulScan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/** 세션 종료 요약 (로그 출력 전용) */
public final class ScanSummaryLogger {
    private static final Logger LOG = LoggerFactory.getLogger(ScanSummaryLogger.class);
    private static final String RULE = "=".repeat(50);

    private ScanSummaryLogger() {}

    public static void log(ScanReport report, boolean retainingIndividualReports) {
        RunningStatistics.Snapshot s = report.statistics();
        ScanIssueLog issues = report.issues();

        LOG.info(RULE);
        LOG.info("SCAN SUMMARY");
        LOG.info(RULE);
        LOG.info("Repositories scanned: {}", s.repositoriesScanned());
        LOG.info("Components found: {}", s.componentsFound());
        LOG.info("Assets scanned: {}", s.assetsScanned());
        LOG.info("Vulnerabilities found: {}", s.vulnerabilitiesFound());
        LOG.info("Scan errors: {}", s.scanErrors());
        LOG.info("Assets skipped: {}", s.assetsSkipped());

        int totalIssues = issues.errors().size() + issues.skipped().size() + issues.warnings().size();
        List<SuccessfulScan> ok = issues.successes();
        LOG.info("Total issues logged: {}", totalIssues);
        LOG.info("  - Errors: {}", issues.errors().size());
        LOG.info("  - Skipped files: {}", issues.skipped().size());
        LOG.info("  - Warnings: {}", issues.warnings().size());
        LOG.info("Successful scans: {}", ok.size());
        if (!ok.isEmpty()) {
            long clean = issues.cleanScans();
            LOG.info("  - Clean scans (0 vulnerabilities): {}", clean);
            LOG.info("  - Scans with vulnerabilities: {}", ok.size() - clean);
        }

        if (!s.bySeverity().isEmpty()) {
            LOG.info("");
            LOG.info("Findings by severity:");
            s.bySeverity().forEach((sev, n) -> LOG.info("  {}: {}", sev, n));
        }

        LOG.info("");
        LOG.info("Repository formats detected: {}", s.repositoryFormats());
        LOG.info("Artifact types detected:");
        s.byArtifactType().forEach((type, n) -> {
            if (n > 0) LOG.info("  {}: {}", type, n);
        });

        LOG.info("");
        LOG.info("Report configuration:");
        if (retainingIndividualReports) {
            LOG.info("  Individual reports: RETAINED in 'individual_files_reports' folder ({} files)",
                    report.individualReports());
        } else {
            LOG.info("  Individual reports: TEMPORARY (discarded after each scan)");
        }
        LOG.info(RULE);
    }
}
