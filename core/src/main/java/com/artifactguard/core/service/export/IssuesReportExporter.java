package com.artifactguard.core.service.export;

import com.artifactguard.core.service.ScanIssueLog;
import com.artifactguard.core.service.ScanReport;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * 이슈 보고서:
 *  - scan_issues_report_&lt;ts&gt;.json (메타데이터, 사유별 요약, 상세 이슈, 성공 스캔)
 *  - skipped_files_report / error_scans_report / successful_scans_report CSV (비어 있으면 생략)
 */
public final class IssuesReportExporter implements ReportExporter {
    private static final Logger LOG = LoggerFactory.getLogger(IssuesReportExporter.class);

    private final ObjectMapper mapper = ReportRows.jsonMapper();

    @Override
    public Path export(ScanReport report) throws IOException {
        ScanIssueLog log = report.issues();
        Path out = ReportNaming.issuesPath(report.context());
        Files.createDirectories(out.getParent());

        ObjectNode root = mapper.createObjectNode();

        // ---- 1) 메타데이터 ----
        ObjectNode meta = root.putObject("scan_metadata");
        meta.put("timestamp", report.startedAt().toString());
        meta.put("nexus_url", report.repositoryUrl());
        meta.put("total_errors", log.errors().size());
        meta.put("total_skipped", log.skipped().size());
        meta.put("total_warnings", log.warnings().size());
        meta.put("total_successful_scans", log.successes().size());

        // ---- 2) 요약 ----
        ObjectNode summary = root.putObject("summary");
        summary.set("errors_by_reason", mapper.valueToTree(ScanIssueLog.groupByReason(log.errors())));
        summary.set("skips_by_reason", mapper.valueToTree(ScanIssueLog.groupByReason(log.skipped())));
        summary.set("warnings_by_reason", mapper.valueToTree(ScanIssueLog.groupByReason(log.warnings())));
        ObjectNode byType = summary.putObject("successful_scans_by_type");
        log.successesByType().forEach((type, ts) -> {
            ObjectNode t = byType.putObject(type);
            t.put("count", ts.count());
            t.put("total_vulnerabilities", ts.totalVulnerabilities());
            t.put("clean_scans", ts.cleanScans());
        });

        // ---- 3) 상세 ----
        ObjectNode detailed = root.putObject("detailed_issues");
        detailed.set("errors", rows(log.errors(), ReportRows::issueDetailed));
        detailed.set("skipped_files", rows(log.skipped(), ReportRows::issueDetailed));
        detailed.set("warnings", rows(log.warnings(), ReportRows::issueDetailed));
        root.set("successful_scans", rows(log.successes(), ReportRows::successDetailed));

        mapper.writeValue(out.toFile(), root);
        LOG.info("Scan issues report saved: {}", out.toAbsolutePath());

        // ---- 4) 사람이 읽는 CSV ----
        csv(ReportNaming.skippedCsvPath(report.context()), ReportRows.ISSUE_COLUMNS, log.skipped(), ReportRows::issue, "Skipped files");
        csv(ReportNaming.errorsCsvPath(report.context()), ReportRows.ISSUE_COLUMNS, log.errors(), ReportRows::issue, "Scan errors");
        csv(ReportNaming.successesCsvPath(report.context()), ReportRows.SUCCESS_COLUMNS, log.successes(), ReportRows::success, "Successful scans");
        return out;
    }

    private <T> ArrayNode rows(List<T> items, Function<T, Map<String, Object>> fn) {
        ArrayNode arr = mapper.createArrayNode();
        for (T it : items) arr.add(mapper.valueToTree(fn.apply(it)));
        return arr;
    }

    private static <T> void csv(Path out, List<String> columns, List<T> items,
                                Function<T, Map<String, Object>> fn, String label) throws IOException {
        if (items.isEmpty()) return;
        CsvReportExporter.write(out, columns, items.stream().map(fn).toList());
        LOG.info("{} report saved: {} ({} rows)", label, out.toAbsolutePath(), items.size());
    }
}
