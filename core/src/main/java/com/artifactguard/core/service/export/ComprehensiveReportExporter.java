package com.artifactguard.core.service.export;

import com.artifactguard.core.model.Finding;
import com.artifactguard.core.model.RunningStatistics;
import com.artifactguard.core.model.Severity;
import com.artifactguard.core.service.ScanReport;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import static com.artifactguard.core.service.export.HtmlReportTemplates.esc;
import static com.artifactguard.core.service.export.HtmlReportTemplates.escOr;

/**
 * comprehensive_scan_report_&lt;ts&gt;.json + .html (세션마다 항상 기록)
 *  - scan_metadata: 시각/소요 시간/서버/엔진
 *  - statistics: 전체 카운터, 저장소 형식, 아티팩트 종류, 심각도 분포, 저장소별 요약
 *  - detailed_vulnerabilities: 결과 JSON과 같은 행
 * HTML은 같은 통계를 표로, 발견은 심각도 높은 순으로 보여준다.
 */
public final class ComprehensiveReportExporter implements ReportExporter {
    private static final Logger LOG = LoggerFactory.getLogger(ComprehensiveReportExporter.class);

    private final ObjectMapper mapper = ReportRows.jsonMapper();

    /** @return JSON 경로 (HTML은 같은 이름의 .html) */
    @Override
    public Path export(ScanReport report) throws IOException {
        Path json = ReportNaming.comprehensiveJsonPath(report.context());
        Path html = ReportNaming.comprehensiveHtmlPath(report.context());
        Files.createDirectories(json.getParent());

        mapper.writeValue(json.toFile(), buildJson(report));
        Files.writeString(html, buildHtml(report), StandardCharsets.UTF_8);

        LOG.info("Comprehensive reports generated: JSON={} HTML={}", json.toAbsolutePath(), html.toAbsolutePath());
        return json;
    }

    ObjectNode buildJson(ScanReport report) {
        RunningStatistics.Snapshot s = report.statistics();
        ObjectNode root = mapper.createObjectNode();

        ObjectNode meta = root.putObject("scan_metadata");
        meta.put("timestamp", report.startedAt().toString());
        meta.put("finished", report.finishedAt().toString());
        meta.put("scan_duration", duration(report));
        meta.put("nexus_url", report.repositoryUrl());
        meta.put("engine", report.engine());

        ObjectNode stats = root.putObject("statistics");
        ObjectNode overall = stats.putObject("overall");
        overall.put("repositories_scanned", s.repositoriesScanned());
        overall.put("components_found", s.componentsFound());
        overall.put("assets_scanned", s.assetsScanned());
        overall.put("vulnerabilities_found", s.vulnerabilitiesFound());
        overall.put("scan_errors", s.scanErrors());
        overall.put("assets_skipped", s.assetsSkipped());

        ArrayNode formats = stats.putArray("repository_formats");
        s.repositoryFormats().forEach(formats::add);
        ObjectNode types = stats.putObject("artifact_types_detected");
        s.byArtifactType().forEach(types::put);
        stats.set("severity_breakdown", severities(s.bySeverity()));

        ObjectNode repos = stats.putObject("repository_summary");
        s.byRepository().forEach((repo, summary) -> {
            List<String> components = s.affectedComponents().getOrDefault(repo, List.of());
            ObjectNode r = repos.putObject(repo);
            r.put("total_vulnerabilities", summary.totalFindings());
            r.set("severity_breakdown", severities(summary.bySeverity()));
            ArrayNode comps = r.putArray("components_with_vulnerabilities");
            components.forEach(comps::add);
            r.put("unique_components_with_vulns", components.size());
        });

        ArrayNode arr = root.putArray("detailed_vulnerabilities");
        for (Finding f : report.findings()) {
            arr.add(mapper.valueToTree(ReportRows.finding(f, false)));
        }
        return root;
    }

    private ObjectNode severities(Map<Severity, Long> counts) {
        ObjectNode n = mapper.createObjectNode();
        counts.forEach((sev, c) -> n.put(sev.name(), c));
        return n;
    }

    String buildHtml(ScanReport report) {
        RunningStatistics.Snapshot s = report.statistics();
        StringBuilder sb = new StringBuilder(32_768);
        sb.append(HtmlReportTemplates.open("Comprehensive Nexus Security Report"));
        sb.append(HtmlReportTemplates.header("Comprehensive Nexus Security Report",
                "Started: " + report.startedAt() + " · Duration: " + duration(report)
                        + " · Nexus Server: " + report.repositoryUrl() + " · Engine: " + report.engine()));

        sb.append("<div class='card'><h2>Overview</h2><div class='grid'>")
          .append(HtmlReportTemplates.stat("Repositories Scanned", s.repositoriesScanned()))
          .append(HtmlReportTemplates.stat("Components Found", s.componentsFound()))
          .append(HtmlReportTemplates.stat("Assets Scanned", s.assetsScanned()))
          .append(HtmlReportTemplates.stat("Vulnerabilities Found", s.vulnerabilitiesFound()))
          .append(HtmlReportTemplates.stat("Assets Skipped", s.assetsSkipped()))
          .append(HtmlReportTemplates.stat("Scan Errors", s.scanErrors()))
          .append("</div>")
          .append(HtmlReportTemplates.severityBar(s.bySeverity()))
          .append("</div>");

        // 아티팩트 종류
        sb.append("<div class='card'><h2>Artifact Types Detected</h2><table><thead><tr>")
          .append("<th>Type</th><th>Assets</th></tr></thead><tbody>");
        s.byArtifactType().forEach((type, n) ->
                sb.append("<tr><td>").append(esc(type)).append("</td><td>").append(n).append("</td></tr>"));
        if (s.byArtifactType().isEmpty()) sb.append("<tr><td colspan='2' class='muted'>None</td></tr>");
        sb.append("</tbody></table>");
        if (!s.repositoryFormats().isEmpty()) {
            sb.append("<p class='muted'>Repository formats: ").append(esc(String.join(", ", s.repositoryFormats())))
              .append("</p>");
        }
        sb.append("</div>");

        // 저장소별 요약
        sb.append("<div class='card'><h2>Repository Summary</h2><table><thead><tr><th>Repository</th>")
          .append("<th>Vulnerabilities</th>");
        for (Severity sev : Severity.values()) {
            sb.append("<th class='sev-").append(sev.name()).append("'>").append(sev.name()).append("</th>");
        }
        sb.append("<th>Affected Components</th></tr></thead><tbody>");
        s.byRepository().forEach((repo, summary) -> {
            sb.append("<tr><td>").append(esc(repo)).append("</td><td>").append(summary.totalFindings()).append("</td>");
            for (Severity sev : Severity.values()) {
                sb.append("<td>").append(summary.bySeverity().getOrDefault(sev, 0L)).append("</td>");
            }
            sb.append("<td>").append(esc(String.join(", ", s.affectedComponents().getOrDefault(repo, List.of()))))
              .append("</td></tr>");
        });
        if (s.byRepository().isEmpty()) {
            sb.append("<tr><td colspan='").append(Severity.values().length + 3)
              .append("' class='muted'>No vulnerable repositories.</td></tr>");
        }
        sb.append("</tbody></table></div>");

        // 발견 (심각도 → 저장소 → 컴포넌트 순)
        List<Finding> ordered = new ArrayList<>(report.findings());
        ordered.sort(Comparator.comparing(Finding::severity)
                .thenComparing(Finding::repository)
                .thenComparing(Finding::component));
        sb.append("<div class='card'><h2>Vulnerabilities</h2><table><thead><tr>")
          .append("<th>#</th><th>Severity</th><th>ID</th><th>Package</th><th>Fixed</th>")
          .append("<th>Repository</th><th>Component</th><th>Asset</th></tr></thead><tbody>");
        int i = 1;
        for (Finding f : ordered) {
            var r = f.record();
            String sev = r.getSeverity().name();
            sb.append("<tr><td>").append(i++).append("</td>")
              .append("<td class='sev-").append(sev).append("'>").append(sev).append("</td>")
              .append("<td title='").append(esc(r.getTitle())).append("'>").append(escOr(r.getVulnerabilityId(), "N/A")).append("</td>")
              .append("<td>").append(escOr(r.getPackageName(), "N/A")).append(' ')
              .append(esc(r.getInstalledVersion())).append("</td>")
              .append("<td>").append(escOr(r.getFixedVersion(), "-")).append("</td>")
              .append("<td>").append(esc(f.repository())).append("</td>")
              .append("<td>").append(esc(f.component())).append("</td>")
              .append("<td>").append(esc(f.asset())).append("</td></tr>");
        }
        if (ordered.isEmpty()) {
            sb.append("<tr><td colspan='8' class='muted'>No vulnerabilities detected.</td></tr>");
        }
        sb.append("</tbody></table></div>");

        sb.append(HtmlReportTemplates.footer());
        return sb.toString();
    }

    private static String duration(ScanReport report) {
        Duration d = Duration.between(report.startedAt(), report.finishedAt());
        return String.format(Locale.ROOT, "%.2fs", Math.max(0, d.toMillis()) / 1000.0);
    }
}
