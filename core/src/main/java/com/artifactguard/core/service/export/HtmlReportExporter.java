package com.artifactguard.core.service.export;

import com.artifactguard.core.model.Finding;
import com.artifactguard.core.model.RunningStatistics;
import com.artifactguard.core.model.VulnerabilityRecord;
import com.artifactguard.core.service.ScanReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.artifactguard.core.service.export.HtmlReportTemplates.esc;
import static com.artifactguard.core.service.export.HtmlReportTemplates.escOr;

/**
 * nexus_scan_report_&lt;ts&gt;.html
 *  - 세션 요약 (저장소/컴포넌트/에셋/취약점 수)
 *  - 저장소 → 컴포넌트 → 취약점 순으로 묶은 상세 (발견 순서 유지)
 *  - 발견이 없으면 "No Vulnerabilities Found" 안내만
 */
public final class HtmlReportExporter implements ReportExporter {
    private static final Logger LOG = LoggerFactory.getLogger(HtmlReportExporter.class);

    @Override
    public Path export(ScanReport report) throws IOException {
        Path out = ReportNaming.htmlPath(report.context());
        Files.createDirectories(out.getParent());
        Files.writeString(out, buildHtml(report), StandardCharsets.UTF_8);
        LOG.info("HTML report saved: {}", out.toAbsolutePath());
        return out;
    }

    String buildHtml(ScanReport report) {
        RunningStatistics.Snapshot s = report.statistics();
        StringBuilder sb = new StringBuilder(16_384);
        sb.append(HtmlReportTemplates.open("Nexus Vulnerability Scan Report"));
        sb.append(HtmlReportTemplates.header("Nexus Repository Vulnerability Scan Report",
                "Generated on: " + ReportNaming.timestamp(report.context())
                        + " · Nexus Server: " + report.repositoryUrl()));

        sb.append("<div class='card'><h2>Scan Summary</h2><div class='grid'>")
          .append(HtmlReportTemplates.stat("Repositories Scanned", s.repositoriesScanned()))
          .append(HtmlReportTemplates.stat("Components Found", s.componentsFound()))
          .append(HtmlReportTemplates.stat("Assets Scanned", s.assetsScanned()))
          .append(HtmlReportTemplates.stat("Vulnerabilities Found", s.vulnerabilitiesFound()))
          .append("</div>")
          .append(HtmlReportTemplates.severityBar(s.bySeverity()))
          .append("</div>");

        Map<String, Map<String, List<Finding>>> byRepo = group(report.findings());
        if (byRepo.isEmpty()) {
            sb.append("<div class='card empty'><h2>No Vulnerabilities Found</h2>")
              .append("<p>No security vulnerabilities were detected in any of the scanned repositories.</p></div>");
        } else {
            sb.append("<h2>Vulnerability Details</h2>");
            byRepo.forEach((repo, components) -> {
                sb.append("<div class='card'><h2>Repository: ").append(esc(repo)).append("</h2>");
                components.forEach((component, findings) -> {
                    sb.append("<h3>Component: ").append(esc(component)).append("</h3>");
                    for (Finding f : findings) vulnerability(sb, f);
                });
                sb.append("</div>");
            });
        }

        sb.append(HtmlReportTemplates.footer());
        return sb.toString();
    }

    /** 저장소 → 컴포넌트 → 발견 목록, 처음 나온 순서 */
    static Map<String, Map<String, List<Finding>>> group(List<Finding> findings) {
        Map<String, Map<String, List<Finding>>> out = new LinkedHashMap<>();
        for (Finding f : findings) {
            String repo = f.repository().isEmpty() ? "Unknown" : f.repository();
            String component = f.component().isEmpty() ? "Unknown" : f.component();
            out.computeIfAbsent(repo, k -> new LinkedHashMap<>())
               .computeIfAbsent(component, k -> new ArrayList<>())
               .add(f);
        }
        return out;
    }

    private static void vulnerability(StringBuilder sb, Finding f) {
        VulnerabilityRecord r = f.record();
        String sev = r.getSeverity().name();
        sb.append("<div class='vuln ").append(sev).append("'>")
          .append("<div><b>").append(escOr(r.getVulnerabilityId(), "N/A")).append("</b> ")
          .append("<span class='chip sev-").append(sev).append("'>").append(sev).append("</span></div>")
          .append("<h4>").append(escOr(r.getTitle(), "No title available")).append("</h4>")
          .append("<p><b>Package:</b> ").append(escOr(r.getPackageName(), "N/A"))
          .append(" (").append(escOr(r.getInstalledVersion(), "N/A")).append(")</p>")
          .append("<p><b>Description:</b> ").append(escOr(r.getDescription(), "No description available")).append("</p>")
          .append("<p><b>Fixed Version:</b> ").append(escOr(r.getFixedVersion(), "Not available")).append("</p>")
          .append("<p><b>Asset:</b> ").append(escOr(f.asset(), "N/A")).append("</p>")
          .append("</div>");
    }
}
