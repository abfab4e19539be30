package com.artifactguard.core.service.export;

import com.artifactguard.core.model.Finding;
import com.artifactguard.core.model.ScanIssue;
import com.artifactguard.core.model.SuccessfulScan;
import com.artifactguard.core.model.VulnerabilityRecord;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 보고서 행 평탄화 (JSON/CSV 공용). 키 이름은 기존 보고서 소비자와 호환되는 snake_case.
 */
final class ReportRows {
    private ReportRows() {}

    static final List<String> FINDING_COLUMNS = List.of(
            "target", "vulnerability_id", "pkg_name", "pkg_version", "severity", "title", "description",
            "fixed_version", "references", "repository", "repository_format", "component", "component_version",
            "asset", "artifact_type", "scan_strategy", "scan_timestamp", "image_reference");

    static final List<String> ISSUE_COLUMNS = List.of(
            "timestamp", "repository", "component", "asset", "artifact_type", "reason", "details");

    static final List<String> SUCCESS_COLUMNS = List.of(
            "timestamp", "repository", "component", "asset", "artifact_type",
            "scan_strategy", "vulnerabilities_found", "scan_type", "file_size", "scan_duration");

    /** ISO-8601 시각, 들여쓰기 출력 */
    static ObjectMapper jsonMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    /** references: JSON은 배열, CSV는 "; " 연결 문자열 */
    static Map<String, Object> finding(Finding f, boolean flatReferences) {
        VulnerabilityRecord r = f.record();
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("target", r.getTarget());
        m.put("vulnerability_id", r.getVulnerabilityId());
        m.put("pkg_name", r.getPackageName());
        m.put("pkg_version", r.getInstalledVersion());
        m.put("severity", r.getSeverity().name());
        m.put("title", r.getTitle());
        m.put("description", r.getDescription());
        m.put("fixed_version", r.getFixedVersion());
        m.put("references", flatReferences ? String.join("; ", r.getReferences()) : r.getReferences());
        m.put("repository", f.repository());
        m.put("repository_format", f.repositoryFormat());
        m.put("component", f.component());
        m.put("component_version", f.componentVersion());
        m.put("asset", f.asset());
        m.put("artifact_type", f.artifactType().tag());
        m.put("scan_strategy", f.strategyReason());
        m.put("scan_timestamp", f.scannedAt().toString());
        m.put("image_reference", f.imageReference());
        return m;
    }

    static Map<String, Object> issue(ScanIssue i) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("timestamp", i.timestamp().toString());
        m.put("repository", i.repository());
        m.put("component", i.component());
        m.put("asset", i.asset());
        m.put("artifact_type", i.artifactType().tag());
        m.put("reason", i.reason());
        m.put("details", i.details());
        return m;
    }

    /** JSON 상세용: CSV 열 + 종류/실패 분류 */
    static Map<String, Object> issueDetailed(ScanIssue i) {
        Map<String, Object> m = issue(i);
        m.put("issue_type", i.kind().name().toLowerCase(Locale.ROOT));
        m.put("failure_kind", i.failureKind() == null ? null : i.failureKind().name());
        return m;
    }

    static Map<String, Object> success(SuccessfulScan s) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("timestamp", s.timestamp().toString());
        m.put("repository", s.repository());
        m.put("component", s.component());
        m.put("asset", s.asset());
        m.put("artifact_type", s.artifactType().tag());
        m.put("scan_strategy", s.strategyReason());
        m.put("vulnerabilities_found", s.findings());
        m.put("scan_type", s.engineMode().command());
        m.put("file_size", s.fileSize());
        m.put("scan_duration", String.format(Locale.ROOT, "%.2fs", s.durationMs() / 1000.0));
        return m;
    }

    /** JSON 상세용: CSV 열 + 엔진 명령 */
    static Map<String, Object> successDetailed(SuccessfulScan s) {
        Map<String, Object> m = success(s);
        m.put("trivy_command", s.engineCommand());
        return m;
    }
}
