package com.artifactguard.core.service;

import com.artifactguard.core.model.Finding;
import com.artifactguard.core.model.RunningStatistics;
import com.artifactguard.core.service.export.ReportNaming;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * 세션 1회의 최종 산출물. 보고서 작성기(export)와 요약 로거의 입력.
 *
 * @param engine            엔진 식별 문자열 (버전 조회 실패 시 실행 경로)
 * @param individualReports 보관된 개별 HTML 보고서 수
 */
public record ScanReport(
        ReportNaming.ReportContext context,
        Instant finishedAt,
        String repositoryUrl,
        String engine,
        List<Finding> findings,
        RunningStatistics.Snapshot statistics,
        ScanIssueLog issues,
        int individualReports
) {
    public ScanReport {
        Objects.requireNonNull(context, "context");
        Objects.requireNonNull(finishedAt, "finishedAt");
        Objects.requireNonNull(statistics, "statistics");
        Objects.requireNonNull(issues, "issues");
        findings = (findings == null ? List.of() : List.copyOf(findings));
        repositoryUrl = (repositoryUrl == null ? "" : repositoryUrl);
        engine = (engine == null ? "" : engine);
    }

    public Instant startedAt() {
        return context.startedAt();
    }
}
