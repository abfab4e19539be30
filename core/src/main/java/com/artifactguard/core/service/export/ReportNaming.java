package com.artifactguard.core.service.export;

import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Objects;

/** 세션 출력 경로 규칙: &lt;output.dir&gt;/scan_reports_&lt;ts&gt;/... */
public final class ReportNaming {

    public static final DateTimeFormatter TS_FMT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH-mm-ss").withZone(ZoneId.systemDefault());

    private ReportNaming() {}

    public static ReportContext context(Path baseDir, Instant startedAt) {
        Path out = (baseDir == null ? Path.of("vulnerability_reports") : baseDir);
        return new ReportContext(out, Objects.requireNonNull(startedAt, "startedAt"));
    }

    public static String timestamp(ReportContext ctx) { return TS_FMT.format(ctx.startedAt()); }

    public static Path sessionDir(ReportContext ctx) { return ctx.baseDir().resolve("scan_reports_" + timestamp(ctx)); }
    public static Path jsonPath(ReportContext ctx) { return file(ctx, "nexus_scan_results_", ".json"); }
    public static Path csvPath(ReportContext ctx) { return file(ctx, "nexus_scan_results_", ".csv"); }
    public static Path htmlPath(ReportContext ctx) { return file(ctx, "nexus_scan_report_", ".html"); }
    public static Path comprehensiveJsonPath(ReportContext ctx) { return file(ctx, "comprehensive_scan_report_", ".json"); }
    public static Path comprehensiveHtmlPath(ReportContext ctx) { return file(ctx, "comprehensive_scan_report_", ".html"); }
    public static Path issuesPath(ReportContext ctx) { return file(ctx, "scan_issues_report_", ".json"); }
    public static Path skippedCsvPath(ReportContext ctx) { return file(ctx, "skipped_files_report_", ".csv"); }
    public static Path errorsCsvPath(ReportContext ctx) { return file(ctx, "error_scans_report_", ".csv"); }
    public static Path successesCsvPath(ReportContext ctx) { return file(ctx, "successful_scans_report_", ".csv"); }
    public static Path individualDir(ReportContext ctx) { return sessionDir(ctx).resolve("individual_files_reports"); }

    private static Path file(ReportContext ctx, String prefix, String ext) {
        return sessionDir(ctx).resolve(prefix + timestamp(ctx) + ext);
    }

    public record ReportContext(Path baseDir, Instant startedAt) {}
}
