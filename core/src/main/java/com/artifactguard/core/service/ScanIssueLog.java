package com.artifactguard.core.service;

import com.artifactguard.core.model.ArtifactType;
import com.artifactguard.core.model.FailureKind;
import com.artifactguard.core.model.ScanIssue;
import com.artifactguard.core.model.SuccessfulScan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.*;

/**
 * 세션 동안의 건너뜀/에러/경고/성공 기록. 보고서(IssuesReportExporter)와 요약 로그의 입력.
 */
public final class ScanIssueLog {
    private static final Logger LOG = LoggerFactory.getLogger(ScanIssueLog.class);

    /** 에셋 위치 (저장소/컴포넌트/에셋/타입) */
    public record Where(String repository, String component, String asset, ArtifactType artifactType) {}

    /** 타입별 성공 요약 */
    public record TypeSummary(long count, long totalVulnerabilities, long cleanScans) {}

    private final Clock clock;
    private final List<ScanIssue> errors = new ArrayList<>();
    private final List<ScanIssue> skipped = new ArrayList<>();
    private final List<ScanIssue> warnings = new ArrayList<>();
    private final List<SuccessfulScan> successes = new ArrayList<>();

    public ScanIssueLog() {
        this(Clock.systemUTC());
    }

    public ScanIssueLog(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public ScanIssue skip(Where w, String reason, String details) {
        ScanIssue i = issue(ScanIssue.Kind.SKIP, w, null, reason, details);
        skipped.add(i);
        LOG.info("Skipping {} - {}", w.asset(), reason);
        return i;
    }

    public ScanIssue error(Where w, FailureKind kind, String reason, String details) {
        ScanIssue i = issue(ScanIssue.Kind.ERROR, w, Objects.requireNonNull(kind, "kind"), reason, details);
        errors.add(i);
        LOG.error("Scan error - {}: {}", reason, w.asset());
        return i;
    }

    public ScanIssue warning(Where w, FailureKind kind, String reason, String details) {
        ScanIssue i = issue(ScanIssue.Kind.WARNING, w, kind, reason, details);
        warnings.add(i);
        LOG.warn("Scan warning - {}: {}", reason, w.asset());
        return i;
    }

    public void success(SuccessfulScan s) {
        successes.add(Objects.requireNonNull(s, "s"));
        if (s.findings() > 0) {
            LOG.info("Successfully scanned {} - Found {} vulnerabilities", s.asset(), s.findings());
        } else {
            LOG.info("Successfully scanned {} - No vulnerabilities found", s.asset());
        }
    }

    private ScanIssue issue(ScanIssue.Kind kind, Where w, FailureKind fk, String reason, String details) {
        return new ScanIssue(clock.instant(), kind, w.repository(), w.component(), w.asset(),
                w.artifactType(), fk, reason, details);
    }

    public List<ScanIssue> errors() { return Collections.unmodifiableList(errors); }
    public List<ScanIssue> skipped() { return Collections.unmodifiableList(skipped); }
    public List<ScanIssue> warnings() { return Collections.unmodifiableList(warnings); }
    public List<SuccessfulScan> successes() { return Collections.unmodifiableList(successes); }

    public long cleanScans() {
        return successes.stream().filter(SuccessfulScan::clean).count();
    }

    /** 사유별 건수 (처음 나온 순서) */
    public static Map<String, Long> groupByReason(List<ScanIssue> issues) {
        Map<String, Long> out = new LinkedHashMap<>();
        for (ScanIssue i : issues) out.merge(i.reason(), 1L, Long::sum);
        return out;
    }

    /** 아티팩트 타입별 성공 요약 (타입 태그 정렬) */
    public Map<String, TypeSummary> successesByType() {
        Map<String, long[]> acc = new TreeMap<>();
        for (SuccessfulScan s : successes) {
            long[] a = acc.computeIfAbsent(s.artifactType().tag(), k -> new long[3]);
            a[0]++;
            a[1] += s.findings();
            if (s.clean()) a[2]++;
        }
        Map<String, TypeSummary> out = new LinkedHashMap<>();
        acc.forEach((k, a) -> out.put(k, new TypeSummary(a[0], a[1], a[2])));
        return out;
    }
}
