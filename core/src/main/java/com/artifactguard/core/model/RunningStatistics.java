package com.artifactguard.core.model;

import java.util.*;

/**
 * 세션 누적 통계. 세션 객체가 소유하며 에셋 1건당 1회 갱신된다 (스레드 세이프 아님).
 * 성장만 하고 줄어들지 않음. 세션 간 공유 금지: 병렬화 시 워커별 인스턴스를 merge 할 것.
 */
public final class RunningStatistics {

    private final EnumMap<Severity, Long> bySeverity = new EnumMap<>(Severity.class);
    private final EnumMap<ArtifactType, Long> byArtifactType = new EnumMap<>(ArtifactType.class);
    private final Map<String, Set<String>> affectedComponents = new HashMap<>();
    private final Map<String, RepoTotals> byRepository = new HashMap<>();
    private final Set<String> repositoryFormats = new HashSet<>();

    private long repositoriesScanned;
    private long componentsFound;
    private long assetsScanned;
    private long vulnerabilitiesFound;
    private long scanErrors;
    private long assetsSkipped;

    private static final class RepoTotals {
        long findings;
        final EnumMap<Severity, Long> bySeverity = new EnumMap<>(Severity.class);
    }

    // ---- 세션 레벨 ----
    public void recordRepository(String format) {
        repositoriesScanned++;
        repositoryFormats.add(RepositoryFormats.lower(format));
    }

    public void addComponents(long count) {
        if (count < 0) throw new IllegalArgumentException("count must be >= 0");
        componentsFound += count;
    }

    // ---- 에셋 레벨 (에셋 1건당 정확히 하나 호출) ----

    /** 스캔 완료 에셋: 레코드마다 심각도 +1, 타입 +1, 취약점이 있으면 컴포넌트를 영향 집합에 추가 */
    public void recordScanned(String repository, String component, ArtifactType type,
                              List<VulnerabilityRecord> records) {
        Objects.requireNonNull(type, "type");
        List<VulnerabilityRecord> rs = (records == null ? List.of() : records);
        assetsScanned++;
        byArtifactType.merge(type, 1L, Long::sum);
        if (rs.isEmpty()) return;

        String repo = repository == null ? "" : repository;
        RepoTotals totals = byRepository.computeIfAbsent(repo, k -> new RepoTotals());
        for (VulnerabilityRecord r : rs) {
            bySeverity.merge(r.getSeverity(), 1L, Long::sum);
            totals.bySeverity.merge(r.getSeverity(), 1L, Long::sum);
        }
        totals.findings += rs.size();
        vulnerabilitiesFound += rs.size();
        affectedComponents.computeIfAbsent(repo, k -> new HashSet<>())
                .add(component == null ? "" : component);
    }

    public void recordSkipped(ArtifactType type) {
        byArtifactType.merge(Objects.requireNonNull(type, "type"), 1L, Long::sum);
        assetsSkipped++;
    }

    public void recordFailed(ArtifactType type) {
        byArtifactType.merge(Objects.requireNonNull(type, "type"), 1L, Long::sum);
        scanErrors++;
    }

    /** 다른 누적기 내용을 이쪽에 더한다. other는 변경하지 않음 */
    public RunningStatistics merge(RunningStatistics other) {
        Objects.requireNonNull(other, "other");
        other.bySeverity.forEach((k, v) -> bySeverity.merge(k, v, Long::sum));
        other.byArtifactType.forEach((k, v) -> byArtifactType.merge(k, v, Long::sum));
        other.affectedComponents.forEach((k, v) ->
                affectedComponents.computeIfAbsent(k, x -> new HashSet<>()).addAll(v));
        other.byRepository.forEach((k, v) -> {
            RepoTotals mine = byRepository.computeIfAbsent(k, x -> new RepoTotals());
            mine.findings += v.findings;
            v.bySeverity.forEach((s, n) -> mine.bySeverity.merge(s, n, Long::sum));
        });
        repositoryFormats.addAll(other.repositoryFormats);
        repositoriesScanned += other.repositoriesScanned;
        componentsFound += other.componentsFound;
        assetsScanned += other.assetsScanned;
        vulnerabilitiesFound += other.vulnerabilitiesFound;
        scanErrors += other.scanErrors;
        assetsSkipped += other.assetsSkipped;
        return this;
    }

    /** 현재 상태를 정렬된 불변 스냅샷으로 (집합 → 정렬·중복제거 리스트) */
    public Snapshot finish() {
        Map<String, List<String>> affected = new TreeMap<>();
        affectedComponents.forEach((repo, set) -> affected.put(repo, List.copyOf(new TreeSet<>(set))));

        Map<String, RepositorySummary> repos = new TreeMap<>();
        byRepository.forEach((repo, t) -> repos.put(repo,
                new RepositorySummary(t.findings, ordered(t.bySeverity))));

        Map<String, Long> types = new LinkedHashMap<>();
        byArtifactType.forEach((t, n) -> types.put(t.tag(), n));

        return new Snapshot(
                repositoriesScanned, componentsFound, assetsScanned, vulnerabilitiesFound,
                scanErrors, assetsSkipped,
                ordered(bySeverity),
                Collections.unmodifiableMap(types),
                Collections.unmodifiableMap(affected),
                Collections.unmodifiableMap(repos),
                List.copyOf(new TreeSet<>(repositoryFormats)));
    }

    // EnumMap 순회 = 선언 순서(CRITICAL → UNKNOWN)
    private static Map<Severity, Long> ordered(EnumMap<Severity, Long> m) {
        return Collections.unmodifiableMap(new LinkedHashMap<>(m));
    }

    public long getVulnerabilitiesFound() { return vulnerabilitiesFound; }
    public long getScanErrors() { return scanErrors; }
    public long getAssetsSkipped() { return assetsSkipped; }
    public long getAssetsScanned() { return assetsScanned; }

    public record RepositorySummary(long totalFindings, Map<Severity, Long> bySeverity) {}

    /** 불변 스냅샷 DTO */
    public record Snapshot(
            long repositoriesScanned,
            long componentsFound,
            long assetsScanned,
            long vulnerabilitiesFound,
            long scanErrors,
            long assetsSkipped,
            Map<Severity, Long> bySeverity,
            Map<String, Long> byArtifactType,
            Map<String, List<String>> affectedComponents,
            Map<String, RepositorySummary> byRepository,
            List<String> repositoryFormats
    ) {}
}
