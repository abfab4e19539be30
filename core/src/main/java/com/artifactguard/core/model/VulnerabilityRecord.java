package com.artifactguard.core.model;

import java.util.List;
import java.util.Objects;

/**
 * 정규화된 취약점 1건 (패키지 1개 x 알려진 이슈 1개).
 * ResultNormalizer만 생성. target은 비어있지 않고 나머지 텍스트 필드는 null 대신 "".
 */
public final class VulnerabilityRecord {
    private final String target;
    private final String vulnerabilityId;
    private final String packageName;
    private final String installedVersion;
    private final Severity severity;
    private final String title;
    private final String description;
    private final String fixedVersion;
    private final List<String> references;

    private VulnerabilityRecord(Builder b) {
        this.target = b.target;
        this.vulnerabilityId = nz(b.vulnerabilityId);
        this.packageName = nz(b.packageName);
        this.installedVersion = nz(b.installedVersion);
        this.severity = (b.severity == null ? Severity.UNKNOWN : b.severity);
        this.title = nz(b.title);
        this.description = nz(b.description);
        this.fixedVersion = nz(b.fixedVersion);
        this.references = (b.references == null ? List.of() : List.copyOf(b.references));
    }

    public String getTarget() { return target; }
    public String getVulnerabilityId() { return vulnerabilityId; }
    public String getPackageName() { return packageName; }
    public String getInstalledVersion() { return installedVersion; }
    public Severity getSeverity() { return severity; }
    public String getTitle() { return title; }
    public String getDescription() { return description; }
    public String getFixedVersion() { return fixedVersion; }
    public List<String> getReferences() { return references; }

    public static Builder builder() { return new Builder(); }

    private static String nz(String s) { return s == null ? "" : s; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof VulnerabilityRecord r)) return false;
        return target.equals(r.target)
                && vulnerabilityId.equals(r.vulnerabilityId)
                && packageName.equals(r.packageName)
                && installedVersion.equals(r.installedVersion)
                && severity == r.severity
                && title.equals(r.title)
                && description.equals(r.description)
                && fixedVersion.equals(r.fixedVersion)
                && references.equals(r.references);
    }

    @Override
    public int hashCode() {
        return Objects.hash(target, vulnerabilityId, packageName, installedVersion, severity);
    }

    @Override
    public String toString() {
        return vulnerabilityId + "@" + packageName + ":" + installedVersion + " [" + severity + "] in " + target;
    }

    public static final class Builder {
        private String target;
        private String vulnerabilityId;
        private String packageName;
        private String installedVersion;
        private Severity severity;
        private String title;
        private String description;
        private String fixedVersion;
        private List<String> references;

        public Builder target(String target) { this.target = target; return this; }
        public Builder vulnerabilityId(String id) { this.vulnerabilityId = id; return this; }
        public Builder packageName(String packageName) { this.packageName = packageName; return this; }
        public Builder installedVersion(String v) { this.installedVersion = v; return this; }
        public Builder severity(Severity severity) { this.severity = severity; return this; }
        public Builder title(String title) { this.title = title; return this; }
        public Builder description(String description) { this.description = description; return this; }
        public Builder fixedVersion(String v) { this.fixedVersion = v; return this; }
        public Builder references(List<String> references) { this.references = references; return this; }

        public VulnerabilityRecord build() {
            Objects.requireNonNull(target, "target");
            if (target.isBlank()) throw new IllegalArgumentException("target must not be blank");
            return new VulnerabilityRecord(this);
        }
    }
}
