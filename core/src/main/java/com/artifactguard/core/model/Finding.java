package com.artifactguard.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * 보고서로 넘어가는 취약점 1건 + 발견 맥락(저장소/컴포넌트/에셋).
 * imageReference는 컨테이너 스캔일 때만 채워짐 (그 외 "").
 */
public record Finding(
        VulnerabilityRecord record,
        String repository,
        String repositoryFormat,
        String component,
        String componentVersion,
        String asset,
        ArtifactType artifactType,
        String strategyReason,
        Instant scannedAt,
        String imageReference
) {
    public Finding {
        Objects.requireNonNull(record, "record");
        Objects.requireNonNull(artifactType, "artifactType");
        Objects.requireNonNull(scannedAt, "scannedAt");
        repository = nz(repository);
        repositoryFormat = nz(repositoryFormat);
        component = nz(component);
        componentVersion = nz(componentVersion);
        asset = nz(asset);
        strategyReason = nz(strategyReason);
        imageReference = nz(imageReference);
    }

    public Severity severity() { return record.getSeverity(); }

    private static String nz(String s) { return s == null ? "" : s; }
}
