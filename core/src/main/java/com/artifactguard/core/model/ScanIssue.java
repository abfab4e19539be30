package com.artifactguard.core.model;

import java.time.Instant;
import java.util.Objects;

/** 건너뜀/에러/경고 1건. failureKind는 SKIP일 때 null. */
public record ScanIssue(
        Instant timestamp,
        Kind kind,
        String repository,
        String component,
        String asset,
        ArtifactType artifactType,
        FailureKind failureKind,
        String reason,
        String details
) {
    public enum Kind { ERROR, SKIP, WARNING }

    public ScanIssue {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(kind, "kind");
        if (artifactType == null) artifactType = ArtifactType.UNKNOWN;
        repository = repository == null ? "" : repository;
        component = component == null ? "" : component;
        asset = asset == null ? "" : asset;
        reason = reason == null ? "" : reason;
        details = details == null ? "" : details;
    }
}
