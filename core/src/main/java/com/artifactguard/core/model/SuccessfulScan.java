package com.artifactguard.core.model;

import java.time.Instant;
import java.util.Objects;

/** 스캔 성공 1건. findings == 0 이면 "clean" 스캔. */
public record SuccessfulScan(
        Instant timestamp,
        String repository,
        String component,
        String asset,
        ArtifactType artifactType,
        String strategyReason,
        int findings,
        EngineMode engineMode,
        long fileSize,
        long durationMs,
        String engineCommand
) {
    public SuccessfulScan {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(artifactType, "artifactType");
        Objects.requireNonNull(engineMode, "engineMode");
        if (findings < 0) throw new IllegalArgumentException("findings must be >= 0");
        repository = repository == null ? "" : repository;
        component = component == null ? "" : component;
        asset = asset == null ? "" : asset;
        strategyReason = strategyReason == null ? "" : strategyReason;
        engineCommand = engineCommand == null ? "" : engineCommand;
    }

    public boolean clean() { return findings == 0; }
}
