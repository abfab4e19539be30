package com.artifactguard.core.model;

import java.util.Locale;
import java.util.Objects;

/**
 * 저장소 메타데이터 (외부 저장소 서비스가 돌려준 값, 읽기 전용).
 *
 * @param name   저장소 이름
 * @param format 포맷 태그 (maven2, npm, pypi, nuget, raw, docker ...)
 * @param kind   hosted | proxy | group
 */
public record RepositoryDescriptor(String name, String format, String kind) {

    public RepositoryDescriptor {
        Objects.requireNonNull(name, "name");
        format = (format == null ? "unknown" : format);
        kind = (kind == null ? "unknown" : kind);
    }

    /** docker/container 포맷 여부 */
    public boolean isContainer() {
        return RepositoryFormats.isContainer(format);
    }

    public String formatLower() {
        return format.toLowerCase(Locale.ROOT);
    }
}
