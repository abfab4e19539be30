package com.artifactguard.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * 다운로드 가능한 단일 파일. 소속 컴포넌트 안에서 name으로 식별.
 *
 * @param name         저장소 내 경로 (예: com/acme/lib/1.0/lib-1.0.jar)
 * @param downloadUrl  다운로드 핸들, 없으면 빈 문자열
 * @param lastModified nullable
 * @param fileSize     바이트, 모르면 -1
 */
public record Asset(String name, String downloadUrl, Instant lastModified, long fileSize) {

    public Asset {
        Objects.requireNonNull(name, "name");
        downloadUrl = (downloadUrl == null ? "" : downloadUrl);
    }

    public boolean hasDownloadUrl() {
        return !downloadUrl.isBlank();
    }
}
