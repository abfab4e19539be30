package com.artifactguard.core.manifest;

import com.artifactguard.core.model.FailureKind;

import java.nio.file.Path;
import java.util.Objects;

/**
 * package.json 1개에 대한 합성 결과.
 *
 * @param dependencies 실제로 만든 의존성 디렉터리 수 (SYNTHESIZED일 때만 의미)
 */
public record ManifestOutcome(Path manifest, Status status, int dependencies, String message) {

    public enum Status {
        /** lock 파일과 node_modules 골격을 만듦 */
        SYNTHESIZED,
        /** 이미 lock 파일이 있음 → 손대지 않음 */
        LOCK_PRESENT,
        /** 파싱/쓰기 실패 → 이 매니페스트만 건너뜀 */
        FAILED
    }

    public ManifestOutcome {
        Objects.requireNonNull(manifest, "manifest");
        Objects.requireNonNull(status, "status");
        message = (message == null ? "" : message);
    }

    /** FAILED일 때만 MANIFEST_SYNTHESIS_ERROR */
    public FailureKind failureKind() {
        return status == Status.FAILED ? FailureKind.MANIFEST_SYNTHESIS_ERROR : null;
    }
}
