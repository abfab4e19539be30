package com.artifactguard.core.model;

import java.util.Objects;

/**
 * 에셋 1건에 대한 스캔 지시. 닫힌 변형 4종:
 * Skip | FilesystemScan | ImageScan | ConfigScan.
 * 스캔 가능한 세 변형만 {@link Scannable}을 구현하므로 Skip은 실행기로 넘어갈 수 없다.
 */
public sealed interface ScanStrategy
        permits ScanStrategy.Skip, ScanStrategy.Scannable {

    /** 로그/보고서용 사람이 읽는 사유 */
    String reason();

    default boolean skip() { return false; }

    default boolean extractBeforeScan() { return false; }

    /** 실행기가 받는 쪽 */
    sealed interface Scannable extends ScanStrategy
            permits FilesystemScan, ImageScan, ConfigScan {
        EngineMode mode();
    }

    record Skip(String reason) implements ScanStrategy {
        public Skip {
            reason = requireReason(reason);
        }
        @Override public boolean skip() { return true; }
    }

    /**
     * @param extractFirst   스캔 전에 압축 해제 필요
     * @param treatAsArchive 엔진이 파일 자체를 아카이브로 다룸 (해제 없이)
     */
    record FilesystemScan(boolean extractFirst, boolean treatAsArchive, String reason) implements Scannable {
        public FilesystemScan {
            if (extractFirst && treatAsArchive) {
                throw new IllegalArgumentException("extractFirst and treatAsArchive are mutually exclusive");
            }
            reason = requireReason(reason);
        }
        @Override public EngineMode mode() { return EngineMode.FILESYSTEM; }
        @Override public boolean extractBeforeScan() { return extractFirst; }
    }

    /** 레이어 처리는 엔진이 하므로 사전 해제 없음 */
    record ImageScan(String reason) implements Scannable {
        public ImageScan {
            reason = requireReason(reason);
        }
        @Override public EngineMode mode() { return EngineMode.IMAGE; }
    }

    record ConfigScan(String reason) implements Scannable {
        public ConfigScan {
            reason = requireReason(reason);
        }
        @Override public EngineMode mode() { return EngineMode.CONFIG; }
    }

    private static String requireReason(String reason) {
        Objects.requireNonNull(reason, "reason");
        if (reason.isBlank()) throw new IllegalArgumentException("reason must not be blank");
        return reason;
    }
}
