package com.artifactguard.core.service;

/** 자산 처리 전에 세션을 시작할 수 없을 때 (저장소 서비스 연결 실패 등) */
public class ScanAbortedException extends RuntimeException {
    public ScanAbortedException(String message) {
        super(message);
    }
}
