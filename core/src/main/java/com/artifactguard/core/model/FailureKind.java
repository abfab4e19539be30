package com.artifactguard.core.model;

/** 에셋 파이프라인 실패 분류. 어떤 것도 세션을 중단시키지 않는다. */
public enum FailureKind {
    /** 분류 불가(unknown). 저하 모드로 스캔은 계속 */
    CLASSIFICATION_FALLBACK,
    /** 에셋 다운로드 실패 → 에셋 건너뜀, 에러로 집계 */
    DOWNLOAD_ERROR,
    /** 해제 불가/손상 아카이브 → 원본 그대로 스캔 */
    EXTRACTION_ERROR,
    /** package.json 파싱 실패 → 해당 매니페스트만 건너뜀 */
    MANIFEST_SYNTHESIS_ERROR,
    /** 엔진 비정상 종료/타임아웃 → 결과 없음, 에러로 집계 */
    SCAN_INVOCATION_ERROR,
    /** 엔진 구조화 출력 파싱 실패 → SCAN_INVOCATION_ERROR와 동일 취급 */
    PARSE_ERROR,
    /** 저장소/컴포넌트 목록 조회 실패 */
    REPOSITORY_ERROR
}
