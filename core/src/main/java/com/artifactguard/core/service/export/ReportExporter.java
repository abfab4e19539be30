package com.artifactguard.core.service.export;

import com.artifactguard.core.service.ScanReport;

import java.io.IOException;
import java.nio.file.Path;

/** 세션 결과를 보고서 파일로 내보내는 책임 (확장: JSON/CSV/HTML/종합/이슈 보고서) */
public interface ReportExporter {
    /**
     * @param report 세션 결과 (출력 위치는 report.context() 기준)
     * @return 생성된 주 파일 경로, 쓸 내용이 없어 건너뛰었으면 null
     */
    Path export(ScanReport report) throws IOException;
}
