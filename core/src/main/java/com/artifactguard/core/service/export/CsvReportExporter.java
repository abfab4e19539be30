package com.artifactguard.core.service.export;

import com.artifactguard.core.service.ScanReport;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/** nexus_scan_results_&lt;ts&gt;.csv, 취약점 1건당 1행. 취약점이 없으면 파일을 만들지 않음. */
public final class CsvReportExporter implements ReportExporter {
    private static final Logger LOG = LoggerFactory.getLogger(CsvReportExporter.class);

    private static final CsvMapper CSV = new CsvMapper();

    @Override
    public Path export(ScanReport report) throws IOException {
        if (report.findings().isEmpty()) {
            LOG.info("No findings, CSV results skipped");
            return null;
        }
        Path out = ReportNaming.csvPath(report.context());
        List<Map<String, Object>> rows = report.findings().stream()
                .map(f -> ReportRows.finding(f, true))
                .toList();
        write(out, ReportRows.FINDING_COLUMNS, rows);
        LOG.info("CSV results saved: {} ({} rows)", out.toAbsolutePath(), rows.size());
        return out;
    }

    /** 헤더 + 행. 열 순서는 columns 그대로. */
    static void write(Path out, List<String> columns, List<Map<String, Object>> rows) throws IOException {
        CsvSchema.Builder b = CsvSchema.builder();
        for (String c : columns) b.addColumn(c);
        CsvSchema schema = b.build().withHeader();

        Files.createDirectories(out.getParent());
        try (Writer w = Files.newBufferedWriter(out, StandardCharsets.UTF_8);
             SequenceWriter seq = CSV.writer(schema).writeValues(w)) {
            for (Map<String, Object> row : rows) seq.write(row);
        }
    }
}
