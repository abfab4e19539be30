package com.artifactguard.core.service.export;

import com.artifactguard.core.model.Finding;
import com.artifactguard.core.service.ScanReport;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * nexus_scan_results_&lt;ts&gt;.json
 *  - scan_timestamp / engine / nexus_url
 *  - statistics: 누적 통계 스냅샷
 *  - findings: 취약점 1건당 1객체 (발견 맥락 포함)
 */
public final class JsonReportExporter implements ReportExporter {
    private static final Logger LOG = LoggerFactory.getLogger(JsonReportExporter.class);

    private final ObjectMapper mapper = ReportRows.jsonMapper();

    @Override
    public Path export(ScanReport report) throws IOException {
        Path out = ReportNaming.jsonPath(report.context());
        Files.createDirectories(out.getParent());

        ObjectNode root = mapper.createObjectNode();
        root.put("scan_timestamp", report.startedAt().toString());
        root.put("scan_finished", report.finishedAt().toString());
        root.put("engine", report.engine());
        root.put("nexus_url", report.repositoryUrl());
        root.set("statistics", mapper.valueToTree(report.statistics()));

        ArrayNode arr = root.putArray("findings");
        for (Finding f : report.findings()) {
            Map<String, Object> row = ReportRows.finding(f, false);
            arr.add(mapper.valueToTree(row));
        }

        mapper.writeValue(out.toFile(), root);
        LOG.info("JSON results saved: {} ({} findings)", out.toAbsolutePath(), report.findings().size());
        return out;
    }
}
