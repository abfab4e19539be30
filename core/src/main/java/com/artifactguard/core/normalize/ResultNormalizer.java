package com.artifactguard.core.normalize;

import com.artifactguard.core.model.Severity;
import com.artifactguard.core.model.VulnerabilityRecord;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;

/**
 * 엔진 JSON 출력 → VulnerabilityRecord 목록. 순수 함수.
 * 기대 형태: {"Results":[{"Target":..., "Vulnerabilities":[{...}]}]}
 * 빠진 텍스트 필드는 "", 심각도는 UNKNOWN, 참조는 빈 목록, 빈 Target은 "Unknown".
 */
public final class ResultNormalizer {

    public static final String UNKNOWN_TARGET = "Unknown";

    public List<VulnerabilityRecord> normalize(JsonNode raw) {
        if (raw == null || raw.isNull() || raw.isMissingNode()) return List.of();
        JsonNode results = raw.get("Results");
        if (results == null || !results.isArray()) return List.of();

        List<VulnerabilityRecord> out = new ArrayList<>();
        for (JsonNode section : results) {
            String target = text(section.get("Target"));
            if (target.isBlank()) target = UNKNOWN_TARGET;

            JsonNode vulns = section.get("Vulnerabilities");
            if (vulns == null || !vulns.isArray()) continue; // 발견 0건 섹션

            for (JsonNode v : vulns) {
                out.add(VulnerabilityRecord.builder()
                        .target(target)
                        .vulnerabilityId(text(v.get("VulnerabilityID")))
                        .packageName(text(v.get("PkgName")))
                        .installedVersion(text(v.get("InstalledVersion")))
                        .severity(Severity.parse(text(v.get("Severity"))))
                        .title(text(v.get("Title")))
                        .description(text(v.get("Description")))
                        .fixedVersion(text(v.get("FixedVersion")))
                        .references(references(v.get("References")))
                        .build());
            }
        }
        return out;
    }

    private static String text(JsonNode n) {
        if (n == null || n.isNull() || !n.isValueNode()) return "";
        return n.asText();
    }

    private static List<String> references(JsonNode n) {
        if (n == null || !n.isArray()) return List.of();
        List<String> refs = new ArrayList<>(n.size());
        for (JsonNode r : n) {
            if (r != null && r.isValueNode() && !r.isNull()) refs.add(r.asText());
        }
        return refs;
    }
}
