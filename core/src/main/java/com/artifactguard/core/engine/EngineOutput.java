package com.artifactguard.core.engine;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Objects;
import java.util.Optional;

/**
 * 엔진 1회 스캔 결과: 구조화(JSON) 출력 + 선택적 사람용 렌더링(HTML).
 *
 * @param command    실행한 구조화 출력 명령 (보고서 기록용)
 * @param durationMs 두 호출 합계
 */
public record EngineOutput(JsonNode structured, String html, String command, long durationMs) {

    public EngineOutput {
        Objects.requireNonNull(structured, "structured");
        command = (command == null ? "" : command);
    }

    public Optional<String> rendering() {
        return Optional.ofNullable(html);
    }
}
