package com.artifactguard.core.classify;

import com.artifactguard.core.model.ArtifactType;

import java.util.Objects;

/**
 * 순서 있는 분류 규칙 1개. 입력은 이미 소문자화된 (에셋 이름, 저장소 포맷).
 *
 * @param id     로그/테스트용 식별자
 * @param match  술어
 * @param result 매치 시 결과 타입
 */
public record ClassificationRule(String id, Matcher match, ArtifactType result) {

    @FunctionalInterface
    public interface Matcher {
        boolean test(String lowerName, String lowerFormat);
    }

    public ClassificationRule {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(match, "match");
        Objects.requireNonNull(result, "result");
    }

    public boolean matches(String lowerName, String lowerFormat) {
        return match.test(lowerName, lowerFormat);
    }
}
