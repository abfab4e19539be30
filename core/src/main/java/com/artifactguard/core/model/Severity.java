package com.artifactguard.core.model;

import java.util.Locale;

/** 취약점 심각도. 선언 순서 = 높은 위험부터 (CRITICAL > ... > UNKNOWN) */
public enum Severity {
    CRITICAL,
    HIGH,
    MEDIUM,
    LOW,
    UNKNOWN;

    /** 엔진 문자열을 관대하게 해석. 비어있거나 모르는 값이면 UNKNOWN */
    public static Severity parse(String raw) {
        if (raw == null || raw.isBlank()) return UNKNOWN;
        String s = raw.trim().toUpperCase(Locale.ROOT);
        for (Severity v : values()) {
            if (v.name().equals(s)) return v;
        }
        return UNKNOWN;
    }
}
