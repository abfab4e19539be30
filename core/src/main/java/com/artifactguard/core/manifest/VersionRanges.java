package com.artifactguard.core.manifest;

/**
 * 선언된 버전 범위 → 단일 버전 (근사치).
 * 앞쪽의 범위 연산자(^ ~ &gt; = &lt;)와 공백을 떼고 첫 토큰만 남긴다.
 * 복합 범위(">=1.0.0 <2.0.0")는 하한만 남으므로 정확한 해석이 아님.
 */
public final class VersionRanges {

    public static final String FALLBACK_VERSION = "0.0.0";

    private static final String OPERATORS = "^~>=<";

    private VersionRanges() {}

    public static String normalize(String range) {
        if (range == null) return FALLBACK_VERSION;
        int i = 0;
        while (i < range.length()) {
            char c = range.charAt(i);
            if (OPERATORS.indexOf(c) < 0 && !Character.isWhitespace(c)) break;
            i++;
        }
        String rest = range.substring(i);
        int end = 0;
        while (end < rest.length() && !Character.isWhitespace(rest.charAt(end))) end++;
        String token = rest.substring(0, end);
        return token.isEmpty() ? FALLBACK_VERSION : token;
    }
}
