package com.artifactguard.core.model;

import java.util.Locale;

/**
 * 저장소 포맷 태그 별칭 정리.
 * 저장소 서비스는 docker/npm 으로, 내부 규칙은 container/node 로 부르므로 둘 다 받는다.
 */
public final class RepositoryFormats {
    private RepositoryFormats() {}

    public static final String MAVEN2 = "maven2";
    public static final String NUGET = "nuget";
    public static final String RAW = "raw";

    public static boolean isContainer(String format) {
        String f = lower(format);
        return f.equals("docker") || f.equals("container");
    }

    public static boolean isNode(String format) {
        String f = lower(format);
        return f.equals("npm") || f.equals("node");
    }

    public static String lower(String format) {
        return format == null ? "" : format.trim().toLowerCase(Locale.ROOT);
    }
}
