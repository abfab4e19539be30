package com.artifactguard.core.model;

/**
 * 파이프라인이 에셋마다 붙이는 아티팩트 분류 태그.
 * tag()는 보고서/로그에 찍히는 소문자 표기.
 */
public enum ArtifactType {
    JAVA_JAR,
    JAVA_SOURCE,
    MAVEN_POM,
    PYTHON_PACKAGE,
    NODE_PACKAGE,
    NUGET_PACKAGE,
    CONTAINER_IMAGE,
    DOCKER_MANIFEST,
    ARCHIVE,
    SOURCE_CODE,
    BINARY_EXECUTABLE,
    SCRIPT,
    CONFIGURATION,
    SBOM,
    SECURITY_REPORT,
    MAVEN_ARTIFACT,
    RAW_FILE,
    UNKNOWN;

    public String tag() {
        return name().toLowerCase(java.util.Locale.ROOT);
    }

    @Override
    public String toString() {
        return tag();
    }
}
