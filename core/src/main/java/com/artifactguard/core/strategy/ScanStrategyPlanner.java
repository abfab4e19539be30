package com.artifactguard.core.strategy;

import com.artifactguard.core.classify.ArtifactClassifier;
import com.artifactguard.core.model.ArtifactType;
import com.artifactguard.core.model.RepositoryFormats;
import com.artifactguard.core.model.ScanStrategy;
import com.artifactguard.core.model.ScanStrategy.ConfigScan;
import com.artifactguard.core.model.ScanStrategy.FilesystemScan;
import com.artifactguard.core.model.ScanStrategy.ImageScan;
import com.artifactguard.core.model.ScanStrategy.Skip;

import java.util.Locale;
import java.util.Objects;

/**
 * ArtifactType (+ 에셋 이름, 저장소 포맷) → ScanStrategy. 테이블 기반, 전역 함수.
 * 체크섬 파일은 타입/포맷과 무관하게 가장 먼저 skip.
 */
public final class ScanStrategyPlanner {

    public static final String REASON_JAVA = "Java archive - scan for dependencies and vulnerabilities";
    public static final String REASON_CONTAINER = "Container image - scan with Trivy image scanner";
    public static final String REASON_PYTHON = "Python package - scan for dependencies";
    public static final String REASON_NODE_TARBALL = "Node package tarball - extract to locate package.json";
    public static final String REASON_NODE = "Node package - scan for dependencies";
    public static final String REASON_NUGET = "NuGet package - scan for dependencies";
    public static final String REASON_ARCHIVE = "Archive/source code - extract and scan contents";
    public static final String REASON_CONFIG = "Configuration/SBOM file - scan for misconfigurations";
    public static final String REASON_CHECKSUM = "Hash/checksum file - not scannable";
    public static final String REASON_SECURITY_REPORT =
            "Existing security report - skip to avoid recursive scanning of scan output";

    public ScanStrategy plan(ArtifactType type, String assetName, String repositoryFormat) {
        Objects.requireNonNull(type, "type");
        String name = (assetName == null ? "" : assetName.toLowerCase(Locale.ROOT));

        if (ArtifactClassifier.isChecksum(name)) return new Skip(REASON_CHECKSUM);
        if (type == ArtifactType.CONTAINER_IMAGE || RepositoryFormats.isContainer(repositoryFormat)) {
            return new ImageScan(REASON_CONTAINER);
        }

        return switch (type) {
            case JAVA_JAR, MAVEN_ARTIFACT -> archive(REASON_JAVA);
            case PYTHON_PACKAGE -> archive(REASON_PYTHON);
            case NODE_PACKAGE -> (name.endsWith(".tgz") || name.endsWith(".tar.gz"))
                    ? extract(REASON_NODE_TARBALL)
                    : archive(REASON_NODE);
            case NUGET_PACKAGE -> archive(REASON_NUGET);
            case ARCHIVE, SOURCE_CODE -> extract(REASON_ARCHIVE);
            case CONFIGURATION, SBOM -> new ConfigScan(REASON_CONFIG);
            case SECURITY_REPORT -> new Skip(REASON_SECURITY_REPORT);
            default -> new FilesystemScan(false, false,
                    "Unrecognized artifact type '" + type.tag() + "' - best-effort filesystem scan");
        };
    }

    private static ScanStrategy archive(String reason) {
        return new FilesystemScan(false, true, reason);
    }

    private static ScanStrategy extract(String reason) {
        return new FilesystemScan(true, false, reason);
    }
}
