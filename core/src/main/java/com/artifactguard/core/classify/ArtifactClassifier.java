package com.artifactguard.core.classify;

import com.artifactguard.core.model.ArtifactType;
import com.artifactguard.core.model.Asset;
import com.artifactguard.core.model.RepositoryDescriptor;
import com.artifactguard.core.model.RepositoryFormats;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

import static com.artifactguard.core.model.ArtifactType.*;

/**
 * (에셋 이름, 저장소 포맷) → ArtifactType. 순수/전역 함수: 항상 값을 반환하고 실패 시 UNKNOWN.
 * 규칙은 위에서부터 평가하고 첫 매치가 이긴다. 순서를 바꾸면 {@link #RULESET_VERSION}을 올릴 것.
 */
public final class ArtifactClassifier {

    public static final int RULESET_VERSION = 1;

    static final List<String> CHECKSUM_EXTENSIONS = List.of(".md5", ".sha1", ".sha256", ".sha512");

    private static final List<ClassificationRule> RULES = List.of(
            // ---- 1~2) 포맷 우선 ----
            new ClassificationRule("container-format",
                    (n, f) -> RepositoryFormats.isContainer(f), CONTAINER_IMAGE),
            new ClassificationRule("node-format",
                    (n, f) -> RepositoryFormats.isNode(f), NODE_PACKAGE),
            // ---- 3) 체크섬 (스크립트로 취급, 계획 단계에서 skip) ----
            new ClassificationRule("checksum",
                    (n, f) -> endsWithAny(n, CHECKSUM_EXTENSIONS), SCRIPT),
            // ---- 4) 자바 ----
            new ClassificationRule("java-archive",
                    (n, f) -> endsWithAny(n, ".jar", ".war", ".ear"), JAVA_JAR),
            new ClassificationRule("java-source",
                    (n, f) -> endsWithAny(n, ".java", ".class"), JAVA_SOURCE),
            new ClassificationRule("maven-pom",
                    (n, f) -> n.contains("pom.xml") || n.endsWith(".pom"), MAVEN_POM),
            // ---- 5~7) 패키지 매니저 ----
            new ClassificationRule("python-package",
                    (n, f) -> endsWithAny(n, ".whl", ".egg") || (n.endsWith(".tar.gz") && n.contains("python")),
                    PYTHON_PACKAGE),
            new ClassificationRule("nuget-package",
                    (n, f) -> endsWithAny(n, ".nupkg", ".nuspec"), NUGET_PACKAGE),
            new ClassificationRule("node-package",
                    (n, f) -> n.contains("package.json") || n.endsWith(".npm")
                            || (endsWithAny(n, ".tgz", ".tar.gz") && containsAny(n, "node", "client", "npm")),
                    NODE_PACKAGE),
            // ---- 8) 컨테이너 메타 (컨테이너 저장소는 1번에서 이미 끝남) ----
            new ClassificationRule("docker-manifest",
                    (n, f) -> containsAny(n, "manifest.json", "config.json"), DOCKER_MANIFEST),
            // ---- 9~14) 일반 확장자 ----
            new ClassificationRule("archive",
                    (n, f) -> endsWithAny(n, ".zip", ".7z", ".rar", ".tar", ".tar.gz", ".tgz"), ARCHIVE),
            new ClassificationRule("binary-executable",
                    (n, f) -> endsWithAny(n, ".exe", ".dll", ".so", ".dylib"), BINARY_EXECUTABLE),
            new ClassificationRule("script",
                    (n, f) -> endsWithAny(n, ".sh", ".bat", ".ps1", ".py", ".js"), SCRIPT),
            new ClassificationRule("configuration",
                    (n, f) -> endsWithAny(n, ".xml", ".json", ".yaml", ".yml", ".properties", ".conf"), CONFIGURATION),
            new ClassificationRule("sbom",
                    (n, f) -> n.contains(".spdx") || (n.endsWith(".json") && n.contains("sbom")), SBOM),
            new ClassificationRule("security-report",
                    (n, f) -> containsAny(n, "trivy-report", "scan-report", ".sarif"), SECURITY_REPORT),
            // ---- 15) 포맷 fallback ----
            new ClassificationRule("maven2-format",
                    (n, f) -> f.equals(RepositoryFormats.MAVEN2), MAVEN_ARTIFACT),
            new ClassificationRule("nuget-format",
                    (n, f) -> f.equals(RepositoryFormats.NUGET), NUGET_PACKAGE),
            new ClassificationRule("raw-format",
                    (n, f) -> f.equals(RepositoryFormats.RAW), RAW_FILE)
    );

    /** 평가 순서 그대로 */
    public List<ClassificationRule> rules() {
        return RULES;
    }

    public ArtifactType classify(Asset asset, RepositoryDescriptor repository) {
        return classify(asset.name(), repository.format());
    }

    public ArtifactType classify(String assetName, String repositoryFormat) {
        return matchingRule(assetName, repositoryFormat)
                .map(ClassificationRule::result)
                .orElse(UNKNOWN);
    }

    /** 첫 매치 규칙 (없으면 empty → UNKNOWN) */
    public Optional<ClassificationRule> matchingRule(String assetName, String repositoryFormat) {
        String n = (assetName == null ? "" : assetName.toLowerCase(Locale.ROOT));
        String f = RepositoryFormats.lower(repositoryFormat);
        for (ClassificationRule r : RULES) {
            if (r.matches(n, f)) return Optional.of(r);
        }
        return Optional.empty();
    }

    public static boolean isChecksum(String assetName) {
        return assetName != null && endsWithAny(assetName.toLowerCase(Locale.ROOT), CHECKSUM_EXTENSIONS);
    }

    // ------------ helpers ------------
    private static boolean endsWithAny(String s, String... suffixes) {
        return endsWithAny(s, List.of(suffixes));
    }

    private static boolean endsWithAny(String s, List<String> suffixes) {
        for (String x : suffixes) if (s.endsWith(x)) return true;
        return false;
    }

    private static boolean containsAny(String s, String... parts) {
        for (String x : parts) if (s.contains(x)) return true;
        return false;
    }
}
