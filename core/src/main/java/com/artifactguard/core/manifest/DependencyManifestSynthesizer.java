package com.artifactguard.core.manifest;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.core.util.Separators;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.artifactguard.core.util.StructuredLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.*;

/**
 * 풀어둔 node 패키지 트리에서 lock 파일이 없는 package.json마다
 * 합성 package-lock.json + node_modules/&lt;dep&gt;/package.json 골격을 만든다.
 * 엔진이 오프라인으로 설치 패키지를 열거할 수 있게 하기 위함.
 *
 * 재실행 시 lock 파일이 이미 있으므로 아무것도 바꾸지 않는다.
 */
public final class DependencyManifestSynthesizer {
    private static final Logger LOG = LoggerFactory.getLogger(DependencyManifestSynthesizer.class);
    private static final StructuredLog SLOG = StructuredLog.get(DependencyManifestSynthesizer.class);

    public static final String MANIFEST = "package.json";
    public static final String LOCK_FILE = "package-lock.json";
    public static final List<String> LOCK_FILES = List.of(LOCK_FILE, "yarn.lock", "pnpm-lock.yaml");
    static final Set<String> EXCLUDED_DIRS =
            Set.of("node_modules", ".git", "test", "tests", "__tests__", "coverage", "dist", "build");

    static final String REGISTRY = "https://registry.npmjs.org/";
    static final String PLACEHOLDER_INTEGRITY = "sha512-" + "0".repeat(64);

    private final ObjectMapper mapper;
    private final ObjectWriter writer;
    private final int maxManifests;
    private final int maxDependencies;

    public DependencyManifestSynthesizer(int maxManifests, int maxDependencies) {
        this(new ObjectMapper(), maxManifests, maxDependencies);
    }

    public DependencyManifestSynthesizer(ObjectMapper mapper, int maxManifests, int maxDependencies) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        if (maxManifests < 1) throw new IllegalArgumentException("maxManifests must be >= 1");
        if (maxDependencies < 0) throw new IllegalArgumentException("maxDependencies must be >= 0");
        this.maxManifests = maxManifests;
        this.maxDependencies = maxDependencies;
        // 2칸 들여쓰기, "\n" 고정, "key": value 형태 → 실행 환경과 무관하게 같은 바이트
        DefaultIndenter indenter = new DefaultIndenter("  ", "\n");
        DefaultPrettyPrinter printer = new DefaultPrettyPrinter()
                .withSeparators(Separators.createDefaultInstance()
                        .withObjectFieldValueSpacing(Separators.Spacing.AFTER));
        printer.indentObjectsWith(indenter);
        printer.indentArraysWith(indenter);
        this.writer = mapper.writer(printer);
    }

    /**
     * @param root 압축 해제 디렉터리
     * @return 매니페스트별 결과 (찾은 순서, 경로 정렬)
     */
    public List<ManifestOutcome> synthesize(Path root) {
        Objects.requireNonNull(root, "root");
        List<Path> manifests;
        try {
            manifests = findManifests(root);
        } catch (IOException e) {
            LOG.warn("Cannot walk extracted tree {}: {}", root, e.getMessage());
            return List.of(new ManifestOutcome(root, ManifestOutcome.Status.FAILED, 0,
                    "cannot walk tree: " + e.getMessage()));
        }
        if (manifests.isEmpty()) {
            LOG.debug("No {} found under {}", MANIFEST, root);
            return List.of();
        }

        List<ManifestOutcome> out = new ArrayList<>(manifests.size());
        for (Path m : manifests) {
            ManifestOutcome o = synthesizeOne(m);
            SLOG.debug("manifest_synthesis", "manifest", root.relativize(m), "status", o.status(),
                    "dependencies", o.dependencies());
            out.add(o);
        }
        return out;
    }

    /** 제외 디렉터리를 건너뛰며 package.json 수집, maxManifests에서 멈춤 */
    List<Path> findManifests(Path root) throws IOException {
        List<Path> found = new ArrayList<>();
        Files.walkFileTree(root, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                if (!dir.equals(root) && EXCLUDED_DIRS.contains(dir.getFileName().toString())) {
                    return FileVisitResult.SKIP_SUBTREE;
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                if (attrs.isRegularFile() && file.getFileName().toString().equals(MANIFEST)) {
                    found.add(file);
                }
                return FileVisitResult.CONTINUE;
            }
        });
        Collections.sort(found);
        if (found.size() > maxManifests) {
            LOG.info("Found {} manifests under {}, processing first {}", found.size(), root, maxManifests);
            return List.copyOf(found.subList(0, maxManifests));
        }
        return found;
    }

    ManifestOutcome synthesizeOne(Path manifest) {
        Path dir = manifest.getParent();
        for (String lock : LOCK_FILES) {
            if (Files.exists(dir.resolve(lock))) {
                LOG.debug("Lock file {} already present next to {}", lock, manifest);
                return new ManifestOutcome(manifest, ManifestOutcome.Status.LOCK_PRESENT, 0, lock);
            }
        }

        // ---- 1) 선언 읽기 ----
        Declared declared;
        try {
            declared = read(manifest);
        } catch (IOException | IllegalArgumentException e) {
            LOG.warn("Skipping malformed manifest {}: {}", manifest, e.getMessage());
            return new ManifestOutcome(manifest, ManifestOutcome.Status.FAILED, 0, e.getMessage());
        }

        // ---- 2) node_modules 골격, lock은 마지막 ----
        // lock 파일이 있으면 재실행 때 건너뛰므로 골격이 다 만들어진 뒤에만 쓴다
        try {
            int created = 0;
            for (Map.Entry<String, String> dep : declared.dependencies().entrySet()) {
                if (materialize(dir, dep.getKey(), dep.getValue())) created++;
            }
            Files.writeString(dir.resolve(LOCK_FILE), writer.writeValueAsString(lockTree(declared)),
                    StandardCharsets.UTF_8);
            LOG.info("Synthesized {} for {}@{} with {} dependencies",
                    LOCK_FILE, declared.name(), declared.version(), created);
            return new ManifestOutcome(manifest, ManifestOutcome.Status.SYNTHESIZED, created, "");
        } catch (IOException e) {
            LOG.warn("Cannot write synthetic lock for {}: {}", manifest, e.getMessage());
            return new ManifestOutcome(manifest, ManifestOutcome.Status.FAILED, 0, e.getMessage());
        }
    }

    private record Declared(String name, String version, LinkedHashMap<String, String> ranges,
                            LinkedHashMap<String, String> dependencies) {}

    private Declared read(Path manifest) throws IOException {
        JsonNode root;
        try {
            root = mapper.readTree(manifest.toFile());
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("invalid JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException(MANIFEST + " is not a JSON object");
        }
        String name = text(root.get("name"), "unknown");
        String version = text(root.get("version"), VersionRanges.FALLBACK_VERSION);

        LinkedHashMap<String, String> ranges = new LinkedHashMap<>();
        LinkedHashMap<String, String> resolved = new LinkedHashMap<>();
        JsonNode deps = root.get("dependencies");
        if (deps != null && !deps.isNull()) {
            if (!deps.isObject()) throw new IllegalArgumentException("dependencies is not an object");
            Iterator<Map.Entry<String, JsonNode>> it = deps.fields();
            while (it.hasNext() && ranges.size() < maxDependencies) {
                Map.Entry<String, JsonNode> e = it.next();
                String range = e.getValue().isValueNode() ? e.getValue().asText() : "";
                ranges.put(e.getKey(), range);
                resolved.put(e.getKey(), VersionRanges.normalize(range));
            }
            if (deps.size() > maxDependencies) {
                LOG.info("Manifest {} declares {} dependencies, keeping first {}", manifest, deps.size(), maxDependencies);
            }
        }
        return new Declared(name, version, ranges, resolved);
    }

    private ObjectNode lockTree(Declared d) {
        ObjectNode lock = mapper.createObjectNode();
        lock.put("name", d.name());
        lock.put("version", d.version());
        lock.put("lockfileVersion", 3);
        lock.put("requires", true);

        ObjectNode packages = lock.putObject("packages");
        ObjectNode rootPkg = packages.putObject("");
        rootPkg.put("name", d.name());
        rootPkg.put("version", d.version());
        rootPkg.put("license", "MIT");
        if (!d.ranges().isEmpty()) {
            ObjectNode declared = rootPkg.putObject("dependencies");
            d.ranges().forEach(declared::put);
        }

        ObjectNode dependencies = lock.putObject("dependencies");
        d.dependencies().forEach((dep, version) -> {
            ObjectNode p = packages.putObject("node_modules/" + dep);
            p.put("version", version);
            p.put("resolved", resolvedUrl(dep, version));
            p.put("integrity", PLACEHOLDER_INTEGRITY);
            p.put("license", "MIT");

            ObjectNode e = dependencies.putObject(dep);
            e.put("version", version);
            e.put("resolved", resolvedUrl(dep, version));
            e.put("integrity", PLACEHOLDER_INTEGRITY);
        });
        return lock;
    }

    /** @scope/pkg → .../@scope/pkg/-/pkg-1.0.0.tgz */
    static String resolvedUrl(String dep, String version) {
        String base = dep.substring(dep.lastIndexOf('/') + 1);
        return REGISTRY + dep + "/-/" + base + "-" + version + ".tgz";
    }

    /** node_modules/&lt;dep&gt;/package.json. 트리 밖으로 나가는 이름은 무시 */
    private boolean materialize(Path dir, String dep, String version) throws IOException {
        Path modules = dir.resolve("node_modules").toAbsolutePath().normalize();
        Path depDir = modules.resolve(dep).normalize();
        if (dep.isBlank() || !depDir.startsWith(modules) || depDir.equals(modules)) {
            LOG.warn("Ignoring dependency with unsafe name '{}'", dep);
            return false;
        }
        Files.createDirectories(depDir);
        ObjectNode pkg = mapper.createObjectNode();
        pkg.put("name", dep);
        pkg.put("version", version);
        Files.writeString(depDir.resolve(MANIFEST), writer.writeValueAsString(pkg), StandardCharsets.UTF_8);
        return true;
    }

    private static String text(JsonNode n, String fallback) {
        if (n == null || n.isNull() || !n.isValueNode()) return fallback;
        String s = n.asText();
        return s.isEmpty() ? fallback : s;
    }
}
