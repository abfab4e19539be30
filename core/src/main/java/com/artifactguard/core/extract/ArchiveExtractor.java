package com.artifactguard.core.extract;

import com.artifactguard.core.model.FailureKind;
import com.artifactguard.core.model.StepResult;
import org.apache.commons.compress.archivers.ArchiveEntry;
import org.apache.commons.compress.archivers.ArchiveInputStream;
import org.apache.commons.compress.archivers.tar.TarArchiveInputStream;
import org.apache.commons.compress.archivers.zip.ZipArchiveInputStream;
import org.apache.commons.compress.compressors.gzip.GzipCompressorInputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Locale;
import java.util.Objects;

/**
 * 다운로드한 아카이브를 작업 디렉터리에 푼다.
 * 지원: zip 계열(.zip/.jar/.war), gzip-tar(.tar.gz/.tgz), tar.
 * 미지원/손상은 예외 대신 EXTRACTION_ERROR. 대상 디렉터리 삭제는 호출자(ScanExecutor) 몫.
 */
public final class ArchiveExtractor {
    private static final Logger LOG = LoggerFactory.getLogger(ArchiveExtractor.class);

    enum Kind { ZIP, TAR_GZ, TAR, UNSUPPORTED }

    static Kind kindOf(String fileName) {
        String n = fileName.toLowerCase(Locale.ROOT);
        if (n.endsWith(".zip") || n.endsWith(".jar") || n.endsWith(".war")) return Kind.ZIP;
        if (n.endsWith(".tar.gz") || n.endsWith(".tgz")) return Kind.TAR_GZ;
        if (n.endsWith(".tar")) return Kind.TAR;
        return Kind.UNSUPPORTED;
    }

    /**
     * @return 성공 시 destDir, 실패 시 EXTRACTION_ERROR (일부 파일이 남아있을 수 있음)
     */
    public StepResult<Path> extract(Path archive, Path destDir) {
        Objects.requireNonNull(archive, "archive");
        Objects.requireNonNull(destDir, "destDir");

        Kind kind = kindOf(archive.getFileName().toString());
        if (kind == Kind.UNSUPPORTED) {
            LOG.warn("Unsupported archive format: {}", archive);
            return StepResult.fail(FailureKind.EXTRACTION_ERROR, "unsupported archive format: " + archive.getFileName());
        }

        try {
            Files.createDirectories(destDir);
            int entries;
            try (InputStream raw = new BufferedInputStream(Files.newInputStream(archive));
                 ArchiveInputStream<? extends ArchiveEntry> in = open(kind, raw)) {
                entries = unpack(in, destDir.toAbsolutePath().normalize());
            }
            LOG.debug("Extracted {} entries from {} into {}", entries, archive.getFileName(), destDir);
            return StepResult.ok(destDir);
        } catch (IOException | IllegalArgumentException e) {
            LOG.error("Error extracting {}: {}", archive, e.getMessage());
            return StepResult.fail(FailureKind.EXTRACTION_ERROR, "cannot extract " + archive.getFileName() + ": " + e.getMessage());
        }
    }

    private static ArchiveInputStream<? extends ArchiveEntry> open(Kind kind, InputStream raw) throws IOException {
        return switch (kind) {
            case ZIP -> new ZipArchiveInputStream(raw);
            case TAR_GZ -> new TarArchiveInputStream(new GzipCompressorInputStream(raw));
            case TAR -> new TarArchiveInputStream(raw);
            case UNSUPPORTED -> throw new IllegalArgumentException("unsupported");
        };
    }

    private static int unpack(ArchiveInputStream<? extends ArchiveEntry> in, Path root) throws IOException {
        int count = 0;
        ArchiveEntry entry;
        while ((entry = in.getNextEntry()) != null) {
            if (!in.canReadEntryData(entry)) {
                LOG.debug("Skipping unreadable entry {}", entry.getName());
                continue;
            }
            Path out = root.resolve(entry.getName()).normalize();
            // zip-slip: 루트 밖으로 나가는 엔트리는 거부
            if (!out.startsWith(root)) {
                throw new IOException("entry escapes extraction directory: " + entry.getName());
            }
            if (entry.isDirectory()) {
                Files.createDirectories(out);
            } else {
                Files.createDirectories(out.getParent());
                Files.copy(in, out, StandardCopyOption.REPLACE_EXISTING);
                count++;
            }
        }
        return count;
    }
}
