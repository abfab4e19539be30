package com.artifactguard.core.service.export;

import com.artifactguard.core.util.FileCleanup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * 에셋별 엔진 HTML 렌더링 보관소. retain=false면 버린다.
 * 파일명: &lt;component&gt;_&lt;asset&gt;_report.html
 */
public final class IndividualReportStore {
    private static final Logger LOG = LoggerFactory.getLogger(IndividualReportStore.class);

    private final Path dir;
    private final boolean retain;
    private int stored;

    public IndividualReportStore(Path dir, boolean retain) {
        this.dir = dir;
        this.retain = retain;
    }

    public Optional<Path> store(String component, String asset, String html) {
        if (html == null || html.isEmpty()) return Optional.empty();
        if (!retain) {
            LOG.debug("Discarding HTML rendering for {} (retention disabled)", asset);
            return Optional.empty();
        }
        Path file = dir.resolve(FileCleanup.safeFileName(component) + "_" + FileCleanup.safeFileName(asset) + "_report.html");
        try {
            Files.createDirectories(dir);
            Files.writeString(file, html, StandardCharsets.UTF_8);
            stored++;
            LOG.info("Individual HTML report retained: {}", file);
            return Optional.of(file);
        } catch (IOException e) {
            LOG.error("Error saving individual HTML report {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    public int storedCount() { return stored; }
}
