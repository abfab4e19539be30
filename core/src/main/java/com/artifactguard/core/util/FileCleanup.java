package com.artifactguard.core.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;

/** 임시 파일/디렉터리 정리 + 파일명 안전화 */
public final class FileCleanup {
    private static final Logger LOG = LoggerFactory.getLogger(FileCleanup.class);

    private FileCleanup() {}

    /**
     * 파일 또는 디렉터리를 재귀 삭제. 실패는 경고 로그만 남기고 false.
     * 없는 경로는 true.
     */
    public static boolean deleteRecursively(Path path) {
        if (path == null || !Files.exists(path)) return true;
        try {
            if (Files.isDirectory(path)) {
                Files.walkFileTree(path, new SimpleFileVisitor<>() {
                    @Override
                    public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                        Files.delete(file);
                        return FileVisitResult.CONTINUE;
                    }

                    @Override
                    public FileVisitResult postVisitDirectory(Path dir, IOException exc) throws IOException {
                        if (exc != null) throw exc;
                        Files.delete(dir);
                        return FileVisitResult.CONTINUE;
                    }
                });
            } else {
                Files.delete(path);
            }
            return true;
        } catch (IOException e) {
            LOG.warn("Could not clean up {}: {}", path, e.getMessage());
            return false;
        }
    }

    /** 경로 구분자/특수문자 → '_' (로컬 파일명용) */
    public static String safeFileName(String raw) {
        if (raw == null || raw.isBlank()) return "unnamed";
        String s = raw.replaceAll("[^A-Za-z0-9._-]", "_");
        if (s.startsWith(".")) s = "_" + s.substring(1);
        return s.length() > 150 ? s.substring(s.length() - 150) : s;
    }
}
