package com.artifactguard.core.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * ProcessBuilder 기반 실행기. stdout/stderr는 임시 파일로 리다이렉트해서
 * 파이프 버퍼가 차서 멈추는 일이 없게 한다.
 */
public final class DefaultProcessRunner implements ProcessRunner {
    private static final Logger LOG = LoggerFactory.getLogger(DefaultProcessRunner.class);

    /** 로그/진단용으로 잘라 보관하는 최대 문자 수 */
    static final int MAX_CAPTURE_CHARS = 64 * 1024;

    @Override
    public ProcessResult run(List<String> command, Duration timeout) throws IOException, InterruptedException {
        Path out = Files.createTempFile("ag-proc-", ".out");
        Path err = Files.createTempFile("ag-proc-", ".err");
        try {
            ProcessBuilder pb = new ProcessBuilder(command);
            pb.redirectOutput(out.toFile());
            pb.redirectError(err.toFile());
            Process p = pb.start();

            boolean finished;
            try {
                finished = p.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                // 호출 스레드가 중단되면 엔진 프로세스도 남기지 않는다
                LOG.warn("Interrupted while waiting, killing: {}", command.get(0));
                p.destroyForcibly();
                throw e;
            }
            if (!finished) {
                LOG.warn("Process exceeded {}s, killing: {}", timeout.toSeconds(), command.get(0));
                p.destroyForcibly();
                p.waitFor(5, TimeUnit.SECONDS);
                return ProcessResult.timeout(read(out), read(err));
            }
            return new ProcessResult(p.exitValue(), read(out), read(err), false);
        } finally {
            deleteQuietly(out);
            deleteQuietly(err);
        }
    }

    private static String read(Path p) throws IOException {
        String s = new String(Files.readAllBytes(p), StandardCharsets.UTF_8);
        return s.length() > MAX_CAPTURE_CHARS ? s.substring(0, MAX_CAPTURE_CHARS) : s;
    }

    private static void deleteQuietly(Path p) {
        try {
            Files.deleteIfExists(p);
        } catch (IOException e) {
            LOG.debug("Could not delete capture file {}: {}", p, e.getMessage());
        }
    }
}
