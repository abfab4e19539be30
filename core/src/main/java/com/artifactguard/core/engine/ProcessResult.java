package com.artifactguard.core.engine;

/**
 * 서브프로세스 1회 실행 결과. timedOut이면 exitCode는 의미 없음(-1).
 */
public record ProcessResult(int exitCode, String stdout, String stderr, boolean timedOut) {

    public ProcessResult {
        stdout = (stdout == null ? "" : stdout);
        stderr = (stderr == null ? "" : stderr);
    }

    public static ProcessResult timeout(String stdout, String stderr) {
        return new ProcessResult(-1, stdout, stderr, true);
    }

    public boolean succeeded() {
        return !timedOut && exitCode == 0;
    }
}
