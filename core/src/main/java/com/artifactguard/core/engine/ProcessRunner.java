package com.artifactguard.core.engine;

import java.io.IOException;
import java.time.Duration;
import java.util.List;

/** 외부 명령 실행 seam (테스트에서 스크립트형 가짜로 교체) */
@FunctionalInterface
public interface ProcessRunner {

    /**
     * 명령을 실행하고 끝나거나 timeout이 지날 때까지 블록.
     * timeout 시 프로세스를 강제 종료하고 {@link ProcessResult#timedOut()} = true.
     *
     * @throws IOException 실행 파일을 시작하지 못함
     */
    ProcessResult run(List<String> command, Duration timeout) throws IOException, InterruptedException;
}
