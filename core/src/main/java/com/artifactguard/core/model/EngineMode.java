package com.artifactguard.core.model;

/** 스캔 엔진 서브커맨드 */
public enum EngineMode {
    FILESYSTEM("fs"),
    IMAGE("image"),
    CONFIG("config");

    private final String command;

    EngineMode(String command) {
        this.command = command;
    }

    /** CLI 첫 인자로 들어가는 값 (fs | image | config) */
    public String command() {
        return command;
    }
}
