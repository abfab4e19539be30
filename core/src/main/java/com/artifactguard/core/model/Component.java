package com.artifactguard.core.model;

import java.util.List;
import java.util.Objects;

/** 이름+버전 단위 묶음 (에셋 1개 이상) */
public record Component(String name, String version, List<Asset> assets) {

    public Component {
        name = (name == null ? "unknown" : name);
        version = (version == null ? "unknown" : version);
        assets = (assets == null ? List.of() : List.copyOf(assets));
    }

    public String coordinate() {
        return name + ":" + version;
    }

    public static Component of(String name, String version, Asset... assets) {
        return new Component(name, version, List.of(Objects.requireNonNull(assets, "assets")));
    }
}
