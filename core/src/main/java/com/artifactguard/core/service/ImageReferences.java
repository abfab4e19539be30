package com.artifactguard.core.service;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 컨테이너 저장소 컴포넌트 → 시도할 이미지 참조 후보 (순서 중요, 중복 제거).
 * host/repo/name:ver → host/name:ver → name:ver
 */
public final class ImageReferences {
    private ImageReferences() {}

    public static List<String> candidates(String registryHost, String repository, String name, String version) {
        String ref = name + ":" + version;
        Set<String> out = new LinkedHashSet<>();
        if (registryHost != null && !registryHost.isBlank()) {
            if (repository != null && !repository.isBlank()) out.add(registryHost + "/" + repository + "/" + ref);
            out.add(registryHost + "/" + ref);
        }
        out.add(ref);
        return List.copyOf(out);
    }
}
