package com.artifactguard.core.api;

import com.artifactguard.core.model.Component;
import com.artifactguard.core.model.RepositoryDescriptor;

import java.util.List;

/** 저장소 서비스 최소 계약: 연결 확인 + 저장소/컴포넌트 목록. 실패는 false/빈 목록. */
public interface IAssetSource {
    boolean testConnection();
    List<RepositoryDescriptor> listRepositories();
    List<Component> listComponents(RepositoryDescriptor repository);
}
