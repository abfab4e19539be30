package com.artifactguard.core.api;

import com.artifactguard.core.model.Asset;
import com.artifactguard.core.model.StepResult;

import java.nio.file.Path;

/** 에셋을 로컬 파일로 내려받는다. 실패는 DOWNLOAD_ERROR. */
@FunctionalInterface
public interface IAssetDownloader {
    StepResult<Path> download(Asset asset, Path target);
}
