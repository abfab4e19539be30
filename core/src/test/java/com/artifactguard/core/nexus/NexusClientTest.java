package com.artifactguard.core.nexus;

import com.artifactguard.core.model.Asset;
import com.artifactguard.core.model.Component;
import com.artifactguard.core.model.FailureKind;
import com.artifactguard.core.model.RepositoryDescriptor;
import com.artifactguard.core.model.ScanConfig;
import com.artifactguard.core.model.StepResult;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.http.HttpRequest;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;

class NexusClientTest {

    @TempDir
    Path tmp;

    private final List<HttpRequest> sent = new ArrayList<>();

    private ScanConfig cfg() {
        ScanConfig c = ScanConfig.defaults();
        c.nexus().setUrl("http://nexus:8081/");
        return c;
    }

    private NexusClient client(ScanConfig c, Function<HttpRequest, FakeResponse> routes) {
        return new NexusClient(c, new ObjectMapper(), req -> {
            sent.add(req);
            return routes.apply(req);
        });
    }

    @Test
    void connectionTestNeedsStatus200() {
        assertThat(client(cfg(), r -> new FakeResponse(r, 200, "")).testConnection()).isTrue();
        assertThat(sent.get(0).uri().toString()).isEqualTo("http://nexus:8081/service/rest/v1/status");
        assertThat(client(cfg(), r -> new FakeResponse(r, 503, "")).testConnection()).isFalse();

        NexusClient down = new NexusClient(cfg(), new ObjectMapper(), r -> { throw new IOException("refused"); });
        assertThat(down.testConnection()).isFalse();
    }

    @Test
    void basicAuthOnlyWithCredentials() {
        ScanConfig c = cfg();
        c.nexus().setUsername("reader").setPassword("pw");
        client(c, r -> new FakeResponse(r, 200, "")).testConnection();
        client(cfg(), r -> new FakeResponse(r, 200, "")).testConnection();

        assertThat(sent.get(0).headers().firstValue("Authorization")).contains("Basic cmVhZGVyOnB3");
        assertThat(sent.get(1).headers().firstValue("Authorization")).isEmpty();
    }

    @Test
    @DisplayName("저장소 목록: hosted만, 허용 목록이 있으면 그 이름만")
    void repositoriesFilteredByKindAndAllowList() {
        String body = """
                [{"name":"maven-releases","format":"maven2","type":"hosted"},
                 {"name":"maven-central","format":"maven2","type":"proxy"},
                 {"name":"npm-internal","format":"npm","type":"hosted"},
                 {"name":"docker-hosted","format":"docker","type":"hosted"}]""";

        List<RepositoryDescriptor> all = client(cfg(), r -> new FakeResponse(r, 200, body)).listRepositories();
        assertThat(all).extracting(RepositoryDescriptor::name)
                .containsExactly("maven-releases", "npm-internal", "docker-hosted");
        assertThat(all.get(2).isContainer()).isTrue();

        ScanConfig c = cfg();
        c.nexus().setRepositories(List.of("npm-internal"));
        assertThat(client(c, r -> new FakeResponse(r, 200, body)).listRepositories())
                .extracting(RepositoryDescriptor::name).containsExactly("npm-internal");
    }

    @Test
    void repositoryListingFailureIsEmpty() {
        assertThat(client(cfg(), r -> new FakeResponse(r, 401, "denied")).listRepositories()).isEmpty();
        assertThat(client(cfg(), r -> new FakeResponse(r, 200, "{\"not\":\"array\"}")).listRepositories()).isEmpty();
    }

    @Test
    @DisplayName("continuationToken을 따라 모든 페이지 수집, 에셋 이름은 path 우선")
    void componentsFollowContinuationToken() {
        String page1 = """
                {"items":[{"name":"core","version":"1.0","assets":[
                   {"path":"org/acme/core/1.0/core-1.0.jar","name":"ignored","downloadUrl":"http://nexus:8081/r/core-1.0.jar",
                    "lastModified":"2024-01-02T03:04:05.000+00:00","fileSize":1234}]}],
                 "continuationToken":"tok-2"}""";
        String page2 = """
                {"items":[{"name":"util","version":"2.0","assets":[{"name":"util-2.0.jar","downloadUrl":""}]}],
                 "continuationToken":null}""";

        List<Component> comps = client(cfg(), r -> new FakeResponse(r, 200,
                r.uri().getQuery().contains("continuationToken=tok-2") ? page2 : page1))
                .listComponents(new RepositoryDescriptor("maven releases", "maven2", "hosted"));

        assertThat(comps).extracting(Component::name).containsExactly("core", "util");
        Asset first = comps.get(0).assets().get(0);
        assertThat(first.name()).isEqualTo("org/acme/core/1.0/core-1.0.jar");
        assertThat(first.fileSize()).isEqualTo(1234);
        assertThat(first.lastModified()).isNotNull();
        Asset second = comps.get(1).assets().get(0);
        assertThat(second.name()).isEqualTo("util-2.0.jar");
        assertThat(second.hasDownloadUrl()).isFalse();
        assertThat(sent).hasSize(2);
        assertThat(sent.get(0).uri().getRawQuery()).isEqualTo("repository=maven+releases");
    }

    @Test
    void repeatedTokenStopsPaging() {
        String page = "{\"items\":[{\"name\":\"a\",\"version\":\"1\",\"assets\":[]}],\"continuationToken\":\"same\"}";

        List<Component> comps = client(cfg(), r -> new FakeResponse(r, 200, page))
                .listComponents(new RepositoryDescriptor("r", "raw", "hosted"));

        assertThat(sent).hasSize(2);
        assertThat(comps).hasSize(2);
    }

    @Test
    void componentListingFailureIsEmpty() {
        assertThat(client(cfg(), r -> new FakeResponse(r, 500, "oops"))
                .listComponents(new RepositoryDescriptor("r", "raw", "hosted"))).isEmpty();
    }

    @Test
    void downloadStreamsToTarget() throws Exception {
        Path target = tmp.resolve("temp/core-1.0.jar");
        Asset a = new Asset("core-1.0.jar", "http://nexus:8081/r/core-1.0.jar", null, -1);

        StepResult<Path> r = client(cfg(), req -> new FakeResponse(req, 200, "JARBYTES")).download(a, target);

        assertThat(r.isOk()).isTrue();
        assertThat(Files.readString(target)).isEqualTo("JARBYTES");
    }

    @Test
    @DisplayName("다운로드 실패 → DOWNLOAD_ERROR, 부분 파일 없음")
    void downloadFailures() {
        Path target = tmp.resolve("x.jar");
        Asset a = new Asset("x.jar", "http://nexus:8081/r/x.jar", null, -1);

        StepResult<Path> notFound = client(cfg(), req -> new FakeResponse(req, 404, "")).download(a, target);
        assertThat(notFound.failure()).isEqualTo(FailureKind.DOWNLOAD_ERROR);
        assertThat(notFound.message()).contains("404");
        assertThat(target).doesNotExist();

        NexusClient broken = new NexusClient(cfg(), new ObjectMapper(), req -> { throw new IOException("reset"); });
        assertThat(broken.download(a, target).failure()).isEqualTo(FailureKind.DOWNLOAD_ERROR);
        assertThat(target).doesNotExist();

        StepResult<Path> noUrl = broken.download(new Asset("y", "", null, -1), target);
        assertThat(noUrl.failure()).isEqualTo(FailureKind.DOWNLOAD_ERROR);
    }
}
