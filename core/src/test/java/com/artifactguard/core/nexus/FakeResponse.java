package com.artifactguard.core.nexus;

import javax.net.ssl.SSLSession;
import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpHeaders;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Optional;

/** 테스트용 고정 응답 */
final class FakeResponse implements HttpResponse<InputStream> {
    private final HttpRequest request;
    private final int status;
    private final byte[] body;

    FakeResponse(HttpRequest request, int status, String body) {
        this.request = request;
        this.status = status;
        this.body = body.getBytes(StandardCharsets.UTF_8);
    }

    @Override public int statusCode() { return status; }
    @Override public HttpRequest request() { return request; }
    @Override public Optional<HttpResponse<InputStream>> previousResponse() { return Optional.empty(); }
    @Override public HttpHeaders headers() { return HttpHeaders.of(Map.of(), (a, b) -> true); }
    @Override public InputStream body() { return new ByteArrayInputStream(body); }
    @Override public Optional<SSLSession> sslSession() { return Optional.empty(); }
    @Override public URI uri() { return request.uri(); }
    @Override public HttpClient.Version version() { return HttpClient.Version.HTTP_1_1; }
}
