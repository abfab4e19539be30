package com.artifactguard.core.nexus;

import com.artifactguard.core.api.IAssetDownloader;
import com.artifactguard.core.api.IAssetSource;
import com.artifactguard.core.model.Asset;
import com.artifactguard.core.model.Component;
import com.artifactguard.core.model.FailureKind;
import com.artifactguard.core.model.RepositoryDescriptor;
import com.artifactguard.core.model.ScanConfig;
import com.artifactguard.core.model.StepResult;
import com.artifactguard.core.util.FileCleanup;
import com.artifactguard.core.util.StructuredLog;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.*;

/**
 * Nexus Repository REST v1 클라이언트 (Basic 인증, 재시도 없음).
 * 목록 조회 실패는 빈 목록, 다운로드 실패는 DOWNLOAD_ERROR.
 */
public class NexusClient implements IAssetSource, IAssetDownloader {
    private static final Logger LOG = LoggerFactory.getLogger(NexusClient.class);
    private static final StructuredLog SLOG = StructuredLog.get(NexusClient.class);

    static final String API = "/service/rest/v1";

    /** 테스트/모킹용 송신 훅 */
    @FunctionalInterface
    public interface HttpSender {
        HttpResponse<InputStream> send(HttpRequest req) throws IOException, InterruptedException;
    }

    private final String baseUrl;
    private final String authHeader;          // null이면 익명
    private final Duration requestTimeout;
    private final Duration downloadTimeout;
    private final Set<String> repositoryTypes;
    private final Set<String> allowList;
    private final ObjectMapper mapper;
    private final HttpSender sender;

    public NexusClient(ScanConfig config, ObjectMapper mapper) {
        this(config, mapper, defaultSender(config.nexus().getRequestTimeout()));
    }

    /** 테스트용 생성자(송신 훅 주입) */
    public NexusClient(ScanConfig config, ObjectMapper mapper, HttpSender sender) {
        ScanConfig.Nexus n = Objects.requireNonNull(config, "config").nexus();
        this.baseUrl = Objects.requireNonNull(n.getUrl(), "nexus.url");
        this.authHeader = n.hasCredentials() ? basic(n.getUsername(), n.getPassword()) : null;
        this.requestTimeout = n.getRequestTimeout();
        this.downloadTimeout = n.getDownloadTimeout();
        this.repositoryTypes = lowerSet(n.getRepositoryTypes());
        this.allowList = Set.copyOf(n.getRepositories());
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.sender = Objects.requireNonNull(sender, "sender");
    }

    private static HttpSender defaultSender(Duration connectTimeout) {
        HttpClient client = HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NORMAL)
                .connectTimeout(connectTimeout)
                .build();
        return req -> client.send(req, HttpResponse.BodyHandlers.ofInputStream());
    }

    // ---- IAssetSource ----

    @Override
    public boolean testConnection() {
        try {
            HttpResponse<InputStream> resp = get(URI.create(baseUrl + API + "/status"), requestTimeout);
            try (InputStream ignored = resp.body()) {
                if (resp.statusCode() == 200) {
                    LOG.info("Successfully connected to repository service {}", baseUrl);
                    return true;
                }
            }
            LOG.error("Failed to connect to {}: HTTP {}", baseUrl, resp.statusCode());
            return false;
        } catch (IOException e) {
            LOG.error("Connection test failed for {}: {}", baseUrl, e.getMessage());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    @Override
    public List<RepositoryDescriptor> listRepositories() {
        try {
            JsonNode root = getJson(URI.create(baseUrl + API + "/repositories"));
            if (!root.isArray()) throw new IOException("repository list is not a JSON array");

            List<RepositoryDescriptor> out = new ArrayList<>();
            Map<String, Integer> byFormat = new TreeMap<>();
            for (JsonNode r : root) {
                String name = text(r, "name", null);
                if (name == null) continue;
                String type = text(r, "type", "unknown");
                if (!repositoryTypes.contains(type.toLowerCase(Locale.ROOT))) continue;
                if (!allowList.isEmpty() && !allowList.contains(name)) continue;
                RepositoryDescriptor d = new RepositoryDescriptor(name, text(r, "format", "unknown"), type);
                out.add(d);
                byFormat.merge(d.formatLower(), 1, Integer::sum);
            }
            LOG.info("Found {} {} repositories: {}", out.size(), repositoryTypes, byFormat);
            return out;
        } catch (IOException e) {
            LOG.error("Error getting repositories: {}", e.getMessage());
            SLOG.warn("repository_error", "kind", FailureKind.REPOSITORY_ERROR, "op", "listRepositories",
                    "message", e.getMessage());
            return List.of();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return List.of();
        }
    }

    /** continuationToken이 없어질 때까지 페이지를 따라간다 */
    @Override
    public List<Component> listComponents(RepositoryDescriptor repository) {
        Objects.requireNonNull(repository, "repository");
        String repo = repository.name();
        List<Component> components = new ArrayList<>();
        Set<String> seenTokens = new HashSet<>();
        String token = null;
        try {
            while (true) {
                StringBuilder url = new StringBuilder(baseUrl).append(API).append("/components?repository=")
                        .append(enc(repo));
                if (token != null) url.append("&continuationToken=").append(enc(token));

                JsonNode page = getJson(URI.create(url.toString()));
                JsonNode items = page.get("items");
                int batch = 0;
                if (items != null && items.isArray()) {
                    for (JsonNode c : items) {
                        components.add(toComponent(c));
                        batch++;
                    }
                }

                token = text(page, "continuationToken", null);
                if (token == null || token.isBlank()) break;
                if (!seenTokens.add(token)) {
                    LOG.warn("Repeated continuation token in '{}', stopping pagination", repo);
                    break;
                }
                LOG.info("Retrieved {} components (total: {})", batch, components.size());
            }
            LOG.info("Found {} components in '{}'", components.size(), repo);
            return components;
        } catch (IOException e) {
            LOG.error("Error getting components from {}: {}", repo, e.getMessage());
            SLOG.warn("repository_error", "kind", FailureKind.REPOSITORY_ERROR, "op", "listComponents",
                    "repository", repo, "message", e.getMessage());
            return List.of();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return List.of();
        }
    }

    // ---- IAssetDownloader ----

    @Override
    public StepResult<Path> download(Asset asset, Path target) {
        Objects.requireNonNull(asset, "asset");
        Objects.requireNonNull(target, "target");
        if (!asset.hasDownloadUrl()) {
            return StepResult.fail(FailureKind.DOWNLOAD_ERROR, "asset has no download URL");
        }
        try {
            URI uri = URI.create(asset.downloadUrl());
            HttpResponse<InputStream> resp = get(uri, downloadTimeout);
            try (InputStream body = resp.body()) {
                if (resp.statusCode() / 100 != 2) {
                    LOG.error("Error downloading {}: HTTP {}", asset.downloadUrl(), resp.statusCode());
                    return StepResult.fail(FailureKind.DOWNLOAD_ERROR, "HTTP " + resp.statusCode());
                }
                if (target.getParent() != null) Files.createDirectories(target.getParent());
                long bytes = Files.copy(body, target, StandardCopyOption.REPLACE_EXISTING);
                LOG.debug("Downloaded {} bytes to {}", bytes, target);
            }
            return StepResult.ok(target);
        } catch (IOException | IllegalArgumentException e) {
            LOG.error("Error downloading {}: {}", asset.downloadUrl(), e.getMessage());
            FileCleanup.deleteRecursively(target);
            return StepResult.fail(FailureKind.DOWNLOAD_ERROR, e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            FileCleanup.deleteRecursively(target);
            return StepResult.fail(FailureKind.DOWNLOAD_ERROR, "interrupted");
        }
    }

    // ------------ helpers ------------
    private HttpResponse<InputStream> get(URI uri, Duration timeout) throws IOException, InterruptedException {
        HttpRequest.Builder b = HttpRequest.newBuilder(uri).timeout(timeout).GET();
        if (authHeader != null) b.header("Authorization", authHeader);
        return sender.send(b.build());
    }

    private JsonNode getJson(URI uri) throws IOException, InterruptedException {
        HttpResponse<InputStream> resp = get(uri, requestTimeout);
        try (InputStream body = resp.body()) {
            if (resp.statusCode() / 100 != 2) {
                throw new IOException("HTTP " + resp.statusCode() + " for " + uri.getPath());
            }
            JsonNode node = mapper.readTree(body);
            if (node == null || node.isMissingNode()) throw new IOException("empty response for " + uri.getPath());
            return node;
        }
    }

    private static Component toComponent(JsonNode c) {
        List<Asset> assets = new ArrayList<>();
        JsonNode arr = c.get("assets");
        if (arr != null && arr.isArray()) {
            for (JsonNode a : arr) {
                String name = text(a, "path", text(a, "name", "unknown"));
                long size = a.hasNonNull("fileSize") ? a.get("fileSize").asLong(-1) : -1;
                assets.add(new Asset(name, text(a, "downloadUrl", ""), instant(text(a, "lastModified", null)), size));
            }
        }
        return new Component(text(c, "name", "unknown"), text(c, "version", "unknown"), assets);
    }

    private static Instant instant(String s) {
        if (s == null || s.isBlank()) return null;
        try {
            return OffsetDateTime.parse(s).toInstant();
        } catch (DateTimeParseException e) {
            LOG.debug("Unparseable lastModified '{}'", s);
            return null;
        }
    }

    private static String text(JsonNode n, String field, String fallback) {
        JsonNode v = n.get(field);
        return (v == null || v.isNull() || !v.isValueNode()) ? fallback : v.asText();
    }

    private static String basic(String user, String pass) {
        String raw = user + ":" + (pass == null ? "" : pass);
        return "Basic " + Base64.getEncoder().encodeToString(raw.getBytes(StandardCharsets.UTF_8));
    }

    private static String enc(String s) {
        return URLEncoder.encode(s, StandardCharsets.UTF_8);
    }

    private static Set<String> lowerSet(List<String> values) {
        Set<String> out = new HashSet<>();
        for (String v : values) out.add(v.toLowerCase(Locale.ROOT));
        return out;
    }

}
