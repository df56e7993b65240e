package org.example.shaker.remote;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.Call;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.example.shaker.config.ShakerConfiguration;
import org.example.shaker.exception.RemoteConnectionException;
import org.example.shaker.model.PackageKey;
import org.example.shaker.model.ResolvedRevision;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * {@link RemoteRepository} backed by the GitHub REST API and raw content host.
 *
 * <p>Requests carry {@code Authorization: token <token>}. A 404 is reported as
 * "absent"; 401 and 403 are credential failures.</p>
 */
public class GitHubRepository implements RemoteRepository {

    private static final Logger log = LoggerFactory.getLogger(GitHubRepository.class);

    static final int PAGE_SIZE = 100;

    private final Call.Factory httpClient;
    private final ObjectMapper mapper;
    private final String token;
    private final String apiUrl;
    private final String rawUrl;
    private final int maxTagCount;
    private final boolean validateTokenOnline;

    public GitHubRepository(Call.Factory httpClient, String token, String apiUrl, String rawUrl,
                            int maxTagCount, boolean validateTokenOnline) {
        this.httpClient = httpClient;
        this.mapper = new ObjectMapper();
        this.token = token;
        this.apiUrl = trimSlash(apiUrl);
        this.rawUrl = trimSlash(rawUrl);
        this.maxTagCount = maxTagCount;
        this.validateTokenOnline = validateTokenOnline;
    }

    /**
     * Creates a client with a fresh OkHttpClient from the plugin configuration.
     */
    public static GitHubRepository fromConfiguration(ShakerConfiguration config) {
        OkHttpClient client = new OkHttpClient.Builder()
                .connectTimeout(Duration.ofSeconds(30))
                .readTimeout(Duration.ofSeconds(60))
                .build();
        return new GitHubRepository(client, config.getGithubToken(), config.getGithubApiUrl(),
                config.getGithubRawUrl(), config.getMaxTagCount(), config.isValidateTokenOnline());
    }

    @Override
    public void verifyAccess() throws RemoteConnectionException {
        if (token == null || token.trim().isEmpty()) {
            throw new RemoteConnectionException(
                    "No GitHub token found; set GITHUB_TOKEN, shaker.githubToken or shaker.serverId");
        }
        if (!validateTokenOnline) {
            log.debug("GitHub token present, online validation disabled");
            return;
        }
        try (Response response = execute(apiUrl + "/")) {
            checkAccess(response, apiUrl);
            log.debug("GitHub token validated against {}", apiUrl);
        }
    }

    @Override
    public List<RemoteTag> listTags(PackageKey key) throws RemoteConnectionException {
        List<RemoteTag> tags = new ArrayList<>();
        int perPage = Math.min(PAGE_SIZE, maxTagCount);
        int page = 1;

        while (tags.size() < maxTagCount) {
            String url = String.format("%s/repos/%s/%s/tags?per_page=%d&page=%d",
                    apiUrl, key.getOrganisation(), key.getName(), perPage, page);
            JsonNode root = getJson(url)
                    .orElseThrow(() -> new RemoteConnectionException("Repository not found: " + key, 404));
            if (!root.isArray()) {
                throw new RemoteConnectionException("Unexpected tag listing for " + key + ": " + root.getNodeType());
            }
            for (JsonNode node : root) {
                if (tags.size() >= maxTagCount) {
                    break;
                }
                tags.add(new RemoteTag(node.path("name").asText(), node.path("commit").path("sha").asText()));
            }
            if (root.size() < perPage) {
                break;
            }
            page++;
        }

        log.debug("Fetched {} tags for {}", tags.size(), key);
        return tags;
    }

    @Override
    public Optional<ResolvedRevision> getBranch(PackageKey key, String branch) throws RemoteConnectionException {
        String url = String.format("%s/repos/%s/%s/branches/%s",
                apiUrl, key.getOrganisation(), key.getName(), branch);
        return getJson(url).map(node -> new ResolvedRevision(
                node.path("name").asText(branch),
                node.path("commit").path("sha").asText()));
    }

    @Override
    public Optional<ResolvedRevision> getCommit(PackageKey key, String sha) throws RemoteConnectionException {
        String url = String.format("%s/repos/%s/%s/commits/%s",
                apiUrl, key.getOrganisation(), key.getName(), sha);
        return getJson(url).map(node -> {
            String fullSha = node.path("sha").asText(sha);
            return new ResolvedRevision(fullSha, fullSha);
        });
    }

    @Override
    public Optional<ResolvedRevision> getDefaultBranch(PackageKey key) throws RemoteConnectionException {
        String url = String.format("%s/repos/%s/%s", apiUrl, key.getOrganisation(), key.getName());
        Optional<JsonNode> repo = getJson(url);
        if (repo.isEmpty()) {
            return Optional.empty();
        }
        String branch = repo.get().path("default_branch").asText("");
        if (branch.isEmpty()) {
            branch = "master";
        }
        return getBranch(key, branch);
    }

    @Override
    public Optional<String> fetchFile(PackageKey key, String ref, String path) throws RemoteConnectionException {
        String url = String.format("%s/%s/%s/%s/%s", rawUrl, key.getOrganisation(), key.getName(), ref, path);
        try (Response response = execute(url)) {
            if (response.code() == 404) {
                log.debug("No {} in {} at {}", path, key, ref);
                return Optional.empty();
            }
            checkAccess(response, url);
            return Optional.of(bodyOf(response, url));
        }
    }

    // ========== HTTP ==========

    private Optional<JsonNode> getJson(String url) throws RemoteConnectionException {
        try (Response response = execute(url)) {
            if (response.code() == 404) {
                return Optional.empty();
            }
            checkAccess(response, url);
            return Optional.of(mapper.readTree(bodyOf(response, url)));
        } catch (IOException e) {
            throw new RemoteConnectionException("Invalid JSON from " + url + ": " + e.getMessage(), e);
        }
    }

    private Response execute(String url) throws RemoteConnectionException {
        Request request = new Request.Builder()
                .url(url)
                .header("Authorization", "token " + token)
                .header("Accept", "application/vnd.github+json")
                .build();
        try {
            return httpClient.newCall(request).execute();
        } catch (IOException e) {
            throw new RemoteConnectionException("Request to " + url + " failed: " + e.getMessage(), e);
        }
    }

    /**
     * Maps unsuccessful statuses to exceptions. 404 is handled by callers before this.
     */
    private void checkAccess(Response response, String url) throws RemoteConnectionException {
        int code = response.code();
        if (response.isSuccessful()) {
            return;
        }
        switch (code) {
            case 401:
                throw new RemoteConnectionException("Bad credentials for " + url, code);
            case 403:
                throw new RemoteConnectionException(
                        "Access forbidden for " + url + " (rate limit or too many login attempts)", code);
            case 404:
                throw new RemoteConnectionException("Not found: " + url, code);
            default:
                throw new RemoteConnectionException("Unexpected status " + code + " from " + url, code);
        }
    }

    private String bodyOf(Response response, String url) throws RemoteConnectionException {
        ResponseBody body = response.body();
        if (body == null) {
            throw new RemoteConnectionException("Empty response from " + url);
        }
        try {
            return body.string();
        } catch (IOException e) {
            throw new RemoteConnectionException("Failed reading response from " + url + ": " + e.getMessage(), e);
        }
    }

    private static String trimSlash(String url) {
        if (url == null) {
            return "";
        }
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
