package org.example.shaker.remote;

import okhttp3.Call;
import okhttp3.MediaType;
import okhttp3.Protocol;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.example.shaker.exception.RemoteConnectionException;
import org.example.shaker.model.PackageKey;
import org.example.shaker.model.ResolvedRevision;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Unit tests for GitHubRepository.
 */
@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class GitHubRepositoryTest {

    private static final String API = "https://api.github.test";
    private static final String RAW = "https://raw.github.test";
    private static final PackageKey FORMULA = new PackageKey("test_organisation", "test1-formula");
    private static final MediaType JSON = MediaType.get("application/json");

    @Mock
    private Call.Factory httpClient;

    private final Map<String, Response.Builder> routes = new HashMap<>();
    private final List<Request> requests = new ArrayList<>();

    @BeforeEach
    void setUp() {
        when(httpClient.newCall(any())).thenAnswer(invocation -> {
            Request request = invocation.getArgument(0);
            requests.add(request);
            Response.Builder route = routes.get(request.url().toString());
            Response response = (route != null ? route : respond(404, "{\"message\":\"Not Found\"}"))
                    .request(request)
                    .build();
            Call call = mock(Call.class);
            when(call.execute()).thenReturn(response);
            return call;
        });
    }

    private static Response.Builder respond(int code, String body) {
        return new Response.Builder()
                .protocol(Protocol.HTTP_1_1)
                .code(code)
                .message("status " + code)
                .body(ResponseBody.create(body, JSON));
    }

    private void route(String url, int code, String body) {
        routes.put(url, respond(code, body));
    }

    private GitHubRepository repository(int maxTagCount) {
        return new GitHubRepository(httpClient, "secret-token", API + "/", RAW, maxTagCount, true);
    }

    @Nested
    @DisplayName("Access")
    class Access {

        @Test
        @DisplayName("should fail without a token and without calling the host")
        void shouldFailWithoutToken() {
            GitHubRepository repository = new GitHubRepository(httpClient, " ", API, RAW, 10, true);

            assertThatThrownBy(repository::verifyAccess)
                    .isInstanceOf(RemoteConnectionException.class)
                    .hasMessageContaining("GITHUB_TOKEN");
            verify(httpClient, never()).newCall(any());
        }

        @Test
        @DisplayName("should skip the online check when disabled")
        void shouldSkipOnlineCheck() throws Exception {
            new GitHubRepository(httpClient, "secret-token", API, RAW, 10, false).verifyAccess();

            verify(httpClient, never()).newCall(any());
        }

        @Test
        @DisplayName("should report bad credentials")
        void shouldReportBadCredentials() {
            route(API + "/", 401, "{\"message\":\"Bad credentials\"}");

            assertThatThrownBy(() -> repository(10).verifyAccess())
                    .isInstanceOf(RemoteConnectionException.class)
                    .hasMessageContaining("Bad credentials")
                    .extracting(e -> ((RemoteConnectionException) e).getStatusCode())
                    .isEqualTo(401);
        }

        @Test
        @DisplayName("should report rate limiting")
        void shouldReportForbidden() {
            route(API + "/", 403, "{}");

            assertThatThrownBy(() -> repository(10).verifyAccess())
                    .isInstanceOf(RemoteConnectionException.class)
                    .hasMessageContaining("Access forbidden");
        }

        @Test
        @DisplayName("should send the token in the authorization header")
        void shouldSendToken() throws Exception {
            route(API + "/", 200, "{}");

            repository(10).verifyAccess();

            assertThat(requests).hasSize(1);
            assertThat(requests.get(0).header("Authorization")).isEqualTo("token secret-token");
        }
    }

    @Nested
    @DisplayName("Tags")
    class Tags {

        @Test
        @DisplayName("should list tags with their commits")
        void shouldListTags() throws Exception {
            route(API + "/repos/test_organisation/test1-formula/tags?per_page=100&page=1", 200,
                    "[{\"name\":\"v1.0.1\",\"commit\":{\"sha\":\"6826533980361f54b9de17d181830fa4ec94138c\"}},"
                            + "{\"name\":\"v2.0.1\",\"commit\":{\"sha\":\"1d7d509b534b08b08b1f85253990b6c3f0dec007\"}}]");

            List<RemoteTag> tags = repository(1000).listTags(FORMULA);

            assertThat(tags).containsExactly(
                    new RemoteTag("v1.0.1", "6826533980361f54b9de17d181830fa4ec94138c"),
                    new RemoteTag("v2.0.1", "1d7d509b534b08b08b1f85253990b6c3f0dec007"));
        }

        @Test
        @DisplayName("should follow pages up to the tag limit")
        void shouldPaginateUpToLimit() throws Exception {
            route(API + "/repos/test_organisation/test1-formula/tags?per_page=2&page=1", 200,
                    "[{\"name\":\"v3.0.0\",\"commit\":{\"sha\":\"c3\"}},{\"name\":\"v2.0.0\",\"commit\":{\"sha\":\"c2\"}}]");
            route(API + "/repos/test_organisation/test1-formula/tags?per_page=2&page=2", 200,
                    "[{\"name\":\"v1.0.0\",\"commit\":{\"sha\":\"c1\"}},{\"name\":\"v0.1.0\",\"commit\":{\"sha\":\"c0\"}}]");

            List<RemoteTag> tags = repository(3).listTags(FORMULA);

            assertThat(tags).extracting(RemoteTag::getName).containsExactly("v3.0.0", "v2.0.0", "v1.0.0");
            assertThat(requests).hasSize(2);
        }

        @Test
        @DisplayName("should fail for an unknown repository")
        void shouldFailForUnknownRepository() {
            assertThatThrownBy(() -> repository(10).listTags(FORMULA))
                    .isInstanceOf(RemoteConnectionException.class)
                    .hasMessageContaining("test_organisation/test1-formula");
        }
    }

    @Nested
    @DisplayName("Revisions")
    class Revisions {

        @Test
        @DisplayName("should resolve a branch head")
        void shouldResolveBranch() throws Exception {
            route(API + "/repos/test_organisation/test1-formula/branches/branch-01", 200,
                    "{\"name\":\"branch-01\",\"commit\":{\"sha\":\"1035f6628a5991bd8b5d7b35affaf5b22f738287\"}}");

            assertThat(repository(10).getBranch(FORMULA, "branch-01"))
                    .contains(new ResolvedRevision("branch-01", "1035f6628a5991bd8b5d7b35affaf5b22f738287"));
        }

        @Test
        @DisplayName("should report a missing branch as absent")
        void shouldReportMissingBranch() throws Exception {
            assertThat(repository(10).getBranch(FORMULA, "nope")).isEmpty();
        }

        @Test
        @DisplayName("should expand a short commit sha")
        void shouldResolveCommit() throws Exception {
            route(API + "/repos/test_organisation/test1-formula/commits/1035f66", 200,
                    "{\"sha\":\"1035f6628a5991bd8b5d7b35affaf5b22f738287\"}");

            assertThat(repository(10).getCommit(FORMULA, "1035f66")).contains(new ResolvedRevision(
                    "1035f6628a5991bd8b5d7b35affaf5b22f738287", "1035f6628a5991bd8b5d7b35affaf5b22f738287"));
        }

        @Test
        @DisplayName("should resolve the default branch")
        void shouldResolveDefaultBranch() throws Exception {
            route(API + "/repos/test_organisation/test1-formula", 200, "{\"default_branch\":\"main\"}");
            route(API + "/repos/test_organisation/test1-formula/branches/main", 200,
                    "{\"name\":\"main\",\"commit\":{\"sha\":\"abc1234\"}}");

            assertThat(repository(10).getDefaultBranch(FORMULA)).contains(new ResolvedRevision("main", "abc1234"));
        }
    }

    @Nested
    @DisplayName("Raw Files")
    class RawFiles {

        @Test
        @DisplayName("should fetch raw file content at a revision")
        void shouldFetchFile() throws Exception {
            route(RAW + "/test_organisation/test1-formula/abc1234/metadata.yml", 200, "formula: test_organisation/test1-formula\n");

            assertThat(repository(10).fetchFile(FORMULA, "abc1234", "metadata.yml"))
                    .contains("formula: test_organisation/test1-formula\n");
        }

        @Test
        @DisplayName("should report a missing file as absent")
        void shouldReportMissingFile() throws Exception {
            assertThat(repository(10).fetchFile(FORMULA, "abc1234", "formula-requirements.txt")).isEmpty();
        }

        @Test
        @DisplayName("should fail on server errors")
        void shouldFailOnServerError() {
            route(RAW + "/test_organisation/test1-formula/abc1234/metadata.yml", 502, "bad gateway");

            assertThatThrownBy(() -> repository(10).fetchFile(FORMULA, "abc1234", "metadata.yml"))
                    .isInstanceOf(RemoteConnectionException.class)
                    .hasMessageContaining("502");
        }

        @Test
        @DisplayName("should wrap transport failures")
        void shouldWrapTransportFailures() throws Exception {
            Call failing = mock(Call.class);
            when(failing.execute()).thenThrow(new IOException("connection reset"));
            doReturn(failing).when(httpClient).newCall(any());

            assertThatThrownBy(() -> repository(10).fetchFile(FORMULA, "abc1234", "metadata.yml"))
                    .isInstanceOf(RemoteConnectionException.class)
                    .hasMessageContaining("connection reset")
                    .hasCauseInstanceOf(IOException.class);
        }
    }
}
