package org.example.shaker.resolver;

import org.example.shaker.exception.ConstraintResolutionException;
import org.example.shaker.model.PackageKey;
import org.example.shaker.model.ResolvedRevision;
import org.example.shaker.remote.RemoteRepository;
import org.example.shaker.remote.RemoteTag;
import org.example.shaker.version.VersionConstraint;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.Logger;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * Unit tests for ConstraintResolver.
 */
@ExtendWith(MockitoExtension.class)
class ConstraintResolverTest {

    private static final PackageKey FORMULA = new PackageKey("test_organisation", "test1-formula");
    private static final String SHA_1_0_1 = "6826533980361f54b9de17d181830fa4ec94138c";
    private static final String SHA_2_0_1 = "1d7d509b534b08b08b1f85253990b6c3f0dec007";
    private static final String SHA_BRANCH = "1035f6628a5991bd8b5d7b35affaf5b22f738287";

    @Mock
    private RemoteRepository remote;

    private ConstraintResolver resolver;

    @BeforeEach
    void setUp() {
        resolver = new ConstraintResolver(remote);
    }

    private void givenTags(RemoteTag... tags) throws Exception {
        when(remote.listTags(FORMULA)).thenReturn(List.of(tags));
    }

    private Optional<ResolvedRevision> resolve(String constraint) throws Exception {
        return resolver.resolve(FORMULA, VersionConstraint.parse(constraint));
    }

    @Nested
    @DisplayName("Version Constraints")
    class VersionConstraints {

        @BeforeEach
        void setUp() throws Exception {
            givenTags(new RemoteTag("v1.0.1", SHA_1_0_1), new RemoteTag("v2.0.1", SHA_2_0_1));
        }

        @Test
        @DisplayName("should pick the highest tag for a lower bound")
        void shouldResolveLowerBound() throws Exception {
            assertThat(resolve(">=v1.1")).contains(new ResolvedRevision("v2.0.1", SHA_2_0_1));
        }

        @Test
        @DisplayName("should pick the highest tag under an upper bound")
        void shouldResolveUpperBound() throws Exception {
            assertThat(resolve("<=v1.1")).contains(new ResolvedRevision("v1.0.1", SHA_1_0_1));
        }

        @Test
        @DisplayName("should pick an exact version")
        void shouldResolveExactVersion() throws Exception {
            assertThat(resolve("==v1.0.1")).contains(new ResolvedRevision("v1.0.1", SHA_1_0_1));
        }

        @Test
        @DisplayName("should fail when the exact version does not exist")
        void shouldFailForMissingExactVersion() {
            assertThatThrownBy(() -> resolve("==v6.6.6"))
                    .isInstanceOf(ConstraintResolutionException.class)
                    .hasMessageContaining("6.6.6");
        }

        @Test
        @DisplayName("should fail when no tag is under the upper bound")
        void shouldFailWhenUpperBoundTooLow() {
            assertThatThrownBy(() -> resolve("<=v0.1.0"))
                    .isInstanceOf(ConstraintResolutionException.class);
        }

        @Test
        @DisplayName("should pick the latest release when unconstrained")
        void shouldResolveUnconstrained() throws Exception {
            assertThat(resolve("")).contains(new ResolvedRevision("v2.0.1", SHA_2_0_1));
        }

        @Test
        @DisplayName("should list tags once per formula")
        void shouldCacheTags() throws Exception {
            resolve(">=v1.0");
            resolve("<=v2.0");

            verify(remote, times(1)).listTags(FORMULA);
        }

        @Test
        @DisplayName("should query tags again after clearing the cache")
        void shouldRefreshAfterClearCache() throws Exception {
            resolve(">=v1.0");
            resolver.clearCache();
            resolve(">=v1.0");

            verify(remote, times(2)).listTags(FORMULA);
        }
    }

    @Nested
    @DisplayName("Prereleases")
    class Prereleases {

        @Test
        @DisplayName("should skip a prerelease above the lower bound")
        void shouldSkipPrereleaseForLowerBound() throws Exception {
            givenTags(new RemoteTag("v1.0.1", SHA_1_0_1), new RemoteTag("v2.0.1", SHA_2_0_1),
                    new RemoteTag("v3.0.0-rc1", "cccccccc"));

            assertThat(resolve(">=v1.0")).contains(new ResolvedRevision("v2.0.1", SHA_2_0_1));
        }

        @Test
        @DisplayName("should log skipped prereleases")
        void shouldLogSkippedPrerelease() throws Exception {
            Logger log = mock(Logger.class);
            givenTags(new RemoteTag("v1.0.1", SHA_1_0_1), new RemoteTag("v3.0.0-rc1", "cccccccc"));

            new ConstraintResolver(remote, log).resolve(FORMULA, VersionConstraint.parse(">=v1.0"));

            verify(log).debug("Skipping prerelease {} of {}", "v3.0.0-rc1", FORMULA);
        }

        @Test
        @DisplayName("should skip a prerelease under the upper bound")
        void shouldSkipPrereleaseForUpperBound() throws Exception {
            givenTags(new RemoteTag("v1.0.1", SHA_1_0_1), new RemoteTag("v1.5.0-beta", "dddddddd"));

            assertThat(resolve("<=v2.0")).contains(new ResolvedRevision("v1.0.1", SHA_1_0_1));
        }

        @Test
        @DisplayName("should allow a prerelease by exact equality")
        void shouldResolvePrereleaseByEquality() throws Exception {
            givenTags(new RemoteTag("v1.5.0-beta", "dddddddd"));

            assertThat(resolve("==v1.5.0-beta")).contains(new ResolvedRevision("v1.5.0-beta", "dddddddd"));
        }

        @Test
        @DisplayName("should return empty when unconstrained and only prereleases exist")
        void shouldReturnEmptyWithoutRelease() throws Exception {
            givenTags(new RemoteTag("v1.5.0-beta", "dddddddd"));

            assertThat(resolve("")).isEmpty();
        }

        @Test
        @DisplayName("should ignore unprefixed tags so the picked tag resolves again by equality")
        void shouldResolvePickedTagAgainByEquality() throws Exception {
            givenTags(new RemoteTag("v0.9.0", SHA_1_0_1), new RemoteTag("1.0.0", SHA_2_0_1));

            Optional<ResolvedRevision> picked = resolve("");

            assertThat(picked).contains(new ResolvedRevision("v0.9.0", SHA_1_0_1));
            assertThat(resolve("==" + picked.get().getName())).isEqualTo(picked);
            verify(remote, never()).getBranch(any(), anyString());
        }

        @Test
        @DisplayName("should abort the lower-bound scan at the first tag below the bound")
        void shouldAbortAtFirstTagBelowBound() throws Exception {
            givenTags(new RemoteTag("v1.0.1", SHA_1_0_1), new RemoteTag("v2.0.0-rc1", "cccccccc"));

            assertThatThrownBy(() -> resolve(">=v1.5"))
                    .isInstanceOf(ConstraintResolutionException.class)
                    .hasMessageContaining("v1.0.1");
        }
    }

    @Nested
    @DisplayName("References")
    class References {

        @Test
        @DisplayName("should resolve a branch name")
        void shouldResolveBranch() throws Exception {
            when(remote.getBranch(FORMULA, "branch-01"))
                    .thenReturn(Optional.of(new ResolvedRevision("branch-01", SHA_BRANCH)));

            assertThat(resolve("==branch-01")).contains(new ResolvedRevision("branch-01", SHA_BRANCH));
            verify(remote, never()).listTags(any());
        }

        @Test
        @DisplayName("should fall back to a commit when no branch matches a sha")
        void shouldResolveCommit() throws Exception {
            when(remote.getBranch(FORMULA, SHA_BRANCH)).thenReturn(Optional.empty());
            when(remote.getCommit(FORMULA, SHA_BRANCH))
                    .thenReturn(Optional.of(new ResolvedRevision(SHA_BRANCH, SHA_BRANCH)));

            assertThat(resolve("==" + SHA_BRANCH)).contains(new ResolvedRevision(SHA_BRANCH, SHA_BRANCH));
        }

        @Test
        @DisplayName("should fail for an unknown branch")
        void shouldFailForUnknownBranch() throws Exception {
            when(remote.getBranch(FORMULA, "no-such-branch")).thenReturn(Optional.empty());

            assertThatThrownBy(() -> resolve("==no-such-branch"))
                    .isInstanceOf(ConstraintResolutionException.class)
                    .hasMessageContaining("no-such-branch");
            verify(remote, never()).getCommit(any(), anyString());
        }

        @Test
        @DisplayName("should reject a bound on a non-version reference")
        void shouldRejectBoundOnReference() {
            assertThatThrownBy(() -> resolve(">=branch-01"))
                    .isInstanceOf(ConstraintResolutionException.class);
        }

        @Test
        @DisplayName("should reject an unknown comparator")
        void shouldRejectUnknownComparator() {
            assertThatThrownBy(() -> resolve(">v1.0.0"))
                    .isInstanceOf(ConstraintResolutionException.class);
        }
    }
}
