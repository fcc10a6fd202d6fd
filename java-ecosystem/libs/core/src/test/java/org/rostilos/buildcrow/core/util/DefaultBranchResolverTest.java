package org.rostilos.buildcrow.core.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;
import org.rostilos.buildcrow.core.model.repo.EScmKind;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("DefaultBranchResolver")
class DefaultBranchResolverTest {

    @ParameterizedTest
    @CsvSource({"git, master", "hg, default", "svn, trunk"})
    @DisplayName("should resolve conventional default branches")
    void shouldResolveConventionalDefaultBranches(String scm, String expected) {
        assertThat(DefaultBranchResolver.resolve(scm)).isEqualTo(expected);
    }

    @ParameterizedTest
    @ValueSource(strings = {"bzr", "cvs", "perforce", "GIT2", "HG", "Git", " git", " svn ", "SVN"})
    @NullAndEmptySource
    @DisplayName("should fall back to master for unknown kinds")
    void shouldFallBackToMasterForUnknownKinds(String scm) {
        assertThat(DefaultBranchResolver.resolve(scm)).isEqualTo("master");
    }

    @Test
    @DisplayName("should resolve enum kinds")
    void shouldResolveEnumKinds() {
        assertThat(DefaultBranchResolver.resolve(EScmKind.HG)).isEqualTo("default");
        assertThat(DefaultBranchResolver.resolve((EScmKind) null)).isEqualTo(DefaultBranchResolver.FALLBACK_BRANCH);
    }

    @Test
    @DisplayName("should return identical output on repeated calls")
    void shouldBePure() {
        assertThat(DefaultBranchResolver.resolve("svn")).isEqualTo(DefaultBranchResolver.resolve("svn"));
    }
}
