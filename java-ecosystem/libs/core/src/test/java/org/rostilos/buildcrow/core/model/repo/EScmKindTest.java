package org.rostilos.buildcrow.core.model.repo;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("EScmKind")
class EScmKindTest {

    @Test
    @DisplayName("should expose ids and default branches")
    void shouldExposeIdsAndDefaultBranches() {
        assertThat(EScmKind.GIT.getId()).isEqualTo("git");
        assertThat(EScmKind.GIT.getDefaultBranch()).isEqualTo("master");
        assertThat(EScmKind.HG.getId()).isEqualTo("hg");
        assertThat(EScmKind.HG.getDefaultBranch()).isEqualTo("default");
        assertThat(EScmKind.SVN.getId()).isEqualTo("svn");
        assertThat(EScmKind.SVN.getDefaultBranch()).isEqualTo("trunk");
    }

    @Nested
    @DisplayName("lookup")
    class Lookup {

        @ParameterizedTest
        @CsvSource({"git, GIT", "hg, HG", "svn, SVN"})
        @DisplayName("should find known kinds")
        void shouldFindKnownKinds(String input, String expected) {
            assertThat(EScmKind.lookup(input)).contains(EScmKind.valueOf(expected));
        }

        @ParameterizedTest
        @ValueSource(strings = {"bzr", "mercurial", "cvs", "", "GIT", "Hg", " svn "})
        @DisplayName("should be empty for unknown or non-canonical kinds")
        void shouldBeEmptyForUnknownKinds(String input) {
            assertThat(EScmKind.lookup(input)).isEmpty();
        }

        @Test
        @DisplayName("should be empty for null")
        void shouldBeEmptyForNull() {
            assertThat(EScmKind.lookup(null)).isEmpty();
        }
    }

    @Nested
    @DisplayName("fromId")
    class FromId {

        @Test
        @DisplayName("should return matching kind")
        void shouldReturnMatchingKind() {
            assertThat(EScmKind.fromId("svn")).isEqualTo(EScmKind.SVN);
        }

        @ParameterizedTest
        @ValueSource(strings = {"HG", " hg ", "Hg"})
        @DisplayName("should ignore case and whitespace of user input")
        void shouldIgnoreCaseAndWhitespace(String input) {
            assertThat(EScmKind.fromId(input)).isEqualTo(EScmKind.HG);
        }

        @Test
        @DisplayName("should throw exception for null input")
        void shouldThrowExceptionForNullInput() {
            assertThatThrownBy(() -> EScmKind.fromId(null))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessage("SCM ID cannot be null");
        }

        @Test
        @DisplayName("should throw exception for unknown kind")
        void shouldThrowExceptionForUnknownKind() {
            assertThatThrownBy(() -> EScmKind.fromId("bzr"))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("Unknown SCM kind");
        }
    }
}
