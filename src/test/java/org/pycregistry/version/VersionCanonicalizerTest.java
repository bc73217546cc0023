package org.pycregistry.version;

import org.pycregistry.api.UnknownVersionException;
import org.pycregistry.config.RegistryConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link VersionCanonicalizer}: literal aliases, the structural fallback and
 * version tuples.
 */
@Tag("unit")
class VersionCanonicalizerTest {

    private static final RegistryConfig CONFIG = new RegistryConfig(
            List.of("pypy", "dropbox"), false, Map.of("PyPy", "pypy"));

    private VersionCanonicalizer.Builder builder;

    @BeforeEach
    void setUp() {
        builder = VersionCanonicalizer.builder(CONFIG);
        builder.registerCanonical("2.7")
                .registerCanonical("2.7pypy")
                .registerCanonical("3.6rc1")
                .registerCanonical("3.7.0")
                .registerCanonical("3.7.0beta3")
                .registerCanonical("3.8.0a1")
                .registerCanonical("3.000+1")
                .registerCanonical("2.5dropbox");
        builder.registerAlias(List.of("2.7.17", "2.7.18"), "2.7");
        builder.registerAlias(List.of("3.6", "3.6.1"), "3.6rc1");
        builder.registerAlias(List.of("3.7", "3.7.1"), "3.7.0");
        builder.registerAlias(List.of("2.7.18pypy"), "2.7pypy");
    }

    // ========== Literal resolution ==========

    @Test
    void aliasResolvesToItsCanonicalVersion() {
        VersionCanonicalizer canonicalizer = builder.build();

        assertThat(canonicalizer.canonicalize("2.7.18")).isEqualTo("2.7");
        assertThat(canonicalizer.canonicalize("3.6.1")).isEqualTo("3.6rc1");
    }

    @Test
    void canonicalizationIsIdempotent() {
        VersionCanonicalizer canonicalizer = builder.build();

        for (String canonical : canonicalizer.canonicalVersions()) {
            assertThat(canonicalizer.canonicalize(canonical)).isEqualTo(canonical);
        }
        for (String known : canonicalizer.allKnownVersions()) {
            String once = canonicalizer.canonicalize(known);
            assertThat(canonicalizer.canonicalize(once)).isEqualTo(once);
        }
    }

    @Test
    void allKnownVersionsContainsCanonicalVersionsAndAliases() {
        VersionCanonicalizer canonicalizer = builder.build();

        assertThat(canonicalizer.allKnownVersions())
                .contains("2.7", "2.7.17", "2.7.18", "3.6", "3.6rc1", "2.7.18pypy")
                .doesNotContain("2.7.19");
    }

    // ========== Registration rules ==========

    @Test
    void aliasToUnregisteredTargetIsRejected() {
        assertThatThrownBy(() -> builder.registerAlias(List.of("3.9.1"), "3.9.0beta5"))
                .isInstanceOf(UnknownVersionException.class)
                .hasMessageContaining("3.9.0beta5");
    }

    @Test
    void aliasToAnotherAliasIsRejected() {
        // no transitive chains: "2.7.18" is an alias, not a canonical version
        assertThatThrownBy(() -> builder.registerAlias(List.of("2.7.18.1"), "2.7.18"))
                .isInstanceOf(UnknownVersionException.class);
    }

    @Test
    void rebindingAnAliasToADifferentTargetIsRejected() {
        assertThatThrownBy(() -> builder.registerAlias(List.of("3.6"), "3.7.0"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("already bound");
    }

    @Test
    void rebindingACanonicalVersionIsRejected() {
        assertThatThrownBy(() -> builder.registerAlias(List.of("3.7.0beta3"), "3.7.0"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void repeatingAnAliasForTheSameTargetIsAccepted() {
        builder.registerAlias(List.of("2.7.18", "2.7.18", "2.7"), "2.7");

        assertThat(builder.build().canonicalize("2.7.18")).isEqualTo("2.7");
    }

    @Test
    void rejectedAliasGroupLeavesNoPartialBindings() {
        assertThatThrownBy(() -> builder.registerAlias(List.of("3.7.5", "3.6"), "3.7.0"))
                .isInstanceOf(IllegalArgumentException.class);

        VersionCanonicalizer canonicalizer = builder.build();
        assertThat(canonicalizer.allKnownVersions()).doesNotContain("3.7.5");
    }

    @Test
    void aliasCannotBecomeCanonical() {
        assertThatThrownBy(() -> builder.registerCanonical("2.7.18"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void builderCannotBeUsedAfterBuild() {
        builder.build();

        assertThatThrownBy(() -> builder.registerCanonical("3.8"))
                .isInstanceOf(IllegalStateException.class);
    }

    // ========== Structural fallback ==========

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource({
        "2.7.99,          2.7",
        "3.6.16,          3.6rc1",
        "3.7.0beta3,      3.7.0beta3",
        "2.7.99pypy,      2.7pypy",
        "3.8.0alpha1,     3.8.0a1"
    })
    void fallbackReducesToKnownVersion(String version, String expected) {
        assertThat(builder.build().canonicalize(version)).isEqualTo(expected);
    }

    @ParameterizedTest
    @CsvSource({"3.7.0beta9", "2.7.19candidate1", "3.8.0alpha2", "3.7.1rc1", "2.7.18b1pypy"})
    void unlistedPreReleaseNeverResolvesToAFinalRelease(String version) {
        VersionCanonicalizer canonicalizer = builder.build();

        assertThatThrownBy(() -> canonicalizer.canonicalize(version))
                .isInstanceOf(UnknownVersionException.class)
                .hasMessageContaining(version);
        assertThat(canonicalizer.isKnown(version)).isFalse();
    }

    @Test
    void nullVersionIsRejected() {
        VersionCanonicalizer canonicalizer = builder.build();

        assertThatThrownBy(() -> canonicalizer.canonicalize(null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> canonicalizer.versionTuple(null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(canonicalizer.isKnown(null)).isFalse();
        assertThat(canonicalizer.isCanonical(null)).isFalse();
    }

    @Test
    void unknownVersionFailsWithDistinguishableError() {
        VersionCanonicalizer canonicalizer = builder.build();

        assertThatThrownBy(() -> canonicalizer.canonicalize("4.0"))
                .isInstanceOfSatisfying(UnknownVersionException.class,
                        e -> assertThat(e.getVersion()).isEqualTo("4.0"));
        assertThatThrownBy(() -> canonicalizer.canonicalize("not-a-version"))
                .isInstanceOf(UnknownVersionException.class);
    }

    @Test
    void suffixedVersionDoesNotFallBackToAnotherImplementationByDefault() {
        VersionCanonicalizer canonicalizer = builder.build();

        // 3.6pypy is not registered; 3.6 (CPython) is, but uses a different magic
        assertThatThrownBy(() -> canonicalizer.canonicalize("3.6.1pypy"))
                .isInstanceOf(UnknownVersionException.class);
    }

    @Test
    void crossImplementationFallbackCanBeEnabled() {
        VersionCanonicalizer.Builder permissive = VersionCanonicalizer.builder(
                new RegistryConfig(List.of("pypy", "dropbox"), true, Map.of()));
        permissive.registerCanonical("3.6rc1");
        permissive.registerAlias(List.of("3.6", "3.6.1"), "3.6rc1");

        assertThat(permissive.build().canonicalize("3.6.1pypy")).isEqualTo("3.6rc1");
    }

    @Test
    void unrecognizedTrailingMarkerIsNotReducedAway() {
        VersionCanonicalizer canonicalizer = builder.build();

        assertThatThrownBy(() -> canonicalizer.canonicalize("2.7pyston-0.6.2"))
                .isInstanceOf(UnknownVersionException.class);
    }

    @Test
    void isKnownReflectsCanonicalize() {
        VersionCanonicalizer canonicalizer = builder.build();

        assertThat(canonicalizer.isKnown("2.7.18")).isTrue();
        assertThat(canonicalizer.isKnown("2.7.42")).isTrue();
        assertThat(canonicalizer.isKnown("5.1")).isFalse();
        assertThat(canonicalizer.isCanonical("2.7.18")).isFalse();
        assertThat(canonicalizer.isCanonical("2.7")).isTrue();
    }

    // ========== Version tuples ==========

    @Test
    void versionTupleHasThreeComponentsWhenMicroIsPresent() {
        assertThat(builder.build().versionTuple("2.7.18")).containsExactly(2, 7, 18);
    }

    @Test
    void versionTupleIgnoresPreReleaseTagsAndSuffixes() {
        VersionCanonicalizer canonicalizer = builder.build();

        assertThat(canonicalizer.versionTuple("3.6rc1")).containsExactly(3, 6);
        assertThat(canonicalizer.versionTuple("3.7.0beta3")).containsExactly(3, 7, 0);
        assertThat(canonicalizer.versionTuple("2.7pypy")).containsExactly(2, 7);
        assertThat(canonicalizer.versionTuple("2.5dropbox")).containsExactly(2, 5);
        assertThat(canonicalizer.versionTuple("3.000+1")).containsExactly(3, 0);
    }

    @Test
    void versionTupleRequiresAKnownVersion() {
        assertThatThrownBy(() -> builder.build().versionTuple("3.99"))
                .isInstanceOf(UnknownVersionException.class);
    }
}
