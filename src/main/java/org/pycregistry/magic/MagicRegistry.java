package org.pycregistry.magic;

import org.pycregistry.api.UnknownMagicException;
import org.pycregistry.api.UnknownVersionException;
import org.pycregistry.api.UnresolvedRuntimeException;
import org.pycregistry.config.RegistryConfig;
import org.pycregistry.spi.IRuntimeProbe;
import org.pycregistry.spi.ReleaseLevel;
import org.pycregistry.spi.RuntimeInfo;
import org.pycregistry.version.VersionCanonicalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Bidirectional index between magic identifiers and canonical versions.
 *
 * <p>One magic may denote several canonical versions (pre-release tags sharing a format) and
 * one canonical version may carry several magics (format bumps within one pre-release cycle).
 * Nothing is collapsed: {@link #versionsFor(MagicIdentifier)} returns the full set and
 * {@link #magicsFor(String)} every magic registered for a version.
 *
 * <p>Precedence for the single-valued forward lookups: the last registration wins, both for
 * {@link #magicFor(String)} (last magic registered for the version) and for
 * {@link #versionForMagicInt(int)} (last version registered for the magic integer).
 *
 * <p>Instances are immutable and safe for concurrent use.
 */
public final class MagicRegistry {

    private final VersionCanonicalizer canonicalizer;
    private final RegistryConfig config;
    private final Map<MagicIdentifier, Set<String>> versionsByMagic;
    private final Map<String, List<MagicIdentifier>> magicsByVersion;
    private final Map<Integer, String> versionByMagicInt;
    private final Set<Integer> pypy3MagicInts;

    private MagicRegistry(Builder builder, VersionCanonicalizer canonicalizer) {
        this.canonicalizer = canonicalizer;
        this.config = builder.config;

        Map<MagicIdentifier, Set<String>> byMagic = new LinkedHashMap<>();
        builder.versionsByMagic.forEach((magic, versions) ->
                byMagic.put(magic, Collections.unmodifiableSet(new LinkedHashSet<>(versions))));
        this.versionsByMagic = Collections.unmodifiableMap(byMagic);

        Map<String, List<MagicIdentifier>> byVersion = new HashMap<>();
        builder.magicsByVersion.forEach((version, magics) -> byVersion.put(version, List.copyOf(magics)));
        this.magicsByVersion = Map.copyOf(byVersion);

        this.versionByMagicInt = Map.copyOf(builder.versionByMagicInt);
        this.pypy3MagicInts = Collections.unmodifiableSet(new TreeSet<>(builder.pypy3MagicInts));
    }

    /**
     * Creates a builder that registers every version it sees as canonical in the given
     * canonicalizer builder.
     *
     * @param canonicalizer the canonicalizer being populated alongside this registry.
     * @param config        settings used for runtime resolution.
     * @return a new, empty builder.
     */
    public static Builder builder(VersionCanonicalizer.Builder canonicalizer, RegistryConfig config) {
        return new Builder(canonicalizer, config);
    }

    /**
     * Returns the magic for a version, after canonicalization.
     *
     * @param version any known spelling of the version.
     * @return the most recently registered magic of the canonical version.
     * @throws UnknownVersionException if the version cannot be canonicalized or has no magic.
     */
    public MagicIdentifier magicFor(String version) {
        List<MagicIdentifier> magics = magicsFor(version);
        return magics.get(magics.size() - 1);
    }

    /**
     * Returns every magic registered for a version, after canonicalization.
     *
     * @param version any known spelling of the version.
     * @return the magics in registration order, never empty.
     * @throws UnknownVersionException if the version cannot be canonicalized or has no magic.
     */
    public List<MagicIdentifier> magicsFor(String version) {
        String canonical = canonicalizer.canonicalize(version);
        List<MagicIdentifier> magics = magicsByVersion.get(canonical);
        if (magics == null) {
            throw new UnknownVersionException(version,
                    "Version '" + version + "' (canonical '" + canonical + "') has no registered magic");
        }
        return magics;
    }

    /**
     * Returns the canonical versions registered for a magic.
     *
     * @param magic the magic identifier.
     * @return the versions in registration order, never empty.
     * @throws UnknownMagicException if nothing is registered for the magic.
     */
    public Set<String> versionsFor(MagicIdentifier magic) {
        Set<String> versions = versionsByMagic.get(magic);
        if (versions == null) {
            throw new UnknownMagicException("No version registered for " + magic);
        }
        return versions;
    }

    /**
     * Returns the version most recently registered for a magic integer.
     *
     * @param magicInt the magic integer, e.g. 62211.
     * @return the canonical version, e.g. "2.7".
     * @throws UnknownMagicException if the integer was never registered.
     */
    public String versionForMagicInt(int magicInt) {
        String version = versionByMagicInt.get(magicInt);
        if (version == null) {
            throw new UnknownMagicException("No version registered for magic integer " + magicInt);
        }
        return version;
    }

    /**
     * Converts a magic integer to the numeric tuple of its version, e.g. 3350 to {@code (3, 5)}.
     *
     * @param magicInt the magic integer.
     * @return the version tuple.
     * @throws UnknownMagicException if the integer was never registered.
     */
    public List<Integer> versionTupleForMagicInt(int magicInt) {
        return canonicalizer.versionTuple(versionForMagicInt(magicInt));
    }

    /**
     * @return every registered magic identifier, in first-registration order.
     */
    public Set<MagicIdentifier> allMagics() {
        return versionsByMagic.keySet();
    }

    /**
     * Tells whether a magic integer denotes a PyPy 3 bytecode format.
     * <p>
     * The classification comes from the catalog, not from version spellings: some PyPy 3
     * formats are filed under plain version strings, and some were never bound to a version.
     *
     * @param magicInt the magic integer.
     * @return true if the integer is a PyPy 3 format.
     */
    public boolean isPyPy3(int magicInt) {
        return pypy3MagicInts.contains(magicInt);
    }

    /**
     * @return the magic integers classified as PyPy 3 formats, ascending.
     */
    public Set<Integer> pypy3MagicInts() {
        return pypy3MagicInts;
    }

    /**
     * Resolves the magic of a final release.
     *
     * @param versionComponents  numeric version components, e.g. {@code [3, 8, 5]}.
     * @param implementationName the implementation name, or {@code null} for CPython.
     * @return the magic for that runtime.
     * @throws UnresolvedRuntimeException if the runtime has no known magic.
     */
    public MagicIdentifier currentRuntimeMagic(List<Integer> versionComponents, String implementationName) {
        return currentRuntimeMagic(new RuntimeInfo(versionComponents, ReleaseLevel.FINAL, 0, implementationName));
    }

    /**
     * Resolves the magic of the runtime reported by a probe.
     *
     * @param probe the runtime probe.
     * @return the magic for that runtime.
     * @throws UnresolvedRuntimeException if the runtime has no known magic.
     */
    public MagicIdentifier currentRuntimeMagic(IRuntimeProbe probe) {
        return currentRuntimeMagic(probe.probe());
    }

    /**
     * Resolves the magic of a runtime.
     *
     * @param runtime the runtime's identity.
     * @return the magic for that runtime.
     * @throws UnresolvedRuntimeException if the version string built from {@code runtime}
     *                                    cannot be canonicalized or has no magic.
     */
    public MagicIdentifier currentRuntimeMagic(RuntimeInfo runtime) {
        String version = versionStringFor(runtime);
        try {
            return magicFor(version);
        } catch (UnknownVersionException e) {
            throw new UnresolvedRuntimeException("Cannot resolve a bytecode magic for runtime "
                    + runtime.implementationName() + " " + version, e);
        }
    }

    /**
     * Builds the catalog spelling of a runtime's version: the components joined by dots, the
     * release level and serial for pre-releases, then the implementation suffix.
     *
     * @param runtime the runtime's identity.
     * @return the version string, e.g. "3.8.0candidate1" or "3.7.13pypy".
     */
    public String versionStringFor(RuntimeInfo runtime) {
        StringBuilder sb = new StringBuilder(runtime.versionComponents().stream()
                .map(String::valueOf)
                .collect(Collectors.joining(".")));
        if (runtime.releaseLevel() != ReleaseLevel.FINAL) {
            sb.append(runtime.releaseLevel().tag()).append(runtime.serial());
        }
        config.suffixFor(runtime.implementationName()).ifPresent(sb::append);
        return sb.toString();
    }

    /**
     * Collects magic registrations during the initialization phase.
     * <p>
     * Not thread-safe; used by a single initializing thread.
     */
    public static final class Builder {

        private static final Logger log = LoggerFactory.getLogger(Builder.class);

        private final VersionCanonicalizer.Builder canonicalizer;
        private final RegistryConfig config;
        private final Map<MagicIdentifier, Set<String>> versionsByMagic = new LinkedHashMap<>();
        private final Map<String, List<MagicIdentifier>> magicsByVersion = new HashMap<>();
        private final Map<Integer, String> versionByMagicInt = new HashMap<>();
        private final Set<Integer> pypy3MagicInts = new HashSet<>();
        private boolean built;

        private Builder(VersionCanonicalizer.Builder canonicalizer, RegistryConfig config) {
            this.canonicalizer = canonicalizer;
            this.config = config;
        }

        /**
         * Registers a magic integer for a version and makes the version canonical.
         * <p>
         * Registering the same pair twice leaves one reverse entry and moves the magic to the
         * most-recent position for {@link MagicRegistry#magicFor(String)}.
         *
         * @param magicInt the magic integer.
         * @param version  the canonical version it denotes.
         * @return this builder.
         * @throws IllegalArgumentException if the integer is out of range or the version is blank
         *                                  or already an alias.
         */
        public Builder register(int magicInt, String version) {
            if (built) {
                throw new IllegalStateException("Magic registry has already been built");
            }
            MagicIdentifier magic = MagicIdentifier.fromInt(magicInt);
            canonicalizer.registerCanonical(version);

            versionsByMagic.computeIfAbsent(magic, k -> new LinkedHashSet<>()).add(version);

            List<MagicIdentifier> magics = magicsByVersion.computeIfAbsent(version, k -> new ArrayList<>());
            if (!magics.isEmpty() && !magics.contains(magic)) {
                log.debug("Version '{}' gets additional magic {} (previous: {})", version, magicInt, magics);
            }
            magics.remove(magic);
            magics.add(magic);

            String previous = versionByMagicInt.put(magicInt, version);
            if (previous != null && !previous.equals(version)) {
                log.debug("Magic {} now denotes '{}' (previously '{}')", magicInt, version, previous);
            }
            return this;
        }

        /**
         * Classifies a magic integer as a PyPy 3 format. The integer need not be registered
         * for any version.
         *
         * @param magicInt the magic integer.
         * @return this builder.
         * @throws IllegalArgumentException if the integer is out of range.
         */
        public Builder markPyPy3(int magicInt) {
            if (built) {
                throw new IllegalStateException("Magic registry has already been built");
            }
            MagicIdentifier.fromInt(magicInt);
            pypy3MagicInts.add(magicInt);
            return this;
        }

        /**
         * Freezes the registrations.
         *
         * @param frozen the canonicalizer built from the builder passed at construction.
         * @return the immutable registry.
         * @throws IllegalStateException if called twice.
         */
        public MagicRegistry build(VersionCanonicalizer frozen) {
            if (built) {
                throw new IllegalStateException("Magic registry has already been built");
            }
            built = true;
            return new MagicRegistry(this, frozen);
        }
    }
}
