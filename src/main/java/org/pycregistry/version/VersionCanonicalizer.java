package org.pycregistry.version;

import org.pycregistry.api.UnknownVersionException;
import org.pycregistry.config.RegistryConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maps arbitrary version spellings to the canonical version of their compatibility class.
 * <p>
 * Every canonical version maps to itself, and every alias maps directly to a canonical
 * version (no chains). When a string has no literal entry, a structural fallback strips a
 * known implementation suffix, reduces the version to its numeric components and retries the
 * literal table. A pre-release tag is kept through the reduction (spelled out or abbreviated,
 * e.g. {@code alpha1} or {@code a1}), so an unlisted pre-release never resolves to a final
 * release.
 * <p>
 * Instances are immutable and safe for concurrent use. They are produced by {@link Builder}.
 */
public final class VersionCanonicalizer {

    private static final Logger log = LoggerFactory.getLogger(VersionCanonicalizer.class);

    private static final Pattern STRUCTURE = Pattern.compile(
            "^(\\d+)\\.(\\d+)(?:\\.(\\d+))?((?:alpha|beta|candidate|rc|a|b|c)\\d+)?(.*)$");
    private static final Pattern LONG_TAG = Pattern.compile("^(alpha|beta|candidate)(\\d+)$");
    private static final Pattern LETTER = Pattern.compile("[A-Za-z]");
    private static final Pattern TRIPLE = Pattern.compile("^(\\d+)\\.(\\d+)\\.(\\d+)");
    private static final Pattern PAIR = Pattern.compile("^(\\d+)\\.(\\d+)");

    private final Map<String, String> canonicalByVersion;
    private final Set<String> canonicalVersions;
    private final List<String> variantSuffixes;
    private final boolean crossImplementationFallback;

    private VersionCanonicalizer(Builder builder) {
        this.canonicalByVersion = Map.copyOf(builder.canonicalByVersion);
        this.canonicalVersions = Collections.unmodifiableSet(new LinkedHashSet<>(builder.canonicalVersions));
        this.variantSuffixes = builder.config.variantSuffixes();
        this.crossImplementationFallback = builder.config.crossImplementationFallback();
    }

    /**
     * Creates a builder using the given resolution settings.
     *
     * @param config the settings controlling the structural fallback.
     * @return a new, empty builder.
     */
    public static Builder builder(RegistryConfig config) {
        return new Builder(config);
    }

    /**
     * Resolves a version string to its canonical version.
     *
     * @param version any registered spelling, or one the structural fallback can reduce.
     * @return the canonical version; canonical versions map to themselves.
     * @throws UnknownVersionException  if no mapping exists.
     * @throws IllegalArgumentException if {@code version} is null.
     */
    public String canonicalize(String version) {
        requireVersion(version);
        String exact = canonicalByVersion.get(version);
        if (exact != null) {
            return exact;
        }
        for (String candidate : fallbackCandidates(version)) {
            String canonical = canonicalByVersion.get(candidate);
            if (canonical != null) {
                log.debug("Resolved version '{}' via '{}' to canonical '{}'", version, candidate, canonical);
                return canonical;
            }
        }
        throw new UnknownVersionException(version);
    }

    /**
     * @param version a version string.
     * @return true if the string is itself a canonical version.
     */
    public boolean isCanonical(String version) {
        return canonicalVersions.contains(version);
    }

    /**
     * @param version a version string.
     * @return true if {@link #canonicalize(String)} would succeed.
     */
    public boolean isKnown(String version) {
        if (version == null) {
            return false;
        }
        try {
            canonicalize(version);
            return true;
        } catch (UnknownVersionException e) {
            return false;
        }
    }

    /**
     * @return every literal version string this canonicalizer knows, canonical versions and aliases alike.
     */
    public Set<String> allKnownVersions() {
        return canonicalByVersion.keySet();
    }

    /**
     * @return the canonical versions, in registration order.
     */
    public Set<String> canonicalVersions() {
        return canonicalVersions;
    }

    /**
     * Converts a known version string to its numeric tuple, e.g. {@code (3, 6, 1)} or {@code (2, 7)}.
     * <p>
     * An implementation suffix is ignored. Three components are returned when the string starts
     * with three numeric components, two otherwise; pre-release tags never contribute.
     *
     * @param version a version string that is literally registered, with or without its suffix.
     * @return the numeric components.
     * @throws UnknownVersionException  if neither the string nor its unsuffixed form is registered.
     * @throws IllegalArgumentException if {@code version} is null.
     */
    public List<Integer> versionTuple(String version) {
        requireVersion(version);
        String base = stripSuffix(version);
        if (!canonicalByVersion.containsKey(version) && !canonicalByVersion.containsKey(base)) {
            throw new UnknownVersionException(version,
                    "Can't find a valid version tuple for version '" + version + "'");
        }
        Matcher triple = TRIPLE.matcher(base);
        if (triple.find()) {
            return List.of(Integer.parseInt(triple.group(1)),
                    Integer.parseInt(triple.group(2)),
                    Integer.parseInt(triple.group(3)));
        }
        Matcher pair = PAIR.matcher(base);
        if (pair.find()) {
            return List.of(Integer.parseInt(pair.group(1)), Integer.parseInt(pair.group(2)));
        }
        throw new UnknownVersionException(version,
                "Version '" + version + "' has no numeric major.minor prefix");
    }

    private static void requireVersion(String version) {
        if (version == null) {
            throw new IllegalArgumentException("Version must not be null");
        }
    }

    private String stripSuffix(String version) {
        for (String suffix : variantSuffixes) {
            if (version.endsWith(suffix) && version.length() > suffix.length()) {
                return version.substring(0, version.length() - suffix.length());
            }
        }
        return version;
    }

    private List<String> fallbackCandidates(String version) {
        String base = stripSuffix(version);
        String suffix = version.substring(base.length());

        Matcher m = STRUCTURE.matcher(base);
        // an unrecognized trailing marker names some other build; never reduce it away
        if (!m.matches() || LETTER.matcher(m.group(5)).find()) {
            return List.of();
        }
        String majorMinor = m.group(1) + "." + m.group(2);
        String micro = m.group(3);
        String tag = m.group(4);

        // a pre-release keeps its tag: it never reduces to a final release's format
        List<String> tags = new ArrayList<>();
        if (tag != null) {
            tags.add(tag);
            String shortTag = shortTag(tag);
            if (!shortTag.equals(tag)) {
                tags.add(shortTag);
            }
        } else {
            tags.add("");
        }

        List<String> reduced = new ArrayList<>();
        if (micro != null) {
            for (String t : tags) {
                reduced.add(majorMinor + "." + micro + t);
            }
        }
        for (String t : tags) {
            reduced.add(majorMinor + t);
        }

        Set<String> candidates = new LinkedHashSet<>();
        for (String r : reduced) {
            candidates.add(r + suffix);
        }
        if (!suffix.isEmpty() && crossImplementationFallback) {
            candidates.add(base);
            candidates.addAll(reduced);
        }
        candidates.remove(version);
        return new ArrayList<>(candidates);
    }

    private static String shortTag(String tag) {
        Matcher m = LONG_TAG.matcher(tag);
        if (!m.matches()) {
            return tag;
        }
        String level = switch (m.group(1)) {
            case "alpha" -> "a";
            case "beta" -> "b";
            default -> "rc";
        };
        return level + m.group(2);
    }

    /**
     * Collects canonical versions and aliases during the initialization phase.
     * <p>
     * Not thread-safe; a builder is used by a single initializing thread and discarded after
     * {@link #build()}.
     */
    public static final class Builder {

        private final RegistryConfig config;
        private final Map<String, String> canonicalByVersion = new HashMap<>();
        private final Set<String> canonicalVersions = new LinkedHashSet<>();
        private boolean built;

        private Builder(RegistryConfig config) {
            this.config = config;
        }

        /**
         * Registers a canonical version. Registering the same version twice is a no-op.
         *
         * @param version the canonical version string.
         * @return this builder.
         * @throws IllegalArgumentException if the version is blank or already bound as an alias.
         */
        public Builder registerCanonical(String version) {
            checkNotBuilt();
            if (version == null || version.isBlank()) {
                throw new IllegalArgumentException("Canonical version must not be blank");
            }
            String existing = canonicalByVersion.get(version);
            if (existing != null && !existing.equals(version)) {
                throw new IllegalArgumentException("Version '" + version
                        + "' is already an alias of '" + existing + "' and cannot become canonical");
            }
            canonicalByVersion.put(version, version);
            canonicalVersions.add(version);
            return this;
        }

        /**
         * Binds every raw version string to a canonical target.
         * <p>
         * Binding a string to the target it already has, or a canonical version to itself, is a
         * no-op. Rebinding to a different target is rejected so that catalog order never
         * matters.
         *
         * @param rawVersions     the release spellings to bind.
         * @param canonicalTarget an already registered canonical version.
         * @return this builder.
         * @throws UnknownVersionException  if the target is not a registered canonical version.
         * @throws IllegalArgumentException if a raw string is already bound to a different version.
         */
        public Builder registerAlias(List<String> rawVersions, String canonicalTarget) {
            checkNotBuilt();
            if (!canonicalVersions.contains(canonicalTarget)) {
                throw new UnknownVersionException(canonicalTarget,
                        "Alias target '" + canonicalTarget + "' is not a registered canonical version");
            }
            Map<String, String> pending = new LinkedHashMap<>();
            for (String raw : rawVersions) {
                String existing = canonicalByVersion.get(raw);
                if (existing != null && !existing.equals(canonicalTarget)) {
                    throw new IllegalArgumentException("Version '" + raw + "' is already bound to '"
                            + existing + "', cannot alias it to '" + canonicalTarget + "'");
                }
                pending.put(raw, canonicalTarget);
            }
            canonicalByVersion.putAll(pending);
            return this;
        }

        /**
         * @param version a version string.
         * @return true if the version has been registered as canonical.
         */
        public boolean isCanonical(String version) {
            return canonicalVersions.contains(version);
        }

        /**
         * Freezes the collected mappings.
         *
         * @return the immutable canonicalizer.
         * @throws IllegalStateException if called twice.
         */
        public VersionCanonicalizer build() {
            checkNotBuilt();
            built = true;
            return new VersionCanonicalizer(this);
        }

        private void checkNotBuilt() {
            if (built) {
                throw new IllegalStateException("Canonicalizer has already been built");
            }
        }
    }
}
