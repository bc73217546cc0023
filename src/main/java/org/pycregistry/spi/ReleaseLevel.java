package org.pycregistry.spi;

/**
 * Release level reported by a runtime, in the spelling used by catalog version strings.
 */
public enum ReleaseLevel {
    ALPHA("alpha"),
    BETA("beta"),
    CANDIDATE("candidate"),
    FINAL("final");

    private final String tag;

    ReleaseLevel(String tag) {
        this.tag = tag;
    }

    /**
     * @return the lower-case tag, e.g. {@code "candidate"}.
     */
    public String tag() {
        return tag;
    }
}
