package org.pycregistry.api;

/**
 * Thrown when a version string has no canonical mapping, or when a version has no published
 * opcode table.
 */
public class UnknownVersionException extends BytecodeRegistryException {

    private final String version;

    /**
     * @param version The version string that could not be resolved
     * @param message Description of the failure
     */
    public UnknownVersionException(String version, String message) {
        super(message);
        this.version = version;
    }

    /**
     * Creates the standard "unknown version" failure for the given version string.
     *
     * @param version The version string that could not be resolved
     */
    public UnknownVersionException(String version) {
        this(version, "Unknown version: '" + version + "'");
    }

    /**
     * @return the version string that could not be resolved.
     */
    public String getVersion() {
        return version;
    }
}
