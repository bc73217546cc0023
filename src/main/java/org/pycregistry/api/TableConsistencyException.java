package org.pycregistry.api;

/**
 * Thrown while deriving an opcode table when an edit would remove an opcode that is not
 * present, define a name or code that is already taken, or derive from a table that was
 * never published.
 * <p>
 * The offending version is never published, and neither is anything derived from it.
 */
public class TableConsistencyException extends BytecodeRegistryException {

    private final String version;

    /**
     * @param version The version whose table failed to build
     * @param message Description of the inconsistency
     */
    public TableConsistencyException(String version, String message) {
        super("Opcode table for version '" + version + "': " + message);
        this.version = version;
    }

    /**
     * @return the version whose table failed to build.
     */
    public String getVersion() {
        return version;
    }
}
