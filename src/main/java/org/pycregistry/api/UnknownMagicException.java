package org.pycregistry.api;

/**
 * Thrown when a magic identifier has no registered version.
 */
public class UnknownMagicException extends BytecodeRegistryException {

    /**
     * @param message Description of the failure
     */
    public UnknownMagicException(String message) {
        super(message);
    }
}
