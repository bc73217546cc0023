package org.pycregistry.api;

/**
 * Thrown when the live runtime's version and implementation cannot be mapped to a magic
 * identifier.
 */
public class UnresolvedRuntimeException extends BytecodeRegistryException {

    /**
     * @param message Description of the failure
     * @param cause The lookup failure that prevented resolution
     */
    public UnresolvedRuntimeException(String message, Throwable cause) {
        super(message, cause);
    }
}
