package org.pycregistry.api;

/**
 * Base type for every failure raised while building or querying the bytecode registry.
 */
public abstract class BytecodeRegistryException extends RuntimeException {

    /**
     * @param message Description of the failure
     */
    protected BytecodeRegistryException(String message) {
        super(message);
    }

    /**
     * @param message Description of the failure
     * @param cause The underlying exception that caused the failure
     */
    protected BytecodeRegistryException(String message, Throwable cause) {
        super(message, cause);
    }
}
