package org.pycregistry.api;

/**
 * Thrown when an opcode name or code is absent from a version's table.
 */
public class UnknownOpcodeException extends BytecodeRegistryException {

    /**
     * @param message Description of the failure
     */
    public UnknownOpcodeException(String message) {
        super(message);
    }
}
