package org.pycregistry.spi;

/**
 * Supplies the identity of the runtime whose bytecode format should be resolved.
 * <p>
 * Implementations live outside this library (they typically query the interpreter a tool is
 * attached to).
 */
@FunctionalInterface
public interface IRuntimeProbe {

    /**
     * @return the runtime's version, release level and implementation name.
     */
    RuntimeInfo probe();
}
