package org.pycregistry.isa;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * One named opcode of a table.
 *
 * @param name   the mnemonic, unique within its table.
 * @param code   the numeric opcode (0-255), unique within its table.
 * @param flags  the operand categories.
 * @param pseudo true for semantics-only markers introduced by {@link EditOperation.Alias},
 *               which do not occur in real bytecode.
 */
public record OpcodeDefinition(String name, int code, Set<OpcodeFlag> flags, boolean pseudo) {

    /** Largest valid opcode. */
    public static final int MAX_CODE = 255;

    public OpcodeDefinition {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Opcode name must not be blank");
        }
        if (code < 0 || code > MAX_CODE) {
            throw new IllegalArgumentException(
                    "Opcode code must be between 0 and " + MAX_CODE + ", got: " + code + " for " + name);
        }
        flags = Collections.unmodifiableSet(copyFlags(flags));
    }

    /**
     * Creates a regular (non-pseudo) opcode.
     *
     * @param name  the mnemonic.
     * @param code  the numeric opcode.
     * @param flags the operand categories.
     * @return the definition.
     */
    public static OpcodeDefinition of(String name, int code, OpcodeFlag... flags) {
        return new OpcodeDefinition(name, code, Set.of(flags), false);
    }

    /**
     * @param flag an operand category.
     * @return true if this opcode carries the category.
     */
    public boolean has(OpcodeFlag flag) {
        return flags.contains(flag);
    }

    static EnumSet<OpcodeFlag> copyFlags(Collection<OpcodeFlag> flags) {
        EnumSet<OpcodeFlag> copy = EnumSet.noneOf(OpcodeFlag.class);
        if (flags != null) {
            copy.addAll(flags);
        }
        return copy;
    }
}
