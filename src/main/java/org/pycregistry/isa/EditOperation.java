package org.pycregistry.isa;

import java.util.Set;

/**
 * One step in deriving a version's opcode table from its parent's table.
 * <p>
 * Edits are replayed in order; each is validated against the table as it stands after all
 * previous edits of the same version.
 */
public sealed interface EditOperation
        permits EditOperation.Define, EditOperation.Remove, EditOperation.Alias, EditOperation.Redefine {

    /**
     * @return the opcode name the edit targets.
     */
    String name();

    /**
     * @return the opcode code the edit targets.
     */
    int code();

    /**
     * Adds a new opcode. Both name and code must be free.
     */
    record Define(String name, int code, Set<OpcodeFlag> flags) implements EditOperation {
        public Define {
            flags = Set.copyOf(flags);
        }
    }

    /**
     * Removes an opcode. The name must currently be bound to exactly this code.
     */
    record Remove(String name, int code) implements EditOperation {
    }

    /**
     * Adds a pseudo opcode: same rules as {@link Define}, but the result is excluded from
     * {@link OpcodeTable#definedOps()}.
     */
    record Alias(String name, int code, Set<OpcodeFlag> flags) implements EditOperation {
        public Alias {
            flags = Set.copyOf(flags);
        }
    }

    /**
     * Intentionally replaces whatever opcode currently occupies {@code code}. The new name must
     * not be bound to a different code.
     */
    record Redefine(String name, int code, Set<OpcodeFlag> flags) implements EditOperation {
        public Redefine {
            flags = Set.copyOf(flags);
        }
    }

    static EditOperation define(String name, int code, OpcodeFlag... flags) {
        return new Define(name, code, Set.of(flags));
    }

    static EditOperation remove(String name, int code) {
        return new Remove(name, code);
    }

    static EditOperation alias(String name, int code, OpcodeFlag... flags) {
        return new Alias(name, code, Set.of(flags));
    }

    static EditOperation redefine(String name, int code, OpcodeFlag... flags) {
        return new Redefine(name, code, Set.of(flags));
    }
}
