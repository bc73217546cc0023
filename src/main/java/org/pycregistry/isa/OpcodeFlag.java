package org.pycregistry.isa;

/**
 * Operand categories an opcode can carry. A disassembler uses these to decide how to
 * interpret an instruction's argument.
 */
public enum OpcodeFlag {

    /** Argument is a jump offset relative to the next instruction. */
    JUMP_RELATIVE,

    /** Argument is an absolute jump target. */
    JUMP_ABSOLUTE,

    /** Argument indexes the constant pool. */
    CONSTANT,

    /** Argument indexes the local variable names. */
    LOCAL,

    /** Argument indexes the cell and free variables. */
    FREE,

    /** Argument indexes the global/attribute names. */
    NAME,

    /** Argument indexes the comparison operator table. */
    COMPARE,

    /** Instruction takes no argument. */
    NO_ARGUMENT
}
