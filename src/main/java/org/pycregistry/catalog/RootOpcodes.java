package org.pycregistry.catalog;

import org.pycregistry.isa.OpcodeDefinition;
import org.pycregistry.isa.OpcodeFlag;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.pycregistry.isa.OpcodeFlag.COMPARE;
import static org.pycregistry.isa.OpcodeFlag.CONSTANT;
import static org.pycregistry.isa.OpcodeFlag.FREE;
import static org.pycregistry.isa.OpcodeFlag.JUMP_ABSOLUTE;
import static org.pycregistry.isa.OpcodeFlag.JUMP_RELATIVE;
import static org.pycregistry.isa.OpcodeFlag.LOCAL;
import static org.pycregistry.isa.OpcodeFlag.NAME;
import static org.pycregistry.isa.OpcodeFlag.NO_ARGUMENT;

/**
 * Literal opcode catalogs of the versions every other table is derived from.
 *
 * <p>Opcodes below {@value #HAVE_ARGUMENT} take no argument.
 */
final class RootOpcodes {

    /** First opcode that takes an argument, in every root format. */
    static final int HAVE_ARGUMENT = 90;

    private final List<OpcodeDefinition> ops = new ArrayList<>();

    private RootOpcodes() {
    }

    /**
     * @return the 2.7 opcode set.
     */
    static List<OpcodeDefinition> python27() {
        RootOpcodes t = new RootOpcodes();
        t.plain("STOP_CODE", 0);
        t.plain("POP_TOP", 1);
        t.plain("ROT_TWO", 2);
        t.plain("ROT_THREE", 3);
        t.plain("DUP_TOP", 4);
        t.plain("ROT_FOUR", 5);
        t.plain("NOP", 9);
        t.plain("UNARY_POSITIVE", 10);
        t.plain("UNARY_NEGATIVE", 11);
        t.plain("UNARY_NOT", 12);
        t.plain("UNARY_CONVERT", 13);
        t.plain("UNARY_INVERT", 15);
        t.plain("BINARY_POWER", 19);
        t.plain("BINARY_MULTIPLY", 20);
        t.plain("BINARY_DIVIDE", 21);
        t.plain("BINARY_MODULO", 22);
        t.plain("BINARY_ADD", 23);
        t.plain("BINARY_SUBTRACT", 24);
        t.plain("BINARY_SUBSCR", 25);
        t.plain("BINARY_FLOOR_DIVIDE", 26);
        t.plain("BINARY_TRUE_DIVIDE", 27);
        t.plain("INPLACE_FLOOR_DIVIDE", 28);
        t.plain("INPLACE_TRUE_DIVIDE", 29);
        t.plain("SLICE+0", 30);
        t.plain("SLICE+1", 31);
        t.plain("SLICE+2", 32);
        t.plain("SLICE+3", 33);
        t.plain("STORE_SLICE+0", 40);
        t.plain("STORE_SLICE+1", 41);
        t.plain("STORE_SLICE+2", 42);
        t.plain("STORE_SLICE+3", 43);
        t.plain("DELETE_SLICE+0", 50);
        t.plain("DELETE_SLICE+1", 51);
        t.plain("DELETE_SLICE+2", 52);
        t.plain("DELETE_SLICE+3", 53);
        t.plain("STORE_MAP", 54);
        t.plain("INPLACE_ADD", 55);
        t.plain("INPLACE_SUBTRACT", 56);
        t.plain("INPLACE_MULTIPLY", 57);
        t.plain("INPLACE_DIVIDE", 58);
        t.plain("INPLACE_MODULO", 59);
        t.plain("STORE_SUBSCR", 60);
        t.plain("DELETE_SUBSCR", 61);
        t.plain("BINARY_LSHIFT", 62);
        t.plain("BINARY_RSHIFT", 63);
        t.plain("BINARY_AND", 64);
        t.plain("BINARY_XOR", 65);
        t.plain("BINARY_OR", 66);
        t.plain("INPLACE_POWER", 67);
        t.plain("GET_ITER", 68);
        t.plain("PRINT_EXPR", 70);
        t.plain("PRINT_ITEM", 71);
        t.plain("PRINT_NEWLINE", 72);
        t.plain("PRINT_ITEM_TO", 73);
        t.plain("PRINT_NEWLINE_TO", 74);
        t.plain("INPLACE_LSHIFT", 75);
        t.plain("INPLACE_RSHIFT", 76);
        t.plain("INPLACE_AND", 77);
        t.plain("INPLACE_XOR", 78);
        t.plain("INPLACE_OR", 79);
        t.plain("BREAK_LOOP", 80);
        t.plain("WITH_CLEANUP", 81);
        t.plain("LOAD_LOCALS", 82);
        t.plain("RETURN_VALUE", 83);
        t.plain("IMPORT_STAR", 84);
        t.plain("EXEC_STMT", 85);
        t.plain("YIELD_VALUE", 86);
        t.plain("POP_BLOCK", 87);
        t.plain("END_FINALLY", 88);
        t.plain("BUILD_CLASS", 89);

        t.op("STORE_NAME", 90, NAME);
        t.op("DELETE_NAME", 91, NAME);
        t.op("UNPACK_SEQUENCE", 92);
        t.op("FOR_ITER", 93, JUMP_RELATIVE);
        t.op("LIST_APPEND", 94);
        t.op("STORE_ATTR", 95, NAME);
        t.op("DELETE_ATTR", 96, NAME);
        t.op("STORE_GLOBAL", 97, NAME);
        t.op("DELETE_GLOBAL", 98, NAME);
        t.op("DUP_TOPX", 99);
        t.op("LOAD_CONST", 100, CONSTANT);
        t.op("LOAD_NAME", 101, NAME);
        t.op("BUILD_TUPLE", 102);
        t.op("BUILD_LIST", 103);
        t.op("BUILD_SET", 104);
        t.op("BUILD_MAP", 105);
        t.op("LOAD_ATTR", 106, NAME);
        t.op("COMPARE_OP", 107, COMPARE);
        t.op("IMPORT_NAME", 108, NAME);
        t.op("IMPORT_FROM", 109, NAME);
        t.op("JUMP_FORWARD", 110, JUMP_RELATIVE);
        t.op("JUMP_IF_FALSE_OR_POP", 111, JUMP_ABSOLUTE);
        t.op("JUMP_IF_TRUE_OR_POP", 112, JUMP_ABSOLUTE);
        t.op("JUMP_ABSOLUTE", 113, JUMP_ABSOLUTE);
        t.op("POP_JUMP_IF_FALSE", 114, JUMP_ABSOLUTE);
        t.op("POP_JUMP_IF_TRUE", 115, JUMP_ABSOLUTE);
        t.op("LOAD_GLOBAL", 116, NAME);
        t.op("CONTINUE_LOOP", 119, JUMP_ABSOLUTE);
        t.op("SETUP_LOOP", 120, JUMP_RELATIVE);
        t.op("SETUP_EXCEPT", 121, JUMP_RELATIVE);
        t.op("SETUP_FINALLY", 122, JUMP_RELATIVE);
        t.op("LOAD_FAST", 124, LOCAL);
        t.op("STORE_FAST", 125, LOCAL);
        t.op("DELETE_FAST", 126, LOCAL);
        t.op("RAISE_VARARGS", 130);
        t.op("CALL_FUNCTION", 131);
        t.op("MAKE_FUNCTION", 132);
        t.op("BUILD_SLICE", 133);
        t.op("MAKE_CLOSURE", 134);
        t.op("LOAD_CLOSURE", 135, FREE);
        t.op("LOAD_DEREF", 136, FREE);
        t.op("STORE_DEREF", 137, FREE);
        t.op("CALL_FUNCTION_VAR", 140);
        t.op("CALL_FUNCTION_KW", 141);
        t.op("CALL_FUNCTION_VAR_KW", 142);
        t.op("SETUP_WITH", 143, JUMP_RELATIVE);
        t.op("EXTENDED_ARG", 145);
        t.op("SET_ADD", 146);
        t.op("MAP_ADD", 147);
        return t.result();
    }

    /**
     * @return the 3.2 opcode set, the base of every 3.x table.
     */
    static List<OpcodeDefinition> python32() {
        RootOpcodes t = new RootOpcodes();
        t.plain("STOP_CODE", 0);
        t.plain("POP_TOP", 1);
        t.plain("ROT_TWO", 2);
        t.plain("ROT_THREE", 3);
        t.plain("DUP_TOP", 4);
        t.plain("DUP_TOP_TWO", 5);
        t.plain("NOP", 9);
        t.plain("UNARY_POSITIVE", 10);
        t.plain("UNARY_NEGATIVE", 11);
        t.plain("UNARY_NOT", 12);
        t.plain("UNARY_INVERT", 15);
        t.plain("BINARY_POWER", 19);
        t.plain("BINARY_MULTIPLY", 20);
        t.plain("BINARY_MODULO", 22);
        t.plain("BINARY_ADD", 23);
        t.plain("BINARY_SUBTRACT", 24);
        t.plain("BINARY_SUBSCR", 25);
        t.plain("BINARY_FLOOR_DIVIDE", 26);
        t.plain("BINARY_TRUE_DIVIDE", 27);
        t.plain("INPLACE_FLOOR_DIVIDE", 28);
        t.plain("INPLACE_TRUE_DIVIDE", 29);
        t.plain("STORE_MAP", 54);
        t.plain("INPLACE_ADD", 55);
        t.plain("INPLACE_SUBTRACT", 56);
        t.plain("INPLACE_MULTIPLY", 57);
        t.plain("INPLACE_MODULO", 59);
        t.plain("STORE_SUBSCR", 60);
        t.plain("DELETE_SUBSCR", 61);
        t.plain("BINARY_LSHIFT", 62);
        t.plain("BINARY_RSHIFT", 63);
        t.plain("BINARY_AND", 64);
        t.plain("BINARY_XOR", 65);
        t.plain("BINARY_OR", 66);
        t.plain("INPLACE_POWER", 67);
        t.plain("GET_ITER", 68);
        t.plain("STORE_LOCALS", 69);
        t.plain("PRINT_EXPR", 70);
        t.plain("LOAD_BUILD_CLASS", 71);
        t.plain("INPLACE_LSHIFT", 75);
        t.plain("INPLACE_RSHIFT", 76);
        t.plain("INPLACE_AND", 77);
        t.plain("INPLACE_XOR", 78);
        t.plain("INPLACE_OR", 79);
        t.plain("BREAK_LOOP", 80);
        t.plain("WITH_CLEANUP", 81);
        t.plain("RETURN_VALUE", 83);
        t.plain("IMPORT_STAR", 84);
        t.plain("YIELD_VALUE", 86);
        t.plain("POP_BLOCK", 87);
        t.plain("END_FINALLY", 88);
        t.plain("POP_EXCEPT", 89);

        t.op("STORE_NAME", 90, NAME);
        t.op("DELETE_NAME", 91, NAME);
        t.op("UNPACK_SEQUENCE", 92);
        t.op("FOR_ITER", 93, JUMP_RELATIVE);
        t.op("UNPACK_EX", 94);
        t.op("STORE_ATTR", 95, NAME);
        t.op("DELETE_ATTR", 96, NAME);
        t.op("STORE_GLOBAL", 97, NAME);
        t.op("DELETE_GLOBAL", 98, NAME);
        t.op("LOAD_CONST", 100, CONSTANT);
        t.op("LOAD_NAME", 101, NAME);
        t.op("BUILD_TUPLE", 102);
        t.op("BUILD_LIST", 103);
        t.op("BUILD_SET", 104);
        t.op("BUILD_MAP", 105);
        t.op("LOAD_ATTR", 106, NAME);
        t.op("COMPARE_OP", 107, COMPARE);
        t.op("IMPORT_NAME", 108, NAME);
        t.op("IMPORT_FROM", 109, NAME);
        t.op("JUMP_FORWARD", 110, JUMP_RELATIVE);
        t.op("JUMP_IF_FALSE_OR_POP", 111, JUMP_ABSOLUTE);
        t.op("JUMP_IF_TRUE_OR_POP", 112, JUMP_ABSOLUTE);
        t.op("JUMP_ABSOLUTE", 113, JUMP_ABSOLUTE);
        t.op("POP_JUMP_IF_FALSE", 114, JUMP_ABSOLUTE);
        t.op("POP_JUMP_IF_TRUE", 115, JUMP_ABSOLUTE);
        t.op("LOAD_GLOBAL", 116, NAME);
        t.op("CONTINUE_LOOP", 119, JUMP_ABSOLUTE);
        t.op("SETUP_LOOP", 120, JUMP_RELATIVE);
        t.op("SETUP_EXCEPT", 121, JUMP_RELATIVE);
        t.op("SETUP_FINALLY", 122, JUMP_RELATIVE);
        t.op("LOAD_FAST", 124, LOCAL);
        t.op("STORE_FAST", 125, LOCAL);
        t.op("DELETE_FAST", 126, LOCAL);
        t.op("RAISE_VARARGS", 130);
        t.op("CALL_FUNCTION", 131);
        t.op("MAKE_FUNCTION", 132);
        t.op("BUILD_SLICE", 133);
        t.op("MAKE_CLOSURE", 134);
        t.op("LOAD_CLOSURE", 135, FREE);
        t.op("LOAD_DEREF", 136, FREE);
        t.op("STORE_DEREF", 137, FREE);
        t.op("DELETE_DEREF", 138, FREE);
        t.op("CALL_FUNCTION_VAR", 140);
        t.op("CALL_FUNCTION_KW", 141);
        t.op("CALL_FUNCTION_VAR_KW", 142);
        t.op("SETUP_WITH", 143, JUMP_RELATIVE);
        t.op("EXTENDED_ARG", 144);
        t.op("LIST_APPEND", 145);
        t.op("SET_ADD", 146);
        t.op("MAP_ADD", 147);
        return t.result();
    }

    private void plain(String name, int code) {
        if (code >= HAVE_ARGUMENT) {
            throw new IllegalArgumentException(name + " takes an argument at code " + code);
        }
        ops.add(OpcodeDefinition.of(name, code, NO_ARGUMENT));
    }

    private void op(String name, int code, OpcodeFlag... flags) {
        ops.add(OpcodeDefinition.of(name, code, flags));
    }

    private List<OpcodeDefinition> result() {
        return Collections.unmodifiableList(ops);
    }
}
