package org.pycregistry.catalog;

import org.pycregistry.BytecodeRegistry;
import org.pycregistry.isa.EditOperation;

import java.util.List;

import static org.pycregistry.isa.EditOperation.define;
import static org.pycregistry.isa.EditOperation.redefine;
import static org.pycregistry.isa.EditOperation.remove;
import static org.pycregistry.isa.OpcodeFlag.FREE;
import static org.pycregistry.isa.OpcodeFlag.JUMP_RELATIVE;
import static org.pycregistry.isa.OpcodeFlag.NAME;
import static org.pycregistry.isa.OpcodeFlag.NO_ARGUMENT;

/**
 * Per-version opcode changes, as a changelog of edits against the previous table.
 *
 * <p>Tables are defined parents-first. Append-only: a new version adds a new
 * {@code defineTable} call; existing edit lists are never changed.
 */
public final class OpcodeCatalog {

    private OpcodeCatalog() {
        // Catalog class - prevent instantiation
    }

    /**
     * Defines every opcode table of the catalog.
     *
     * @param registry the registry under construction; all catalog magics must be registered.
     */
    public static void defineAll(BytecodeRegistry.Builder registry) {
        // ==================== 2.x ====================
        registry.defineRoot("2.7", RootOpcodes.python27());

        registry.defineTable("2.7pypy", "2.7", List.of(
                define("LOOKUP_METHOD", 201, NAME),
                define("CALL_METHOD", 202),
                define("BUILD_LIST_FROM_ARG", 203),
                define("JUMP_IF_NOT_DEBUG", 204, JUMP_RELATIVE)));

        // ==================== 3.x ====================
        registry.defineRoot("3.2a2", RootOpcodes.python32());

        registry.defineTable("3.3a4", "3.2a2", List.of(
                remove("STOP_CODE", 0),
                define("YIELD_FROM", 72, NO_ARGUMENT)));

        registry.defineTable("3.4rc2", "3.3a4", List.of(
                remove("STORE_LOCALS", 69),
                define("LOAD_CLASSDEREF", 148, FREE)));

        registry.defineTable("3.5", "3.4rc2", py35Edits());

        // 3.5.2 changed BUILD_MAP_UNPACK_WITH_CALL semantics, not the opcode set
        registry.defineTable("3.5.2", "3.5", List.of());

        registry.defineTable("3.6rc1", "3.5.2", List.of(
                define("SETUP_ANNOTATIONS", 85, NO_ARGUMENT),
                define("STORE_ANNOTATION", 127, NAME),
                remove("MAKE_CLOSURE", 134),
                remove("CALL_FUNCTION_VAR", 140),
                // the keyword/star-args call form took over this code
                redefine("CALL_FUNCTION_EX", 142),
                define("FORMAT_VALUE", 155),
                define("BUILD_CONST_KEY_MAP", 156),
                define("BUILD_STRING", 157),
                define("BUILD_TUPLE_UNPACK_WITH_CALL", 158)));

        registry.defineTable("3.7.0", "3.6rc1", List.of(
                remove("STORE_ANNOTATION", 127),
                define("LOAD_METHOD", 160, NAME),
                define("CALL_METHOD", 161)));
    }

    private static List<EditOperation> py35Edits() {
        return List.of(
                remove("WITH_CLEANUP", 81),
                define("BINARY_MATRIX_MULTIPLY", 16, NO_ARGUMENT),
                define("INPLACE_MATRIX_MULTIPLY", 17, NO_ARGUMENT),
                define("GET_AITER", 50, NO_ARGUMENT),
                define("GET_ANEXT", 51, NO_ARGUMENT),
                define("BEFORE_ASYNC_WITH", 52, NO_ARGUMENT),
                define("GET_YIELD_FROM_ITER", 69, NO_ARGUMENT),
                define("GET_AWAITABLE", 73, NO_ARGUMENT),
                define("WITH_CLEANUP_START", 81, NO_ARGUMENT),
                define("WITH_CLEANUP_FINISH", 82, NO_ARGUMENT),
                define("BUILD_LIST_UNPACK", 149),
                define("BUILD_MAP_UNPACK", 150),
                define("BUILD_MAP_UNPACK_WITH_CALL", 151),
                define("BUILD_TUPLE_UNPACK", 152),
                define("BUILD_SET_UNPACK", 153),
                define("SETUP_ASYNC_WITH", 154, JUMP_RELATIVE),
                remove("STORE_MAP", 54));
    }
}
