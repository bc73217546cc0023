package org.pycregistry.catalog;

import org.pycregistry.BytecodeRegistry;

import java.util.Arrays;
import java.util.List;

/**
 * Every known bytecode magic number and the release spellings that share its format.
 *
 * <p>Append-only: old compiled files depend on historical entries, so entries are never
 * reordered or edited; new formats are added at the end of their section.
 *
 * <p>Where two sources disagree, a registered canonical version keeps its own binding and a
 * spelling is bound to one target only; PyPy release spellings always resolve to a PyPy
 * format.
 */
public final class MagicCatalog {

    private MagicCatalog() {
        // Catalog class - prevent instantiation
    }

    /**
     * Registers all magics, the PyPy 3 format classification, then all alias groups.
     *
     * @param registry the registry under construction.
     */
    public static void registerAll(BytecodeRegistry.Builder registry) {
        registerMagics(registry);
        classifyPyPy3(registry);
        registerAliases(registry);
    }

    static void registerMagics(BytecodeRegistry.Builder r) {
        // ==================== 1.x ====================
        r.registerMagic(39170, "1.0");
        r.registerMagic(39171, "1.1");      // also 1.2
        r.registerMagic(11913, "1.3");
        r.registerMagic(5892, "1.4");
        r.registerMagic(20121, "1.5");
        r.registerMagic(50428, "1.6");

        // ==================== 2.x ====================
        r.registerMagic(50823, "2.0");
        r.registerMagic(60202, "2.1");
        r.registerMagic(60717, "2.2");
        r.registerMagic(62011, "2.3a0");
        r.registerMagic(62021, "2.3a0");    // two distinct magics for the same release
        r.registerMagic(62041, "2.4a0");
        r.registerMagic(62051, "2.4a3");
        r.registerMagic(62061, "2.4b1");
        r.registerMagic(62071, "2.5a0");
        r.registerMagic(62081, "2.5a0");    // ast-branch
        r.registerMagic(62091, "2.5a0");    // with statement
        r.registerMagic(62092, "2.5a0");    // changed WITH_CLEANUP
        r.registerMagic(62101, "2.5b3");    // fix "for x, in ..."
        r.registerMagic(62111, "2.5b3");    // fix "x += yield"
        r.registerMagic(62121, "2.5c1");    // fix lnotab with for loops
        r.registerMagic(62131, "2.5c2");    // fix "for x, in ..." in listcomp/genexp
        r.registerMagic(62135, "2.5dropbox");
        r.registerMagic(62151, "2.6a0");    // peephole optimizations, STORE_MAP
        r.registerMagic(62161, "2.6a1");    // WITH_CLEANUP optimization
        r.registerMagic(62171, "2.7a0");    // list comprehension LIST_APPEND
        r.registerMagic(62181, "2.7a0+1");  // POP_JUMP_IF_FALSE, POP_JUMP_IF_TRUE
        r.registerMagic(62191, "2.7a0+2");  // SETUP_WITH
        r.registerMagic(62201, "2.7a0+3");  // BUILD_SET
        r.registerMagic(62211, "2.7");      // MAP_ADD, SET_ADD
        r.registerMagic(2657, "2.7pyston-0.6.1");
        r.registerMagic(62211 + 7, "2.7pypy");

        // ==================== 3.0 - 3.2 ====================
        r.registerMagic(3000, "3.000");
        r.registerMagic(3010, "3.000+1");   // removed UNARY_CONVERT
        r.registerMagic(3020, "3.000+2");   // BUILD_SET
        r.registerMagic(3030, "3.000+3");   // keyword-only parameters
        r.registerMagic(3040, "3.000+4");   // signature annotations
        r.registerMagic(3050, "3.000+5");   // print becomes a function
        r.registerMagic(3060, "3.000+6");   // metaclass syntax
        r.registerMagic(3061, "3.000+7");   // string literals become unicode
        r.registerMagic(3071, "3.000+8");   // raise changes
        r.registerMagic(3081, "3.000+9");   // unicode __file__ and __name__
        r.registerMagic(3091, "3.000+10");  // kill str8 interning
        r.registerMagic(3101, "3.000+11");  // merge from 2.6a0
        r.registerMagic(3103, "3.000+12");  // __file__ points to source file
        r.registerMagic(3111, "3.0a4");     // WITH_CLEANUP optimization
        r.registerMagic(3131, "3.0a5");     // lexical exception stacking, POP_EXCEPT
        r.registerMagic(3141, "3.1a0");     // optimize comprehensions
        r.registerMagic(3151, "3.1a0+");    // optimize conditional branches
        r.registerMagic(3160, "3.2a0");     // SETUP_WITH
        r.registerMagic(3170, "3.2a1");     // DUP_TOP_TWO, remove DUP_TOPX and ROT_FOUR
        r.registerMagic(3180, "3.2a2");     // DELETE_DEREF
        r.registerMagic(3180 + 7, "3.2pypy");

        // ==================== 3.3 - 3.6 ====================
        r.registerMagic(3190, "3.3a0");     // __class__ super closure changed
        r.registerMagic(3200, "3.3a0+");    // __qualname__
        r.registerMagic(3220, "3.3a1");     // PEP 380 implementation
        r.registerMagic(3210, "3.3a2");     // source size in header
        r.registerMagic(3230, "3.3a4");     // revert implicit __class__ closure
        r.registerMagic(3250, "3.4a1");     // keyword-only defaults order
        r.registerMagic(3260, "3.4a1+1");   // LOAD_CLASSDEREF
        r.registerMagic(3270, "3.4a1+2");   // __class__ closure tweaks
        r.registerMagic(3280, "3.4a1+3");   // remove implicit class argument
        r.registerMagic(3290, "3.4a4");     // __qualname__ computation
        r.registerMagic(3300, "3.4a4+");    // __qualname__ computation
        r.registerMagic(3310, "3.4rc2");    // __qualname__ computation
        r.registerMagic(3320, "3.5a0");     // matrix multiplication
        r.registerMagic(3330, "3.5b1");     // additional unpacking generalizations
        r.registerMagic(3340, "3.5b2");     // dict display evaluation order
        r.registerMagic(3350, "3.5");       // GET_YIELD_FROM_ITER
        r.registerMagic(3351, "3.5.2");     // BUILD_MAP_UNPACK_WITH_CALL fix
        r.registerMagic(3360, "3.6a0");     // FORMAT_VALUE
        r.registerMagic(3361, "3.6a0+1");   // signed lnotab deltas
        r.registerMagic(3370, "3.6a1");     // 16 bit wordcode
        r.registerMagic(3371, "3.6a1+1");   // BUILD_CONST_KEY_MAP
        r.registerMagic(3372, "3.6a1+2");   // remove MAKE_CLOSURE
        r.registerMagic(3373, "3.6b1");     // BUILD_STRING
        r.registerMagic(3375, "3.6b1+1");   // SETUP_ANNOTATIONS, STORE_ANNOTATION
        r.registerMagic(3376, "3.6b1+2");   // simplify CALL_FUNCTION*
        r.registerMagic(3377, "3.6b1+3");   // __class__ cell from type.__new__
        r.registerMagic(3378, "3.6b2");     // BUILD_TUPLE_UNPACK_WITH_CALL
        r.registerMagic(3379, "3.6rc1");    // __class__ validation

        // ==================== 3.7 - 3.10 ====================
        r.registerMagic(3390, "3.7.0alpha0");   // LOAD_METHOD, CALL_METHOD
        r.registerMagic(3391, "3.7.0alpha3");   // GET_AITER update
        r.registerMagic(3392, "3.7.0beta2");    // deterministic pycs, initial
        r.registerMagic(3393, "3.7.0beta3");    // deterministic pycs, remove STORE_ANNOTATION
        r.registerMagic(3394, "3.7.0");         // docstring restored as first statement
        r.registerMagic(3400, "3.8.0a1");       // frame block handling moved to compiler
        r.registerMagic(3401, "3.8.0a3+");      // END_ASYNC_FOR
        r.registerMagic(3410, "3.8.0a1+");      // positional-only parameters
        r.registerMagic(3411, "3.8.0b2+");      // dict comprehension evaluation order
        r.registerMagic(3412, "3.8.0beta2");    // positional-only args position
        r.registerMagic(3413, "3.8.0rc1+");     // break/continue in finally
        r.registerMagic(3420, "3.9.0a0");       // LOAD_ASSERTION_ERROR
        r.registerMagic(3421, "3.9.0a0");       // simplified with blocks
        r.registerMagic(3422, "3.9.0alpha1");   // remove BEGIN_FINALLY and friends
        r.registerMagic(3423, "3.9.0a0");       // IS_OP, CONTAINS_OP, JUMP_IF_NOT_EXC_MATCH
        r.registerMagic(3424, "3.9.0a2");       // *value unpacking
        r.registerMagic(3425, "3.9.0beta5");    // **value unpacking
        r.registerMagic(3430, "3.10a1");        // annotations future by default
        r.registerMagic(3431, "3.10a1");        // PEP 626 line number table
        r.registerMagic(3432, "3.10a2");        // MAKE_FUNCTION annotations as tuple
        r.registerMagic(3433, "3.10a2");        // RERAISE restores f_lasti
        r.registerMagic(3434, "3.10a6");
        r.registerMagic(3435, "3.10a7");
        r.registerMagic(3438, "3.10b1");
        r.registerMagic(3439, "3.10.0rc2");

        // ==================== 3.11 - 3.12 ====================
        r.registerMagic(3450, "3.11a1a");
        r.registerMagic(3451, "3.11a1b");
        r.registerMagic(3452, "3.11a1c");
        r.registerMagic(3453, "3.11a1d");
        r.registerMagic(3454, "3.11a1e");
        r.registerMagic(3455, "3.11a1f");
        r.registerMagic(3457, "3.11a1g");
        r.registerMagic(3458, "3.11a1h");
        r.registerMagic(3459, "3.11a1i");
        r.registerMagic(3460, "3.11a1j");
        r.registerMagic(3461, "3.11a1k");
        r.registerMagic(3462, "3.11a2");
        r.registerMagic(3463, "3.11a3a");
        r.registerMagic(3464, "3.11a3b");
        r.registerMagic(3465, "3.11a4a");
        r.registerMagic(3466, "3.11a4b");
        r.registerMagic(3466, "3.11a4c");       // one magic, two pre-release tags
        r.registerMagic(3467, "3.11a4d");
        r.registerMagic(3468, "3.11a4e");
        r.registerMagic(3469, "3.11a4f");
        r.registerMagic(3470, "3.11a4g");
        r.registerMagic(3471, "3.11a4h");
        r.registerMagic(3472, "3.11a4i");
        r.registerMagic(3473, "3.11a4j");
        r.registerMagic(3474, "3.11a4k");
        r.registerMagic(3475, "3.11a5a");
        r.registerMagic(3476, "3.11a5b");
        r.registerMagic(3477, "3.11a5c");
        r.registerMagic(3478, "3.11a5d");
        r.registerMagic(3479, "3.11a5e");
        r.registerMagic(3480, "3.11a5e");
        r.registerMagic(3481, "3.11a5f");
        r.registerMagic(3482, "3.11a5g");
        r.registerMagic(3483, "3.11a5h");
        r.registerMagic(3484, "3.11a5i");
        r.registerMagic(3485, "3.11a5j");
        r.registerMagic(3486, "3.11a6a");
        r.registerMagic(3487, "3.11a6b");
        r.registerMagic(3488, "3.11a6c");
        r.registerMagic(3489, "3.11a6d");
        r.registerMagic(3490, "3.11a6d");
        r.registerMagic(3491, "3.11a7a");
        r.registerMagic(3492, "3.11a7b");
        r.registerMagic(3493, "3.11a7c");
        r.registerMagic(3494, "3.11a7d");
        r.registerMagic(3495, "3.11a7e");
        r.registerMagic(3531, "3.12.0rc2");

        // ==================== Other implementations ====================
        r.registerMagic(48, "3.2a2");
        r.registerMagic(64, "3.3pypy");
        r.registerMagic(112, "3.5pypy");        // pypy3.5-c-jit-latest
        r.registerMagic(160, "3.6.1pypy");      // PyPy 7.1.0-beta0
        r.registerMagic(192, "3.6pypy");        // 3.6.9, PyPy 7.1.0-beta0
        r.registerMagic(224, "3.7pypy");        // PyPy 3.7.9-beta0
        r.registerMagic(240, "3.7pypy");        // PyPy 3.7.9-beta0
        r.registerMagic(256, "3.8pypy");        // PyPy 3.8.15
        r.registerMagic(336, "3.9pypy");        // PyPy 3.9.15, 3.9.17
        r.registerMagic(384, "3.10pypy");       // PyPy 3.10.12
        r.registerMagic(21150, "3.8.5Graal");   // JVM bytecode, not Python bytecode
        r.registerMagic(1011, "2.7.1b3Jython");
        r.registerMagic(22138, "2.7.7Pyston");  // 2.7.8 Pyston, pyston-0.6.0
    }

    static void classifyPyPy3(BytecodeRegistry.Builder r) {
        // 48 is filed under "3.2a2"; 244 was never bound to a version
        r.markPyPy3(48, 64, 112, 160, 192, 240, 244, 256, 336, 384);
    }

    static void registerAliases(BytecodeRegistry.Builder r) {
        alias(r, "1.5", "1.5.1 1.5.2");
        alias(r, "2.0", "2.0.1");
        alias(r, "2.1", "2.1.1 2.1.2 2.1.3");
        alias(r, "2.2", "2.2.3");
        alias(r, "2.3a0", "2.3 2.3.7");
        alias(r, "2.4b1", "2.4 2.4.0 2.4.1 2.4.2 2.4.3 2.4.5 2.4.6");
        alias(r, "2.5c2", "2.5 2.5.0 2.5.1 2.5.2 2.5.3 2.5.4 2.5.5 2.5.6");
        alias(r, "2.6a1", "2.6 2.6.6 2.6.7 2.6.8 2.6.9");
        alias(r, "2.7",
                "2.7.0 2.7.1 2.7.2 2.7.3 2.7.4 2.7.5 2.7.6 2.7.7 "
                + "2.7.8 2.7.9 2.7.10 2.7.11 2.7.12 2.7.13 2.7.14 2.7.15 "
                + "2.7.15candidate1 2.7.16 "
                + "2.7.17rc1 2.7.17candidate1 2.7.17 2.7.18 2.7.18candidate1");
        alias(r, "3.0a5", "3.0 3.0.0 3.0.1");
        alias(r, "3.1a0+", "3.1 3.1.0 3.1.1 3.1.2 3.1.3 3.1.4 3.1.5");
        alias(r, "3.2a2", "3.2 3.2.0 3.2.1 3.2.2 3.2.3 3.2.4 3.2.5 3.2.6");
        alias(r, "3.3a4", "3.3 3.3.0 3.3.1 3.3.2 3.3.3 3.3.4 3.3.5 3.3.6 3.3.7rc1 3.3.7");
        alias(r, "3.4rc2", "3.4 3.4.0 3.4.1 3.4.2 3.4.3 3.4.4 3.4.5 3.4.6 3.4.7 3.4.8 3.4.9 3.4.10");
        alias(r, "3.5", "3.5.0 3.5.1");
        alias(r, "3.5.2", "3.5.3 3.5.4 3.5.5 3.5.6 3.5.7 3.5.8 3.5.9 3.5.10");
        alias(r, "3.6rc1",
                "3.6 3.6.0 3.6.1 3.6.2 3.6.3 3.6.4 3.6.5 3.6.6 3.6.7 3.6.8 "
                + "3.6.9 3.6.10 3.6.11 3.6.12 3.6.13 3.6.14 3.6.15");
        alias(r, "3.7.0beta3", "3.7b1");
        alias(r, "3.8.0beta2", "3.8a1");

        alias(r, "2.7pypy", "2.7.10pypy 2.7.12pypy 2.7.13pypy 2.7.18pypy");
        alias(r, "2.7.1b3Jython", "2.7.3b0Jython");
        alias(r, "3.2pypy", "3.2.5pypy");
        alias(r, "3.3pypy", "3.3.5pypy");
        alias(r, "3.5pypy", "3.5.3pypy");
        alias(r, "3.6pypy", "3.6.9pypy");
        alias(r, "3.7pypy", "3.7.0pypy 3.7.9pypy 3.7.10pypy 3.7.12pypy 3.7.13pypy");
        alias(r, "3.8pypy", "3.8.0pypy 3.8.12pypy 3.8.13pypy 3.8.15pypy 3.8.16pypy");
        alias(r, "3.9pypy", "3.9.10pypy 3.9.11pypy 3.9.12pypy 3.9.15pypy 3.9.16pypy 3.9.17pypy");
        alias(r, "3.10pypy", "3.10.12pypy");
        alias(r, "2.7.7Pyston", "2.7.8Pyston");

        alias(r, "3.7.0",
                "3.7 3.7.0beta5 3.7.1 3.7.2 3.7.3 3.7.4 3.7.5 3.7.6 3.7.7 3.7.8 3.7.9 "
                + "3.7.10 3.7.11 3.7.12 3.7.13 3.7.14 3.7.15 3.7.16 3.7.17");
        alias(r, "3.8.0a3+", "3.8.0alpha0 3.8.0alpha3 3.8.0a0");
        alias(r, "3.8.0rc1+",
                "3.8b4 3.8.0candidate1 3.8 3.8.0 3.8.1 3.8.2 3.8.3 3.8.4 3.8.5 3.8.6 3.8.7 3.8.8 "
                + "3.8.9 3.8.10 3.8.11 3.8.12 3.8.13 3.8.14 3.8.15 3.8.16 3.8.17 3.8.18");
        alias(r, "3.9.0alpha1", "3.9.0a1+ 3.9.0a2+ 3.9.0alpha2");
        alias(r, "3.9.0beta5",
                "3.9 3.9.0 3.9.1 3.9.2 3.9.3 3.9.4 3.9.5 3.9.6 3.9.7 3.9.8 3.9.9 3.9.10 3.9.11 "
                + "3.9.12 3.9.13 3.9.14 3.9.15 3.9.16 3.9.0b5+ 3.9.17 3.9.18");
        alias(r, "3.10.0rc2",
                "3.10 3.10.0 3.10.1 3.10.2 3.10.3 3.10.4 3.10.5 3.10.6 3.10.7 3.10.8 3.10.9 "
                + "3.10.10 3.10.11 3.10.12 3.10.13");
        alias(r, "3.11a7e", "3.11 3.11.0 3.11.1 3.11.2 3.11.3 3.11.4 3.11.5");
        alias(r, "3.12.0rc2", "3.12 3.12.0");
    }

    private static void alias(BytecodeRegistry.Builder r, String canonical, String releases) {
        List<String> versions = Arrays.asList(releases.trim().split("\\s+"));
        r.registerAlias(versions, canonical);
    }
}
