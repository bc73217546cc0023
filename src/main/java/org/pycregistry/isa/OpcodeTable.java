package org.pycregistry.isa;

import org.pycregistry.api.UnknownOpcodeException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * The complete, published opcode set of one canonical version.
 *
 * <p>Name-to-code and code-to-name projections are bijective. The per-flag code sets (e.g. all
 * relative jumps) are computed once at construction; they are the main surface a disassembler
 * consumes.
 *
 * <p>Instances are immutable and share no storage with their parent table.
 */
public final class OpcodeTable {

    private final String version;
    private final String parentVersion;
    private final Map<Integer, OpcodeDefinition> byCode;
    private final Map<String, Integer> codeByName;
    private final Map<OpcodeFlag, Set<Integer>> codesByFlag;

    OpcodeTable(String version, String parentVersion, Collection<OpcodeDefinition> definitions) {
        this.version = version;
        this.parentVersion = parentVersion;

        Map<Integer, OpcodeDefinition> sorted = new TreeMap<>();
        Map<String, Integer> names = new LinkedHashMap<>();
        Map<OpcodeFlag, Set<Integer>> flagSets = new EnumMap<>(OpcodeFlag.class);
        for (OpcodeFlag flag : OpcodeFlag.values()) {
            flagSets.put(flag, new TreeSet<>());
        }
        for (OpcodeDefinition def : definitions) {
            sorted.put(def.code(), def);
            for (OpcodeFlag flag : def.flags()) {
                flagSets.get(flag).add(def.code());
            }
        }
        for (OpcodeDefinition def : sorted.values()) {
            names.put(def.name(), def.code());
        }
        flagSets.replaceAll((flag, codes) -> Collections.unmodifiableSet(codes));

        this.byCode = Collections.unmodifiableMap(sorted);
        this.codeByName = Collections.unmodifiableMap(names);
        this.codesByFlag = Collections.unmodifiableMap(flagSets);
    }

    /**
     * @return the canonical version this table belongs to.
     */
    public String version() {
        return version;
    }

    /**
     * @return the version this table was derived from, or empty for a root table.
     */
    public Optional<String> parentVersion() {
        return Optional.ofNullable(parentVersion);
    }

    /**
     * @param name an opcode name.
     * @return its code.
     * @throws UnknownOpcodeException if the name is not in this table.
     */
    public int code(String name) {
        Integer code = codeByName.get(name);
        if (code == null) {
            throw new UnknownOpcodeException("Opcode '" + name + "' is not defined in version " + version);
        }
        return code;
    }

    /**
     * @param code an opcode code.
     * @return its name.
     * @throws UnknownOpcodeException if the code is not in this table.
     */
    public String name(int code) {
        return definition(code).name();
    }

    /**
     * @param code an opcode code.
     * @return its operand categories.
     * @throws UnknownOpcodeException if the code is not in this table.
     */
    public Set<OpcodeFlag> flags(int code) {
        return definition(code).flags();
    }

    /**
     * @param code an opcode code.
     * @return the full definition.
     * @throws UnknownOpcodeException if the code is not in this table.
     */
    public OpcodeDefinition definition(int code) {
        OpcodeDefinition def = byCode.get(code);
        if (def == null) {
            throw new UnknownOpcodeException("Opcode " + code + " is not defined in version " + version);
        }
        return def;
    }

    /**
     * @param name an opcode name.
     * @return true if the name is defined.
     */
    public boolean contains(String name) {
        return codeByName.containsKey(name);
    }

    /**
     * @param code an opcode code.
     * @return true if the code is defined.
     */
    public boolean contains(int code) {
        return byCode.containsKey(code);
    }

    /**
     * @param code an opcode code.
     * @return true if the instruction takes an argument.
     * @throws UnknownOpcodeException if the code is not in this table.
     */
    public boolean hasArgument(int code) {
        return !definition(code).has(OpcodeFlag.NO_ARGUMENT);
    }

    /**
     * @param flag an operand category.
     * @return the codes carrying the category, ascending.
     */
    public Set<Integer> codesWithFlag(OpcodeFlag flag) {
        return codesByFlag.get(flag);
    }

    /**
     * @return names of all relative and absolute jumps, ordered by code.
     */
    public List<String> jumpOpNames() {
        List<String> names = new ArrayList<>();
        for (OpcodeDefinition def : byCode.values()) {
            if (def.has(OpcodeFlag.JUMP_RELATIVE) || def.has(OpcodeFlag.JUMP_ABSOLUTE)) {
                names.add(def.name());
            }
        }
        return Collections.unmodifiableList(names);
    }

    /**
     * @return the opcodes that occur in real bytecode (pseudo opcodes excluded), ordered by code.
     */
    public List<OpcodeDefinition> definedOps() {
        return byCode.values().stream().filter(def -> !def.pseudo()).toList();
    }

    /**
     * @return every definition, ordered by code.
     */
    public Collection<OpcodeDefinition> definitions() {
        return byCode.values();
    }

    /**
     * @return the name-to-code map, ordered by code.
     */
    public Map<String, Integer> asNameMap() {
        return codeByName;
    }

    /**
     * @return number of opcodes, pseudo opcodes included.
     */
    public int size() {
        return byCode.size();
    }

    @Override
    public String toString() {
        return "OpcodeTable[" + version + ", " + byCode.size() + " opcodes"
                + (parentVersion == null ? "" : ", from " + parentVersion) + "]";
    }
}
