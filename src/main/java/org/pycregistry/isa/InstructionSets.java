package org.pycregistry.isa;

import org.pycregistry.api.UnknownOpcodeException;
import org.pycregistry.api.UnknownVersionException;
import org.pycregistry.version.VersionCanonicalizer;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Read-only view over every published opcode table, keyed by canonical version.
 * <p>
 * Lookups accept any spelling the canonicalizer knows; a version without a published table
 * (including one whose derivation failed) fails with {@link UnknownVersionException}.
 * <p>
 * Instances are immutable and safe for concurrent use.
 */
public final class InstructionSets {

    private final VersionCanonicalizer canonicalizer;
    private final Map<String, OpcodeTable> tables;

    InstructionSets(VersionCanonicalizer canonicalizer, Map<String, OpcodeTable> tables) {
        this.canonicalizer = canonicalizer;
        this.tables = Collections.unmodifiableMap(new LinkedHashMap<>(tables));
    }

    /**
     * @param version any known spelling of a version.
     * @return the published table of its canonical version.
     * @throws UnknownVersionException if the version is unknown or has no published table.
     */
    public OpcodeTable table(String version) {
        String canonical = canonicalizer.canonicalize(version);
        OpcodeTable table = tables.get(canonical);
        if (table == null) {
            throw new UnknownVersionException(version,
                    "No opcode table published for version '" + version + "' (canonical '" + canonical + "')");
        }
        return table;
    }

    /**
     * @param version any known spelling of a version.
     * @param name    an opcode name.
     * @return the opcode's code in that version.
     * @throws UnknownVersionException if the version has no published table.
     * @throws UnknownOpcodeException  if the name is not defined in that version.
     */
    public int lookup(String version, String name) {
        return table(version).code(name);
    }

    /**
     * @param version any known spelling of a version.
     * @param code    an opcode code.
     * @return the opcode's name in that version.
     * @throws UnknownVersionException if the version has no published table.
     * @throws UnknownOpcodeException  if the code is not defined in that version.
     */
    public String lookup(String version, int code) {
        return table(version).name(code);
    }

    /**
     * @param version any known spelling of a version.
     * @param code    an opcode code.
     * @return the opcode's operand categories in that version.
     * @throws UnknownVersionException if the version has no published table.
     * @throws UnknownOpcodeException  if the code is not defined in that version.
     */
    public Set<OpcodeFlag> classify(String version, int code) {
        return table(version).flags(code);
    }

    /**
     * @param version a version string.
     * @return true if a table is published for the version.
     */
    public boolean hasTable(String version) {
        return canonicalizer.isKnown(version) && tables.containsKey(canonicalizer.canonicalize(version));
    }

    /**
     * @return the canonical versions with a published table, in publication order.
     */
    public Set<String> versions() {
        return tables.keySet();
    }
}
