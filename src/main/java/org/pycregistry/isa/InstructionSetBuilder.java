package org.pycregistry.isa;

import org.pycregistry.api.TableConsistencyException;
import org.pycregistry.api.UnknownVersionException;
import org.pycregistry.version.VersionCanonicalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Derives and publishes the opcode table of each version.
 *
 * <p>Root tables are supplied as literal catalogs. Every other table is produced by replaying
 * an ordered list of {@link EditOperation}s against a private copy of an already published
 * parent table. The whole edit list is validated before anything is published; a failed
 * version stays unpublished, so nothing can be derived from it either.
 *
 * <p>Tables must be defined parents-first. The builder is used by a single initializing
 * thread; {@link #build()} freezes the published tables into an {@link InstructionSets}.
 */
public final class InstructionSetBuilder {

    private static final Logger log = LoggerFactory.getLogger(InstructionSetBuilder.class);

    private final VersionCanonicalizer canonicalizer;
    private final Map<String, OpcodeTable> published = new LinkedHashMap<>();
    private boolean built;

    /**
     * @param canonicalizer the frozen canonicalizer; every table version must be canonical in it.
     */
    public InstructionSetBuilder(VersionCanonicalizer canonicalizer) {
        this.canonicalizer = canonicalizer;
    }

    /**
     * Publishes a root table from a literal catalog.
     *
     * @param version     a canonical version.
     * @param definitions the opcodes; names and codes must be unique.
     * @return the published table.
     * @throws UnknownVersionException    if the version is not canonical.
     * @throws TableConsistencyException  if the version is already published or a name or code repeats.
     */
    public OpcodeTable defineRoot(String version, List<OpcodeDefinition> definitions) {
        checkDefinable(version);
        WorkingTable working = new WorkingTable(version);
        for (OpcodeDefinition def : definitions) {
            working.add(def, "root catalog entry " + def.name());
        }
        return publish(working, null);
    }

    /**
     * Derives a table by replaying edits against a published parent.
     *
     * @param version       a canonical version.
     * @param parentVersion the version to derive from; must already be published.
     * @param edits         the edits, applied in order.
     * @return the published table.
     * @throws UnknownVersionException   if the version is not canonical.
     * @throws TableConsistencyException if the version is already published, the parent is not
     *                                   published, or any edit is inconsistent with the table
     *                                   as it stands at that point.
     */
    public OpcodeTable defineTable(String version, String parentVersion, List<EditOperation> edits) {
        checkDefinable(version);
        OpcodeTable parent = published.get(resolveParent(parentVersion));
        if (parent == null) {
            throw new TableConsistencyException(version,
                    "parent version '" + parentVersion + "' has no published table");
        }

        WorkingTable working = WorkingTable.copyOf(version, parent);
        for (int i = 0; i < edits.size(); i++) {
            working.apply(edits.get(i), i);
        }
        return publish(working, parent.version());
    }

    /**
     * @param version a version string.
     * @return true if a table is published for the version's canonical form.
     */
    public boolean isPublished(String version) {
        return published.containsKey(resolveParent(version));
    }

    /**
     * Freezes the published tables.
     *
     * @return the read-only instruction sets.
     * @throws IllegalStateException if called twice.
     */
    public InstructionSets build() {
        checkNotBuilt();
        built = true;
        return new InstructionSets(canonicalizer, published);
    }

    private void checkDefinable(String version) {
        checkNotBuilt();
        if (!canonicalizer.isCanonical(version)) {
            throw new UnknownVersionException(version,
                    "Opcode tables can only be defined for canonical versions, got '" + version + "'");
        }
        if (published.containsKey(version)) {
            throw new TableConsistencyException(version, "table is already published");
        }
    }

    private String resolveParent(String version) {
        return canonicalizer.isKnown(version) ? canonicalizer.canonicalize(version) : version;
    }

    private OpcodeTable publish(WorkingTable working, String parentVersion) {
        OpcodeTable table = new OpcodeTable(working.version, parentVersion, working.byCode.values());
        published.put(working.version, table);
        log.debug("Published opcode table {} ({} opcodes{})", table.version(), table.size(),
                parentVersion == null ? "" : ", derived from " + parentVersion);
        return table;
    }

    private void checkNotBuilt() {
        if (built) {
            throw new IllegalStateException("Instruction sets have already been built");
        }
    }

    /**
     * Mutable table used only while one version is being built. Definitions are immutable
     * records, so copying the two maps gives a table that shares nothing mutable with its parent.
     */
    private static final class WorkingTable {

        private final String version;
        private final Map<Integer, OpcodeDefinition> byCode;
        private final Map<String, Integer> codeByName;

        private WorkingTable(String version) {
            this.version = version;
            this.byCode = new LinkedHashMap<>();
            this.codeByName = new HashMap<>();
        }

        static WorkingTable copyOf(String version, OpcodeTable parent) {
            WorkingTable copy = new WorkingTable(version);
            for (OpcodeDefinition def : parent.definitions()) {
                copy.byCode.put(def.code(), def);
                copy.codeByName.put(def.name(), def.code());
            }
            return copy;
        }

        void apply(EditOperation edit, int index) {
            String where = "edit #" + index + " " + edit;
            if (edit instanceof EditOperation.Define define) {
                add(new OpcodeDefinition(define.name(), define.code(), define.flags(), false), where);
            } else if (edit instanceof EditOperation.Alias alias) {
                add(new OpcodeDefinition(alias.name(), alias.code(), alias.flags(), true), where);
            } else if (edit instanceof EditOperation.Remove remove) {
                remove(remove, where);
            } else if (edit instanceof EditOperation.Redefine redefine) {
                redefine(redefine, where);
            }
        }

        void add(OpcodeDefinition def, String where) {
            Integer existingCode = codeByName.get(def.name());
            if (existingCode != null) {
                throw new TableConsistencyException(version, where + ": name " + def.name()
                        + " is already defined with code " + existingCode);
            }
            OpcodeDefinition occupant = byCode.get(def.code());
            if (occupant != null) {
                throw new TableConsistencyException(version, where + ": code " + def.code()
                        + " is already used by " + occupant.name());
            }
            byCode.put(def.code(), def);
            codeByName.put(def.name(), def.code());
        }

        private void remove(EditOperation.Remove remove, String where) {
            Integer code = codeByName.get(remove.name());
            if (code == null) {
                throw new TableConsistencyException(version, where + ": name " + remove.name()
                        + " is not defined");
            }
            if (code != remove.code()) {
                throw new TableConsistencyException(version, where + ": name " + remove.name()
                        + " has code " + code + ", not " + remove.code());
            }
            byCode.remove(code);
            codeByName.remove(remove.name());
        }

        private void redefine(EditOperation.Redefine redefine, String where) {
            OpcodeDefinition occupant = byCode.get(redefine.code());
            if (occupant == null) {
                throw new TableConsistencyException(version, where + ": code " + redefine.code()
                        + " is not defined, nothing to redefine");
            }
            Integer boundCode = codeByName.get(redefine.name());
            if (boundCode != null && boundCode != redefine.code()) {
                throw new TableConsistencyException(version, where + ": name " + redefine.name()
                        + " is already bound to code " + boundCode);
            }
            codeByName.remove(occupant.name());
            OpcodeDefinition replacement =
                    new OpcodeDefinition(redefine.name(), redefine.code(), redefine.flags(), false);
            byCode.put(replacement.code(), replacement);
            codeByName.put(replacement.name(), replacement.code());
        }
    }
}
