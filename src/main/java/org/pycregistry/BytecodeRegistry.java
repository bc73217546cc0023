package org.pycregistry;

import org.pycregistry.catalog.MagicCatalog;
import org.pycregistry.catalog.OpcodeCatalog;
import org.pycregistry.config.RegistryConfig;
import org.pycregistry.isa.EditOperation;
import org.pycregistry.isa.InstructionSetBuilder;
import org.pycregistry.isa.InstructionSets;
import org.pycregistry.isa.OpcodeDefinition;
import org.pycregistry.isa.OpcodeTable;
import org.pycregistry.magic.MagicRegistry;
import org.pycregistry.version.VersionCanonicalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * The fully initialized registry: version canonicalizer, magic index and opcode tables.
 *
 * <p>Built once at startup and handed to consumers explicitly; there is no global instance.
 * All parts are immutable, so a single registry can be shared by any number of threads
 * without locking.
 *
 * <p>Typical use:
 * <pre>{@code
 * BytecodeRegistry registry = BytecodeRegistry.standard();
 * String version = registry.magics().versionForMagicInt(3413);
 * int jump = registry.instructionSets().lookup(version, "JUMP_FORWARD");
 * }</pre>
 */
public final class BytecodeRegistry {

    private static final Logger log = LoggerFactory.getLogger(BytecodeRegistry.class);

    private final VersionCanonicalizer canonicalizer;
    private final MagicRegistry magics;
    private final InstructionSets instructionSets;

    private BytecodeRegistry(VersionCanonicalizer canonicalizer, MagicRegistry magics, InstructionSets instructionSets) {
        this.canonicalizer = canonicalizer;
        this.magics = magics;
        this.instructionSets = instructionSets;
    }

    /**
     * Builds the registry from the compiled-in catalog using the classpath configuration.
     *
     * @return the initialized registry.
     * @throws org.pycregistry.api.BytecodeRegistryException if the catalog is inconsistent.
     */
    public static BytecodeRegistry standard() {
        return standard(RegistryConfig.load());
    }

    /**
     * Builds the registry from the compiled-in catalog.
     *
     * @param config resolution settings.
     * @return the initialized registry.
     * @throws org.pycregistry.api.BytecodeRegistryException if the catalog is inconsistent.
     */
    public static BytecodeRegistry standard(RegistryConfig config) {
        Builder builder = builder(config);
        MagicCatalog.registerAll(builder);
        OpcodeCatalog.defineAll(builder);
        return builder.build();
    }

    /**
     * Creates an empty builder, for custom catalogs.
     *
     * @param config resolution settings.
     * @return a new builder.
     */
    public static Builder builder(RegistryConfig config) {
        return new Builder(config);
    }

    public VersionCanonicalizer canonicalizer() {
        return canonicalizer;
    }

    public MagicRegistry magics() {
        return magics;
    }

    public InstructionSets instructionSets() {
        return instructionSets;
    }

    /**
     * Drives the initialization phases in order.
     *
     * <p>Magic numbers and aliases come first. The first table definition freezes versions and
     * magics; registering either afterwards fails with {@link IllegalStateException}. Tables
     * must then be defined parents-first. Any exception leaves nothing published: the builder
     * never hands out a partially built registry.
     */
    public static final class Builder {

        private final VersionCanonicalizer.Builder versionBuilder;
        private final MagicRegistry.Builder magicBuilder;
        private VersionCanonicalizer canonicalizer;
        private MagicRegistry magics;
        private InstructionSetBuilder tables;
        private boolean built;

        private Builder(RegistryConfig config) {
            this.versionBuilder = VersionCanonicalizer.builder(config);
            this.magicBuilder = MagicRegistry.builder(versionBuilder, config);
        }

        /**
         * @see MagicRegistry.Builder#register(int, String)
         */
        public Builder registerMagic(int magicInt, String version) {
            requireVersionPhase();
            magicBuilder.register(magicInt, version);
            return this;
        }

        /**
         * @see MagicRegistry.Builder#markPyPy3(int)
         */
        public Builder markPyPy3(int... magicInts) {
            requireVersionPhase();
            for (int magicInt : magicInts) {
                magicBuilder.markPyPy3(magicInt);
            }
            return this;
        }

        /**
         * @see VersionCanonicalizer.Builder#registerAlias(List, String)
         */
        public Builder registerAlias(List<String> rawVersions, String canonicalTarget) {
            requireVersionPhase();
            versionBuilder.registerAlias(rawVersions, canonicalTarget);
            return this;
        }

        /**
         * @see InstructionSetBuilder#defineRoot(String, List)
         */
        public OpcodeTable defineRoot(String version, List<OpcodeDefinition> definitions) {
            return tables().defineRoot(version, definitions);
        }

        /**
         * @see InstructionSetBuilder#defineTable(String, String, List)
         */
        public OpcodeTable defineTable(String version, String parentVersion, List<EditOperation> edits) {
            return tables().defineTable(version, parentVersion, edits);
        }

        /**
         * Freezes everything registered so far.
         *
         * @return the registry.
         * @throws IllegalStateException if called twice.
         */
        public BytecodeRegistry build() {
            if (built) {
                throw new IllegalStateException("Registry has already been built");
            }
            InstructionSets sets = tables().build();
            built = true;
            log.info("Bytecode registry initialized: {} magics, {} known versions, {} opcode tables",
                    magics.allMagics().size(), canonicalizer.allKnownVersions().size(), sets.versions().size());
            return new BytecodeRegistry(canonicalizer, magics, sets);
        }

        private void requireVersionPhase() {
            if (tables != null) {
                throw new IllegalStateException(
                        "Versions and magics are frozen once the first opcode table is defined");
            }
        }

        private InstructionSetBuilder tables() {
            if (built) {
                throw new IllegalStateException("Registry has already been built");
            }
            if (tables == null) {
                canonicalizer = versionBuilder.build();
                magics = magicBuilder.build(canonicalizer);
                tables = new InstructionSetBuilder(canonicalizer);
            }
            return tables;
        }
    }
}
