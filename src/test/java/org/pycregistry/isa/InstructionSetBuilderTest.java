package org.pycregistry.isa;

import org.pycregistry.api.TableConsistencyException;
import org.pycregistry.api.UnknownOpcodeException;
import org.pycregistry.api.UnknownVersionException;
import org.pycregistry.config.RegistryConfig;
import org.pycregistry.version.VersionCanonicalizer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.pycregistry.isa.EditOperation.alias;
import static org.pycregistry.isa.EditOperation.define;
import static org.pycregistry.isa.EditOperation.redefine;
import static org.pycregistry.isa.EditOperation.remove;
import static org.pycregistry.isa.OpcodeFlag.COMPARE;
import static org.pycregistry.isa.OpcodeFlag.JUMP_ABSOLUTE;
import static org.pycregistry.isa.OpcodeFlag.JUMP_RELATIVE;
import static org.pycregistry.isa.OpcodeFlag.LOCAL;
import static org.pycregistry.isa.OpcodeFlag.NO_ARGUMENT;

/**
 * Unit tests for {@link InstructionSetBuilder}: edit replay, consistency errors and
 * isolation between parent and child tables.
 */
@Tag("unit")
class InstructionSetBuilderTest {

    private static final List<OpcodeDefinition> T0 = List.of(
            OpcodeDefinition.of("LOAD_FAST", 124, LOCAL),
            OpcodeDefinition.of("JUMP_FORWARD", 110, JUMP_RELATIVE));

    private InstructionSetBuilder builder;

    @BeforeEach
    void setUp() {
        VersionCanonicalizer.Builder versions = VersionCanonicalizer.builder(
                new RegistryConfig(List.of(), false, Map.of()));
        for (String v : List.of("t0", "t1", "t2", "t3", "t4")) {
            versions.registerCanonical(v);
        }
        versions.registerAlias(List.of("t1.1"), "t1");
        builder = new InstructionSetBuilder(versions.build());
    }

    // ========== Derivation ==========

    @Test
    void removeThenDefineReusesTheCodeUnderANewName() {
        builder.defineRoot("t0", T0);
        builder.defineTable("t1", "t0", List.of(
                remove("JUMP_FORWARD", 110),
                define("JUMP_FORWARD_NEW", 110, JUMP_RELATIVE)));
        InstructionSets sets = builder.build();

        assertEquals(110, sets.lookup("t1", "JUMP_FORWARD_NEW"));
        assertThatThrownBy(() -> sets.lookup("t1", "JUMP_FORWARD"))
                .isInstanceOf(UnknownOpcodeException.class)
                .hasMessageContaining("JUMP_FORWARD");
        assertEquals(110, sets.lookup("t0", "JUMP_FORWARD"));
        assertEquals("JUMP_FORWARD", sets.lookup("t0", 110));
        assertEquals("JUMP_FORWARD_NEW", sets.lookup("t1.1", 110));
    }

    @Test
    void removeWithWrongCodeFailsAndPublishesNothing() {
        builder.defineRoot("t0", T0);

        assertThatThrownBy(() -> builder.defineTable("t2", "t0", List.of(remove("LOAD_FAST", 99))))
                .isInstanceOf(TableConsistencyException.class)
                .hasMessageContaining("LOAD_FAST")
                .hasMessageContaining("124");
        assertFalse(builder.isPublished("t2"));

        InstructionSets sets = builder.build();
        assertThatThrownBy(() -> sets.lookup("t2", "LOAD_FAST"))
                .isInstanceOf(UnknownVersionException.class);
        assertFalse(sets.hasTable("t2"));
        assertEquals(124, sets.lookup("t0", "LOAD_FAST"));
    }

    @Test
    void laterEditFailureDiscardsEarlierEditsOfTheSameVersion() {
        builder.defineRoot("t0", T0);

        assertThatThrownBy(() -> builder.defineTable("t1", "t0", List.of(
                define("NOP", 9, NO_ARGUMENT),
                remove("NOT_THERE", 1))))
                .isInstanceOf(TableConsistencyException.class)
                .hasMessageContaining("edit #1");

        InstructionSets sets = builder.build();
        assertThat(sets.versions()).containsExactly("t0");
        assertFalse(sets.table("t0").contains("NOP"));
    }

    @Test
    void childOfAFailedVersionCannotBeDerived() {
        builder.defineRoot("t0", T0);
        assertThatThrownBy(() -> builder.defineTable("t1", "t0", List.of(remove("LOAD_FAST", 99))))
                .isInstanceOf(TableConsistencyException.class);

        assertThatThrownBy(() -> builder.defineTable("t2", "t1", List.of()))
                .hasMessageContaining("parent version 't1'")
                .isInstanceOfSatisfying(TableConsistencyException.class,
                        e -> assertEquals("t2", e.getVersion()));
    }

    @Test
    void childEditsDoNotLeakIntoTheParent() {
        OpcodeTable parent = builder.defineRoot("t0", T0);
        OpcodeTable child = builder.defineTable("t1", "t0", List.of(
                remove("LOAD_FAST", 124),
                define("STORE_FAST", 125, LOCAL)));

        assertThat(parent.asNameMap()).containsOnlyKeys("JUMP_FORWARD", "LOAD_FAST");
        assertThat(child.asNameMap()).containsOnlyKeys("JUMP_FORWARD", "STORE_FAST");
        assertThat(parent.codesWithFlag(LOCAL)).containsExactly(124);
        assertThat(child.codesWithFlag(LOCAL)).containsExactly(125);
        assertEquals("t0", child.parentVersion().orElseThrow());
        assertTrue(parent.parentVersion().isEmpty());
    }

    @Test
    void emptyEditListCopiesTheParent() {
        OpcodeTable parent = builder.defineRoot("t0", T0);
        OpcodeTable child = builder.defineTable("t1", "t0", List.of());

        assertThat(child.definitions()).containsExactlyElementsOf(parent.definitions());
        assertEquals("t1", child.version());
    }

    @Test
    void replayIsDeterministic() {
        List<EditOperation> edits = List.of(
                remove("JUMP_FORWARD", 110),
                define("JUMP_ABSOLUTE", 113, JUMP_ABSOLUTE),
                define("COMPARE_OP", 107, COMPARE));
        builder.defineRoot("t0", T0);
        OpcodeTable first = builder.defineTable("t1", "t0", edits);
        OpcodeTable second = builder.defineTable("t2", "t0", edits);

        assertThat(second.definitions()).containsExactlyElementsOf(first.definitions());
        assertThat(second.asNameMap()).containsExactlyEntriesOf(first.asNameMap());
    }

    // ========== Collisions ==========

    @Test
    void defineOnAnOccupiedCodeIsRejected() {
        builder.defineRoot("t0", T0);

        assertThatThrownBy(() -> builder.defineTable("t1", "t0", List.of(define("OTHER", 110))))
                .isInstanceOf(TableConsistencyException.class)
                .hasMessageContaining("already used by JUMP_FORWARD");
    }

    @Test
    void defineOfAnExistingNameIsRejected() {
        builder.defineRoot("t0", T0);

        assertThatThrownBy(() -> builder.defineTable("t1", "t0", List.of(define("LOAD_FAST", 1))))
                .isInstanceOf(TableConsistencyException.class)
                .hasMessageContaining("already defined with code 124");
    }

    @Test
    void rootCatalogWithDuplicateCodeIsRejected() {
        List<OpcodeDefinition> clash = List.of(
                OpcodeDefinition.of("A", 1, NO_ARGUMENT),
                OpcodeDefinition.of("B", 1, NO_ARGUMENT));

        assertThatThrownBy(() -> builder.defineRoot("t0", clash))
                .isInstanceOf(TableConsistencyException.class);
        assertFalse(builder.isPublished("t0"));
    }

    @Test
    void redefineReplacesTheOccupantOfACode() {
        builder.defineRoot("t0", T0);
        OpcodeTable t1 = builder.defineTable("t1", "t0", List.of(
                redefine("JUMP_FORWARD_V2", 110, JUMP_RELATIVE)));

        assertEquals("JUMP_FORWARD_V2", t1.name(110));
        assertFalse(t1.contains("JUMP_FORWARD"));
        assertEquals(T0.size(), t1.size());
    }

    @Test
    void redefineOfAFreeCodeIsRejected() {
        builder.defineRoot("t0", T0);

        assertThatThrownBy(() -> builder.defineTable("t1", "t0", List.of(redefine("X", 5))))
                .isInstanceOf(TableConsistencyException.class)
                .hasMessageContaining("nothing to redefine");
    }

    @Test
    void redefineCannotStealANameBoundElsewhere() {
        builder.defineRoot("t0", T0);

        assertThatThrownBy(() -> builder.defineTable("t1", "t0", List.of(redefine("LOAD_FAST", 110))))
                .isInstanceOf(TableConsistencyException.class);
    }

    @Test
    void aliasIsPseudoAndExcludedFromDefinedOps() {
        builder.defineRoot("t0", T0);
        OpcodeTable t1 = builder.defineTable("t1", "t0", List.of(alias("JUMP_MARKER", 200, JUMP_RELATIVE)));

        assertTrue(t1.definition(200).pseudo());
        assertThat(t1.definedOps()).extracting(OpcodeDefinition::name)
                .containsExactly("JUMP_FORWARD", "LOAD_FAST");
        assertThat(t1.codesWithFlag(JUMP_RELATIVE)).containsExactly(110, 200);
    }

    // ========== Version rules ==========

    @Test
    void tablesRequireCanonicalVersions() {
        assertThatThrownBy(() -> builder.defineRoot("t1.1", T0))
                .isInstanceOf(UnknownVersionException.class);
        assertThatThrownBy(() -> builder.defineRoot("unregistered", T0))
                .isInstanceOf(UnknownVersionException.class);
    }

    @Test
    void versionCanOnlyBePublishedOnce() {
        builder.defineRoot("t0", T0);

        assertThatThrownBy(() -> builder.defineRoot("t0", T0))
                .isInstanceOf(TableConsistencyException.class)
                .hasMessageContaining("already published");
    }

    @Test
    void parentMayBeGivenByAlias() {
        builder.defineRoot("t0", T0);
        builder.defineTable("t1", "t0", List.of());

        OpcodeTable t3 = builder.defineTable("t3", "t1.1", List.of());
        assertEquals("t1", t3.parentVersion().orElseThrow());
    }

    @Test
    void builderIsFrozenAfterBuild() {
        builder.defineRoot("t0", T0);
        builder.build();

        assertThatThrownBy(() -> builder.defineTable("t1", "t0", List.of()))
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(builder::build).isInstanceOf(IllegalStateException.class);
    }
}
