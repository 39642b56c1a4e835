/*
 * Copyright (c) 2025, Trail of Bits, Inc.
 *
 * This source code is licensed in accordance with the terms specified in
 * the LICENSE file found in the root directory of this source tree.
 */

package ast;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.*;

import domain.DefUses;
import domain.ReachingDefinition;

import java.util.ArrayList;
import java.util.List;

public class AstProvenanceTest {
    AstProvenance provenance;

    @BeforeEach
    public void setUp() {
        provenance = new AstProvenance();
    }

    @Test
    public void testAbsentReachingDefinitionsAreDropped() {
        List<ReachingDefinition> rdefs = new ArrayList<>();
        rdefs.add(null);
        rdefs.add(new ReachingDefinition("R1", List.of("0x100")));
        rdefs.add(null);

        provenance.addReachingDefinitions(5, rdefs);
        assertTrue(provenance.hasReachingDefinitions(5));
        assertEquals(1, provenance.getReachingDefinitions(5).size());
        assertEquals("R1", provenance.getReachingDefinitions(5).get(0).getVariable());

        List<ReachingDefinition> none = new ArrayList<>();
        none.add(null);
        provenance.addReachingDefinitions(6, none);
        assertFalse(provenance.hasReachingDefinitions(6));
    }

    @Test
    public void testNullDefUsesAreSkipped() {
        provenance.addLvalDefUses(1, null);
        provenance.addLvalDefUsesHigh(1, null);
        assertTrue(provenance.getAllLvalDefUses().isEmpty());
        assertTrue(provenance.getAllLvalDefUsesHigh().isEmpty());

        provenance.addLvalDefUses(2, new DefUses("R0", List.of("0x104", "0x108")));
        assertEquals(List.of("0x104", "0x108"), provenance.getLvalDefUses(2).getUseAddresses());
    }

    @Test
    public void testAddressesAccumulate() {
        provenance.addInstructionAddress(3, List.of("0x10"));
        provenance.addInstructionAddress(3, List.of("0x14"));
        provenance.addConditionAddress(9, List.of("0x20"));

        assertEquals(List.of("0x10", "0x14"), provenance.getInstructionAddresses(3));
        assertEquals(List.of("0x20"), provenance.getConditionAddresses(9));
    }

    @Test
    public void testMappings() {
        provenance.addInstructionMapping(1, 2);
        provenance.addExpressionMapping(10, 11);
        provenance.addLvalMapping(20, 21);

        assertTrue(provenance.hasInstructionMapping(1));
        assertFalse(provenance.hasInstructionMapping(2));
        assertEquals(11, provenance.getExpressionMapping(10));
        assertEquals(21, provenance.getLvalMapping(20));
        assertThrows(IllegalStateException.class, () -> provenance.addInstructionMapping(1, 3));
    }
}
