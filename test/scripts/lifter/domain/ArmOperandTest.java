/*
 * Copyright (c) 2025, Trail of Bits, Inc.
 *
 * This source code is licensed in accordance with the terms specified in
 * the LICENSE file found in the root directory of this source tree.
 */

package domain;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.*;

import ast.AstExpr;
import ast.AstInterface;
import ast.AstLval;

import java.util.List;

public class ArmOperandTest {
    AstInterface astree;

    @BeforeEach
    public void setUp() {
        astree = new AstInterface();
    }

    @Test
    public void testRendering() {
        assertEquals("R0", ArmOperand.register(ArmRegister.R0).toString());
        assertEquals("[R1, #4]", ArmOperand.indirectRegister(ArmRegister.R1, 4).toString());
        assertEquals("[R1]", ArmOperand.indirectRegister(ArmRegister.R1, 0).toString());
        assertEquals("[R1, #4]!",
            ArmOperand.indirectRegister(ArmRegister.R1, 4, IndexMode.PRE_INDEX, 4).toString());
        assertEquals("[R1], #4",
            ArmOperand.indirectRegister(ArmRegister.R1, 4, IndexMode.POST_INDEX, 4).toString());
        assertEquals("{R1,R3}",
            ArmOperand.registerList(List.of(ArmRegister.R3, ArmRegister.R1)).toString());
        assertEquals("#5", ArmOperand.immediate(5).toString());
        assertEquals("0x1000", ArmOperand.absolute(0x1000).toString());
    }

    @Test
    public void testRegisterListIsSorted() {
        ArmOperand list = ArmOperand.registerList(
            List.of(ArmRegister.LR, ArmRegister.R4, ArmRegister.R0));
        assertEquals(List.of(ArmRegister.R0, ArmRegister.R4, ArmRegister.LR), list.getRegisters());
        assertThrows(IllegalArgumentException.class, () -> ArmOperand.registerList(List.of()));
    }

    @Test
    public void testWrongKindAttributes() {
        ArmOperand reg = ArmOperand.register(ArmRegister.R2);
        assertThrows(IllegalStateException.class, reg::getValue);
        assertThrows(IllegalStateException.class, reg::getRegisters);
        assertThrows(IllegalStateException.class, reg::getOffset);
        assertThrows(IllegalStateException.class, () -> ArmOperand.immediate(1).getRegister());
    }

    @Test
    public void testRegisterValues() {
        ArmOperand reg = ArmOperand.register(ArmRegister.R2);
        OperandFragment<AstLval> lval = reg.astLvalue(astree, "0x10", "");
        OperandFragment<AstExpr> rval = reg.astRvalue(astree, "0x10", "");
        assertEquals("R2", lval.getNode().toString());
        assertEquals("R2", rval.getNode().toString());
        assertTrue(lval.getPreInstructions().isEmpty());
        assertTrue(rval.getPostInstructions().isEmpty());
    }

    @Test
    public void testIndirectOffset() {
        ArmOperand mem = ArmOperand.indirectRegister(ArmRegister.R1, 8);
        OperandFragment<AstExpr> rval = mem.astRvalue(astree, "0x10", "");
        assertEquals("*(R1 + 8)", rval.getNode().toString());
        assertTrue(rval.getPreInstructions().isEmpty());
        assertTrue(rval.getPostInstructions().isEmpty());

        ArmOperand zero = ArmOperand.indirectRegister(ArmRegister.R1, 0);
        assertEquals("*R1", zero.astLvalue(astree, "0x10", "").getNode().toString());
    }

    @Test
    public void testPreIndexedWriteback() {
        ArmOperand mem = ArmOperand.indirectRegister(ArmRegister.R1, 4, IndexMode.PRE_INDEX, 4);
        OperandFragment<AstExpr> rval = mem.astRvalue(astree, "0x10", "");
        assertEquals("*R1", rval.getNode().toString());
        assertEquals(1, rval.getPreInstructions().size());
        assertEquals("R1 = R1 + 4", rval.getPreInstructions().get(0).toString());
        assertEquals(List.of("writeback"), rval.getPreInstructions().get(0).getAnnotations());
        assertTrue(rval.getPostInstructions().isEmpty());
    }

    @Test
    public void testPostIndexedWriteback() {
        ArmOperand mem = ArmOperand.indirectRegister(ArmRegister.R1, 4, IndexMode.POST_INDEX, 4);
        OperandFragment<AstLval> lval = mem.astLvalue(astree, "0x10", "");
        assertEquals("*R1", lval.getNode().toString());
        assertTrue(lval.getPreInstructions().isEmpty());
        assertEquals("R1 = R1 + 4", lval.getPostInstructions().get(0).toString());
    }

    @Test
    public void testContractViolations() {
        assertThrows(IllegalStateException.class,
            () -> ArmOperand.immediate(3).astLvalue(astree, "0x10", ""));
        ArmOperand list = ArmOperand.registerList(List.of(ArmRegister.R1));
        assertThrows(IllegalStateException.class, () -> list.astLvalue(astree, "0x10", ""));
        assertThrows(IllegalStateException.class, () -> list.astRvalue(astree, "0x10", ""));
    }

    @Test
    public void testAbsolute() {
        ArmOperand abs = ArmOperand.absolute(0x2000);
        assertEquals("*8192", abs.astRvalue(astree, "0x10", "").getNode().toString());
    }
}
