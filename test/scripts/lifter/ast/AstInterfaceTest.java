/*
 * Copyright (c) 2025, Trail of Bits, Inc.
 *
 * This source code is licensed in accordance with the terms specified in
 * the LICENSE file found in the root directory of this source tree.
 */

package ast;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.*;

import java.util.List;

public class AstInterfaceTest {
    AstInterface astree;

    @BeforeEach
    public void setUp() {
        astree = new AstInterface();
    }

    @Test
    public void testVarInfoIsCreatedOncePerName() {
        AstVarInfo first = astree.mkVarInfo("R0");
        AstVarInfo second = astree.mkVarInfo("R0", astree.mkSignedIntType(), null, null, "ignored");
        assertSame(first, second);
        assertNull(second.getType());
        assertEquals(1, astree.getSymbolTable().size());
        assertTrue(astree.hasVarInfo("R0"));
        assertFalse(astree.hasVarInfo("R1"));
    }

    @Test
    public void testConstructionIdsIncrease() {
        AstExpr a = astree.mkIntegerConstant(1);
        AstExpr b = astree.mkVariableExpr("R1");
        AstExpr c = astree.mkBinaryOp("plus", a, b);
        assertTrue(a.getExprId() < b.getExprId());
        assertTrue(b.getExprId() < c.getExprId());

        AstLval l1 = astree.mkVariableLval("R2");
        AstLval l2 = astree.mkVariableLval("R2");
        assertEquals(l1.getLvalId() + 1, l2.getLvalId());
    }

    @Test
    public void testUnknownOperatorsAreRejected() {
        AstExpr zero = astree.mkIntegerConstant(0);
        assertThrows(IllegalArgumentException.class, () -> astree.mkBinaryOp("rotl", zero, zero));
        assertThrows(IllegalArgumentException.class, () -> astree.mkUnaryOp("plus", zero));
        assertDoesNotThrow(() -> astree.mkUnaryOp("bnot", zero));
    }

    @Test
    public void testInstructionsRecordTheirSpan() {
        AstAssign assign = astree.mkAssign(
            astree.mkVariableLval("R0"), astree.mkIntegerConstant(7),
            "0x8000", "0700a0e3", List.of("0x8000", "MOV"));
        AstNopInstruction nop = astree.mkNopInstruction("NOP", "0x8004", "00f020e3", List.of());

        InstructionSpan span = astree.getSpanMap().get(assign.getLocationId());
        assertEquals("0x8000", span.getAddress());
        assertEquals("0700a0e3", span.getBytes());
        assertEquals("0x8004", astree.getSpanMap().get(nop.getLocationId()).getAddress());
        assertEquals(assign.getInstrId() + 1, nop.getInstrId());
        assertEquals(List.of("0x8000", "MOV"), assign.getAnnotations());
    }

    @Test
    public void testCompInfoKeysAreUnique() {
        AstFieldInfo next = astree.mkFieldInfo("next", astree.mkPointerType(astree.mkVoidType()), 3, 0);
        astree.mkCompInfo("node", 3, false, List.of(next));

        assertThrows(IllegalStateException.class, () -> astree.mkCompInfo("other", 3, false, List.of()));
        assertThrows(IllegalArgumentException.class, () -> astree.getCompInfo(4));
        assertEquals("node", astree.getCompInfo(3).getCompName());
    }

    @Test
    public void testFieldOffsetRequiresKnownField() {
        AstFieldInfo size = astree.mkFieldInfo("size", astree.mkUnsignedIntType(), 1, 4);
        astree.mkCompInfo("buffer", 1, false, List.of(size));

        AstFieldOffset offset = astree.mkFieldOffset("size", 1, astree.mkNoOffset());
        assertEquals("size", offset.getFieldName());
        assertThrows(IllegalArgumentException.class,
            () -> astree.mkFieldOffset("data", 1, astree.mkNoOffset()));
    }

    @Test
    public void testIntegerTypesAreShared() {
        assertSame(astree.mkSignedIntType(), astree.mkIntType("iint"));
        assertNotSame(astree.mkSignedIntType(), astree.mkUnsignedIntType());
        assertSame(astree.mkVoidType(), astree.mkVoidType());
    }

    @Test
    public void testInstrMappingToDifferentTargetFails() {
        AstAssign hl = astree.mkAssign(
            astree.mkVariableLval("x"), astree.mkIntegerConstant(1), "0x10", "", List.of());
        AstAssign ll1 = astree.mkAssign(
            astree.mkVariableLval("R0"), astree.mkIntegerConstant(1), "0x10", "", List.of());
        AstAssign ll2 = astree.mkAssign(
            astree.mkVariableLval("R1"), astree.mkIntegerConstant(1), "0x10", "", List.of());

        astree.addInstrMapping(hl, ll1);
        assertDoesNotThrow(() -> astree.addInstrMapping(hl, ll1));
        assertThrows(IllegalStateException.class, () -> astree.addInstrMapping(hl, ll2));
        assertEquals(ll1.getInstrId(), astree.getProvenance().getInstructionMapping(hl.getInstrId()));
    }
}
