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

public class AstPrettyPrinterTest {
    AstInterface astree;

    @BeforeEach
    public void setUp() {
        astree = new AstInterface();
    }

    @Test
    public void testMemoryAccessIsParenthesized() {
        AstExpr address = astree.mkBinaryOp(
            "plus", astree.mkVariableExpr("SP"), astree.mkIntegerConstant(8));
        AstAssign assign = astree.mkAssign(
            astree.mkVariableLval("R0"), astree.mkMemRefExpr(address), "0x10", "", List.of());
        assertEquals("R0 = *(SP + 8)", assign.toString());
    }

    @Test
    public void testCall() {
        AstCall call = astree.mkCall(
            astree.mkVariableLval("R0"),
            astree.mkVariableExpr("printf"),
            List.of(astree.mkVariableExpr("R0"), astree.mkIntegerConstant(3)),
            "0x10", "", List.of());
        assertEquals("R0 = printf(R0, 3)", call.toString());

        AstCall noResult = astree.mkCall(
            null, astree.mkVariableExpr("abort"), List.of(), "0x14", "", List.of());
        assertEquals("abort()", noResult.toString());
    }

    @Test
    public void testBranchWithGoto() {
        AstExpr cond = astree.mkBinaryOp("eq", astree.mkVariableExpr("R3"), astree.mkIntegerConstant(0));
        AstBranch branch = astree.mkBranch(cond, astree.mkGoto("0x2040"), astree.mkBlock(List.of()), 32);
        assertEquals("if (R3 == 0) {\n  goto 0x2040;\n}\n", branch.toString());
    }

    @Test
    public void testInstructionSequence() {
        AstInstrSequence seq = astree.mkInstrSequence(List.of(
            astree.mkAssign(astree.mkVariableLval("R1"), astree.mkIntegerConstant(1), "0x10", "", List.of()),
            astree.mkNopInstruction("BX", "0x14", "", List.of())));
        assertEquals("R1 = 1;\n/* BX */;\n", seq.toString());
    }

    @Test
    public void testCastAndUnary() {
        AstExpr cast = astree.mkCastExpr(
            astree.mkUnsignedIntType(),
            astree.mkBinaryOp("shiftrt", astree.mkVariableExpr("R2"), astree.mkIntegerConstant(4)));
        assertEquals("(unsigned int)(R2 >> 4)", cast.toString());
        assertEquals("!R0", astree.mkUnaryOp("lnot", astree.mkVariableExpr("R0")).toString());
    }

    @Test
    public void testGlobalAddressIsHex() {
        AstExpr gaddr = astree.mkGlobalAddressConstant(0x2000, astree.mkIntegerConstant(0x2000));
        assertEquals("0x2000", gaddr.toString());
    }
}
