/*
 * Copyright (c) 2025, Trail of Bits, Inc.
 *
 * This source code is licensed in accordance with the terms specified in
 * the LICENSE file found in the root directory of this source tree.
 */

package arm;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.*;

import ast.AstBranch;
import ast.AstGoto;
import ast.AstInstrSequence;
import ast.AstInstruction;
import ast.AstProvenance;
import ast.AstStmt;

import domain.CallTarget;
import domain.DecodedFunction;
import domain.DecodedInstruction;
import domain.FactBundle;
import domain.XExpr;
import domain.XVariable;

import java.util.List;

public class FunctionLifterTest extends BaseOpcodeTest {
    FunctionLifter lifter = new FunctionLifter();

    private DecodedFunction sample() {
        FactBundle mov = FactBundle.builder()
            .vars(new XVariable("count"))
            .xprs(XExpr.constant(4), XExpr.constant(4))
            .defUses(uses("count", "0x1004"))
            .build();
        FactBundle cbz = FactBundle.builder()
            .branchConditions(true)
            .xprs(
                XExpr.variable("count"),
                XExpr.op("eq", XExpr.variable("count"), XExpr.constant(0)),
                XExpr.op("ne", XExpr.variable("count"), XExpr.constant(0)),
                XExpr.op("eq", XExpr.variable("count"), XExpr.constant(0)),
                XExpr.op("ne", XExpr.variable("count"), XExpr.constant(0)),
                XExpr.constant(0x2000))
            .reachingDefinitions(rdef("R0", "0x1000"))
            .build();
        FactBundle bl = FactBundle.builder()
            .tags("bl", "call")
            .xprs(XExpr.variable("count"))
            .callTarget(new CallTarget("process", 0x2000L), 1)
            .build();
        FactBundle bx = FactBundle.builder()
            .xprs(XExpr.variable("LR"), XExpr.variable("LR"))
            .build();

        return new DecodedFunction("main", "0x1000", operands, List.of(
            new DecodedInstruction("0x1000", "0400a0e3", record("MOV", 0, OP_R0, OP_IMM_4), mov),
            new DecodedInstruction("0x1004", "08b1", record(List.of("CBZ"), OP_R0, OP_ABS), cbz),
            new DecodedInstruction("0x1006", "00f0fbff", record("BL", OP_ABS), bl),
            new DecodedInstruction("0x100a", "7047", record("BX", OP_LR), bx)));
    }

    @Test
    public void testStatementStructure() {
        LiftedFunction lifted = lifter.lift(sample());

        List<AstStmt> high = lifted.getHighLevelBody().getStmts();
        List<AstStmt> low = lifted.getLowLevelBody().getStmts();
        assertEquals(3, high.size());
        assertEquals(3, low.size());

        assertTrue(high.get(0) instanceof AstInstrSequence);
        assertTrue(high.get(1) instanceof AstBranch);
        assertTrue(high.get(2) instanceof AstInstrSequence);

        AstBranch hlBranch = (AstBranch) high.get(1);
        AstBranch llBranch = (AstBranch) low.get(1);
        assertEquals("count == 0", hlBranch.getCondition().toString());
        assertEquals("R0 == 0", llBranch.getCondition().toString());
        assertEquals("0x2000", ((AstGoto) hlBranch.getIfStmt()).getDestination());
        assertEquals(0x2000 - 0x1004, hlBranch.getRelativeOffset());

        AstProvenance provenance = lifted.getProvenance();
        assertEquals(
            llBranch.getCondition().getExprId(),
            provenance.getExpressionMapping(hlBranch.getCondition().getExprId()));
        assertEquals(List.of("0x1004"), provenance.getConditionAddresses(llBranch.getCondition().getExprId()));
    }

    @Test
    public void testInstructionLists() {
        LiftedFunction lifted = lifter.lift(sample());

        assertEquals(List.of("count = 4", "process(count)"), render(lifted.getHighLevelInstructions()));
        assertEquals(List.of("R0 = 4", "R0 = 0x2000(R0)", "/* BX */"), render(lifted.getLowLevelInstructions()));

        for (AstInstruction hl : lifted.getHighLevelInstructions()) {
            assertTrue(lifted.getProvenance().hasInstructionMapping(hl.getInstrId()));
        }
    }

    @Test
    public void testAnnotations() {
        LiftedFunction lifted = lifter.lift(sample());

        assertEquals("count := 4", lifted.getAnnotations().get("0x1000"));
        assertEquals("if (count == 0) goto 8192", lifted.getAnnotations().get("0x1004"));
        assertEquals("call process(count)", lifted.getAnnotations().get("0x1006"));
        assertEquals("goto LR", lifted.getAnnotations().get("0x100a"));
    }

    @Test
    public void testUnknownMnemonicAbortsTheFunction() {
        DecodedFunction function = new DecodedFunction("bad", "0x10", operands, List.of(
            new DecodedInstruction("0x10", "", record("VADD", OP_R0), FactBundle.invalid())));
        assertThrows(ArmDecodeException.class, () -> lifter.lift(function));
    }

    @Test
    public void testEachLiftOwnsItsIds() {
        LiftedFunction first = lifter.lift(sample());
        LiftedFunction second = lifter.lift(sample());
        assertNotSame(first.getAstree(), second.getAstree());
        assertEquals(
            first.getHighLevelInstructions().get(0).getInstrId(),
            second.getHighLevelInstructions().get(0).getInstrId());
    }
}
