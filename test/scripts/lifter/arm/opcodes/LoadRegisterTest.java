/*
 * Copyright (c) 2025, Trail of Bits, Inc.
 *
 * This source code is licensed in accordance with the terms specified in
 * the LICENSE file found in the root directory of this source tree.
 */

package arm.opcodes;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.*;

import arm.BaseOpcodeTest;
import arm.InstructionPair;

import ast.AstAssign;

import domain.FactBundle;
import domain.XExpr;
import domain.XVariable;

import java.util.List;

public class LoadRegisterTest extends BaseOpcodeTest {
    private static FactBundle facts() {
        return FactBundle.builder()
            .vars(new XVariable("len"))
            .xprs(XExpr.variable("buf_len"), XExpr.variable("buf_len"))
            .reachingDefinitions(rdef("R1", "0xff0"), rdef("buf_len", "0xff4"))
            .defUses(uses("R0", "0x1008"))
            .build();
    }

    @Test
    public void testOffsetLoad() {
        LoadRegister ldr = new LoadRegister(operands, record("LDR", OP_R0, OP_MEM_R2));

        InstructionPair pair = ldr.liftToAst(context, IADDR, BYTES, facts());

        assertEquals(List.of("R0 = *(R2 + 4)"), render(pair.getLowLevel()));
        assertEquals(List.of("len = buf_len"), render(pair.getHighLevel()));
        assertEquals("len := buf_len", ldr.annotation(facts()));
    }

    @Test
    public void testPreIndexedWritebackComesFirst() {
        LoadRegister ldr = new LoadRegister(operands, record("LDR", OP_R0, OP_MEM_R1_PRE));

        InstructionPair pair = ldr.liftToAst(context, IADDR, BYTES, facts());

        assertEquals(List.of("R1 = R1 + 4", "R0 = *R1"), render(pair.getLowLevel()));
        assertEquals(1, pair.getHighLevel().size());
        assertEquals(List.of("writeback"), ((AstAssign) pair.getLowLevel().get(0)).getAnnotations());
        assertEquals("LDR R0, [R1, #4]!", ldr.toString());
    }

    @Test
    public void testPostIndexedWritebackComesLast() {
        LoadRegister ldr = new LoadRegister(operands, record("LDR", OP_R0, OP_MEM_R1_POST));

        InstructionPair pair = ldr.liftToAst(context, IADDR, BYTES, facts());

        assertEquals(List.of("R0 = *R1", "R1 = R1 + 4"), render(pair.getLowLevel()));
        assertEquals(List.of("len = buf_len"), render(pair.getHighLevel()));
    }

    @Test
    public void testConditionalAnnotation() {
        LoadRegister ldr = new LoadRegister(operands, record(List.of("LDR", "NE"), OP_R0, OP_MEM_R2));
        FactBundle facts = FactBundle.builder()
            .vars(new XVariable("len"))
            .xprs(XExpr.variable("buf_len"), XExpr.variable("buf_len"))
            .instructionCondition(XExpr.op("ne", XExpr.variable("len"), XExpr.constant(0)))
            .build();

        assertEquals("if (len != 0) then len := buf_len", ldr.annotation(facts));
        assertEquals("LDRNE R0, [R2, #4]", ldr.toString());
    }
}
