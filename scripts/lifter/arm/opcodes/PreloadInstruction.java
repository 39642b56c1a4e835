/*
 * Copyright (c) 2025, Trail of Bits, Inc.
 *
 * This source code is licensed in accordance with the terms specified in
 * the LICENSE file found in the root directory of this source tree.
 */

package arm.opcodes;

import arm.ArmOpcode;
import arm.ArmOpcodeFacts;
import arm.InstructionPair;
import arm.LiftContext;

import domain.ArmOperand;
import domain.FactBundle;
import domain.InstructionRecord;
import domain.OperandTable;
import domain.XExpr;

import java.util.List;

/**
 * PLI&lt;c&gt; &lt;memory&gt;
 *
 * <pre>
 * args[0]: index of the memory operand in the operand table
 * xprs[0]: memory address
 * </pre>
 */
public class PreloadInstruction extends ArmOpcode {
    static class PreloadInstructionFacts extends ArmOpcodeFacts {
        final XExpr xmem;

        PreloadInstructionFacts(FactBundle bundle) {
            super(bundle, 0, 1);
            this.xmem = xpr(0);
        }
    }

    public PreloadInstruction(OperandTable operandTable, InstructionRecord record) {
        super(operandTable, record);
        checkKey(2, 1, "PreloadInstruction");
    }

    @Override
    public List<ArmOperand> operands() {
        return List.of(operand(0));
    }

    @Override
    public String annotation(FactBundle bundle) {
        PreloadInstructionFacts facts = new PreloadInstructionFacts(bundle);
        if (!facts.isOk()) {
            return ERROR_VALUE;
        }
        return "Preload-instruction(" + facts.xmem + ")";
    }

    @Override
    public InstructionPair liftToAst(
            LiftContext context, String iaddr, String bytestring, FactBundle bundle) {
        return InstructionPair.empty();
    }
}
