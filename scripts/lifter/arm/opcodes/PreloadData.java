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
 * PLD&lt;c&gt; &lt;memory&gt; and PLDW&lt;c&gt; &lt;memory&gt;: hints that data at the
 * address is likely to be read (or written). Nothing is lifted.
 *
 * <pre>
 * args[0]: is-write (1 for PLDW)
 * args[1]: index of the base register in the operand table
 * args[2]: index of the memory operand in the operand table
 *
 * xprs[0]: base
 * xprs[1]: memory address
 * </pre>
 */
public class PreloadData extends ArmOpcode {
    static class PreloadDataFacts extends ArmOpcodeFacts {
        final XExpr xbase;
        final XExpr xmem;

        PreloadDataFacts(FactBundle bundle) {
            super(bundle, 0, 2);
            this.xbase = xpr(0);
            this.xmem = xpr(1);
        }
    }

    public PreloadData(OperandTable operandTable, InstructionRecord record) {
        super(operandTable, record);
        checkKey(2, 3, "PreloadData");
    }

    public boolean isWrite() {
        return getArgs().get(0) == 1;
    }

    @Override
    public List<ArmOperand> operands() {
        return operandsFrom(1);
    }

    @Override
    public String annotation(FactBundle bundle) {
        PreloadDataFacts facts = new PreloadDataFacts(bundle);
        if (!facts.isOk()) {
            return ERROR_VALUE;
        }
        return "Preload-data(" + facts.xmem + ")";
    }

    @Override
    public InstructionPair liftToAst(
            LiftContext context, String iaddr, String bytestring, FactBundle bundle) {
        return InstructionPair.empty();
    }
}
