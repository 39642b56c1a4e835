/*
 * Copyright (c) 2025, Trail of Bits, Inc.
 *
 * This source code is licensed in accordance with the terms specified in
 * the LICENSE file found in the root directory of this source tree.
 */

package arm.opcodes;

import domain.ArmOperand;
import domain.InstructionRecord;
import domain.OperandTable;

/**
 * POP&lt;c&gt; &lt;registers&gt;
 *
 * <pre>
 * tags[1]: &lt;c&gt;
 * args[0]: index of SP in the operand table
 * args[1]: index of the register list in the operand table
 * args[2]: index of the stack memory operand in the operand table
 * </pre>
 *
 * Same as LDM SP!, &lt;registers&gt;.
 */
public class Pop extends ArmMultipleTransfer {
    public Pop(OperandTable operandTable, InstructionRecord record) {
        super(operandTable, record);
        checkKey(2, 3, "Pop");
    }

    @Override
    public boolean isLoad() {
        return true;
    }

    @Override
    public boolean isDecrementBefore() {
        return false;
    }

    @Override
    public boolean isWriteback() {
        return true;
    }

    @Override
    public ArmOperand baseOperand() {
        return operand(0);
    }

    @Override
    public ArmOperand registersOperand() {
        return operand(1);
    }
}
