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
 * STM&lt;c&gt; &lt;Rn&gt;{!}, &lt;registers&gt;
 *
 * <pre>
 * tags[1]: &lt;c&gt;
 * args[0]: writeback
 * args[1]: index of Rn in the operand table
 * args[2]: index of the register list in the operand table
 * args[3]: index of the base memory operand in the operand table
 * </pre>
 */
public class StoreMultipleIncrementAfter extends ArmMultipleTransfer {
    public StoreMultipleIncrementAfter(OperandTable operandTable, InstructionRecord record) {
        super(operandTable, record);
        checkKey(2, 4, "StoreMultipleIncrementAfter");
    }

    @Override
    public boolean isLoad() {
        return false;
    }

    @Override
    public boolean isDecrementBefore() {
        return false;
    }

    @Override
    public boolean isWriteback() {
        return getArgs().get(0) == 1;
    }

    @Override
    public ArmOperand baseOperand() {
        return operand(1);
    }

    @Override
    public ArmOperand registersOperand() {
        return operand(2);
    }
}
