/*
 * Copyright (c) 2025, Trail of Bits, Inc.
 *
 * This source code is licensed in accordance with the terms specified in
 * the LICENSE file found in the root directory of this source tree.
 */

package arm.opcodes;

import domain.InstructionRecord;
import domain.OperandTable;

/**
 * CBZ &lt;Rn&gt;, &lt;label&gt;: branches forward when Rn is zero.
 */
public class CompareBranchZero extends ArmCompareBranch {
    public CompareBranchZero(OperandTable operandTable, InstructionRecord record) {
        super(operandTable, record, "CompareBranchZero (CBZ)");
    }

    @Override
    protected String comparison(boolean reverse) {
        return reverse ? "ne" : "eq";
    }
}
