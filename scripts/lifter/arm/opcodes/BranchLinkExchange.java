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
 * BLX&lt;c&gt; &lt;label&gt; or BLX&lt;c&gt; &lt;Rm&gt;. Lifted exactly as BL; the
 * instruction set switch has no AST counterpart.
 */
public class BranchLinkExchange extends BranchLink {
    public BranchLinkExchange(OperandTable operandTable, InstructionRecord record) {
        super(operandTable, record, "BranchLinkExchange");
    }
}
