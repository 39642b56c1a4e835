/*
 * Copyright (c) 2025, Trail of Bits, Inc.
 *
 * This source code is licensed in accordance with the terms specified in
 * the LICENSE file found in the root directory of this source tree.
 */

package arm.opcodes;

import arm.ArmCallOpcode;
import arm.InstructionPair;
import arm.LiftContext;

import domain.ArmOperand;
import domain.FactBundle;
import domain.InstructionRecord;
import domain.OperandTable;

import java.util.List;

/**
 * BL&lt;c&gt; &lt;label&gt;
 *
 * <pre>
 * tags[1]: &lt;c&gt;
 * args[0]: index of the target in the operand table
 *
 * xprs[0..argc-1]:  arguments
 * vars[0]:          return value (optional)
 * rdefs[0..argc-1]: arguments
 * uses[0]:          return value
 * </pre>
 */
public class BranchLink extends ArmCallOpcode {
    public BranchLink(OperandTable operandTable, InstructionRecord record) {
        this(operandTable, record, "BranchLink");
    }

    protected BranchLink(OperandTable operandTable, InstructionRecord record, String name) {
        super(operandTable, record);
        checkKey(2, 1, name);
    }

    @Override
    public List<ArmOperand> operands() {
        return List.of(operand(0));
    }

    @Override
    public boolean isCall(FactBundle bundle) {
        return true;
    }

    @Override
    public String annotation(FactBundle bundle) {
        if (!bundle.isValid()) {
            return ERROR_VALUE;
        }
        return addInstructionCondition(bundle, callAnnotation(bundle));
    }

    @Override
    public InstructionPair liftToAst(
            LiftContext context, String iaddr, String bytestring, FactBundle bundle) {
        return liftCall(context, iaddr, bytestring, bundle);
    }
}
