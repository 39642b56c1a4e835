/*
 * Copyright (c) 2025, Trail of Bits, Inc.
 *
 * This source code is licensed in accordance with the terms specified in
 * the LICENSE file found in the root directory of this source tree.
 */

package arm.opcodes;

import arm.AstEmitter;
import arm.FlagSemantics;

import ast.AstExpr;

import domain.InstructionRecord;
import domain.OperandTable;

/**
 * SUB{S}&lt;c&gt; &lt;Rd&gt;, &lt;Rn&gt;, &lt;op2&gt;
 */
public class Subtract extends ArmArithmetic {
    public Subtract(OperandTable operandTable, InstructionRecord record) {
        super(operandTable, record, "Subtract");
    }

    @Override
    protected String operator() {
        return "minus";
    }

    @Override
    protected void updateFlags(AstEmitter emitter, AstExpr rn, AstExpr op2, AstExpr result) {
        FlagSemantics.subtraction(emitter, rn, op2, result);
    }
}
