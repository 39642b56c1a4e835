/*
 * Copyright (c) 2025, Trail of Bits, Inc.
 *
 * This source code is licensed in accordance with the terms specified in
 * the LICENSE file found in the root directory of this source tree.
 */

package arm.opcodes;

import arm.ArmOpcode;
import arm.AstEmitter;
import arm.InstructionPair;
import arm.LiftContext;

import domain.ArmOperand;
import domain.FactBundle;
import domain.InstructionRecord;
import domain.OperandTable;

import java.util.List;

public class NoOperation extends ArmOpcode {
    public NoOperation(OperandTable operandTable, InstructionRecord record) {
        super(operandTable, record);
        checkKey(1, 0, "NoOperation");
    }

    @Override
    public List<ArmOperand> operands() {
        return List.of();
    }

    @Override
    public String annotation(FactBundle bundle) {
        return "NOP";
    }

    @Override
    public InstructionPair liftToAst(
            LiftContext context, String iaddr, String bytestring, FactBundle bundle) {
        AstEmitter emitter = new AstEmitter(context, iaddr, bytestring, astAnnotations(iaddr));
        emitter.lowLevelNop("NOP");
        return emitter.toPair();
    }
}
