/*
 * Copyright (c) 2025, Trail of Bits, Inc.
 *
 * This source code is licensed in accordance with the terms specified in
 * the LICENSE file found in the root directory of this source tree.
 */

package arm.opcodes;

import arm.ArmCallOpcode;
import arm.ArmOpcodeFacts;
import arm.AstEmitter;
import arm.InstructionPair;
import arm.LiftContext;

import domain.ArmOperand;
import domain.ArmRegister;
import domain.FactBundle;
import domain.InstructionRecord;
import domain.OperandTable;
import domain.XExpr;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * BX&lt;c&gt; &lt;Rm&gt;
 *
 * <pre>
 * tags[1]: &lt;c&gt;
 * args[0]: index of the target register in the operand table
 *
 * xprs[0]: target
 * xprs[1]: target (simplified)
 * </pre>
 *
 * When the analysis classifies the instruction as a call (bundle tags[1] is
 * "call") and resolved its target, it is lifted as a call. Otherwise only a
 * low-level nop is emitted; in particular BX LR does not become a return
 * statement.
 */
public class BranchExchange extends ArmCallOpcode {
    private static final Logger LOG = LoggerFactory.getLogger(BranchExchange.class);

    static class BranchExchangeFacts extends ArmOpcodeFacts {
        final XExpr xtgt;
        final XExpr xxtgt;

        BranchExchangeFacts(FactBundle bundle) {
            super(bundle, 0, 2);
            this.xtgt = xpr(0);
            this.xxtgt = xpr(1);
        }
    }

    public BranchExchange(OperandTable operandTable, InstructionRecord record) {
        super(operandTable, record);
        checkKey(2, 1, "BranchExchange");
    }

    @Override
    public List<ArmOperand> operands() {
        return List.of(operand(0));
    }

    public boolean isReturnInstruction() {
        ArmOperand target = operand(0);
        return target.isRegister() && target.getRegister() == ArmRegister.LR;
    }

    public XExpr returnValue(FactBundle bundle) {
        return bundle.hasReturnXpr() ? bundle.getReturnXprSimplified() : null;
    }

    private boolean isResolvedCall(FactBundle bundle) {
        return isCall(bundle) && bundle.hasCallTarget();
    }

    @Override
    public String annotation(FactBundle bundle) {
        if (bundle.isValid() && isResolvedCall(bundle)) {
            return callAnnotation(bundle);
        }
        BranchExchangeFacts facts = new BranchExchangeFacts(bundle);
        if (!facts.isOk()) {
            return ERROR_VALUE;
        }
        if (bundle.hasReturnXpr()) {
            return addInstructionCondition(bundle, "return " + bundle.getReturnXprSimplified());
        }
        return addInstructionCondition(bundle, "goto " + facts.xxtgt);
    }

    @Override
    public InstructionPair liftToAst(
            LiftContext context, String iaddr, String bytestring, FactBundle bundle) {
        if (!bundle.isValid()) {
            LOG.error("Error value encountered at address {}", iaddr);
            return InstructionPair.empty();
        }
        if (isResolvedCall(bundle)) {
            return liftCall(context, iaddr, bytestring, bundle);
        }
        AstEmitter emitter = new AstEmitter(context, iaddr, bytestring, astAnnotations(iaddr));
        emitter.lowLevelNop("BX");
        return emitter.toPair();
    }
}
