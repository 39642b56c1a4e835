/*
 * Copyright (c) 2025, Trail of Bits, Inc.
 *
 * This source code is licensed in accordance with the terms specified in
 * the LICENSE file found in the root directory of this source tree.
 */

package arm.opcodes;

import arm.ArmOpcode;
import arm.ArmOpcodeFacts;
import arm.AstEmitter;
import arm.FlagSemantics;
import arm.InstructionPair;
import arm.LiftContext;

import ast.AstExpr;
import ast.AstInterface;

import domain.ArmOperand;
import domain.FactBundle;
import domain.InstructionRecord;
import domain.OperandFragment;
import domain.OperandTable;
import domain.ReachingDefinition;
import domain.XExpr;

import java.util.Collections;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * CMP&lt;c&gt; &lt;Rn&gt;, &lt;op2&gt;
 *
 * <pre>
 * xprs[0]: Rn
 * xprs[1]: op2
 * xprs[2]: Rn - op2 (simplified)
 * rdefs[0]: Rn
 * rdefs[1]: op2
 * </pre>
 */
public class Compare extends ArmOpcode {
    private static final Logger LOG = LoggerFactory.getLogger(Compare.class);

    static class CompareFacts extends ArmOpcodeFacts {
        final XExpr xrn;
        final XExpr xop2;
        final XExpr result;
        final ReachingDefinition rnRdef;
        final ReachingDefinition op2Rdef;

        CompareFacts(FactBundle bundle) {
            super(bundle, 0, 3);
            this.xrn = xpr(0);
            this.xop2 = xpr(1);
            this.result = xpr(2);
            this.rnRdef = rdef(0);
            this.op2Rdef = rdef(1);
        }
    }

    public Compare(OperandTable operandTable, InstructionRecord record) {
        super(operandTable, record);
        checkKey(2, 2, "Compare");
    }

    @Override
    public List<ArmOperand> operands() {
        return List.of(operand(0), operand(1));
    }

    @Override
    public String annotation(FactBundle bundle) {
        CompareFacts facts = new CompareFacts(bundle);
        if (!facts.isOk()) {
            return ERROR_VALUE;
        }
        return addInstructionCondition(
            bundle, "compare " + facts.xrn + " and " + facts.xop2 + " (" + facts.result + ")");
    }

    @Override
    public InstructionPair liftToAst(
            LiftContext context, String iaddr, String bytestring, FactBundle bundle) {
        CompareFacts facts = new CompareFacts(bundle);
        if (!facts.isOk()) {
            LOG.error("Error value encountered at address {}", iaddr);
            return InstructionPair.empty();
        }

        AstInterface astree = context.getAstree();
        AstEmitter emitter = new AstEmitter(context, iaddr, bytestring, astAnnotations(iaddr));

        AstExpr rn = operand(0).astRvalue(astree, iaddr, bytestring).getNode();
        OperandFragment<AstExpr> op2 = operand(1).astRvalue(astree, iaddr, bytestring);
        AstExpr difference = astree.mkBinaryOp("minus", rn, op2.getNode());

        emitter.addLowLevel(op2.getPreInstructions());
        FlagSemantics.subtraction(emitter, rn, op2.getNode(), difference);
        emitter.addLowLevel(op2.getPostInstructions());

        astree.addExprReachingDefs(rn, Collections.singletonList(facts.rnRdef));
        astree.addExprReachingDefs(op2.getNode(), Collections.singletonList(facts.op2Rdef));
        return emitter.toPair();
    }
}
