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
import ast.AstLval;

import domain.ArmOperand;
import domain.DefUses;
import domain.FactBundle;
import domain.InstructionRecord;
import domain.OperandFragment;
import domain.OperandTable;
import domain.ReachingDefinition;
import domain.XExpr;
import domain.XVariable;

import java.util.Collections;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * MOV{S}&lt;c&gt; &lt;Rd&gt;, &lt;op2&gt;
 *
 * <pre>
 * args[0]: setflags
 * args[1]: index of Rd in the operand table
 * args[2]: index of op2 in the operand table
 *
 * vars[0]: lhs
 * xprs[0]: rhs
 * xprs[1]: rhs (simplified)
 * rdefs[0]: op2
 * uses[0]: lhs
 * </pre>
 */
public class Move extends ArmOpcode {
    private static final Logger LOG = LoggerFactory.getLogger(Move.class);

    static class MoveFacts extends ArmOpcodeFacts {
        final XVariable lhs;
        final XExpr rhs;
        final XExpr rrhs;
        final ReachingDefinition rhsRdef;
        final DefUses uses;
        final DefUses usesHigh;

        MoveFacts(FactBundle bundle) {
            super(bundle, 1, 2);
            this.lhs = var(0);
            this.rhs = xpr(0);
            this.rrhs = xpr(1);
            this.rhsRdef = rdef(0);
            this.uses = uses(0);
            this.usesHigh = usesHigh(0);
        }
    }

    public Move(OperandTable operandTable, InstructionRecord record) {
        super(operandTable, record);
        checkKey(2, 3, "Move");
    }

    public boolean isSetFlags() {
        return getArgs().get(0) == 1;
    }

    @Override
    public List<ArmOperand> operands() {
        return operandsFrom(1);
    }

    @Override
    public String annotation(FactBundle bundle) {
        MoveFacts facts = new MoveFacts(bundle);
        if (!facts.isOk()) {
            return ERROR_VALUE;
        }
        return addInstructionCondition(
            bundle, facts.lhs + " := " + simplifyResult(facts.rhs, facts.rrhs));
    }

    @Override
    public InstructionPair liftToAst(
            LiftContext context, String iaddr, String bytestring, FactBundle bundle) {
        MoveFacts facts = new MoveFacts(bundle);
        if (!facts.isOk()) {
            LOG.error("Error value encountered at address {}", iaddr);
            return InstructionPair.empty();
        }

        AstInterface astree = context.getAstree();
        AstEmitter emitter = new AstEmitter(context, iaddr, bytestring, astAnnotations(iaddr));

        AstLval llLhs = operand(1).astLvalue(astree, iaddr, bytestring).getNode();
        OperandFragment<AstExpr> llRhs = operand(2).astRvalue(astree, iaddr, bytestring);

        AstLval hlLhs = emitter.hlLval(facts.lhs, llLhs);
        AstExpr hlRhs = emitter.hlExpr(facts.rrhs, llRhs.getNode());

        List<ReachingDefinition> rdefs = Collections.singletonList(facts.rhsRdef);
        emitter.addLowLevel(llRhs.getPreInstructions());
        emitter.assignPair(
            hlLhs, hlRhs, llLhs, llRhs.getNode(), rdefs, rdefs, facts.uses, facts.usesHigh);
        emitter.addLowLevel(llRhs.getPostInstructions());

        if (isSetFlags()) {
            FlagSemantics.negativeZero(emitter, operand(1).astRvalue(astree, iaddr, bytestring).getNode());
        }
        return emitter.toPair();
    }
}
