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

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shared lifting of two-operand data-processing instructions,
 * &lt;op&gt;{S}&lt;c&gt; &lt;Rd&gt;, &lt;Rn&gt;, &lt;op2&gt;.
 *
 * <pre>
 * args[0]: setflags
 * args[1]: index of Rd in the operand table
 * args[2]: index of Rn in the operand table
 * args[3]: index of op2 in the operand table
 *
 * vars[0]: lhs
 * xprs[0]: Rn
 * xprs[1]: op2
 * xprs[2]: result
 * xprs[3]: result (simplified)
 * rdefs[0]: Rn
 * rdefs[1]: op2
 * uses[0]: lhs
 * </pre>
 */
public abstract class ArmArithmetic extends ArmOpcode {
    private static final Logger LOG = LoggerFactory.getLogger(ArmArithmetic.class);

    static class ArithmeticFacts extends ArmOpcodeFacts {
        final XVariable lhs;
        final XExpr xrn;
        final XExpr xop2;
        final XExpr result;
        final XExpr rresult;
        final DefUses uses;
        final DefUses usesHigh;

        ArithmeticFacts(FactBundle bundle) {
            super(bundle, 1, 4);
            this.lhs = var(0);
            this.xrn = xpr(0);
            this.xop2 = xpr(1);
            this.result = xpr(2);
            this.rresult = xpr(3);
            this.uses = uses(0);
            this.usesHigh = usesHigh(0);
        }

        List<ReachingDefinition> operandRdefs() {
            List<ReachingDefinition> rdefs = new ArrayList<>();
            rdefs.add(rdef(0));
            rdefs.add(rdef(1));
            return rdefs;
        }
    }

    protected ArmArithmetic(OperandTable operandTable, InstructionRecord record, String name) {
        super(operandTable, record);
        checkKey(2, 4, name);
    }

    // AST binary operator computing the result from Rn and op2.
    protected abstract String operator();

    protected abstract void updateFlags(AstEmitter emitter, AstExpr rn, AstExpr op2, AstExpr result);

    public boolean isSetFlags() {
        return getArgs().get(0) == 1;
    }

    @Override
    public List<ArmOperand> operands() {
        return operandsFrom(1);
    }

    @Override
    public String annotation(FactBundle bundle) {
        ArithmeticFacts facts = new ArithmeticFacts(bundle);
        if (!facts.isOk()) {
            return ERROR_VALUE;
        }
        return addInstructionCondition(
            bundle, facts.lhs + " := " + simplifyResult(facts.result, facts.rresult));
    }

    @Override
    public InstructionPair liftToAst(
            LiftContext context, String iaddr, String bytestring, FactBundle bundle) {
        ArithmeticFacts facts = new ArithmeticFacts(bundle);
        if (!facts.isOk()) {
            LOG.error("Error value encountered at address {}", iaddr);
            return InstructionPair.empty();
        }

        AstInterface astree = context.getAstree();
        AstEmitter emitter = new AstEmitter(context, iaddr, bytestring, astAnnotations(iaddr));

        AstLval llLhs = operand(1).astLvalue(astree, iaddr, bytestring).getNode();
        AstExpr rn = operand(2).astRvalue(astree, iaddr, bytestring).getNode();
        OperandFragment<AstExpr> op2 = operand(3).astRvalue(astree, iaddr, bytestring);
        AstExpr llRhs = astree.mkBinaryOp(operator(), rn, op2.getNode());

        AstLval hlLhs = emitter.hlLval(facts.lhs, llLhs);
        AstExpr hlRhs = emitter.hlExpr(facts.rresult, llRhs);

        List<ReachingDefinition> rdefs = facts.operandRdefs();
        emitter.addLowLevel(op2.getPreInstructions());
        emitter.assignPair(hlLhs, hlRhs, llLhs, llRhs, rdefs, rdefs, facts.uses, facts.usesHigh);
        emitter.addLowLevel(op2.getPostInstructions());

        if (isSetFlags()) {
            updateFlags(emitter, rn, op2.getNode(), llRhs);
        }
        return emitter.toPair();
    }
}
