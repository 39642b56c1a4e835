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
import java.util.Collections;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * STR&lt;c&gt; &lt;Rt&gt;, &lt;memory&gt;
 *
 * <pre>
 * args[0]: index of Rt in the operand table
 * args[1]: index of the memory operand in the operand table
 *
 * vars[0]: memory location written
 * xprs[0]: value of Rt
 * xprs[1]: value of Rt (simplified)
 * rdefs[0]: Rt
 * rdefs[1]: base register
 * uses[0]: memory location written
 * </pre>
 */
public class StoreRegister extends ArmOpcode {
    private static final Logger LOG = LoggerFactory.getLogger(StoreRegister.class);

    static class StoreRegisterFacts extends ArmOpcodeFacts {
        final XVariable lhs;
        final XExpr rhs;
        final XExpr rrhs;
        final ReachingDefinition rtRdef;
        final ReachingDefinition baseRdef;
        final DefUses uses;
        final DefUses usesHigh;

        StoreRegisterFacts(FactBundle bundle) {
            super(bundle, 1, 2);
            this.lhs = var(0);
            this.rhs = xpr(0);
            this.rrhs = xpr(1);
            this.rtRdef = rdef(0);
            this.baseRdef = rdef(1);
            this.uses = uses(0);
            this.usesHigh = usesHigh(0);
        }
    }

    public StoreRegister(OperandTable operandTable, InstructionRecord record) {
        super(operandTable, record);
        checkKey(2, 2, "StoreRegister");
    }

    @Override
    public List<ArmOperand> operands() {
        return List.of(operand(0), operand(1));
    }

    @Override
    public String annotation(FactBundle bundle) {
        StoreRegisterFacts facts = new StoreRegisterFacts(bundle);
        if (!facts.isOk()) {
            return ERROR_VALUE;
        }
        return addInstructionCondition(
            bundle, facts.lhs + " := " + simplifyResult(facts.rhs, facts.rrhs));
    }

    @Override
    public InstructionPair liftToAst(
            LiftContext context, String iaddr, String bytestring, FactBundle bundle) {
        StoreRegisterFacts facts = new StoreRegisterFacts(bundle);
        if (!facts.isOk()) {
            LOG.error("Error value encountered at address {}", iaddr);
            return InstructionPair.empty();
        }

        AstInterface astree = context.getAstree();
        AstEmitter emitter = new AstEmitter(context, iaddr, bytestring, astAnnotations(iaddr));

        OperandFragment<AstLval> llLhs = operand(1).astLvalue(astree, iaddr, bytestring);
        AstExpr llRhs = operand(0).astRvalue(astree, iaddr, bytestring).getNode();

        AstLval hlLhs = emitter.hlLval(facts.lhs, llLhs.getNode());
        AstExpr hlRhs = emitter.hlExpr(facts.rrhs, llRhs);

        List<ReachingDefinition> llRdefs = new ArrayList<>();
        llRdefs.add(facts.rtRdef);
        llRdefs.add(facts.baseRdef);

        emitter.addLowLevel(llLhs.getPreInstructions());
        emitter.assignPair(
            hlLhs, hlRhs, llLhs.getNode(), llRhs,
            Collections.singletonList(facts.rtRdef), llRdefs,
            facts.uses, facts.usesHigh);
        emitter.addLowLevel(llLhs.getPostInstructions());
        return emitter.toPair();
    }
}
