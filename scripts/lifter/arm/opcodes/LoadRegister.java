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
 * LDR&lt;c&gt; &lt;Rt&gt;, &lt;memory&gt;
 *
 * <pre>
 * args[0]: index of Rt in the operand table
 * args[1]: index of the memory operand in the operand table
 *
 * vars[0]: lhs
 * xprs[0]: value of the memory location
 * xprs[1]: value of the memory location (simplified)
 * rdefs[0]: base register
 * rdefs[1]: memory location
 * uses[0]: lhs
 * </pre>
 */
public class LoadRegister extends ArmOpcode {
    private static final Logger LOG = LoggerFactory.getLogger(LoadRegister.class);

    static class LoadRegisterFacts extends ArmOpcodeFacts {
        final XVariable lhs;
        final XExpr rhs;
        final XExpr rrhs;
        final ReachingDefinition baseRdef;
        final ReachingDefinition memRdef;
        final DefUses uses;
        final DefUses usesHigh;

        LoadRegisterFacts(FactBundle bundle) {
            super(bundle, 1, 2);
            this.lhs = var(0);
            this.rhs = xpr(0);
            this.rrhs = xpr(1);
            this.baseRdef = rdef(0);
            this.memRdef = rdef(1);
            this.uses = uses(0);
            this.usesHigh = usesHigh(0);
        }
    }

    public LoadRegister(OperandTable operandTable, InstructionRecord record) {
        super(operandTable, record);
        checkKey(2, 2, "LoadRegister");
    }

    @Override
    public List<ArmOperand> operands() {
        return List.of(operand(0), operand(1));
    }

    @Override
    public String annotation(FactBundle bundle) {
        LoadRegisterFacts facts = new LoadRegisterFacts(bundle);
        if (!facts.isOk()) {
            return ERROR_VALUE;
        }
        return addInstructionCondition(
            bundle, facts.lhs + " := " + simplifyResult(facts.rhs, facts.rrhs));
    }

    @Override
    public InstructionPair liftToAst(
            LiftContext context, String iaddr, String bytestring, FactBundle bundle) {
        LoadRegisterFacts facts = new LoadRegisterFacts(bundle);
        if (!facts.isOk()) {
            LOG.error("Error value encountered at address {}", iaddr);
            return InstructionPair.empty();
        }

        AstInterface astree = context.getAstree();
        AstEmitter emitter = new AstEmitter(context, iaddr, bytestring, astAnnotations(iaddr));

        AstLval llLhs = operand(0).astLvalue(astree, iaddr, bytestring).getNode();
        OperandFragment<AstExpr> llRhs = operand(1).astRvalue(astree, iaddr, bytestring);

        AstLval hlLhs = emitter.hlLval(facts.lhs, llLhs);
        AstExpr hlRhs = emitter.hlExpr(facts.rrhs, llRhs.getNode());

        List<ReachingDefinition> llRdefs = new ArrayList<>();
        llRdefs.add(facts.baseRdef);
        llRdefs.add(facts.memRdef);

        emitter.addLowLevel(llRhs.getPreInstructions());
        emitter.assignPair(
            hlLhs, hlRhs, llLhs, llRhs.getNode(),
            Collections.singletonList(facts.memRdef), llRdefs,
            facts.uses, facts.usesHigh);
        emitter.addLowLevel(llRhs.getPostInstructions());
        return emitter.toPair();
    }
}
