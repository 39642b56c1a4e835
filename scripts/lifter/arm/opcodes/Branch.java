/*
 * Copyright (c) 2025, Trail of Bits, Inc.
 *
 * This source code is licensed in accordance with the terms specified in
 * the LICENSE file found in the root directory of this source tree.
 */

package arm.opcodes;

import arm.ArmConditionCode;
import arm.ArmOpcode;
import arm.ArmOpcodeFacts;
import arm.AstEmitter;
import arm.ConditionPair;
import arm.ConditionalBranch;
import arm.InstructionPair;
import arm.LiftContext;

import ast.AstExpr;
import ast.AstInterface;

import domain.ArmOperand;
import domain.FactBundle;
import domain.InstructionRecord;
import domain.OperandTable;
import domain.XExpr;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * B&lt;c&gt; &lt;label&gt;
 *
 * <pre>
 * tags[1]: &lt;c&gt;
 * args[0]: index of the target in the operand table
 *
 * with branch conditions:
 * xprs[0]: true condition
 * xprs[1]: false condition
 * xprs[2]: true condition (simplified)
 * xprs[3]: false condition (simplified)
 * rdefs:   flag definitions
 * </pre>
 *
 * The transfer of control itself is expressed as a statement by the function
 * lifter, so no instructions are emitted for it.
 */
public class Branch extends ArmOpcode implements ConditionalBranch {
    private static final Logger LOG = LoggerFactory.getLogger(Branch.class);

    static class BranchFacts extends ArmOpcodeFacts {
        final XExpr tcond;
        final XExpr fcond;
        final XExpr tcondSimplified;
        final XExpr fcondSimplified;

        BranchFacts(FactBundle bundle) {
            super(bundle, 0, bundle.hasBranchConditions() ? 4 : 0);
            this.tcond = xpr(0);
            this.fcond = xpr(1);
            this.tcondSimplified = xpr(2);
            this.fcondSimplified = xpr(3);
        }
    }

    public Branch(OperandTable operandTable, InstructionRecord record) {
        super(operandTable, record);
        checkKey(2, 1, "Branch");
    }

    @Override
    public List<ArmOperand> operands() {
        return List.of(operand(0));
    }

    @Override
    public boolean isConditional() {
        return !getConditionCode().isUnconditional();
    }

    @Override
    public ArmOperand branchTarget() {
        return operand(0);
    }

    @Override
    public List<XExpr> ftConditions(FactBundle bundle) {
        if (!bundle.hasBranchConditions()) {
            return List.of();
        }
        BranchFacts facts = new BranchFacts(bundle);
        if (!facts.isOk()) {
            LOG.warn("B: Encountered error condition");
            return List.of();
        }
        return List.of(facts.fcondSimplified, facts.tcondSimplified);
    }

    @Override
    public String annotation(FactBundle bundle) {
        BranchFacts facts = new BranchFacts(bundle);
        if (!facts.isOk()) {
            return ERROR_VALUE;
        }
        if (isConditional() && bundle.hasBranchConditions()) {
            return "if " + facts.tcondSimplified + " then goto " + branchTarget();
        }
        return "goto " + branchTarget();
    }

    @Override
    public InstructionPair liftToAst(
            LiftContext context, String iaddr, String bytestring, FactBundle bundle) {
        return InstructionPair.empty();
    }

    @Override
    public ConditionPair astConditionProv(
            LiftContext context, String iaddr, String bytestring,
            FactBundle bundle, boolean reverse) {
        AstInterface astree = context.getAstree();
        ArmConditionCode cc = getConditionCode();
        AstExpr llCond = cc.lowLevelTest(astree);
        if (reverse) {
            llCond = astree.mkUnaryOp("lnot", llCond);
        }

        List<XExpr> ftconds = ftConditions(bundle);
        if (ftconds.size() != 2) {
            LOG.warn(
                "Branch (B{}) at address {}: no condition expressions found; using flag test",
                cc, iaddr);
            astree.addConditionAddress(llCond, List.of(iaddr));
            return new ConditionPair(llCond, llCond);
        }

        AstEmitter emitter = new AstEmitter(context, iaddr, bytestring, astAnnotations(iaddr));
        XExpr condition = reverse ? ftconds.get(0) : ftconds.get(1);
        AstExpr hlCond = emitter.hlExpr(condition, llCond);

        astree.addExprMapping(hlCond, llCond);
        astree.addExprReachingDefs(hlCond, bundle.getReachingDefinitions());
        astree.addExprReachingDefs(llCond, bundle.getReachingDefinitions());
        astree.addConditionAddress(llCond, List.of(iaddr));
        return new ConditionPair(hlCond, llCond);
    }
}
