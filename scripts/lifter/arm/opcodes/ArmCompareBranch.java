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
import domain.ReachingDefinition;
import domain.XExpr;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shared lifting of CBZ and CBNZ.
 *
 * <pre>
 * args[0]: index of Rn in the operand table
 * args[1]: index of the label in the operand table
 *
 * xprs[0]: Rn
 * xprs[1]: true condition
 * xprs[2]: false condition
 * xprs[3]: true condition (simplified)
 * xprs[4]: false condition (simplified)
 * xprs[5]: target
 * rdefs[0]: Rn
 * </pre>
 */
public abstract class ArmCompareBranch extends ArmOpcode implements ConditionalBranch {
    private static final Logger LOG = LoggerFactory.getLogger(ArmCompareBranch.class);

    static class CompareBranchFacts extends ArmOpcodeFacts {
        final XExpr xrn;
        final XExpr txpr;
        final XExpr fxpr;
        final XExpr tcond;
        final XExpr fcond;
        final XExpr xtgt;

        CompareBranchFacts(FactBundle bundle) {
            super(bundle, 0, 6);
            this.xrn = xpr(0);
            this.txpr = xpr(1);
            this.fxpr = xpr(2);
            this.tcond = xpr(3);
            this.fcond = xpr(4);
            this.xtgt = xpr(5);
        }
    }

    private final String name;

    protected ArmCompareBranch(OperandTable operandTable, InstructionRecord record, String name) {
        super(operandTable, record);
        this.name = name;
        checkKey(1, 2, name);
    }

    // Low-level comparison of Rn against zero for the taken (reverse false)
    // or the fall-through (reverse true) direction: "eq" or "ne".
    protected abstract String comparison(boolean reverse);

    @Override
    public List<ArmOperand> operands() {
        return List.of(operand(0), operand(1));
    }

    @Override
    public boolean isConditional() {
        return true;
    }

    @Override
    public ArmOperand branchTarget() {
        return operand(1);
    }

    @Override
    public List<XExpr> ftConditions(FactBundle bundle) {
        if (!bundle.hasBranchConditions()) {
            return List.of();
        }
        CompareBranchFacts facts = new CompareBranchFacts(bundle);
        if (!facts.isOk()) {
            LOG.warn("{}: Encountered error condition", getMnemonic());
            return List.of();
        }
        return List.of(facts.fcond, facts.tcond);
    }

    @Override
    public String annotation(FactBundle bundle) {
        CompareBranchFacts facts = new CompareBranchFacts(bundle);
        if (!facts.isOk()) {
            return ERROR_VALUE;
        }
        return "if " + facts.tcond + " goto " + facts.xtgt;
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

        AstExpr llOp = operand(0).astRvalue(astree, iaddr, bytestring).getNode();
        AstExpr zero = astree.mkIntegerConstant(0);
        AstExpr llCond = astree.mkBinaryOp(comparison(reverse), llOp, zero);

        List<XExpr> ftconds = ftConditions(bundle);
        if (ftconds.size() != 2) {
            LOG.error(
                "{} at address {}: no condition expressions found; returning zero",
                name, iaddr);
            return new ConditionPair(zero, zero);
        }

        AstEmitter emitter = new AstEmitter(context, iaddr, bytestring, astAnnotations(iaddr));
        XExpr condition = reverse ? ftconds.get(0) : ftconds.get(1);
        AstExpr hlCond = emitter.hlExpr(condition, llCond);

        List<ReachingDefinition> rdefs = bundle.getReachingDefinitions();
        List<ReachingDefinition> opRdefs = new ArrayList<>();
        if (!rdefs.isEmpty()) {
            opRdefs.add(rdefs.get(0));
        }

        astree.addExprMapping(hlCond, llCond);
        astree.addExprReachingDefs(hlCond, rdefs);
        astree.addExprReachingDefs(llOp, opRdefs);
        astree.addConditionAddress(llCond, List.of(iaddr));
        return new ConditionPair(hlCond, llCond);
    }
}
