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
import domain.ArmRegister;
import domain.DefUses;
import domain.FactBundle;
import domain.InstructionRecord;
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
 * Shared lifting of the load/store multiple family (LDM, LDMDB, STM, STMDB,
 * POP, PUSH). Registers are transferred in ascending order to consecutive
 * words starting at the base (increment after) or ending just below it
 * (decrement before).
 *
 * <pre>
 * vars[0]:         base lhs
 * vars[1..n]:      registers loaded, or memory locations stored to
 * xprs[0]:         base
 * xprs[1]:         updated base
 * xprs[2]:         updated base (simplified)
 * xprs[3..n+2]:    values loaded from memory, or register values stored
 * rdefs[0]:        base register
 * rdefs[1..n]:     memory locations read, or registers stored
 * uses[0]:         base lhs
 * uses[1..n]:      registers loaded, or memory locations stored to
 * </pre>
 */
public abstract class ArmMultipleTransfer extends ArmOpcode {
    private static final Logger LOG = LoggerFactory.getLogger(ArmMultipleTransfer.class);

    static class MultipleTransferFacts extends ArmOpcodeFacts {
        final int regcount;
        final XVariable baseLhs;
        final List<XVariable> lhsVars = new ArrayList<>();
        final XExpr baseRhs;
        final XExpr baseUpdate;
        final XExpr baseUpdateSimplified;
        final List<XExpr> rhsExprs = new ArrayList<>();
        final ReachingDefinition baseRdef;
        final List<ReachingDefinition> transferRdefs = new ArrayList<>();
        final DefUses baseUses;
        final DefUses baseUsesHigh;
        final List<DefUses> transferUses = new ArrayList<>();
        final List<DefUses> transferUsesHigh = new ArrayList<>();

        MultipleTransferFacts(FactBundle bundle, int regcount) {
            super(bundle, regcount + 1, regcount + 3);
            this.regcount = regcount;
            this.baseLhs = var(0);
            this.baseRhs = xpr(0);
            this.baseUpdate = xpr(1);
            this.baseUpdateSimplified = xpr(2);
            this.baseRdef = rdef(0);
            this.baseUses = uses(0);
            this.baseUsesHigh = usesHigh(0);
            for (int i = 1; i <= regcount; i++) {
                lhsVars.add(var(i));
                rhsExprs.add(xpr(i + 2));
                transferRdefs.add(rdef(i));
                transferUses.add(uses(i));
                transferUsesHigh.add(usesHigh(i));
            }
        }

        String writebackUpdate(boolean writeback) {
            if (!writeback) {
                return "";
            }
            return "; " + baseLhs + " := " + baseUpdateSimplified;
        }
    }

    protected ArmMultipleTransfer(OperandTable operandTable, InstructionRecord record) {
        super(operandTable, record);
    }

    public abstract boolean isLoad();

    public abstract boolean isDecrementBefore();

    public abstract boolean isWriteback();

    public abstract ArmOperand baseOperand();

    public abstract ArmOperand registersOperand();

    public List<ArmRegister> getRegisters() {
        return registersOperand().getRegisters();
    }

    @Override
    public List<ArmOperand> operands() {
        return List.of(baseOperand(), registersOperand());
    }

    @Override
    public String operandString() {
        return baseOperand() + (isWriteback() ? "!" : "") + ", " + registersOperand();
    }

    @Override
    public String annotation(FactBundle bundle) {
        MultipleTransferFacts facts = new MultipleTransferFacts(bundle, getRegisters().size());
        if (!facts.isOk()) {
            return ERROR_VALUE;
        }
        List<String> assigns = new ArrayList<>();
        for (int i = 0; i < facts.regcount; i++) {
            assigns.add(facts.lhsVars.get(i) + " := " + facts.rhsExprs.get(i));
        }
        return addInstructionCondition(
            bundle, String.join("; ", assigns) + facts.writebackUpdate(isWriteback()));
    }

    // Offset of the i-th transferred word relative to the base.
    private long wordOffset(int i, int regcount) {
        return isDecrementBefore() ? 4L * (i - regcount) : 4L * i;
    }

    private AstExpr address(AstInterface astree, AstExpr base, long offset) {
        if (offset < 0) {
            return astree.mkBinaryOp("minus", base, astree.mkIntegerConstant(-offset));
        }
        return astree.mkBinaryOp("plus", base, astree.mkIntegerConstant(offset));
    }

    @Override
    public InstructionPair liftToAst(
            LiftContext context, String iaddr, String bytestring, FactBundle bundle) {
        List<ArmRegister> registers = getRegisters();
        MultipleTransferFacts facts = new MultipleTransferFacts(bundle, registers.size());
        if (!facts.isOk()) {
            LOG.error("Error value encountered at address {}", iaddr);
            return InstructionPair.empty();
        }

        AstInterface astree = context.getAstree();
        AstEmitter emitter = new AstEmitter(context, iaddr, bytestring, astAnnotations(iaddr));

        AstLval baseLval = baseOperand().astLvalue(astree, iaddr, bytestring).getNode();
        AstExpr baseRval = baseOperand().astRvalue(astree, iaddr, bytestring).getNode();

        for (int i = 0; i < registers.size(); i++) {
            String reg = registers.get(i).name();
            AstExpr addr = address(astree, baseRval, wordOffset(i, registers.size()));
            ReachingDefinition rdef = facts.transferRdefs.get(i);

            AstLval llLhs;
            AstExpr llRhs;
            List<ReachingDefinition> hlRdefs;
            if (isLoad()) {
                llLhs = astree.mkVariableLval(reg);
                llRhs = astree.mkMemRefExpr(addr);
                hlRdefs = Collections.emptyList();
            } else {
                llLhs = astree.mkMemRefLval(addr);
                llRhs = astree.mkVariableExpr(reg);
                hlRdefs = Collections.singletonList(rdef);
            }

            AstLval hlLhs = emitter.hlLval(facts.lhsVars.get(i), llLhs);
            AstExpr hlRhs = emitter.hlExpr(facts.rhsExprs.get(i), llRhs);
            emitter.assignPair(
                hlLhs, hlRhs, llLhs, llRhs,
                hlRdefs, Collections.singletonList(rdef),
                facts.transferUses.get(i), facts.transferUsesHigh.get(i));
        }

        if (isWriteback()) {
            long increment = 4L * registers.size();
            AstExpr llBaseRhs = address(astree, baseRval, isDecrementBefore() ? -increment : increment);
            AstLval hlBaseLhs = emitter.hlLval(facts.baseLhs, baseLval);
            AstExpr hlBaseRhs = emitter.hlExpr(facts.baseUpdateSimplified, llBaseRhs);
            emitter.assignPair(
                hlBaseLhs, hlBaseRhs, baseLval, llBaseRhs,
                Collections.emptyList(), Collections.singletonList(facts.baseRdef),
                facts.baseUses, facts.baseUsesHigh);
        }
        return emitter.toPair();
    }
}
