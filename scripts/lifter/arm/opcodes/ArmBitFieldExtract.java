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
import domain.OperandTable;
import domain.ReachingDefinition;
import domain.XExpr;
import domain.XVariable;

import java.util.Collections;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shared lifting of UBFX and SBFX, &lt;op&gt;&lt;c&gt; &lt;Rd&gt;, &lt;Rn&gt;, #&lt;lsb&gt;, #&lt;width&gt;.
 *
 * <pre>
 * args[0]: index of Rd in the operand table
 * args[1]: index of Rn in the operand table
 * args[2]: index of lsb (immediate) in the operand table
 * args[3]: index of width (immediate) in the operand table
 *
 * vars[0]: lhs
 * xprs[0]: result
 * xprs[1]: result (simplified)
 * rdefs[0]: Rn
 * uses[0]: lhs
 * </pre>
 */
public abstract class ArmBitFieldExtract extends ArmOpcode {
    private static final Logger LOG = LoggerFactory.getLogger(ArmBitFieldExtract.class);

    static class BitFieldExtractFacts extends ArmOpcodeFacts {
        final XVariable lhs;
        final XExpr result;
        final XExpr rresult;
        final ReachingDefinition rnRdef;
        final List<ReachingDefinition> otherRdefs;
        final DefUses uses;
        final DefUses usesHigh;

        BitFieldExtractFacts(FactBundle bundle) {
            super(bundle, 1, 2);
            this.lhs = var(0);
            this.result = xpr(0);
            this.rresult = xpr(1);
            this.rnRdef = rdef(0);
            this.otherRdefs = rdefsFrom(1);
            this.uses = uses(0);
            this.usesHigh = usesHigh(0);
        }
    }

    private final String name;

    protected ArmBitFieldExtract(OperandTable operandTable, InstructionRecord record, String name) {
        super(operandTable, record);
        this.name = name;
        checkKey(2, 4, name);
    }

    public int getLsb() {
        return (int) operand(2).getValue();
    }

    public int getWidth() {
        return (int) operand(3).getValue();
    }

    // Literal extraction of bits lsb..lsb+width-1 of rn.
    protected abstract AstExpr extract(AstInterface astree, AstExpr rn, int lsb, int width);

    @Override
    public List<ArmOperand> operands() {
        return operandsFrom(0);
    }

    @Override
    public String annotation(FactBundle bundle) {
        BitFieldExtractFacts facts = new BitFieldExtractFacts(bundle);
        if (!facts.isOk()) {
            return ERROR_VALUE;
        }
        return addInstructionCondition(
            bundle, facts.lhs + " := " + simplifyResult(facts.result, facts.rresult));
    }

    @Override
    public InstructionPair liftToAst(
            LiftContext context, String iaddr, String bytestring, FactBundle bundle) {
        BitFieldExtractFacts facts = new BitFieldExtractFacts(bundle);
        if (!facts.isOk()) {
            LOG.error("Error value encountered at address {}", iaddr);
            return InstructionPair.empty();
        }

        AstInterface astree = context.getAstree();
        AstEmitter emitter = new AstEmitter(context, iaddr, bytestring, astAnnotations(iaddr));

        AstLval llLhs = operand(0).astLvalue(astree, iaddr, bytestring).getNode();
        AstExpr rn = operand(1).astRvalue(astree, iaddr, bytestring).getNode();
        AstExpr llRhs = extract(astree, rn, getLsb(), getWidth());

        List<AstLval> hlLhss = emitter.hlLvals(facts.lhs, llLhs);
        List<AstExpr> hlRhss = emitter.hlExprs(facts.rresult, llRhs);
        if (hlLhss.size() != 1 || hlRhss.size() != 1) {
            throw new IllegalStateException(
                name + " at address " + iaddr + ": multiple expressions/lvals in ast ("
                + hlLhss.size() + " lvals, " + hlRhss.size() + " expressions)");
        }

        emitter.assignPair(
            hlLhss.get(0), hlRhss.get(0), llLhs, llRhs,
            facts.otherRdefs, Collections.singletonList(facts.rnRdef),
            facts.uses, facts.usesHigh);
        return emitter.toPair();
    }
}
