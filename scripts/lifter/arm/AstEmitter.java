/*
 * Copyright (c) 2025, Trail of Bits, Inc.
 *
 * This source code is licensed in accordance with the terms specified in
 * the LICENSE file found in the root directory of this source tree.
 */

package arm;

import ast.AstAssign;
import ast.AstCall;
import ast.AstExpr;
import ast.AstInstruction;
import ast.AstInterface;
import ast.AstLval;
import ast.AstNopInstruction;

import domain.DefUses;
import domain.ReachingDefinition;
import domain.XExpr;
import domain.XVariable;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

// Emits the matched high-level and low-level instructions of one machine
// instruction and records how they relate. Recovered values that cannot be
// converted fall back to the corresponding low-level fragment.
public class AstEmitter {
    private static final Logger LOG = LoggerFactory.getLogger(AstEmitter.class);

    private final LiftContext context;
    private final AstInterface astree;
    private final String iaddr;
    private final String bytestring;
    private final List<String> annotations;

    private final List<AstInstruction> highLevel = new ArrayList<>();
    private final List<AstInstruction> lowLevel = new ArrayList<>();

    public AstEmitter(LiftContext context, String iaddr, String bytestring, List<String> annotations) {
        this.context = context;
        this.astree = context.getAstree();
        this.iaddr = iaddr;
        this.bytestring = bytestring;
        this.annotations = List.copyOf(annotations);
    }

    public AstInterface getAstree() {
        return astree;
    }

    public String getAddress() {
        return iaddr;
    }

    public String getBytes() {
        return bytestring;
    }

    public List<AstLval> hlLvals(XVariable variable, AstLval fallback) {
        try {
            return context.getResolver().toLvals(astree, variable);
        } catch (ExpressionConversionException e) {
            LOG.error("Cannot convert variable {} at address {}: {}", variable, iaddr, e.getMessage());
            return List.of(fallback);
        }
    }

    public List<AstExpr> hlExprs(XExpr expr, AstExpr fallback) {
        try {
            return context.getResolver().toExprs(astree, expr);
        } catch (ExpressionConversionException e) {
            LOG.error("Cannot convert expression {} at address {}: {}", expr, iaddr, e.getMessage());
            return List.of(fallback);
        }
    }

    // A variable that converts to zero or several lvals is replaced by the
    // low-level fragment.
    public AstLval hlLval(XVariable variable, AstLval fallback) {
        List<AstLval> lvals = hlLvals(variable, fallback);
        if (lvals.size() != 1) {
            LOG.error("Expected one lval for {} at address {}, found {}; using low-level lval",
                variable, iaddr, lvals.size());
            return fallback;
        }
        return lvals.get(0);
    }

    public AstExpr hlExpr(XExpr expr, AstExpr fallback) {
        List<AstExpr> exprs = hlExprs(expr, fallback);
        if (exprs.size() != 1) {
            LOG.error("Expected one expression for {} at address {}, found {}; using low-level expression",
                expr, iaddr, exprs.size());
            return fallback;
        }
        return exprs.get(0);
    }

    // Side-effect instructions of an operand (writeback) exist only at the
    // low level.
    public void addLowLevel(List<AstInstruction> instrs) {
        for (AstInstruction instr : instrs) {
            astree.addInstrAddress(instr, List.of(iaddr));
            lowLevel.add(instr);
        }
    }

    public AstAssign lowLevelAssign(AstLval lhs, AstExpr rhs) {
        AstAssign assign = astree.mkAssign(lhs, rhs, iaddr, bytestring, annotations);
        astree.addInstrAddress(assign, List.of(iaddr));
        lowLevel.add(assign);
        return assign;
    }

    public AstNopInstruction lowLevelNop(String description) {
        AstNopInstruction nop = astree.mkNopInstruction(description, iaddr, bytestring, annotations);
        astree.addInstrAddress(nop, List.of(iaddr));
        lowLevel.add(nop);
        return nop;
    }

    public AstAssign assignPair(
            AstLval hlLhs, AstExpr hlRhs, AstLval llLhs, AstExpr llRhs,
            List<ReachingDefinition> hlRdefs, List<ReachingDefinition> llRdefs,
            DefUses uses, DefUses usesHigh) {
        AstAssign llAssign = astree.mkAssign(llLhs, llRhs, iaddr, bytestring, annotations);
        AstAssign hlAssign = astree.mkAssign(hlLhs, hlRhs, iaddr, bytestring, annotations);
        lowLevel.add(llAssign);
        highLevel.add(hlAssign);

        astree.addInstrMapping(hlAssign, llAssign);
        astree.addInstrAddress(hlAssign, List.of(iaddr));
        astree.addExprMapping(hlRhs, llRhs);
        astree.addLvalMapping(hlLhs, llLhs);
        astree.addExprReachingDefs(hlRhs, hlRdefs);
        astree.addExprReachingDefs(llRhs, llRdefs);
        astree.addLvalDefUses(hlLhs, uses);
        astree.addLvalDefUsesHigh(hlLhs, usesHigh);
        return hlAssign;
    }

    // hlLhs is null for calls whose result is not used.
    public AstCall callPair(
            AstLval hlLhs, AstExpr hlTarget, List<AstExpr> hlArgs,
            AstLval llLhs, AstExpr llTarget, List<AstExpr> llArgs,
            List<ReachingDefinition> argRdefs, DefUses uses, DefUses usesHigh) {
        AstCall llCall = astree.mkCall(llLhs, llTarget, llArgs, iaddr, bytestring, annotations);
        AstCall hlCall = astree.mkCall(hlLhs, hlTarget, hlArgs, iaddr, bytestring, annotations);
        lowLevel.add(llCall);
        highLevel.add(hlCall);

        astree.addInstrMapping(hlCall, llCall);
        astree.addInstrAddress(hlCall, List.of(iaddr));
        astree.addExprMapping(hlTarget, llTarget);
        for (int i = 0; i < hlArgs.size() && i < llArgs.size(); i++) {
            astree.addExprMapping(hlArgs.get(i), llArgs.get(i));
            if (i < argRdefs.size()) {
                ReachingDefinition rdef = argRdefs.get(i);
                List<ReachingDefinition> single = new ArrayList<>();
                single.add(rdef);
                astree.addExprReachingDefs(hlArgs.get(i), single);
                astree.addExprReachingDefs(llArgs.get(i), single);
            }
        }
        if (hlLhs != null) {
            astree.addLvalMapping(hlLhs, llLhs);
            astree.addLvalDefUses(hlLhs, uses);
            astree.addLvalDefUsesHigh(hlLhs, usesHigh);
        }
        return hlCall;
    }

    public InstructionPair toPair() {
        return new InstructionPair(highLevel, lowLevel);
    }
}
