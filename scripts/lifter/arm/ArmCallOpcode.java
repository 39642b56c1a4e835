/*
 * Copyright (c) 2025, Trail of Bits, Inc.
 *
 * This source code is licensed in accordance with the terms specified in
 * the LICENSE file found in the root directory of this source tree.
 */

package arm;

import ast.AstExpr;
import ast.AstInterface;
import ast.AstLval;

import domain.ArmOperand;
import domain.ArmRegister;
import domain.CallTarget;
import domain.DefUses;
import domain.FactBundle;
import domain.InstructionRecord;
import domain.OperandTable;
import domain.XExpr;
import domain.XVariable;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

// Base of the opcodes that may call a function. The first four arguments are
// passed in R0-R3 and the rest on the stack; the result comes back in R0.
public abstract class ArmCallOpcode extends ArmOpcode {
    private static final Logger LOG = LoggerFactory.getLogger(ArmCallOpcode.class);

    private static final int REGISTER_ARGUMENTS = 4;

    protected ArmCallOpcode(OperandTable operandTable, InstructionRecord record) {
        super(operandTable, record);
    }

    public boolean isCall(FactBundle bundle) {
        return bundle.isCall();
    }

    private void requireCall(FactBundle bundle) {
        if (!isCall(bundle)) {
            throw new UnsupportedOperationException("Instruction is not a call: " + this);
        }
    }

    public CallTarget callTarget(FactBundle bundle) {
        requireCall(bundle);
        if (!bundle.hasCallTarget()) {
            throw new UnsupportedOperationException("Call has no resolved target: " + this);
        }
        return bundle.getCallTarget();
    }

    public int argumentCount(FactBundle bundle) {
        requireCall(bundle);
        Integer count = bundle.getArgumentCount();
        if (count != null) {
            return count;
        }
        LOG.warn("Call instruction does not have argument count: {}", this);
        return 0;
    }

    public List<XExpr> arguments(FactBundle bundle) {
        List<XExpr> xprs = bundle.getXprs();
        int argc = Math.min(argumentCount(bundle), xprs.size());
        return xprs.subList(0, argc);
    }

    // Falls back to the encoded target when the analysis did not resolve one.
    protected CallTarget resolvedTarget(FactBundle bundle) {
        if (bundle.hasCallTarget()) {
            return bundle.getCallTarget();
        }
        ArmOperand target = operand(0);
        if (target.isAbsolute()) {
            return new CallTarget(String.format("sub_%x", target.getValue()), target.getValue());
        }
        return new CallTarget(target.toString(), null);
    }

    protected String callAnnotation(FactBundle bundle) {
        String args = arguments(bundle).stream()
            .map(XExpr::toString)
            .collect(Collectors.joining(", "));
        return "call " + resolvedTarget(bundle) + "(" + args + ")";
    }

    private static AstExpr lowLevelArgument(AstInterface astree, int index) {
        if (index < REGISTER_ARGUMENTS) {
            return astree.mkVariableExpr(ArmRegister.fromNumber(index).name());
        }
        AstExpr address = astree.mkBinaryOp(
            "plus",
            astree.mkVariableExpr(ArmRegister.SP.name()),
            astree.mkIntegerConstant(4L * (index - REGISTER_ARGUMENTS)));
        return astree.mkMemRefExpr(address);
    }

    private static AstExpr lowLevelTarget(AstInterface astree, ArmOperand target, String iaddr, String bytestring) {
        if (target.isAbsolute()) {
            long address = target.getValue();
            return astree.mkGlobalAddressConstant(address, astree.mkIntegerConstant(address));
        }
        return target.astRvalue(astree, iaddr, bytestring).getNode();
    }

    // R0 := tgt(R0, ..) at the low level, lhs := name(args) at the high
    // level. The result is only assigned at the high level when the analysis
    // recovered a variable for it (vars[0]).
    protected InstructionPair liftCall(
            LiftContext context, String iaddr, String bytestring, FactBundle bundle) {
        if (!bundle.isValid()) {
            LOG.error("Error value encountered for call at address {}", iaddr);
            return InstructionPair.empty();
        }

        AstInterface astree = context.getAstree();
        AstEmitter emitter = new AstEmitter(context, iaddr, bytestring, astAnnotations(iaddr));

        CallTarget target = resolvedTarget(bundle);
        List<XExpr> args = arguments(bundle);

        AstLval llLhs = astree.mkVariableLval(ArmRegister.R0.name());
        AstExpr llTarget = lowLevelTarget(astree, operand(0), iaddr, bytestring);
        List<AstExpr> llArgs = new ArrayList<>();
        for (int i = 0; i < args.size(); i++) {
            llArgs.add(lowLevelArgument(astree, i));
        }

        AstExpr hlTarget = astree.mkLvalExpr(astree.mkVariableLval(astree.mkVarInfo(
            target.getName(), null, null, target.getAddress(), "function")));
        List<AstExpr> hlArgs = new ArrayList<>();
        for (int i = 0; i < args.size(); i++) {
            hlArgs.add(emitter.hlExpr(args.get(i), llArgs.get(i)));
        }

        List<XVariable> vars = bundle.getVars();
        AstLval hlLhs = vars.isEmpty() ? null : emitter.hlLval(vars.get(0), llLhs);

        DefUses uses = bundle.getDefUses().isEmpty() ? null : bundle.getDefUses().get(0);
        DefUses usesHigh = bundle.getDefUsesHigh().isEmpty() ? null : bundle.getDefUsesHigh().get(0);
        emitter.callPair(
            hlLhs, hlTarget, hlArgs, llLhs, llTarget, llArgs,
            bundle.getReachingDefinitions(), uses, usesHigh);
        return emitter.toPair();
    }
}
