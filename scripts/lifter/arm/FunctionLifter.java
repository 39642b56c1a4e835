/*
 * Copyright (c) 2025, Trail of Bits, Inc.
 *
 * This source code is licensed in accordance with the terms specified in
 * the LICENSE file found in the root directory of this source tree.
 */

package arm;

import ast.AstBlock;
import ast.AstInstruction;
import ast.AstInterface;
import ast.AstStmt;

import domain.ArmOperand;
import domain.DecodedFunction;
import domain.DecodedInstruction;
import domain.FactBundle;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

// Lifts the instructions of a function in program order. Straight-line runs
// of instructions become instruction sequences; a conditional branch becomes
// "if (cond) goto target" and an unconditional one a plain goto. Both levels
// get the same statement structure.
public class FunctionLifter {
    private static final Logger LOG = LoggerFactory.getLogger(FunctionLifter.class);

    private final ArmOpcodeRegistry registry;
    private final ExpressionResolver resolver;

    public FunctionLifter(ArmOpcodeRegistry registry, ExpressionResolver resolver) {
        this.registry = registry;
        this.resolver = resolver;
    }

    public FunctionLifter() {
        this(ArmOpcodeRegistry.createDefault(), new DefaultExpressionResolver());
    }

    private static class Body {
        final List<AstStmt> stmts = new ArrayList<>();
        final List<AstInstruction> pending = new ArrayList<>();
        final List<AstInstruction> all = new ArrayList<>();

        void add(List<AstInstruction> instrs) {
            pending.addAll(instrs);
            all.addAll(instrs);
        }

        void flush(AstInterface astree) {
            if (!pending.isEmpty()) {
                stmts.add(astree.mkInstrSequence(new ArrayList<>(pending)));
                pending.clear();
            }
        }
    }

    private static String targetLabel(ArmOperand target) {
        if (target.isAbsolute() || target.isImmediate()) {
            return String.format("0x%x", target.getValue());
        }
        return target.toString();
    }

    private static long relativeOffset(ArmOperand target, DecodedInstruction instr) {
        if (target.isAbsolute() || target.isImmediate()) {
            return target.getValue() - instr.getAddressValue();
        }
        return 0;
    }

    // ArmDecodeException propagates: a function with an undecodable
    // instruction is not lifted at all.
    public LiftedFunction lift(DecodedFunction function) {
        AstInterface astree = new AstInterface();
        LiftContext context = new LiftContext(astree, resolver);

        Body high = new Body();
        Body low = new Body();
        Map<String, String> annotations = new LinkedHashMap<>();

        for (DecodedInstruction instr : function.getInstructions()) {
            ArmOpcode opcode = registry.construct(function.getOperands(), instr.getRecord());
            FactBundle facts = instr.getFacts();
            String iaddr = instr.getAddress();
            String bytes = instr.getBytes();

            String annotation = opcode.annotation(facts);
            annotations.put(iaddr, annotation);
            if (ArmOpcode.ERROR_VALUE.equals(annotation)) {
                LOG.warn("{} at address {} in {}: unusable facts", opcode, iaddr, function.getName());
            }

            if (opcode instanceof ConditionalBranch) {
                ConditionalBranch branch = (ConditionalBranch) opcode;
                ArmOperand target = branch.branchTarget();
                String label = targetLabel(target);

                high.flush(astree);
                low.flush(astree);
                if (branch.isConditional()) {
                    ConditionPair cond = branch.astConditionProv(context, iaddr, bytes, facts, false);
                    long offset = relativeOffset(target, instr);
                    high.stmts.add(astree.mkBranch(
                        cond.getHighLevel(), astree.mkGoto(label), astree.mkBlock(List.of()), offset));
                    low.stmts.add(astree.mkBranch(
                        cond.getLowLevel(), astree.mkGoto(label), astree.mkBlock(List.of()), offset));
                } else {
                    high.stmts.add(astree.mkGoto(label));
                    low.stmts.add(astree.mkGoto(label));
                }
                continue;
            }

            InstructionPair pair = opcode.liftToAst(context, iaddr, bytes, facts);
            high.add(pair.getHighLevel());
            low.add(pair.getLowLevel());
        }

        high.flush(astree);
        low.flush(astree);

        AstBlock highBody = astree.mkBlock(high.stmts);
        AstBlock lowBody = astree.mkBlock(low.stmts);
        LOG.debug(
            "Lifted {}: {} high-level and {} low-level instructions",
            function.getName(), high.all.size(), low.all.size());
        return new LiftedFunction(
            function.getName(), function.getEntryAddress(), highBody, lowBody,
            high.all, low.all, annotations, astree);
    }
}
