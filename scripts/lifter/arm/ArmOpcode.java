/*
 * Copyright (c) 2025, Trail of Bits, Inc.
 *
 * This source code is licensed in accordance with the terms specified in
 * the LICENSE file found in the root directory of this source tree.
 */

package arm;

import domain.ArmOperand;
import domain.FactBundle;
import domain.InstructionRecord;
import domain.OperandTable;

import java.util.List;
import java.util.stream.Collectors;

// Base of all instruction handlers. A handler is constructed from its decoded
// record, checks the record's arity in its constructor, and then lifts the
// instruction against the fact bundle computed for it.
public abstract class ArmOpcode {
    public static final String ERROR_VALUE = "Error value";

    private final OperandTable operandTable;
    private final InstructionRecord record;

    protected ArmOpcode(OperandTable operandTable, InstructionRecord record) {
        this.operandTable = operandTable;
        this.record = record;
    }

    protected void checkKey(int tagCount, int argCount, String name) {
        int tags = record.getTags().size();
        int args = record.getArgs().size();
        if (tags != tagCount || args != argCount) {
            throw new ArmDecodeException(
                name + ": expected " + tagCount + " tags and " + argCount + " args, found "
                + tags + " tags and " + args + " args in " + record);
        }
    }

    public String getMnemonic() {
        return record.getMnemonic();
    }

    public InstructionRecord getRecord() {
        return record;
    }

    public List<String> getTags() {
        return record.getTags();
    }

    public List<Integer> getArgs() {
        return record.getArgs();
    }

    public ArmConditionCode getConditionCode() {
        List<String> tags = record.getTags();
        return tags.size() > 1 ? ArmConditionCode.fromTag(tags.get(1)) : ArmConditionCode.AL;
    }

    protected ArmOperand operand(int argIndex) {
        return operandTable.get(record.getArg(argIndex));
    }

    protected List<ArmOperand> operandsFrom(int argIndex) {
        List<Integer> args = record.getArgs();
        return args.subList(argIndex, args.size()).stream()
            .map(operandTable::get)
            .collect(Collectors.toList());
    }

    public abstract List<ArmOperand> operands();

    // Readable summary of what the instruction does under the given facts,
    // or ERROR_VALUE when the facts are unusable.
    public abstract String annotation(FactBundle bundle);

    public abstract InstructionPair liftToAst(
        LiftContext context, String iaddr, String bytestring, FactBundle bundle);

    protected List<String> astAnnotations(String iaddr) {
        return List.of(iaddr, getMnemonic());
    }

    public static String simplifyResult(Object x, Object rx) {
        String xs = String.valueOf(x);
        String rxs = String.valueOf(rx);
        if (xs.equals(rxs)) {
            return xs;
        }
        return xs + " (= " + rxs + ")";
    }

    protected static String addInstructionCondition(FactBundle bundle, String text) {
        if (bundle.hasInstructionCondition()) {
            return "if " + bundle.getInstructionCondition() + " then " + text;
        }
        return text;
    }

    public String operandString() {
        return operands().stream().map(ArmOperand::toString).collect(Collectors.joining(", "));
    }

    @Override
    public String toString() {
        ArmConditionCode cc = getConditionCode();
        String mnemonic = cc.isUnconditional() ? getMnemonic() : getMnemonic() + cc.name();
        return mnemonic + " " + operandString();
    }
}
