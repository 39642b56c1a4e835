/*
 * Copyright (c) 2025, Trail of Bits, Inc.
 *
 * This source code is licensed in accordance with the terms specified in
 * the LICENSE file found in the root directory of this source tree.
 */

package arm;

import arm.opcodes.Add;
import arm.opcodes.Branch;
import arm.opcodes.BranchExchange;
import arm.opcodes.BranchLink;
import arm.opcodes.BranchLinkExchange;
import arm.opcodes.Compare;
import arm.opcodes.CompareBranchNonzero;
import arm.opcodes.CompareBranchZero;
import arm.opcodes.LoadMultipleDecrementBefore;
import arm.opcodes.LoadMultipleIncrementAfter;
import arm.opcodes.LoadRegister;
import arm.opcodes.Move;
import arm.opcodes.NoOperation;
import arm.opcodes.Pop;
import arm.opcodes.PreloadData;
import arm.opcodes.PreloadInstruction;
import arm.opcodes.Push;
import arm.opcodes.SignedBitFieldExtract;
import arm.opcodes.StoreMultipleDecrementBefore;
import arm.opcodes.StoreMultipleIncrementAfter;
import arm.opcodes.StoreRegister;
import arm.opcodes.Subtract;
import arm.opcodes.UnsignedBitFieldExtract;

// Every mnemonic the lifter understands, with the handler that lifts it and
// the tag and argument counts its records must have.
public enum ArmMnemonic {
    B("B", 2, 1, Branch::new),
    BL("BL", 2, 1, BranchLink::new),
    BLX("BLX", 2, 1, BranchLinkExchange::new),
    BX("BX", 2, 1, BranchExchange::new),
    CBZ("CBZ", 1, 2, CompareBranchZero::new),
    CBNZ("CBNZ", 1, 2, CompareBranchNonzero::new),
    CMP("CMP", 2, 2, Compare::new),
    MOV("MOV", 2, 3, Move::new),
    ADD("ADD", 2, 4, Add::new),
    SUB("SUB", 2, 4, Subtract::new),
    LDR("LDR", 2, 2, LoadRegister::new),
    STR("STR", 2, 2, StoreRegister::new),
    LDM("LDM", 2, 4, LoadMultipleIncrementAfter::new),
    LDMDB("LDMDB", 2, 4, LoadMultipleDecrementBefore::new),
    STM("STM", 2, 4, StoreMultipleIncrementAfter::new),
    STMDB("STMDB", 2, 4, StoreMultipleDecrementBefore::new),
    POP("POP", 2, 3, Pop::new),
    PUSH("PUSH", 2, 3, Push::new),
    UBFX("UBFX", 2, 4, UnsignedBitFieldExtract::new),
    SBFX("SBFX", 2, 4, SignedBitFieldExtract::new),
    PLD("PLD", 2, 3, PreloadData::new),
    PLDW("PLDW", 2, 3, PreloadData::new),
    PLI("PLI", 2, 1, PreloadInstruction::new),
    NOP("NOP", 1, 0, NoOperation::new);

    private final String tag;
    private final int tagCount;
    private final int argCount;
    private final ArmOpcodeConstructor constructor;

    ArmMnemonic(String tag, int tagCount, int argCount, ArmOpcodeConstructor constructor) {
        this.tag = tag;
        this.tagCount = tagCount;
        this.argCount = argCount;
        this.constructor = constructor;
    }

    public String getTag() {
        return tag;
    }

    public int getTagCount() {
        return tagCount;
    }

    public int getArgCount() {
        return argCount;
    }

    public ArmOpcodeConstructor getConstructor() {
        return constructor;
    }
}
