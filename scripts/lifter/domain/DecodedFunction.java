/*
 * Copyright (c) 2025, Trail of Bits, Inc.
 *
 * This source code is licensed in accordance with the terms specified in
 * the LICENSE file found in the root directory of this source tree.
 */

package domain;

import java.util.List;

public class DecodedFunction {
    private final String name;
    private final String entryAddress;
    private final OperandTable operands;
    private final List<DecodedInstruction> instructions;

    public DecodedFunction(
            String name, String entryAddress, OperandTable operands,
            List<DecodedInstruction> instructions) {
        this.name = name;
        this.entryAddress = entryAddress;
        this.operands = operands;
        this.instructions = List.copyOf(instructions);
    }

    public String getName() {
        return name;
    }

    public String getEntryAddress() {
        return entryAddress;
    }

    public OperandTable getOperands() {
        return operands;
    }

    public List<DecodedInstruction> getInstructions() {
        return instructions;
    }
}
