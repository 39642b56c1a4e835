/*
 * Copyright (c) 2025, Trail of Bits, Inc.
 *
 * This source code is licensed in accordance with the terms specified in
 * the LICENSE file found in the root directory of this source tree.
 */

package arm;

import ast.AstInstruction;

import java.util.List;

// The high-level and low-level instructions lifted from one machine
// instruction.
public class InstructionPair {
    private static final InstructionPair EMPTY = new InstructionPair(List.of(), List.of());

    private final List<AstInstruction> highLevel;
    private final List<AstInstruction> lowLevel;

    public InstructionPair(List<AstInstruction> highLevel, List<AstInstruction> lowLevel) {
        this.highLevel = List.copyOf(highLevel);
        this.lowLevel = List.copyOf(lowLevel);
    }

    public static InstructionPair empty() {
        return EMPTY;
    }

    public List<AstInstruction> getHighLevel() {
        return highLevel;
    }

    public List<AstInstruction> getLowLevel() {
        return lowLevel;
    }

    public boolean isEmpty() {
        return highLevel.isEmpty() && lowLevel.isEmpty();
    }
}
