/*
 * Copyright (c) 2025, Trail of Bits, Inc.
 *
 * This source code is licensed in accordance with the terms specified in
 * the LICENSE file found in the root directory of this source tree.
 */

package ast;

import java.util.List;

public class AstInstrSequence extends AstStmt {
    private final List<AstInstruction> instructions;

    public AstInstrSequence(int stmtId, int locationId, List<AstInstruction> instructions) {
        super("instrs", stmtId, locationId);
        this.instructions = List.copyOf(instructions);
    }

    public List<AstInstruction> getInstructions() {
        return instructions;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitInstrSequence(this);
    }
}
