/*
 * Copyright (c) 2025, Trail of Bits, Inc.
 *
 * This source code is licensed in accordance with the terms specified in
 * the LICENSE file found in the root directory of this source tree.
 */

package ast;

import java.util.List;

public class AstNopInstruction extends AstInstruction {
    private final String description;

    public AstNopInstruction(
            int instrId, int locationId, String description, List<String> annotations) {
        super("nop", instrId, locationId, annotations);
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitNop(this);
    }
}
