/*
 * Copyright (c) 2025, Trail of Bits, Inc.
 *
 * This source code is licensed in accordance with the terms specified in
 * the LICENSE file found in the root directory of this source tree.
 */

package ast;

import java.util.List;

public class AstAssign extends AstInstruction {
    private final AstLval lhs;
    private final AstExpr rhs;

    public AstAssign(
            int instrId, int locationId, AstLval lhs, AstExpr rhs,
            List<String> annotations) {
        super("assign", instrId, locationId, annotations);
        this.lhs = lhs;
        this.rhs = rhs;
    }

    public AstLval getLhs() {
        return lhs;
    }

    public AstExpr getRhs() {
        return rhs;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitAssign(this);
    }
}
