/*
 * Copyright (c) 2025, Trail of Bits, Inc.
 *
 * This source code is licensed in accordance with the terms specified in
 * the LICENSE file found in the root directory of this source tree.
 */

package ast;

public class AstLvalExpr extends AstExpr {
    private final AstLval lval;

    public AstLvalExpr(int exprId, AstLval lval) {
        super("lval-expr", exprId);
        this.lval = lval;
    }

    public AstLval getLval() {
        return lval;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitLvalExpr(this);
    }
}
