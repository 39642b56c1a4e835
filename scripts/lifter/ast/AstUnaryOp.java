/*
 * Copyright (c) 2025, Trail of Bits, Inc.
 *
 * This source code is licensed in accordance with the terms specified in
 * the LICENSE file found in the root directory of this source tree.
 */

package ast;

public class AstUnaryOp extends AstExpr {
    private final String op;
    private final AstExpr exp1;

    public AstUnaryOp(int exprId, String op, AstExpr exp1) {
        super("unary-op", exprId);
        this.op = op;
        this.exp1 = exp1;
    }

    public String getOp() {
        return op;
    }

    public AstExpr getExp1() {
        return exp1;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitUnaryOp(this);
    }
}
