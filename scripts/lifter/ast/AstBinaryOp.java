/*
 * Copyright (c) 2025, Trail of Bits, Inc.
 *
 * This source code is licensed in accordance with the terms specified in
 * the LICENSE file found in the root directory of this source tree.
 */

package ast;

public class AstBinaryOp extends AstExpr {
    private final String op;
    private final AstExpr exp1;
    private final AstExpr exp2;

    public AstBinaryOp(int exprId, String op, AstExpr exp1, AstExpr exp2) {
        super("binary-op", exprId);
        this.op = op;
        this.exp1 = exp1;
        this.exp2 = exp2;
    }

    public String getOp() {
        return op;
    }

    public AstExpr getExp1() {
        return exp1;
    }

    public AstExpr getExp2() {
        return exp2;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitBinaryOp(this);
    }
}
