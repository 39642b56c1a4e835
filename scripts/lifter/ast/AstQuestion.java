/*
 * Copyright (c) 2025, Trail of Bits, Inc.
 *
 * This source code is licensed in accordance with the terms specified in
 * the LICENSE file found in the root directory of this source tree.
 */

package ast;

// Conditional expression: exp1 ? exp2 : exp3.
public class AstQuestion extends AstExpr {
    private final AstExpr exp1;
    private final AstExpr exp2;
    private final AstExpr exp3;

    public AstQuestion(int exprId, AstExpr exp1, AstExpr exp2, AstExpr exp3) {
        super("question", exprId);
        this.exp1 = exp1;
        this.exp2 = exp2;
        this.exp3 = exp3;
    }

    public AstExpr getExp1() {
        return exp1;
    }

    public AstExpr getExp2() {
        return exp2;
    }

    public AstExpr getExp3() {
        return exp3;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitQuestion(this);
    }
}
